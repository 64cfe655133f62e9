package org.iotdash.http;

import com.google.gson.JsonObject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * Service info at {@code /} and the endpoint listing at {@code /api/docs};
 * everything not claimed by another servlet is a 404.
 */
public class RootServlet extends ApiServlet {
    public static final String DOCS_PATH = "/api/docs";

    @Override
    protected boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException {
        if (!method.equals("GET")) {
            return false;
        }
        String uri = req.getRequestURI();
        if (uri.equals("/") || uri.isEmpty()) {
            info(resp);
            return true;
        }
        if (uri.equals(DOCS_PATH)) {
            docs(resp);
            return true;
        }
        return false;
    }

    private void info(HttpServletResponse resp) throws IOException {
        JsonObject endpoints = new JsonObject();
        endpoints.addProperty("auth", "/api/auth");
        endpoints.addProperty("health", "/api/health");
        endpoints.addProperty("dashboard", "/api/dashboard");
        endpoints.addProperty("mqtt", "/api/mqtt");
        endpoints.addProperty("websocket", "/ws");
        endpoints.addProperty("documentation", DOCS_PATH);

        JsonObject body = success();
        body.addProperty("message", "IoT Dashboard Backend API");
        body.addProperty("version", HealthServlet.VERSION);
        body.addProperty("timestamp", timestamp());
        body.add("endpoints", endpoints);
        ok(resp, body);
    }

    private void docs(HttpServletResponse resp) throws IOException {
        JsonObject auth = new JsonObject();
        auth.addProperty("POST /api/auth/request-reset", "Request password reset");
        auth.addProperty("POST /api/auth/reset-password", "Reset password with token");
        auth.addProperty("GET /api/auth/validate-reset-token", "Validate reset token");
        auth.addProperty("GET /api/auth/health", "Auth service health check");

        JsonObject health = new JsonObject();
        health.addProperty("GET /api/health", "General health check");
        health.addProperty("GET /api/health/detailed", "Detailed system health");

        JsonObject dashboard = new JsonObject();
        dashboard.addProperty("POST /api/dashboard/save", "Save a new dashboard");
        dashboard.addProperty("PUT /api/dashboard/update/{id}", "Update an existing dashboard");
        dashboard.addProperty("POST /api/dashboard/publish", "Publish a dashboard for sharing");
        dashboard.addProperty("GET /api/dashboard/shared/{shareableId}", "Read a shared dashboard");
        dashboard.addProperty("GET /api/dashboard/user/{userId}", "List dashboards of a user");
        dashboard.addProperty("GET /api/dashboard/generate-topic-id", "Generate a topic id");
        dashboard.addProperty("GET /api/dashboard/health", "Dashboard service health check");
        dashboard.addProperty("GET /api/dashboard/{id}", "Read a dashboard");
        dashboard.addProperty("DELETE /api/dashboard/{id}", "Delete a dashboard");

        JsonObject mqtt = new JsonObject();
        mqtt.addProperty("GET /api/mqtt/health", "MQTT connection status");
        mqtt.addProperty("GET /api/mqtt/topics", "Topics with a cached message");
        mqtt.addProperty("GET /api/mqtt/latest?topic=", "Latest message on a topic");
        mqtt.addProperty("POST /api/mqtt/publish", "Publish a message");

        JsonObject endpoints = new JsonObject();
        endpoints.add("auth", auth);
        endpoints.add("health", health);
        endpoints.add("dashboard", dashboard);
        endpoints.add("mqtt", mqtt);

        JsonObject requestResetBody = new JsonObject();
        requestResetBody.addProperty("email", "user@example.com");
        JsonObject requestReset = example("POST", "/api/auth/request-reset", requestResetBody);

        JsonObject resetPasswordBody = new JsonObject();
        resetPasswordBody.addProperty("token", "reset_token_here");
        resetPasswordBody.addProperty("email", "user@example.com");
        resetPasswordBody.addProperty("newPassword", "new_password_here");
        JsonObject resetPassword = example("POST", "/api/auth/reset-password", resetPasswordBody);

        JsonObject publishBody = new JsonObject();
        publishBody.addProperty("topic", "home/livingroom/temp");
        publishBody.addProperty("message", "21.5");
        JsonObject mqttPublish = example("POST", "/api/mqtt/publish", publishBody);

        JsonObject examples = new JsonObject();
        examples.add("requestReset", requestReset);
        examples.add("resetPassword", resetPassword);
        examples.add("mqttPublish", mqttPublish);

        JsonObject body = success();
        body.addProperty("message", "API Documentation");
        body.addProperty("version", HealthServlet.VERSION);
        body.add("endpoints", endpoints);
        body.add("examples", examples);
        ok(resp, body);
    }

    private static JsonObject example(String method, String url, JsonObject body) {
        JsonObject example = new JsonObject();
        example.addProperty("method", method);
        example.addProperty("url", url);
        example.add("body", body);
        return example;
    }
}
