package org.iotdash.http;

import com.google.gson.JsonObject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.iotdash.store.InMemoryStore;
import org.iotdash.ws.FanOutHub;

import java.io.IOException;
import java.lang.management.ManagementFactory;

/**
 * Health endpoints under {@code /api/health}.
 */
public class HealthServlet extends ApiServlet {
    public static final String VERSION = "1.0.0";

    private final transient InMemoryStore store;
    private final transient UpstreamMqttClient mqttClient;
    private final transient FanOutHub fanOutHub;

    public HealthServlet(InMemoryStore store, UpstreamMqttClient mqttClient, FanOutHub fanOutHub) {
        this.store = store;
        this.mqttClient = mqttClient;
        this.fanOutHub = fanOutHub;
    }

    @Override
    protected boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException {
        if (!method.equals("GET")) {
            return false;
        }
        if (path.equals("/")) {
            JsonObject body = success();
            body.addProperty("message", "IoT Dashboard Backend is healthy");
            body.addProperty("timestamp", timestamp());
            body.addProperty("uptime", uptimeSeconds());
            body.addProperty("version", VERSION);
            ok(resp, body);
            return true;
        }
        if (path.equals("/detailed")) {
            detailed(resp);
            return true;
        }
        return false;
    }

    private void detailed(HttpServletResponse resp) throws IOException {
        InMemoryStore.ConnectionStatus storeStatus = store.connectionStatus();

        JsonObject database = new JsonObject();
        database.addProperty("status", storeStatus.connected() ? "healthy" : "unhealthy");
        database.addProperty("type", storeStatus.type());
        database.addProperty("connected", storeStatus.connected());
        database.add("collections", gson.toJsonTree(store.stats()));

        JsonObject websocket = new JsonObject();
        websocket.addProperty("status", "healthy");
        websocket.addProperty("connections", fanOutHub.connectionCount());

        Runtime runtime = Runtime.getRuntime();
        JsonObject server = new JsonObject();
        server.addProperty("status", "healthy");
        server.addProperty("uptime", uptimeSeconds());
        server.addProperty("heapUsed", runtime.totalMemory() - runtime.freeMemory());
        server.addProperty("heapMax", runtime.maxMemory());

        JsonObject services = new JsonObject();
        services.add("database", database);
        services.add("mqtt", gson.toJsonTree(mqttClient.getHealth()));
        services.add("websocket", websocket);
        services.add("server", server);

        JsonObject environment = new JsonObject();
        environment.addProperty("javaVersion", System.getProperty("java.version"));
        environment.addProperty("platform", System.getProperty("os.name"));
        environment.addProperty("arch", System.getProperty("os.arch"));

        boolean healthy = storeStatus.connected();
        JsonObject body = new JsonObject();
        body.addProperty("success", healthy);
        body.addProperty("message", "Detailed health check completed");
        body.addProperty("timestamp", timestamp());
        body.add("services", services);
        body.add("environment", environment);
        write(resp, healthy ? HttpServletResponse.SC_OK : HttpServletResponse.SC_SERVICE_UNAVAILABLE, body);
    }

    private static double uptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }
}
