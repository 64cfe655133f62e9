package org.iotdash.http;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.iotdash.auth.PasswordResetService;
import org.iotdash.dashboard.DashboardService;
import org.iotdash.id.TopicIdGenerator;
import org.iotdash.model.MessageRecord;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.iotdash.settings.MqttSettings;
import org.iotdash.settings.ServerSettings;
import org.iotdash.store.InMemoryStore;
import org.iotdash.support.Await;
import org.iotdash.ws.FanOutHub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BackendServerTest {

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private final List<String> resetLinks = new CopyOnWriteArrayList<>();

    private UpstreamMqttClient mqttClient;
    private FanOutHub hub;
    private BackendServer server;
    private String base;

    @BeforeEach
    void startServer() {
        ServerSettings settings = new ServerSettings();
        settings.setHost("127.0.0.1");
        settings.setPort(0);

        InMemoryStore store = new InMemoryStore();
        Clock clock = Clock.systemUTC();
        DashboardService dashboards = new DashboardService(store, new TopicIdGenerator(), clock,
                "http://frontend.test");
        PasswordResetService resets = new PasswordResetService(store, (email, link) -> resetLinks.add(link), clock,
                "http://frontend.test");
        mqttClient = new UpstreamMqttClient(new MqttSettings());
        hub = new FanOutHub();
        mqttClient.addListener(hub);

        server = new BackendServer(settings, store, dashboards, resets, mqttClient, hub);
        server.start();
        base = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        mqttClient.shutdown();
    }

    private HttpResponse<String> send(String method, String path, String body, String user)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(base + path))
                .timeout(Duration.ofSeconds(10))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (user != null) {
            builder.header(ApiServlet.CALLER_HEADER, user);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonObject json(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }

    private static String dashboardBody(String id, String name) {
        return "{" + (id == null ? "" : "\"id\":\"" + id + "\",")
                + "\"name\":\"" + name + "\","
                + "\"widgets\":[{\"id\":\"w1\",\"type\":\"gauge\",\"topic\":\"home/temp\",\"x\":0,\"y\":0,\"w\":2,\"h\":2,"
                + "\"mqttTopic\":\"home/temp\",\"minW\":1,\"color\":\"red\"}],"
                + "\"layouts\":{\"lg\":[]}}";
    }

    @Test
    void rootDescribesServiceAndUnknownPathsAre404() throws Exception {
        HttpResponse<String> root = send("GET", "/", null, null);
        assertEquals(200, root.statusCode());
        assertTrue(root.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));

        assertTrue(json(root).get("timestamp").getAsString()
                .matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{3}Z"));

        HttpResponse<String> docs = send("GET", "/api/docs", null, null);
        assertEquals(200, docs.statusCode());
        JsonObject endpoints = json(docs).getAsJsonObject("endpoints");
        assertTrue(endpoints.getAsJsonObject("auth").has("POST /api/auth/request-reset"));
        assertTrue(endpoints.getAsJsonObject("health").has("GET /api/health/detailed"));
        assertTrue(json(docs).getAsJsonObject("examples").has("resetPassword"));
        assertEquals(404, send("POST", "/api/docs", "{}", null).statusCode());

        assertEquals(404, send("GET", "/nope", null, null).statusCode());
        assertEquals(404, send("GET", "/api/dashboard/a/b/c", null, null).statusCode());
    }

    @Test
    void healthEndpoints() throws Exception {
        HttpResponse<String> basic = send("GET", "/api/health", null, null);
        assertEquals(200, basic.statusCode());
        assertTrue(json(basic).get("success").getAsBoolean());

        HttpResponse<String> detailed = send("GET", "/api/health/detailed", null, null);
        assertEquals(200, detailed.statusCode());
        JsonObject services = json(detailed).getAsJsonObject("services");
        assertEquals("in-memory", services.getAsJsonObject("database").get("type").getAsString());
        assertFalse(services.getAsJsonObject("mqtt").get("connected").getAsBoolean());
        assertEquals(0, services.getAsJsonObject("websocket").get("connections").getAsInt());
    }

    @Test
    void dashboardLifecycle() throws Exception {
        HttpResponse<String> saved = send("POST", "/api/dashboard/save", dashboardBody(null, "Home"), "alice");
        assertEquals(200, saved.statusCode(), saved.body());
        String id = json(saved).getAsJsonObject("dashboard").get("id").getAsString();
        assertTrue(TopicIdGenerator.validate(id));
        assertEquals(1, json(saved).getAsJsonObject("dashboard").get("widgetCount").getAsInt());

        HttpResponse<String> fetched = send("GET", "/api/dashboard/" + id, null, "alice");
        assertEquals(200, fetched.statusCode());
        JsonObject dashboard = json(fetched).getAsJsonObject("dashboard");
        assertEquals("Home", dashboard.get("name").getAsString());
        assertEquals(0, dashboard.getAsJsonArray("widgets").get(0).getAsJsonObject().get("x").getAsInt());
        assertFalse(dashboard.has("userId"));

        assertEquals(403, send("GET", "/api/dashboard/" + id, null, "bob").statusCode());

        HttpResponse<String> updated = send("PUT", "/api/dashboard/update/" + id, dashboardBody(null, "Renamed"),
                "alice");
        assertEquals(200, updated.statusCode());
        assertEquals("Renamed", json(updated).getAsJsonObject("dashboard").get("name").getAsString());

        HttpResponse<String> list = send("GET", "/api/dashboard/user/alice", null, "alice");
        assertEquals(1, json(list).getAsJsonArray("dashboards").size());
        assertEquals(403, send("GET", "/api/dashboard/user/alice", null, "bob").statusCode());

        assertEquals(200, send("DELETE", "/api/dashboard/" + id, null, "alice").statusCode());
        assertEquals(404, send("GET", "/api/dashboard/" + id, null, "alice").statusCode());
    }

    @Test
    void publishedDashboardIsReadableWithPassword() throws Exception {
        String id = json(send("POST", "/api/dashboard/save", dashboardBody(null, "Home"), null))
                .getAsJsonObject("dashboard").get("id").getAsString();

        HttpResponse<String> published = send("POST", "/api/dashboard/publish", dashboardBody(id, "Home"), null);
        assertEquals(200, published.statusCode(), published.body());
        JsonObject info = json(published).getAsJsonObject("dashboard");
        String shareableId = info.get("shareableId").getAsString();
        String password = info.get("sharePassword").getAsString();
        assertEquals("http://frontend.test/shared/" + shareableId, info.get("shareableLink").getAsString());

        HttpResponse<String> shared = send("GET", "/api/dashboard/shared/" + shareableId + "?password=" + password,
                null, null);
        assertEquals(200, shared.statusCode());
        JsonObject snapshot = json(shared).getAsJsonObject("dashboard");
        assertEquals(shareableId, snapshot.get("panelId").getAsString());
        assertEquals(id, snapshot.get("originalDashboardId").getAsString());
        JsonObject widget = snapshot.getAsJsonArray("widgets").get(0).getAsJsonObject();
        assertEquals("home/temp", widget.get("mqttTopic").getAsString());
        assertEquals(1, widget.get("minW").getAsInt());
        assertEquals("red", widget.get("color").getAsString());

        assertEquals(401, send("GET", "/api/dashboard/shared/" + shareableId + "?password=WRONG1", null, null)
                .statusCode());
        assertEquals(404, send("GET", "/api/dashboard/shared/shared-0-missing", null, null).statusCode());
    }

    @Test
    void invalidDashboardRequestsAre400() throws Exception {
        assertEquals(400, send("POST", "/api/dashboard/save", "{\"widgets\":[]}", null).statusCode());
        assertEquals(400, send("POST", "/api/dashboard/save", "{not json", null).statusCode());
        assertEquals(400, send("POST", "/api/dashboard/publish", dashboardBody(null, "Home"), null).statusCode());
        HttpResponse<String> nullWidget = send("POST", "/api/dashboard/save",
                "{\"name\":\"Home\",\"widgets\":[null]}", null);
        assertEquals(400, nullWidget.statusCode());
        assertFalse(json(nullWidget).get("success").getAsBoolean());
    }

    @Test
    void topicIdEndpoint() throws Exception {
        HttpResponse<String> response = send("GET", "/api/dashboard/generate-topic-id", null, null);
        assertEquals(200, response.statusCode());
        assertTrue(TopicIdGenerator.validate(json(response).get("topicId").getAsString()));
        assertEquals(1, json(response).getAsJsonObject("stats").get("totalGenerated").getAsInt());
    }

    @Test
    void mqttEndpointsExposeLatestMessages() throws Exception {
        assertEquals(400, send("GET", "/api/mqtt/latest", null, null).statusCode());
        assertEquals(404, send("GET", "/api/mqtt/latest?topic=home%2Ftemp", null, null).statusCode());

        assertEquals(200, send("GET", "/api/mqtt/topics", null, null).statusCode());
        assertEquals(400, send("POST", "/api/mqtt/publish", "{\"message\":\"on\"}", null).statusCode());
        assertEquals(400, send("POST", "/api/mqtt/publish",
                "{\"topic\":\"a\",\"message\":\"on\",\"options\":{\"qos\":3}}", null).statusCode());
        assertEquals(400, send("POST", "/api/mqtt/publish",
                "{\"topic\":\"a\",\"message\":\"on\",\"options\":{\"qos\":{}}}", null).statusCode());
        assertEquals(400, send("POST", "/api/mqtt/publish",
                "{\"topic\":\"a\",\"message\":\"on\",\"options\":{\"retain\":[true]}}", null).statusCode());
        assertEquals(200, send("POST", "/api/mqtt/publish",
                "{\"topic\":\"a\",\"message\":\"on\",\"options\":{\"qos\":1,\"retain\":true}}", null)
                .statusCode());
        assertEquals(200, send("POST", "/api/mqtt/publish", "{\"topic\":\"a\",\"message\":{\"on\":true}}", null)
                .statusCode());
    }

    @Test
    void passwordResetFlow() throws Exception {
        assertEquals(400, send("POST", "/api/auth/request-reset", "{\"email\":\"nope\"}", null).statusCode());

        HttpResponse<String> requested = send("POST", "/api/auth/request-reset", "{\"email\":\"Alice@Example.com\"}",
                null);
        assertEquals(200, requested.statusCode());
        assertEquals("alice@example.com", json(requested).get("email").getAsString());
        String link = resetLinks.get(0);
        String token = link.substring(link.indexOf("token=") + 6, link.indexOf("&email="));

        String email = URLEncoder.encode("alice@example.com", StandardCharsets.UTF_8);
        assertEquals(200, send("GET", "/api/auth/validate-reset-token?token=" + token + "&email=" + email, null,
                null).statusCode());

        String resetBody = "{\"token\":\"" + token + "\",\"email\":\"alice@example.com\",\"newPassword\":\"%s\"}";
        assertEquals(400, send("POST", "/api/auth/reset-password", String.format(resetBody, "short"), null)
                .statusCode());
        assertEquals(200, send("POST", "/api/auth/reset-password", String.format(resetBody, "longenough"), null)
                .statusCode());

        HttpResponse<String> reused = send("POST", "/api/auth/reset-password", String.format(resetBody, "another1"),
                null);
        assertEquals(400, reused.statusCode());
        assertFalse(json(reused).get("success").getAsBoolean());
    }

    @Test
    void webSocketClientsReceiveSubscribedTopicsOnly() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket.Listener listener = new WebSocket.Listener() {
            private final StringBuilder partial = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                partial.append(data);
                if (last) {
                    frames.add(partial.toString());
                    partial.setLength(0);
                }
                webSocket.request(1);
                return null;
            }
        };
        WebSocket socket = http.newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + server.getPort() + "/ws?topics=a/b"), listener)
                .get(10, TimeUnit.SECONDS);
        Await.until(() -> hub.connectionCount() == 1, Duration.ofSeconds(5), "websocket registration");

        hub.onMessage(new MessageRecord("c/d", new JsonPrimitive("skip"), "skip", Instant.now()));
        hub.onMessage(new MessageRecord("a/b", JsonParser.parseString("{\"v\":1}"), "{\"v\":1}", Instant.now()));

        String frame = frames.poll(10, TimeUnit.SECONDS);
        assertNotNull(frame);
        JsonObject envelope = JsonParser.parseString(frame).getAsJsonObject();
        assertEquals("mqtt", envelope.get("type").getAsString());
        assertEquals("a/b", envelope.get("topic").getAsString());
        assertEquals(1, envelope.getAsJsonObject("data").get("v").getAsInt());

        socket.sendText("{\"action\":\"subscribe\",\"topic\":\"c/d\"}", true).get(5, TimeUnit.SECONDS);
        socket.sendText("garbage", true).get(5, TimeUnit.SECONDS);
        Thread.sleep(500);
        hub.onMessage(new MessageRecord("c/d", new JsonPrimitive("now"), "now", Instant.now()));
        String second = frames.poll(10, TimeUnit.SECONDS);
        assertNotNull(second);
        assertEquals("c/d", JsonParser.parseString(second).getAsJsonObject().get("topic").getAsString());

        socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        Await.until(() -> hub.connectionCount() == 0, Duration.ofSeconds(5), "websocket close");
    }
}
