package org.iotdash;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.iotdash.auth.LoggingResetLinkSender;
import org.iotdash.auth.PasswordResetService;
import org.iotdash.dashboard.DashboardService;
import org.iotdash.http.BackendServer;
import org.iotdash.id.TopicIdGenerator;
import org.iotdash.mqtt.EmbeddedBrokerService;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.iotdash.settings.BrokerSettings;
import org.iotdash.settings.MqttSettings;
import org.iotdash.settings.ServerSettings;
import org.iotdash.store.InMemoryStore;
import org.iotdash.support.Await;
import org.iotdash.ws.FanOutHub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EndToEndTest {

    private EmbeddedBrokerService broker;
    private UpstreamMqttClient mqttClient;
    private FanOutHub hub;
    private BackendServer server;

    @BeforeEach
    void startStack() {
        int brokerPort = Await.freePort();
        BrokerSettings brokerSettings = new BrokerSettings();
        brokerSettings.setHost("127.0.0.1");
        brokerSettings.setPort(brokerPort);
        broker = new EmbeddedBrokerService();
        broker.start(brokerSettings);

        MqttSettings mqttSettings = new MqttSettings();
        mqttSettings.setHost("127.0.0.1");
        mqttSettings.setPort(brokerPort);
        mqttSettings.setSubscribeTopics(List.of("#"));
        mqttClient = new UpstreamMqttClient(mqttSettings);
        hub = new FanOutHub();
        mqttClient.addListener(hub);

        ServerSettings serverSettings = new ServerSettings();
        serverSettings.setHost("127.0.0.1");
        serverSettings.setPort(0);
        InMemoryStore store = new InMemoryStore();
        Clock clock = Clock.systemUTC();
        server = new BackendServer(serverSettings, store,
                new DashboardService(store, new TopicIdGenerator(), clock, serverSettings.getFrontendUrl()),
                new PasswordResetService(store, new LoggingResetLinkSender(), clock, serverSettings.getFrontendUrl()),
                mqttClient, hub);
        server.start();
        mqttClient.connect();
        Await.until(() -> mqttClient.getHealth().subscriptions().contains("#"), Duration.ofSeconds(10),
                "upstream subscription");
    }

    @AfterEach
    void stopStack() {
        server.stop();
        mqttClient.shutdown();
        broker.shutdown();
    }

    @Test
    void brokerMessageReachesSubscribedWebSocketClientAndLatestEndpoint() throws Exception {
        HttpClient http = HttpClient.newHttpClient();
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket socket = http.newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + server.getPort() + "/ws?topics=home/temp"),
                        new WebSocket.Listener() {
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
                        })
                .get(10, TimeUnit.SECONDS);
        Await.until(() -> hub.connectionCount() == 1, Duration.ofSeconds(5), "websocket registration");

        HttpRequest publish = HttpRequest.newBuilder(
                        URI.create("http://127.0.0.1:" + server.getPort() + "/api/mqtt/publish"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"topic\":\"home/temp\",\"message\":{\"v\":21.5}}"))
                .build();
        assertEquals(200, http.send(publish, HttpResponse.BodyHandlers.ofString()).statusCode());

        String frame = frames.poll(10, TimeUnit.SECONDS);
        assertNotNull(frame, "no frame delivered");
        JsonObject envelope = JsonParser.parseString(frame).getAsJsonObject();
        assertEquals("home/temp", envelope.get("topic").getAsString());
        assertEquals(21.5, envelope.getAsJsonObject("data").get("v").getAsDouble());
        assertEquals("{\"v\":21.5}", envelope.get("raw").getAsString());

        HttpRequest latest = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + server.getPort() + "/api/mqtt/latest?topic=home%2Ftemp")).build();
        HttpResponse<String> latestResponse = http.send(latest, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, latestResponse.statusCode());
        JsonObject data = JsonParser.parseString(latestResponse.body()).getAsJsonObject().getAsJsonObject("data");
        assertEquals("home/temp", data.get("topic").getAsString());

        socket.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
    }
}
