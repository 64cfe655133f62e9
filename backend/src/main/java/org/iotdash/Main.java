package org.iotdash;

import org.iotdash.auth.LoggingResetLinkSender;
import org.iotdash.auth.PasswordResetService;
import org.iotdash.dashboard.DashboardService;
import org.iotdash.http.BackendServer;
import org.iotdash.id.TopicIdGenerator;
import org.iotdash.mqtt.EmbeddedBrokerService;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.iotdash.settings.AppSettings;
import org.iotdash.settings.SettingsManager;
import org.iotdash.store.InMemoryStore;
import org.iotdash.ws.FanOutHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("IoT Dashboard Backend starting...");
        Path settingsPath = args.length > 0 ? Path.of(args[0]) : SettingsManager.defaultPath();
        SettingsManager settingsManager = new SettingsManager(settingsPath, System.getenv());
        AppSettings settings = settingsManager.getSettings();

        EmbeddedBrokerService broker = new EmbeddedBrokerService();
        UpstreamMqttClient mqttClient = null;
        BackendServer server = null;
        try {
            if (settings.getBroker().isBrokerEnabled()) {
                broker.start(settings.getBroker());
            }

            Clock clock = Clock.systemUTC();
            String frontendUrl = settings.getServer().getFrontendUrl();
            InMemoryStore store = new InMemoryStore();
            DashboardService dashboardService = new DashboardService(store, new TopicIdGenerator(), clock, frontendUrl);
            PasswordResetService resetService = new PasswordResetService(store, new LoggingResetLinkSender(), clock,
                    frontendUrl);

            mqttClient = new UpstreamMqttClient(settings.getMqtt(), clock);
            FanOutHub hub = new FanOutHub();
            mqttClient.addListener(hub);

            server = new BackendServer(settings.getServer(), store, dashboardService, resetService, mqttClient, hub);
            server.start();
            mqttClient.connect();
        } catch (RuntimeException e) {
            logger.error("Fatal error during startup", e);
            stopAll(server, mqttClient, broker);
            System.exit(1);
            return;
        }

        BackendServer runningServer = server;
        UpstreamMqttClient runningClient = mqttClient;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down gracefully");
            stopAll(runningServer, runningClient, broker);
        }, "shutdown-hook"));
        logger.info("IoT Dashboard Backend started");
    }

    private static void stopAll(BackendServer server, UpstreamMqttClient mqttClient, EmbeddedBrokerService broker) {
        if (server != null) {
            server.stop();
        }
        if (mqttClient != null) {
            mqttClient.shutdown();
        }
        broker.shutdown();
    }
}
