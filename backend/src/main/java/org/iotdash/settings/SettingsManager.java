package org.iotdash.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.iotdash.util.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);
    private static final String SETTINGS_FILE = "settings.json";

    private final Gson gson;
    private final Path settingsPath;
    private final Map<String, String> environment;
    private AppSettings settings;

    public SettingsManager(Path settingsPath, Map<String, String> environment) {
        logger.info("Initializing SettingsManager");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.settingsPath = settingsPath;
        this.environment = environment == null ? Map.of() : environment;
        logger.debug("Settings path: {}", settingsPath);
        load();
    }

    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), ".iotdash", SETTINGS_FILE);
    }

    public AppSettings getSettings() {
        return settings;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public void load() {
        logger.debug("Loading settings from {}", settingsPath);
        try {
            if (Files.exists(settingsPath)) {
                String json = Files.readString(settingsPath);
                settings = gson.fromJson(json, AppSettings.class);
                if (settings == null) {
                    logger.warn("Settings file exists but is empty, using defaults");
                    settings = new AppSettings();
                }
                logger.info("Settings loaded successfully");
            } else {
                logger.info("Settings file not found, creating with defaults");
                settings = new AppSettings();
                save();
            }
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load settings", e);
            settings = new AppSettings();
        }
        ensureNonNullSections();
        applyEnvironment();
    }

    public void save() {
        logger.debug("Saving settings to {}", settingsPath);
        try {
            Files.createDirectories(settingsPath.getParent());
            String json = gson.toJson(settings);
            Files.writeString(settingsPath, json);
            logger.info("Settings saved successfully");
        } catch (IOException e) {
            logger.error("Failed to save settings", e);
        }
    }

    private void ensureNonNullSections() {
        if (settings.getServer() == null) {
            settings.setServer(new ServerSettings());
        }
        if (settings.getMqtt() == null) {
            settings.setMqtt(new MqttSettings());
        }
        if (settings.getBroker() == null) {
            settings.setBroker(new BrokerSettings());
        }
        if (settings.getMqtt().getSubscribeTopics() == null) {
            settings.getMqtt().setSubscribeTopics(List.of("#"));
        }
    }

    // Environment variables win over the file and are read once.
    private void applyEnvironment() {
        ServerSettings server = settings.getServer();
        MqttSettings mqtt = settings.getMqtt();
        BrokerSettings broker = settings.getBroker();

        intEnv("PORT", server::setPort);
        stringEnv("FRONTEND_URL", server::setFrontendUrl);

        stringEnv("MQTT_HOST", mqtt::setHost);
        intEnv("MQTT_PORT", mqtt::setPort);
        stringEnv("MQTT_PROTOCOL", mqtt::setProtocol);
        stringEnv("MQTT_USERNAME", mqtt::setUsername);
        stringEnv("MQTT_PASSWORD", mqtt::setPassword);
        stringEnv("MQTT_CLIENT_ID", mqtt::setClientId);
        stringEnv("MQTT_SUBSCRIBE_TOPICS", value -> mqtt.setSubscribeTopics(Topics.split(value)));
        intEnv("MQTT_QOS", mqtt::setQos);
        if (mqtt.getQos() < 0 || mqtt.getQos() > 2) {
            logger.warn("Ignoring MQTT qos {}: must be 0, 1 or 2, using 0", mqtt.getQos());
            mqtt.setQos(0);
        }
        intEnv("MQTT_RECONNECT_PERIOD_MS", value -> mqtt.setReconnectPeriodMs(value));

        stringEnv("EMBEDDED_BROKER_ENABLED",
                value -> broker.setBrokerEnabled(Boolean.parseBoolean(value.toLowerCase(Locale.ROOT))));
        intEnv("EMBEDDED_BROKER_PORT", broker::setPort);
    }

    private void stringEnv(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            logger.debug("Applying {} from environment", name);
            setter.accept(value.trim());
        }
    }

    private void intEnv(String name, IntConsumer setter) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}: '{}' is not a number", name, value);
        }
    }
}
