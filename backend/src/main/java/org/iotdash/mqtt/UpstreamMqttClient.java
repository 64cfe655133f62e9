package org.iotdash.mqtt;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import org.eclipse.paho.client.mqttv3.DisconnectedBufferOptions;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.iotdash.model.MessageRecord;
import org.iotdash.settings.MqttSettings;
import org.iotdash.util.BoundedMap;
import org.iotdash.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single long-lived connection to the MQTT broker. Keeps the latest message per
 * topic and hands every inbound message to the registered listeners.
 */
public class UpstreamMqttClient {
    private static final Logger logger = LoggerFactory.getLogger(UpstreamMqttClient.class);

    private static final int KEEP_ALIVE_SECONDS = 60;
    private static final long DISCONNECT_TIMEOUT_MS = 2000;
    private static final int OFFLINE_BUFFER_SIZE = 1000;

    private final MqttSettings settings;
    private final String clientId;
    private final Clock clock;
    private final Gson gson = Json.gson();

    private final Map<String, Integer> requestedTopics = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<String> activeSubscriptions = ConcurrentHashMap.newKeySet();
    private final Map<String, MessageRecord> latestByTopic;
    private final List<MessageRecordListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService reconnectScheduler;

    private MqttAsyncClient mqttClient;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean closed = false;

    public UpstreamMqttClient(MqttSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public UpstreamMqttClient(MqttSettings settings, Clock clock) {
        this.settings = settings.copy();
        this.clock = clock;
        this.clientId = resolveClientId(settings.getClientId());
        this.latestByTopic = Collections.synchronizedMap(new BoundedMap<>(Math.max(1, settings.getLatestCacheCapacity())));
        for (String topic : this.settings.getSubscribeTopics()) {
            requestedTopics.put(topic, this.settings.getQos());
        }
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mqtt-reconnect-thread");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void connect() {
        if (mqttClient != null) {
            return;
        }
        closed = false;
        String brokerUri = settings.brokerUri();
        logger.info("Connecting to MQTT broker at: {} as {}", brokerUri, clientId);
        try {
            mqttClient = new MqttAsyncClient(brokerUri, clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new IllegalStateException("Failed to create MQTT client for " + brokerUri, e);
        }
        mqttClient.setCallback(new MqttCallbackExtended() {
            @Override
            public void connectComplete(boolean reconnect, String serverURI) {
                onConnected(reconnect, serverURI);
            }

            @Override
            public void connectionLost(Throwable cause) {
                logger.warn("MQTT connection lost, reconnecting", cause);
                activeSubscriptions.clear();
                state = ConnectionState.RECONNECTING;
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                handleInbound(topic, message.getPayload());
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
                // Not used for our purposes
            }
        });
        DisconnectedBufferOptions bufferOptions = new DisconnectedBufferOptions();
        bufferOptions.setBufferEnabled(true);
        bufferOptions.setBufferSize(OFFLINE_BUFFER_SIZE);
        bufferOptions.setDeleteOldestMessages(true);
        bufferOptions.setPersistBuffer(false);
        mqttClient.setBufferOpts(bufferOptions);

        attemptConnect();
    }

    private synchronized void attemptConnect() {
        if (closed || mqttClient == null || mqttClient.isConnected()) {
            return;
        }
        state = ConnectionState.CONNECTING;
        try {
            mqttClient.connect(buildOptions(), null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    logger.debug("MQTT connect acknowledged");
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    logger.warn("MQTT connect failed, retrying in {} ms: {}",
                            settings.getReconnectPeriodMs(), exception == null ? "unknown" : exception.getMessage());
                    state = ConnectionState.RECONNECTING;
                    scheduleReconnect();
                }
            });
        } catch (MqttException e) {
            logger.warn("MQTT connect could not be started, retrying in {} ms", settings.getReconnectPeriodMs(), e);
            state = ConnectionState.RECONNECTING;
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (closed || reconnectScheduler.isShutdown()) {
            return;
        }
        logger.info("MQTT reconnecting...");
        reconnectScheduler.schedule(this::attemptConnect, settings.getReconnectPeriodMs(), TimeUnit.MILLISECONDS);
    }

    private MqttConnectOptions buildOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setMaxReconnectDelay((int) Math.max(1, settings.getReconnectPeriodMs()));
        options.setConnectionTimeout(settings.getConnectTimeoutSeconds());
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        if (settings.getUsername() != null && !settings.getUsername().isBlank()) {
            options.setUserName(settings.getUsername());
        }
        if (settings.getPassword() != null && !settings.getPassword().isEmpty()) {
            options.setPassword(settings.getPassword().toCharArray());
        }
        return options;
    }

    private void onConnected(boolean reconnect, String serverURI) {
        state = ConnectionState.CONNECTED;
        logger.info("MQTT {} to {}", reconnect ? "reconnected" : "connected", serverURI);

        List<Map.Entry<String, Integer>> topics;
        synchronized (requestedTopics) {
            topics = new ArrayList<>(requestedTopics.entrySet());
        }
        for (Map.Entry<String, Integer> topic : topics) {
            sendSubscribe(topic.getKey(), topic.getValue());
        }
    }

    public void subscribe(String topic) {
        subscribe(topic, settings.getQos());
    }

    /**
     * Subscribes now when connected; otherwise the request is kept and sent on the
     * next successful connect.
     */
    public void subscribe(String topic, int qos) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        requestedTopics.put(topic, qos);
        if (isConnected()) {
            sendSubscribe(topic, qos);
        } else {
            logger.debug("Not connected, deferring subscription to {}", topic);
        }
    }

    public void unsubscribe(String topic) {
        requestedTopics.remove(topic);
        if (!isConnected()) {
            return;
        }
        try {
            mqttClient.unsubscribe(topic, null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    activeSubscriptions.remove(topic);
                    logger.info("Unsubscribed from {}", topic);
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    logger.error("Failed to unsubscribe from {}", topic, exception);
                }
            });
        } catch (MqttException e) {
            logger.error("Failed to unsubscribe from {}", topic, e);
        }
    }

    private void sendSubscribe(String topic, int qos) {
        MqttAsyncClient client = mqttClient;
        if (client == null) {
            return;
        }
        try {
            client.subscribe(topic, qos, null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    int[] granted = asyncActionToken.getGrantedQos();
                    if (granted != null && granted.length > 0 && granted[0] == 0x80) {
                        logger.error("Broker rejected subscription to {}", topic);
                        return;
                    }
                    activeSubscriptions.add(topic);
                    logger.info("Subscribed to {}{}", topic,
                            granted != null && granted.length > 0 ? " (qos=" + granted[0] + ")" : "");
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    logger.error("Failed to subscribe to {}", topic, exception);
                }
            });
        } catch (MqttException e) {
            logger.error("Failed to subscribe to {}", topic, e);
        }
    }

    public void publish(String topic, Object message) {
        publish(topic, message, settings.getQos(), false);
    }

    /**
     * Fire and forget: strings are sent as they are, anything else as JSON. Failures
     * are only logged.
     */
    public void publish(String topic, Object message, int qos, boolean retained) {
        MqttAsyncClient client = mqttClient;
        if (client == null) {
            logger.error("MQTT publish to {} dropped: client not started", topic);
            return;
        }
        String payload = toPayload(message);
        MqttMessage mqttMessage = new MqttMessage(payload.getBytes(StandardCharsets.UTF_8));
        mqttMessage.setQos(qos);
        mqttMessage.setRetained(retained);

        logger.debug("Publishing to {}: {}", topic, payload);
        try {
            client.publish(topic, mqttMessage, null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    logger.debug("Published to {}", topic);
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    logger.error("MQTT publish error on {}", topic, exception);
                }
            });
        } catch (MqttException | IllegalArgumentException e) {
            logger.error("MQTT publish error on {}", topic, e);
        }
    }

    String toPayload(Object message) {
        if (message == null) {
            return "";
        }
        if (message instanceof String text) {
            return text;
        }
        if (message instanceof JsonElement element && element.isJsonPrimitive()
                && element.getAsJsonPrimitive().isString()) {
            return element.getAsString();
        }
        return gson.toJson(message);
    }

    void handleInbound(String topic, byte[] payload) {
        String raw = new String(payload, StandardCharsets.UTF_8);
        MessageRecord record = new MessageRecord(topic, Json.parseOrRaw(raw), raw, clock.instant());
        logger.debug("Message received on topic {}: {}", topic, raw);

        synchronized (latestByTopic) {
            latestByTopic.remove(topic);
            latestByTopic.put(topic, record);
        }

        for (MessageRecordListener listener : listeners) {
            try {
                listener.onMessage(record);
            } catch (RuntimeException e) {
                logger.warn("Message listener failed for topic {}", topic, e);
            }
        }
    }

    public void addListener(MessageRecordListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MessageRecordListener listener) {
        listeners.remove(listener);
    }

    public Optional<MessageRecord> getLatest(String topic) {
        return Optional.ofNullable(latestByTopic.get(topic));
    }

    public List<String> getTopics() {
        synchronized (latestByTopic) {
            return new ArrayList<>(latestByTopic.keySet());
        }
    }

    public List<String> getRequestedTopics() {
        synchronized (requestedTopics) {
            return new ArrayList<>(requestedTopics.keySet());
        }
    }

    public boolean isConnected() {
        MqttAsyncClient client = mqttClient;
        return state == ConnectionState.CONNECTED && client != null && client.isConnected();
    }

    public ConnectionState getState() {
        return state;
    }

    public String getClientId() {
        return clientId;
    }

    public MqttHealth getHealth() {
        List<String> subscriptions = new ArrayList<>(activeSubscriptions);
        Collections.sort(subscriptions);
        return new MqttHealth(isConnected(), clientId, state, subscriptions, latestByTopic.size());
    }

    public synchronized void shutdown() {
        closed = true;
        reconnectScheduler.shutdownNow();
        if (mqttClient != null) {
            logger.info("Disconnecting from MQTT broker");
            try {
                if (mqttClient.isConnected()) {
                    mqttClient.disconnect().waitForCompletion(DISCONNECT_TIMEOUT_MS);
                }
            } catch (MqttException e) {
                logger.warn("Error disconnecting from MQTT broker", e);
            }
            try {
                mqttClient.close(true);
            } catch (MqttException e) {
                logger.warn("Error closing MQTT client", e);
            }
            mqttClient = null;
        }
        activeSubscriptions.clear();
        state = ConnectionState.DISCONNECTED;
        logger.info("MQTT client shut down");
    }

    private static String resolveClientId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        byte[] bytes = new byte[4];
        new SecureRandom().nextBytes(bytes);
        return "iot-backend-" + HexFormat.of().formatHex(bytes);
    }
}
