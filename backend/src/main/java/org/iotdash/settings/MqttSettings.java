package org.iotdash.settings;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Connection settings of the upstream MQTT client.
 */
@Data
public class MqttSettings {
    private String host = "localhost";
    private int port = 1883;
    private String protocol = "mqtt";
    private String username = "";
    private String password = "";
    private String clientId = "";
    private List<String> subscribeTopics = new ArrayList<>(List.of("#"));
    private int qos = 0;
    private long reconnectPeriodMs = 5000;
    private int connectTimeoutSeconds = 30;
    private int latestCacheCapacity = 10_000;

    /**
     * Builds the broker URI understood by the Paho client. The Node-style
     * {@code mqtt}/{@code mqtts} schemes map to {@code tcp}/{@code ssl}.
     */
    public String brokerUri() {
        String scheme = protocol == null ? "tcp" : protocol.trim().toLowerCase(Locale.ROOT);
        scheme = switch (scheme) {
            case "", "mqtt", "tcp" -> "tcp";
            case "mqtts", "ssl", "tls" -> "ssl";
            case "ws", "wss" -> scheme;
            default -> throw new IllegalArgumentException("Unsupported MQTT protocol: " + protocol);
        };
        return scheme + "://" + host + ":" + port;
    }

    public MqttSettings copy() {
        MqttSettings copy = new MqttSettings();
        copy.setHost(host);
        copy.setPort(port);
        copy.setProtocol(protocol);
        copy.setUsername(username);
        copy.setPassword(password);
        copy.setClientId(clientId);
        copy.setSubscribeTopics(subscribeTopics == null ? new ArrayList<>() : new ArrayList<>(subscribeTopics));
        copy.setQos(qos);
        copy.setReconnectPeriodMs(reconnectPeriodMs);
        copy.setConnectTimeoutSeconds(connectTimeoutSeconds);
        copy.setLatestCacheCapacity(latestCacheCapacity);
        return copy;
    }
}
