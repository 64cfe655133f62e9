package org.iotdash.mqtt;

import java.util.List;

public record MqttHealth(boolean connected,
                         String clientId,
                         ConnectionState state,
                         List<String> subscriptions,
                         int knownTopics) { }
