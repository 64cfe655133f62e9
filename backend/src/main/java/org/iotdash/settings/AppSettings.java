package org.iotdash.settings;

import lombok.Data;

@Data
public class AppSettings {
    private ServerSettings server = new ServerSettings();
    private MqttSettings mqtt = new MqttSettings();
    private BrokerSettings broker = new BrokerSettings();
}
