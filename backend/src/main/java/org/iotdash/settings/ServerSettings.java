package org.iotdash.settings;

import lombok.Data;

@Data
public class ServerSettings {
    private String host = "0.0.0.0";
    private int port = 5000;
    private String websocketPath = "/ws";
    private int maxTextMessageSize = 65536;
    private String frontendUrl = "http://localhost:5173";
}
