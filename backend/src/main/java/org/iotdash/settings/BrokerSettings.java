package org.iotdash.settings;

import lombok.Data;

/**
 * Embedded Moquette broker for running the backend without an external broker.
 */
@Data
public class BrokerSettings {
    private boolean brokerEnabled = false;
    private String host = "127.0.0.1";
    private int port = 1883;
    private boolean websocketEnabled = false;
    private int websocketPort = 8083;
    private boolean allowAnonymous = true;
    private String username = "";
    private String password = "";

    public BrokerSettings copy() {
        BrokerSettings copy = new BrokerSettings();
        copy.setBrokerEnabled(brokerEnabled);
        copy.setHost(host);
        copy.setPort(port);
        copy.setWebsocketEnabled(websocketEnabled);
        copy.setWebsocketPort(websocketPort);
        copy.setAllowAnonymous(allowAnonymous);
        copy.setUsername(username);
        copy.setPassword(password);
        return copy;
    }
}
