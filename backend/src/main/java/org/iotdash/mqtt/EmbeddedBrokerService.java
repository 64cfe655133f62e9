package org.iotdash.mqtt;

import io.moquette.broker.Server;
import io.moquette.broker.config.IConfig;
import io.moquette.broker.config.MemoryConfig;
import io.moquette.broker.security.IAuthenticator;
import io.moquette.broker.security.PermitAllAuthorizatorPolicy;
import io.moquette.interception.InterceptHandler;
import org.iotdash.settings.BrokerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Objects;
import java.util.Properties;

/**
 * In-process Moquette broker for development setups without an external broker.
 */
public class EmbeddedBrokerService {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddedBrokerService.class);

    private static final String PROP_PORT = "port";
    private static final String PROP_HOST = "host";
    private static final String PROP_ALLOW_ANONYMOUS = "allow_anonymous";
    private static final String PROP_PERSISTENCE_ENABLED = "persistence_enabled";
    private static final String PROP_TELEMETRY_ENABLED = "telemetry_enabled";
    private static final String PROP_WS_PORT = "websocket_port";
    private static final String PROP_WS_PATH = "websocket_path";

    public record RuntimeInfo(String host, int port, boolean websocketEnabled, int websocketPort) { }

    private Server server;
    private boolean running;
    private RuntimeInfo runtimeInfo;

    public synchronized RuntimeInfo start(BrokerSettings settings) {
        if (running) {
            logger.debug("Embedded MQTT broker already running");
            return runtimeInfo;
        }
        BrokerSettings snapshot = settings.copy();
        logger.info("Starting embedded MQTT broker on {}:{}", snapshot.getHost(), snapshot.getPort());
        try {
            IConfig config = new MemoryConfig(buildProperties(snapshot));
            server = new Server();
            IAuthenticator authenticator = snapshot.isAllowAnonymous() ? null : buildAuthenticator(snapshot);
            server.startServer(config, Collections.<InterceptHandler>emptyList(), null, authenticator,
                    new PermitAllAuthorizatorPolicy());
            running = true;
            runtimeInfo = new RuntimeInfo(snapshot.getHost(), snapshot.getPort(), snapshot.isWebsocketEnabled(),
                    snapshot.getWebsocketPort());
            logger.info("Embedded MQTT broker started successfully");
            return runtimeInfo;
        } catch (Exception ex) {
            logger.error("Failed to start embedded MQTT broker", ex);
            stopInternal();
            throw new IllegalStateException("Failed to start embedded MQTT broker: " + ex.getMessage(), ex);
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized RuntimeInfo getRuntimeInfo() {
        return runtimeInfo;
    }

    public synchronized void shutdown() {
        if (server != null) {
            logger.info("Shutting down embedded MQTT broker");
        }
        stopInternal();
    }

    private void stopInternal() {
        if (server != null) {
            try {
                server.stopServer();
                logger.info("Embedded MQTT broker stopped");
            } catch (Exception e) {
                logger.warn("Exception while stopping embedded MQTT broker", e);
            }
        }
        server = null;
        running = false;
        runtimeInfo = null;
    }

    Properties buildProperties(BrokerSettings settings) {
        Properties props = new Properties();
        props.setProperty(PROP_PORT, String.valueOf(settings.getPort()));
        props.setProperty(PROP_HOST, settings.getHost());
        props.setProperty(PROP_ALLOW_ANONYMOUS, String.valueOf(settings.isAllowAnonymous()));
        props.setProperty(PROP_PERSISTENCE_ENABLED, Boolean.FALSE.toString());
        props.setProperty(PROP_TELEMETRY_ENABLED, Boolean.FALSE.toString());
        if (settings.isWebsocketEnabled()) {
            props.setProperty(PROP_WS_PORT, String.valueOf(settings.getWebsocketPort()));
            props.setProperty(PROP_WS_PATH, "/mqtt");
        }
        return props;
    }

    IAuthenticator buildAuthenticator(BrokerSettings settings) {
        String expectedUser = settings.getUsername();
        String expectedPassword = settings.getPassword();
        if (expectedUser == null || expectedUser.isBlank()) {
            throw new IllegalArgumentException("Username must be provided when anonymous access is disabled.");
        }
        return (clientId, username, password) -> {
            if (username == null || !expectedUser.equals(username)) {
                return false;
            }
            String providedPassword = password == null ? "" : new String(password, StandardCharsets.UTF_8);
            return Objects.equals(expectedPassword, providedPassword);
        };
    }
}
