package org.iotdash.http;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.websocket.server.config.JettyWebSocketServletContainerInitializer;
import org.iotdash.auth.PasswordResetService;
import org.iotdash.dashboard.DashboardService;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.iotdash.settings.ServerSettings;
import org.iotdash.store.InMemoryStore;
import org.iotdash.ws.FanOutHub;
import org.iotdash.ws.FanOutWebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty server carrying the JSON API and the fan-out WebSocket endpoint
 * on one port.
 */
public class BackendServer {
    private static final Logger logger = LoggerFactory.getLogger(BackendServer.class);

    private final ServerSettings settings;
    private final InMemoryStore store;
    private final DashboardService dashboardService;
    private final PasswordResetService resetService;
    private final UpstreamMqttClient mqttClient;
    private final FanOutHub fanOutHub;

    private Server server;
    private ServerConnector connector;

    public BackendServer(ServerSettings settings,
                         InMemoryStore store,
                         DashboardService dashboardService,
                         PasswordResetService resetService,
                         UpstreamMqttClient mqttClient,
                         FanOutHub fanOutHub) {
        this.settings = settings;
        this.store = store;
        this.dashboardService = dashboardService;
        this.resetService = resetService;
        this.mqttClient = mqttClient;
        this.fanOutHub = fanOutHub;
    }

    public synchronized void start() {
        if (server != null && server.isRunning()) {
            logger.info("Backend server already running");
            return;
        }

        server = new Server();
        connector = new ServerConnector(server);
        connector.setHost(settings.getHost());
        connector.setPort(settings.getPort());
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new DashboardServlet(dashboardService)), "/api/dashboard/*");
        context.addServlet(new ServletHolder(new MqttServlet(mqttClient)), "/api/mqtt/*");
        context.addServlet(new ServletHolder(new AuthServlet(resetService)), "/api/auth/*");
        context.addServlet(new ServletHolder(new HealthServlet(store, mqttClient, fanOutHub)), "/api/health/*");
        context.addServlet(new ServletHolder(new RootServlet()), "/");

        JettyWebSocketServletContainerInitializer.configure(context, (servletContext, wsContainer) -> {
            wsContainer.setMaxTextMessageSize(settings.getMaxTextMessageSize());
            wsContainer.addMapping(settings.getWebsocketPath(), (request, response) -> new FanOutWebSocket(fanOutHub));
        });

        server.setHandler(context);
        try {
            server.start();
        } catch (Exception e) {
            stop();
            throw new IllegalStateException("Failed to start backend server on port " + settings.getPort(), e);
        }
        logger.info("IoT Dashboard Backend running on port {}", getPort());
        logger.info("WebSocket endpoint at ws://{}:{}{}", settings.getHost(), getPort(), settings.getWebsocketPath());
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        try {
            server.stop();
            logger.info("Backend server stopped");
        } catch (Exception e) {
            logger.warn("Exception while stopping backend server", e);
        }
        server = null;
        connector = null;
    }

    public synchronized boolean isRunning() {
        return server != null && server.isRunning();
    }

    /**
     * Actual listening port, which differs from the configured one when that is 0.
     */
    public synchronized int getPort() {
        return connector == null ? -1 : connector.getLocalPort();
    }
}
