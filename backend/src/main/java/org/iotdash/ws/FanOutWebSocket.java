package org.iotdash.ws;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketConnect;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.iotdash.util.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WebSocket endpoint of one downstream client. The {@code topics} query parameter
 * holds the initial comma separated subscriptions.
 */
@WebSocket
public class FanOutWebSocket {
    private static final Logger logger = LoggerFactory.getLogger(FanOutWebSocket.class);

    public static final String TOPICS_PARAMETER = "topics";

    private final FanOutHub hub;
    private JettySessionChannel channel;
    private DownstreamConnection connection;

    public FanOutWebSocket(FanOutHub hub) {
        this.hub = hub;
    }

    @OnWebSocketConnect
    public void onConnect(Session session) {
        channel = new JettySessionChannel(session);
        connection = hub.open(channel, initialTopics(session.getUpgradeRequest().getParameterMap()));
    }

    @OnWebSocketMessage
    public void onMessage(Session session, String message) {
        if (connection != null) {
            hub.handleControlMessage(connection, message);
        }
    }

    @OnWebSocketClose
    public void onClose(Session session, int statusCode, String reason) {
        if (channel != null) {
            hub.close(channel);
        }
    }

    @OnWebSocketError
    public void onError(Session session, Throwable error) {
        logger.debug("WebSocket error on {}: {}", channel, error.getMessage());
        if (channel != null) {
            hub.close(channel);
        }
    }

    static List<String> initialTopics(Map<String, List<String>> parameters) {
        List<String> topics = new ArrayList<>();
        if (parameters == null) {
            return topics;
        }
        List<String> values = parameters.get(TOPICS_PARAMETER);
        if (values != null) {
            for (String value : values) {
                topics.addAll(Topics.split(value));
            }
        }
        return topics;
    }
}
