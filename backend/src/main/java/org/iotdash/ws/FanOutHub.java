package org.iotdash.ws;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.iotdash.model.MessageRecord;
import org.iotdash.mqtt.MessageRecordListener;
import org.iotdash.util.InstantTypeAdapter;
import org.iotdash.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Broadcasts upstream messages to the downstream connections that want them.
 * Delivery is best effort and independent per connection.
 */
public class FanOutHub implements MessageRecordListener {
    private static final Logger logger = LoggerFactory.getLogger(FanOutHub.class);

    public static final String ENVELOPE_TYPE = "mqtt";

    private final Map<String, DownstreamConnection> connections = new ConcurrentHashMap<>();

    public DownstreamConnection open(DownstreamChannel channel, Collection<String> initialTopics) {
        DownstreamConnection connection = new DownstreamConnection(channel, initialTopics);
        connections.put(channel.id(), connection);
        logger.info("WS client {} connected. Subs: {}", channel.id(),
                connection.getSubscriptions().isEmpty() ? "(none)" : String.join(", ", connection.getSubscriptions()));
        return connection;
    }

    public void close(DownstreamChannel channel) {
        if (connections.remove(channel.id()) != null) {
            logger.info("WS client {} disconnected", channel.id());
        }
    }

    /**
     * Applies a {@code {"action": "subscribe"|"unsubscribe", "topic": "..."}} message.
     * Anything else is ignored and the connection stays open.
     */
    public void handleControlMessage(DownstreamConnection connection, String text) {
        JsonElement parsed = Json.parseStrict(text).orElse(null);
        if (parsed == null || !parsed.isJsonObject()) {
            logger.debug("Ignoring malformed control message from {}", connection.getChannel().id());
            return;
        }
        JsonObject message = parsed.getAsJsonObject();
        String action = stringMember(message, "action");
        String topic = stringMember(message, "topic");
        if (action == null || topic == null || topic.isEmpty()) {
            logger.debug("Ignoring incomplete control message from {}", connection.getChannel().id());
            return;
        }
        switch (action) {
            case "subscribe" -> connection.subscribe(topic);
            case "unsubscribe" -> connection.unsubscribe(topic);
            default -> {
                logger.debug("Ignoring unknown control action '{}' from {}", action, connection.getChannel().id());
                return;
            }
        }
        logger.debug("WS client {} {}d {}", connection.getChannel().id(), action, topic);
    }

    @Override
    public void onMessage(MessageRecord record) {
        if (connections.isEmpty()) {
            return;
        }
        String payload = envelope(record);
        for (DownstreamConnection connection : connections.values()) {
            DownstreamChannel channel = connection.getChannel();
            try {
                if (!channel.isOpen()) {
                    connections.remove(channel.id(), connection);
                    continue;
                }
                if (connection.wants(record.topic())) {
                    channel.send(payload);
                }
            } catch (RuntimeException e) {
                logger.debug("Delivery to WS client {} failed: {}", channel.id(), e.getMessage());
            }
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    static String envelope(MessageRecord record) {
        JsonObject envelope = new JsonObject();
        envelope.addProperty("type", ENVELOPE_TYPE);
        envelope.addProperty("topic", record.topic());
        envelope.add("data", record.data());
        envelope.addProperty("raw", record.raw());
        envelope.addProperty("receivedAt", InstantTypeAdapter.format(record.receivedAt()));
        return Json.gson().toJson(envelope);
    }

    private static String stringMember(JsonObject object, String name) {
        JsonElement element = object.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        return element.getAsString();
    }
}
