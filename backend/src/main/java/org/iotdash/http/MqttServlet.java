package org.iotdash.http;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iotdash.model.MessageRecord;
import org.iotdash.mqtt.UpstreamMqttClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Manual access to the upstream client under {@code /api/mqtt}.
 */
public class MqttServlet extends ApiServlet {
    private static final Logger logger = LoggerFactory.getLogger(MqttServlet.class);

    private final transient UpstreamMqttClient mqttClient;

    public MqttServlet(UpstreamMqttClient mqttClient) {
        this.mqttClient = mqttClient;
    }

    @Override
    protected boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException {
        if (method.equals("GET") && path.equals("/health")) {
            JsonObject body = success();
            body.add("mqtt", gson.toJsonTree(mqttClient.getHealth()));
            ok(resp, body);
            return true;
        }
        if (method.equals("GET") && path.equals("/topics")) {
            JsonObject body = success();
            body.add("topics", gson.toJsonTree(mqttClient.getTopics()));
            ok(resp, body);
            return true;
        }
        if (method.equals("GET") && path.equals("/latest")) {
            latest(req, resp);
            return true;
        }
        if (method.equals("POST") && path.equals("/publish")) {
            publish(req, resp);
            return true;
        }
        return false;
    }

    private void latest(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String topic = req.getParameter("topic");
        if (topic == null || topic.isEmpty()) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "Query param \"topic\" is required");
            return;
        }
        Optional<MessageRecord> record = mqttClient.getLatest(topic);
        if (record.isEmpty()) {
            error(resp, HttpServletResponse.SC_NOT_FOUND, "No data for topic");
            return;
        }
        JsonObject body = success();
        body.add("data", gson.toJsonTree(record.get()));
        ok(resp, body);
    }

    private void publish(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        JsonObject request = readBody(req, JsonObject.class);
        JsonElement topic = request.get("topic");
        if (topic == null || !topic.isJsonPrimitive() || topic.getAsString().isEmpty()) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "topic is required");
            return;
        }
        JsonElement message = request.get("message");
        JsonObject options = request.has("options") && request.get("options").isJsonObject()
                ? request.getAsJsonObject("options") : new JsonObject();
        JsonElement qosOption = options.get("qos");
        JsonElement retainOption = options.get("retain");
        if (qosOption != null && !isNumber(qosOption)) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "qos must be 0, 1 or 2");
            return;
        }
        if (retainOption != null && !isBoolean(retainOption)) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "retain must be a boolean");
            return;
        }
        int qos = qosOption == null ? 0 : qosOption.getAsInt();
        boolean retain = retainOption != null && retainOption.getAsBoolean();
        if (qos < 0 || qos > 2) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "qos must be 0, 1 or 2");
            return;
        }

        mqttClient.publish(topic.getAsString(), message == null || message.isJsonNull() ? "" : message, qos, retain);
        logger.info("MQTT publish via API to {}", topic.getAsString());
        ok(resp, success());
    }

    private static boolean isBoolean(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean();
    }

    private static boolean isNumber(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }
}
