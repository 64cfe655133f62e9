package org.iotdash.mqtt;

import org.iotdash.model.MessageRecord;

/**
 * Receives every message the upstream client takes from the broker. Called on the
 * MQTT callback thread, so implementations must not block.
 */
@FunctionalInterface
public interface MessageRecordListener {

    void onMessage(MessageRecord record);
}
