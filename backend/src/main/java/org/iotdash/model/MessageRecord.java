package org.iotdash.model;

import com.google.gson.JsonElement;

import java.time.Instant;

/**
 * One inbound broker message. {@code data} is the parsed JSON payload, or the raw
 * text as a JSON string when the payload is not valid JSON.
 */
public record MessageRecord(String topic, JsonElement data, String raw, Instant receivedAt) { }
