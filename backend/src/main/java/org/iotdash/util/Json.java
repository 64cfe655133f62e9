package org.iotdash.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.util.Optional;

public final class Json {
    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter())
            .disableHtmlEscaping()
            .create();

    private Json() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Parses {@code text} as a single strict JSON value. Empty input, unquoted
     * words and trailing content are rejected.
     */
    public static Optional<JsonElement> parseStrict(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setLenient(false);
            JsonElement element = GSON.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                return Optional.empty();
            }
            return Optional.ofNullable(element);
        } catch (IOException | RuntimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Payload value used for broker messages: the parsed JSON, or the text itself.
     */
    public static JsonElement parseOrRaw(String text) {
        return parseStrict(text).orElseGet(() -> new JsonPrimitive(text == null ? "" : text));
    }
}
