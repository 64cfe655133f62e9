package org.iotdash.model;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

/**
 * Maps the modelled widget members onto {@link Widget} fields. A member whose
 * value does not fit its field, and every unknown member, goes to
 * {@link Widget#getExtra()} as it was received.
 */
public class WidgetTypeAdapter extends TypeAdapter<Widget> {
    private static final TypeAdapter<JsonElement> ELEMENTS = new Gson().getAdapter(JsonElement.class);

    @Override
    public void write(JsonWriter out, Widget widget) throws IOException {
        if (widget == null) {
            out.nullValue();
            return;
        }
        out.beginObject();
        writeString(out, "id", widget.getId());
        writeString(out, "type", widget.getType());
        writeString(out, "title", widget.getTitle());
        writeString(out, "topic", widget.getTopic());
        writeNumber(out, "x", widget.getX());
        writeNumber(out, "y", widget.getY());
        writeNumber(out, "w", widget.getW());
        writeNumber(out, "h", widget.getH());
        writeElement(out, "data", widget.getData());
        writeElement(out, "config", widget.getConfig());
        if (widget.getExtra() != null) {
            for (Map.Entry<String, JsonElement> member : widget.getExtra().entrySet()) {
                out.name(member.getKey());
                ELEMENTS.write(out, member.getValue());
            }
        }
        out.endObject();
    }

    @Override
    public Widget read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        JsonElement element = ELEMENTS.read(in);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Widget must be a JSON object");
        }
        Widget widget = new Widget();
        for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
            if (!assign(widget, member.getKey(), member.getValue())) {
                widget.getExtra().add(member.getKey(), member.getValue());
            }
        }
        return widget;
    }

    private static boolean assign(Widget widget, String name, JsonElement value) {
        switch (name) {
            case "id", "type", "title", "topic" -> {
                if (!isString(value)) {
                    return false;
                }
                String text = value.getAsString();
                switch (name) {
                    case "id" -> widget.setId(text);
                    case "type" -> widget.setType(text);
                    case "title" -> widget.setTitle(text);
                    default -> widget.setTopic(text);
                }
                return true;
            }
            case "x", "y", "w", "h" -> {
                if (!isNumber(value)) {
                    return false;
                }
                Number number = value.getAsNumber();
                switch (name) {
                    case "x" -> widget.setX(number);
                    case "y" -> widget.setY(number);
                    case "w" -> widget.setW(number);
                    default -> widget.setH(number);
                }
                return true;
            }
            case "data", "config" -> {
                if (!value.isJsonObject()) {
                    return false;
                }
                if (name.equals("data")) {
                    widget.setData(value.getAsJsonObject());
                } else {
                    widget.setConfig(value.getAsJsonObject());
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private static boolean isString(JsonElement value) {
        return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
    }

    private static boolean isNumber(JsonElement value) {
        return value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber();
    }

    private static void writeString(JsonWriter out, String name, String value) throws IOException {
        if (value != null) {
            out.name(name).value(value);
        }
    }

    private static void writeNumber(JsonWriter out, String name, Number value) throws IOException {
        if (value != null) {
            out.name(name).value(value);
        }
    }

    private static void writeElement(JsonWriter out, String name, JsonObject value) throws IOException {
        if (value != null) {
            out.name(name);
            ELEMENTS.write(out, value);
        }
    }
}
