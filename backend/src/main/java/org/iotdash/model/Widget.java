package org.iotdash.model;

import com.google.gson.JsonObject;
import com.google.gson.annotations.JsonAdapter;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One dashboard widget. Members the backend does not model are kept in
 * {@code extra} and written back unchanged.
 */
@Data
@NoArgsConstructor
@JsonAdapter(WidgetTypeAdapter.class)
public class Widget {
    private String id;
    private String type;
    private String title;
    private String topic;
    private Number x;
    private Number y;
    private Number w;
    private Number h;
    private JsonObject data;
    private JsonObject config;
    private JsonObject extra = new JsonObject();

    public Widget(String id, String type, String title, String topic, Number x, Number y, Number w, Number h,
                  JsonObject data, JsonObject config) {
        this.id = id;
        this.type = type;
        this.title = title;
        this.topic = topic;
        this.x = x;
        this.y = y;
        this.w = w;
        this.h = h;
        this.data = data;
        this.config = config;
    }

    public Widget copy() {
        Widget copy = new Widget(id, type, title, topic, x, y, w, h,
                data == null ? null : data.deepCopy(),
                config == null ? null : config.deepCopy());
        copy.setExtra(extra == null ? new JsonObject() : extra.deepCopy());
        return copy;
    }
}
