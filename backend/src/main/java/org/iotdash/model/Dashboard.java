package org.iotdash.model;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class Dashboard {
    private String id;
    private String name;
    private List<Widget> widgets = new ArrayList<>();
    private JsonObject layout = new JsonObject();
    private Integer deviceCount;
    private JsonObject stats;
    @SerializedName("userId")
    private String owner;
    private Instant createdAt;
    private Instant updatedAt;
    @SerializedName("isPublished")
    private boolean published;
    private Instant publishedAt;
    private String shareableId;
    private String shareableLink;
    private String sharePassword;

    public int widgetCount() {
        return widgets == null ? 0 : widgets.size();
    }

    public List<Widget> copyWidgets() {
        List<Widget> copies = new ArrayList<>();
        if (widgets != null) {
            for (Widget widget : widgets) {
                copies.add(widget.copy());
            }
        }
        return copies;
    }
}
