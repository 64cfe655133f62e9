package org.iotdash.model;

import com.google.gson.JsonObject;
import lombok.Data;

import java.util.List;

/**
 * Client-supplied dashboard fields for save, update and publish.
 * {@code layouts} is accepted as an alias of {@code layout}.
 */
@Data
public class DashboardRequest {
    private String id;
    private String name;
    private List<Widget> widgets;
    private JsonObject layout;
    private JsonObject layouts;
    private Integer deviceCount;
    private JsonObject stats;

    public JsonObject effectiveLayout() {
        if (layout != null) {
            return layout;
        }
        return layouts;
    }
}
