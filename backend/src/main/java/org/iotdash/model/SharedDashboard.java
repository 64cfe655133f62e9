package org.iotdash.model;

import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.List;

/**
 * Public snapshot of a dashboard taken at publish time. Holds its own copies of
 * the widgets, layout and stats.
 */
public record SharedDashboard(String panelId,
                              String title,
                              List<Widget> widgets,
                              JsonObject layouts,
                              JsonObject stats,
                              String sharePassword,
                              Instant publishedAt,
                              boolean isShared,
                              String originalDashboardId) {

    public static SharedDashboard snapshotOf(Dashboard dashboard) {
        List<Widget> widgets = dashboard.copyWidgets();
        JsonObject stats;
        if (dashboard.getStats() != null) {
            stats = dashboard.getStats().deepCopy();
        } else {
            stats = new JsonObject();
            stats.addProperty("totalWidgets", widgets.size());
            stats.addProperty("gridUtilization", 0);
        }
        return new SharedDashboard(
                dashboard.getShareableId(),
                dashboard.getName() != null ? dashboard.getName() : "Shared Dashboard",
                List.copyOf(widgets),
                dashboard.getLayout() != null ? dashboard.getLayout().deepCopy() : new JsonObject(),
                stats,
                dashboard.getSharePassword(),
                dashboard.getPublishedAt(),
                true,
                dashboard.getId());
    }
}
