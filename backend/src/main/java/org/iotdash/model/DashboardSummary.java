package org.iotdash.model;

import java.time.Instant;

public record DashboardSummary(String id,
                               String name,
                               int widgetCount,
                               boolean isPublished,
                               Instant createdAt,
                               Instant updatedAt,
                               Instant publishedAt) {

    public static DashboardSummary of(Dashboard dashboard) {
        return new DashboardSummary(dashboard.getId(), dashboard.getName(), dashboard.widgetCount(),
                dashboard.isPublished(), dashboard.getCreatedAt(), dashboard.getUpdatedAt(),
                dashboard.getPublishedAt());
    }
}
