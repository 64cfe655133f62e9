package org.iotdash.store;

public record StorageStats(int resetTokens,
                           int dashboards,
                           int sharedDashboards,
                           int sessions,
                           int devices) {

    public int total() {
        return resetTokens + dashboards + sharedDashboards + sessions + devices;
    }
}
