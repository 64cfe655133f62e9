package org.iotdash.store;

import com.google.gson.JsonObject;
import org.iotdash.model.Dashboard;
import org.iotdash.model.ResetToken;
import org.iotdash.model.SharedDashboard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Process-resident stand-in for a database. Nothing survives a restart and the
 * collections do not reference each other.
 */
public class InMemoryStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    public record ConnectionStatus(boolean connected, String type) { }

    private final KeyValueCollection<ResetToken> resetTokens = new KeyValueCollection<>("resetTokens");
    private final KeyValueCollection<Dashboard> dashboards = new KeyValueCollection<>("dashboards");
    private final KeyValueCollection<SharedDashboard> sharedDashboards = new KeyValueCollection<>("sharedDashboards");
    private final KeyValueCollection<JsonObject> sessions = new KeyValueCollection<>("sessions");
    private final KeyValueCollection<JsonObject> devices = new KeyValueCollection<>("devices");

    public KeyValueCollection<ResetToken> resetTokens() {
        return resetTokens;
    }

    public KeyValueCollection<Dashboard> dashboards() {
        return dashboards;
    }

    public KeyValueCollection<SharedDashboard> sharedDashboards() {
        return sharedDashboards;
    }

    public KeyValueCollection<JsonObject> sessions() {
        return sessions;
    }

    public KeyValueCollection<JsonObject> devices() {
        return devices;
    }

    public void clear() {
        logger.info("Clearing in-memory store");
        for (KeyValueCollection<?> collection : List.of(resetTokens, dashboards, sharedDashboards, sessions, devices)) {
            collection.clear();
        }
    }

    public StorageStats stats() {
        return new StorageStats(resetTokens.size(), dashboards.size(), sharedDashboards.size(),
                sessions.size(), devices.size());
    }

    public ConnectionStatus connectionStatus() {
        return new ConnectionStatus(true, "in-memory");
    }
}
