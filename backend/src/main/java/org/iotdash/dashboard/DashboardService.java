package org.iotdash.dashboard;

import org.iotdash.id.TopicIdGenerator;
import org.iotdash.id.TopicIdStats;
import org.iotdash.model.Dashboard;
import org.iotdash.model.DashboardRequest;
import org.iotdash.model.DashboardSummary;
import org.iotdash.model.SharedDashboard;
import org.iotdash.store.AccessDeniedException;
import org.iotdash.store.InMemoryStore;
import org.iotdash.store.KeyValueCollection;
import org.iotdash.store.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

public class DashboardService {
    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

    public static final String ANONYMOUS = "anonymous";

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    public record DashboardStats(int totalDashboards, int totalSharedDashboards,
                                 TopicIdStats topicIdGenerator) { }

    private final KeyValueCollection<Dashboard> dashboards;
    private final KeyValueCollection<SharedDashboard> sharedDashboards;
    private final TopicIdGenerator topicIdGenerator;
    private final Clock clock;
    private final String frontendUrl;
    private final SecureRandom random = new SecureRandom();

    public DashboardService(InMemoryStore store, TopicIdGenerator topicIdGenerator, Clock clock, String frontendUrl) {
        this.dashboards = store.dashboards();
        this.sharedDashboards = store.sharedDashboards();
        this.topicIdGenerator = topicIdGenerator;
        this.clock = clock;
        this.frontendUrl = frontendUrl;
    }

    public Dashboard save(DashboardRequest request, String caller) {
        requireContent(request);
        String owner = callerOrAnonymous(caller);
        logger.info("Saving dashboard '{}' for {} with {} widgets", request.getName(), owner,
                request.getWidgets().size());

        String id = request.getId();
        if (id == null || id.isBlank()) {
            id = topicIdGenerator.generate();
            logger.info("Generated new topic id {}", id);
        } else if (!TopicIdGenerator.validate(id)) {
            logger.warn("Invalid topic id format provided ({}), generating a new one", id);
            id = topicIdGenerator.generate();
            logger.info("Generated replacement topic id {}", id);
        }

        Instant now = clock.instant();
        Dashboard dashboard = new Dashboard();
        dashboard.setId(id);
        dashboard.setOwner(owner);
        dashboard.setCreatedAt(now);
        dashboard.setUpdatedAt(now);
        dashboard.setPublished(false);
        applyContent(dashboard, request);

        dashboards.put(id, dashboard);
        logger.info("Dashboard {} saved for {}", id, owner);
        return dashboard;
    }

    public Dashboard update(String id, DashboardRequest request, String caller) {
        requireContent(request);
        String owner = callerOrAnonymous(caller);
        Dashboard dashboard = ownedDashboard(id, owner, "update");

        applyContent(dashboard, request);
        dashboard.setUpdatedAt(clock.instant());
        dashboards.put(id, dashboard);

        logger.info("Dashboard {} updated by {}, {} widgets", id, owner, dashboard.widgetCount());
        return dashboard;
    }

    public Dashboard publish(DashboardRequest request, String caller) {
        if (request == null || request.getId() == null || request.getId().isBlank()) {
            throw new IllegalArgumentException("Dashboard id is required");
        }
        requireContent(request);
        String owner = callerOrAnonymous(caller);
        Dashboard dashboard = ownedDashboard(request.getId(), owner, "publish");

        if (dashboard.getShareableId() != null) {
            sharedDashboards.remove(dashboard.getShareableId());
        }

        Instant now = clock.instant();
        String shareableId = "shared-" + now.toEpochMilli() + "-" + randomBase36(9);
        applyContent(dashboard, request);
        dashboard.setPublished(true);
        dashboard.setPublishedAt(now);
        dashboard.setShareableId(shareableId);
        dashboard.setShareableLink(frontendUrl + "/shared/" + shareableId);
        dashboard.setSharePassword(randomBase36(6).toUpperCase(Locale.ROOT));
        dashboard.setUpdatedAt(now);
        dashboards.put(dashboard.getId(), dashboard);

        sharedDashboards.put(shareableId, SharedDashboard.snapshotOf(dashboard));
        logger.info("Dashboard {} published as {} by {}", dashboard.getId(), shareableId, owner);
        return dashboard;
    }

    public SharedDashboard getShared(String shareableId, String password) {
        SharedDashboard shared = sharedDashboards.get(shareableId)
                .orElseThrow(() -> {
                    logger.warn("Shared dashboard not found: {}", shareableId);
                    return new NotFoundException("Shared dashboard not found");
                });
        if (password != null && !password.isEmpty() && !password.equals(shared.sharePassword())) {
            logger.warn("Invalid password for shared dashboard {}", shareableId);
            throw new InvalidPasswordException("Invalid access password");
        }
        return shared;
    }

    public Dashboard get(String id, String caller) {
        return ownedDashboard(id, callerOrAnonymous(caller), "access");
    }

    public List<DashboardSummary> listForOwner(String userId, String caller) {
        String requester = callerOrAnonymous(caller);
        if (!Objects.equals(userId, requester)) {
            logger.warn("Unauthorized dashboard list request for {} by {}", userId, requester);
            throw new AccessDeniedException("Unauthorized to access these dashboards");
        }
        return dashboards.values().stream()
                .filter(dashboard -> userId.equals(dashboard.getOwner()))
                .sorted(Comparator.comparing(Dashboard::getCreatedAt))
                .map(DashboardSummary::of)
                .collect(Collectors.toList());
    }

    public void delete(String id, String caller) {
        String owner = callerOrAnonymous(caller);
        Dashboard dashboard = ownedDashboard(id, owner, "delete");

        dashboards.remove(id);
        if (dashboard.isPublished() && dashboard.getShareableId() != null) {
            sharedDashboards.remove(dashboard.getShareableId());
        }
        logger.info("Dashboard {} deleted by {}", id, owner);
    }

    public DashboardStats stats() {
        return new DashboardStats(dashboards.size(), sharedDashboards.size(), topicIdGenerator.stats());
    }

    public String generateTopicId() {
        return topicIdGenerator.generate();
    }

    public static String callerOrAnonymous(String caller) {
        return caller == null || caller.isBlank() ? ANONYMOUS : caller;
    }

    private Dashboard ownedDashboard(String id, String owner, String action) {
        Dashboard dashboard = dashboards.get(id)
                .orElseThrow(() -> {
                    logger.warn("Dashboard not found for {}: {}", action, id);
                    return new NotFoundException("Dashboard not found");
                });
        if (!Objects.equals(dashboard.getOwner(), owner)) {
            logger.warn("Unauthorized dashboard {} attempt on {} by {} (owner {})", action, id, owner,
                    dashboard.getOwner());
            throw new AccessDeniedException("Unauthorized to " + action + " this dashboard");
        }
        return dashboard;
    }

    private static void requireContent(DashboardRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Dashboard name is required");
        }
        if (request.getWidgets() == null) {
            throw new IllegalArgumentException("Dashboard widgets are required");
        }
        if (request.getWidgets().contains(null)) {
            throw new IllegalArgumentException("Dashboard widgets must not contain null entries");
        }
    }

    private static void applyContent(Dashboard dashboard, DashboardRequest request) {
        dashboard.setName(request.getName());
        dashboard.setWidgets(new ArrayList<>(request.getWidgets()));
        if (request.effectiveLayout() != null) {
            dashboard.setLayout(request.effectiveLayout());
        }
        if (request.getDeviceCount() != null) {
            dashboard.setDeviceCount(request.getDeviceCount());
        }
        if (request.getStats() != null) {
            dashboard.setStats(request.getStats());
        }
    }

    private String randomBase36(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return builder.toString();
    }
}
