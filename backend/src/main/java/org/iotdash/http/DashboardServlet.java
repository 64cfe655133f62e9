package org.iotdash.http;

import com.google.gson.JsonObject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iotdash.dashboard.DashboardService;
import org.iotdash.model.Dashboard;
import org.iotdash.model.DashboardRequest;
import org.iotdash.model.DashboardSummary;
import org.iotdash.model.SharedDashboard;
import org.iotdash.util.InstantTypeAdapter;

import java.io.IOException;
import java.util.List;

/**
 * Dashboard endpoints under {@code /api/dashboard}.
 */
public class DashboardServlet extends ApiServlet {
    private final transient DashboardService dashboardService;

    public DashboardServlet(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @Override
    protected boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException {
        String[] segments = path.substring(1).split("/", -1);
        switch (method) {
            case "POST" -> {
                if (path.equals("/save")) {
                    save(req, resp);
                    return true;
                }
                if (path.equals("/publish")) {
                    publish(req, resp);
                    return true;
                }
            }
            case "PUT" -> {
                if (segments.length == 2 && segments[0].equals("update") && !segments[1].isEmpty()) {
                    update(segments[1], req, resp);
                    return true;
                }
            }
            case "GET" -> {
                if (path.equals("/health")) {
                    health(resp);
                    return true;
                }
                if (path.equals("/generate-topic-id")) {
                    generateTopicId(resp);
                    return true;
                }
                if (segments.length == 2 && segments[0].equals("shared") && !segments[1].isEmpty()) {
                    shared(segments[1], req, resp);
                    return true;
                }
                if (segments.length == 2 && segments[0].equals("user") && !segments[1].isEmpty()) {
                    listForUser(segments[1], req, resp);
                    return true;
                }
                if (segments.length == 1 && !segments[0].isEmpty()) {
                    get(segments[0], req, resp);
                    return true;
                }
            }
            case "DELETE" -> {
                if (segments.length == 1 && !segments[0].isEmpty()) {
                    delete(segments[0], req, resp);
                    return true;
                }
            }
            default -> {
                return false;
            }
        }
        return false;
    }

    private void save(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Dashboard dashboard = dashboardService.save(readBody(req, DashboardRequest.class), caller(req));
        JsonObject body = success();
        body.addProperty("message", "Dashboard saved successfully");
        body.add("dashboard", brief(dashboard));
        ok(resp, body);
    }

    private void update(String id, HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Dashboard dashboard = dashboardService.update(id, readBody(req, DashboardRequest.class), caller(req));
        JsonObject body = success();
        body.addProperty("message", "Dashboard updated successfully");
        body.add("dashboard", brief(dashboard));
        ok(resp, body);
    }

    private void publish(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Dashboard dashboard = dashboardService.publish(readBody(req, DashboardRequest.class), caller(req));
        JsonObject published = new JsonObject();
        published.addProperty("id", dashboard.getId());
        published.addProperty("name", dashboard.getName());
        published.addProperty("isPublished", dashboard.isPublished());
        published.addProperty("publishedAt", InstantTypeAdapter.format(dashboard.getPublishedAt()));
        published.addProperty("shareableLink", dashboard.getShareableLink());
        published.addProperty("sharePassword", dashboard.getSharePassword());
        published.addProperty("shareableId", dashboard.getShareableId());

        JsonObject body = success();
        body.addProperty("message", "Dashboard published successfully");
        body.add("dashboard", published);
        ok(resp, body);
    }

    private void shared(String shareableId, HttpServletRequest req, HttpServletResponse resp) throws IOException {
        SharedDashboard shared = dashboardService.getShared(shareableId, req.getParameter("password"));
        JsonObject body = success();
        body.add("dashboard", gson.toJsonTree(shared));
        ok(resp, body);
    }

    private void listForUser(String userId, HttpServletRequest req, HttpServletResponse resp) throws IOException {
        List<DashboardSummary> dashboards = dashboardService.listForOwner(userId,
                DashboardService.callerOrAnonymous(caller(req)));
        JsonObject body = success();
        body.add("dashboards", gson.toJsonTree(dashboards));
        ok(resp, body);
    }

    private void get(String id, HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Dashboard dashboard = dashboardService.get(id, caller(req));
        JsonObject full = gson.toJsonTree(dashboard).getAsJsonObject();
        for (String hidden : List.of("userId", "shareableId", "shareableLink", "sharePassword")) {
            full.remove(hidden);
        }
        JsonObject body = success();
        body.add("dashboard", full);
        ok(resp, body);
    }

    private void delete(String id, HttpServletRequest req, HttpServletResponse resp) throws IOException {
        dashboardService.delete(id, caller(req));
        JsonObject body = success();
        body.addProperty("message", "Dashboard deleted successfully");
        ok(resp, body);
    }

    private void health(HttpServletResponse resp) throws IOException {
        DashboardService.DashboardStats stats = dashboardService.stats();
        JsonObject body = success();
        body.addProperty("message", "Dashboard service is running");
        body.addProperty("timestamp", timestamp());
        body.addProperty("totalDashboards", stats.totalDashboards());
        body.addProperty("totalSharedDashboards", stats.totalSharedDashboards());
        body.add("topicIdGenerator", gson.toJsonTree(stats.topicIdGenerator()));
        ok(resp, body);
    }

    private void generateTopicId(HttpServletResponse resp) throws IOException {
        String topicId = dashboardService.generateTopicId();
        JsonObject body = success();
        body.addProperty("topicId", topicId);
        body.add("stats", gson.toJsonTree(dashboardService.stats().topicIdGenerator()));
        body.addProperty("timestamp", timestamp());
        ok(resp, body);
    }

    private static JsonObject brief(Dashboard dashboard) {
        JsonObject brief = new JsonObject();
        brief.addProperty("id", dashboard.getId());
        brief.addProperty("name", dashboard.getName());
        brief.addProperty("widgetCount", dashboard.widgetCount());
        brief.addProperty("createdAt", InstantTypeAdapter.format(dashboard.getCreatedAt()));
        brief.addProperty("updatedAt", InstantTypeAdapter.format(dashboard.getUpdatedAt()));
        return brief;
    }
}
