package org.iotdash.http;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iotdash.auth.ResetTokenException;
import org.iotdash.dashboard.InvalidPasswordException;
import org.iotdash.store.AccessDeniedException;
import org.iotdash.store.NotFoundException;
import org.iotdash.util.InstantTypeAdapter;
import org.iotdash.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Base for the JSON endpoints. Subclasses route on method and path; domain
 * exceptions are turned into status codes here.
 */
public abstract class ApiServlet extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(ApiServlet.class);

    public static final String CALLER_HEADER = "X-User-Id";

    protected final transient Gson gson = Json.gson();

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String path = req.getPathInfo() == null ? "/" : req.getPathInfo();
        logger.info("{} {}{} - IP: {}", req.getMethod(), req.getServletPath(), path, req.getRemoteAddr());
        try {
            if (!route(req.getMethod(), path, req, resp)) {
                error(resp, HttpServletResponse.SC_NOT_FOUND, "Not found");
            }
        } catch (NotFoundException e) {
            error(resp, HttpServletResponse.SC_NOT_FOUND, e.getMessage());
        } catch (AccessDeniedException e) {
            error(resp, HttpServletResponse.SC_FORBIDDEN, e.getMessage());
        } catch (InvalidPasswordException e) {
            error(resp, HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
        } catch (ResetTokenException | IllegalArgumentException e) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
        } catch (JsonParseException e) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "Malformed JSON body");
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling {} {}{}", req.getMethod(), req.getServletPath(), path, e);
            error(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        }
    }

    /**
     * @return false when no route matches
     */
    protected abstract boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException;

    protected <T> T readBody(HttpServletRequest req, Class<T> type) throws IOException {
        req.setCharacterEncoding(StandardCharsets.UTF_8.name());
        try (Reader reader = req.getReader()) {
            T body = gson.fromJson(reader, type);
            if (body == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            return body;
        }
    }

    protected static String caller(HttpServletRequest req) {
        return req.getHeader(CALLER_HEADER);
    }

    protected static JsonObject success() {
        JsonObject body = new JsonObject();
        body.addProperty("success", true);
        return body;
    }

    protected static String timestamp() {
        return InstantTypeAdapter.format(Instant.now());
    }

    protected void write(HttpServletResponse resp, int status, JsonObject body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resp.getWriter().write(gson.toJson(body));
    }

    protected void ok(HttpServletResponse resp, JsonObject body) throws IOException {
        write(resp, HttpServletResponse.SC_OK, body);
    }

    protected void error(HttpServletResponse resp, int status, String message) throws IOException {
        JsonObject body = new JsonObject();
        body.addProperty("success", false);
        body.addProperty("error", message);
        write(resp, status, body);
    }
}
