package org.iotdash.http;

import com.google.gson.JsonObject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iotdash.auth.PasswordResetService;

import java.io.IOException;
import java.util.Locale;

/**
 * Password reset endpoints under {@code /api/auth}.
 */
public class AuthServlet extends ApiServlet {
    private static final int MIN_PASSWORD_LENGTH = 6;

    private final transient PasswordResetService resetService;

    public AuthServlet(PasswordResetService resetService) {
        this.resetService = resetService;
    }

    @Override
    protected boolean route(String method, String path, HttpServletRequest req, HttpServletResponse resp)
            throws IOException {
        if (method.equals("POST") && path.equals("/request-reset")) {
            requestReset(req, resp);
            return true;
        }
        if (method.equals("POST") && path.equals("/reset-password")) {
            resetPassword(req, resp);
            return true;
        }
        if (method.equals("GET") && path.equals("/validate-reset-token")) {
            validate(req, resp);
            return true;
        }
        if (method.equals("GET") && path.equals("/health")) {
            JsonObject body = success();
            body.addProperty("message", "Auth service is running");
            body.addProperty("timestamp", timestamp());
            body.addProperty("activeTokens", resetService.activeTokens());
            ok(resp, body);
            return true;
        }
        return false;
    }

    private void requestReset(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        JsonObject request = readBody(req, JsonObject.class);
        String email = member(request, "email");
        if (email == null || !email.contains("@")) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "Please provide a valid email address");
            return;
        }
        try {
            resetService.requestReset(email, req.getRemoteAddr());
        } catch (IllegalStateException e) {
            error(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                    "Failed to send password reset email. Please try again later.");
            return;
        }
        JsonObject body = success();
        body.addProperty("message", "Password reset email sent successfully. Please check your inbox.");
        body.addProperty("email", email.trim().toLowerCase(Locale.ROOT));
        ok(resp, body);
    }

    private void resetPassword(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        JsonObject request = readBody(req, JsonObject.class);
        String token = member(request, "token");
        String email = member(request, "email");
        String newPassword = member(request, "newPassword");
        if (token == null || email == null || newPassword == null) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "token, email and newPassword are required");
            return;
        }
        if (newPassword.length() < MIN_PASSWORD_LENGTH) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "Password must be at least 6 characters long");
            return;
        }
        resetService.reset(token, email, newPassword);
        JsonObject body = success();
        body.addProperty("message",
                "Password has been reset successfully. You can now log in with your new password.");
        ok(resp, body);
    }

    private void validate(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String token = req.getParameter("token");
        String email = req.getParameter("email");
        if (token == null || token.isEmpty() || email == null || email.isEmpty()) {
            error(resp, HttpServletResponse.SC_BAD_REQUEST, "Token and email are required");
            return;
        }
        resetService.validate(token, email);
        JsonObject body = success();
        body.addProperty("message", "Reset token is valid");
        ok(resp, body);
    }

    private static String member(JsonObject object, String name) {
        if (!object.has(name) || !object.get(name).isJsonPrimitive()) {
            return null;
        }
        return object.get(name).getAsString();
    }
}
