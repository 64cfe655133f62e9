package org.iotdash.auth;

import org.iotdash.model.ResetToken;
import org.iotdash.store.InMemoryStore;
import org.iotdash.store.KeyValueCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

public class PasswordResetService {
    private static final Logger logger = LoggerFactory.getLogger(PasswordResetService.class);

    public static final Duration TOKEN_LIFETIME = Duration.ofHours(24);

    private final KeyValueCollection<ResetToken> resetTokens;
    private final ResetLinkSender sender;
    private final Clock clock;
    private final String frontendUrl;
    private final SecureRandom random = new SecureRandom();

    public PasswordResetService(InMemoryStore store, ResetLinkSender sender, Clock clock, String frontendUrl) {
        this.resetTokens = store.resetTokens();
        this.sender = sender;
        this.clock = clock;
        this.frontendUrl = frontendUrl;
    }

    /**
     * Issues a token and hands the reset link to the sender. The token is dropped
     * again when the link cannot be delivered.
     *
     * @return the issued token
     */
    public String requestReset(String email, String ip) {
        String normalizedEmail = normalize(email);
        logger.info("Processing password reset for {}", normalizedEmail);

        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String token = HexFormat.of().formatHex(bytes);

        Instant now = clock.instant();
        ResetToken resetToken = new ResetToken();
        resetToken.setEmail(normalizedEmail);
        resetToken.setExpiry(now.plus(TOKEN_LIFETIME));
        resetToken.setUsed(false);
        resetToken.setCreatedAt(now);
        resetToken.setIp(ip);
        resetTokens.put(token, resetToken);

        String resetLink = frontendUrl + "/reset-password?token=" + token
                + "&email=" + URLEncoder.encode(normalizedEmail, StandardCharsets.UTF_8);
        try {
            sender.send(normalizedEmail, resetLink);
        } catch (Exception e) {
            resetTokens.remove(token);
            logger.error("Failed to deliver reset link to {}", normalizedEmail, e);
            throw new IllegalStateException("Failed to send password reset email", e);
        }
        logger.info("Password reset link issued for {}", normalizedEmail);
        return token;
    }

    public void validate(String token, String email) {
        check(token, normalize(email));
        logger.info("Reset token validated for {}", normalize(email));
    }

    public void reset(String token, String email, String newPassword) {
        String normalizedEmail = normalize(email);
        ResetToken resetToken = check(token, normalizedEmail);

        resetToken.setUsed(true);
        resetToken.setUsedAt(clock.instant());
        resetTokens.put(token, resetToken);

        // password storage lives outside this backend
        logger.info("Password reset successful for {}", normalizedEmail);
    }

    public int activeTokens() {
        return resetTokens.size();
    }

    private ResetToken check(String token, String normalizedEmail) {
        ResetToken resetToken = resetTokens.get(token).orElse(null);
        if (resetToken == null) {
            logger.warn("Invalid reset token used for {}", normalizedEmail);
            throw new ResetTokenException(ResetTokenException.Reason.INVALID);
        }
        if (resetToken.isExpired(clock.instant())) {
            resetTokens.remove(token);
            logger.warn("Expired reset token used for {}", normalizedEmail);
            throw new ResetTokenException(ResetTokenException.Reason.EXPIRED);
        }
        if (resetToken.isUsed()) {
            logger.warn("Already used reset token presented for {}", normalizedEmail);
            throw new ResetTokenException(ResetTokenException.Reason.ALREADY_USED);
        }
        if (!resetToken.getEmail().equals(normalizedEmail)) {
            logger.warn("Reset token email mismatch: expected {}, got {}", resetToken.getEmail(), normalizedEmail);
            throw new ResetTokenException(ResetTokenException.Reason.EMAIL_MISMATCH);
        }
        return resetToken;
    }

    private static String normalize(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
