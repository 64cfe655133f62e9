package org.iotdash.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes reset links to the log instead of mailing them.
 */
public class LoggingResetLinkSender implements ResetLinkSender {
    private static final Logger logger = LoggerFactory.getLogger(LoggingResetLinkSender.class);

    @Override
    public void send(String email, String resetLink) {
        logger.info("Password reset link for {}: {}", email, resetLink);
    }
}
