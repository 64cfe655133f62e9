package org.iotdash.auth;

/**
 * Delivers a password reset link to its recipient.
 */
@FunctionalInterface
public interface ResetLinkSender {

    void send(String email, String resetLink) throws Exception;
}
