package org.iotdash.auth;

public class ResetTokenException extends RuntimeException {

    public enum Reason {
        INVALID("Invalid or expired reset token"),
        EXPIRED("Reset token has expired. Please request a new one."),
        ALREADY_USED("Reset token has already been used. Please request a new one."),
        EMAIL_MISMATCH("Invalid email for this reset token");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public ResetTokenException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
