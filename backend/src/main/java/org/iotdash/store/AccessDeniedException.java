package org.iotdash.store;

/**
 * Caller identifier does not match the record owner. The identifier is not
 * authenticated, so this is a placeholder check only.
 */
public class AccessDeniedException extends RuntimeException {
    public AccessDeniedException(String message) {
        super(message);
    }
}
