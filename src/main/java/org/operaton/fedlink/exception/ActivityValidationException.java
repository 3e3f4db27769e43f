package org.operaton.fedlink.exception;

/**
 * Exception thrown when an outbound activity or its signing keys fail the
 * preconditions for sending. Always raised before any I/O happens.
 */
public class ActivityValidationException extends RuntimeException {

    public ActivityValidationException(String message) {
        super(message);
    }

    public ActivityValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
