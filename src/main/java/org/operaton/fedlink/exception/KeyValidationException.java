package org.operaton.fedlink.exception;

/**
 * Exception thrown when a key has the wrong purpose or an unsupported algorithm.
 */
public class KeyValidationException extends RuntimeException {

    public KeyValidationException(String message) {
        super(message);
    }

    public KeyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
