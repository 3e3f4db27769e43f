package org.operaton.fedlink.exception;

/**
 * Exception thrown when the crypto provider fails to produce or check a signature.
 */
public class SigningException extends RuntimeException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
