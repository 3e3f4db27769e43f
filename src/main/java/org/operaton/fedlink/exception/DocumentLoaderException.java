package org.operaton.fedlink.exception;

import java.net.URI;

/**
 * Exception thrown when a remote document cannot be fetched or decoded.
 */
public class DocumentLoaderException extends RuntimeException {

    private final URI url;

    public DocumentLoaderException(URI url, String message) {
        super(message);
        this.url = url;
    }

    public DocumentLoaderException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /**
     * @return the URL that failed to load
     */
    public URI getUrl() {
        return url;
    }
}
