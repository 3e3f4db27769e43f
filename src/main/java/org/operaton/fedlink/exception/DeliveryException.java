package org.operaton.fedlink.exception;

import java.net.URI;

/**
 * Exception thrown when a remote inbox answers a delivery with a non-2xx status.
 * Carries everything that was logged about the failed attempt.
 */
public class DeliveryException extends RuntimeException {

    private final URI activityId;
    private final URI inbox;
    private final int statusCode;
    private final String statusText;
    private final String responseBody;

    public DeliveryException(URI activityId, URI inbox, int statusCode, String statusText, String responseBody) {
        super(String.format("Failed to send activity %s to %s (%d %s):%n%s",
            activityId, inbox, statusCode, statusText, responseBody));
        this.activityId = activityId;
        this.inbox = inbox;
        this.statusCode = statusCode;
        this.statusText = statusText;
        this.responseBody = responseBody;
    }

    public URI getActivityId() {
        return activityId;
    }

    public URI getInbox() {
        return inbox;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getStatusText() {
        return statusText;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
