package org.operaton.fedlink.service;

import lombok.Builder;
import lombok.Getter;
import org.operaton.fedlink.loader.DocumentLoader;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.List;

/**
 * Options for fanning an activity out to its recipients.
 */
@Getter
@Builder
public class SendOptions {

    /**
     * Deliver to shared inboxes where recipients advertise one.
     */
    @Builder.Default
    private final boolean preferSharedInbox = false;

    /**
     * Servers that must not receive the activity, typically the local one.
     */
    @Builder.Default
    private final List<URI> excludeBaseUris = List.of();

    /**
     * Extra request headers for every delivery.
     */
    @Builder.Default
    private final HttpHeaders headers = HttpHeaders.EMPTY;

    /**
     * Loader for the JSON-LD contexts the Linked Data signature needs, or null
     * for the default document loader.
     */
    private final DocumentLoader contextLoader;

    public static SendOptions defaults() {
        return SendOptions.builder().build();
    }
}
