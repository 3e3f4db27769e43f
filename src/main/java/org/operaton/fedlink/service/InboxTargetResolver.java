package org.operaton.fedlink.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.model.vocab.Recipient;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Works out which inboxes an activity has to be posted to.
 *
 * Recipients are grouped by the exact inbox URL, so two inboxes on the same server
 * with different paths are posted to separately. Exclusions on the other hand
 * match by origin: any inbox on an excluded server is skipped.
 */
@Component
@Slf4j
public class InboxTargetResolver {

    /**
     * @param recipients the recipients in delivery order
     * @param preferSharedInbox use a recipient's shared inbox where it has one
     * @param excludeBaseUris servers (any URL on them) that must not receive the activity
     * @return the recipient ids keyed by inbox URL, both in first-seen order
     */
    public Map<String, Set<URI>> extractInboxes(List<? extends Recipient> recipients, boolean preferSharedInbox,
                                                List<URI> excludeBaseUris) {
        Set<String> excludedOrigins = new LinkedHashSet<>();
        if (excludeBaseUris != null) {
            for (URI exclusion : excludeBaseUris) {
                String origin = origin(exclusion);
                if (origin != null) {
                    excludedOrigins.add(origin);
                }
            }
        }

        Map<String, Set<URI>> inboxes = new LinkedHashMap<>();
        for (Recipient recipient : recipients) {
            URI inbox = preferSharedInbox && recipient.getSharedInboxId() != null
                ? recipient.getSharedInboxId()
                : recipient.getInboxId();
            if (inbox == null || recipient.getId() == null) {
                log.debug("Skipping recipient {} without inbox", recipient.getId());
                continue;
            }
            String origin = origin(inbox);
            if (origin != null && excludedOrigins.contains(origin)) {
                log.debug("Skipping excluded inbox {} of {}", inbox, recipient.getId());
                continue;
            }
            inboxes.computeIfAbsent(inbox.toString(), k -> new LinkedHashSet<>()).add(recipient.getId());
        }
        return inboxes;
    }

    /**
     * @return scheme, host and effective port, or null for URIs without a host
     */
    static String origin(URI uri) {
        if (uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equals(scheme) ? 443 : "http".equals(scheme) ? 80 : -1;
        }
        return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + ":" + port;
    }
}
