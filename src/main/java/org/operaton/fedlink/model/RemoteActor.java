package org.operaton.fedlink.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.fedlink.model.vocab.Person;
import org.operaton.fedlink.model.vocab.Recipient;

import java.net.URI;
import java.time.Instant;

/**
 * Snapshot of a remote ActivityPub actor (user from another server), as far as
 * delivery needs it. Can be kept by callers that store followers themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteActor implements Recipient {

    /**
     * The full ActivityPub actor URI.
     * Example: https://mastodon.social/users/alice
     */
    private URI actorUri;

    /**
     * The username part of the actor.
     * Example: alice
     */
    private String username;

    /**
     * The domain of the remote server.
     * Example: mastodon.social
     */
    private String domain;

    private String displayName;

    /**
     * The actor's inbox URL for sending activities.
     */
    private URI inboxUrl;

    /**
     * The actor's shared inbox URL (if available).
     * More efficient for server-to-server communication.
     */
    private URI sharedInboxUrl;

    /**
     * When the actor information was last fetched/updated.
     */
    private Instant lastFetchedAt;

    /**
     * Creates a snapshot from a fetched actor.
     */
    public static RemoteActor fromPerson(Person person, Instant fetchedAt) {
        URI actorUri = person.getId();
        String username = person.getPreferredUsername().orElseGet(() -> {
            String path = actorUri == null || actorUri.getPath() == null ? "" : actorUri.getPath();
            return path.substring(path.lastIndexOf('/') + 1);
        });
        return RemoteActor.builder()
            .actorUri(actorUri)
            .username(username)
            .domain(actorUri != null ? actorUri.getHost() : null)
            .displayName(person.getName().orElse(null))
            .inboxUrl(person.getInboxId())
            .sharedInboxUrl(person.getSharedInboxId())
            .lastFetchedAt(fetchedAt)
            .build();
    }

    /**
     * Example: https://mastodon.social/users/alice -> alice@mastodon.social
     */
    public String getHandle() {
        return username + "@" + domain;
    }

    @Override
    public URI getId() {
        return actorUri;
    }

    @Override
    public URI getInboxId() {
        return inboxUrl;
    }

    @Override
    public URI getSharedInboxId() {
        return sharedInboxUrl;
    }
}
