package org.operaton.fedlink.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.model.RemoteActor;
import org.operaton.fedlink.model.SignedActivity;
import org.operaton.fedlink.model.vocab.Activity;
import org.operaton.fedlink.model.vocab.FederatedObject;
import org.operaton.fedlink.model.vocab.Person;
import org.operaton.fedlink.model.vocab.Recipient;
import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;
import org.operaton.fedlink.security.SenderKeyPair;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Service for ActivityPub federation operations.
 * Handles outbound activities and remote object lookups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FederationService {

    private final SigningPipeline signingPipeline;
    private final InboxTargetResolver inboxTargetResolver;
    private final DeliveryTransport deliveryTransport;
    private final ReferenceResolver referenceResolver;
    private final DocumentLoader documentLoader;
    private final Clock clock;

    /**
     * Signs an activity once and delivers it to the inboxes of all recipients.
     *
     * Validation and signing failures are thrown right away. Delivery failures
     * complete the returned future exceptionally; the other deliveries go on.
     *
     * @return a future that completes when every delivery has completed
     */
    public CompletableFuture<Void> sendActivity(Activity activity, List<SenderKeyPair> keys,
                                                List<? extends Recipient> recipients, SendOptions options) {
        SendOptions effective = options != null ? options : SendOptions.defaults();
        DocumentLoader contextLoader = effective.getContextLoader() != null
            ? effective.getContextLoader()
            : documentLoader;
        SignedActivity signed = signingPipeline.sign(activity, keys, contextLoader);
        Map<String, Set<URI>> inboxes = inboxTargetResolver.extractInboxes(
            recipients, effective.isPreferSharedInbox(), effective.getExcludeBaseUris());

        log.info("Sending activity {} to {} inboxes", activity.getId(), inboxes.size());

        List<CompletableFuture<Void>> deliveries = new ArrayList<>(inboxes.size());
        for (Map.Entry<String, Set<URI>> inbox : inboxes.entrySet()) {
            log.debug("Delivering {} to {} for {}", activity.getId(), inbox.getKey(), inbox.getValue());
            CompletableFuture<Void> delivery;
            try {
                delivery = deliveryTransport.deliverAsync(signed, URI.create(inbox.getKey()), effective.getHeaders());
            } catch (RuntimeException e) {
                delivery = CompletableFuture.failedFuture(e);
            }
            deliveries.add(delivery);
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
    }

    /**
     * Fetches any ActivityPub object by its URL.
     */
    public Optional<FederatedObject> lookupObject(URI url, ResolveOptions options) {
        return referenceResolver.lookupObject(url, options);
    }

    /**
     * Fetch a remote actor's information.
     *
     * @param actorUri the actor's URI
     * @return the actor snapshot, or empty if the URL does not point to an actor
     *     or fetching failed with errors suppressed
     */
    public Optional<RemoteActor> fetchRemoteActor(URI actorUri, ResolveOptions options) {
        log.info("Fetching remote actor: {}", actorUri);
        return lookupObject(actorUri, options)
            .filter(Person.class::isInstance)
            .map(person -> RemoteActor.fromPerson((Person) person, clock.instant()));
    }
}
