package org.operaton.fedlink.resolve;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.DocumentLoaderException;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.model.vocab.DefaultObjectType;
import org.operaton.fedlink.model.vocab.FederatedObject;
import org.operaton.fedlink.model.vocab.ObjectType;
import org.operaton.fedlink.model.vocab.PropertyValue;
import org.operaton.fedlink.model.vocab.ResolvableProperty;
import org.operaton.fedlink.model.vocab.Vocabulary;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Lazily dereferences remote references held by federated objects.
 *
 * A resolved reference is written back into its slot as an inline object, so the
 * next access needs no I/O. The write only happens if the slot still holds the
 * reference the resolution started from; concurrent resolutions of the same
 * slot may both fetch, and callers that need exactly-once fetching must
 * serialize their calls.
 */
@Component
@Slf4j
public class ReferenceResolver {

    static final String LOOKUP_OBSERVATION = "activitypub.lookup_object";

    private final DocumentLoader defaultDocumentLoader;
    private final ObservationRegistry observationRegistry;

    public ReferenceResolver(DocumentLoader documentLoader, ObservationRegistry observationRegistry) {
        this.defaultDocumentLoader = documentLoader;
        this.observationRegistry = observationRegistry;
    }

    /**
     * Resolves the first value of a property.
     *
     * @return the resolved object, or empty if the property is empty or a suppressed failure occurred
     */
    public <V extends FederatedObject> Optional<V> resolveOne(FederatedObject owner, ResolvableProperty<V> property,
                                                            ResolveOptions options) {
        if (owner.size(property) < 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolveSlot(owner, property, 0, options));
    }

    /**
     * Resolves all values of a property lazily, in slot order. Every iteration starts
     * over from the first slot; already resolved slots are served from memory.
     * Entries whose resolution failed with a suppressed error are skipped.
     */
    public <V extends FederatedObject> Iterable<V> resolveAll(FederatedObject owner, ResolvableProperty<V> property,
                                                            ResolveOptions options) {
        return () -> new Iterator<>() {
            private int index;
            private V next;

            @Override
            public boolean hasNext() {
                while (next == null && index < owner.size(property)) {
                    next = resolveSlot(owner, property, index++, options);
                }
                return next != null;
            }

            @Override
            public V next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                V value = next;
                next = null;
                return value;
            }
        };
    }

    /**
     * Fetches an arbitrary URL and parses it against every known type.
     */
    public Optional<FederatedObject> lookupObject(URI url, ResolveOptions options) {
        return Optional.ofNullable(lookup(url, Vocabulary.allTypes(), null, options));
    }

    @SuppressWarnings("unchecked")
    private <V extends FederatedObject> V resolveSlot(FederatedObject owner, ResolvableProperty<V> property,
                                                     int index, ResolveOptions options) {
        PropertyValue value = owner.getSlot(property, index);
        if (value.isInline()) {
            return (V) value.getInline();
        }

        Map<String, Object> embedded = embeddedDocument(owner, property, index);
        V resolved = lookup(value.getReference(), property.getRange(), embedded, options);
        if (resolved == null) {
            return null;
        }
        if (!owner.replaceSlot(property, index, value, PropertyValue.inline(resolved))) {
            log.debug("Slot {}[{}] of {} was already replaced by a concurrent resolution", property, index, owner.getId());
        }
        return resolved;
    }

    /**
     * Finds the embedded document for a slot in the owner's retained source document.
     * Only documents carrying their own {@code @context} qualify.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> embeddedDocument(FederatedObject owner, ResolvableProperty<?> property, int index) {
        Map<String, Object> source = owner.getSourceDocument().orElse(null);
        if (source == null) {
            return null;
        }
        Object raw = source.get(property.getCompactName());
        Object candidate;
        if (raw instanceof List) {
            List<?> list = (List<?>) raw;
            candidate = index < list.size() ? list.get(index) : null;
        } else {
            candidate = index == 0 ? raw : null;
        }
        if (candidate instanceof Map && ((Map<String, Object>) candidate).containsKey("@context")) {
            return (Map<String, Object>) candidate;
        }
        return null;
    }

    private <V extends FederatedObject> V lookup(URI url, List<? extends ObjectType<? extends V>> candidates,
                                                Map<String, Object> embedded, ResolveOptions options) {
        ResolveOptions effective = options != null ? options : ResolveOptions.defaults();
        DocumentLoader loader = effective.getDocumentLoader() != null
            ? effective.getDocumentLoader()
            : defaultDocumentLoader;

        Observation observation = Observation.createNotStarted(LOOKUP_OBSERVATION, observationRegistry)
            .highCardinalityKeyValue("activitypub.object.url", url.toString())
            .start();
        try {
            Map<String, Object> document;
            if (embedded != null) {
                log.debug("Using embedded document for {}", url);
                document = embedded;
            } else {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Resolution of " + url + " was cancelled");
                }
                document = loader.load(url).document();
            }

            V object = DefaultObjectType.parseCandidates(candidates, document);
            URI objectId = object.getId() != null ? object.getId() : url;
            observation.highCardinalityKeyValue("activitypub.object.id", objectId.toString());
            observation.lowCardinalityKeyValue("activitypub.object.type",
                object.getObjectType().getTypeIri(object.getTypeTag()).toString());
            log.info("Resolved {} to {}", url, object);
            return object;

        } catch (CancellationException e) {
            observation.error(e);
            throw e;
        } catch (RuntimeException e) {
            observation.error(e);
            if (effective.isSuppressError()) {
                log.error("Failed to {} {}: {}",
                    e instanceof DocumentLoaderException ? "fetch" : "parse", url, e.getMessage());
                return null;
            }
            throw e;
        } finally {
            observation.stop();
        }
    }
}
