package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A candidate type: parses compacted documents into instances and serializes
 * instances back into linked-data documents.
 *
 * @param <T> the object class
 */
public interface ObjectType<T extends FederatedObject> {

    /**
     * @return the short type name, e.g. {@code Note}
     */
    String getName();

    /**
     * @param typeTag one of the accepted type tags
     * @return the full IRI of that type
     */
    URI getTypeIri(String typeTag);

    /**
     * @return the type tags this type accepts, the first one being the default
     */
    List<String> getTypeTags();

    List<PropertyDescriptor> getProperties();

    Optional<PropertyDescriptor> findProperty(String compactName);

    /**
     * Parses a compacted document.
     *
     * @param document the document
     * @return the instance, or a mismatch if the document is not of this type
     * @throws RuntimeException if the document has this type but is malformed
     */
    ParseResult<T> parse(Map<String, Object> document);

    /**
     * Serializes an instance.
     *
     * @param instance the instance
     * @param format compact or expanded form
     * @return the document; compact documents carry a top-level {@code @context}
     */
    Map<String, Object> serialize(T instance, JsonLdFormat format);

    /**
     * Creates an instance from validated state.
     *
     * @throws IllegalArgumentException if a property is unknown, over-filled or holds the wrong kind of value
     */
    T create(String typeTag, URI id, Map<String, List<PropertyValue>> properties, Map<String, Object> sourceDocument);

    default ObjectBuilder<T> builder() {
        return new ObjectBuilder<>(this);
    }
}
