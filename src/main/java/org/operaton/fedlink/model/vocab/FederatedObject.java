package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * A typed, property-bearing node of the federated object graph.
 *
 * Every property is stored as an index-addressed array of slots, also for
 * functional properties (length 0 or 1). The set of slots is fixed at
 * construction; only the content of a slot can change, and only through
 * {@link #replaceSlot}, which the reference resolver uses to memoize resolved
 * references. Everything else produces new snapshots.
 */
public abstract class FederatedObject {

    private final ObjectType<?> objectType;
    private final String typeTag;
    private final URI id;
    private final Map<String, AtomicReferenceArray<PropertyValue>> slots;
    private final Map<String, Object> sourceDocument;

    protected FederatedObject(ObjectState state) {
        this.objectType = state.objectType();
        this.typeTag = state.typeTag();
        this.id = state.id();
        Map<String, AtomicReferenceArray<PropertyValue>> copy = new LinkedHashMap<>();
        state.properties().forEach((name, values) ->
            copy.put(name, new AtomicReferenceArray<>(values.toArray(new PropertyValue[0]))));
        this.slots = Collections.unmodifiableMap(copy);
        this.sourceDocument = state.sourceDocument() == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(state.sourceDocument()));
    }

    /**
     * @return the identity of this object, or null for anonymous objects
     */
    public URI getId() {
        return id;
    }

    /**
     * @return the concrete type tag, e.g. {@code Create} for an activity
     */
    public String getTypeTag() {
        return typeTag;
    }

    public ObjectType<?> getObjectType() {
        return objectType;
    }

    /**
     * @return the compacted document this object was parsed from, if it was parsed from one
     */
    public Optional<Map<String, Object>> getSourceDocument() {
        return Optional.ofNullable(sourceDocument);
    }

    // Raw slot access

    public int size(PropertyDescriptor property) {
        AtomicReferenceArray<PropertyValue> values = slots.get(property.getCompactName());
        return values == null ? 0 : values.length();
    }

    public PropertyValue getSlot(PropertyDescriptor property, int index) {
        AtomicReferenceArray<PropertyValue> values = slots.get(property.getCompactName());
        if (values == null || index < 0 || index >= values.length()) {
            throw new IndexOutOfBoundsException(property + "[" + index + "]");
        }
        return values.get(index);
    }

    /**
     * @return a snapshot of the current slot contents in order
     */
    public List<PropertyValue> getValues(PropertyDescriptor property) {
        AtomicReferenceArray<PropertyValue> values = slots.get(property.getCompactName());
        if (values == null) {
            return List.of();
        }
        List<PropertyValue> snapshot = new ArrayList<>(values.length());
        for (int i = 0; i < values.length(); i++) {
            snapshot.add(values.get(i));
        }
        return snapshot;
    }

    /**
     * Replaces the content of a slot if it still holds {@code expected}.
     *
     * @return true if the slot was updated
     */
    public boolean replaceSlot(PropertyDescriptor property, int index, PropertyValue expected,
                               PropertyValue replacement) {
        AtomicReferenceArray<PropertyValue> values = slots.get(property.getCompactName());
        if (values == null || index < 0 || index >= values.length()) {
            return false;
        }
        return values.compareAndSet(index, expected, replacement);
    }

    // Scalar accessors

    @SuppressWarnings("unchecked")
    public <V> Optional<V> getScalar(ScalarProperty<V> property) {
        if (size(property) < 1) {
            return Optional.empty();
        }
        return Optional.of((V) getSlot(property, 0).getScalar());
    }

    @SuppressWarnings("unchecked")
    public <V> List<V> getScalars(ScalarProperty<V> property) {
        List<V> result = new ArrayList<>();
        for (PropertyValue value : getValues(property)) {
            result.add((V) value.getScalar());
        }
        return result;
    }

    // Identity accessors, never perform I/O

    /**
     * @return the URI of the first value of the property, or null if there is none
     */
    public URI getReferenceId(ResolvableProperty<?> property) {
        if (size(property) < 1) {
            return null;
        }
        return getSlot(property, 0).getId();
    }

    /**
     * @return the URIs of all values; inline objects without an id are left out
     */
    public List<URI> getReferenceIds(ResolvableProperty<?> property) {
        List<URI> ids = new ArrayList<>();
        for (PropertyValue value : getValues(property)) {
            URI valueId = value.getId();
            if (valueId != null) {
                ids.add(valueId);
            }
        }
        return ids;
    }

    // Snapshots

    /**
     * Returns a copy of this object with one more value appended to a property.
     * The copy does not retain the source document, since it no longer describes it.
     */
    public FederatedObject withAdded(PropertyDescriptor property, PropertyValue value) {
        Map<String, List<PropertyValue>> properties = copyProperties();
        properties.computeIfAbsent(property.getCompactName(), k -> new ArrayList<>()).add(value);
        return objectType.create(typeTag, id, properties, null);
    }

    /**
     * Returns a copy of this object without any value for the property.
     */
    public FederatedObject without(PropertyDescriptor property) {
        Map<String, List<PropertyValue>> properties = copyProperties();
        properties.remove(property.getCompactName());
        return objectType.create(typeTag, id, properties, null);
    }

    private Map<String, List<PropertyValue>> copyProperties() {
        Map<String, List<PropertyValue>> properties = new LinkedHashMap<>();
        for (String name : slots.keySet()) {
            AtomicReferenceArray<PropertyValue> values = slots.get(name);
            List<PropertyValue> list = new ArrayList<>(values.length());
            for (int i = 0; i < values.length(); i++) {
                list.add(values.get(i));
            }
            properties.put(name, list);
        }
        return properties;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toJsonLd(JsonLdFormat format) {
        return ((ObjectType<FederatedObject>) objectType).serialize(this, format);
    }

    @Override
    public String toString() {
        return typeTag + (id != null ? " " + id : "") + " " + slots.keySet();
    }
}
