package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds objects for outbound sending.
 *
 * @param <T> the object class
 */
public class ObjectBuilder<T extends FederatedObject> {

    private final ObjectType<T> objectType;
    private final Map<String, List<PropertyValue>> properties = new LinkedHashMap<>();
    private String typeTag;
    private URI id;

    public ObjectBuilder(ObjectType<T> objectType) {
        this.objectType = objectType;
        this.typeTag = objectType.getTypeTags().get(0);
    }

    public ObjectBuilder<T> typeTag(String typeTag) {
        if (!objectType.getTypeTags().contains(typeTag)) {
            throw new IllegalArgumentException(objectType.getName() + " does not accept type " + typeTag);
        }
        this.typeTag = typeTag;
        return this;
    }

    public ObjectBuilder<T> id(URI id) {
        this.id = id;
        return this;
    }

    public ObjectBuilder<T> id(String id) {
        return id(URI.create(id));
    }

    public <V> ObjectBuilder<T> scalar(ScalarProperty<V> property, V value) {
        return add(property, PropertyValue.scalar(value));
    }

    public ObjectBuilder<T> reference(ResolvableProperty<?> property, URI url) {
        return add(property, PropertyValue.reference(url));
    }

    public ObjectBuilder<T> reference(ResolvableProperty<?> property, String url) {
        return reference(property, URI.create(url));
    }

    public <V extends FederatedObject> ObjectBuilder<T> inline(ResolvableProperty<V> property, V value) {
        return add(property, PropertyValue.inline(value));
    }

    private ObjectBuilder<T> add(PropertyDescriptor property, PropertyValue value) {
        properties.computeIfAbsent(property.getCompactName(), k -> new ArrayList<>()).add(value);
        return this;
    }

    public T build() {
        return objectType.create(typeTag, id, properties, null);
    }
}
