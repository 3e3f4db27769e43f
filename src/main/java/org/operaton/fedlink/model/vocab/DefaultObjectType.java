package org.operaton.fedlink.model.vocab;

import org.operaton.fedlink.exception.TypeMismatchException;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Table-driven {@link ObjectType}: the properties, the accepted type tags and a
 * constructor are all it needs to parse and serialize an object class.
 *
 * Embedded objects that carry their own {@code @context} and an id are kept as
 * references when parsing; the reference resolver later parses them from the
 * retained source document without going to the network.
 *
 * @param <T> the object class
 */
public class DefaultObjectType<T extends FederatedObject> implements ObjectType<T> {

    private static final String XSD_DATE_TIME = "http://www.w3.org/2001/XMLSchema#dateTime";

    private final String name;
    private final String namespace;
    private final List<String> typeTags;
    private final List<PropertyDescriptor> properties;
    private final Function<ObjectState, T> factory;

    public DefaultObjectType(String name, String namespace, List<String> typeTags,
                             List<PropertyDescriptor> properties, Function<ObjectState, T> factory) {
        this.name = name;
        this.namespace = namespace;
        this.typeTags = List.copyOf(typeTags);
        this.properties = List.copyOf(properties);
        this.factory = factory;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public URI getTypeIri(String typeTag) {
        return URI.create(namespace + typeTag);
    }

    @Override
    public List<String> getTypeTags() {
        return typeTags;
    }

    @Override
    public List<PropertyDescriptor> getProperties() {
        return properties;
    }

    @Override
    public Optional<PropertyDescriptor> findProperty(String compactName) {
        return properties.stream()
            .filter(p -> p.getCompactName().equals(compactName))
            .findFirst();
    }

    // ==================== Parsing ====================

    @Override
    public ParseResult<T> parse(Map<String, Object> document) {
        String typeTag = matchTypeTag(document.containsKey("type") ? document.get("type") : document.get("@type"));
        if (typeTag == null) {
            return ParseResult.mismatch("Expected one of " + typeTags + " but got " + document.get("type"));
        }

        Object rawId = document.containsKey("id") ? document.get("id") : document.get("@id");
        URI id = null;
        if (rawId != null) {
            if (!(rawId instanceof String)) {
                return ParseResult.mismatch("The id of a " + name + " must be a string");
            }
            id = URI.create((String) rawId);
        }

        Map<String, List<PropertyValue>> values = new LinkedHashMap<>();
        for (PropertyDescriptor property : properties) {
            Object raw = document.get(property.getCompactName());
            if (raw == null) {
                continue;
            }
            List<?> items = raw instanceof List ? (List<?>) raw : List.of(raw);
            if (property.isFunctional() && items.size() > 1) {
                items = items.subList(0, 1);
            }
            List<PropertyValue> parsed = new ArrayList<>(items.size());
            for (Object item : items) {
                PropertyValue value = property.isResolvable()
                    ? parseResolvable((ResolvableProperty<?>) property, item)
                    : parseScalar((ScalarProperty<?>) property, item);
                if (value == null) {
                    return ParseResult.mismatch("Invalid value for property " + property + " of " + name + ": " + item);
                }
                parsed.add(value);
            }
            values.put(property.getCompactName(), parsed);
        }

        Map<String, Object> source = document.containsKey("@context") ? document : null;
        return ParseResult.success(create(typeTag, id, values, source));
    }

    private String matchTypeTag(Object rawType) {
        List<?> candidates = rawType instanceof List ? (List<?>) rawType : rawType == null ? List.of() : List.of(rawType);
        for (Object candidate : candidates) {
            if (!(candidate instanceof String)) {
                continue;
            }
            String tag = (String) candidate;
            if (tag.startsWith(namespace)) {
                tag = tag.substring(namespace.length());
            }
            if (typeTags.contains(tag)) {
                return tag;
            }
        }
        return null;
    }

    private PropertyValue parseScalar(ScalarProperty<?> property, Object item) {
        Object decoded = property.getCodec().decode(item);
        return decoded == null ? null : PropertyValue.scalar(decoded);
    }

    @SuppressWarnings("unchecked")
    private PropertyValue parseResolvable(ResolvableProperty<?> property, Object item) {
        if (item instanceof String) {
            return PropertyValue.reference(URI.create((String) item));
        }
        if (!(item instanceof Map)) {
            return null;
        }
        Map<String, Object> embedded = (Map<String, Object>) item;
        Object embeddedId = embedded.containsKey("id") ? embedded.get("id") : embedded.get("@id");
        boolean linkOnly = embeddedId instanceof String && embedded.keySet().stream()
            .allMatch(key -> key.equals("id") || key.equals("@id"));
        if (embeddedId instanceof String && (linkOnly || embedded.containsKey("@context"))) {
            return PropertyValue.reference(URI.create((String) embeddedId));
        }
        return PropertyValue.inline(parseCandidates(property, embedded));
    }

    /**
     * Parses a document against every candidate type of a property in declared order.
     *
     * @throws TypeMismatchException if no candidate matches
     */
    public static <V extends FederatedObject> V parseCandidates(ResolvableProperty<V> property,
                                                               Map<String, Object> document) {
        return parseCandidates(property.getRange(), document);
    }

    /**
     * Parses a document against the candidate types in order.
     *
     * @throws TypeMismatchException if no candidate matches
     */
    public static <V extends FederatedObject> V parseCandidates(List<? extends ObjectType<? extends V>> candidates,
                                                               Map<String, Object> document) {
        List<String> attempted = new ArrayList<>();
        for (ObjectType<? extends V> candidate : candidates) {
            ParseResult<? extends V> result = candidate.parse(document);
            if (result.isSuccess()) {
                return result.getValue();
            }
            attempted.add(candidate.getName());
        }
        throw new TypeMismatchException(attempted);
    }

    // ==================== Construction ====================

    @Override
    public T create(String typeTag, URI id, Map<String, List<PropertyValue>> values,
                    Map<String, Object> sourceDocument) {
        if (!typeTags.contains(typeTag)) {
            throw new IllegalArgumentException(name + " does not accept type " + typeTag);
        }
        Map<String, List<PropertyValue>> checked = new LinkedHashMap<>();
        for (Map.Entry<String, List<PropertyValue>> entry : values.entrySet()) {
            PropertyDescriptor property = findProperty(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException(name + " has no property " + entry.getKey()));
            List<PropertyValue> list = entry.getValue();
            if (property.isFunctional() && list.size() > 1) {
                throw new IllegalArgumentException("Functional property " + property + " holds " + list.size() + " values");
            }
            for (PropertyValue value : list) {
                if (property.isResolvable() == value.isScalar()) {
                    throw new IllegalArgumentException("Property " + property + " cannot hold a " + value.getKind() + " value");
                }
            }
            if (!list.isEmpty()) {
                checked.put(property.getCompactName(), List.copyOf(list));
            }
        }
        return factory.apply(new ObjectState(this, typeTag, id, checked, sourceDocument));
    }

    // ==================== Serialization ====================

    @Override
    public Map<String, Object> serialize(T instance, JsonLdFormat format) {
        if (format == JsonLdFormat.EXPAND) {
            return expand(instance);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("@context", Vocabulary.DEFAULT_CONTEXT);
        document.putAll(compactBody(instance));
        return document;
    }

    private Map<String, Object> compactBody(FederatedObject instance) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (instance.getId() != null) {
            document.put("id", instance.getId().toString());
        }
        document.put("type", instance.getTypeTag());
        for (PropertyDescriptor property : properties) {
            List<PropertyValue> values = instance.getValues(property);
            if (values.isEmpty()) {
                continue;
            }
            List<Object> json = new ArrayList<>(values.size());
            for (PropertyValue value : values) {
                json.add(compactValue(property, value));
            }
            document.put(property.getCompactName(), json.size() == 1 ? json.get(0) : json);
        }
        return document;
    }

    @SuppressWarnings("unchecked")
    private Object compactValue(PropertyDescriptor property, PropertyValue value) {
        switch (value.getKind()) {
            case REFERENCE:
                return value.getReference().toString();
            case INLINE:
                Map<String, Object> nested = new LinkedHashMap<>(value.getInline().toJsonLd(JsonLdFormat.COMPACT));
                nested.remove("@context");
                return nested;
            default:
                return ((ScalarProperty<Object>) property).getCodec().encode(value.getScalar());
        }
    }

    private Map<String, Object> expand(FederatedObject instance) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (instance.getId() != null) {
            document.put("@id", instance.getId().toString());
        }
        document.put("@type", List.of(getTypeIri(instance.getTypeTag()).toString()));
        for (PropertyDescriptor property : properties) {
            List<PropertyValue> values = instance.getValues(property);
            if (values.isEmpty()) {
                continue;
            }
            List<Object> json = new ArrayList<>(values.size());
            for (PropertyValue value : values) {
                json.add(expandValue(property, value));
            }
            document.put(property.getIri(), json);
        }
        return document;
    }

    @SuppressWarnings("unchecked")
    private Object expandValue(PropertyDescriptor property, PropertyValue value) {
        switch (value.getKind()) {
            case REFERENCE:
                return Map.of("@id", value.getReference().toString());
            case INLINE:
                return value.getInline().toJsonLd(JsonLdFormat.EXPAND);
            default:
                ScalarProperty<Object> scalar = (ScalarProperty<Object>) property;
                Object encoded = scalar.getCodec().encode(value.getScalar());
                if (scalar.getCodec() == (Object) ScalarCodec.DATE_TIME) {
                    return Map.of("@type", XSD_DATE_TIME, "@value", encoded);
                }
                if (scalar.getCodec() == (Object) ScalarCodec.URI_VALUE) {
                    return Map.of("@id", encoded);
                }
                return Map.of("@value", encoded);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
