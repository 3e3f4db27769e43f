package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.Objects;

/**
 * One value held by a property of a {@link FederatedObject}.
 * Either a scalar, a fully materialized object, or an unresolved reference.
 */
public final class PropertyValue {

    public enum Kind {
        SCALAR,
        INLINE,
        REFERENCE
    }

    private final Kind kind;
    private final Object scalar;
    private final FederatedObject inline;
    private final URI reference;

    private PropertyValue(Kind kind, Object scalar, FederatedObject inline, URI reference) {
        this.kind = kind;
        this.scalar = scalar;
        this.inline = inline;
        this.reference = reference;
    }

    public static PropertyValue scalar(Object value) {
        return new PropertyValue(Kind.SCALAR, Objects.requireNonNull(value, "value"), null, null);
    }

    public static PropertyValue inline(FederatedObject object) {
        return new PropertyValue(Kind.INLINE, null, Objects.requireNonNull(object, "object"), null);
    }

    public static PropertyValue reference(URI url) {
        return new PropertyValue(Kind.REFERENCE, null, null, Objects.requireNonNull(url, "url"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    public boolean isInline() {
        return kind == Kind.INLINE;
    }

    public boolean isReference() {
        return kind == Kind.REFERENCE;
    }

    public Object getScalar() {
        return scalar;
    }

    public FederatedObject getInline() {
        return inline;
    }

    public URI getReference() {
        return reference;
    }

    /**
     * The URI this value points at without performing any I/O: the reference
     * itself, or the id of the inline object. Scalars have none.
     *
     * @return the URI, or null
     */
    public URI getId() {
        switch (kind) {
            case REFERENCE:
                return reference;
            case INLINE:
                return inline.getId();
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case REFERENCE:
                return "URL " + reference;
            case INLINE:
                return inline.toString();
            default:
                return String.valueOf(scalar);
        }
    }
}
