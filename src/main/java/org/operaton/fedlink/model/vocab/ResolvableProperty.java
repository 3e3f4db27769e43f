package org.operaton.fedlink.model.vocab;

import java.util.List;
import java.util.function.Supplier;

/**
 * A property whose values may be inline objects or remote references.
 * The candidate types are tried in declared order when a value is parsed or resolved.
 * The range is supplied lazily because types may refer to each other.
 *
 * @param <V> the common supertype of every candidate type
 */
public final class ResolvableProperty<V extends FederatedObject> extends PropertyDescriptor {

    private final Supplier<List<ObjectType<? extends V>>> range;

    private ResolvableProperty(String compactName, String iri, boolean functional,
                               Supplier<List<ObjectType<? extends V>>> range) {
        super(compactName, iri, functional);
        this.range = range;
    }

    public static <V extends FederatedObject> ResolvableProperty<V> functional(
            String compactName, String iri, Supplier<List<ObjectType<? extends V>>> range) {
        return new ResolvableProperty<>(compactName, iri, true, range);
    }

    public static <V extends FederatedObject> ResolvableProperty<V> plural(
            String compactName, String iri, Supplier<List<ObjectType<? extends V>>> range) {
        return new ResolvableProperty<>(compactName, iri, false, range);
    }

    /**
     * @return the candidate types in priority order
     */
    public List<ObjectType<? extends V>> getRange() {
        return range.get();
    }

    @Override
    public boolean isResolvable() {
        return true;
    }
}
