package org.operaton.fedlink.model.vocab;

/**
 * A property whose values are always stored and returned directly.
 *
 * @param <V> the Java value type
 */
public final class ScalarProperty<V> extends PropertyDescriptor {

    private final ScalarCodec<V> codec;

    private ScalarProperty(String compactName, String iri, boolean functional, ScalarCodec<V> codec) {
        super(compactName, iri, functional);
        this.codec = codec;
    }

    public static <V> ScalarProperty<V> functional(String compactName, String iri, ScalarCodec<V> codec) {
        return new ScalarProperty<>(compactName, iri, true, codec);
    }

    public static <V> ScalarProperty<V> plural(String compactName, String iri, ScalarCodec<V> codec) {
        return new ScalarProperty<>(compactName, iri, false, codec);
    }

    public ScalarCodec<V> getCodec() {
        return codec;
    }

    @Override
    public boolean isResolvable() {
        return false;
    }
}
