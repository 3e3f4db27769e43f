package org.operaton.fedlink.model.vocab;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

/**
 * Converts a scalar property value between its JSON form and its Java form.
 * A decoder returns null when the JSON value has the wrong shape, which the
 * parser reports as a type mismatch.
 *
 * @param <V> the Java value type
 */
public final class ScalarCodec<V> {

    public static final ScalarCodec<String> STRING = new ScalarCodec<>(
        json -> json instanceof String ? (String) json : null,
        value -> value
    );

    public static final ScalarCodec<URI> URI_VALUE = new ScalarCodec<>(
        json -> {
            if (!(json instanceof String)) {
                return null;
            }
            try {
                return URI.create((String) json);
            } catch (IllegalArgumentException e) {
                return null;
            }
        },
        URI::toString
    );

    public static final ScalarCodec<Instant> DATE_TIME = new ScalarCodec<>(
        json -> {
            if (!(json instanceof String)) {
                return null;
            }
            try {
                return Instant.parse((String) json);
            } catch (DateTimeParseException e) {
                return null;
            }
        },
        Instant::toString
    );

    /**
     * Counts and other integral values. Fractions and numbers out of
     * the {@code long} range do not decode.
     */
    public static final ScalarCodec<Long> INTEGER = new ScalarCodec<>(
        json -> {
            if (!(json instanceof Number)) {
                return null;
            }
            try {
                return new BigDecimal(json.toString()).longValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                return null;
            }
        },
        value -> value
    );

    private final Function<Object, V> decoder;
    private final Function<V, Object> encoder;

    public ScalarCodec(Function<Object, V> decoder, Function<V, Object> encoder) {
        this.decoder = decoder;
        this.encoder = encoder;
    }

    public V decode(Object json) {
        return json == null ? null : decoder.apply(json);
    }

    public Object encode(V value) {
        return encoder.apply(value);
    }
}
