package org.operaton.fedlink.model.vocab;

import java.util.Objects;

/**
 * Outcome of parsing a document against one candidate type.
 * A mismatch is an expected outcome that lets the caller try the next candidate;
 * real failures are thrown instead.
 *
 * @param <T> the parsed object type
 */
public final class ParseResult<T> {

    private final T value;
    private final String mismatchReason;

    private ParseResult(T value, String mismatchReason) {
        this.value = value;
        this.mismatchReason = mismatchReason;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> mismatch(String reason) {
        return new ParseResult<>(null, reason);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public T getValue() {
        if (value == null) {
            throw new IllegalStateException("No value for a mismatched parse: " + mismatchReason);
        }
        return value;
    }

    public String getMismatchReason() {
        return mismatchReason;
    }
}
