package org.operaton.fedlink.resolve;

import lombok.Builder;
import lombok.Getter;
import org.operaton.fedlink.loader.DocumentLoader;

/**
 * Per-call options for resolving references.
 */
@Getter
@Builder
public class ResolveOptions {

    private static final ResolveOptions DEFAULTS = ResolveOptions.builder().build();

    /**
     * Loader to use instead of the resolver's default one; null keeps the default.
     */
    private final DocumentLoader documentLoader;

    /**
     * If true, fetch and parse failures are logged and yield nothing instead of
     * being thrown. Cancellation is never suppressed.
     */
    private final boolean suppressError;

    public static ResolveOptions defaults() {
        return DEFAULTS;
    }
}
