package org.operaton.fedlink.model.vocab;

/**
 * Shapes a {@link FederatedObject} can be serialized into.
 */
public enum JsonLdFormat {
    /** Short property names and a top-level {@code @context}. */
    COMPACT,
    /** Full IRIs, {@code @id}/{@code @type} keywords and value objects. */
    EXPAND
}
