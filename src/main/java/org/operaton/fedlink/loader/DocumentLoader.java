package org.operaton.fedlink.loader;

import java.net.URI;

/**
 * Resolves a URL to a linked-data document.
 * Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface DocumentLoader {

    /**
     * Loads a document.
     *
     * @param url the document URL
     * @return the loaded document
     * @throws org.operaton.fedlink.exception.DocumentLoaderException if the document cannot be fetched or decoded
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted
     */
    RemoteDocument load(URI url);
}
