package org.operaton.fedlink.loader;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A loaded document.
 *
 * @param documentUrl the URL the document was finally served from
 * @param contextUrl the context advertised through a {@code Link} header, or null
 * @param document the parsed JSON document
 */
public record RemoteDocument(URI documentUrl, URI contextUrl, Map<String, Object> document) {

    public RemoteDocument {
        Objects.requireNonNull(documentUrl, "documentUrl");
        Objects.requireNonNull(document, "document");
    }
}
