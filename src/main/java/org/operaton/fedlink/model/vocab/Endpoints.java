package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code endpoints} value of an actor. Only the shared inbox is kept.
 */
public record Endpoints(URI sharedInbox) {

    public static final ScalarCodec<Endpoints> CODEC = new ScalarCodec<>(
        json -> {
            if (!(json instanceof Map)) {
                return null;
            }
            Object sharedInbox = ((Map<?, ?>) json).get("sharedInbox");
            if (sharedInbox != null && !(sharedInbox instanceof String)) {
                return null;
            }
            return new Endpoints(sharedInbox == null ? null : URI.create((String) sharedInbox));
        },
        endpoints -> {
            Map<String, Object> json = new LinkedHashMap<>();
            if (endpoints.sharedInbox() != null) {
                json.put("sharedInbox", endpoints.sharedInbox().toString());
            }
            return json;
        }
    );
}
