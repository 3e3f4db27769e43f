package org.operaton.fedlink.model.vocab;

import java.util.List;

/**
 * Namespaces, contexts and the registry of all object types known to this runtime.
 */
public final class Vocabulary {

    public static final String ACTIVITYSTREAMS_CONTEXT = "https://www.w3.org/ns/activitystreams";
    public static final String SECURITY_V1_CONTEXT = "https://w3id.org/security/v1";
    public static final String DATA_INTEGRITY_CONTEXT = "https://w3id.org/security/data-integrity/v1";

    public static final String AS = ACTIVITYSTREAMS_CONTEXT + "#";
    public static final String LDP = "http://www.w3.org/ns/ldp#";
    public static final String SECURITY = "https://w3id.org/security#";

    public static final String PUBLIC_COLLECTION = AS + "Public";

    public static final List<Object> DEFAULT_CONTEXT = List.of(
        ACTIVITYSTREAMS_CONTEXT,
        SECURITY_V1_CONTEXT,
        DATA_INTEGRITY_CONTEXT
    );

    private Vocabulary() {
    }

    /**
     * @return every known type, in the order an unknown document is tried against them
     */
    public static List<ObjectType<? extends FederatedObject>> allTypes() {
        return List.of(Activity.TYPE, Note.TYPE, Person.TYPE, OrderedCollection.TYPE, DataIntegrityProof.TYPE);
    }
}
