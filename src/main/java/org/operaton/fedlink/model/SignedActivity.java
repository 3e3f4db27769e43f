package org.operaton.fedlink.model;

import org.operaton.fedlink.security.SenderKeyPair;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The output of the signing pipeline: the compacted, signed JSON document ready
 * to be posted, and the RSA key the transport signature has to be made with.
 *
 * @param activityId the id of the signed activity
 * @param document the compacted document including proofs and the Linked Data signature
 * @param rsaKey the first RSA key, or null if none was given
 * @param proofCount the number of integrity proofs attached
 */
public record SignedActivity(URI activityId, Map<String, Object> document, SenderKeyPair rsaKey, int proofCount) {

    public SignedActivity {
        document = Collections.unmodifiableMap(new LinkedHashMap<>(document));
    }

    public Optional<SenderKeyPair> getRsaKey() {
        return Optional.ofNullable(rsaKey);
    }

    public boolean hasLinkedDataSignature() {
        return document.containsKey("signature");
    }
}
