package org.operaton.fedlink.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.ActivityValidationException;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.model.SignedActivity;
import org.operaton.fedlink.model.vocab.Activity;
import org.operaton.fedlink.model.vocab.JsonLdFormat;
import org.operaton.fedlink.security.IntegrityProofSigner;
import org.operaton.fedlink.security.KeyAlgorithm;
import org.operaton.fedlink.security.KeyPurpose;
import org.operaton.fedlink.security.KeyValidator;
import org.operaton.fedlink.security.LinkedDataSigner;
import org.operaton.fedlink.security.SenderKeyPair;
import org.springframework.stereotype.Component;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an outbound activity into the signed document that is posted to inboxes.
 *
 * Order matters: integrity proofs are attached to the activity first, the
 * Linked Data signature then covers the compacted, proof-bearing document, and
 * the HTTP signature made at delivery time covers the final body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SigningPipeline {

    private final KeyValidator keyValidator;
    private final IntegrityProofSigner integrityProofSigner;
    private final LinkedDataSigner linkedDataSigner;
    private final Clock clock;

    /**
     * Signs an activity with every usable key.
     *
     * The first RSA key makes the Linked Data signature and is handed on for the
     * HTTP signature; every Ed25519 key adds one integrity proof. All keys are
     * validated before anything is signed.
     *
     * @param contextLoader the loader the JSON-LD contexts of the activity are read from
     *     when the Linked Data signature is made
     * @throws ActivityValidationException if the activity has no id or no actor, or no keys are given
     * @throws org.operaton.fedlink.exception.KeyValidationException if a key is not a private key of a supported algorithm
     */
    public SignedActivity sign(Activity activity, List<SenderKeyPair> keys, DocumentLoader contextLoader) {
        Objects.requireNonNull(contextLoader, "contextLoader");
        if (activity.getId() == null) {
            throw new ActivityValidationException("The activity to send must have an id.");
        }
        if (activity.size(Activity.ACTOR) == 0) {
            throw new ActivityValidationException("The activity to send must have at least one actor property.");
        }
        if (keys == null || keys.isEmpty()) {
            throw new ActivityValidationException("The keys must not be empty.");
        }

        List<KeyAlgorithm> algorithms = new ArrayList<>(keys.size());
        for (SenderKeyPair key : keys) {
            algorithms.add(keyValidator.validate(key.privateKey(), KeyPurpose.PRIVATE));
        }

        Instant now = clock.instant();
        SenderKeyPair rsaKey = null;
        Activity signed = activity;
        int proofCount = 0;
        for (int i = 0; i < keys.size(); i++) {
            SenderKeyPair key = keys.get(i);
            switch (algorithms.get(i)) {
                case RSASSA_PKCS1_V1_5:
                    if (rsaKey == null) {
                        rsaKey = key;
                    } else {
                        log.debug("Ignoring additional RSA key {}", key.keyId());
                    }
                    break;
                case ED25519:
                    signed = integrityProofSigner.sign(signed, (PrivateKey) key.privateKey(), key.keyId(), now);
                    proofCount++;
                    break;
                default:
                    log.debug("Key {} ({}) is not used by any signature scheme", key.keyId(), algorithms.get(i));
            }
        }

        if (proofCount == 0) {
            log.warn("No supported key found to create a proof for the activity {}. "
                + "The activity will be sent without a proof. "
                + "In order to create a proof, at least one Ed25519 key must be provided.", activity.getId());
        }

        Map<String, Object> document = signed.toJsonLd(JsonLdFormat.COMPACT);
        if (rsaKey != null) {
            document = linkedDataSigner.sign(document, (PrivateKey) rsaKey.privateKey(), rsaKey.keyId(), now,
                contextLoader);
        } else {
            log.warn("No supported key found to create a Linked Data signature for the activity {}. "
                + "The activity will be sent without a Linked Data signature. "
                + "In order to create a Linked Data signature, at least one RSASSA-PKCS1-v1_5 key must be provided.",
                activity.getId());
        }

        log.info("Signed activity {} ({} proofs, Linked Data signature: {})",
            activity.getId(), proofCount, rsaKey != null);
        return new SignedActivity(activity.getId(), document, rsaKey, proofCount);
    }
}
