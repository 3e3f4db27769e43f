package org.operaton.fedlink.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.SigningException;
import org.operaton.fedlink.model.vocab.Activity;
import org.operaton.fedlink.model.vocab.DataIntegrityProof;
import org.operaton.fedlink.model.vocab.JsonLdFormat;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates and verifies {@code eddsa-jcs-2022} Data Integrity proofs (FEP-8b32).
 *
 * The signature covers SHA-256 of the canonical proof configuration followed by
 * SHA-256 of the canonical document without any proof. Every proof is computed
 * over the same proof-less document, so proofs can be added in any order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntegrityProofSigner {

    public static final String CRYPTOSUITE = "eddsa-jcs-2022";
    public static final String PROOF_PURPOSE = "assertionMethod";

    private final JsonCanonicalizer canonicalizer;

    /**
     * @return a copy of the activity with one more proof made by the key
     */
    public Activity sign(Activity activity, PrivateKey privateKey, URI keyId, Instant created) {
        return activity.withProof(createProof(activity, privateKey, keyId, created));
    }

    public DataIntegrityProof createProof(Activity activity, PrivateKey privateKey, URI keyId, Instant created) {
        Instant createdAt = created.truncatedTo(ChronoUnit.SECONDS);
        Map<String, Object> unsecured = activity.withoutProofs().toJsonLd(JsonLdFormat.COMPACT);
        Map<String, Object> proofConfig = proofConfig(unsecured.get("@context"), keyId.toString(),
            PROOF_PURPOSE, createdAt.toString());

        byte[] signature;
        try {
            Signature sig = Signature.getInstance("Ed25519");
            sig.initSign(privateKey);
            sig.update(hashData(proofConfig, unsecured));
            signature = sig.sign();
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to create integrity proof", e);
        }

        log.debug("Created {} proof by {} for {}", CRYPTOSUITE, keyId, activity.getId());
        return DataIntegrityProof.builder()
            .scalar(DataIntegrityProof.CRYPTOSUITE, CRYPTOSUITE)
            .scalar(DataIntegrityProof.VERIFICATION_METHOD, keyId)
            .scalar(DataIntegrityProof.PROOF_PURPOSE, PROOF_PURPOSE)
            .scalar(DataIntegrityProof.PROOF_VALUE, Multibase.BASE58_BTC.encode(signature))
            .scalar(DataIntegrityProof.CREATED, createdAt)
            .build();
    }

    /**
     * Verifies one proof of an activity.
     */
    public boolean verify(Activity activity, DataIntegrityProof proof, PublicKey publicKey) {
        if (proof.getVerificationMethod().isEmpty() || proof.getCreated().isEmpty()) {
            log.warn("Incomplete proof on {}", activity.getId());
            return false;
        }
        return verify(activity.withoutProofs().toJsonLd(JsonLdFormat.COMPACT),
            proof.getCryptosuite().orElse(null),
            proof.getVerificationMethod().get().toString(),
            proof.getProofPurpose().orElse(null),
            proof.getCreated().get().toString(),
            proof.getProofValue().orElse(null),
            publicKey);
    }

    /**
     * Verifies a proof against a received compacted document. The document's own
     * {@code proof} and {@code signature} members are ignored.
     */
    public boolean verify(Map<String, Object> document, Map<String, Object> proof, PublicKey publicKey) {
        Map<String, Object> unsecured = new LinkedHashMap<>(document);
        unsecured.remove("proof");
        unsecured.remove("signature");
        return verify(unsecured,
            stringOrNull(proof.get("cryptosuite")),
            stringOrNull(proof.get("verificationMethod")),
            stringOrNull(proof.get("proofPurpose")),
            stringOrNull(proof.get("created")),
            stringOrNull(proof.get("proofValue")),
            publicKey);
    }

    private boolean verify(Map<String, Object> unsecured, String cryptosuite, String verificationMethod,
                           String proofPurpose, String created, String proofValue, PublicKey publicKey) {
        if (!CRYPTOSUITE.equals(cryptosuite)) {
            log.warn("Unsupported cryptosuite: {}", cryptosuite);
            return false;
        }
        if (verificationMethod == null || created == null || proofValue == null) {
            log.warn("Incomplete proof on {}", unsecured.get("id"));
            return false;
        }

        Map<String, Object> proofConfig = proofConfig(unsecured.get("@context"), verificationMethod,
            proofPurpose, created);
        try {
            byte[] signature = Multibase.decode(proofValue);
            Signature sig = Signature.getInstance("Ed25519");
            sig.initVerify(publicKey);
            sig.update(hashData(proofConfig, unsecured));
            return sig.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Error verifying integrity proof: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> proofConfig(Object context, String verificationMethod, String proofPurpose,
                                            String created) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (context != null) {
            config.put("@context", context);
        }
        config.put("type", "DataIntegrityProof");
        config.put("cryptosuite", CRYPTOSUITE);
        config.put("verificationMethod", verificationMethod);
        config.put("proofPurpose", proofPurpose);
        config.put("created", created);
        return config;
    }

    private byte[] hashData(Map<String, Object> proofConfig, Map<String, Object> unsecured) {
        try {
            ByteArrayOutputStream data = new ByteArrayOutputStream(64);
            data.writeBytes(MessageDigest.getInstance("SHA-256").digest(canonicalizer.canonicalize(proofConfig)));
            data.writeBytes(MessageDigest.getInstance("SHA-256").digest(canonicalizer.canonicalize(unsecured)));
            return data.toByteArray();
        } catch (GeneralSecurityException e) {
            throw new SigningException("SHA-256 is not available", e);
        }
    }

    private static String stringOrNull(Object value) {
        return value instanceof String ? (String) value : null;
    }
}
