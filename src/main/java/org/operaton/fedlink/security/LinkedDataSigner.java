package org.operaton.fedlink.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.SigningException;
import org.operaton.fedlink.loader.DocumentLoader;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates and verifies {@code RsaSignature2017} Linked Data Signatures, the
 * embedded {@code signature} block Mastodon uses to authenticate relayed activities.
 *
 * The signed input is the hex SHA-256 of the URDNA2015-normalized signature
 * options followed by the hex SHA-256 of the normalized document without its
 * {@code signature}. JSON-LD contexts are read through the loader passed in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LinkedDataSigner {

    public static final String SIGNATURE_TYPE = "RsaSignature2017";
    static final String IDENTITY_CONTEXT = "https://w3id.org/identity/v1";

    private final JsonLdNormalizer normalizer;

    /**
     * Signs a compacted document.
     *
     * @param contextLoader the loader the JSON-LD contexts of the document are read from
     * @return a copy of the document with a {@code signature} block
     * @throws SigningException if the document cannot be normalized or signed
     */
    public Map<String, Object> sign(Map<String, Object> document, PrivateKey privateKey, URI keyId, Instant created,
                                    DocumentLoader contextLoader) {
        String createdValue = created.truncatedTo(ChronoUnit.SECONDS).toString();
        Map<String, Object> unsigned = new LinkedHashMap<>(document);
        unsigned.remove("signature");

        String toBeSigned = signingInput(unsigned, keyId.toString(), createdValue, contextLoader);
        byte[] signatureValue;
        try {
            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initSign(privateKey);
            sig.update(toBeSigned.getBytes(StandardCharsets.UTF_8));
            signatureValue = sig.sign();
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to create Linked Data signature", e);
        }

        Map<String, Object> signature = new LinkedHashMap<>();
        signature.put("type", SIGNATURE_TYPE);
        signature.put("creator", keyId.toString());
        signature.put("created", createdValue);
        signature.put("signatureValue", Base64.getEncoder().encodeToString(signatureValue));

        Map<String, Object> signed = new LinkedHashMap<>(unsigned);
        signed.put("signature", signature);
        log.debug("Created Linked Data signature by {} for {}", keyId, document.get("id"));
        return signed;
    }

    /**
     * Verifies the {@code signature} block of a document.
     *
     * @return true if the document carries a valid signature made by the key
     */
    public boolean verify(Map<String, Object> document, PublicKey publicKey, DocumentLoader contextLoader) {
        if (!(document.get("signature") instanceof Map)) {
            log.debug("Document {} has no signature block", document.get("id"));
            return false;
        }
        Map<?, ?> signature = (Map<?, ?>) document.get("signature");
        if (!SIGNATURE_TYPE.equals(signature.get("type"))
            || !(signature.get("creator") instanceof String)
            || !(signature.get("created") instanceof String)
            || !(signature.get("signatureValue") instanceof String)) {
            log.warn("Unsupported or incomplete signature block in {}", document.get("id"));
            return false;
        }

        Map<String, Object> unsigned = new LinkedHashMap<>(document);
        unsigned.remove("signature");
        String toBeSigned;
        try {
            toBeSigned = signingInput(unsigned, (String) signature.get("creator"), (String) signature.get("created"),
                contextLoader);
        } catch (SigningException e) {
            log.warn("Cannot verify Linked Data signature of {}: {}", document.get("id"), e.getMessage());
            return false;
        }

        try {
            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initVerify(publicKey);
            sig.update(toBeSigned.getBytes(StandardCharsets.UTF_8));
            return sig.verify(Base64.getDecoder().decode((String) signature.get("signatureValue")));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Error verifying Linked Data signature: {}", e.getMessage());
            return false;
        }
    }

    private String signingInput(Map<String, Object> unsigned, String creator, String created,
                                DocumentLoader contextLoader) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("@context", IDENTITY_CONTEXT);
        options.put("creator", creator);
        options.put("created", created);
        return sha256Hex(normalizer.normalize(options, contextLoader))
            + sha256Hex(normalizer.normalize(unsigned, contextLoader));
    }

    private static String sha256Hex(String nquads) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(nquads.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new SigningException("SHA-256 is not available", e);
        }
    }
}
