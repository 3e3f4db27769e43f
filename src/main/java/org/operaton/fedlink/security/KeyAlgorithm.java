package org.operaton.fedlink.security;

import java.math.BigInteger;
import java.security.Key;
import java.security.interfaces.ECKey;
import java.security.interfaces.EdECKey;
import java.security.interfaces.RSAKey;
import java.util.Optional;

/**
 * The closed set of key algorithms accepted for signing.
 */
public enum KeyAlgorithm {

    /** RSA, used for the Linked Data signature and the HTTP signature. */
    RSASSA_PKCS1_V1_5,

    /** Ed25519, used for integrity proofs. */
    ED25519,

    /** ECDSA on P-256. Accepted by validation, not used by any signature scheme. */
    ECDSA_P256;

    private static final BigInteger P256_ORDER = new BigInteger(
        "FFFFFFFF00000000FFFFFFFFFFFFFFFFBCE6FAADA7179E84F3B9CAC2FC632551", 16);

    /**
     * Determines the algorithm of a key.
     *
     * @return the algorithm, or empty if the key belongs to none of the supported ones
     */
    public static Optional<KeyAlgorithm> of(Key key) {
        // RSASSA-PSS keys are RSAKeys as well
        if (key instanceof RSAKey && "RSA".equals(key.getAlgorithm())) {
            return Optional.of(RSASSA_PKCS1_V1_5);
        }
        if (key instanceof EdECKey && "Ed25519".equalsIgnoreCase(((EdECKey) key).getParams().getName())) {
            return Optional.of(ED25519);
        }
        if (key instanceof ECKey && P256_ORDER.equals(((ECKey) key).getParams().getOrder())) {
            return Optional.of(ECDSA_P256);
        }
        return Optional.empty();
    }
}
