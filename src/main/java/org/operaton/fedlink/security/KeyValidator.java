package org.operaton.fedlink.security;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.KeyValidationException;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.security.PrivateKey;

/**
 * Checks that a key has the expected purpose and a supported algorithm.
 */
@Component
@Slf4j
public class KeyValidator {

    /**
     * @return the algorithm of the key
     * @throws KeyValidationException if the purpose does not match or the algorithm is unsupported
     */
    public KeyAlgorithm validate(Key key, KeyPurpose purpose) {
        if (key == null) {
            throw new KeyValidationException("The key must not be null.");
        }
        boolean isPrivate = key instanceof PrivateKey;
        if (purpose == KeyPurpose.PRIVATE && !isPrivate) {
            throw new KeyValidationException("The key must be a private key, but got a " + key.getAlgorithm() + " public key.");
        }
        if (purpose == KeyPurpose.PUBLIC && isPrivate) {
            throw new KeyValidationException("The key must be a public key, but got a " + key.getAlgorithm() + " private key.");
        }
        KeyAlgorithm algorithm = KeyAlgorithm.of(key)
            .orElseThrow(() -> new KeyValidationException(
                "Unsupported key algorithm: " + key.getAlgorithm()
                    + "; supported are RSASSA-PKCS1-v1_5, Ed25519 and ECDSA P-256."));
        log.debug("Validated {} key ({})", algorithm, purpose);
        return algorithm;
    }
}
