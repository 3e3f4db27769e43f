package org.operaton.fedlink.security;

import java.net.URI;
import java.security.Key;

/**
 * A private key of the sending actor together with the id of its public key,
 * e.g. {@code https://example.com/users/alice#main-key}.
 */
public record SenderKeyPair(Key privateKey, URI keyId) {
}
