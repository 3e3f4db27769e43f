package org.operaton.fedlink.security;

import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;

/**
 * Key material shared by the tests. Generated once per JVM, RSA generation is slow.
 */
public final class TestKeys {

    public static final URI RSA_KEY_ID = URI.create("https://local.example/users/alice#main-key");
    public static final URI ED25519_KEY_ID = URI.create("https://local.example/users/alice#ed25519-key");
    public static final URI P256_KEY_ID = URI.create("https://local.example/users/alice#p256-key");

    private static final KeyPair RSA = generate("RSA", null);
    private static final KeyPair RSA_2 = generate("RSA", null);
    private static final KeyPair ED25519 = generate("Ed25519", null);
    private static final KeyPair ED25519_2 = generate("Ed25519", null);
    private static final KeyPair P256 = generate("EC", new ECGenParameterSpec("secp256r1"));

    private TestKeys() {
    }

    public static KeyPair rsa() {
        return RSA;
    }

    public static KeyPair secondRsa() {
        return RSA_2;
    }

    public static KeyPair ed25519() {
        return ED25519;
    }

    public static KeyPair secondEd25519() {
        return ED25519_2;
    }

    public static KeyPair p256() {
        return P256;
    }

    public static SenderKeyPair rsaSender() {
        return new SenderKeyPair(RSA.getPrivate(), RSA_KEY_ID);
    }

    public static SenderKeyPair ed25519Sender() {
        return new SenderKeyPair(ED25519.getPrivate(), ED25519_KEY_ID);
    }

    private static KeyPair generate(String algorithm, ECGenParameterSpec spec) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
            if (spec != null) {
                generator.initialize(spec);
            } else if ("RSA".equals(algorithm)) {
                generator.initialize(2048);
            }
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot generate " + algorithm + " test key", e);
        }
    }
}
