package org.operaton.fedlink.security;

import org.junit.jupiter.api.Test;
import org.operaton.fedlink.exception.KeyValidationException;

import java.security.PrivateKey;
import java.security.PublicKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PemKeysTest {

    @Test
    void encode_shouldWritePemBlocks() {
        String pem = PemKeys.encode(TestKeys.rsa().getPublic());

        assertThat(pem).startsWith("-----BEGIN PUBLIC KEY-----\n").endsWith("-----END PUBLIC KEY-----\n");
        assertThat(pem.lines().skip(1).findFirst().orElseThrow()).hasSizeLessThanOrEqualTo(64);
    }

    @Test
    void parse_shouldReadRsaKeys() {
        PrivateKey privateKey = PemKeys.parsePrivateKey(PemKeys.encode(TestKeys.rsa().getPrivate()));
        PublicKey publicKey = PemKeys.parsePublicKey(PemKeys.encode(TestKeys.rsa().getPublic()));

        assertThat(privateKey.getEncoded()).isEqualTo(TestKeys.rsa().getPrivate().getEncoded());
        assertThat(publicKey.getEncoded()).isEqualTo(TestKeys.rsa().getPublic().getEncoded());
        assertThat(KeyAlgorithm.of(privateKey)).contains(KeyAlgorithm.RSASSA_PKCS1_V1_5);
    }

    @Test
    void parse_shouldReadEd25519Keys() {
        PrivateKey privateKey = PemKeys.parsePrivateKey(PemKeys.encode(TestKeys.ed25519().getPrivate()));
        PublicKey publicKey = PemKeys.parsePublicKey(PemKeys.encode(TestKeys.ed25519().getPublic()));

        assertThat(KeyAlgorithm.of(privateKey)).contains(KeyAlgorithm.ED25519);
        assertThat(KeyAlgorithm.of(publicKey)).contains(KeyAlgorithm.ED25519);
    }

    @Test
    void parse_withWrongBlock_shouldReject() {
        String publicPem = PemKeys.encode(TestKeys.rsa().getPublic());

        assertThatThrownBy(() -> PemKeys.parsePrivateKey(publicPem))
            .isInstanceOf(KeyValidationException.class);
    }

    @Test
    void parse_withGarbage_shouldReject() {
        assertThatThrownBy(() -> PemKeys.parsePublicKey("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----"))
            .isInstanceOf(KeyValidationException.class)
            .hasMessageContaining("Unsupported or malformed public key");
    }
}
