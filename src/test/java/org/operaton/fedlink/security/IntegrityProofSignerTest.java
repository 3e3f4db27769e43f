package org.operaton.fedlink.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.operaton.fedlink.model.vocab.Activity;
import org.operaton.fedlink.model.vocab.DataIntegrityProof;
import org.operaton.fedlink.model.vocab.JsonLdFormat;
import org.operaton.fedlink.model.vocab.Note;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntegrityProofSignerTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00.500Z");

    private final IntegrityProofSigner signer = new IntegrityProofSigner(new JsonCanonicalizer(new ObjectMapper()));

    @Test
    void createProof_shouldFillProofFields() {
        DataIntegrityProof proof = signer.createProof(activity(), TestKeys.ed25519().getPrivate(),
            TestKeys.ED25519_KEY_ID, CREATED);

        assertThat(proof.getCryptosuite()).contains("eddsa-jcs-2022");
        assertThat(proof.getVerificationMethod()).contains(TestKeys.ED25519_KEY_ID);
        assertThat(proof.getProofPurpose()).contains("assertionMethod");
        assertThat(proof.getCreated()).contains(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(proof.getProofValue()).hasValueSatisfying(value -> assertThat(value).startsWith("z"));
        assertThat(Multibase.decode(proof.getProofValue().get())).hasSize(64);
    }

    @Test
    void verify_withSignedActivity_shouldAccept() {
        Activity signed = signer.sign(activity(), TestKeys.ed25519().getPrivate(), TestKeys.ED25519_KEY_ID, CREATED);

        assertThat(signed.getProofs()).hasSize(1);
        assertThat(signer.verify(signed, signed.getProofs().get(0), TestKeys.ed25519().getPublic())).isTrue();
    }

    @Test
    void verify_withTwoProofs_shouldAcceptEachWithItsKey() {
        Activity signed = signer.sign(activity(), TestKeys.ed25519().getPrivate(), TestKeys.ED25519_KEY_ID, CREATED);
        signed = signer.sign(signed, TestKeys.secondEd25519().getPrivate(),
            URI.create("https://local.example/users/alice#second-key"), CREATED);

        assertThat(signed.getProofs()).hasSize(2);
        assertThat(signer.verify(signed, signed.getProofs().get(0), TestKeys.ed25519().getPublic())).isTrue();
        assertThat(signer.verify(signed, signed.getProofs().get(1), TestKeys.secondEd25519().getPublic())).isTrue();
        assertThat(signer.verify(signed, signed.getProofs().get(1), TestKeys.ed25519().getPublic())).isFalse();
    }

    @Test
    void verify_withReceivedDocument_shouldIgnoreProofAndSignatureMembers() {
        Activity signed = signer.sign(activity(), TestKeys.ed25519().getPrivate(), TestKeys.ED25519_KEY_ID, CREATED);
        Map<String, Object> document = new LinkedHashMap<>(signed.toJsonLd(JsonLdFormat.COMPACT));
        document.put("signature", Map.of("type", "RsaSignature2017"));
        Map<String, Object> proof = signed.getProofs().get(0).toJsonLd(JsonLdFormat.COMPACT);

        assertThat(signer.verify(document, proof, TestKeys.ed25519().getPublic())).isTrue();
    }

    @Test
    void verify_withTamperedDocument_shouldReject() {
        Activity signed = signer.sign(activity(), TestKeys.ed25519().getPrivate(), TestKeys.ED25519_KEY_ID, CREATED);
        Map<String, Object> document = new LinkedHashMap<>(signed.toJsonLd(JsonLdFormat.COMPACT));
        document.put("actor", "https://evil.example/users/mallory");
        Map<String, Object> proof = signed.getProofs().get(0).toJsonLd(JsonLdFormat.COMPACT);

        assertThat(signer.verify(document, proof, TestKeys.ed25519().getPublic())).isFalse();
    }

    @Test
    void verify_withOtherCryptosuite_shouldReject() {
        Activity signed = signer.sign(activity(), TestKeys.ed25519().getPrivate(), TestKeys.ED25519_KEY_ID, CREATED);
        Map<String, Object> proof = new LinkedHashMap<>(signed.getProofs().get(0).toJsonLd(JsonLdFormat.COMPACT));
        proof.put("cryptosuite", "eddsa-rdfc-2022");

        assertThat(signer.verify(signed.toJsonLd(JsonLdFormat.COMPACT), proof, TestKeys.ed25519().getPublic()))
            .isFalse();
    }

    private static Activity activity() {
        Note note = Note.builder()
            .id("https://local.example/notes/1")
            .reference(Note.ATTRIBUTED_TO, "https://local.example/users/alice")
            .scalar(Note.CONTENT, "Hello, fediverse")
            .build();
        return Activity.builder("Create")
            .id("https://local.example/activities/1")
            .reference(Activity.ACTOR, "https://local.example/users/alice")
            .inline(Activity.OBJECT, note)
            .build();
    }
}
