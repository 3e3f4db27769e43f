package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An embedded integrity proof (FEP-8b32), one per Ed25519 key that signed the object.
 */
public class DataIntegrityProof extends FederatedObject {

    public static final ScalarProperty<String> CRYPTOSUITE = ScalarProperty.functional(
        "cryptosuite", Vocabulary.SECURITY + "cryptosuite", ScalarCodec.STRING);

    public static final ScalarProperty<URI> VERIFICATION_METHOD = ScalarProperty.functional(
        "verificationMethod", Vocabulary.SECURITY + "verificationMethod", ScalarCodec.URI_VALUE);

    public static final ScalarProperty<String> PROOF_PURPOSE = ScalarProperty.functional(
        "proofPurpose", Vocabulary.SECURITY + "proofPurpose", ScalarCodec.STRING);

    public static final ScalarProperty<String> PROOF_VALUE = ScalarProperty.functional(
        "proofValue", Vocabulary.SECURITY + "proofValue", ScalarCodec.STRING);

    public static final ScalarProperty<Instant> CREATED = ScalarProperty.functional(
        "created", "http://purl.org/dc/terms/created", ScalarCodec.DATE_TIME);

    public static final ObjectType<DataIntegrityProof> TYPE = new DefaultObjectType<>(
        "DataIntegrityProof",
        Vocabulary.SECURITY,
        List.of("DataIntegrityProof"),
        List.of(CRYPTOSUITE, VERIFICATION_METHOD, PROOF_PURPOSE, PROOF_VALUE, CREATED),
        DataIntegrityProof::new
    );

    protected DataIntegrityProof(ObjectState state) {
        super(state);
    }

    public static ObjectBuilder<DataIntegrityProof> builder() {
        return TYPE.builder();
    }

    public Optional<String> getCryptosuite() {
        return getScalar(CRYPTOSUITE);
    }

    public Optional<URI> getVerificationMethod() {
        return getScalar(VERIFICATION_METHOD);
    }

    public Optional<String> getProofPurpose() {
        return getScalar(PROOF_PURPOSE);
    }

    public Optional<String> getProofValue() {
        return getScalar(PROOF_VALUE);
    }

    public Optional<Instant> getCreated() {
        return getScalar(CREATED);
    }
}
