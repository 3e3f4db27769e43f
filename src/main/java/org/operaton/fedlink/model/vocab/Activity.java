package org.operaton.fedlink.model.vocab;

import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An ActivityStreams activity: the message type that gets signed and delivered.
 *
 * Spec: https://www.w3.org/TR/activitystreams-vocabulary/#dfn-activity
 */
public class Activity extends FederatedObject {

    public static final ResolvableProperty<Person> ACTOR = ResolvableProperty.plural(
        "actor", Vocabulary.AS + "actor", () -> List.of(Person.TYPE));

    public static final ResolvableProperty<FederatedObject> OBJECT = ResolvableProperty.plural(
        "object", Vocabulary.AS + "object",
        () -> List.of(Note.TYPE, Person.TYPE, Activity.TYPE, OrderedCollection.TYPE));

    public static final ResolvableProperty<FederatedObject> TO = ResolvableProperty.plural(
        "to", Vocabulary.AS + "to", () -> List.of(Person.TYPE, OrderedCollection.TYPE));

    public static final ResolvableProperty<FederatedObject> CC = ResolvableProperty.plural(
        "cc", Vocabulary.AS + "cc", () -> List.of(Person.TYPE, OrderedCollection.TYPE));

    public static final ScalarProperty<Instant> PUBLISHED = ScalarProperty.functional(
        "published", Vocabulary.AS + "published", ScalarCodec.DATE_TIME);

    public static final ScalarProperty<String> SUMMARY = ScalarProperty.functional(
        "summary", Vocabulary.AS + "summary", ScalarCodec.STRING);

    public static final ResolvableProperty<DataIntegrityProof> PROOF = ResolvableProperty.plural(
        "proof", Vocabulary.SECURITY + "proof", () -> List.of(DataIntegrityProof.TYPE));

    public static final ObjectType<Activity> TYPE = new DefaultObjectType<>(
        "Activity",
        Vocabulary.AS,
        List.of("Activity", "Create", "Update", "Delete", "Follow", "Accept", "Reject", "Like", "Undo", "Announce"),
        List.of(ACTOR, OBJECT, TO, CC, PUBLISHED, SUMMARY, PROOF),
        Activity::new
    );

    protected Activity(ObjectState state) {
        super(state);
    }

    public static ObjectBuilder<Activity> builder(String typeTag) {
        return TYPE.builder().typeTag(typeTag);
    }

    public URI getActorId() {
        return getReferenceId(ACTOR);
    }

    public List<URI> getActorIds() {
        return getReferenceIds(ACTOR);
    }

    public Iterable<Person> getActors(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveAll(this, ACTOR, options);
    }

    public URI getObjectId() {
        return getReferenceId(OBJECT);
    }

    public List<URI> getObjectIds() {
        return getReferenceIds(OBJECT);
    }

    public Optional<FederatedObject> getObject(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveOne(this, OBJECT, options);
    }

    public Iterable<FederatedObject> getObjects(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveAll(this, OBJECT, options);
    }

    public List<URI> getToIds() {
        return getReferenceIds(TO);
    }

    public List<URI> getCcIds() {
        return getReferenceIds(CC);
    }

    public Optional<Instant> getPublished() {
        return getScalar(PUBLISHED);
    }

    /**
     * Proofs are always attached inline, so reading them needs no resolver.
     */
    public List<DataIntegrityProof> getProofs() {
        return getValues(PROOF).stream()
            .filter(PropertyValue::isInline)
            .map(value -> (DataIntegrityProof) value.getInline())
            .toList();
    }

    /**
     * @return a copy of this activity with the proof appended
     */
    public Activity withProof(DataIntegrityProof proof) {
        return (Activity) withAdded(PROOF, PropertyValue.inline(proof));
    }

    /**
     * @return a copy of this activity without any proof
     */
    public Activity withoutProofs() {
        return (Activity) without(PROOF);
    }
}
