package org.operaton.fedlink.model.vocab;

import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * An ActivityPub actor. Also used for the Service, Application, Group and
 * Organization actor types, which share the same properties.
 *
 * Spec: https://www.w3.org/TR/activitypub/#actors
 */
public class Person extends FederatedObject implements Recipient {

    public static final ScalarProperty<String> PREFERRED_USERNAME = ScalarProperty.functional(
        "preferredUsername", Vocabulary.AS + "preferredUsername", ScalarCodec.STRING);

    public static final ScalarProperty<String> NAME = ScalarProperty.functional(
        "name", Vocabulary.AS + "name", ScalarCodec.STRING);

    public static final ScalarProperty<String> SUMMARY = ScalarProperty.functional(
        "summary", Vocabulary.AS + "summary", ScalarCodec.STRING);

    public static final ResolvableProperty<OrderedCollection> INBOX = ResolvableProperty.functional(
        "inbox", Vocabulary.LDP + "inbox", () -> List.of(OrderedCollection.TYPE));

    public static final ResolvableProperty<OrderedCollection> OUTBOX = ResolvableProperty.functional(
        "outbox", Vocabulary.AS + "outbox", () -> List.of(OrderedCollection.TYPE));

    public static final ResolvableProperty<OrderedCollection> FOLLOWERS = ResolvableProperty.functional(
        "followers", Vocabulary.AS + "followers", () -> List.of(OrderedCollection.TYPE));

    public static final ScalarProperty<Endpoints> ENDPOINTS = ScalarProperty.functional(
        "endpoints", Vocabulary.AS + "endpoints", Endpoints.CODEC);

    public static final ObjectType<Person> TYPE = new DefaultObjectType<>(
        "Person",
        Vocabulary.AS,
        List.of("Person", "Service", "Application", "Group", "Organization"),
        List.of(PREFERRED_USERNAME, NAME, SUMMARY, INBOX, OUTBOX, FOLLOWERS, ENDPOINTS),
        Person::new
    );

    protected Person(ObjectState state) {
        super(state);
    }

    public static ObjectBuilder<Person> builder() {
        return TYPE.builder();
    }

    public Optional<String> getPreferredUsername() {
        return getScalar(PREFERRED_USERNAME);
    }

    public Optional<String> getName() {
        return getScalar(NAME);
    }

    @Override
    public URI getInboxId() {
        return getReferenceId(INBOX);
    }

    public Optional<OrderedCollection> getInbox(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveOne(this, INBOX, options);
    }

    public URI getOutboxId() {
        return getReferenceId(OUTBOX);
    }

    public URI getFollowersId() {
        return getReferenceId(FOLLOWERS);
    }

    public Optional<OrderedCollection> getFollowers(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveOne(this, FOLLOWERS, options);
    }

    @Override
    public URI getSharedInboxId() {
        return getScalar(ENDPOINTS).map(Endpoints::sharedInbox).orElse(null);
    }
}
