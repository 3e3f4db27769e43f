package org.operaton.fedlink.model.vocab;

import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A short written work.
 */
public class Note extends FederatedObject {

    public static final ResolvableProperty<Person> ATTRIBUTED_TO = ResolvableProperty.plural(
        "attributedTo", Vocabulary.AS + "attributedTo", () -> List.of(Person.TYPE));

    public static final ResolvableProperty<Note> IN_REPLY_TO = ResolvableProperty.functional(
        "inReplyTo", Vocabulary.AS + "inReplyTo", () -> List.of(Note.TYPE));

    public static final ResolvableProperty<FederatedObject> TO = ResolvableProperty.plural(
        "to", Vocabulary.AS + "to", () -> List.of(Person.TYPE, OrderedCollection.TYPE));

    public static final ResolvableProperty<FederatedObject> CC = ResolvableProperty.plural(
        "cc", Vocabulary.AS + "cc", () -> List.of(Person.TYPE, OrderedCollection.TYPE));

    public static final ScalarProperty<String> CONTENT = ScalarProperty.functional(
        "content", Vocabulary.AS + "content", ScalarCodec.STRING);

    public static final ScalarProperty<Instant> PUBLISHED = ScalarProperty.functional(
        "published", Vocabulary.AS + "published", ScalarCodec.DATE_TIME);

    public static final ScalarProperty<URI> URL = ScalarProperty.functional(
        "url", Vocabulary.AS + "url", ScalarCodec.URI_VALUE);

    public static final ObjectType<Note> TYPE = new DefaultObjectType<>(
        "Note",
        Vocabulary.AS,
        List.of("Note", "Article"),
        List.of(ATTRIBUTED_TO, IN_REPLY_TO, TO, CC, CONTENT, PUBLISHED, URL),
        Note::new
    );

    protected Note(ObjectState state) {
        super(state);
    }

    public static ObjectBuilder<Note> builder() {
        return TYPE.builder();
    }

    public URI getAttributedToId() {
        return getReferenceId(ATTRIBUTED_TO);
    }

    public List<URI> getAttributedToIds() {
        return getReferenceIds(ATTRIBUTED_TO);
    }

    public Iterable<Person> getAttributedTos(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveAll(this, ATTRIBUTED_TO, options);
    }

    public URI getInReplyToId() {
        return getReferenceId(IN_REPLY_TO);
    }

    public Optional<Note> getInReplyTo(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveOne(this, IN_REPLY_TO, options);
    }

    public Optional<String> getContent() {
        return getScalar(CONTENT);
    }

    public Optional<Instant> getPublished() {
        return getScalar(PUBLISHED);
    }
}
