package org.operaton.fedlink.model.vocab;

import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * ActivityPub OrderedCollection.
 * Used for inbox, outbox, followers, and following collections.
 *
 * Spec: https://www.w3.org/TR/activitystreams-core/#collections
 */
public class OrderedCollection extends FederatedObject {

    public static final ScalarProperty<Long> TOTAL_ITEMS = ScalarProperty.functional(
        "totalItems", Vocabulary.AS + "totalItems", ScalarCodec.INTEGER);

    public static final ResolvableProperty<FederatedObject> ORDERED_ITEMS = ResolvableProperty.plural(
        "orderedItems", Vocabulary.AS + "items",
        () -> List.of(Activity.TYPE, Note.TYPE, Person.TYPE));

    public static final ObjectType<OrderedCollection> TYPE = new DefaultObjectType<>(
        "OrderedCollection",
        Vocabulary.AS,
        List.of("OrderedCollection", "Collection"),
        List.of(TOTAL_ITEMS, ORDERED_ITEMS),
        OrderedCollection::new
    );

    protected OrderedCollection(ObjectState state) {
        super(state);
    }

    /**
     * Creates an empty OrderedCollection.
     */
    public static OrderedCollection empty(URI id) {
        return TYPE.builder()
            .id(id)
            .scalar(TOTAL_ITEMS, 0L)
            .build();
    }

    public Optional<Long> getTotalItems() {
        return getScalar(TOTAL_ITEMS);
    }

    public List<URI> getItemIds() {
        return getReferenceIds(ORDERED_ITEMS);
    }

    public Iterable<FederatedObject> getItems(ReferenceResolver resolver, ResolveOptions options) {
        return resolver.resolveAll(this, ORDERED_ITEMS, options);
    }
}
