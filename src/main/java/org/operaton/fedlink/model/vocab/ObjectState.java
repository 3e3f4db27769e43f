package org.operaton.fedlink.model.vocab;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link FederatedObject} is constructed from.
 */
public record ObjectState(
    ObjectType<?> objectType,
    String typeTag,
    URI id,
    Map<String, List<PropertyValue>> properties,
    Map<String, Object> sourceDocument
) {
}
