package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ReadPropertyMultiple: a list of read-access specifications, each naming an
 * object and the properties to read from it. {@link PropertyIdentifier#ALL}
 * asks for every property of the object.
 */
public record ReadPropertyMultipleRequest(
        Map<ObjectIdentifier, List<PropertyIdentifier>> specifications
) implements ConfirmedRequest
{
    public ReadPropertyMultipleRequest {
        Objects.requireNonNull(specifications, "specifications");
        if (specifications.isEmpty()) {
            throw new IllegalArgumentException("at least one read-access specification required");
        }
        Map<ObjectIdentifier, List<PropertyIdentifier>> copy = new LinkedHashMap<>();
        specifications.forEach((id, props) -> {
            if (props.isEmpty()) {
                throw new IllegalArgumentException("no properties requested for " + id);
            }
            copy.put(id, List.copyOf(props));
        });
        specifications = Collections.unmodifiableMap(copy);
    }

    /** Request for several properties of a single object. */
    public static ReadPropertyMultipleRequest of(ObjectIdentifier id, List<PropertyIdentifier> properties) {
        return new ReadPropertyMultipleRequest(Map.of(id, properties));
    }
}
