package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Acknowledgement of a {@link ReadPropertyMultipleRequest}: values per object and
 * property. A property that could not be read holds a {@link PropertyAccessError}
 * instead of a value.
 */
public record ReadPropertyMultipleAck(Map<ObjectIdentifier, Map<PropertyIdentifier, Object>> results)
{
    public ReadPropertyMultipleAck {
        Objects.requireNonNull(results, "results");
        Map<ObjectIdentifier, Map<PropertyIdentifier, Object>> copy = new LinkedHashMap<>();
        results.forEach((id, values) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        results = Collections.unmodifiableMap(copy);
    }

    /** Results for one object, empty if the object was not part of the answer. */
    public Map<PropertyIdentifier, Object> resultsFor(ObjectIdentifier id) {
        return results.getOrDefault(id, Map.of());
    }
}
