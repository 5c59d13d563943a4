package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CreateObject with an explicit object identifier and initial property values.
 * Acknowledged with the identifier of the created object.
 */
public record CreateObjectRequest(
        ObjectIdentifier objectIdentifier,
        Map<PropertyIdentifier, Object> initialValues
) implements ConfirmedRequest
{
    public CreateObjectRequest {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
        initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(initialValues, "initialValues")));
    }
}
