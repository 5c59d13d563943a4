package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Objects;

/**
 * ReadProperty. {@code arrayIndex} is {@code null} to read the whole property.
 */
public record ReadPropertyRequest(
        ObjectIdentifier objectIdentifier,
        PropertyIdentifier propertyIdentifier,
        Integer arrayIndex
) implements ConfirmedRequest
{
    public ReadPropertyRequest {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
        Objects.requireNonNull(propertyIdentifier, "propertyIdentifier");
        if (arrayIndex != null && arrayIndex < 0) {
            throw new IllegalArgumentException("arrayIndex must be >= 0");
        }
    }

    public ReadPropertyRequest(ObjectIdentifier objectIdentifier, PropertyIdentifier propertyIdentifier) {
        this(objectIdentifier, propertyIdentifier, null);
    }
}
