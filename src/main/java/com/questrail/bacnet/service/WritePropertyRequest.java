package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Objects;

/**
 * WriteProperty. {@code priority} (1-16) is {@code null} for non-commandable writes.
 */
public record WritePropertyRequest(
        ObjectIdentifier objectIdentifier,
        PropertyIdentifier propertyIdentifier,
        Object value,
        Integer priority
) implements ConfirmedRequest
{
    public WritePropertyRequest {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
        Objects.requireNonNull(propertyIdentifier, "propertyIdentifier");
        if (priority != null && (priority < 1 || priority > 16)) {
            throw new IllegalArgumentException("priority must be 1-16: " + priority);
        }
    }

    public WritePropertyRequest(ObjectIdentifier objectIdentifier, PropertyIdentifier propertyIdentifier, Object value) {
        this(objectIdentifier, propertyIdentifier, value, null);
    }
}
