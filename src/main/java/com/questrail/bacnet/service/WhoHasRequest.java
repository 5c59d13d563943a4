package com.questrail.bacnet.service;

import com.questrail.bacnet.api.DeviceRange;
import com.questrail.bacnet.api.ObjectIdentifier;

import java.util.Objects;

/**
 * WhoHas. The target is either an object identifier or an object name; the two
 * are distinct encodings on the wire and exactly one of them is set.
 */
public record WhoHasRequest(DeviceRange limits, ObjectIdentifier objectIdentifier, String objectName)
        implements UnconfirmedRequest
{
    public WhoHasRequest {
        Objects.requireNonNull(limits, "limits");
        if ((objectIdentifier == null) == (objectName == null)) {
            throw new IllegalArgumentException("exactly one of objectIdentifier and objectName must be set");
        }
    }

    public static WhoHasRequest forIdentifier(DeviceRange limits, ObjectIdentifier objectIdentifier) {
        return new WhoHasRequest(limits, Objects.requireNonNull(objectIdentifier, "objectIdentifier"), null);
    }

    public static WhoHasRequest forName(DeviceRange limits, String objectName) {
        return new WhoHasRequest(limits, null, Objects.requireNonNull(objectName, "objectName"));
    }

    public boolean byName() {
        return objectName != null;
    }
}
