package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;

import java.util.Objects;

/**
 * I-Have, the answer to a WhoHas.
 */
public record IHaveRequest(int deviceId, ObjectIdentifier objectIdentifier, String objectName)
        implements UnconfirmedRequest
{
    public IHaveRequest {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
    }
}
