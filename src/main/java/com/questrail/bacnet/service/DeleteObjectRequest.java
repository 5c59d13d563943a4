package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;

import java.util.Objects;

public record DeleteObjectRequest(ObjectIdentifier objectIdentifier) implements ConfirmedRequest
{
    public DeleteObjectRequest {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
    }
}
