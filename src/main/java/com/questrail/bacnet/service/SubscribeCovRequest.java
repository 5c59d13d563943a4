package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;

import java.util.Objects;

/**
 * SubscribeCOV.
 *
 * <p>{@code issueConfirmedNotifications} and {@code lifetimeSeconds} are both
 * {@code null} for a cancellation; both are present for a subscription. A
 * lifetime of 0 asks for an indefinite subscription.</p>
 */
public record SubscribeCovRequest(
        long subscriberProcessId,
        ObjectIdentifier monitoredObject,
        Boolean issueConfirmedNotifications,
        Integer lifetimeSeconds
) implements ConfirmedRequest
{
    public SubscribeCovRequest {
        Objects.requireNonNull(monitoredObject, "monitoredObject");
        if (subscriberProcessId < 0 || subscriberProcessId > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("subscriberProcessId must be an unsigned 32-bit value");
        }
        if ((issueConfirmedNotifications == null) != (lifetimeSeconds == null)) {
            throw new IllegalArgumentException("confirmed flag and lifetime must both be present or both absent");
        }
        if (lifetimeSeconds != null && lifetimeSeconds < 0) {
            throw new IllegalArgumentException("lifetimeSeconds must be >= 0");
        }
    }

    public static SubscribeCovRequest cancel(long subscriberProcessId, ObjectIdentifier monitoredObject) {
        return new SubscribeCovRequest(subscriberProcessId, monitoredObject, null, null);
    }

    public boolean isCancellation() {
        return lifetimeSeconds == null;
    }
}
