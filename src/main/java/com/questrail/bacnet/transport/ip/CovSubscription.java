package com.questrail.bacnet.transport.ip;

import com.questrail.bacnet.api.ObjectIdentifier;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * A remote subscriber's standing COV request against one local object.
 *
 * @param expiresAtNanos monotonic expiry, {@link Long#MAX_VALUE} for indefinite
 */
record CovSubscription(
        SocketAddress subscriber,
        long processId,
        ObjectIdentifier monitoredObject,
        boolean confirmed,
        long expiresAtNanos
) {
    CovSubscription {
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(monitoredObject, "monitoredObject");
    }

    Key key() {
        return new Key(subscriber, processId, monitoredObject);
    }

    boolean expired(long nowNanos) {
        return expiresAtNanos != Long.MAX_VALUE && nowNanos - expiresAtNanos >= 0;
    }

    /** Whole seconds left, 0 for an indefinite subscription. */
    int secondsRemaining(long nowNanos) {
        if (expiresAtNanos == Long.MAX_VALUE) {
            return 0;
        }
        return (int) Math.max(0, (expiresAtNanos - nowNanos) / 1_000_000_000L);
    }

    record Key(SocketAddress subscriber, long processId, ObjectIdentifier monitoredObject) {
    }
}
