package com.questrail.bacnet.observability;

import com.questrail.bacnet.api.RequestOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of one blocking request and how it ended.
 */
public record RequestCompletedEvent(
    Instant timestamp,
    int remoteDeviceId,
    String service,
    RequestOutcome<?> outcome,
    Duration elapsed
) {
    /** Simple name of the outcome variant, e.g. {@code Success} or {@code Timeout}. */
    public String outcomeKind() {
        return outcome.getClass().getSimpleName();
    }
}
