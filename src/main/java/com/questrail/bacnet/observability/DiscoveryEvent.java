package com.questrail.bacnet.observability;

import java.time.Instant;
import java.util.Set;

/**
 * Result of one WhoIs-and-fetch discovery pass.
 */
public record DiscoveryEvent(
    Instant timestamp,
    int attempt,
    Set<Integer> deviceIds
) {
    public DiscoveryEvent {
        deviceIds = Set.copyOf(deviceIds);
    }
}
