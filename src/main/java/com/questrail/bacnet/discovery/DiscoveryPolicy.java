package com.questrail.bacnet.discovery;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of the discovery loop.
 *
 * @param settleInterval how long to wait after a WhoIs for I-Am answers to arrive
 * @param maxAttempts    discovery passes before giving up on a silent network
 */
public record DiscoveryPolicy(Duration settleInterval, int maxAttempts)
{
    public static final Duration DEFAULT_SETTLE_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public DiscoveryPolicy {
        Objects.requireNonNull(settleInterval, "settleInterval");
        if (settleInterval.isNegative()) {
            throw new IllegalArgumentException("settleInterval must be non-negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static DiscoveryPolicy defaults() {
        return new DiscoveryPolicy(DEFAULT_SETTLE_INTERVAL, DEFAULT_MAX_ATTEMPTS);
    }
}
