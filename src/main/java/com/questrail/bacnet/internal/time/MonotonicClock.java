package com.questrail.bacnet.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for APDU timeouts and retry spacing.
 *
 * <p>Transaction deadlines are computed from this clock only. Wall-clock time
 * jumps (NTP, manual changes) must never expire or extend a pending request.</p>
 */
public interface MonotonicClock
{
    /** Current tick in nanoseconds; only differences between ticks are meaningful. */
    long nowNanos();
}
