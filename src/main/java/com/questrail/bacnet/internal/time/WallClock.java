package com.questrail.bacnet.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability timestamps only. Never used for timeouts.
 */
public interface WallClock
{
    Instant now();
}
