package com.questrail.bacnet.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly inside the node.
 */
public record BacnetErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
