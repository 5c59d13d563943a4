package com.questrail.bacnet.remote;

/**
 * Parameters of a SubscribeCOV request.
 *
 * @param processId       subscriber process identifier echoed in every notification
 * @param confirmed       ask for confirmed notifications
 * @param lifetimeSeconds subscription lifetime, 0 for indefinite
 */
public record CovSubscriptionOptions(long processId, boolean confirmed, int lifetimeSeconds)
{
    public static final long DEFAULT_PROCESS_ID = 0;
    public static final int DEFAULT_LIFETIME_SECONDS = 60;

    public CovSubscriptionOptions {
        if (processId < 0) {
            throw new IllegalArgumentException("processId must be non-negative");
        }
        if (lifetimeSeconds < 0) {
            throw new IllegalArgumentException("lifetimeSeconds must be non-negative");
        }
    }

    public static CovSubscriptionOptions defaults() {
        return new CovSubscriptionOptions(DEFAULT_PROCESS_ID, false, DEFAULT_LIFETIME_SECONDS);
    }
}
