package com.questrail.bacnet.internal.time;

/**
 * Handle for a pending APDU timer.
 */
public interface Cancellable
{
    /**
     * Cancel the timer.
     *
     * @return {@code false} if the task already ran or was cancelled before
     */
    boolean cancel();
}
