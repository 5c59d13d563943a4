package com.questrail.bacnet.transport;

/**
 * ResponseConsumer
 * -----------------------------------------------------------------------------
 * Completion callback registered with {@link BacnetTransport#send}.
 *
 * <p>The transport calls exactly one of the three methods, exactly once, for
 * each request it accepted. Calls arrive on a transport thread and must not
 * block.</p>
 */
public interface ResponseConsumer
{
    /**
     * The remote device acknowledged the request.
     *
     * @param ack decoded acknowledgement, or {@code null} for a simple ack
     */
    void success(Object ack);

    /** The remote device (or the local transaction machine) refused the request. */
    void fail(ApduFailure failure);

    /** No answer could be obtained: retries exhausted, unreachable, or terminated. */
    void ex(Throwable cause);
}
