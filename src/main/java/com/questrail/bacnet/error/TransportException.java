package com.questrail.bacnet.error;

/**
 * Transport-level failure: no response within the APDU retries, network
 * unreachable, transport terminated while a request was pending.
 *
 * <p>The request bridge turns this into a {@code Timeout} outcome.</p>
 */
public class TransportException extends BacnetNodeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
