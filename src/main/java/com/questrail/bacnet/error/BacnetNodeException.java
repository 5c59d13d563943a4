package com.questrail.bacnet.error;

/**
 * Root of the node's exception hierarchy.
 *
 * <p>All node exceptions are unchecked. Remote request failures are not
 * exceptions at all; they travel as {@code RequestOutcome} values.</p>
 */
public class BacnetNodeException extends RuntimeException
{
    public BacnetNodeException(String message) {
        super(message);
    }

    public BacnetNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
