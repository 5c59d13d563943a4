package com.questrail.bacnet.transport.codec;

import com.questrail.bacnet.error.BacnetNodeException;

/**
 * Raised by a codec for a payload that is not a well-formed APDU. The transport
 * drops such datagrams.
 */
public final class ApduDecodeException extends BacnetNodeException
{
    public ApduDecodeException(String message) {
        super(message);
    }

    public ApduDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
