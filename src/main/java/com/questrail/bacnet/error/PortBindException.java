package com.questrail.bacnet.error;

/**
 * The local device could not bind its UDP port, typically because another
 * (un-terminated) device already holds it.
 *
 * <p>Terminal for the device instance that raised it: terminate or discard
 * that instance and construct a new one.</p>
 */
public final class PortBindException extends BacnetNodeException
{
    private final int port;

    public PortBindException(int port, Throwable cause) {
        super("Cannot bind BACnet port " + port, cause);
        this.port = port;
    }

    public int port() {
        return port;
    }
}
