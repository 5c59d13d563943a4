package com.questrail.bacnet.error;

/**
 * An operation needing a bound local device was attempted before
 * {@code initialize()} (or after {@code terminate()}).
 */
public final class DeviceNotInitializedException extends BacnetNodeException
{
    public DeviceNotInitializedException(String message) {
        super(message);
    }
}
