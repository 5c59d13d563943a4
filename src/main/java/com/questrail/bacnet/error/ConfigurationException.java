package com.questrail.bacnet.error;

/**
 * A local device configuration is invalid or one of its addresses cannot be resolved.
 */
public final class ConfigurationException extends BacnetNodeException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
