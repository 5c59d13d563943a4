package com.questrail.bacnet.error;

/**
 * A restore was requested but no configuration snapshot has been saved.
 */
public final class NoBackupException extends BacnetNodeException
{
    public NoBackupException(String message) {
        super(message);
    }
}
