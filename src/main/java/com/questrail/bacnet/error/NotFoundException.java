package com.questrail.bacnet.error;

/**
 * Something addressed by identifier does not exist.
 */
public abstract class NotFoundException extends BacnetNodeException
{
    protected NotFoundException(String message) {
        super(message);
    }
}
