package com.questrail.bacnet.error;

import com.questrail.bacnet.api.ObjectIdentifier;

/**
 * No local object with the given identifier.
 */
public final class ObjectNotFoundException extends NotFoundException
{
    private final ObjectIdentifier objectIdentifier;

    public ObjectNotFoundException(ObjectIdentifier objectIdentifier) {
        super("No local object " + objectIdentifier);
        this.objectIdentifier = objectIdentifier;
    }

    public ObjectIdentifier objectIdentifier() {
        return objectIdentifier;
    }
}
