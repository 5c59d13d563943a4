package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

/**
 * Acknowledgement of a {@link ReadPropertyRequest}.
 */
public record ReadPropertyAck(
        ObjectIdentifier objectIdentifier,
        PropertyIdentifier propertyIdentifier,
        Object value
) {
}
