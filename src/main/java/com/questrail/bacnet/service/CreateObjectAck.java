package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;

/**
 * Acknowledgement of a {@link CreateObjectRequest}.
 */
public record CreateObjectAck(ObjectIdentifier objectIdentifier)
{
}
