package com.questrail.bacnet.service;

/**
 * A BACnet unconfirmed service request. Sent (usually broadcast) without any
 * transaction state; nothing ever answers it directly.
 */
public sealed interface UnconfirmedRequest
        permits WhoIsRequest, WhoHasRequest, IAmRequest, IHaveRequest, UnconfirmedCovNotificationRequest
{
}
