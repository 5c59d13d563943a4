package com.questrail.bacnet.service;

/**
 * A BACnet confirmed service request: one that the receiving device must answer
 * with an acknowledgement, an error, a reject or an abort.
 *
 * <p>These are semantic requests only. Turning them into APDU bytes (and the
 * acknowledgements back into values) is the codec's job.</p>
 */
public sealed interface ConfirmedRequest
        permits ReadPropertyRequest, ReadPropertyMultipleRequest, WritePropertyRequest,
                CreateObjectRequest, DeleteObjectRequest, SubscribeCovRequest,
                ConfirmedCovNotificationRequest
{
}
