package com.questrail.bacnet.service;

/**
 * I-Am, the answer to a WhoIs.
 */
public record IAmRequest(
        int deviceId,
        int maxApduLengthAccepted,
        Segmentation segmentationSupported,
        int vendorId
) implements UnconfirmedRequest
{
}
