package com.questrail.bacnet.service;

/** BACnetSegmentation as announced in I-Am. */
public enum Segmentation
{
    SEGMENTED_BOTH,
    SEGMENTED_TRANSMIT,
    SEGMENTED_RECEIVE,
    NO_SEGMENTATION
}
