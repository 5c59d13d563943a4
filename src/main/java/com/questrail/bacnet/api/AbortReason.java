package com.questrail.bacnet.api;

/**
 * Reason carried by a BACnet Abort PDU (ASHRAE 135 clause 21, BACnetAbortReason).
 */
public enum AbortReason
{
    OTHER(0),
    BUFFER_OVERFLOW(1),
    INVALID_APDU_IN_THIS_STATE(2),
    PREEMPTED_BY_HIGHER_PRIORITY_TASK(3),
    SEGMENTATION_NOT_SUPPORTED(4),
    SECURITY_ERROR(5),
    INSUFFICIENT_SECURITY(6),
    WINDOW_SIZE_OUT_OF_RANGE(7),
    APPLICATION_EXCEEDED_REPLY_TIME(8),
    OUT_OF_RESOURCES(9),
    TSM_TIMEOUT(10),
    APDU_TOO_LONG(11);

    private final int code;

    AbortReason(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Unknown and proprietary codes map to {@link #OTHER}. */
    public static AbortReason fromCode(int code) {
        for (AbortReason reason : values()) {
            if (reason.code == code) {
                return reason;
            }
        }
        return OTHER;
    }
}
