package com.questrail.bacnet.api;

/**
 * Reason carried by a BACnet Reject PDU (BACnetRejectReason).
 */
public enum RejectReason
{
    OTHER(0),
    BUFFER_OVERFLOW(1),
    INCONSISTENT_PARAMETERS(2),
    INVALID_PARAMETER_DATA_TYPE(3),
    INVALID_TAG(4),
    MISSING_REQUIRED_PARAMETER(5),
    PARAMETER_OUT_OF_RANGE(6),
    TOO_MANY_ARGUMENTS(7),
    UNDEFINED_ENUMERATION(8),
    UNRECOGNIZED_SERVICE(9);

    private final int code;

    RejectReason(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static RejectReason fromCode(int code) {
        for (RejectReason reason : values()) {
            if (reason.code == code) {
                return reason;
            }
        }
        return OTHER;
    }
}
