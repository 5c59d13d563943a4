package com.questrail.bacnet.api;

/**
 * BACnet error code, the second half of an application error.
 *
 * <p>Only the codes this node produces or is likely to branch on are listed;
 * anything else decodes to {@link #OTHER}.</p>
 */
public enum ErrorCode
{
    OTHER(0),
    CONFIGURATION_IN_PROGRESS(2),
    DEVICE_BUSY(3),
    DYNAMIC_CREATION_NOT_SUPPORTED(4),
    INCONSISTENT_PARAMETERS(7),
    INVALID_DATA_TYPE(9),
    NO_OBJECTS_OF_SPECIFIED_TYPE(17),
    NO_SPACE_FOR_OBJECT(18),
    READ_ACCESS_DENIED(27),
    SERVICE_REQUEST_DENIED(29),
    TIMEOUT(30),
    UNKNOWN_OBJECT(31),
    UNKNOWN_PROPERTY(32),
    UNSUPPORTED_OBJECT_TYPE(36),
    VALUE_OUT_OF_RANGE(37),
    WRITE_ACCESS_DENIED(40),
    INVALID_ARRAY_INDEX(42),
    OBJECT_DELETION_NOT_PERMITTED(23),
    OBJECT_IDENTIFIER_ALREADY_EXISTS(24),
    PROPERTY_IS_NOT_AN_ARRAY(50);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return OTHER;
    }
}
