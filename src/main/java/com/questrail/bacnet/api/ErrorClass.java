package com.questrail.bacnet.api;

/**
 * BACnet error class, the first half of an application error.
 */
public enum ErrorClass
{
    DEVICE(0),
    OBJECT(1),
    PROPERTY(2),
    RESOURCES(3),
    SECURITY(4),
    SERVICES(5),
    VT(6),
    COMMUNICATION(7);

    private final int code;

    ErrorClass(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ErrorClass fromCode(int code) {
        for (ErrorClass errorClass : values()) {
            if (errorClass.code == code) {
                return errorClass;
            }
        }
        throw new IllegalArgumentException("Unknown error class: " + code);
    }
}
