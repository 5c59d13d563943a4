package com.questrail.bacnet.api;

import java.util.Locale;

/**
 * Standard BACnet object types.
 *
 * <p>Each constant carries the numeric type code used on the wire and the
 * kebab-case name used in the generic object model and in the backup file
 * ({@code analog-value}, {@code multi-state-input}, ...).</p>
 */
public enum ObjectType
{
    ANALOG_INPUT(0),
    ANALOG_OUTPUT(1),
    ANALOG_VALUE(2),
    BINARY_INPUT(3),
    BINARY_OUTPUT(4),
    BINARY_VALUE(5),
    CALENDAR(6),
    COMMAND(7),
    DEVICE(8),
    EVENT_ENROLLMENT(9),
    FILE(10),
    GROUP(11),
    LOOP(12),
    MULTI_STATE_INPUT(13),
    MULTI_STATE_OUTPUT(14),
    NOTIFICATION_CLASS(15),
    PROGRAM(16),
    SCHEDULE(17),
    AVERAGING(18),
    MULTI_STATE_VALUE(19),
    TREND_LOG(20),
    LIFE_SAFETY_POINT(21),
    LIFE_SAFETY_ZONE(22),
    ACCUMULATOR(23),
    PULSE_CONVERTER(24),
    EVENT_LOG(25),
    GLOBAL_GROUP(26),
    TREND_LOG_MULTIPLE(27),
    LOAD_CONTROL(28),
    STRUCTURED_VIEW(29),
    ACCESS_DOOR(30);

    private final int code;
    private final String kebabName;

    ObjectType(int code) {
        this.code = code;
        this.kebabName = name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Numeric BACnet object type. */
    public int code() {
        return code;
    }

    /** Name as used in the generic object model, e.g. {@code analog-value}. */
    public String kebabName() {
        return kebabName;
    }

    public static ObjectType fromCode(int code) {
        for (ObjectType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type code: " + code);
    }

    public static ObjectType fromKebabName(String name) {
        for (ObjectType type : values()) {
            if (type.kebabName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + name);
    }

    @Override
    public String toString() {
        return kebabName;
    }
}
