package com.questrail.bacnet.api;

/**
 * Inclusive device-instance range used to limit WhoIs and WhoHas broadcasts.
 *
 * <p>The upper bound may be one past {@link ObjectIdentifier#MAX_INSTANCE}:
 * a WhoIs given only a lower bound asks for {@code [min, 4194304]}.</p>
 */
public record DeviceRange(int min, int max)
{
    /** Upper bound used when a WhoIs range omits its maximum. */
    public static final int WHO_IS_OPEN_MAX = ObjectIdentifier.MAX_INSTANCE + 1;

    /** Full device-id space as used by WhoHas. */
    public static final DeviceRange ALL = new DeviceRange(0, ObjectIdentifier.MAX_INSTANCE);

    public DeviceRange {
        if (min < 0) {
            throw new IllegalArgumentException("min must be >= 0: " + min);
        }
        if (max > WHO_IS_OPEN_MAX) {
            throw new IllegalArgumentException("max must be <= " + WHO_IS_OPEN_MAX + ": " + max);
        }
        if (min > max) {
            throw new IllegalArgumentException("min > max: " + min + " > " + max);
        }
    }

    public static DeviceRange of(int min, int max) {
        return new DeviceRange(min, max);
    }

    /**
     * Range for a WhoIs where either bound may be omitted ({@code null}).
     * Missing bounds default to 0 and {@link #WHO_IS_OPEN_MAX}.
     */
    public static DeviceRange whoIs(Integer min, Integer max) {
        return new DeviceRange(min == null ? 0 : min, max == null ? WHO_IS_OPEN_MAX : max);
    }

    public boolean contains(int deviceId) {
        return deviceId >= min && deviceId <= max;
    }
}
