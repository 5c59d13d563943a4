package com.questrail.bacnet.api;

import java.util.Comparator;
import java.util.Objects;

/**
 * BACnet object identifier: an object type plus an instance number.
 *
 * <p>The identifier is the identity of an object. It is immutable once the
 * object exists; every other property of the object may change.</p>
 */
public record ObjectIdentifier(ObjectType type, int instance) implements Comparable<ObjectIdentifier>
{
    /** Highest legal instance number (22 bits, 4194303 is "unconfigured"). */
    public static final int MAX_INSTANCE = 4_194_303;

    private static final Comparator<ObjectIdentifier> ORDER =
            Comparator.comparingInt((ObjectIdentifier id) -> id.type().code())
                    .thenComparingInt(ObjectIdentifier::instance);

    public ObjectIdentifier {
        Objects.requireNonNull(type, "type");
        if (instance < 0 || instance > MAX_INSTANCE) {
            throw new IllegalArgumentException("instance must be 0-" + MAX_INSTANCE + ": " + instance);
        }
    }

    public static ObjectIdentifier of(ObjectType type, int instance) {
        return new ObjectIdentifier(type, instance);
    }

    /** Identifier of the device object of the device with the given id. */
    public static ObjectIdentifier device(int deviceId) {
        return new ObjectIdentifier(ObjectType.DEVICE, deviceId);
    }

    public boolean isDevice() {
        return type == ObjectType.DEVICE;
    }

    @Override
    public int compareTo(ObjectIdentifier other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + type.kebabName() + " " + instance + "]";
    }
}
