package com.questrail.bacnet.api;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Value domain of local object properties.
 *
 * <p>A local object may hold {@code null}, {@link Boolean}, {@link Byte},
 * {@link Short}, {@link Integer}, {@link Long}, {@link BigInteger},
 * {@link Float}, {@link Double}, {@link String}, {@link ObjectIdentifier} and
 * {@link ObjectType} values, plus {@link List}, {@link Set} and {@link Map}
 * values whose elements, keys and values are themselves in the domain. Every
 * table built from these can be backed up and read back equal.</p>
 *
 * <p>Values coming back from remote reads are not restricted.</p>
 */
public final class PropertyValues
{
    private PropertyValues() {
    }

    public static boolean isSupported(Object value) {
        if (value == null
                || value instanceof Boolean
                || value instanceof Byte
                || value instanceof Short
                || value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Float
                || value instanceof Double
                || value instanceof String
                || value instanceof ObjectIdentifier
                || value instanceof ObjectType) {
            return true;
        }
        if (value instanceof List<?> || value instanceof Set<?>) {
            return allSupported((Collection<?>) value);
        }
        if (value instanceof Map<?, ?> map) {
            return allSupported(map.keySet()) && allSupported(map.values());
        }
        return false;
    }

    private static boolean allSupported(Collection<?> values) {
        for (Object v : values) {
            if (!isSupported(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalArgumentException naming the first property whose value
     *         is outside the domain
     */
    public static void requireSupported(ObjectRecord record) {
        Objects.requireNonNull(record, "record");
        record.properties().forEach((property, value) -> {
            if (!isSupported(value)) {
                throw new IllegalArgumentException("unsupported value for " + property + " of "
                        + record.objectIdentifier() + ": " + value.getClass().getName());
            }
        });
    }
}
