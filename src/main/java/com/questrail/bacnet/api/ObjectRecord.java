package com.questrail.bacnet.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ObjectRecord
 * =============================================================================
 * Immutable snapshot of a BACnet object: its identifier plus a map from
 * property identifier to an opaque typed value.
 *
 * <h2>Identity</h2>
 * The identifier is held apart from the property map. The {@code object-identifier}
 * and {@code object-type} entries are never stored in {@link #properties()};
 * if the caller supplies them they are dropped, because the identifier field is
 * the only authority for them. {@link #asPropertyMap()} re-adds both entries for
 * callers that want the object exactly as a remote read would present it.
 *
 * <h2>Values</h2>
 * Values are whatever the property codec produces (numbers, strings, booleans,
 * object identifiers, lists). The core never inspects them. {@code null} is a
 * legal value (BACnet {@code Null}).
 */
public record ObjectRecord(ObjectIdentifier objectIdentifier, Map<PropertyIdentifier, Object> properties)
{
    public ObjectRecord {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
        Objects.requireNonNull(properties, "properties");

        Map<PropertyIdentifier, Object> copy = new LinkedHashMap<>();
        properties.forEach((id, value) -> {
            if (!Objects.requireNonNull(id, "property identifier").isIdentity()) {
                copy.put(id, value);
            }
        });
        properties = Collections.unmodifiableMap(copy);
    }

    public static ObjectRecord of(ObjectIdentifier id) {
        return new ObjectRecord(id, Map.of());
    }

    public static ObjectRecord of(ObjectIdentifier id, Map<PropertyIdentifier, Object> properties) {
        return new ObjectRecord(id, properties);
    }

    public ObjectType objectType() {
        return objectIdentifier.type();
    }

    public boolean has(PropertyIdentifier property) {
        return properties.containsKey(property);
    }

    /**
     * Value of a property. An absent property and a property holding BACnet
     * {@code Null} both yield an empty optional; use {@link #has} to tell them apart.
     */
    public Optional<Object> property(PropertyIdentifier property) {
        return Optional.ofNullable(properties.get(property));
    }

    /**
     * Returns a record with the given properties written over this one.
     * Identity properties in {@code updates} are ignored.
     */
    public ObjectRecord withProperties(Map<PropertyIdentifier, Object> updates) {
        Map<PropertyIdentifier, Object> merged = new LinkedHashMap<>(properties);
        merged.putAll(updates);
        return new ObjectRecord(objectIdentifier, merged);
    }

    public ObjectRecord withProperty(PropertyIdentifier property, Object value) {
        Map<PropertyIdentifier, Object> update = new LinkedHashMap<>();
        update.put(property, value);
        return withProperties(update);
    }

    public ObjectRecord withoutProperty(PropertyIdentifier property) {
        Map<PropertyIdentifier, Object> remaining = new LinkedHashMap<>(properties);
        remaining.remove(property);
        return new ObjectRecord(objectIdentifier, remaining);
    }

    /** The object with {@code object-identifier} and {@code object-type} included. */
    public Map<PropertyIdentifier, Object> asPropertyMap() {
        Map<PropertyIdentifier, Object> all = new LinkedHashMap<>();
        all.put(PropertyIdentifier.OBJECT_IDENTIFIER, objectIdentifier);
        all.put(PropertyIdentifier.OBJECT_TYPE, objectIdentifier.type());
        all.putAll(properties);
        return Collections.unmodifiableMap(all);
    }
}
