package com.questrail.bacnet.api;

import java.util.Objects;

/**
 * PropertyIdentifier
 * -----------------------------------------------------------------------------
 * Name of a BACnet property in the generic object model ({@code present-value},
 * {@code object-list}, ...).
 *
 * <p>Identifiers are kept as kebab-case names rather than a closed enum:
 * proprietary and newer standard properties pass through the core untouched.
 * Mapping a name to its numeric wire code is the codec's concern.</p>
 */
public record PropertyIdentifier(String name)
{
    public static final PropertyIdentifier ALL = new PropertyIdentifier("all");
    public static final PropertyIdentifier OBJECT_IDENTIFIER = new PropertyIdentifier("object-identifier");
    public static final PropertyIdentifier OBJECT_TYPE = new PropertyIdentifier("object-type");
    public static final PropertyIdentifier OBJECT_NAME = new PropertyIdentifier("object-name");
    public static final PropertyIdentifier OBJECT_LIST = new PropertyIdentifier("object-list");
    public static final PropertyIdentifier PRESENT_VALUE = new PropertyIdentifier("present-value");
    public static final PropertyIdentifier DESCRIPTION = new PropertyIdentifier("description");
    public static final PropertyIdentifier STATUS_FLAGS = new PropertyIdentifier("status-flags");
    public static final PropertyIdentifier UNITS = new PropertyIdentifier("units");
    public static final PropertyIdentifier VENDOR_NAME = new PropertyIdentifier("vendor-name");
    public static final PropertyIdentifier VENDOR_IDENTIFIER = new PropertyIdentifier("vendor-identifier");
    public static final PropertyIdentifier MODEL_NAME = new PropertyIdentifier("model-name");
    public static final PropertyIdentifier PROTOCOL_SERVICES_SUPPORTED =
            new PropertyIdentifier("protocol-services-supported");

    public PropertyIdentifier {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("property name must not be blank");
        }
    }

    public static PropertyIdentifier of(String name) {
        return new PropertyIdentifier(name);
    }

    /**
     * True for the properties that identify an object and therefore can never
     * be written through a property update.
     */
    public boolean isIdentity() {
        return this.equals(OBJECT_IDENTIFIER) || this.equals(OBJECT_TYPE);
    }

    @Override
    public String toString() {
        return name;
    }
}
