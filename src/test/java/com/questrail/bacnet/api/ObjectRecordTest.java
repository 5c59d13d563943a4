package com.questrail.bacnet.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ObjectRecordTest {

    private static final ObjectIdentifier AV1 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 1);

    @Test
    void identityPropertiesNeverReachThePropertyMap() {
        Map<PropertyIdentifier, Object> props = new LinkedHashMap<>();
        props.put(PropertyIdentifier.OBJECT_IDENTIFIER, ObjectIdentifier.of(ObjectType.BINARY_VALUE, 9));
        props.put(PropertyIdentifier.OBJECT_TYPE, ObjectType.BINARY_VALUE);
        props.put(PropertyIdentifier.PRESENT_VALUE, 1.0f);

        ObjectRecord record = ObjectRecord.of(AV1, props);

        assertEquals(Map.of(PropertyIdentifier.PRESENT_VALUE, 1.0f), record.properties());
        assertEquals(AV1, record.asPropertyMap().get(PropertyIdentifier.OBJECT_IDENTIFIER));
        assertEquals(ObjectType.ANALOG_VALUE, record.asPropertyMap().get(PropertyIdentifier.OBJECT_TYPE));
    }

    @Test
    void updatesMergeOverExistingProperties() {
        ObjectRecord record = ObjectRecord.of(AV1, Map.of(
                PropertyIdentifier.OBJECT_NAME, "Zone temp",
                PropertyIdentifier.PRESENT_VALUE, 20.0f));

        ObjectRecord updated = record.withProperties(Map.of(
                PropertyIdentifier.PRESENT_VALUE, 21.0f,
                PropertyIdentifier.UNITS, "degrees-celsius"));

        assertEquals(Optional.of("Zone temp"), updated.property(PropertyIdentifier.OBJECT_NAME));
        assertEquals(Optional.of(21.0f), updated.property(PropertyIdentifier.PRESENT_VALUE));
        assertEquals(Optional.of(20.0f), record.property(PropertyIdentifier.PRESENT_VALUE));
        assertFalse(updated.withoutProperty(PropertyIdentifier.UNITS).has(PropertyIdentifier.UNITS));
    }

    @Test
    void nullIsAStoredValue() {
        ObjectRecord record = ObjectRecord.of(AV1).withProperty(PropertyIdentifier.DESCRIPTION, null);

        assertTrue(record.has(PropertyIdentifier.DESCRIPTION));
        assertEquals(Optional.empty(), record.property(PropertyIdentifier.DESCRIPTION));
    }

    @Test
    void propertyMapIsReadOnly() {
        ObjectRecord record = ObjectRecord.of(AV1, Map.of(PropertyIdentifier.PRESENT_VALUE, 1.0f));

        assertThrows(UnsupportedOperationException.class,
                () -> record.properties().put(PropertyIdentifier.UNITS, "percent"));
    }

    @Test
    void identifiersOrderByTypeThenInstance() {
        ObjectIdentifier device = ObjectIdentifier.device(5);
        ObjectIdentifier av2 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 2);

        List<ObjectIdentifier> sorted = new ArrayList<>(List.of(device, av2, AV1));
        Collections.sort(sorted);

        assertEquals(List.of(AV1, av2, device), sorted);
        assertThrows(IllegalArgumentException.class, () -> ObjectIdentifier.of(ObjectType.ANALOG_VALUE, -1));
        assertThrows(IllegalArgumentException.class,
                () -> ObjectIdentifier.of(ObjectType.ANALOG_VALUE, ObjectIdentifier.MAX_INSTANCE + 1));
    }
}
