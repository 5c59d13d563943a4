package com.questrail.bacnet.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRangeTest {

    @Test
    void missingWhoIsBoundsOpenTheRange() {
        assertEquals(new DeviceRange(0, DeviceRange.WHO_IS_OPEN_MAX), DeviceRange.whoIs(null, null));
        assertEquals(new DeviceRange(100, DeviceRange.WHO_IS_OPEN_MAX), DeviceRange.whoIs(100, null));
        assertEquals(new DeviceRange(0, 50), DeviceRange.whoIs(null, 50));
    }

    @Test
    void boundsAreInclusive() {
        DeviceRange range = DeviceRange.of(10, 20);

        assertTrue(range.contains(10));
        assertTrue(range.contains(20));
        assertFalse(range.contains(9));
        assertFalse(range.contains(21));
    }

    @Test
    void invalidRangesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DeviceRange.of(-1, 5));
        assertThrows(IllegalArgumentException.class, () -> DeviceRange.of(6, 5));
        assertThrows(IllegalArgumentException.class, () -> DeviceRange.of(0, DeviceRange.WHO_IS_OPEN_MAX + 1));
    }

    @Test
    void allCoversEveryDeviceInstance() {
        assertTrue(DeviceRange.ALL.contains(0));
        assertTrue(DeviceRange.ALL.contains(ObjectIdentifier.MAX_INSTANCE));
    }
}
