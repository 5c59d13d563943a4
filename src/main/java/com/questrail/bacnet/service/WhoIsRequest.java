package com.questrail.bacnet.service;

import com.questrail.bacnet.api.DeviceRange;

import java.util.Optional;

/**
 * WhoIs. Without a range every device answers; with a range only devices whose
 * instance number falls inside it answer.
 */
public record WhoIsRequest(Optional<DeviceRange> range) implements UnconfirmedRequest
{
    public WhoIsRequest {
        range = range == null ? Optional.empty() : range;
    }

    public static WhoIsRequest everyone() {
        return new WhoIsRequest(Optional.empty());
    }

    public static WhoIsRequest within(DeviceRange range) {
        return new WhoIsRequest(Optional.of(range));
    }

    /** True when a device with the given instance number must answer. */
    public boolean matches(int deviceId) {
        return range.map(r -> r.contains(deviceId)).orElse(true);
    }
}
