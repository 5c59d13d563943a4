package com.questrail.bacnet.observability;

import com.questrail.bacnet.device.LocalDeviceState;

import java.time.Instant;

/**
 * Local device lifecycle transition. {@code oldState} is {@code null} for a
 * newly created device.
 */
public record DeviceLifecycleEvent(
    Instant timestamp,
    int deviceId,
    int port,
    LocalDeviceState oldState,
    LocalDeviceState newState
) {
}
