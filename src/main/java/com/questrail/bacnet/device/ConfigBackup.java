package com.questrail.bacnet.device;

import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.config.LocalDeviceConfig;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to rebuild a local device: its configuration, the tunables
 * in force when the snapshot was taken, and every local object.
 */
public record ConfigBackup(LocalDeviceConfig config, DeviceTunables tunables, List<ObjectRecord> objects)
{
    public ConfigBackup {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(tunables, "tunables");
        objects = List.copyOf(Objects.requireNonNull(objects, "objects"));
    }

    /** Snapshot of a device that has no objects yet. */
    public static ConfigBackup of(LocalDeviceConfig config) {
        return new ConfigBackup(config, DeviceTunables.from(config), List.of());
    }
}
