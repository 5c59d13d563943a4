package com.questrail.bacnet.backup;

import com.questrail.bacnet.device.ConfigBackup;

import java.util.Optional;

/**
 * Durable home of the last {@link ConfigBackup}.
 */
public interface BackupStore
{
    /** Replace any stored snapshot with {@code backup}. */
    void save(ConfigBackup backup);

    /** The stored snapshot, or empty if nothing was ever saved. */
    Optional<ConfigBackup> load();
}
