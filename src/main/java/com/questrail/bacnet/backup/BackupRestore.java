package com.questrail.bacnet.backup;

import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.device.ConfigBackup;
import com.questrail.bacnet.device.LocalDevice;
import com.questrail.bacnet.device.LocalDeviceManager;
import com.questrail.bacnet.discovery.DiscoveryService;
import com.questrail.bacnet.error.NoBackupException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * BackupRestore
 * =============================================================================
 * Persists the local device's configuration and objects, and brings a node up
 * from the last saved state.
 *
 * <h2>Boot</h2>
 * <pre>
 *   boot()
 *     ├─ load()                       backup found: rebuild device from it
 *     │    └─ NoBackupException  →  create(default config) + initialize()
 *     └─ discoverWithRetries()        on the background executor
 * </pre>
 * {@link #boot()} returns as soon as the device is bound; the returned future
 * completes when discovery finishes.
 */
public final class BackupRestore
{
    private static final Logger log = LoggerFactory.getLogger(BackupRestore.class);

    private final LocalDeviceManager devices;
    private final BackupStore store;
    private final DiscoveryService discovery;
    private final Executor backgroundExecutor;
    private final LocalDeviceConfig defaultConfig;

    public BackupRestore(LocalDeviceManager devices,
                         BackupStore store,
                         DiscoveryService discovery,
                         Executor backgroundExecutor,
                         LocalDeviceConfig defaultConfig) {
        this.devices = Objects.requireNonNull(devices, "devices");
        this.store = Objects.requireNonNull(store, "store");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor, "backgroundExecutor");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
    }

    /** Snapshot the current device and store it, replacing any older snapshot. */
    public ConfigBackup save() {
        ConfigBackup backup = devices.backup();
        store.save(backup);
        return backup;
    }

    /**
     * Rebuild the local device from the stored snapshot.
     *
     * @throws NoBackupException if nothing has been saved
     */
    public LocalDevice load() {
        ConfigBackup backup = store.load()
                .orElseThrow(() -> new NoBackupException("no local device backup has been saved"));
        return devices.restore(backup);
    }

    /**
     * Bring the node up and start discovery in the background.
     *
     * @return future of the discovered device ids
     */
    public CompletableFuture<Set<Integer>> boot() {
        try {
            load();
        }
        catch (NoBackupException e) {
            log.info("No backup found, booting device {} with default configuration", defaultConfig.deviceId());
            devices.terminate();
            devices.create(defaultConfig);
            devices.initialize();
        }
        return CompletableFuture.supplyAsync(discovery::discoverWithRetries, backgroundExecutor);
    }
}
