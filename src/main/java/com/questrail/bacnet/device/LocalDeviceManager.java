package com.questrail.bacnet.device;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.PropertyValues;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.error.DeviceNotInitializedException;
import com.questrail.bacnet.error.ObjectNotFoundException;
import com.questrail.bacnet.internal.time.WallClock;
import com.questrail.bacnet.observability.BacnetErrorEvent;
import com.questrail.bacnet.observability.BacnetObservabilitySink;
import com.questrail.bacnet.observability.DeviceLifecycleEvent;
import com.questrail.bacnet.transport.BacnetTransport;
import com.questrail.bacnet.transport.BacnetTransportFactory;
import com.questrail.bacnet.transport.BacnetTransportListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * LocalDeviceManager
 * =============================================================================
 * Owns the single current {@link LocalDevice} of a node.
 *
 * <h2>Current device</h2>
 * The current device sits behind an atomic reference. {@link #create} and
 * {@link #reset} replace it; every other operation dereferences it afresh, so
 * callers never hold on to a stale device across a reset.
 *
 * <pre>
 *   create(config) → initialize() → (serve) → terminate()
 *          ↑                                       │
 *          └──────────── reset(overrides) ─────────┘
 * </pre>
 *
 * <h2>Objects</h2>
 * The object table lives in the device's transport. All local changes go
 * through this class; {@link #addOrUpdateObject} never touches the identifier
 * or type of an object.
 *
 * <h2>Concurrency</h2>
 * Object operations are serialized on an internal lock. Concurrent
 * {@link #reset} or {@link #restore} calls must be serialized by the caller.
 */
public final class LocalDeviceManager
{
    private static final Logger log = LoggerFactory.getLogger(LocalDeviceManager.class);

    private final BacnetTransportFactory transportFactory;
    private final BacnetObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicReference<LocalDevice> current = new AtomicReference<>();
    private final List<BacnetTransportListener> transportListeners = new CopyOnWriteArrayList<>();
    private final Object objectLock = new Object();

    public LocalDeviceManager(BacnetTransportFactory transportFactory,
                              BacnetObservabilitySink sink,
                              WallClock wallClock) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Build a new device and make it current. A previous device is neither
     * terminated nor merged; call {@link #terminate()} first if it is live.
     *
     * @throws com.questrail.bacnet.error.ConfigurationException if an address
     *         of {@code config} cannot be resolved
     */
    public LocalDevice create(LocalDeviceConfig config) {
        Objects.requireNonNull(config, "config");
        BacnetTransport transport = transportFactory.create(config);
        transport.setPort(config.port());
        DeviceTunables.from(config).applyTo(transport);
        transportListeners.forEach(transport::addListener);

        LocalDevice device = new LocalDevice(config, transport);
        current.set(device);
        publish(device, null, LocalDeviceState.UNINITIALIZED);
        return device;
    }

    public LocalDevice create() {
        return create(LocalDeviceConfig.defaults());
    }

    /**
     * Bind the current device to its port.
     *
     * @throws com.questrail.bacnet.error.PortBindException if the port is held
     *         by another device; the current device is then terminated
     */
    public void initialize() {
        LocalDevice device = requireCurrent();
        LocalDeviceState before = device.state();
        try {
            device.initialize();
        }
        finally {
            publish(device, before, device.state());
        }
    }

    /**
     * Release the current device's port. A missing, uninitialized or already
     * terminated device is left as it is. A failure inside the transport is
     * logged and reported to the sink; the device ends up terminated either way.
     */
    public void terminate() {
        LocalDevice device = current.get();
        if (device == null) {
            log.debug("terminate(): no local device");
            return;
        }
        boolean released;
        try {
            released = device.terminate();
        }
        catch (RuntimeException e) {
            log.warn("terminate(): transport of device {} failed to shut down cleanly", device.deviceId(), e);
            sink.onError(new BacnetErrorEvent(wallClock.now(),
                    "Terminating local device " + device.deviceId() + " failed", e));
            released = true;
        }
        if (released) {
            publish(device, LocalDeviceState.INITIALIZED, LocalDeviceState.TERMINATED);
        }
        else {
            log.debug("terminate(): device {} is {}, nothing to release", device.deviceId(), device.state());
        }
    }

    /** Terminate and forget the current device. */
    public void clearAll() {
        terminate();
        current.set(null);
    }

    public Optional<LocalDevice> currentDevice() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws DeviceNotInitializedException if there is no current device
     */
    public LocalDevice requireCurrent() {
        LocalDevice device = current.get();
        if (device == null) {
            throw new DeviceNotInitializedException("no local device has been created");
        }
        return device;
    }

    public boolean isInitialized() {
        LocalDevice device = current.get();
        return device != null && device.isInitialized();
    }

    public void tune(DeviceTunables tunables) {
        requireCurrent().apply(Objects.requireNonNull(tunables, "tunables"));
    }

    /**
     * Register a listener on the current device and on every device created
     * later, so it survives {@link #reset}.
     */
    public void addTransportListener(BacnetTransportListener listener) {
        transportListeners.add(Objects.requireNonNull(listener, "listener"));
        currentDevice().ifPresent(d -> d.transport().addListener(listener));
    }

    public void removeTransportListener(BacnetTransportListener listener) {
        transportListeners.remove(listener);
        currentDevice().ifPresent(d -> d.transport().removeListener(listener));
    }

    // ---------------------------------------------------------------------
    // Objects
    // ---------------------------------------------------------------------

    /**
     * Create the object if it does not exist, then write every given property
     * over it. Returns the resulting record.
     *
     * @throws IllegalArgumentException for the device object, or for a value
     *         outside {@link PropertyValues}
     */
    public ObjectRecord addOrUpdateObject(ObjectRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.objectIdentifier().isDevice()) {
            throw new IllegalArgumentException("the device object cannot be edited: " + record.objectIdentifier());
        }
        PropertyValues.requireSupported(record);
        BacnetTransport transport = requireCurrent().transport();
        synchronized (objectLock) {
            Optional<ObjectRecord> existing = transport.getObject(record.objectIdentifier());
            if (existing.isPresent()) {
                ObjectRecord merged = existing.get().withProperties(record.properties());
                transport.replaceObject(merged);
                return merged;
            }
            transport.addObject(record);
            return record;
        }
    }

    /**
     * @throws ObjectNotFoundException if no local object has this identifier
     */
    public ObjectRecord removeObject(ObjectIdentifier id) {
        Objects.requireNonNull(id, "id");
        BacnetTransport transport = requireCurrent().transport();
        synchronized (objectLock) {
            return transport.removeObject(id).orElseThrow(() -> new ObjectNotFoundException(id));
        }
    }

    public void removeAllObjects() {
        BacnetTransport transport = requireCurrent().transport();
        synchronized (objectLock) {
            for (ObjectRecord o : transport.getLocalObjects()) {
                transport.removeObject(o.objectIdentifier());
            }
        }
    }

    /** Every local object except the device object, ordered by identifier. */
    public List<ObjectRecord> localObjects() {
        return List.copyOf(requireCurrent().transport().getLocalObjects());
    }

    public Optional<ObjectRecord> getObject(ObjectIdentifier id) {
        return requireCurrent().transport().getObject(Objects.requireNonNull(id, "id"));
    }

    // ---------------------------------------------------------------------
    // Backup and reset
    // ---------------------------------------------------------------------

    /**
     * Snapshot of the current device. The configuration carries the port and
     * tunables actually in force, which may differ from the ones it was
     * created with.
     */
    public ConfigBackup backup() {
        LocalDevice device = requireCurrent();
        BacnetTransport transport = device.transport();
        DeviceTunables tunables = device.tunables();
        LocalDeviceConfig live = device.config().toBuilder()
                .withPort(transport.getPort())
                .withRetries(tunables.retries())
                .withTimeout(tunables.timeout())
                .withSegTimeout(tunables.segTimeout())
                .withSegWindow(tunables.segWindow())
                .build();
        return new ConfigBackup(live, tunables, localObjects());
    }

    /**
     * Replace the current device with one built from its own backup with
     * {@code overrides} applied, then put every object back. This is the only
     * way to change the device id or port of a node.
     *
     * <pre>
     *   manager.reset(b -> b.withDeviceId(1112));
     * </pre>
     */
    public LocalDevice reset(Consumer<LocalDeviceConfig.Builder> overrides) {
        Objects.requireNonNull(overrides, "overrides");
        ConfigBackup snapshot = current.get() != null
                ? backup()
                : ConfigBackup.of(LocalDeviceConfig.defaults());

        LocalDeviceConfig.Builder builder = snapshot.config().toBuilder();
        overrides.accept(builder);
        LocalDeviceConfig merged = builder.build();

        return rebuild(merged, DeviceTunables.from(merged), snapshot.objects());
    }

    public LocalDevice reset() {
        return reset(b -> { });
    }

    /** Replace the current device with the one described by {@code backup}. */
    public LocalDevice restore(ConfigBackup backup) {
        Objects.requireNonNull(backup, "backup");
        return rebuild(backup.config(), backup.tunables(), backup.objects());
    }

    private LocalDevice rebuild(LocalDeviceConfig config, DeviceTunables tunables, List<ObjectRecord> objects) {
        terminate();
        LocalDevice device = create(config);
        device.apply(tunables);
        initialize();
        for (ObjectRecord o : objects) {
            addOrUpdateObject(o);
        }
        log.info("Local device {} rebuilt on port {} with {} object(s)",
                device.deviceId(), device.transport().getPort(), objects.size());
        return device;
    }

    private void publish(LocalDevice device, LocalDeviceState from, LocalDeviceState to) {
        if (from == to) {
            return;
        }
        sink.onDeviceLifecycle(new DeviceLifecycleEvent(
                wallClock.now(), device.deviceId(), device.transport().getPort(), from, to));
    }
}
