package com.questrail.bacnet.device;

import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.error.PortBindException;
import com.questrail.bacnet.transport.BacnetTransport;

import java.util.Objects;

/**
 * LocalDevice
 * =============================================================================
 * One live local device: the configuration it was built from plus the transport
 * that binds its port.
 *
 * <p>Instances are single-use. Once terminated (or after a failed bind) a
 * device stays terminated; the manager builds a new one instead.</p>
 */
public final class LocalDevice
{
    private final LocalDeviceConfig config;
    private final BacnetTransport transport;

    private volatile LocalDeviceState state = LocalDeviceState.UNINITIALIZED;

    LocalDevice(LocalDeviceConfig config, BacnetTransport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public LocalDeviceConfig config() {
        return config;
    }

    public BacnetTransport transport() {
        return transport;
    }

    public int deviceId() {
        return config.deviceId();
    }

    public LocalDeviceState state() {
        return state;
    }

    public boolean isInitialized() {
        return state == LocalDeviceState.INITIALIZED && transport.isInitialized();
    }

    synchronized void initialize() {
        if (state != LocalDeviceState.UNINITIALIZED) {
            throw new IllegalStateException("device " + deviceId() + " is " + state);
        }
        try {
            transport.initialize();
        }
        catch (PortBindException e) {
            state = LocalDeviceState.TERMINATED;
            throw e;
        }
        state = LocalDeviceState.INITIALIZED;
    }

    /**
     * @return {@code false} when there was nothing to terminate
     */
    synchronized boolean terminate() {
        if (state != LocalDeviceState.INITIALIZED) {
            return false;
        }
        try {
            transport.terminate();
        }
        finally {
            state = LocalDeviceState.TERMINATED;
        }
        return true;
    }

    DeviceTunables tunables() {
        return DeviceTunables.from(transport);
    }

    void apply(DeviceTunables tunables) {
        tunables.applyTo(transport);
    }

    @Override
    public String toString() {
        return "LocalDevice{" + deviceId() + ", port " + transport.getPort() + ", " + state + "}";
    }
}
