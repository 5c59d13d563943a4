package com.questrail.bacnet.transport;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.service.Segmentation;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * RemoteDevice
 * =============================================================================
 * Entry of the transport's remote-device table, created from an I-Am.
 *
 * <p>The device id is the identity. The address and I-Am data are refreshed
 * whenever the device announces itself again. The extended information (names
 * and supported services) is filled in later by
 * {@link BacnetTransport#getExtendedDeviceInformation(RemoteDevice)} and stays
 * empty until then.</p>
 *
 * <p>Handles are never persisted; they are rediscovered on every boot.</p>
 */
public final class RemoteDevice
{
    private final int instanceNumber;

    private volatile SocketAddress address;
    private volatile int maxApduLengthAccepted;
    private volatile Segmentation segmentation;
    private volatile int vendorId;

    private volatile String name;
    private volatile String vendorName;
    private volatile String modelName;
    private volatile Object servicesSupported;

    public RemoteDevice(int instanceNumber, SocketAddress address, int maxApduLengthAccepted,
                        Segmentation segmentation, int vendorId) {
        if (instanceNumber < 0 || instanceNumber > ObjectIdentifier.MAX_INSTANCE) {
            throw new IllegalArgumentException("device instance out of range: " + instanceNumber);
        }
        this.instanceNumber = instanceNumber;
        this.address = Objects.requireNonNull(address, "address");
        this.maxApduLengthAccepted = maxApduLengthAccepted;
        this.segmentation = Objects.requireNonNull(segmentation, "segmentation");
        this.vendorId = vendorId;
    }

    public int instanceNumber() {
        return instanceNumber;
    }

    public ObjectIdentifier objectIdentifier() {
        return ObjectIdentifier.device(instanceNumber);
    }

    public SocketAddress address() {
        return address;
    }

    public int maxApduLengthAccepted() {
        return maxApduLengthAccepted;
    }

    public Segmentation segmentation() {
        return segmentation;
    }

    public int vendorId() {
        return vendorId;
    }

    /** Refresh from a repeated I-Am. */
    public void updateAnnouncement(SocketAddress address, int maxApduLengthAccepted,
                                   Segmentation segmentation, int vendorId) {
        this.address = Objects.requireNonNull(address, "address");
        this.maxApduLengthAccepted = maxApduLengthAccepted;
        this.segmentation = Objects.requireNonNull(segmentation, "segmentation");
        this.vendorId = vendorId;
    }

    public void updateExtendedInformation(String name, String vendorName, String modelName,
                                          Object servicesSupported) {
        this.name = name;
        this.vendorName = vendorName;
        this.modelName = modelName;
        this.servicesSupported = servicesSupported;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> vendorName() {
        return Optional.ofNullable(vendorName);
    }

    public Optional<String> modelName() {
        return Optional.ofNullable(modelName);
    }

    public Optional<Object> servicesSupported() {
        return Optional.ofNullable(servicesSupported);
    }

    public boolean hasExtendedInformation() {
        return name != null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RemoteDevice other && other.instanceNumber == instanceNumber;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(instanceNumber);
    }

    @Override
    public String toString() {
        return "RemoteDevice{" + instanceNumber + " @ " + address + (name != null ? " \"" + name + "\"" : "") + "}";
    }
}
