package com.questrail.bacnet.discovery;

import com.questrail.bacnet.api.DeviceRange;
import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.device.LocalDevice;
import com.questrail.bacnet.device.LocalDeviceManager;
import com.questrail.bacnet.error.DeviceNotInitializedException;
import com.questrail.bacnet.error.RemoteDeviceNotFoundException;
import com.questrail.bacnet.error.TransportException;
import com.questrail.bacnet.internal.time.WallClock;
import com.questrail.bacnet.observability.BacnetErrorEvent;
import com.questrail.bacnet.observability.BacnetObservabilitySink;
import com.questrail.bacnet.observability.DiscoveryEvent;
import com.questrail.bacnet.service.WhoHasRequest;
import com.questrail.bacnet.service.WhoIsRequest;
import com.questrail.bacnet.transport.BacnetTransport;
import com.questrail.bacnet.transport.RemoteDevice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * DiscoveryService
 * =============================================================================
 * Finds remote devices by broadcasting WhoIs and letting the transport collect
 * the I-Am answers into its remote-device table.
 *
 * <h2>No completion signal</h2>
 * BACnet discovery never says "that was everyone". A discovery pass therefore
 * waits a fixed settle interval after the WhoIs, then works with whatever the
 * table holds. The wait is a plain sleep and is not cancellable.
 *
 * <h2>Retry</h2>
 * {@link #discoverWithRetries} repeats the pass until one finds at least one
 * device or the policy's attempt count runs out. An empty result after the last
 * attempt is a normal return, not an error.
 */
public final class DiscoveryService
{
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final LocalDeviceManager devices;
    private final DiscoveryPolicy policy;
    private final BacnetObservabilitySink sink;
    private final WallClock wallClock;

    public DiscoveryService(LocalDeviceManager devices, DiscoveryPolicy policy,
                            BacnetObservabilitySink sink, WallClock wallClock) {
        this.devices = Objects.requireNonNull(devices, "devices");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public DiscoveryPolicy policy() {
        return policy;
    }

    // ---------------------------------------------------------------------
    // Broadcasts
    // ---------------------------------------------------------------------

    /** Global WhoIs to every device. */
    public void sendWhoIs() {
        sendWhoIs(null);
    }

    /**
     * Global WhoIs. Only devices inside {@code range} answer; {@code null} asks
     * every device.
     */
    public void sendWhoIs(DeviceRange range) {
        transport().sendGlobalBroadcast(whoIs(range));
    }

    /** WhoIs as a local broadcast to an explicit UDP port. */
    public void sendWhoIs(DeviceRange range, int destinationPort) {
        transport().sendBroadcast(destinationPort, whoIs(range));
    }

    public void sendWhoHas(ObjectIdentifier objectIdentifier) {
        sendWhoHas(objectIdentifier, null);
    }

    /** WhoHas by object identifier; {@code null} range means every device. */
    public void sendWhoHas(ObjectIdentifier objectIdentifier, DeviceRange range) {
        transport().sendGlobalBroadcast(WhoHasRequest.forIdentifier(orAll(range), objectIdentifier));
    }

    public void sendWhoHas(String objectName) {
        sendWhoHas(objectName, null);
    }

    /** WhoHas by object name; {@code null} range means every device. */
    public void sendWhoHas(String objectName, DeviceRange range) {
        transport().sendGlobalBroadcast(WhoHasRequest.forName(orAll(range), objectName));
    }

    private static WhoIsRequest whoIs(DeviceRange range) {
        return range == null ? WhoIsRequest.everyone() : WhoIsRequest.within(range);
    }

    private static DeviceRange orAll(DeviceRange range) {
        return range == null ? DeviceRange.ALL : range;
    }

    // ---------------------------------------------------------------------
    // Discovery passes
    // ---------------------------------------------------------------------

    public Set<Integer> findDevicesAndExtendedInfo() {
        return findDevicesAndExtendedInfo(null);
    }

    /**
     * One discovery pass: WhoIs to the configured destination port, settle,
     * then fetch extended information of every device in the table.
     *
     * @return ids of every device the transport now knows
     */
    public Set<Integer> findDevicesAndExtendedInfo(DeviceRange range) {
        LocalDevice local = requireInitialized();
        BacnetTransport transport = local.transport();

        transport.sendBroadcast(local.config().destinationPort(), whoIs(range));
        settle();

        Set<Integer> ids = new TreeSet<>();
        for (RemoteDevice device : transport.getRemoteDevices()) {
            ids.add(device.instanceNumber());
            try {
                transport.getExtendedDeviceInformation(device);
            }
            catch (TransportException e) {
                log.warn("No extended information from device {}: {}", device.instanceNumber(), e.getMessage());
                sink.onError(new BacnetErrorEvent(wallClock.now(),
                        "extended information of device " + device.instanceNumber() + " failed", e));
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    public Set<Integer> discoverWithRetries() {
        return discoverWithRetries(null);
    }

    /**
     * Run discovery passes until one finds a device, at most
     * {@link DiscoveryPolicy#maxAttempts()} times.
     *
     * @return the last pass's result, empty if the network stayed silent
     */
    public Set<Integer> discoverWithRetries(DeviceRange range) {
        Set<Integer> found = Set.of();
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            found = findDevicesAndExtendedInfo(range);
            sink.onDiscovery(new DiscoveryEvent(wallClock.now(), attempt, found));
            if (!found.isEmpty()) {
                return found;
            }
        }
        log.info("No remote devices found after {} attempt(s)", policy.maxAttempts());
        return found;
    }

    private void settle() {
        try {
            Thread.sleep(policy.settleInterval().toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while waiting for I-Am answers", e);
        }
    }

    // ---------------------------------------------------------------------
    // Remote-device table
    // ---------------------------------------------------------------------

    public List<RemoteDevice> remoteDevices() {
        return List.copyOf(transport().getRemoteDevices());
    }

    /**
     * @throws RemoteDeviceNotFoundException if the device has not been discovered
     */
    public RemoteDevice remoteDevice(int deviceId) {
        return transport().getRemoteDevice(deviceId)
                .orElseThrow(() -> new RemoteDeviceNotFoundException(deviceId));
    }

    /**
     * Device id to object name, for every known device. The name is empty until
     * extended information has been fetched.
     */
    public Map<Integer, Optional<String>> remoteDevicesAndNames() {
        Map<Integer, Optional<String>> names = new LinkedHashMap<>();
        for (RemoteDevice device : transport().getRemoteDevices()) {
            names.put(device.instanceNumber(), device.name());
        }
        return Collections.unmodifiableMap(names);
    }

    private BacnetTransport transport() {
        return requireInitialized().transport();
    }

    private LocalDevice requireInitialized() {
        return devices.currentDevice()
                .filter(LocalDevice::isInitialized)
                .orElseThrow(() -> new DeviceNotInitializedException("the local device is not initialized"));
    }
}
