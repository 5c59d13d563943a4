package com.questrail.bacnet.transport;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.UnconfirmedRequest;

import java.util.Collection;
import java.util.Optional;

/**
 * BacnetTransport
 * =============================================================================
 * Port between the node core and a BACnet protocol stack.
 *
 * <p>One transport instance is one local device endpoint. It owns:</p>
 * <ul>
 *   <li>the bound network port ({@link #initialize()} / {@link #terminate()})</li>
 *   <li>confirmed-request transactions, including APDU timeout and retries</li>
 *   <li>the table of remote devices learned from I-Am</li>
 *   <li>the local object table served to remote readers and writers</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   new  → initialize() → (serve) → terminate()
 * </pre>
 * A terminated transport is never initialized again. {@link #terminate()} is
 * idempotent and a no-op on a transport that was never initialized.
 *
 * <h2>Local objects</h2>
 * The device object itself is synthesized from the configuration: it is served
 * to remote reads but is not part of {@link #getLocalObjects()}.
 */
public interface BacnetTransport
{
    // ---------------------------------------------------------------------
    // Settings
    // ---------------------------------------------------------------------

    int deviceId();

    int getPort();

    /** Only legal before {@link #initialize()}. */
    void setPort(int port);

    int getTimeout();

    void setTimeout(int timeoutMillis);

    int getRetries();

    void setRetries(int retries);

    int getSegTimeout();

    void setSegTimeout(int segTimeoutMillis);

    int getSegWindow();

    void setSegWindow(int segWindow);

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Bind the port and start serving.
     *
     * @throws com.questrail.bacnet.error.PortBindException if the port is taken
     * @throws IllegalStateException if already initialized or terminated
     */
    void initialize();

    /** Release the port. Pending requests complete with {@link ResponseConsumer#ex}. */
    void terminate();

    boolean isInitialized();

    // ---------------------------------------------------------------------
    // Sending
    // ---------------------------------------------------------------------

    /** Local broadcast to the given UDP port. */
    void sendBroadcast(int port, UnconfirmedRequest request);

    void sendGlobalBroadcast(UnconfirmedRequest request);

    /**
     * Start a confirmed transaction. Exactly one callback of {@code consumer}
     * fires once the transaction ends.
     */
    void send(RemoteDevice device, ConfirmedRequest request, ResponseConsumer consumer);

    // ---------------------------------------------------------------------
    // Remote devices
    // ---------------------------------------------------------------------

    Collection<RemoteDevice> getRemoteDevices();

    Optional<RemoteDevice> getRemoteDevice(int deviceId);

    /**
     * Fetch name, vendor, model and supported services of a device and store
     * them on the handle. Blocks the caller for one round-trip.
     *
     * @throws com.questrail.bacnet.error.TransportException if the fetch fails
     */
    void getExtendedDeviceInformation(RemoteDevice device);

    // ---------------------------------------------------------------------
    // Local object table
    // ---------------------------------------------------------------------

    /** @throws IllegalStateException if the identifier is already present */
    void addObject(ObjectRecord record);

    Optional<ObjectRecord> getObject(ObjectIdentifier id);

    /** @throws IllegalStateException if the identifier is absent */
    void replaceObject(ObjectRecord record);

    /** @return the removed record, empty if the identifier was absent */
    Optional<ObjectRecord> removeObject(ObjectIdentifier id);

    /** Snapshot of the table, ordered by identifier, device object excluded. */
    Collection<ObjectRecord> getLocalObjects();

    // ---------------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------------

    void addListener(BacnetTransportListener listener);

    void removeListener(BacnetTransportListener listener);
}
