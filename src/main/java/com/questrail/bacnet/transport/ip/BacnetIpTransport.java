package com.questrail.bacnet.transport.ip;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.config.NetworkAddresses;
import com.questrail.bacnet.error.DeviceNotInitializedException;
import com.questrail.bacnet.error.TransportException;
import com.questrail.bacnet.internal.time.Cancellable;
import com.questrail.bacnet.internal.time.MonotonicClock;
import com.questrail.bacnet.internal.time.MonotonicScheduler;
import com.questrail.bacnet.service.ConfirmedCovNotificationRequest;
import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.CovNotification;
import com.questrail.bacnet.service.IAmRequest;
import com.questrail.bacnet.service.IHaveRequest;
import com.questrail.bacnet.service.PropertyAccessError;
import com.questrail.bacnet.service.ReadPropertyMultipleAck;
import com.questrail.bacnet.service.ReadPropertyMultipleRequest;
import com.questrail.bacnet.service.Segmentation;
import com.questrail.bacnet.service.UnconfirmedCovNotificationRequest;
import com.questrail.bacnet.service.UnconfirmedRequest;
import com.questrail.bacnet.service.WhoHasRequest;
import com.questrail.bacnet.service.WhoIsRequest;
import com.questrail.bacnet.service.WritePropertyRequest;
import com.questrail.bacnet.transport.ApduFailure;
import com.questrail.bacnet.transport.BacnetTransport;
import com.questrail.bacnet.transport.BacnetTransportFactory;
import com.questrail.bacnet.transport.BacnetTransportListener;
import com.questrail.bacnet.transport.DatagramEndpoint;
import com.questrail.bacnet.transport.DatagramEndpointListener;
import com.questrail.bacnet.transport.RemoteDevice;
import com.questrail.bacnet.transport.ResponseConsumer;
import com.questrail.bacnet.transport.codec.ApduDecodeException;
import com.questrail.bacnet.transport.codec.BacnetApduCodec;
import com.questrail.bacnet.transport.codec.InboundApdu;
import com.questrail.bacnet.transport.ip.netty.NettyUdpDatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * BacnetIpTransport
 * =============================================================================
 * {@link BacnetTransport} for BACnet/IP over a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → BacnetApduCodec.decode
 *            → Acknowledgement / Failure   → pending transaction by invoke id and sender
 *            → ConfirmedReceived           → LocalObjectServer → ack / error back to sender
 *            → UnconfirmedReceived         → remote-device table, WhoIs / WhoHas answers, listeners
 * </pre>
 * Datagrams the codec cannot decode are dropped.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   ConfirmedRequest → invoke id → BacnetApduCodec.encodeConfirmed → DatagramEndpoint.send
 *                                    ↳ APDU timer on MonotonicScheduler
 * </pre>
 *
 * <h2>Transactions</h2>
 * Each confirmed request holds one invoke id (0-255) until it completes. When the
 * APDU timer fires the request is sent again, up to {@code retries} times; after
 * that the consumer gets {@link ResponseConsumer#ex}. Only an answer from the
 * address the request went to can settle it. A transaction completes
 * exactly once: whichever of ack, failure, final timeout or terminate gets there
 * first wins and the rest are ignored.
 *
 * <h2>Threading</h2>
 * Inbound callbacks run on the endpoint's I/O thread and timers on the
 * scheduler's thread. Neither ever blocks.
 */
public final class BacnetIpTransport implements BacnetTransport, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(BacnetIpTransport.class);

    static final int INVOKE_ID_SPACE = 256;

    private static final InetAddress GLOBAL_BROADCAST = NetworkAddresses.resolve(NetworkAddresses.LIMITED_BROADCAST);
    private static final Duration EXTENDED_INFO_GRACE = Duration.ofSeconds(1);

    static final List<PropertyIdentifier> EXTENDED_INFO_PROPERTIES = List.of(
            PropertyIdentifier.OBJECT_NAME,
            PropertyIdentifier.VENDOR_NAME,
            PropertyIdentifier.MODEL_NAME,
            PropertyIdentifier.PROTOCOL_SERVICES_SUPPORTED);

    private enum Lifecycle { NEW, RUNNING, TERMINATED }

    private final int deviceId;
    private final int destinationPort;
    private final InetAddress broadcastAddress;
    private final InetAddress localAddress;

    private final Function<InetSocketAddress, DatagramEndpoint> endpointFactory;
    private final BacnetApduCodec codec;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private final LocalObjectServer objects;
    private final Map<Integer, Transaction> pending = new ConcurrentHashMap<>();
    private final Map<Integer, RemoteDevice> remoteDevices = new ConcurrentHashMap<>();
    private final List<BacnetTransportListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private int nextInvokeId;              // guarded by lock
    private volatile Lifecycle lifecycle = Lifecycle.NEW;
    private volatile DatagramEndpoint endpoint;

    private volatile int port;
    private volatile int timeout;
    private volatile int retries;
    private volatile int segTimeout;
    private volatile int segWindow;

    /**
     * @throws com.questrail.bacnet.error.ConfigurationException if the broadcast or
     *         local address of {@code config} cannot be resolved
     */
    public BacnetIpTransport(LocalDeviceConfig config,
                             Function<InetSocketAddress, DatagramEndpoint> endpointFactory,
                             BacnetApduCodec codec,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock)
    {
        Objects.requireNonNull(config, "config");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.deviceId = config.deviceId();
        this.destinationPort = config.destinationPort();
        this.broadcastAddress = NetworkAddresses.resolve(config.broadcastAddress());
        this.localAddress = config.localAddress() != null ? NetworkAddresses.resolve(config.localAddress()) : null;

        this.port = config.port();
        this.timeout = config.timeout();
        this.retries = config.retries();
        this.segTimeout = config.segTimeout();
        this.segWindow = config.segWindow();

        this.objects = new LocalObjectServer(deviceId, clock);
    }

    /**
     * Factory producing Netty-backed transports.
     */
    public static BacnetTransportFactory factory(BacnetApduCodec codec, MonotonicScheduler scheduler, MonotonicClock clock) {
        return factory(NettyUdpDatagramEndpoint::new, codec, scheduler, clock);
    }

    public static BacnetTransportFactory factory(Function<InetSocketAddress, DatagramEndpoint> endpointFactory,
                                                 BacnetApduCodec codec,
                                                 MonotonicScheduler scheduler,
                                                 MonotonicClock clock) {
        return config -> new BacnetIpTransport(config, endpointFactory, codec, scheduler, clock);
    }

    // -------------------------------------------------------------------------
    // Settings
    // -------------------------------------------------------------------------

    @Override
    public int deviceId() {
        return deviceId;
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    public void setPort(int port) {
        synchronized (lock) {
            if (lifecycle != Lifecycle.NEW) {
                throw new IllegalStateException("port can only be changed before initialize()");
            }
            this.port = port;
        }
    }

    @Override
    public int getTimeout() {
        return timeout;
    }

    @Override
    public void setTimeout(int timeoutMillis) {
        this.timeout = timeoutMillis;
    }

    @Override
    public int getRetries() {
        return retries;
    }

    @Override
    public void setRetries(int retries) {
        this.retries = retries;
    }

    @Override
    public int getSegTimeout() {
        return segTimeout;
    }

    @Override
    public void setSegTimeout(int segTimeoutMillis) {
        this.segTimeout = segTimeoutMillis;
    }

    @Override
    public int getSegWindow() {
        return segWindow;
    }

    @Override
    public void setSegWindow(int segWindow) {
        this.segWindow = segWindow;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void initialize() {
        synchronized (lock) {
            if (lifecycle != Lifecycle.NEW) {
                throw new IllegalStateException("transport for device " + deviceId + " is " + lifecycle);
            }
            InetSocketAddress bind = localAddress != null
                    ? new InetSocketAddress(localAddress, port)
                    : new InetSocketAddress(port);
            DatagramEndpoint ep = endpointFactory.apply(bind);
            ep.setListener(this);
            try {
                ep.start();
            }
            catch (RuntimeException e) {
                lifecycle = Lifecycle.TERMINATED;
                throw e;
            }
            endpoint = ep;
            lifecycle = Lifecycle.RUNNING;
        }
        log.info("Device {} bound to {}", deviceId, endpoint.localAddress());
    }

    @Override
    public void terminate() {
        DatagramEndpoint ep;
        synchronized (lock) {
            if (lifecycle != Lifecycle.RUNNING) {
                return;
            }
            lifecycle = Lifecycle.TERMINATED;
            ep = endpoint;
            endpoint = null;
        }
        ep.stop();

        TransportException terminated = new TransportException("device " + deviceId + " terminated");
        for (Transaction tx : List.copyOf(pending.values())) {
            complete(tx, () -> tx.consumer.ex(terminated));
        }
        log.info("Device {} terminated, port {} released", deviceId, port);
    }

    @Override
    public boolean isInitialized() {
        return lifecycle == Lifecycle.RUNNING;
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    @Override
    public void sendBroadcast(int port, UnconfirmedRequest request) {
        Objects.requireNonNull(request, "request");
        requireEndpoint().send(new InetSocketAddress(broadcastAddress, port), codec.encodeUnconfirmed(request, true));
    }

    @Override
    public void sendGlobalBroadcast(UnconfirmedRequest request) {
        Objects.requireNonNull(request, "request");
        requireEndpoint().send(new InetSocketAddress(GLOBAL_BROADCAST, destinationPort), codec.encodeUnconfirmed(request, true));
    }

    @Override
    public void send(RemoteDevice device, ConfirmedRequest request, ResponseConsumer consumer) {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(consumer, "consumer");

        DatagramEndpoint ep = endpoint;
        if (ep == null) {
            consumer.ex(new TransportException("device " + deviceId + " is not initialized"));
            return;
        }

        Transaction tx = null;
        synchronized (lock) {
            Integer invokeId = allocateInvokeId();
            if (invokeId != null) {
                tx = new Transaction(invokeId, device, device.address(), request, consumer,
                        codec.encodeConfirmed(invokeId, request));
                pending.put(invokeId, tx);
            }
        }
        if (tx == null) {
            consumer.ex(new TransportException("no free invoke id: " + INVOKE_ID_SPACE + " requests pending"));
            return;
        }
        transmit(ep, tx);
    }

    /** Next free invoke id after the last one handed out, or {@code null} if all are in use. */
    private Integer allocateInvokeId() {
        for (int i = 0; i < INVOKE_ID_SPACE; i++) {
            int candidate = (nextInvokeId + i) % INVOKE_ID_SPACE;
            if (!pending.containsKey(candidate)) {
                nextInvokeId = (candidate + 1) % INVOKE_ID_SPACE;
                return candidate;
            }
        }
        return null;
    }

    private void transmit(DatagramEndpoint ep, Transaction tx) {
        synchronized (tx) {
            if (tx.done.get()) {
                return;
            }
            tx.attempts++;
            tx.timer = scheduler.scheduleAfter(Duration.ofMillis(timeout), clock, () -> onApduTimeout(tx));
        }
        log.trace("Sending {} invoke id {} attempt {} to device {}",
                tx.request.getClass().getSimpleName(), tx.invokeId, tx.attempts, tx.device.instanceNumber());
        ep.send(tx.destination, tx.payload);
    }

    private void onApduTimeout(Transaction tx) {
        if (tx.done.get()) {
            return;
        }
        DatagramEndpoint ep = endpoint;
        boolean retry;
        synchronized (tx) {
            retry = ep != null && tx.attempts <= retries;
        }
        if (retry) {
            log.debug("No answer to invoke id {} from device {}, retrying", tx.invokeId, tx.device.instanceNumber());
            transmit(ep, tx);
            return;
        }
        TransportException cause = new TransportException("no response from device "
                + tx.device.instanceNumber() + " after " + tx.attempts + " attempt(s)");
        complete(tx, () -> tx.consumer.ex(cause));
    }

    private void complete(Transaction tx, Runnable delivery) {
        if (!tx.done.compareAndSet(false, true)) {
            return;
        }
        pending.remove(tx.invokeId, tx);
        synchronized (tx) {
            if (tx.timer != null) {
                tx.timer.cancel();
            }
        }
        try {
            delivery.run();
        }
        catch (RuntimeException e) {
            log.error("Response consumer for invoke id {} threw", tx.invokeId, e);
        }
    }

    // -------------------------------------------------------------------------
    // Remote devices
    // -------------------------------------------------------------------------

    @Override
    public Collection<RemoteDevice> getRemoteDevices() {
        List<RemoteDevice> devices = new ArrayList<>(remoteDevices.values());
        devices.sort(Comparator.comparingInt(RemoteDevice::instanceNumber));
        return devices;
    }

    @Override
    public Optional<RemoteDevice> getRemoteDevice(int deviceId) {
        return Optional.ofNullable(remoteDevices.get(deviceId));
    }

    @Override
    public void getExtendedDeviceInformation(RemoteDevice device) {
        Objects.requireNonNull(device, "device");
        ObjectIdentifier deviceObject = device.objectIdentifier();

        CompletableFuture<ReadPropertyMultipleAck> result = new CompletableFuture<>();
        send(device, ReadPropertyMultipleRequest.of(deviceObject, EXTENDED_INFO_PROPERTIES), new ResponseConsumer() {
            @Override
            public void success(Object ack) {
                if (ack instanceof ReadPropertyMultipleAck rpm) {
                    result.complete(rpm);
                }
                else {
                    result.completeExceptionally(new TransportException("unexpected acknowledgement " + ack));
                }
            }

            @Override
            public void fail(ApduFailure failure) {
                result.completeExceptionally(new TransportException(
                        "device " + device.instanceNumber() + " refused extended information request: " + failure));
            }

            @Override
            public void ex(Throwable cause) {
                result.completeExceptionally(cause);
            }
        });

        long waitMillis = (long) timeout * (retries + 1) + EXTENDED_INFO_GRACE.toMillis();
        ReadPropertyMultipleAck ack;
        try {
            ack = result.get(waitMillis, TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted fetching extended information of device " + device.instanceNumber(), e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException te) {
                throw te;
            }
            throw new TransportException("extended information of device " + device.instanceNumber() + " failed", cause);
        }
        catch (TimeoutException e) {
            throw new TransportException("extended information of device " + device.instanceNumber() + " timed out", e);
        }

        Map<PropertyIdentifier, Object> values = ack.resultsFor(deviceObject);
        device.updateExtendedInformation(
                text(values.get(PropertyIdentifier.OBJECT_NAME)),
                text(values.get(PropertyIdentifier.VENDOR_NAME)),
                text(values.get(PropertyIdentifier.MODEL_NAME)),
                readable(values.get(PropertyIdentifier.PROTOCOL_SERVICES_SUPPORTED)));
    }

    private static Object readable(Object value) {
        return value instanceof PropertyAccessError ? null : value;
    }

    private static String text(Object value) {
        Object v = readable(value);
        return v == null ? null : v.toString();
    }

    // -------------------------------------------------------------------------
    // Local object table
    // -------------------------------------------------------------------------

    @Override
    public void addObject(ObjectRecord record) {
        objects.add(Objects.requireNonNull(record, "record"));
    }

    @Override
    public Optional<ObjectRecord> getObject(ObjectIdentifier id) {
        return objects.get(Objects.requireNonNull(id, "id"));
    }

    @Override
    public void replaceObject(ObjectRecord record) {
        objects.replace(Objects.requireNonNull(record, "record"));
        notifyCovSubscribers(record.objectIdentifier());
    }

    @Override
    public Optional<ObjectRecord> removeObject(ObjectIdentifier id) {
        return objects.remove(Objects.requireNonNull(id, "id"));
    }

    @Override
    public Collection<ObjectRecord> getLocalObjects() {
        return objects.snapshot();
    }

    // -------------------------------------------------------------------------
    // Listeners
    // -------------------------------------------------------------------------

    @Override
    public void addListener(BacnetTransportListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(BacnetTransportListener listener) {
        listeners.remove(listener);
    }

    private void fireListeners(Consumer<BacnetTransportListener> call) {
        for (BacnetTransportListener l : listeners) {
            try {
                call.accept(l);
            }
            catch (RuntimeException e) {
                log.error("Transport listener {} threw", l, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            log.warn("Datagram endpoint of device {} failed", deviceId, cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        final InboundApdu apdu;
        try {
            apdu = codec.decode(payload);
        }
        catch (ApduDecodeException e) {
            log.debug("Dropping undecodable datagram from {}: {}", remote, e.getMessage());
            return;
        }

        if (apdu instanceof InboundApdu.Acknowledgement ack) {
            Transaction tx = pendingFrom(remote, ack.invokeId());
            if (tx != null) {
                complete(tx, () -> tx.consumer.success(ack.ack()));
            }
        }
        else if (apdu instanceof InboundApdu.Failure failure) {
            Transaction tx = pendingFrom(remote, failure.invokeId());
            if (tx != null) {
                complete(tx, () -> tx.consumer.fail(failure.failure()));
            }
        }
        else if (apdu instanceof InboundApdu.ConfirmedReceived confirmed) {
            onConfirmedRequest(remote, confirmed.invokeId(), confirmed.request());
        }
        else if (apdu instanceof InboundApdu.UnconfirmedReceived unconfirmed) {
            onUnconfirmedRequest(remote, unconfirmed.request());
        }
    }

    /** The transaction holding {@code invokeId}, provided its request was sent to {@code remote}. */
    private Transaction pendingFrom(SocketAddress remote, int invokeId) {
        Transaction tx = pending.get(invokeId);
        if (tx == null) {
            return null;
        }
        if (!tx.destination.equals(remote)) {
            log.debug("Ignoring answer for invoke id {} from {}, request went to {}",
                    invokeId, remote, tx.destination);
            return null;
        }
        return tx;
    }

    private void onConfirmedRequest(SocketAddress remote, int invokeId, ConfirmedRequest request) {
        DatagramEndpoint ep = endpoint;
        if (ep == null) {
            return;
        }
        if (request instanceof ConfirmedCovNotificationRequest cov) {
            fireListeners(l -> l.covNotificationReceived(cov.notification(), true));
            ep.send(remote, codec.encodeAcknowledgement(invokeId, request, null));
            return;
        }

        ServiceAnswer answer = objects.serve(request, remote);
        if (answer instanceof ServiceAnswer.Ack ack) {
            ep.send(remote, codec.encodeAcknowledgement(invokeId, request, ack.value()));
            if (request instanceof WritePropertyRequest write) {
                notifyCovSubscribers(write.objectIdentifier());
            }
        }
        else if (answer instanceof ServiceAnswer.Refused refused) {
            ep.send(remote, codec.encodeFailure(invokeId, request, refused.failure()));
        }
    }

    private void onUnconfirmedRequest(SocketAddress remote, UnconfirmedRequest request) {
        if (request instanceof IAmRequest iAm) {
            if (iAm.deviceId() == deviceId) {
                // our own broadcast looped back
                return;
            }
            RemoteDevice device = remoteDevices.compute(iAm.deviceId(), (id, existing) -> {
                if (existing == null) {
                    return new RemoteDevice(id, remote, iAm.maxApduLengthAccepted(),
                            iAm.segmentationSupported(), iAm.vendorId());
                }
                existing.updateAnnouncement(remote, iAm.maxApduLengthAccepted(),
                        iAm.segmentationSupported(), iAm.vendorId());
                return existing;
            });
            log.debug("I-Am from device {} at {}", iAm.deviceId(), remote);
            fireListeners(l -> l.iAmReceived(device));
        }
        else if (request instanceof IHaveRequest iHave) {
            fireListeners(l -> l.iHaveReceived(iHave));
        }
        else if (request instanceof WhoIsRequest whoIs) {
            if (whoIs.matches(deviceId)) {
                reply(remote, new IAmRequest(deviceId, LocalObjectServer.MAX_APDU_LENGTH_ACCEPTED,
                        Segmentation.NO_SEGMENTATION, LocalObjectServer.VENDOR_IDENTIFIER));
            }
        }
        else if (request instanceof WhoHasRequest whoHas) {
            if (whoHas.limits().contains(deviceId)) {
                Optional<ObjectRecord> found = whoHas.byName()
                        ? objects.findByName(whoHas.objectName())
                        : objects.get(whoHas.objectIdentifier());
                found.ifPresent(o -> reply(remote, new IHaveRequest(deviceId, o.objectIdentifier(),
                        o.property(PropertyIdentifier.OBJECT_NAME).map(Object::toString).orElse(null))));
            }
        }
        else if (request instanceof UnconfirmedCovNotificationRequest cov) {
            fireListeners(l -> l.covNotificationReceived(cov.notification(), false));
        }
    }

    private void reply(SocketAddress remote, UnconfirmedRequest answer) {
        DatagramEndpoint ep = endpoint;
        if (ep != null) {
            ep.send(remote, codec.encodeUnconfirmed(answer, false));
        }
    }

    private void notifyCovSubscribers(ObjectIdentifier id) {
        DatagramEndpoint ep = endpoint;
        if (ep == null) {
            return;
        }
        Optional<ObjectRecord> object = objects.get(id);
        if (object.isEmpty()) {
            return;
        }
        long now = clock.nowNanos();
        for (CovSubscription s : objects.subscribersFor(id)) {
            CovNotification notification = new CovNotification(s.processId(), deviceId, id,
                    s.secondsRemaining(now), objects.covValues(object.get()));
            ep.send(s.subscriber(), codec.encodeUnconfirmed(new UnconfirmedCovNotificationRequest(notification), false));
        }
    }

    private DatagramEndpoint requireEndpoint() {
        DatagramEndpoint ep = endpoint;
        if (ep == null) {
            throw new DeviceNotInitializedException("device " + deviceId + " is not initialized");
        }
        return ep;
    }

    /**
     * One confirmed request awaiting its answer.
     */
    private static final class Transaction
    {
        final int invokeId;
        final RemoteDevice device;
        final SocketAddress destination;
        final ConfirmedRequest request;
        final ResponseConsumer consumer;
        final byte[] payload;
        final AtomicBoolean done = new AtomicBoolean();

        int attempts;           // guarded by this
        Cancellable timer;      // guarded by this

        Transaction(int invokeId, RemoteDevice device, SocketAddress destination, ConfirmedRequest request,
                    ResponseConsumer consumer, byte[] payload) {
            this.invokeId = invokeId;
            this.device = device;
            this.destination = destination;
            this.request = request;
            this.consumer = consumer;
            this.payload = payload;
        }
    }
}
