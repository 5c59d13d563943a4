package com.questrail.bacnet.bridge;

import com.questrail.bacnet.api.RequestOutcome;
import com.questrail.bacnet.device.LocalDevice;
import com.questrail.bacnet.device.LocalDeviceManager;
import com.questrail.bacnet.error.DeviceNotInitializedException;
import com.questrail.bacnet.error.RemoteDeviceNotFoundException;
import com.questrail.bacnet.error.TransportException;
import com.questrail.bacnet.internal.time.MonotonicClock;
import com.questrail.bacnet.internal.time.WallClock;
import com.questrail.bacnet.observability.BacnetObservabilitySink;
import com.questrail.bacnet.observability.RequestCompletedEvent;
import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.transport.ApduFailure;
import com.questrail.bacnet.transport.BacnetTransport;
import com.questrail.bacnet.transport.RemoteDevice;
import com.questrail.bacnet.transport.ResponseConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * RequestBridge
 * =============================================================================
 * Blocking front for the transport's callback-driven confirmed requests.
 *
 * <h2>One slot per request</h2>
 * Every call creates its own {@link CompletableFuture}, registers a
 * {@link ResponseConsumer} that completes it, and waits on it. Concurrent
 * callers never share a slot and are never serialized against each other.
 *
 * <h2>Classification</h2>
 * <pre>
 *   success(ack)   → Success(ack), or Success(true) for a simple ack
 *   fail(Abort)    → Abort(reason)
 *   fail(Reject)   → Reject(reason)
 *   fail(Error)    → Error(class, code)
 *   ex(cause)      → Timeout(cause)
 * </pre>
 *
 * <h2>Wait ceiling</h2>
 * The transport owns APDU timeouts and retries and always answers eventually.
 * The wait here is only a ceiling on top of that:
 * {@code apdu-timeout} when configured, else {@code timeout × (retries + 1)},
 * plus {@link #DEFAULT_GRACE}. When it runs out the slot is completed with a
 * {@code Timeout}; a transport answer arriving later finds the slot already
 * completed and is dropped.
 */
public final class RequestBridge
{
    private static final Logger log = LoggerFactory.getLogger(RequestBridge.class);

    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(1);

    private final LocalDeviceManager devices;
    private final BacnetObservabilitySink sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration grace;

    private final AtomicReference<Object> lastResponse = new AtomicReference<>();

    public RequestBridge(LocalDeviceManager devices, BacnetObservabilitySink sink,
                         MonotonicClock clock, WallClock wallClock) {
        this(devices, sink, clock, wallClock, DEFAULT_GRACE);
    }

    public RequestBridge(LocalDeviceManager devices, BacnetObservabilitySink sink,
                         MonotonicClock clock, WallClock wallClock, Duration grace) {
        this.devices = Objects.requireNonNull(devices, "devices");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.grace = Objects.requireNonNull(grace, "grace");
    }

    /**
     * Send to a device from the transport's remote-device table.
     *
     * @throws DeviceNotInitializedException if the local device is not initialized
     * @throws RemoteDeviceNotFoundException if the device has not been discovered
     */
    public RequestOutcome<Object> sendAndWait(int deviceId, ConfirmedRequest request) {
        LocalDevice local = requireInitialized();
        RemoteDevice device = local.transport().getRemoteDevice(deviceId)
                .orElseThrow(() -> new RemoteDeviceNotFoundException(deviceId));
        return sendAndWait(device, request);
    }

    /**
     * @throws DeviceNotInitializedException if the local device is not initialized
     */
    public RequestOutcome<Object> sendAndWait(RemoteDevice device, ConfirmedRequest request) {
        LocalDevice local = requireInitialized();
        return await(local.transport(), device, request, waitCeiling(local));
    }

    /**
     * Same as {@link #sendAndWait(RemoteDevice, ConfirmedRequest)} with an
     * explicit wait ceiling.
     */
    public RequestOutcome<Object> sendAndWait(RemoteDevice device, ConfirmedRequest request, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return await(requireInitialized().transport(), device, request, timeout);
    }

    /**
     * The last raw answer seen by any call: an acknowledgement value, an
     * {@link ApduFailure}, or the throwable behind a timeout.
     */
    public Optional<Object> lastResponse() {
        return Optional.ofNullable(lastResponse.get());
    }

    Duration waitCeiling(LocalDevice local) {
        Integer apduTimeout = local.config().apduTimeout();
        BacnetTransport transport = local.transport();
        Duration base = apduTimeout != null
                ? Duration.ofMillis(apduTimeout)
                : Duration.ofMillis((long) transport.getTimeout() * (transport.getRetries() + 1));
        return base.plus(grace);
    }

    private LocalDevice requireInitialized() {
        return devices.currentDevice()
                .filter(LocalDevice::isInitialized)
                .orElseThrow(() -> new DeviceNotInitializedException(
                        "cannot send a request while the local device is not initialized"));
    }

    private RequestOutcome<Object> await(BacnetTransport transport, RemoteDevice device,
                                         ConfirmedRequest request, Duration timeout) {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(request, "request");

        CompletableFuture<RequestOutcome<Object>> slot = new CompletableFuture<>();
        long start = clock.nowNanos();

        try {
            transport.send(device, request, new SlotConsumer(slot));
        }
        catch (RuntimeException e) {
            log.warn("Transport rejected {} for device {}", request.getClass().getSimpleName(),
                    device.instanceNumber(), e);
            lastResponse.set(e);
            slot.complete(RequestOutcome.timeout(e));
        }

        RequestOutcome<Object> outcome;
        try {
            outcome = slot.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            TransportException cause = new TransportException("no outcome from device "
                    + device.instanceNumber() + " within " + timeout.toMillis() + " ms");
            if (slot.complete(RequestOutcome.timeout(cause))) {
                lastResponse.set(cause);
            }
            outcome = slot.join();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slot.complete(RequestOutcome.timeout(e));
            outcome = slot.join();
        }
        catch (ExecutionException e) {
            // slots are only ever completed normally
            outcome = RequestOutcome.timeout(e.getCause());
        }

        sink.onRequestCompleted(new RequestCompletedEvent(wallClock.now(), device.instanceNumber(),
                request.getClass().getSimpleName(), outcome, Duration.ofNanos(clock.nowNanos() - start)));
        return outcome;
    }

    static RequestOutcome<Object> classify(ApduFailure failure) {
        if (failure instanceof ApduFailure.Abort abort) {
            return RequestOutcome.abort(abort.reason());
        }
        if (failure instanceof ApduFailure.Reject reject) {
            return RequestOutcome.reject(reject.reason());
        }
        ApduFailure.Error error = (ApduFailure.Error) failure;
        return RequestOutcome.error(error.errorClass(), error.errorCode());
    }

    /**
     * Completes one slot. Only the first delivery counts.
     */
    private final class SlotConsumer implements ResponseConsumer
    {
        private final CompletableFuture<RequestOutcome<Object>> slot;

        SlotConsumer(CompletableFuture<RequestOutcome<Object>> slot) {
            this.slot = slot;
        }

        @Override
        public void success(Object ack) {
            Object value = ack != null ? ack : Boolean.TRUE;
            if (slot.complete(RequestOutcome.success(value))) {
                lastResponse.set(value);
            }
        }

        @Override
        public void fail(ApduFailure failure) {
            if (slot.complete(classify(failure))) {
                lastResponse.set(failure);
            }
        }

        @Override
        public void ex(Throwable cause) {
            if (slot.complete(RequestOutcome.timeout(cause))) {
                lastResponse.set(cause);
            }
        }
    }
}
