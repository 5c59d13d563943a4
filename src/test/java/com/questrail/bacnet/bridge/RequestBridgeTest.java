package com.questrail.bacnet.bridge;

import com.questrail.bacnet.api.AbortReason;
import com.questrail.bacnet.api.ErrorClass;
import com.questrail.bacnet.api.ErrorCode;
import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectType;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.api.RejectReason;
import com.questrail.bacnet.api.RequestOutcome;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.device.LocalDeviceManager;
import com.questrail.bacnet.error.DeviceNotInitializedException;
import com.questrail.bacnet.error.RemoteDeviceNotFoundException;
import com.questrail.bacnet.error.TransportException;
import com.questrail.bacnet.internal.time.SystemMonotonicClock;
import com.questrail.bacnet.observability.RecordingObservabilitySink;
import com.questrail.bacnet.observability.RequestCompletedEvent;
import com.questrail.bacnet.service.ReadPropertyAck;
import com.questrail.bacnet.service.ReadPropertyRequest;
import com.questrail.bacnet.service.WritePropertyRequest;
import com.questrail.bacnet.transport.ApduFailure;
import com.questrail.bacnet.transport.FakeBacnetTransport;
import com.questrail.bacnet.transport.FakeTransportFactory;
import com.questrail.bacnet.transport.ResponseConsumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestBridgeTest {

    private static final int REMOTE = 1234;
    private static final ObjectIdentifier AV1 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 1);
    private static final ReadPropertyRequest READ_PV = new ReadPropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE);

    private FakeTransportFactory transports;
    private LocalDeviceManager devices;
    private RecordingObservabilitySink sink;
    private RequestBridge bridge;

    @BeforeEach
    void setUp() {
        transports = new FakeTransportFactory().onCreate(t -> t.known(REMOTE));
        sink = new RecordingObservabilitySink();
        devices = new LocalDeviceManager(transports, sink, () -> Instant.EPOCH);
        bridge = new RequestBridge(devices, sink, SystemMonotonicClock.INSTANCE, () -> Instant.EPOCH,
                Duration.ofMillis(50));
    }

    private FakeBacnetTransport startLocalDevice(int timeoutMillis, int retries) {
        devices.create(LocalDeviceConfig.builder()
                .withBroadcastAddress("127.0.0.1")
                .withTimeout(timeoutMillis)
                .withRetries(retries)
                .build());
        devices.initialize();
        return transports.last();
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    @Test
    void complexAckIsSuccessWithTheDecodedValue() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        ReadPropertyAck ack = new ReadPropertyAck(AV1, PropertyIdentifier.PRESENT_VALUE, 72.5f);
        transport.respondWith((device, request, consumer) -> consumer.success(ack));

        RequestOutcome<Object> outcome = bridge.sendAndWait(REMOTE, READ_PV);

        assertEquals(RequestOutcome.success(ack), outcome);
        assertEquals(ack, bridge.lastResponse().orElseThrow());
    }

    @Test
    void simpleAckIsSuccessTrue() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        transport.respondWith((device, request, consumer) -> consumer.success(null));

        RequestOutcome<Object> outcome =
                bridge.sendAndWait(REMOTE, new WritePropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE, 72.5f));

        assertEquals(RequestOutcome.success(Boolean.TRUE), outcome);
    }

    @Test
    void abortRejectAndErrorAreClassified() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);

        transport.respondWith((d, r, c) -> c.fail(new ApduFailure.Abort(AbortReason.SEGMENTATION_NOT_SUPPORTED, true)));
        assertEquals(RequestOutcome.abort(AbortReason.SEGMENTATION_NOT_SUPPORTED), bridge.sendAndWait(REMOTE, READ_PV));

        transport.respondWith((d, r, c) -> c.fail(new ApduFailure.Reject(RejectReason.UNRECOGNIZED_SERVICE)));
        assertEquals(RequestOutcome.reject(RejectReason.UNRECOGNIZED_SERVICE), bridge.sendAndWait(REMOTE, READ_PV));

        ApduFailure.Error error = new ApduFailure.Error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED);
        transport.respondWith((d, r, c) -> c.fail(error));
        assertEquals(RequestOutcome.error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED),
                bridge.sendAndWait(REMOTE, READ_PV));
        assertEquals(error, bridge.lastResponse().orElseThrow());
    }

    @Test
    void transportExceptionIsTimeout() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        TransportException cause = new TransportException("retries exhausted");
        transport.respondWith((d, r, c) -> c.ex(cause));

        RequestOutcome<Object> outcome = bridge.sendAndWait(REMOTE, READ_PV);

        assertInstanceOf(RequestOutcome.Timeout.class, outcome);
        assertSame(cause, ((RequestOutcome.Timeout<Object>) outcome).cause());
    }

    @Test
    void synchronousSendFailureIsTimeout() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        transport.respondWith((d, r, c) -> {
            throw new IllegalStateException("socket closed");
        });

        assertInstanceOf(RequestOutcome.Timeout.class, bridge.sendAndWait(REMOTE, READ_PV));
    }

    // ---------------------------------------------------------------------
    // Exactly once
    // ---------------------------------------------------------------------

    @Test
    void onlyTheFirstDeliveryCounts() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        transport.respondWith((d, r, c) -> {
            c.success(null);
            c.fail(new ApduFailure.Reject(RejectReason.OTHER));
            c.ex(new TransportException("late"));
        });

        assertEquals(RequestOutcome.success(Boolean.TRUE), bridge.sendAndWait(REMOTE, READ_PV));
        assertEquals(Boolean.TRUE, bridge.lastResponse().orElseThrow());
    }

    @Test
    void silentTransportTimesOutAtTheCeilingAndLateAnswersAreDropped() throws Exception {
        FakeBacnetTransport transport = startLocalDevice(100, 1);
        AtomicReference<ResponseConsumer> held = new AtomicReference<>();
        transport.respondWith((d, r, c) -> held.set(c));

        long start = System.nanoTime();
        RequestOutcome<Object> outcome = bridge.sendAndWait(REMOTE, READ_PV);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertInstanceOf(RequestOutcome.Timeout.class, outcome);
        // 100 ms x 2 attempts + 50 ms grace
        assertTrue(elapsedMillis >= 240, "waited only " + elapsedMillis + " ms");

        held.get().success(null);
        assertInstanceOf(TransportException.class, bridge.lastResponse().orElseThrow());
    }

    @Test
    void waitCeilingPrefersApduTimeout() {
        devices.create(LocalDeviceConfig.builder()
                .withBroadcastAddress("127.0.0.1")
                .withTimeout(1_000)
                .withRetries(3)
                .withApduTimeout(2_500)
                .build());
        devices.initialize();

        assertEquals(Duration.ofMillis(2_550), bridge.waitCeiling(devices.requireCurrent()));

        devices.reset(b -> b.withApduTimeout(null));
        assertEquals(Duration.ofMillis(4_050), bridge.waitCeiling(devices.requireCurrent()));
    }

    // ---------------------------------------------------------------------
    // Preconditions
    // ---------------------------------------------------------------------

    @Test
    void uninitializedDeviceFailsBeforeAnyIo() {
        devices.create(LocalDeviceConfig.builder().withBroadcastAddress("127.0.0.1").build());
        FakeBacnetTransport transport = transports.last();

        assertThrows(DeviceNotInitializedException.class, () -> bridge.sendAndWait(REMOTE, READ_PV));
        assertTrue(transport.sentRequests().isEmpty());
    }

    @Test
    void noDeviceAtAllFailsBeforeAnyIo() {
        assertThrows(DeviceNotInitializedException.class, () -> bridge.sendAndWait(REMOTE, READ_PV));
    }

    @Test
    void undiscoveredRemoteDeviceIsNotFound() {
        startLocalDevice(1_000, 0);

        RemoteDeviceNotFoundException e =
                assertThrows(RemoteDeviceNotFoundException.class, () -> bridge.sendAndWait(9999, READ_PV));
        assertEquals(9999, e.deviceId());
    }

    // ---------------------------------------------------------------------
    // Concurrency and observability
    // ---------------------------------------------------------------------

    @Test
    void concurrentCallersEachGetTheirOwnAnswer() throws Exception {
        FakeBacnetTransport transport = startLocalDevice(5_000, 0);
        transport.respondWith((d, r, c) -> {
            WritePropertyRequest write = (WritePropertyRequest) r;
            // answer from another thread, as a real transport would
            new Thread(() -> c.success(write.value())).start();
        });

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<RequestOutcome<Object>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                int value = i;
                futures.add(pool.submit(() -> {
                    go.await();
                    return bridge.sendAndWait(REMOTE,
                            new WritePropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE, value));
                }));
            }
            go.countDown();
            for (int i = 0; i < callers; i++) {
                assertEquals(RequestOutcome.success(i), futures.get(i).get(10, TimeUnit.SECONDS));
            }
        }
        finally {
            pool.shutdownNow();
        }
    }

    @Test
    void everyRequestIsPublished() {
        FakeBacnetTransport transport = startLocalDevice(1_000, 0);
        transport.respondWith((d, r, c) -> c.fail(new ApduFailure.Reject(RejectReason.OTHER)));

        bridge.sendAndWait(REMOTE, READ_PV);

        List<RequestCompletedEvent> events = sink.eventsOfType(RequestCompletedEvent.class);
        assertEquals(1, events.size());
        assertEquals(REMOTE, events.get(0).remoteDeviceId());
        assertEquals("ReadPropertyRequest", events.get(0).service());
        assertEquals("Reject", events.get(0).outcomeKind());
    }
}
