package com.questrail.bacnet.transport.ip.netty;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.ObjectType;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.internal.time.ScheduledExecutorScheduler;
import com.questrail.bacnet.internal.time.SystemMonotonicClock;
import com.questrail.bacnet.service.ReadPropertyAck;
import com.questrail.bacnet.service.ReadPropertyRequest;
import com.questrail.bacnet.service.WhoIsRequest;
import com.questrail.bacnet.transport.ApduFailure;
import com.questrail.bacnet.transport.BacnetTransportListener;
import com.questrail.bacnet.transport.RegistryApduCodec;
import com.questrail.bacnet.transport.RemoteDevice;
import com.questrail.bacnet.transport.ResponseConsumer;
import com.questrail.bacnet.transport.ip.BacnetIpTransport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two BACnet/IP transports exchanging real UDP datagrams on 127.0.0.1.
 */
class BacnetIpLoopbackTest {

    private static final ObjectIdentifier AV1 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 1);

    private ScheduledExecutorService timers;
    private RegistryApduCodec codec;
    private BacnetIpTransport server;
    private BacnetIpTransport client;

    @BeforeEach
    void setUp() throws IOException {
        timers = Executors.newSingleThreadScheduledExecutor();
        codec = new RegistryApduCodec();
        int serverPort = freePort();
        int clientPort = freePort();
        server = transport(1234, serverPort, serverPort);
        client = transport(1338, clientPort, serverPort);
    }

    @AfterEach
    void tearDown() {
        client.terminate();
        server.terminate();
        timers.shutdownNow();
    }

    private BacnetIpTransport transport(int deviceId, int port, int destinationPort) {
        LocalDeviceConfig config = LocalDeviceConfig.builder()
                .withDeviceId(deviceId)
                .withBroadcastAddress("127.0.0.1")
                .withLocalAddress("127.0.0.1")
                .withPort(port)
                .withDestinationPort(destinationPort)
                .withTimeout(1_000)
                .withRetries(1)
                .build();
        return new BacnetIpTransport(config, NettyUdpDatagramEndpoint::new, codec,
                new ScheduledExecutorScheduler(timers, SystemMonotonicClock.INSTANCE), SystemMonotonicClock.INSTANCE);
    }

    private static int freePort() throws IOException {
        try (DatagramSocket socket = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    @Test
    void whoIsThenReadPropertyOverUdp() throws Exception {
        server.initialize();
        server.addObject(ObjectRecord.of(AV1, Map.of(PropertyIdentifier.PRESENT_VALUE, 20.0f)));
        client.initialize();

        CompletableFuture<RemoteDevice> announced = new CompletableFuture<>();
        client.addListener(new BacnetTransportListener() {
            @Override
            public void iAmReceived(RemoteDevice device) {
                announced.complete(device);
            }
        });
        client.sendBroadcast(server.getPort(), WhoIsRequest.everyone());
        RemoteDevice device = announced.get(5, TimeUnit.SECONDS);
        assertEquals(1234, device.instanceNumber());

        CompletableFuture<Object> answer = new CompletableFuture<>();
        client.send(device, new ReadPropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE), new ResponseConsumer() {
            @Override
            public void success(Object ack) {
                answer.complete(ack);
            }

            @Override
            public void fail(ApduFailure failure) {
                answer.complete(failure);
            }

            @Override
            public void ex(Throwable cause) {
                answer.completeExceptionally(cause);
            }
        });

        assertEquals(new ReadPropertyAck(AV1, PropertyIdentifier.PRESENT_VALUE, 20.0f), answer.get(5, TimeUnit.SECONDS));
    }

    @Test
    void requestToAStoppedPeerTimesOutAfterRetries() throws Exception {
        server.initialize();
        client.initialize();
        CompletableFuture<RemoteDevice> announced = new CompletableFuture<>();
        client.addListener(new BacnetTransportListener() {
            @Override
            public void iAmReceived(RemoteDevice device) {
                announced.complete(device);
            }
        });
        client.sendBroadcast(server.getPort(), WhoIsRequest.everyone());
        RemoteDevice device = announced.get(5, TimeUnit.SECONDS);
        server.terminate();

        CompletableFuture<Throwable> failed = new CompletableFuture<>();
        client.send(device, new ReadPropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE), new ResponseConsumer() {
            @Override
            public void success(Object ack) {
                failed.completeExceptionally(new AssertionError("unexpected ack " + ack));
            }

            @Override
            public void fail(ApduFailure failure) {
                failed.completeExceptionally(new AssertionError("unexpected failure " + failure));
            }

            @Override
            public void ex(Throwable cause) {
                failed.complete(cause);
            }
        });

        Throwable cause = failed.get(5, TimeUnit.SECONDS);
        assertTrue(cause.getMessage().contains("2 attempt(s)"), cause.getMessage());
    }
}
