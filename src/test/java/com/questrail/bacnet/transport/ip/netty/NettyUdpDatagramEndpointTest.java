package com.questrail.bacnet.transport.ip.netty;

import com.questrail.bacnet.error.PortBindException;
import com.questrail.bacnet.transport.DatagramEndpointListener;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds real UDP sockets on the loopback interface. Port 0 lets the OS pick a
 * free port; the bound port is then reused to provoke conflicts.
 */
class NettyUdpDatagramEndpointTest {

    private final List<NettyUdpDatagramEndpoint> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        started.forEach(NettyUdpDatagramEndpoint::stop);
    }

    private static InetSocketAddress loopback(int port) {
        return new InetSocketAddress(InetAddress.getLoopbackAddress(), port);
    }

    private NettyUdpDatagramEndpoint start(InetSocketAddress address, DatagramEndpointListener listener) {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(address);
        endpoint.setListener(listener);
        endpoint.start();
        started.add(endpoint);
        return endpoint;
    }

    private static final class QueueListener implements DatagramEndpointListener {
        final BlockingQueue<String> received = new ArrayBlockingQueue<>(16);
        final BlockingQueue<SocketAddress> senders = new ArrayBlockingQueue<>(16);

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            senders.add(remote);
            received.add(new String(payload, StandardCharsets.US_ASCII));
        }

        @Override
        public void onTransportDown(Throwable cause) {
        }
    }

    @Test
    void startRequiresAListener() {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(loopback(0));

        assertThrows(IllegalStateException.class, endpoint::start);
        assertNull(endpoint.localAddress());
        endpoint.stop();
    }

    @Test
    void secondBindOnTheSamePortFails() {
        NettyUdpDatagramEndpoint first = start(loopback(0), new QueueListener());
        int port = first.localAddress().getPort();

        NettyUdpDatagramEndpoint second = new NettyUdpDatagramEndpoint(loopback(port));
        second.setListener(new QueueListener());

        PortBindException e = assertThrows(PortBindException.class, second::start);
        assertEquals(port, e.port());
    }

    @Test
    void portIsFreeAgainAfterStop() {
        NettyUdpDatagramEndpoint first = start(loopback(0), new QueueListener());
        int port = first.localAddress().getPort();

        first.stop();
        started.remove(first);
        assertNull(first.localAddress());

        NettyUdpDatagramEndpoint again = start(loopback(port), new QueueListener());
        assertEquals(port, again.localAddress().getPort());
    }

    @Test
    void datagramsTravelBetweenTwoEndpoints() throws InterruptedException {
        QueueListener aListener = new QueueListener();
        QueueListener bListener = new QueueListener();
        NettyUdpDatagramEndpoint a = start(loopback(0), aListener);
        NettyUdpDatagramEndpoint b = start(loopback(0), bListener);

        a.send(b.localAddress(), "who-is".getBytes(StandardCharsets.US_ASCII));

        assertEquals("who-is", bListener.received.poll(2, TimeUnit.SECONDS));
        InetSocketAddress sender = (InetSocketAddress) bListener.senders.poll(2, TimeUnit.SECONDS);
        assertEquals(a.localAddress().getPort(), sender.getPort());

        b.send(sender, "i-am".getBytes(StandardCharsets.US_ASCII));
        assertEquals("i-am", aListener.received.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void sendBeforeStartIsDropped() {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(loopback(0));
        endpoint.setListener(new QueueListener());

        assertDoesNotThrow(() -> endpoint.send(loopback(9), new byte[]{1}));
        endpoint.stop();
    }
}
