package com.questrail.bacnet.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Link-layer port for BACnet/IP: sends and receives raw UDP datagrams.
 *
 * <p>The endpoint moves bytes only. Decoding, transaction state and timers all
 * live in the transport above it.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket. Returns once the socket is bound.
     *
     * @throws com.questrail.bacnet.error.PortBindException if the address is in use
     */
    void start();

    /**
     * Close the socket. When this returns the port can be bound again.
     */
    void stop();

    /**
     * Send one datagram. Silently dropped while the endpoint is not started.
     */
    void send(SocketAddress remote, byte[] payload);

    /** Must be called before {@link #start()}. */
    void setListener(DatagramEndpointListener listener);

    /** Bound address, or {@code null} while not started. */
    InetSocketAddress localAddress();
}
