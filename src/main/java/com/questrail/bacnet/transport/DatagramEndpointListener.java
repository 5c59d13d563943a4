package com.questrail.bacnet.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}. Callbacks are serialized by the
 * endpoint.
 */
public interface DatagramEndpointListener
{
    /**
     * One complete datagram. The payload is a private copy owned by the listener.
     */
    void onDatagram(SocketAddress remote, byte[] payload);

    /**
     * The endpoint stopped receiving.
     *
     * @param cause failure, or {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);
}
