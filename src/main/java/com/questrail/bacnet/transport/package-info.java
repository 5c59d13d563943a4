/**
 * Transport ports
 * =============================================================================
 *
 * Interfaces between the node core and the BACnet stack below it.
 *
 * <ul>
 *   <li>{@link com.questrail.bacnet.transport.BacnetTransport}: one local device
 *       endpoint with confirmed-request transactions, the remote-device table and
 *       the local object table</li>
 *   <li>{@link com.questrail.bacnet.transport.DatagramEndpoint}: raw UDP I/O</li>
 *   <li>{@link com.questrail.bacnet.transport.codec.BacnetApduCodec}: APDU bytes
 *       to service requests and back</li>
 * </ul>
 *
 * <p>Netty types never leave {@code transport.ip.netty}. Everything above the
 * endpoint sees {@code byte[]} and {@link java.net.SocketAddress} only.</p>
 */
package com.questrail.bacnet.transport;
