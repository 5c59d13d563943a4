package com.questrail.bacnet.transport.codec;

import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.UnconfirmedRequest;
import com.questrail.bacnet.transport.ApduFailure;

/**
 * BacnetApduCodec
 * =============================================================================
 * Converts between service-level messages and BACnet/IP datagram payloads
 * (BVLC + NPDU + APDU).
 *
 * <p>Property values cross this boundary as opaque Java values; mapping them to
 * BACnet application tags is entirely the codec's business. Implementations
 * must be stateless and thread-safe.</p>
 */
public interface BacnetApduCodec
{
    byte[] encodeConfirmed(int invokeId, ConfirmedRequest request);

    /**
     * @param broadcast selects the broadcast or unicast BVLC function
     */
    byte[] encodeUnconfirmed(UnconfirmedRequest request, boolean broadcast);

    /**
     * @param ack acknowledgement value, {@code null} for a SimpleAck
     */
    byte[] encodeAcknowledgement(int invokeId, ConfirmedRequest answered, Object ack);

    byte[] encodeFailure(int invokeId, ConfirmedRequest answered, ApduFailure failure);

    /**
     * @throws ApduDecodeException if the payload is not a well-formed APDU
     */
    InboundApdu decode(byte[] payload);
}
