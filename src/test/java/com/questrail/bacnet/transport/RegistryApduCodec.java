package com.questrail.bacnet.transport;

import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.UnconfirmedRequest;
import com.questrail.bacnet.transport.codec.ApduDecodeException;
import com.questrail.bacnet.transport.codec.BacnetApduCodec;
import com.questrail.bacnet.transport.codec.InboundApdu;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Codec for tests: every encoded message is kept in a registry and the payload
 * is just its 8-byte key. Nodes exchanging datagrams must share one instance.
 */
public final class RegistryApduCodec implements BacnetApduCodec {

    private final Map<Long, InboundApdu> registry = new ConcurrentHashMap<>();
    private final AtomicLong nextKey = new AtomicLong();

    @Override
    public byte[] encodeConfirmed(int invokeId, ConfirmedRequest request) {
        return register(new InboundApdu.ConfirmedReceived(invokeId, request));
    }

    @Override
    public byte[] encodeUnconfirmed(UnconfirmedRequest request, boolean broadcast) {
        return register(new InboundApdu.UnconfirmedReceived(request));
    }

    @Override
    public byte[] encodeAcknowledgement(int invokeId, ConfirmedRequest answered, Object ack) {
        return register(new InboundApdu.Acknowledgement(invokeId, ack));
    }

    @Override
    public byte[] encodeFailure(int invokeId, ConfirmedRequest answered, ApduFailure failure) {
        return register(new InboundApdu.Failure(invokeId, failure));
    }

    @Override
    public InboundApdu decode(byte[] payload) {
        if (payload.length != Long.BYTES) {
            throw new ApduDecodeException("not a registry key: " + payload.length + " bytes");
        }
        InboundApdu apdu = registry.get(ByteBuffer.wrap(payload).getLong());
        if (apdu == null) {
            throw new ApduDecodeException("unknown registry key");
        }
        return apdu;
    }

    private byte[] register(InboundApdu apdu) {
        long key = nextKey.incrementAndGet();
        registry.put(key, apdu);
        return ByteBuffer.allocate(Long.BYTES).putLong(key).array();
    }
}
