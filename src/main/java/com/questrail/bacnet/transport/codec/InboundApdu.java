package com.questrail.bacnet.transport.codec;

import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.UnconfirmedRequest;
import com.questrail.bacnet.transport.ApduFailure;

import java.util.Objects;

/**
 * InboundApdu
 * -----------------------------------------------------------------------------
 * Decoded form of one received datagram.
 */
public sealed interface InboundApdu
        permits InboundApdu.ConfirmedReceived, InboundApdu.UnconfirmedReceived,
                InboundApdu.Acknowledgement, InboundApdu.Failure
{
    record ConfirmedReceived(int invokeId, ConfirmedRequest request) implements InboundApdu {
        public ConfirmedReceived {
            Objects.requireNonNull(request, "request");
        }
    }

    record UnconfirmedReceived(UnconfirmedRequest request) implements InboundApdu {
        public UnconfirmedReceived {
            Objects.requireNonNull(request, "request");
        }
    }

    /**
     * SimpleAck or ComplexAck. {@code ack} is {@code null} for a SimpleAck.
     */
    record Acknowledgement(int invokeId, Object ack) implements InboundApdu {
        public static Acknowledgement simple(int invokeId) {
            return new Acknowledgement(invokeId, null);
        }
    }

    record Failure(int invokeId, ApduFailure failure) implements InboundApdu {
        public Failure {
            Objects.requireNonNull(failure, "failure");
        }
    }
}
