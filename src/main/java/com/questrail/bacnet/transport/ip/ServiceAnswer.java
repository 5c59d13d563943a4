package com.questrail.bacnet.transport.ip;

import com.questrail.bacnet.transport.ApduFailure;

import java.util.Objects;

/**
 * How the local device answers one inbound confirmed request.
 */
sealed interface ServiceAnswer permits ServiceAnswer.Ack, ServiceAnswer.Refused
{
    /** {@code value} is {@code null} for a SimpleAck. */
    record Ack(Object value) implements ServiceAnswer {
    }

    record Refused(ApduFailure failure) implements ServiceAnswer {
        public Refused {
            Objects.requireNonNull(failure, "failure");
        }
    }

    static ServiceAnswer simpleAck() {
        return new Ack(null);
    }
}
