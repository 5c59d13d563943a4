package com.questrail.bacnet.transport;

import com.questrail.bacnet.api.AbortReason;
import com.questrail.bacnet.api.ErrorClass;
import com.questrail.bacnet.api.ErrorCode;
import com.questrail.bacnet.api.RejectReason;

import java.util.Objects;

/**
 * ApduFailure
 * -----------------------------------------------------------------------------
 * A negative answer to a confirmed request, as carried by an Abort, Reject or
 * Error PDU.
 */
public sealed interface ApduFailure
        permits ApduFailure.Abort, ApduFailure.Reject, ApduFailure.Error
{
    /**
     * @param sentByServer {@code true} when the remote device aborted,
     *                     {@code false} when the local transaction machine did
     */
    record Abort(AbortReason reason, boolean sentByServer) implements ApduFailure {
        public Abort {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Reject(RejectReason reason) implements ApduFailure {
        public Reject {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Error(ErrorClass errorClass, ErrorCode errorCode) implements ApduFailure {
        public Error {
            Objects.requireNonNull(errorClass, "errorClass");
            Objects.requireNonNull(errorCode, "errorCode");
        }
    }
}
