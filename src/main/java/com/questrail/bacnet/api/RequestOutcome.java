package com.questrail.bacnet.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * RequestOutcome
 * =============================================================================
 * Terminal result of one confirmed BACnet request.
 *
 * <h2>Variants</h2>
 * Layers above the transport return the outcome as a value and callers branch
 * on the variant:
 *
 * <pre>
 *   switch on outcome:
 *     Success  → value decoded from the acknowledgement ({@code true} for a simple ack)
 *     Abort    → the remote (or local TSM) aborted the transaction
 *     Reject   → the remote rejected the request as malformed or unsupported
 *     Error    → the remote executed the request and reported an application error
 *     Timeout  → no answer: APDU retries exhausted, network unreachable, node terminated
 * </pre>
 *
 * <p>The set of variants is closed. Exactly one outcome is produced per request.</p>
 *
 * @param <T> type of the success value
 */
public sealed interface RequestOutcome<T>
        permits RequestOutcome.Success, RequestOutcome.Abort, RequestOutcome.Reject,
                RequestOutcome.Error, RequestOutcome.Timeout
{
    static <T> RequestOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> RequestOutcome<T> abort(AbortReason reason) {
        return new Abort<>(reason);
    }

    static <T> RequestOutcome<T> reject(RejectReason reason) {
        return new Reject<>(reason);
    }

    static <T> RequestOutcome<T> error(ErrorClass errorClass, ErrorCode errorCode) {
        return new Error<>(errorClass, errorCode);
    }

    static <T> RequestOutcome<T> timeout(Throwable cause) {
        return new Timeout<>(cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** The success value, or empty for every failure variant. */
    default Optional<T> successValue() {
        if (this instanceof Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        return Optional.empty();
    }

    /**
     * Converts a success value; failure variants pass through unchanged.
     */
    default <R> RequestOutcome<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return failureAs();
    }

    /**
     * Like {@link #map}, for conversions that may themselves fail.
     */
    default <R> RequestOutcome<R> flatMap(Function<? super T, RequestOutcome<R>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Success<T> success) {
            return Objects.requireNonNull(mapper.apply(success.value()), "mapped outcome");
        }
        return failureAs();
    }

    /**
     * The same failure as an outcome of another value type.
     *
     * @throws IllegalStateException if this is a {@link Success}
     */
    default <R> RequestOutcome<R> failureAs() {
        if (this instanceof Abort<T> abort) {
            return new Abort<>(abort.reason());
        }
        if (this instanceof Reject<T> reject) {
            return new Reject<>(reject.reason());
        }
        if (this instanceof Error<T> error) {
            return new Error<>(error.errorClass(), error.errorCode());
        }
        if (this instanceof Timeout<T> timeout) {
            return new Timeout<>(timeout.cause());
        }
        throw new IllegalStateException("not a failure: " + this);
    }

    /** Acknowledged. {@code value} is {@code Boolean.TRUE} when the service returns nothing. */
    record Success<T>(T value) implements RequestOutcome<T> {
    }

    record Abort<T>(AbortReason reason) implements RequestOutcome<T> {
        public Abort {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Reject<T>(RejectReason reason) implements RequestOutcome<T> {
        public Reject {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Error<T>(ErrorClass errorClass, ErrorCode errorCode) implements RequestOutcome<T> {
        public Error {
            Objects.requireNonNull(errorClass, "errorClass");
            Objects.requireNonNull(errorCode, "errorCode");
        }
    }

    /**
     * No acknowledgement arrived. {@code cause} is the transport-level reason
     * (may be {@code null}).
     */
    record Timeout<T>(Throwable cause) implements RequestOutcome<T> {
    }
}
