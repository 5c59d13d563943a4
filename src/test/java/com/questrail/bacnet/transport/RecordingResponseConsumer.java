package com.questrail.bacnet.transport;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every callback so tests can check that exactly one arrived.
 */
public final class RecordingResponseConsumer implements ResponseConsumer {

    private final List<Object> calls = new ArrayList<>();

    @Override
    public synchronized void success(Object ack) {
        calls.add(ack == null ? "simple-ack" : ack);
    }

    @Override
    public synchronized void fail(ApduFailure failure) {
        calls.add(failure);
    }

    @Override
    public synchronized void ex(Throwable cause) {
        calls.add(cause);
    }

    public synchronized List<Object> calls() {
        return List.copyOf(calls);
    }

    public synchronized boolean isComplete() {
        return !calls.isEmpty();
    }

    /** The single callback received. */
    public synchronized Object only() {
        if (calls.size() != 1) {
            throw new AssertionError("expected exactly one callback, got " + calls);
        }
        return calls.get(0);
    }
}
