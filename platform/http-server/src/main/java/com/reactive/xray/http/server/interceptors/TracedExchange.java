package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.emit.Emitter;
import com.reactive.xray.http.server.ResponseLifecycle;
import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.Segment;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One traced request: its segment and where it is in its lifecycle.
 *
 * <pre>
 *   OPEN ──error──▶ ERRORED
 *     │                │
 *     └──finish/close──┴──▶ CLOSING ──▶ CLOSED
 * </pre>
 *
 * The move into CLOSING is the finalize guard: whichever completion event
 * wins the compare-and-set applies the status, closes and emits. The loser
 * returns without touching the segment.
 */
final class TracedExchange {

    enum State { OPEN, ERRORED, CLOSING, CLOSED }

    private final Segment segment;
    private final ResponseLifecycle lifecycle;
    private final Emitter emitter;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    TracedExchange(Segment segment, ResponseLifecycle lifecycle, Emitter emitter) {
        this.segment = segment;
        this.lifecycle = lifecycle;
        this.emitter = emitter;
    }

    Segment segment() {
        return segment;
    }

    State state() {
        return state.get();
    }

    /**
     * Record a handler error. The segment stays open; the response lifecycle still closes it.
     */
    void recordError(Throwable error) {
        segment.addError(error);
        state.compareAndSet(State.OPEN, State.ERRORED);
    }

    /**
     * Completion observer, registered for both finish and close.
     */
    void complete() {
        State current;
        do {
            current = state.get();
            if (current == State.CLOSING || current == State.CLOSED) {
                return;
            }
        } while (!state.compareAndSet(current, State.CLOSING));

        try {
            if (lifecycle.isFinished()) {
                segment.recordResponse(lifecycle.status(), lifecycle.contentLength());
            } else {
                // Connection closed before the response went out.
                segment.applyStatus(lifecycle.status());
            }
            segment.close();
            emit();
        } finally {
            state.set(State.CLOSED);
        }
    }

    private void emit() {
        if (!segment.isSampled()) {
            Log.debug("Segment {} not sampled; not emitted", segment.id());
            return;
        }
        try {
            emitter.send(segment);
        } catch (RuntimeException e) {
            Log.warn("Failed to emit segment {}: {}", segment.id(), e.toString());
        }
    }
}
