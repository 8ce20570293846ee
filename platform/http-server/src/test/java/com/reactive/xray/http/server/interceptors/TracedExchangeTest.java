package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.http.server.ResponseLifecycle;
import com.reactive.xray.segment.Segment;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TracedExchangeTest {

    private final RecordingEmitter emitter = new RecordingEmitter();
    private final ResponseLifecycle lifecycle = new ResponseLifecycle();
    private final Segment segment = new Segment("checkout", "1-a-b", null);

    @Test
    void errorMovesOpenToErrored() {
        TracedExchange exchange = new TracedExchange(segment, lifecycle, emitter);

        exchange.recordError(new IllegalStateException("boom"));

        assertEquals(TracedExchange.State.ERRORED, exchange.state());
        assertTrue(segment.isInProgress());
    }

    @Test
    void completeClosesAndEmitsOnce() {
        TracedExchange exchange = new TracedExchange(segment, lifecycle, emitter);
        lifecycle.finish(201, 5);

        exchange.complete();
        exchange.complete();

        assertEquals(TracedExchange.State.CLOSED, exchange.state());
        assertEquals(1, emitter.sent().size());
        assertEquals(201, segment.http().get("response").get("status"));
    }

    @Test
    void erroredExchangeStillCompletes() {
        TracedExchange exchange = new TracedExchange(segment, lifecycle, emitter);
        exchange.recordError(new IllegalStateException("boom"));
        lifecycle.finish(500, 0);

        exchange.complete();

        assertEquals(TracedExchange.State.CLOSED, exchange.state());
        assertTrue(segment.isError());
        assertTrue(segment.isFault());
    }

    @Test
    void errorAfterCompletionKeepsClosedState() {
        TracedExchange exchange = new TracedExchange(segment, lifecycle, emitter);
        exchange.complete();

        exchange.recordError(new IllegalStateException("late"));

        assertEquals(TracedExchange.State.CLOSED, exchange.state());
        assertEquals(1, segment.cause().exceptions().size());
    }
}
