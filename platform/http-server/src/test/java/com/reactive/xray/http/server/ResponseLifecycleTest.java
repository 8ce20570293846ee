package com.reactive.xray.http.server;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseLifecycleTest {

    @Test
    void defaultsBeforeAnythingHappened() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();

        assertEquals(200, lifecycle.status());
        assertEquals(-1, lifecycle.contentLength());
        assertFalse(lifecycle.isFinished());
        assertFalse(lifecycle.isClosed());
    }

    @Test
    void finishFiresOnceWithFinalValues() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();
        List<String> events = new ArrayList<>();
        lifecycle.onFinish(() -> events.add("finish " + lifecycle.status() + " " + lifecycle.contentLength()));

        lifecycle.finish(404, 12);
        lifecycle.finish(500, 99);

        assertEquals(List.of("finish 404 12"), events);
        assertEquals(404, lifecycle.status());
    }

    @Test
    void closeFiresOnce() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();
        List<String> events = new ArrayList<>();
        lifecycle.onClose(() -> events.add("close"));

        lifecycle.close();
        lifecycle.close();

        assertEquals(List.of("close"), events);
        assertTrue(lifecycle.isClosed());
    }

    @Test
    void lateListenersRunImmediately() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();
        lifecycle.finish(200, 0);
        lifecycle.close();
        List<String> events = new ArrayList<>();

        lifecycle.onFinish(() -> events.add("finish"));
        lifecycle.onClose(() -> events.add("close"));

        assertEquals(List.of("finish", "close"), events);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();
        List<String> events = new ArrayList<>();
        lifecycle.onFinish(() -> {
            throw new IllegalStateException("listener bug");
        });
        lifecycle.onFinish(() -> events.add("second"));

        assertDoesNotThrow(() -> lifecycle.finish(200, 0));
        assertEquals(List.of("second"), events);
    }

    @Test
    void setStatusIsVisibleBeforeFinish() {
        ResponseLifecycle lifecycle = new ResponseLifecycle();

        lifecycle.setStatus(503);

        assertEquals(503, lifecycle.status());
        assertFalse(lifecycle.isFinished());
    }
}
