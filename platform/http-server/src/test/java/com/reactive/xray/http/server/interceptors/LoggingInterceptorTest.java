package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.context.ContextMode;
import com.reactive.xray.context.SegmentStore;
import com.reactive.xray.http.server.HttpServerSpec.Handler;
import com.reactive.xray.http.server.HttpServerSpec.Response;
import com.reactive.xray.http.server.HttpServerSpec.Interceptor;
import com.reactive.xray.http.server.HttpServerSpec.Request;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class LoggingInterceptorTest {

    private final List<LoggingInterceptor.LogEntry> entries = new ArrayList<>();

    private static Handler status(int status) {
        return Handler.sync(req -> Response.error(status, "x"));
    }

    /** Segment interceptor outermost, logging inside it, like a real server chain. */
    private static Handler chain(Interceptor outer, Interceptor inner, Handler handler) {
        return outer.around(inner.around(handler));
    }

    @Test
    void allLevelLogsEveryRequestWithTraceId() throws Exception {
        SegmentInterceptor segments = SegmentInterceptor.create("checkout", new RecordingEmitter());
        LoggingInterceptor logging = LoggingInterceptor.custom(LoggingInterceptor.Level.ALL, segments.store(), entries::add);
        Request request = TestRequests.get("/cart")
            .traceHeader("Root=1-abc-def;Sampled=1")
            .header("User-Agent", "curl/8")
            .build();

        chain(segments, logging, Handler.sync(req -> Response.ok("{}"))).handle(request).get();

        assertEquals(1, entries.size());
        LoggingInterceptor.LogEntry entry = entries.get(0);
        assertEquals("GET", entry.method());
        assertEquals("/cart", entry.path());
        assertEquals(200, entry.status());
        assertEquals("1-abc-def", entry.traceId());
        assertEquals("curl/8", entry.userAgent());
        assertFalse(entry.isError());
        assertTrue(entry.durationMs() >= 0);
    }

    @Test
    void manualModeTraceIdComesFromRequest() throws Exception {
        SegmentInterceptor segments = SegmentInterceptor.builder("checkout")
            .store(SegmentStore.forMode(ContextMode.MANUAL))
            .build();
        LoggingInterceptor logging = LoggingInterceptor.custom(LoggingInterceptor.Level.ALL, segments.store(), entries::add);

        chain(segments, logging, status(200))
            .handle(TestRequests.get("/").traceHeader("Root=1-abc-def").build()).get();

        assertEquals("1-abc-def", entries.get(0).traceId());
    }

    @Test
    void errorsOnlySkipsSuccesses() throws Exception {
        SegmentStore store = SegmentStore.forMode(ContextMode.AUTOMATIC);
        LoggingInterceptor logging = LoggingInterceptor.custom(LoggingInterceptor.Level.ERRORS_ONLY, store, entries::add);

        logging.intercept(TestRequests.get("/ok").build(), status(200)).get();
        logging.intercept(TestRequests.get("/missing").build(), status(404)).get();

        assertEquals(1, entries.size());
        assertEquals(404, entries.get(0).status());
        assertTrue(entries.get(0).isError());
        assertNull(entries.get(0).traceId());
    }

    @Test
    void failedHandlerIsLoggedAsServerError() {
        SegmentStore store = SegmentStore.forMode(ContextMode.AUTOMATIC);
        LoggingInterceptor logging = LoggingInterceptor.custom(LoggingInterceptor.Level.ERRORS_ONLY, store, entries::add);

        CompletableFuture<Response> result = logging.intercept(TestRequests.get("/").build(),
            req -> CompletableFuture.failedFuture(new IllegalStateException("boom")));

        assertTrue(result.isCompletedExceptionally());
        assertEquals(500, entries.get(0).status());
        assertInstanceOf(IllegalStateException.class, entries.get(0).error());
    }

    @Test
    void noneLevelPassesThrough() throws Exception {
        LoggingInterceptor logging = LoggingInterceptor.none(SegmentStore.forMode(ContextMode.AUTOMATIC));

        Response response = logging.intercept(TestRequests.get("/").build(), status(500)).get();

        assertEquals(500, response.status());
        assertTrue(entries.isEmpty());
    }

    @Test
    void defaultLoggersDoNotThrow() {
        SegmentStore store = SegmentStore.forMode(ContextMode.AUTOMATIC);

        assertDoesNotThrow(() -> LoggingInterceptor.all(store).intercept(TestRequests.get("/").build(), status(200)).get());
        assertDoesNotThrow(() -> LoggingInterceptor.errorsOnly(store).intercept(TestRequests.get("/").build(), status(503)).get());
    }
}
