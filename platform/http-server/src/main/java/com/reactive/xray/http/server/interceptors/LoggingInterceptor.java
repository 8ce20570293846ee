package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.context.SegmentStore;
import com.reactive.xray.http.server.HttpServerSpec.*;
import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.Entity;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Configurable access-log interceptor that tags each line with the trace id.
 *
 * Register it after the {@link SegmentInterceptor} so the segment is already
 * bound (automatic mode) or attached (manual mode) when it runs.
 *
 * Log levels:
 * - NONE: No logging (interceptor passes through)
 * - ERRORS_ONLY: Only log requests that result in errors (status >= 400 or exception)
 * - ALL: Log all requests with timing
 *
 * Usage:
 * <pre>
 * server.intercept(LoggingInterceptor.all(store))
 * server.intercept(LoggingInterceptor.errorsOnly(store))
 * server.intercept(LoggingInterceptor.custom(Level.ALL, store, entry -> collect(entry)))
 * </pre>
 */
public class LoggingInterceptor implements Interceptor {

    public enum Level {
        NONE,        // Skip logging entirely
        ERRORS_ONLY, // Only log errors (status >= 400 or exceptions)
        ALL          // Log all requests
    }

    private final Level level;
    private final SegmentStore store;
    private final Consumer<LogEntry> logger;

    private LoggingInterceptor(Level level, SegmentStore store, Consumer<LogEntry> logger) {
        this.level = level;
        this.store = store;
        this.logger = logger;
    }

    public static LoggingInterceptor none(SegmentStore store) {
        return new LoggingInterceptor(Level.NONE, store, entry -> {});
    }

    public static LoggingInterceptor errorsOnly(SegmentStore store) {
        return new LoggingInterceptor(Level.ERRORS_ONLY, store, LoggingInterceptor::defaultLog);
    }

    public static LoggingInterceptor all(SegmentStore store) {
        return new LoggingInterceptor(Level.ALL, store, LoggingInterceptor::defaultLog);
    }

    public static LoggingInterceptor custom(Level level, SegmentStore store, Consumer<LogEntry> logger) {
        return new LoggingInterceptor(level, store, logger);
    }

    @Override
    public CompletableFuture<Response> intercept(Request request, Handler next) {
        if (level == Level.NONE) {
            return next.handle(request);
        }

        // Resolve now: the automatic binding is only visible on this call stack.
        String traceId = TracedRequests.current(request, store).map(Entity::traceId).orElse(null);
        long startNanos = System.nanoTime();
        Instant startTime = Instant.now();

        return next.handle(request)
            .whenComplete((response, error) -> {
                long durationNanos = System.nanoTime() - startNanos;
                int status = response != null ? response.status() : 500;
                boolean isError = error != null || status >= 400;

                if (level == Level.ALL || isError) {
                    logger.accept(new LogEntry(
                        startTime,
                        request.method().name(),
                        request.path(),
                        status,
                        durationNanos,
                        error,
                        traceId,
                        request.header("User-Agent")
                    ));
                }
            });
    }

    private static void defaultLog(LogEntry entry) {
        String trace = entry.traceId() != null ? entry.traceId() : "-";
        if (entry.error() != null) {
            Log.warn("{} {} -> {} ({} ms) [trace:{}] error={}",
                entry.method(), entry.path(), entry.status(), String.format("%.2f", entry.durationMs()),
                trace, entry.error().toString());
        } else if (entry.isError()) {
            Log.warn("{} {} -> {} ({} ms) [trace:{}]",
                entry.method(), entry.path(), entry.status(), String.format("%.2f", entry.durationMs()), trace);
        } else {
            Log.info("{} {} -> {} ({} ms) [trace:{}]",
                entry.method(), entry.path(), entry.status(), String.format("%.2f", entry.durationMs()), trace);
        }
    }

    /**
     * Log entry passed to custom loggers.
     */
    public record LogEntry(
        Instant timestamp,
        String method,
        String path,
        int status,
        long durationNanos,
        Throwable error,
        String traceId,
        String userAgent
    ) {
        public double durationMs() {
            return durationNanos / 1_000_000.0;
        }

        public boolean isError() {
            return error != null || status >= 400;
        }
    }
}
