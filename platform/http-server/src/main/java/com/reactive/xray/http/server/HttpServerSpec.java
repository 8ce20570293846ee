package com.reactive.xray.http.server;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * HTTP Server Specification - the interface every server adapter implements.
 *
 * Design principles:
 * 1. Declarative route registration
 * 2. Interceptor chain for cross-cutting concerns (tracing, logging)
 * 3. Implementation-agnostic
 * 4. Every request exposes a {@link ResponseLifecycle} so interceptors can
 *    observe when the response was written or the connection went away
 *
 * Example usage:
 * <pre>
 * HttpServerSpec server = new NettyHttpServer()
 *     .intercept(SegmentInterceptor.fromConfig(TracingConfig.load(), emitter))
 *     .intercept(LoggingInterceptor.all(store))
 *     .get("/health", Handler.sync(req -> Response.ok("{\"status\":\"UP\"}")));
 *
 * try (ServerHandle handle = server.start(8080)) {
 *     handle.awaitTermination();
 * }
 * </pre>
 */
public interface HttpServerSpec {

    // ========================================================================
    // Route Registration
    // ========================================================================

    /**
     * Register a route handler.
     */
    HttpServerSpec route(Method method, String path, Handler handler);

    /**
     * Convenience method for GET routes.
     */
    default HttpServerSpec get(String path, Handler handler) {
        return route(Method.GET, path, handler);
    }

    /**
     * Convenience method for POST routes.
     */
    default HttpServerSpec post(String path, Handler handler) {
        return route(Method.POST, path, handler);
    }

    // ========================================================================
    // Interceptors (Middleware)
    // ========================================================================

    /**
     * Add an interceptor to the chain.
     * Interceptors are called in order of registration; the first one sees the
     * request first and the response last.
     */
    HttpServerSpec intercept(Interceptor interceptor);

    // ========================================================================
    // Server Lifecycle
    // ========================================================================

    /**
     * Start the server on the specified port (0 picks a free one).
     * Returns a handle for lifecycle management.
     */
    ServerHandle start(int port);

    /**
     * Start with custom configuration.
     */
    ServerHandle start(int port, ServerConfig config);

    // ========================================================================
    // HTTP Method enum
    // ========================================================================

    enum Method {
        GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS
    }

    // ========================================================================
    // Request
    // ========================================================================

    interface Request {
        Method method();
        String path();

        /**
         * Header value, case-insensitive lookup. Null when absent.
         */
        String header(String name);
        Map<String, String> headers();
        Map<String, String> queryParams();
        byte[] body();
        String bodyAsString();

        /**
         * Remote address of the connection, empty when unknown.
         */
        String clientAddress();

        /**
         * Completion events of the response to this request.
         */
        ResponseLifecycle lifecycle();

        /**
         * Attach contextual data (e.g. the segment in manual context mode).
         * Returns a new request sharing the same lifecycle.
         */
        Request withAttribute(String key, Object value);
        <T> T attribute(String key);
    }

    // ========================================================================
    // Response
    // ========================================================================

    interface Response {
        int status();
        Map<String, String> headers();
        byte[] body();

        /**
         * Copy of this response with one header added or replaced.
         */
        default Response withHeader(String name, String value) {
            Map<String, String> merged = new java.util.LinkedHashMap<>(headers());
            merged.put(name, value);
            return new SimpleResponse(status(), Map.copyOf(merged), body());
        }

        // Factory methods
        static Response ok(String body) {
            return new SimpleResponse(200, body.getBytes());
        }

        static Response ok(byte[] body) {
            return new SimpleResponse(200, body);
        }

        static Response accepted() {
            return new SimpleResponse(202, "{\"ok\":true}".getBytes());
        }

        static Response notFound() {
            return new SimpleResponse(404, "{\"error\":\"Not Found\"}".getBytes());
        }

        static Response error(int status, String message) {
            return new SimpleResponse(status, ("{\"error\":\"" + message + "\"}").getBytes());
        }

        static Response serverError(String message) {
            return error(500, message);
        }
    }

    // ========================================================================
    // Handler
    // ========================================================================

    @FunctionalInterface
    interface Handler {
        /**
         * Handle a request and return a response.
         * Can be sync or async.
         */
        CompletableFuture<Response> handle(Request request);

        /**
         * Create a synchronous handler.
         */
        static Handler sync(Function<Request, Response> fn) {
            return request -> CompletableFuture.completedFuture(fn.apply(request));
        }
    }

    // ========================================================================
    // Interceptor (Middleware)
    // ========================================================================

    @FunctionalInterface
    interface Interceptor {
        /**
         * Intercept the request/response.
         *
         * @param request The incoming request
         * @param next The next handler in the chain
         * @return The response (possibly modified)
         */
        CompletableFuture<Response> intercept(Request request, Handler next);

        /**
         * Wrap {@code handler} so this interceptor runs in front of it.
         */
        default Handler around(Handler handler) {
            return request -> intercept(request, handler);
        }
    }

    // ========================================================================
    // Server Handle
    // ========================================================================

    interface ServerHandle extends AutoCloseable {
        /**
         * Block until the server is terminated.
         */
        void awaitTermination() throws InterruptedException;

        /**
         * Get the port the server is listening on.
         */
        int port();

        /**
         * Number of requests dispatched so far.
         */
        long requestCount();

        @Override
        void close();
    }

    // ========================================================================
    // Server Configuration
    // ========================================================================

    record ServerConfig(
        int workerThreads,
        int backlog,
        int maxRequestSize
    ) {
        public static ServerConfig defaults() {
            return new ServerConfig(
                Runtime.getRuntime().availableProcessors(),
                1024,
                65536
            );
        }

        public ServerConfig withWorkerThreads(int threads) {
            return new ServerConfig(threads, backlog, maxRequestSize);
        }
    }
}
