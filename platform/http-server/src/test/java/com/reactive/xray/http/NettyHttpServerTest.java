package com.reactive.xray.http;

import com.reactive.xray.context.TraceHeader;
import com.reactive.xray.http.server.HttpServerSpec;
import com.reactive.xray.http.server.HttpServerSpec.Handler;
import com.reactive.xray.http.server.HttpServerSpec.Response;
import com.reactive.xray.http.server.HttpServerSpec.ServerHandle;
import com.reactive.xray.http.server.ResponseLifecycle;
import com.reactive.xray.http.server.SimpleRequest;
import com.reactive.xray.http.server.interceptors.RecordingEmitter;
import com.reactive.xray.http.server.interceptors.SegmentInterceptor;
import com.reactive.xray.segment.Segment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class NettyHttpServerTest {

    private final HttpClient client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Duration.ofSeconds(5))
        .build();
    private RecordingEmitter emitter;
    private ServerHandle handle;

    @BeforeEach
    void setUp() {
        emitter = new RecordingEmitter();
        SegmentInterceptor segments = SegmentInterceptor.create("checkout", emitter);

        HttpServerSpec server = new NettyHttpServer()
            .intercept(segments)
            .get("/cart", Handler.sync(req -> Response.ok("{\"items\":2}")))
            .get("/throttled", Handler.sync(req -> Response.error(429, "slow down")))
            .post("/orders", Handler.sync(req -> {
                throw new IllegalStateException("payment declined");
            }))
            .get("/async-failure", req -> CompletableFuture.failedFuture(new IllegalArgumentException("bad sku")));

        handle = server.start(0, HttpServerSpec.ServerConfig.defaults().withWorkerThreads(2));
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    private HttpResponse<String> get(String path, Map<String, String> headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + handle.port() + path))
            .timeout(Duration.ofSeconds(5));
        headers.forEach(builder::header);
        return client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void tracedRequestIsEmittedAfterResponse() throws Exception {
        HttpResponse<String> response = get("/cart",
            Map.of(TraceHeader.HEADER_NAME, "Root=1-5759e988-bd862e3fe1be46a994272793;Parent=53995c3f42cd8ad8;Sampled=1"));

        assertEquals(200, response.statusCode());
        Segment segment = emitter.take();
        assertEquals("checkout", segment.name());
        assertEquals("1-5759e988-bd862e3fe1be46a994272793", segment.traceId());
        assertEquals("53995c3f42cd8ad8", segment.parentId().orElseThrow());
        assertTrue(segment.isClosed());
        Map<String, Object> http = segment.http().get("response");
        assertEquals(200, http.get("status"));
        assertEquals((long) "{\"items\":2}".length(), http.get("content_length"));
        assertEquals("127.0.0.1", segment.http().get("request").get("client_ip"));
    }

    @Test
    void throttledResponseFlagsSegment() throws Exception {
        HttpResponse<String> response = get("/throttled", Map.of());

        assertEquals(429, response.statusCode());
        Segment segment = emitter.take();
        assertTrue(segment.isThrottle());
        assertTrue(segment.isError());
    }

    @Test
    void handlerExceptionBecomesServerErrorAndIsRecorded() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + handle.port() + "/orders"))
            .POST(HttpRequest.BodyPublishers.ofString("{}"))
            .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(500, response.statusCode());
        assertTrue(response.body().contains("payment declined"));
        Segment segment = emitter.take();
        assertTrue(segment.isFault());
        assertTrue(segment.isError());
        assertEquals("payment declined", segment.cause().exceptions().get(0).message());
    }

    @Test
    void asyncFailureIsRecorded() throws Exception {
        HttpResponse<String> response = get("/async-failure", Map.of());

        assertEquals(500, response.statusCode());
        Segment segment = emitter.take();
        assertEquals(IllegalArgumentException.class.getName(), segment.cause().exceptions().get(0).type());
    }

    @Test
    void requestedSamplingIsEchoedOverTheWire() throws Exception {
        HttpResponse<String> response = get("/cart", Map.of(TraceHeader.HEADER_NAME, "Root=1-a-b;Sampled=?"));

        assertEquals("Root=1-a-b;Sampled=1", response.headers().firstValue(TraceHeader.HEADER_NAME).orElseThrow());
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        HttpResponse<String> response = get("/nowhere", Map.of());

        assertEquals(404, response.statusCode());
        assertTrue(emitter.take().isError());
        assertEquals(1, handle.requestCount());
    }

    @Test
    void firstRegisteredInterceptorIsOutermost() throws Exception {
        List<String> calls = new ArrayList<>();
        NettyHttpServer server = new NettyHttpServer();
        server.intercept((request, next) -> {
                calls.add("outer");
                return next.handle(request);
            })
            .intercept((request, next) -> {
                calls.add("inner");
                return next.handle(request);
            })
            .get("/", Handler.sync(req -> {
                calls.add("handler");
                return Response.ok("{}");
            }));

        server.chain().handle(new SimpleRequest(HttpServerSpec.Method.GET, "/", Map.of(), "", new ResponseLifecycle())).get();

        assertEquals(List.of("outer", "inner", "handler"), calls);
    }
}
