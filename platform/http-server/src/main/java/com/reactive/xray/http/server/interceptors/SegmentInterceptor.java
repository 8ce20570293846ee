package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.context.ContextMode;
import com.reactive.xray.context.Sampler;
import com.reactive.xray.context.SamplingDecision;
import com.reactive.xray.context.SegmentNaming;
import com.reactive.xray.context.SegmentStore;
import com.reactive.xray.context.TraceHeader;
import com.reactive.xray.context.TracingConfig;
import com.reactive.xray.emit.Emitter;
import com.reactive.xray.http.server.HttpServerSpec.*;
import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.IncomingRequestData;
import com.reactive.xray.segment.Segment;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Segment Interceptor.
 *
 * Opens a segment for every request, makes it available to everything that
 * runs on behalf of the request, and closes and emits it once the response
 * lifecycle reports finish or close (whichever comes first).
 *
 * <ul>
 *   <li>Trace id and parent come from the {@code X-Amzn-Trace-Id} header;
 *       absent or unreadable headers start a new trace.</li>
 *   <li>Handler errors are recorded on the segment and passed on unchanged.</li>
 *   <li>Tracing problems never fail the request: it continues untraced.</li>
 *   <li>With {@code Sampled=?} the decision is echoed in the response header.</li>
 * </ul>
 *
 * Usage:
 * <pre>
 * server.intercept(SegmentInterceptor.create("checkout", emitter))
 * server.intercept(SegmentInterceptor.fromConfig(TracingConfig.load(), emitter))
 * server.intercept(SegmentInterceptor.builder("checkout")
 *     .store(SegmentStore.forMode(ContextMode.MANUAL))
 *     .sampler(mySampler)
 *     .emitter(emitter)
 *     .build())
 * </pre>
 */
public class SegmentInterceptor implements Interceptor {

    /** Request attribute carrying the segment in {@link ContextMode#MANUAL}. */
    public static final String SEGMENT_ATTRIBUTE = "segment";

    private final SegmentNaming naming;
    private final SegmentStore store;
    private final Emitter emitter;
    private final Sampler sampler;
    private final Clock clock;

    private SegmentInterceptor(Builder builder) {
        this.naming = builder.naming;
        this.store = builder.store;
        this.emitter = builder.emitter;
        this.sampler = builder.sampler;
        this.clock = builder.clock;
    }

    /**
     * Interceptor naming every segment {@code defaultName}, automatic context mode.
     *
     * @throws com.reactive.xray.context.TracingConfigurationException if the name is null or empty
     */
    public static SegmentInterceptor create(String defaultName, Emitter emitter) {
        return builder(defaultName).emitter(emitter).build();
    }

    public static SegmentInterceptor fromConfig(TracingConfig config, Emitter emitter) {
        return builder(config.naming())
            .store(SegmentStore.forMode(config.contextMode()))
            .emitter(emitter)
            .build();
    }

    /**
     * @throws com.reactive.xray.context.TracingConfigurationException if the name is null or empty
     */
    public static Builder builder(String defaultName) {
        return new Builder(SegmentNaming.fixed(defaultName));
    }

    public static Builder builder(SegmentNaming naming) {
        return new Builder(naming);
    }

    public SegmentStore store() {
        return store;
    }

    @Override
    public CompletableFuture<Response> intercept(Request request, Handler next) {
        TraceHeader header;
        TracedExchange exchange;
        try {
            header = TraceHeader.parse(request.header(TraceHeader.HEADER_NAME));
            exchange = open(request, header);
        } catch (RuntimeException e) {
            Log.error("Failed to open segment for " + request.method() + " " + request.path()
                + "; continuing untraced", e);
            return next.handle(request);
        }

        Segment segment = exchange.segment();
        Request downstream = store.mode() == ContextMode.MANUAL
            ? request.withAttribute(SEGMENT_ATTRIBUTE, segment)
            : request;

        CompletableFuture<Response> result;
        try {
            result = store.bind(segment, () -> next.handle(downstream));
        } catch (RuntimeException e) {
            exchange.recordError(e);
            throw e;
        }

        CompletableFuture<Response> traced = result.whenComplete((response, error) -> {
            if (error != null) {
                exchange.recordError(unwrap(error));
            }
        });

        if (header.sampled() == SamplingDecision.REQUESTED) {
            String echoed = TraceHeader.of(segment.traceId(), null, SamplingDecision.of(segment.isSampled()))
                .toHeaderValue();
            return traced.thenApply(response -> response.withHeader(TraceHeader.HEADER_NAME, echoed));
        }
        return traced;
    }

    private TracedExchange open(Request request, TraceHeader header) {
        String host = request.header("Host");
        String name = naming.resolve(host);

        Segment segment = new Segment(name, header.traceId(), header.parentId().orElse(null), clock);
        segment.setSampled(header.sampled().isDecided()
            ? header.sampled() == SamplingDecision.SAMPLED
            : sampler.shouldSample(new Sampler.SamplingRequest(name, host, request.method().name(), request.path())));
        segment.addIncomingRequestData(incomingRequestData(request, host));

        TracedExchange exchange = new TracedExchange(segment, request.lifecycle(), emitter);
        request.lifecycle().onFinish(exchange::complete);
        request.lifecycle().onClose(exchange::complete);

        Log.debug("Opened segment {} in trace {}", segment.id(), segment.traceId());
        return exchange;
    }

    static IncomingRequestData incomingRequestData(Request request, String host) {
        String forwarded = request.header("X-Forwarded-For");
        boolean viaProxy = forwarded != null && !forwarded.isBlank();
        String clientIp = viaProxy ? forwarded.split(",")[0].trim() : request.clientAddress();
        String url = host != null ? "http://" + host + request.path() : request.path();
        return new IncomingRequestData(
            request.method().name(),
            url,
            clientIp,
            request.header("User-Agent"),
            viaProxy
        );
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static final class Builder {
        private final SegmentNaming naming;
        private SegmentStore store = SegmentStore.forMode(ContextMode.AUTOMATIC);
        private Emitter emitter = segment -> Log.debug("No emitter configured; dropping segment {}", segment.id());
        private Sampler sampler = Sampler.always();
        private Clock clock = Clock.systemUTC();

        private Builder(SegmentNaming naming) {
            this.naming = Objects.requireNonNull(naming, "naming");
        }

        public Builder store(SegmentStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public Builder emitter(Emitter emitter) {
            this.emitter = Objects.requireNonNull(emitter, "emitter");
            return this;
        }

        public Builder sampler(Sampler sampler) {
            this.sampler = Objects.requireNonNull(sampler, "sampler");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SegmentInterceptor build() {
            return new SegmentInterceptor(this);
        }
    }
}
