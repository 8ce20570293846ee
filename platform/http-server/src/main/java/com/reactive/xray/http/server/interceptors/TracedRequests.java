package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.context.SegmentStore;
import com.reactive.xray.http.server.HttpServerSpec.Request;
import com.reactive.xray.segment.Entity;
import com.reactive.xray.segment.Segment;

import java.util.Optional;

/**
 * Lookups for handlers that need the segment of the request they serve.
 */
public final class TracedRequests {

    private TracedRequests() {}

    /**
     * Segment attached to the request in manual context mode.
     */
    public static Optional<Segment> segment(Request request) {
        Object value = request.attribute(SegmentInterceptor.SEGMENT_ATTRIBUTE);
        return value instanceof Segment segment ? Optional.of(segment) : Optional.empty();
    }

    /**
     * Current entity whichever context mode is active: the store's binding
     * first, then the request attribute.
     */
    public static Optional<Entity> current(Request request, SegmentStore store) {
        return store.current().or(() -> segment(request));
    }
}
