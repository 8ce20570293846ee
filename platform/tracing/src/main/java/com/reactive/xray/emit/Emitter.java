package com.reactive.xray.emit;

import com.reactive.xray.segment.Segment;

/**
 * Takes finalized segments off the request path, e.g. to a local daemon.
 *
 * Implementations should not block for long; callers log and drop whatever
 * {@link #send} throws.
 */
@FunctionalInterface
public interface Emitter {

    void send(Segment segment);
}
