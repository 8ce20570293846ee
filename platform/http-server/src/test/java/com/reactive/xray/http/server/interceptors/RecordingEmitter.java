package com.reactive.xray.http.server.interceptors;

import com.reactive.xray.emit.Emitter;
import com.reactive.xray.segment.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Emitter that keeps everything it is sent.
 */
public final class RecordingEmitter implements Emitter {

    private final BlockingQueue<Segment> sent = new LinkedBlockingQueue<>();

    @Override
    public void send(Segment segment) {
        sent.add(segment);
    }

    public List<Segment> sent() {
        return new ArrayList<>(sent);
    }

    /**
     * Next emitted segment, waiting for it when emission happens on another thread.
     */
    public Segment take() throws InterruptedException {
        Segment segment = sent.poll(5, TimeUnit.SECONDS);
        if (segment == null) {
            throw new AssertionError("No segment emitted within 5s");
        }
        return segment;
    }
}
