package com.reactive.xray.segment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level entity describing one request served by this process.
 */
public final class Segment extends Entity {

    private final String traceId;
    private final String parentId;
    private volatile boolean sampled = true;

    /**
     * Open a segment: identity set, start time taken from {@code clock}, in progress.
     *
     * @param parentId id of the calling entity, or null for a root request
     */
    public Segment(String name, String traceId, String parentId, Clock clock) {
        super(name, clock);
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.parentId = parentId;
    }

    public Segment(String name, String traceId, String parentId) {
        this(name, traceId, parentId, Clock.systemUTC());
    }

    @Override
    public Segment root() {
        return this;
    }

    @Override
    @JsonProperty("trace_id")
    public String traceId() {
        return traceId;
    }

    public Optional<String> parentId() {
        return Optional.ofNullable(parentId);
    }

    @JsonProperty("parent_id")
    private String jsonParentId() {
        return parentId;
    }

    /**
     * Unsampled segments are still finalized but never emitted.
     */
    public boolean isSampled() {
        return sampled;
    }

    public void setSampled(boolean sampled) {
        this.sampled = sampled;
    }
}
