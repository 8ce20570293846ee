package com.reactive.xray.context;

import com.reactive.xray.id.IdGenerator;
import com.reactive.xray.segment.Entity;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed {@code X-Amzn-Trace-Id} header: trace id, parent segment id and sampling decision.
 *
 * Wire format is {@code key=value} pairs joined by {@code ;}, for example
 * {@code Root=1-5759e988-bd862e3fe1be46a994272793;Parent=53995c3f42cd8ad8;Sampled=1}.
 * Keys are case-insensitive; unknown keys are ignored.
 *
 * Parsing never fails. A null, blank or unrecognisable header yields a fresh
 * trace id with no parent.
 */
public final class TraceHeader {

    public static final String HEADER_NAME = "X-Amzn-Trace-Id";

    private static final String ROOT = "root";
    private static final String PARENT = "parent";
    private static final String SAMPLED = "sampled";

    // Anything longer is not a header we produced or can trust.
    private static final int MAX_LENGTH = 1024;

    private final String traceId;
    private final String parentId;
    private final SamplingDecision sampled;

    private TraceHeader(String traceId, String parentId, SamplingDecision sampled) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.parentId = parentId;
        this.sampled = Objects.requireNonNull(sampled, "sampled");
    }

    public static TraceHeader of(String traceId, String parentId, SamplingDecision sampled) {
        return new TraceHeader(traceId, parentId, sampled);
    }

    /**
     * Header for a brand-new root trace.
     */
    public static TraceHeader fresh() {
        return new TraceHeader(IdGenerator.getInstance().generateTraceId(), null, SamplingDecision.UNKNOWN);
    }

    /**
     * Header to send on a call made from inside {@code entity}: same trace,
     * {@code entity} as the parent, the root segment's sampling decision.
     */
    public static TraceHeader forDownstream(Entity entity) {
        return new TraceHeader(entity.traceId(), entity.id(), SamplingDecision.of(entity.root().isSampled()));
    }

    public static TraceHeader parse(String raw) {
        if (raw == null || raw.isBlank() || raw.length() > MAX_LENGTH) {
            return fresh();
        }

        String root = null;
        String parent = null;
        SamplingDecision sampled = SamplingDecision.UNKNOWN;

        for (String part : raw.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = part.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = part.substring(eq + 1).trim();
            switch (key) {
                case ROOT -> root = value.isEmpty() ? null : value;
                case PARENT -> parent = value.isEmpty() ? null : value;
                case SAMPLED -> sampled = SamplingDecision.fromHeaderValue(value);
                default -> { }
            }
        }

        if (root == null) {
            // A parent id cannot belong to a trace we are about to invent.
            return new TraceHeader(IdGenerator.getInstance().generateTraceId(), null, sampled);
        }
        return new TraceHeader(root, parent, sampled);
    }

    public String traceId() {
        return traceId;
    }

    public Optional<String> parentId() {
        return Optional.ofNullable(parentId);
    }

    public SamplingDecision sampled() {
        return sampled;
    }

    public TraceHeader withParent(String newParentId) {
        return new TraceHeader(traceId, newParentId, sampled);
    }

    public TraceHeader withSampled(SamplingDecision decision) {
        return new TraceHeader(traceId, parentId, decision);
    }

    /**
     * Render back to wire format. Components are omitted when unknown.
     */
    public String toHeaderValue() {
        StringBuilder sb = new StringBuilder("Root=").append(traceId);
        if (parentId != null) {
            sb.append(";Parent=").append(parentId);
        }
        if (sampled != SamplingDecision.UNKNOWN) {
            sb.append(";Sampled=").append(sampled.headerValue());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceHeader other)) return false;
        return traceId.equals(other.traceId)
            && Objects.equals(parentId, other.parentId)
            && sampled == other.sampled;
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceId, parentId, sampled);
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
