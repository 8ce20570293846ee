package com.reactive.xray.segment;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.reactive.xray.id.IdGenerator;
import com.reactive.xray.observe.Log;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A traced unit of work: a {@link Segment} for a whole request, or a
 * {@link Subsegment} for a narrower piece of it.
 *
 * <p>Lifecycle: open on construction, closed by the first {@link #close()}.
 * Once closed, timing and status are frozen and every mutation except
 * {@link #addError(Throwable)} is ignored with a warning. Errors keep
 * accumulating because they can be delivered after the response completed.
 *
 * <p>All state is guarded by the entity's monitor. Accessors return copies.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "id", "trace_id", "parent_id", "start_time", "end_time", "in_progress",
    "error", "fault", "throttle", "cause", "http", "annotations", "metadata", "subsegments"})
public abstract class Entity {

    private static final String WORKING_DIRECTORY = System.getProperty("user.dir", "");

    private final Clock clock;
    private final String name;
    private final String id;
    private final double startTime;

    private Double endTime;
    private boolean error;
    private boolean fault;
    private boolean throttle;

    private final List<ExceptionRecord> exceptions = new ArrayList<>();
    private final Map<String, Object> annotations = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> metadata = new LinkedHashMap<>();
    private final Map<String, Object> httpRequest = new LinkedHashMap<>();
    private final Map<String, Object> httpResponse = new LinkedHashMap<>();
    private final List<Subsegment> subsegments = new ArrayList<>();

    protected Entity(String name, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.id = IdGenerator.getInstance().generateEntityId();
        this.startTime = epochSeconds(clock.instant());
    }

    /**
     * The segment at the top of this entity's tree.
     */
    public abstract Segment root();

    public abstract String traceId();

    // ========================================================================
    // Identity and timing
    // ========================================================================

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("start_time")
    public double startTime() {
        return startTime;
    }

    public synchronized OptionalDouble endTime() {
        return endTime == null ? OptionalDouble.empty() : OptionalDouble.of(endTime);
    }

    @JsonProperty("in_progress")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public synchronized boolean isInProgress() {
        return endTime == null;
    }

    public synchronized boolean isClosed() {
        return endTime != null;
    }

    Clock clock() {
        return clock;
    }

    /**
     * Stamp the end time. Only the first call has an effect.
     *
     * @return true if this call closed the entity
     */
    public synchronized boolean close() {
        if (endTime != null) {
            Log.debug("{} {} already closed", getClass().getSimpleName(), id);
            return false;
        }
        endTime = Math.max(epochSeconds(clock.instant()), startTime);
        return true;
    }

    // ========================================================================
    // Status
    // ========================================================================

    @JsonProperty("error")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public synchronized boolean isError() {
        return error;
    }

    @JsonProperty("fault")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public synchronized boolean isFault() {
        return fault;
    }

    @JsonProperty("throttle")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public synchronized boolean isThrottle() {
        return throttle;
    }

    /**
     * Record an exception and raise the error flag. Allowed in any state.
     */
    public synchronized void addError(Throwable t) {
        Objects.requireNonNull(t, "t");
        exceptions.add(ExceptionRecord.of(t));
        error = true;
    }

    /**
     * Raise the flags an HTTP status implies: 4xx error, 429 error and throttle, 5xx fault.
     *
     * @return false if the entity was already closed
     */
    public synchronized boolean applyStatus(int status) {
        if (rejectIfClosed("applyStatus")) {
            return false;
        }
        HttpStatusCause.of(status).ifPresent(cause -> {
            if (exceptions.isEmpty()) {
                exceptions.add(ExceptionRecord.forStatus(status));
            }
            if (cause == HttpStatusCause.FAULT) {
                fault = true;
            } else {
                error = true;
            }
        });
        if (HttpStatusCause.isThrottle(status)) {
            throttle = true;
            error = true;
        }
        return true;
    }

    public synchronized Cause cause() {
        return new Cause(WORKING_DIRECTORY, exceptions);
    }

    @JsonProperty("cause")
    private synchronized Cause jsonCause() {
        return exceptions.isEmpty() ? null : cause();
    }

    // ========================================================================
    // HTTP
    // ========================================================================

    public synchronized boolean addIncomingRequestData(IncomingRequestData data) {
        if (rejectIfClosed("addIncomingRequestData")) {
            return false;
        }
        httpRequest.putAll(data.toMap());
        return true;
    }

    /**
     * Record the response ({@code http.response}) and apply its status flags.
     *
     * @param contentLength body size in bytes, negative when unknown
     */
    public synchronized boolean recordResponse(int status, long contentLength) {
        if (rejectIfClosed("recordResponse")) {
            return false;
        }
        httpResponse.put("status", status);
        if (contentLength >= 0) {
            httpResponse.put("content_length", contentLength);
        }
        return applyStatus(status);
    }

    @JsonProperty("http")
    public synchronized Map<String, Map<String, Object>> http() {
        Map<String, Map<String, Object>> http = new LinkedHashMap<>();
        if (!httpRequest.isEmpty()) {
            http.put("request", new LinkedHashMap<>(httpRequest));
        }
        if (!httpResponse.isEmpty()) {
            http.put("response", new LinkedHashMap<>(httpResponse));
        }
        return http;
    }

    // ========================================================================
    // Annotations and metadata
    // ========================================================================

    /**
     * Indexed key-value pair. Values must be strings, numbers or booleans.
     */
    public synchronized boolean addAnnotation(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "Annotation values must be String, Number or Boolean, got " + (value == null ? "null" : value.getClass().getName()));
        }
        if (rejectIfClosed("addAnnotation")) {
            return false;
        }
        annotations.put(key, value);
        return true;
    }

    @JsonProperty("annotations")
    public synchronized Map<String, Object> annotations() {
        return new LinkedHashMap<>(annotations);
    }

    /**
     * Non-indexed data under a namespace ({@code "default"} when in doubt).
     */
    public synchronized boolean putMetadata(String namespace, String key, Object value) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(key, "key");
        if (rejectIfClosed("putMetadata")) {
            return false;
        }
        metadata.computeIfAbsent(namespace, ns -> new LinkedHashMap<>()).put(key, value);
        return true;
    }

    @JsonProperty("metadata")
    public synchronized Map<String, Map<String, Object>> metadata() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        metadata.forEach((ns, values) -> copy.put(ns, new LinkedHashMap<>(values)));
        return copy;
    }

    // ========================================================================
    // Subsegments
    // ========================================================================

    /**
     * Open a child entity. A closed parent hands out a detached subsegment
     * that is never recorded, so callers need no null checks.
     */
    public synchronized Subsegment beginSubsegment(String subsegmentName) {
        Subsegment child = new Subsegment(subsegmentName, this);
        if (!rejectIfClosed("beginSubsegment")) {
            subsegments.add(child);
        }
        return child;
    }

    @JsonProperty("subsegments")
    public synchronized List<Subsegment> subsegments() {
        return new ArrayList<>(subsegments);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean rejectIfClosed(String operation) {
        if (endTime == null) {
            return false;
        }
        Log.warn("{} {} is closed; ignoring {}", getClass().getSimpleName(), id, operation);
        return true;
    }

    static double epochSeconds(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
        return Math.round(seconds * 1_000_000.0) / 1_000_000.0;
    }

    @JsonProperty("end_time")
    private synchronized Double jsonEndTime() {
        return endTime;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", id=" + id + ", traceId=" + traceId() + "}";
    }
}
