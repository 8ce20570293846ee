package com.reactive.xray.context;

/**
 * Sampling decision carried by the {@code Sampled} component of a trace header.
 */
public enum SamplingDecision {
    /** {@code Sampled=1}: the caller decided to record this trace. */
    SAMPLED("1"),
    /** {@code Sampled=0}: the caller decided not to record this trace. */
    NOT_SAMPLED("0"),
    /** {@code Sampled=?}: the caller asks us to decide and report the decision back. */
    REQUESTED("?"),
    /** No (recognisable) decision present. */
    UNKNOWN("");

    private final String headerValue;

    SamplingDecision(String headerValue) {
        this.headerValue = headerValue;
    }

    public String headerValue() {
        return headerValue;
    }

    public boolean isDecided() {
        return this == SAMPLED || this == NOT_SAMPLED;
    }

    public static SamplingDecision of(boolean sampled) {
        return sampled ? SAMPLED : NOT_SAMPLED;
    }

    static SamplingDecision fromHeaderValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim()) {
            case "1" -> SAMPLED;
            case "0" -> NOT_SAMPLED;
            case "?" -> REQUESTED;
            default -> UNKNOWN;
        };
    }
}
