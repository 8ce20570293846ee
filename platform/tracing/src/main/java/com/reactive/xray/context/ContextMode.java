package com.reactive.xray.context;

/**
 * How the current segment reaches code running on behalf of a request.
 * Chosen once per process.
 */
public enum ContextMode {
    /** Bound to the execution context; looked up through {@link SegmentStore#current()}. */
    AUTOMATIC,
    /** Attached to the request object; downstream code reads it from there. */
    MANUAL
}
