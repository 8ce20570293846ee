package com.reactive.xray.segment;

import java.util.Optional;

/**
 * Flag an HTTP status code raises on the entity that served it.
 */
public enum HttpStatusCause {
    /** 4xx: the caller got something wrong. */
    ERROR,
    /** 5xx: we got something wrong. */
    FAULT;

    public static final int TOO_MANY_REQUESTS = 429;

    public static Optional<HttpStatusCause> of(int status) {
        if (status >= 400 && status < 500) {
            return Optional.of(ERROR);
        }
        if (status >= 500) {
            return Optional.of(FAULT);
        }
        return Optional.empty();
    }

    public static boolean isThrottle(int status) {
        return status == TOO_MANY_REQUESTS;
    }
}
