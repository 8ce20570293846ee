package com.reactive.xray.http.server;

import java.util.Map;

/**
 * Simple immutable Response implementation.
 */
public record SimpleResponse(
    int status,
    Map<String, String> headers,
    byte[] body
) implements HttpServerSpec.Response {

    public SimpleResponse(int status, byte[] body) {
        this(status, Map.of("Content-Type", "application/json"), body);
    }
}
