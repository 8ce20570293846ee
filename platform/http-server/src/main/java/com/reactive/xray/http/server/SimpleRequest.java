package com.reactive.xray.http.server;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable Request implementation. Header names are stored lower-case.
 */
public record SimpleRequest(
    HttpServerSpec.Method method,
    String path,
    Map<String, String> headers,
    Map<String, String> queryParams,
    byte[] body,
    String clientAddress,
    ResponseLifecycle lifecycle,
    Map<String, Object> attributes
) implements HttpServerSpec.Request {

    public SimpleRequest {
        headers = lowerCaseKeys(headers);
        queryParams = Map.copyOf(queryParams);
        body = body != null ? body : new byte[0];
        clientAddress = clientAddress != null ? clientAddress : "";
        attributes = Map.copyOf(attributes);
    }

    public SimpleRequest(HttpServerSpec.Method method, String path, Map<String, String> headers,
                         String clientAddress, ResponseLifecycle lifecycle) {
        this(method, path, headers, Map.of(), new byte[0], clientAddress, lifecycle, Map.of());
    }

    @Override
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public HttpServerSpec.Request withAttribute(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new SimpleRequest(method, path, headers, queryParams, body, clientAddress, lifecycle, copy);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T attribute(String key) {
        return (T) attributes.get(key);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> source) {
        Map<String, String> lower = new HashMap<>();
        source.forEach((k, v) -> lower.put(k.toLowerCase(Locale.ROOT), v));
        return Map.copyOf(lower);
    }
}
