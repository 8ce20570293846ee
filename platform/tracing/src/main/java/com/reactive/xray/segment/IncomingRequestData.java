package com.reactive.xray.segment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a segment records about the request it serves ({@code http.request}).
 *
 * @param forwardedFor true when {@code clientIp} came from {@code X-Forwarded-For}
 */
public record IncomingRequestData(
    String method,
    String url,
    String clientIp,
    String userAgent,
    boolean forwardedFor
) {

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "method", method);
        putIfPresent(map, "url", url);
        putIfPresent(map, "client_ip", clientIp);
        putIfPresent(map, "user_agent", userAgent);
        if (forwardedFor) {
            map.put("x_forwarded_for", true);
        }
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isEmpty()) {
            map.put(key, value);
        }
    }
}
