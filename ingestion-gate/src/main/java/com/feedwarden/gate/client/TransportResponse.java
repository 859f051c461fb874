package com.feedwarden.gate.client;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Raw response as seen by the gate. Header names are matched case-insensitively.
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, byte[] body, Duration elapsed) {

    public String firstHeader(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst()
                .orElse(null);
    }

    public String bodyText() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}
