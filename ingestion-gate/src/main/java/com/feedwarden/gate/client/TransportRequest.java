package com.feedwarden.gate.client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * @param proxyUrl egress proxy, or null for a direct connection
 */
public record TransportRequest(URI uri, Map<String, String> headers, String proxyUrl, Duration timeout) {

    public TransportRequest direct() {
        return new TransportRequest(uri, headers, null, timeout);
    }
}
