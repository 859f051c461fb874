package com.feedwarden.gate.client;

import java.io.IOException;

/**
 * Byte-level HTTP execution. Exactly one network call per invocation; no retries.
 */
public interface HttpTransport {

    /**
     * @throws java.net.http.HttpTimeoutException when the request timeout elapses
     * @throws java.net.ConnectException          when the proxy (or origin) refuses the connection
     * @throws ProxyRejectedException             when the egress proxy answers 407
     */
    TransportResponse execute(TransportRequest request) throws IOException, InterruptedException;
}
