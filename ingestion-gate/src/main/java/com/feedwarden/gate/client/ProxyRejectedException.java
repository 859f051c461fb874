package com.feedwarden.gate.client;

import java.io.IOException;

/**
 * The egress proxy refused to forward the request (HTTP 407). The fault lies with the proxy
 * session, not the source.
 */
public class ProxyRejectedException extends IOException {

    public ProxyRejectedException(String message) {
        super(message);
    }
}
