package com.feedwarden.gate.service;

import com.feedwarden.gate.client.FetchResult;

/**
 * Downstream consumer of fetched content (extraction, parsing, storage).
 *
 * Receives the response bytes, status and {@link com.feedwarden.gate.client.FetchMetadata} only.
 * Implementations must not call back into the gate to fetch.
 */
public interface ContentHandoff {

    void accept(FetchResult result);
}
