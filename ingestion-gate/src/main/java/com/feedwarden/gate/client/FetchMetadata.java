package com.feedwarden.gate.client;

import java.time.Instant;

/**
 * The only fetch context the downstream content extractor gets to see.
 *
 * @param statusCode null when no response was received
 */
public record FetchMetadata(boolean proxyUsed, Integer statusCode, double durationSeconds, Instant fetchedAt) {
}
