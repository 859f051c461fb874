package com.feedwarden.gate.model;

/**
 * Failure classification used to weight health penalties.
 */
public enum ErrorKind {
    NETWORK_TIMEOUT,
    SERVER_ERROR,
    CLIENT_ERROR,
    SOFT_BLOCK,
    HARD_BLOCK,
    CONTENT_EMPTY,
    /** Reserved for the downstream content extractor; never raised by the gate itself. */
    PARSE_ERROR
}
