package com.feedwarden.gate.model;

/**
 * Coarse operational state persisted on each {@link SourceRecord} for cross-run continuity.
 */
public enum SourceStatus {
    HEALTHY, DEGRADED, OPEN
}
