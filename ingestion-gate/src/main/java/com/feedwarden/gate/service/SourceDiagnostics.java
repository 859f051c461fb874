package com.feedwarden.gate.service;

import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.HealthStatus;
import com.feedwarden.gate.model.SourceStatus;

import java.time.Instant;

/**
 * Read-only snapshot of one source, for dashboards and the CSV export.
 */
public record SourceDiagnostics(
        String sourceId,
        boolean schedulerReady,
        double healthScore,
        HealthStatus healthStatus,
        CircuitPhase circuitPhase,
        Instant nextScheduledAt,
        SourceStatus status,
        int failureCount,
        String assignedIdentityId,
        Instant lastFetchAt,
        Instant lastSuccessAt
) {
}
