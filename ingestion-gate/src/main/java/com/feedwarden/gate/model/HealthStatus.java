package com.feedwarden.gate.model;

/**
 * Categorical status derived from a continuous health score.
 *
 * HEALTHY   score &gt; 0.8  nominal operation
 * DEGRADED  score &gt; 0.4  reduced frequency, heightened skip chance
 * UNHEALTHY otherwise     quarantined behind the circuit breaker
 */
public enum HealthStatus {
    HEALTHY, DEGRADED, UNHEALTHY;

    public static HealthStatus fromScore(double score) {
        if (score > 0.8) return HEALTHY;
        if (score > 0.4) return DEGRADED;
        return UNHEALTHY;
    }
}
