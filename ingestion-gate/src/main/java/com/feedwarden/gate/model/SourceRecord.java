package com.feedwarden.gate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable per-source state, one row per source key in the source_records table.
 *
 * This is the only definition of source state. Health and circuit views are derived from it
 * via {@link #health()} and {@link #circuit()} and written back with {@link #apply(HealthScore)}
 * and {@link #apply(CircuitState)}.
 *
 * Invariant: failureCount at or above the lockout threshold implies status OPEN and a
 * nextAllowedAt at least 24h out.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecord {

    private String sourceId;

    // ── Operational state ───────────────────────────────────────────────────
    @Builder.Default
    private SourceStatus status = SourceStatus.HEALTHY;
    private int failureCount;
    private Instant nextAllowedAt;

    // ── Conditional fetch tokens ────────────────────────────────────────────
    private String etag;
    private String lastModified;

    // ── Timing ──────────────────────────────────────────────────────────────
    private Instant lastFetchAt;
    private Instant lastSuccessAt;
    private Instant nextScheduledAt;

    /** Weak reference to an IdentityProfile owned by the IdentityManager. */
    private String assignedIdentityId;

    // ── Health ──────────────────────────────────────────────────────────────
    @Builder.Default
    private double healthScore = HealthScore.MAX_SCORE;
    private int errorStreak;
    private int successStreak;
    @Builder.Default
    private List<ErrorKind> recentErrorKinds = new ArrayList<>();

    // ── Circuit ─────────────────────────────────────────────────────────────
    @Builder.Default
    private CircuitPhase circuitPhase = CircuitPhase.CLOSED;
    private int openCycleCount;
    private Instant cooldownUntil;

    public static SourceRecord fresh(String sourceId) {
        return SourceRecord.builder().sourceId(sourceId).build();
    }

    public HealthScore health() {
        return HealthScore.builder()
                .score(healthScore)
                .errorStreak(errorStreak)
                .successStreak(successStreak)
                .recentErrorKinds(recentErrorKinds == null ? List.of() : recentErrorKinds)
                .build();
    }

    public CircuitState circuit() {
        return CircuitState.builder()
                .phase(circuitPhase)
                .openCycleCount(openCycleCount)
                .cooldownUntil(cooldownUntil)
                .build();
    }

    public void apply(HealthScore health) {
        this.healthScore = health.getScore();
        this.errorStreak = health.getErrorStreak();
        this.successStreak = health.getSuccessStreak();
        this.recentErrorKinds = new ArrayList<>(health.getRecentErrorKinds());
    }

    public void apply(CircuitState circuit) {
        this.circuitPhase = circuit.getPhase();
        this.openCycleCount = circuit.getOpenCycleCount();
        this.cooldownUntil = circuit.getCooldownUntil();
    }

    /** Deep enough copy for stores that hand out records to callers. */
    public SourceRecord copy() {
        return toBuilder()
                .recentErrorKinds(new ArrayList<>(recentErrorKinds == null ? List.of() : recentErrorKinds))
                .build();
    }
}
