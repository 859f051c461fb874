package com.feedwarden.gate.circuit;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.CircuitState;
import com.feedwarden.gate.model.HealthStatus;
import com.feedwarden.gate.model.SourceRecord;
import com.feedwarden.gate.store.SourceRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source breaker with escalating cooldowns.
 *
 * CLOSED    -> OPEN       health reaches UNHEALTHY
 * OPEN      -> HALF_OPEN  lazily, on the first canFetch after the cooldown has elapsed
 * HALF_OPEN -> CLOSED     probe succeeded, cycle count reset
 * HALF_OPEN -> OPEN       probe failed, cooldown escalates
 *
 * Phase and cycle count live on the {@link SourceRecord}; the lazy HALF_OPEN transition is
 * written through the store's atomic update so it is idempotent across concurrent callers.
 * Only the probe permit is process-local.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CircuitBreaker {

    private final SourceRecordStore store;
    private final IngestionGateProperties properties;
    private final Clock clock;

    private final Set<String> probesInFlight = ConcurrentHashMap.newKeySet();

    public boolean canFetch(String sourceId) {
        SourceRecord record = store.getOrCreate(sourceId);
        CircuitPhase phase = record.getCircuitPhase();

        if (phase != CircuitPhase.OPEN) {
            return true;
        }

        Instant now = clock.instant();
        if (!record.circuit().isCooldownElapsed(now)) {
            return false;
        }

        SourceRecord updated = store.update(sourceId, r -> {
            if (r.getCircuitPhase() == CircuitPhase.OPEN && r.circuit().isCooldownElapsed(now)) {
                r.setCircuitPhase(CircuitPhase.HALF_OPEN);
                log.info("Circuit {}: OPEN -> HALF_OPEN | cooldown expired, probing", sourceId);
            }
        });
        return updated.getCircuitPhase() != CircuitPhase.OPEN;
    }

    /** Non-mutating read of the phase, for diagnostics. */
    public CircuitPhase currentPhase(SourceRecord record) {
        return record.getCircuitPhase();
    }

    /**
     * Claims the single probe slot for a half-open source.
     *
     * @return false if another caller already holds it
     */
    public boolean tryAcquireProbe(String sourceId) {
        boolean acquired = probesInFlight.add(sourceId);
        if (!acquired) {
            log.warn("Probe for {} already in flight, refusing a second", sourceId);
        }
        return acquired;
    }

    public void releaseProbe(String sourceId) {
        probesInFlight.remove(sourceId);
    }

    public boolean isProbeInFlight(String sourceId) {
        return probesInFlight.contains(sourceId);
    }

    // ── Pure transitions, applied inside the outcome update ─────────────────

    public CircuitState onHealthSignal(String sourceId, CircuitState state, HealthStatus status, Instant now) {
        if (state.getPhase() == CircuitPhase.CLOSED && status == HealthStatus.UNHEALTHY) {
            return trip(sourceId, state, now, "Health dropped to UNHEALTHY");
        }
        return state;
    }

    public CircuitState onProbeResult(String sourceId, CircuitState state, boolean success, Instant now) {
        if (state.getPhase() != CircuitPhase.HALF_OPEN) {
            return state;
        }
        if (success) {
            log.info("Circuit {}: HALF_OPEN -> CLOSED | probe succeeded", sourceId);
            return CircuitState.closed();
        }
        return trip(sourceId, state, now, "Probe failed");
    }

    /**
     * Cooldown for the given (1-based) open cycle. Strictly increasing through the
     * configured table, then flat at the last entry.
     */
    public Duration cooldownFor(int openCycleCount) {
        List<Duration> table = properties.getCircuit().getCooldowns();
        if (table.isEmpty()) {
            throw new IllegalStateException("ingestion-gate.circuit.cooldowns must not be empty");
        }
        int index = Math.max(0, Math.min(openCycleCount, table.size()) - 1);
        return table.get(index);
    }

    private CircuitState trip(String sourceId, CircuitState state, Instant now, String reason) {
        int cycle = state.getOpenCycleCount() + 1;
        Duration cooldown = cooldownFor(cycle);
        log.info("Circuit {}: {} -> OPEN | {}. Backoff: {}h (cycle {})",
                sourceId, state.getPhase(), reason, cooldown.toHours(), cycle);
        return CircuitState.builder()
                .phase(CircuitPhase.OPEN)
                .openCycleCount(cycle)
                .cooldownUntil(now.plus(cooldown))
                .build();
    }
}
