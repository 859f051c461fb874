package com.feedwarden.gate.service;

import com.feedwarden.gate.circuit.CircuitBreaker;
import com.feedwarden.gate.client.FetchResult;
import com.feedwarden.gate.client.NetworkClient;
import com.feedwarden.gate.config.SourceRegistry;
import com.feedwarden.gate.health.HealthMonitor;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.HealthStatus;
import com.feedwarden.gate.model.SourceDefinition;
import com.feedwarden.gate.model.SourceRecord;
import com.feedwarden.gate.scheduler.BehaviorDecision;
import com.feedwarden.gate.scheduler.FetchScheduler;
import com.feedwarden.gate.store.SourceRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for ingestion. Every authority is consulted again here, in order:
 * due check, behavior engine, health gate, circuit breaker, then the network client.
 * Any one of them may refuse.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionController {

    private final SourceRecordStore store;
    private final FetchScheduler scheduler;
    private final HealthMonitor healthMonitor;
    private final CircuitBreaker circuitBreaker;
    private final NetworkClient networkClient;
    private final SourceRegistry sourceRegistry;
    private final Clock clock;

    /**
     * @return true only if a network request was actually attempted
     */
    public boolean ingest(String sourceId, String url) {
        return ingestForResult(sourceId, url).isPresent();
    }

    public Optional<FetchResult> ingestForResult(String sourceId, String url) {
        try {
            requireText(sourceId, "sourceId");
            requireText(url, "url");
            return attempt(sourceId, url);
        } catch (DataAccessException e) {
            log.error("Storage failure while ingesting {}: {}", sourceId, e.getMessage(), e);
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Rejected ingestion request for {}: {}", sourceId, e.getMessage());
            throw e;
        }
    }

    /**
     * Read-only: never creates a record and never moves the breaker.
     */
    public SourceDiagnostics diagnostics(String sourceId) {
        requireText(sourceId, "sourceId");
        try {
            SourceRecord record = store.find(sourceId).orElseGet(() -> SourceRecord.fresh(sourceId));
            return toDiagnostics(record);
        } catch (DataAccessException e) {
            log.error("Storage failure reading diagnostics for {}: {}", sourceId, e.getMessage(), e);
            throw e;
        }
    }

    /** Every stored source plus configured sources that have never been fetched. */
    public List<SourceDiagnostics> diagnosticsForAll() {
        try {
            Map<String, SourceRecord> records = new LinkedHashMap<>();
            for (SourceDefinition source : sourceRegistry.enabledSources()) {
                records.put(source.getKey(), SourceRecord.fresh(source.getKey()));
            }
            for (SourceRecord record : store.findAll()) {
                records.put(record.getSourceId(), record);
            }
            List<SourceDiagnostics> result = new ArrayList<>();
            records.values().forEach(record -> result.add(toDiagnostics(record)));
            result.sort(Comparator.comparing(SourceDiagnostics::sourceId));
            return result;
        } catch (DataAccessException e) {
            log.error("Storage failure reading diagnostics: {}", e.getMessage(), e);
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<FetchResult> attempt(String sourceId, String url) {
        SourceRecord record = store.getOrCreate(sourceId);

        if (!scheduler.shouldFetchNow(record)) {
            log.debug("{} not due until {}", sourceId, scheduler.nextFetchAt(record));
            return Optional.empty();
        }

        BehaviorDecision decision = scheduler.nextAction(record);
        if (decision.skip()) {
            store.update(sourceId, r -> r.setNextScheduledAt(decision.nextScheduledAt()));
            log.debug("{} skipped ({}), next at {}", sourceId, decision.reason(), decision.nextScheduledAt());
            return Optional.empty();
        }

        boolean isProbe = isProbeAttempt(record);
        if (healthMonitor.statusOf(record.health()) == HealthStatus.UNHEALTHY && !isProbe) {
            log.debug("{} refused: health {} is UNHEALTHY", sourceId, record.getHealthScore());
            return Optional.empty();
        }

        if (!circuitBreaker.canFetch(sourceId)) {
            log.debug("{} refused: circuit open until {}", sourceId, record.getCooldownUntil());
            return Optional.empty();
        }

        if (!pause(decision.thinkDelay())) {
            return Optional.empty();
        }

        return networkClient.fetch(url, sourceId, isProbe, decision.nextScheduledAt());
    }

    // The next attempt is the half-open probe if the breaker is half-open or about to become so
    private boolean isProbeAttempt(SourceRecord record) {
        CircuitPhase phase = circuitBreaker.currentPhase(record);
        return phase == CircuitPhase.HALF_OPEN
                || (phase == CircuitPhase.OPEN && record.circuit().isCooldownElapsed(clock.instant()));
    }

    private SourceDiagnostics toDiagnostics(SourceRecord record) {
        return new SourceDiagnostics(
                record.getSourceId(),
                scheduler.shouldFetchNow(record),
                record.getHealthScore(),
                healthMonitor.statusOf(record.health()),
                circuitBreaker.currentPhase(record),
                scheduler.nextFetchAt(record),
                record.getStatus(),
                record.getFailureCount(),
                record.getAssignedIdentityId(),
                record.getLastFetchAt(),
                record.getLastSuccessAt());
    }

    /**
     * @return false if interrupted, in which case the attempt is abandoned
     */
    private boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Think-time pause interrupted; abandoning attempt");
            return false;
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
