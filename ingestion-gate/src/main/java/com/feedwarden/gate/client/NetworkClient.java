package com.feedwarden.gate.client;

import com.feedwarden.gate.circuit.CircuitBreaker;
import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.config.SourceRegistry;
import com.feedwarden.gate.health.HealthMonitor;
import com.feedwarden.gate.identity.IdentityManager;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.CircuitState;
import com.feedwarden.gate.model.ConditionalTokens;
import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.FetchOutcome;
import com.feedwarden.gate.model.HealthScore;
import com.feedwarden.gate.model.HealthStatus;
import com.feedwarden.gate.model.IdentityProfile;
import com.feedwarden.gate.model.SourceRecord;
import com.feedwarden.gate.model.SourceStatus;
import com.feedwarden.gate.scheduler.FetchScheduler;
import com.feedwarden.gate.store.SourceRecordStore;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The single component allowed to touch the network for a source.
 *
 * Every call re-checks the breaker and the cooldown, holds the per-source bulkhead for the
 * whole attempt, makes exactly one request (plus at most one direct fallback when the proxy
 * is unreachable or rejects the request) and persists the outcome in one atomic store update.
 * No retries: the next attempt is the scheduler's decision.
 *
 * Only reached through {@link com.feedwarden.gate.service.IngestionController}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NetworkClient {

    private static final Duration MIN_LOCKOUT = Duration.ofHours(24);

    private final SourceRecordStore store;
    private final CircuitBreaker circuitBreaker;
    private final HealthMonitor healthMonitor;
    private final IdentityManager identityManager;
    private final FetchScheduler scheduler;
    private final OutcomeClassifier classifier;
    private final HttpTransport transport;
    private final BulkheadRegistry bulkheadRegistry;
    private final SourceRegistry sourceRegistry;
    private final IngestionGateProperties properties;
    private final Clock clock;

    public Optional<FetchResult> fetch(String url, String sourceId, boolean isProbe) {
        return fetch(url, sourceId, isProbe, null);
    }

    /**
     * @param nextScheduledAt the behavior engine's plan for the following attempt; computed here when null
     * @return empty when no request was attempted
     */
    public Optional<FetchResult> fetch(String url, String sourceId, boolean isProbe, Instant nextScheduledAt) {
        if (!circuitBreaker.canFetch(sourceId)) {
            SourceRecord record = store.getOrCreate(sourceId);
            log.warn("BLOCKED {}: circuit OPEN. Retry at {}", sourceId, record.getCooldownUntil());
            return Optional.empty();
        }

        SourceRecord record = store.getOrCreate(sourceId);
        if (!isProbe && !scheduler.shouldFetchNow(record)) {
            log.info("Skipping {}: cooling down or not yet due (next fetch at {})",
                    sourceId, scheduler.nextFetchAt(record));
            return Optional.empty();
        }

        Bulkhead bulkhead = bulkheadRegistry.bulkhead(sourceId);
        if (!bulkhead.tryAcquirePermission()) {
            log.info("Skipping {}: another request for this source is in flight", sourceId);
            return Optional.empty();
        }

        boolean halfOpen = record.getCircuitPhase() == CircuitPhase.HALF_OPEN;
        boolean probeHeld = false;
        try {
            if (halfOpen) {
                if (!circuitBreaker.tryAcquireProbe(sourceId)) {
                    return Optional.empty();
                }
                probeHeld = true;
            }
            return Optional.of(execute(url, record, isProbe || halfOpen, nextScheduledAt));
        } finally {
            if (probeHeld) {
                circuitBreaker.releaseProbe(sourceId);
            }
            bulkhead.onComplete();
        }
    }

    /**
     * Applies an observed outcome to health, circuit, cooldown and scheduling state in one
     * atomic update. Public so outcomes seen by other transports can be fed in the same way.
     *
     * @param tokens          validators to keep on success, or null
     * @param nextScheduledAt planned next attempt, or null to let the behavior engine pick one
     */
    public SourceRecord reportOutcome(String sourceId,
                                      Classification classification,
                                      Duration latency,
                                      boolean isProbe,
                                      ConditionalTokens tokens,
                                      Instant nextScheduledAt) {
        Instant now = clock.instant();

        SourceRecord updated = store.update(sourceId, record -> {
            HealthScore before = record.health();
            boolean halfOpen = record.getCircuitPhase() == CircuitPhase.HALF_OPEN;

            record.setLastFetchAt(now);
            HealthScore health;
            if (classification.isSuccess()) {
                health = healthMonitor.recordSuccess(before, latency);
                record.setFailureCount(0);
                record.setLastSuccessAt(now);
                if (tokens != null && !tokens.isEmpty()) {
                    if (tokens.etag() != null) record.setEtag(tokens.etag());
                    if (tokens.lastModified() != null) record.setLastModified(tokens.lastModified());
                }
            } else {
                health = healthMonitor.recordFailure(before, classification.errorKind());
                record.setFailureCount(record.getFailureCount() + 1);
            }

            CircuitState circuit = record.circuit();
            if (isProbe || halfOpen) {
                circuit = circuitBreaker.onProbeResult(sourceId, circuit, classification.isSuccess(), now);
                if (halfOpen && classification.isSuccess()) {
                    health = healthMonitor.restoreAfterProbe(health);
                }
            }
            HealthStatus healthStatus = healthMonitor.statusOf(health);
            circuit = circuitBreaker.onHealthSignal(sourceId, circuit, healthStatus, now);

            record.apply(health);
            record.apply(circuit);
            record.setNextAllowedAt(nextAllowedAfter(record, classification, now));
            record.setStatus(statusOf(record, healthStatus));
            record.setNextScheduledAt(nextScheduledAt != null
                    ? nextScheduledAt
                    : scheduler.nextScheduledAfter(record, now));

            if (health.getScore() < before.getScore()) {
                log.warn("Source {} health drop: {} -> {} [{}]",
                        sourceId, fmt(before.getScore()), fmt(health.getScore()), classification.errorKind());
            }
        });

        if (classification.outcome().isBlock()) {
            identityManager.reportBlock(sourceId, updated.getAssignedIdentityId(),
                    classification.outcome() == FetchOutcome.HARD_BLOCK);
        }
        if (updated.getFailureCount() >= properties.getClient().getFailureLockoutThreshold()) {
            log.error("Source {} locked out after {} consecutive failures until {}",
                    sourceId, updated.getFailureCount(), updated.getNextAllowedAt());
        }
        return updated;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private FetchResult execute(String url, SourceRecord record, boolean probe, Instant nextScheduledAt) {
        String sourceId = record.getSourceId();
        IdentityProfile identity = identityManager.profileFor(
                sourceId, record.getAssignedIdentityId(), sourceRegistry.proxyTier(sourceId));
        if (!identity.getId().equals(record.getAssignedIdentityId())) {
            store.update(sourceId, r -> r.setAssignedIdentityId(identity.getId()));
        }

        Map<String, String> headers = new LinkedHashMap<>(identity.headers());
        if (record.getEtag() != null) {
            headers.put("If-None-Match", record.getEtag());
        }
        if (record.getLastModified() != null) {
            headers.put("If-Modified-Since", record.getLastModified());
        }

        String egress = identity.getProxySession() == null ? null : identity.getProxySession().getEgressUrl();
        TransportRequest request = new TransportRequest(
                URI.create(url), headers, egress, properties.getClient().getRequestTimeout());

        Instant fetchedAt = clock.instant();
        long started = System.nanoTime();
        boolean proxyUsed = egress != null;
        TransportResponse response = null;
        Classification classification;

        log.debug("Fetching {} for {}{}", url, sourceId, probe ? " (probe)" : "");
        try {
            try {
                response = transport.execute(request);
            } catch (ConnectException | HttpConnectTimeoutException | ProxyRejectedException e) {
                if (!proxyUsed) {
                    throw e;
                }
                log.warn("Egress for {} unreachable ({}), retrying once direct", sourceId, e.toString());
                proxyUsed = false;
                response = transport.execute(request.direct());
            }
            classification = classifier.classify(response);
        } catch (IOException e) {
            log.warn("Network error fetching {} for {}: {}", url, sourceId, e.toString());
            classification = Classification.transientError(ErrorKind.NETWORK_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch of {} for {} interrupted", url, sourceId);
            classification = Classification.transientError(ErrorKind.NETWORK_TIMEOUT);
        }

        Duration latency = response != null && response.elapsed() != null
                ? response.elapsed()
                : Duration.ofNanos(System.nanoTime() - started);

        ConditionalTokens tokens = response == null
                ? null
                : new ConditionalTokens(response.firstHeader("ETag"), response.firstHeader("Last-Modified"));
        reportOutcome(sourceId, classification, latency, probe, tokens, nextScheduledAt);

        log.info("Fetched {} for {}: {} (HTTP {}, {} ms)", url, sourceId, classification.outcome(),
                response == null ? "-" : response.statusCode(), latency.toMillis());

        boolean keepBody = response != null
                && classification.outcome() != FetchOutcome.HARD_BLOCK
                && response.statusCode() != 304;
        return FetchResult.builder()
                .sourceId(sourceId)
                .url(url)
                .outcome(classification.outcome())
                .errorKind(classification.errorKind())
                .probe(probe)
                .body(keepBody ? response.body() : null)
                .headers(response == null ? Map.of() : response.headers())
                .metadata(new FetchMetadata(
                        proxyUsed,
                        response == null ? null : response.statusCode(),
                        latency.toMillis() / 1000.0,
                        fetchedAt))
                .build();
    }

    private Instant nextAllowedAfter(SourceRecord record, Classification classification, Instant now) {
        IngestionGateProperties.Client cfg = properties.getClient();

        Instant next = switch (classification.outcome()) {
            case SUCCESS -> null;
            case SOFT_BLOCK -> now.plus(softBlockCooldown(classification.retryAfter()));
            case HARD_BLOCK -> now.plus(cfg.getHardBlockCooldown());
            case TRANSIENT_ERROR -> now.plus(cfg.getTransientCooldown());
        };

        if (record.getCircuitPhase() == CircuitPhase.OPEN && record.getCooldownUntil() != null) {
            next = latest(next, record.getCooldownUntil());
        }
        if (record.getFailureCount() >= cfg.getFailureLockoutThreshold()) {
            next = latest(next, now.plus(lockoutDuration()));
        }
        return next;
    }

    private Duration softBlockCooldown(Duration retryAfter) {
        IngestionGateProperties.Client cfg = properties.getClient();
        Duration cooldown = cfg.getSoftBlockCooldown();
        if (retryAfter == null) {
            return cooldown;
        }
        // Retry-After is a hint from the server, never an unbounded sleep
        Duration capped = retryAfter.compareTo(cfg.getHardBlockCooldown()) > 0 ? cfg.getHardBlockCooldown() : retryAfter;
        return capped.compareTo(cooldown) > 0 ? capped : cooldown;
    }

    private Duration lockoutDuration() {
        Duration configured = properties.getClient().getFailureLockout();
        return configured.compareTo(MIN_LOCKOUT) < 0 ? MIN_LOCKOUT : configured;
    }

    private SourceStatus statusOf(SourceRecord record, HealthStatus healthStatus) {
        if (record.getCircuitPhase() == CircuitPhase.OPEN
                || record.getFailureCount() >= properties.getClient().getFailureLockoutThreshold()) {
            return SourceStatus.OPEN;
        }
        return healthStatus == HealthStatus.HEALTHY ? SourceStatus.HEALTHY : SourceStatus.DEGRADED;
    }

    private static Instant latest(Instant current, Instant candidate) {
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    private static String fmt(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
