package com.feedwarden.gate.scheduler;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.config.SourceRegistry;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.SourceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Behavior engine: decides when a source is due and whether a due fetch should be skipped.
 *
 * Example rhythm for a 30 minute source:
 *   T+00  fetch succeeds, next planned around T+30 +/- 40%, say T+24
 *   T+24  due, skip roll hits (5%), rescheduled 10-60 minutes out
 *   T+55  due, skip roll misses, 2.3s think time, fetch
 *
 * Never touches the network; produces timing decisions only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchScheduler {

    private final SourceRegistry sourceRegistry;
    private final IngestionGateProperties properties;
    private final Clock clock;
    private final Random random;

    public boolean shouldFetchNow(SourceRecord record) {
        Instant now = clock.instant();

        if (isInCooldown(record, now)) {
            return false;
        }
        if (record.getNextScheduledAt() != null && now.isBefore(record.getNextScheduledAt())) {
            return false;
        }
        if (record.getLastFetchAt() == null) {
            return true;
        }

        // Hard floor against tight polling loops, regardless of what the engine decides later
        Duration elapsed = Duration.between(record.getLastFetchAt(), now);
        return elapsed.compareTo(floor(record.getSourceId())) >= 0;
    }

    public boolean isInCooldown(SourceRecord record, Instant now) {
        return record.getNextAllowedAt() != null && now.isBefore(record.getNextAllowedAt());
    }

    public BehaviorDecision nextAction(SourceRecord record) {
        IngestionGateProperties.Behavior cfg = properties.getBehavior();
        Instant now = clock.instant();

        if (random.nextDouble() < skipProbability(record.getHealthScore())) {
            Instant rescheduleAt = now.plus(between(cfg.getSkipDelayMin(), cfg.getSkipDelayMax()));
            log.debug("Source {}: simulated skip, rescheduled to {}", record.getSourceId(), rescheduleAt);
            return BehaviorDecision.skip(rescheduleAt);
        }

        Duration thinkTime = between(cfg.getThinkTimeMin(), cfg.getThinkTimeMax());
        return BehaviorDecision.fetch(thinkTime, nextScheduledAfter(record, now));
    }

    /**
     * Base interval plus symmetric jitter, floored at the minimum interval, with a small
     * chance of an extended pause that breaks periodicity entirely.
     */
    public Instant nextScheduledAfter(SourceRecord record, Instant now) {
        IngestionGateProperties.Behavior cfg = properties.getBehavior();
        long averageMillis = averageInterval(record.getSourceId()).toMillis();
        double jitterRange = averageMillis * cfg.getJitterFactor();
        double jitter = (random.nextDouble() * 2.0 - 1.0) * jitterRange;

        long intervalMillis = Math.max(cfg.getMinimumInterval().toMillis(), Math.round(averageMillis + jitter));
        Instant next = now.plusMillis(intervalMillis);

        if (random.nextDouble() < cfg.getLongPauseProbability()) {
            Duration pause = between(cfg.getLongPauseMin(), cfg.getLongPauseMax());
            next = next.plus(pause);
            log.info("Source {}: applied long pause of {} minutes", record.getSourceId(), pause.toMinutes());
        }
        return next;
    }

    /**
     * Predictive "safe" time for the next attempt, for diagnostics and external job queues.
     */
    public Instant nextFetchAt(SourceRecord record) {
        Instant floorAt = record.getLastFetchAt() == null
                ? null
                : record.getLastFetchAt().plus(floor(record.getSourceId()));
        Instant cooldown = record.getCircuitPhase() == CircuitPhase.OPEN ? record.getCooldownUntil() : null;

        return Stream.of(record.getNextAllowedAt(), record.getNextScheduledAt(), cooldown, floorAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElseGet(clock::instant);
    }

    public double skipProbability(double healthScore) {
        IngestionGateProperties.Behavior cfg = properties.getBehavior();
        double chance = cfg.getSkipProbabilityBaseline();
        if (healthScore < cfg.getSkipHealthThreshold()) {
            chance += (cfg.getSkipHealthThreshold() - healthScore) * cfg.getSkipHealthFactor();
        }
        return Math.min(1.0, chance);
    }

    public Duration averageInterval(String sourceId) {
        return sourceRegistry.averageInterval(sourceId);
    }

    private Duration floor(String sourceId) {
        long averageMillis = averageInterval(sourceId).toMillis();
        return Duration.ofMillis(Math.round(averageMillis * (1.0 - properties.getBehavior().getJitterFactor())));
    }

    private Duration between(Duration min, Duration max) {
        long low = min.toMillis();
        long span = Math.max(0, max.toMillis() - low);
        return Duration.ofMillis(low + Math.round(random.nextDouble() * span));
    }
}
