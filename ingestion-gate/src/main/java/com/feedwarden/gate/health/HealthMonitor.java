package com.feedwarden.gate.health;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.HealthScore;
import com.feedwarden.gate.model.HealthStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns fetch outcomes into a continuous health score.
 *
 * Recovery is a small flat increment per success. Degradation is a penalty per error kind,
 * multiplied when the same kind repeats back to back (1.5x, 2.0x, 2.5x, capped at 3.0x).
 *
 * All operations are pure: they return a new {@link HealthScore} and never touch storage.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthMonitor {

    private final IngestionGateProperties properties;

    public HealthScore recordSuccess(HealthScore health, Duration latency) {
        IngestionGateProperties.Health cfg = properties.getHealth();

        double latencyPenalty = 0.0;
        if (latency != null && latency.compareTo(cfg.getSlowResponseThreshold()) > 0) {
            latencyPenalty = cfg.getLatencyPenalty();
            log.debug("Slow response ({} ms), recovery reduced by {}", latency.toMillis(), latencyPenalty);
        }

        double gain = Math.max(0.0, cfg.getRecoveryIncrement() - latencyPenalty);

        return health.toBuilder()
                .score(clamp(health.getScore() + gain))
                .errorStreak(0)
                .successStreak(health.getSuccessStreak() + 1)
                .build();
    }

    public HealthScore recordFailure(HealthScore health, ErrorKind errorKind) {
        List<ErrorKind> history = new ArrayList<>(health.getRecentErrorKinds());
        ErrorKind previous = health.getErrorStreak() > 0 && !history.isEmpty()
                ? history.get(history.size() - 1)
                : null;

        int repeats = errorKind == previous
                ? Math.min(countTrailing(history, errorKind), health.getErrorStreak())
                : 0;
        double penalty = penaltyFor(errorKind, repeats);

        history.add(errorKind);
        int historySize = properties.getHealth().getHistorySize();
        while (history.size() > historySize) {
            history.remove(0);
        }

        HealthScore updated = health.toBuilder()
                .score(clamp(health.getScore() - penalty))
                .successStreak(0)
                .errorStreak(health.getErrorStreak() + 1)
                .clearRecentErrorKinds()
                .recentErrorKinds(history)
                .build();

        if (repeats > 0) {
            log.info("Escalating penalty x{} for repeated {}", repeats + 1, errorKind);
        }
        return updated;
    }

    public HealthStatus statusOf(HealthScore health) {
        return HealthStatus.fromScore(health.getScore());
    }

    /**
     * Penalty for an error kind that has already occurred {@code repeats} times immediately before.
     * Non-decreasing in repeats and capped once repeats reaches the configured maximum.
     */
    public double penaltyFor(ErrorKind errorKind, int repeats) {
        IngestionGateProperties.Health cfg = properties.getHealth();
        double base = cfg.getPenalties().getOrDefault(errorKind, cfg.getDefaultPenalty());
        int effective = Math.max(0, Math.min(repeats, cfg.getMaxRepeats()));
        return base * (1.0 + cfg.getRepeatMultiplierStep() * effective);
    }

    /**
     * Lifts a score to the probe-recovery floor once a half-open probe has succeeded, so a
     * freshly closed circuit is not immediately silenced again by the health gate.
     */
    public HealthScore restoreAfterProbe(HealthScore health) {
        double floor = properties.getHealth().getProbeRecoveryFloor();
        if (health.getScore() >= floor) return health;
        return health.toBuilder().score(clamp(floor)).build();
    }

    // Consecutive occurrences of kind at the tail of history.
    private static int countTrailing(List<ErrorKind> history, ErrorKind kind) {
        int count = 0;
        for (int i = history.size() - 1; i >= 0 && history.get(i) == kind; i--) {
            count++;
        }
        return count;
    }

    private static double clamp(double score) {
        return Math.max(HealthScore.MIN_SCORE, Math.min(HealthScore.MAX_SCORE, score));
    }
}
