package com.feedwarden.gate.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Continuous trust score for one source.
 *
 * errorStreak and successStreak are mutually exclusive: at most one of them is non-zero.
 * recentErrorKinds holds the most recent classifications, oldest first.
 */
@Value
@Builder(toBuilder = true)
public class HealthScore {

    public static final double MAX_SCORE = 1.0;
    public static final double MIN_SCORE = 0.0;

    @Builder.Default
    double score = MAX_SCORE;

    int errorStreak;

    int successStreak;

    @Singular
    List<ErrorKind> recentErrorKinds;

    public static HealthScore fresh() {
        return HealthScore.builder().build();
    }
}
