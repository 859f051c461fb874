package com.feedwarden.gate.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Breaker state for one source. cooldownUntil is only meaningful while OPEN.
 */
@Value
@Builder(toBuilder = true)
public class CircuitState {

    @Builder.Default
    CircuitPhase phase = CircuitPhase.CLOSED;

    int openCycleCount;

    Instant cooldownUntil;

    public static CircuitState closed() {
        return CircuitState.builder().build();
    }

    public boolean isCooldownElapsed(Instant now) {
        return cooldownUntil == null || !now.isBefore(cooldownUntil);
    }
}
