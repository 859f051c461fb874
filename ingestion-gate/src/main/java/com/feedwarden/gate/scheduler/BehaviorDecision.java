package com.feedwarden.gate.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * What to do about a due source right now. Generated fresh at each decision point.
 *
 * @param skip            simulate inattention: do not contact the network this time
 * @param thinkDelay      pause before issuing the request (zero when skipping)
 * @param nextScheduledAt when the next fetch should happen after this one (or after the skip)
 * @param reason          short tag for logs
 */
public record BehaviorDecision(boolean skip, Duration thinkDelay, Instant nextScheduledAt, String reason) {

    public static BehaviorDecision skip(Instant rescheduleAt) {
        return new BehaviorDecision(true, Duration.ZERO, rescheduleAt, "simulated_skip");
    }

    public static BehaviorDecision fetch(Duration thinkDelay, Instant nextScheduledAt) {
        return new BehaviorDecision(false, thinkDelay, nextScheduledAt, "standard_fetch");
    }
}
