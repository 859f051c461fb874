package com.feedwarden.gate.client;

import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.FetchOutcome;

import java.time.Duration;

/**
 * @param errorKind  null on success
 * @param retryAfter server-provided back-off hint, or null
 */
public record Classification(FetchOutcome outcome, ErrorKind errorKind, Duration retryAfter) {

    public static Classification success() {
        return new Classification(FetchOutcome.SUCCESS, null, null);
    }

    public static Classification softBlock(ErrorKind kind, Duration retryAfter) {
        return new Classification(FetchOutcome.SOFT_BLOCK, kind, retryAfter);
    }

    public static Classification hardBlock() {
        return new Classification(FetchOutcome.HARD_BLOCK, ErrorKind.HARD_BLOCK, null);
    }

    public static Classification transientError(ErrorKind kind) {
        return new Classification(FetchOutcome.TRANSIENT_ERROR, kind, null);
    }

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }
}
