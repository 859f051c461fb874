package com.feedwarden.gate.model;

public enum FetchOutcome {
    SUCCESS,
    /** Reversible refusal: 429, CAPTCHA, throttling. Means "slow down". */
    SOFT_BLOCK,
    /** The identity or egress IP is burned: 403/406. */
    HARD_BLOCK,
    /** Network glitch, timeout, 5xx or a non-block 4xx. */
    TRANSIENT_ERROR;

    public boolean isBlock() {
        return this == SOFT_BLOCK || this == HARD_BLOCK;
    }
}
