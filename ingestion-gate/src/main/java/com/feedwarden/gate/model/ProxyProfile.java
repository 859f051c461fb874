package com.feedwarden.gate.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A sticky egress session. A null egressUrl means a direct connection.
 */
@Value
@Builder
public class ProxyProfile {

    String id;
    String egressUrl;
    ProxyTier tier;
    Instant createdAt;
    Instant expiresAt;

    public boolean isDirect() {
        return egressUrl == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
