package com.feedwarden.gate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A consistent browser identity bound to one sticky proxy session.
 * Owned by the IdentityManager; sources only hold its id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IdentityProfile {

    private String id;
    private BrowserTemplate template;
    private ProxyProfile proxySession;

    @Builder.Default
    private IdentityStatus status = IdentityStatus.ACTIVE;

    private Instant createdAt;
    private Instant retiredAt;
    private String retiredReason;   // null while active

    public Map<String, String> headers() {
        return template.headers();
    }

    public boolean isRetired() {
        return status == IdentityStatus.RETIRED;
    }
}
