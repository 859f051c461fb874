package com.feedwarden.gate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Typed definition of one configured source, bound from ingestion-gate.sources.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDefinition {

    private String key;
    private String name;
    private String url;

    @Builder.Default
    private SourceType type = SourceType.RSS;

    @Builder.Default
    private boolean enabled = true;

    /** Overrides the per-type average fetch interval when set. */
    private Duration averageInterval;

    @Builder.Default
    private ProxyTier proxyTier = ProxyTier.DIRECT;

    @Builder.Default
    private SourcePriority priority = SourcePriority.LOW;
}
