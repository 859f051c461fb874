package com.feedwarden.gate.config;

import com.feedwarden.gate.model.SourceDefinition;
import com.feedwarden.gate.model.ProxyTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the configured sources. Disabled sources are never returned by
 * {@link #enabledSources()}; execution order is priority first, then key.
 */
@Component
@RequiredArgsConstructor
public class SourceRegistry {

    private final IngestionGateProperties properties;

    public List<SourceDefinition> enabledSources() {
        return properties.getSources().stream()
                .filter(SourceDefinition::isEnabled)
                .sorted(Comparator.comparing(SourceDefinition::getPriority)
                        .thenComparing(SourceDefinition::getKey))
                .toList();
    }

    public Optional<SourceDefinition> find(String key) {
        return properties.getSources().stream()
                .filter(s -> s.getKey().equals(key))
                .findFirst();
    }

    /** Per-source interval, else the per-type interval, else the global default. */
    public Duration averageInterval(String key) {
        IngestionGateProperties.Behavior behavior = properties.getBehavior();
        return find(key)
                .map(source -> source.getAverageInterval() != null
                        ? source.getAverageInterval()
                        : behavior.getTypeIntervals().get(source.getType()))
                .orElse(behavior.getDefaultAverageInterval());
    }

    public ProxyTier proxyTier(String key) {
        return find(key).map(SourceDefinition::getProxyTier).orElse(ProxyTier.DIRECT);
    }
}
