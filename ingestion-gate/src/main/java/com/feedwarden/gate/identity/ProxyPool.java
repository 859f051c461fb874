package com.feedwarden.gate.identity;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.ProxyTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tiered egress selection with round-robin rotation inside each tier.
 *
 * RESIDENTIAL sources only get residential endpoints; DATACENTER sources get datacenter
 * endpoints; DIRECT sources never use a proxy. An empty pool degrades to a direct connection.
 *
 * Egress URLs are validated on construction: each must be http://[user:pass@]host:port.
 */
@Component
@Slf4j
public class ProxyPool {

    private final IngestionGateProperties properties;

    private final Map<ProxyTier, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public ProxyPool(IngestionGateProperties properties) {
        this.properties = properties;
        requireValidEgress(ProxyTier.RESIDENTIAL, properties.getProxy().getResidential());
        requireValidEgress(ProxyTier.DATACENTER, properties.getProxy().getDatacenter());
    }

    /**
     * @return the egress URL for the next session in this tier, or null for a direct connection
     */
    public String nextEgress(ProxyTier tier) {
        List<String> pool = eligible(tier);
        if (pool.isEmpty()) {
            if (tier != ProxyTier.DIRECT) {
                log.warn("No {} egress configured, falling back to direct connection", tier);
            }
            return null;
        }
        int index = cursors.computeIfAbsent(tier, t -> new AtomicInteger())
                .getAndUpdate(i -> (i + 1) % pool.size());
        return pool.get(index % pool.size());
    }

    /** The tier actually delivered for a requested tier, given the configured pools. */
    public ProxyTier effectiveTier(ProxyTier requested, String egress) {
        return egress == null ? ProxyTier.DIRECT : requested;
    }

    private List<String> eligible(ProxyTier tier) {
        IngestionGateProperties.Proxy proxy = properties.getProxy();
        List<String> configured = switch (tier) {
            case RESIDENTIAL -> proxy.getResidential();
            case DATACENTER -> proxy.getDatacenter();
            case DIRECT -> List.of();
        };
        return configured.stream()
                .filter(url -> url != null && !url.isBlank())
                .map(String::trim)
                .toList();
    }

    // Messages name the host only, so credentials in user-info never reach the logs
    private static void requireValidEgress(ProxyTier tier, List<String> urls) {
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            if (url == null || url.isBlank()) {
                continue;
            }
            URI uri;
            try {
                uri = new URI(url.trim());
            } catch (URISyntaxException e) {
                throw new IllegalStateException(
                        "Malformed " + tier + " egress URL at position " + i + ": " + e.getReason());
            }
            if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null || uri.getPort() == -1) {
                throw new IllegalStateException(String.format(
                        "Invalid %s egress URL at position %d (host %s): expected http://host:port",
                        tier, i, uri.getHost()));
            }
        }
    }
}
