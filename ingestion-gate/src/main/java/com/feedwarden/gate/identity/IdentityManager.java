package com.feedwarden.gate.identity;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.BrowserTemplate;
import com.feedwarden.gate.model.IdentityProfile;
import com.feedwarden.gate.model.IdentityStatus;
import com.feedwarden.gate.model.ProxyProfile;
import com.feedwarden.gate.model.ProxyTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each source looking like one consistent visitor: the same header set and the same
 * sticky egress for days at a time.
 *
 * A profile is replaced only when it is retired (hard block) or its proxy session expires.
 * Soft blocks never rotate identity; churning fingerprints on every throttle is itself a bot signal.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdentityManager {

    private final IdentityProfileRepository repository;
    private final ProxyPool proxyPool;
    private final IngestionGateProperties properties;
    private final Clock clock;
    private final Random random;

    // sourceId -> profileId for the current process; SourceRecord carries it across restarts
    private final Map<String, String> assignments = new ConcurrentHashMap<>();

    public IdentityProfile profileFor(String sourceId, String currentProfileId, ProxyTier tier) {
        String profileId = currentProfileId != null ? currentProfileId : assignments.get(sourceId);
        Optional<IdentityProfile> current = profileId == null
                ? Optional.empty()
                : repository.findById(profileId);

        Instant now = clock.instant();
        if (current.isPresent()) {
            IdentityProfile profile = current.get();
            if (profile.isRetired()) {
                log.info("Identity {} retired. Rotating for {}", profile.getId(), sourceId);
            } else if (profile.getProxySession() != null && profile.getProxySession().isExpired(now)) {
                log.info("Proxy session for identity {} expired. Rotating for {}", profile.getId(), sourceId);
                retire(profile, "proxy_expired");
            } else {
                assignments.put(sourceId, profile.getId());
                return profile;
            }
        } else if (profileId != null) {
            log.warn("Identity {} for {} not found, assigning a new one", profileId, sourceId);
        }

        IdentityProfile created = createIdentity(tier, now);
        repository.save(created);
        assignments.put(sourceId, created.getId());
        log.info("Assigned new identity {} ({}/{}, {}) to {}",
                created.getId(),
                created.getTemplate().browserFamily(),
                created.getTemplate().osFamily(),
                created.getProxySession().getTier(),
                sourceId);
        return created;
    }

    /**
     * A hard block burns the fingerprint and retires the identity. A soft block leaves it intact.
     *
     * @param profileId the identity persisted on the source record; when null the assignment made
     *                  by this process is used
     */
    public void reportBlock(String sourceId, String profileId, boolean isHard) {
        String blocked = profileId != null ? profileId : assignments.get(sourceId);
        if (blocked == null) {
            log.debug("Block reported for {} with no assigned identity", sourceId);
            return;
        }
        if (!isHard) {
            log.debug("Soft block for {}; keeping identity {}", sourceId, blocked);
            return;
        }
        retireProfile(blocked, "hard_block");
    }

    /** Idempotent: retiring an already-retired or unknown profile does nothing. */
    public void retireProfile(String profileId, String reason) {
        repository.findById(profileId)
                .filter(profile -> !profile.isRetired())
                .ifPresent(profile -> retire(profile, reason));
    }

    private void retire(IdentityProfile profile, String reason) {
        IdentityProfile retired = profile.toBuilder()
                .status(IdentityStatus.RETIRED)
                .retiredAt(clock.instant())
                .retiredReason(reason)
                .build();
        repository.save(retired);
        log.warn("Retired identity {}. Reason: {}", profile.getId(), reason);
    }

    private IdentityProfile createIdentity(ProxyTier tier, Instant now) {
        BrowserTemplate[] templates = BrowserTemplate.values();
        BrowserTemplate template = templates[random.nextInt(templates.length)];

        String egress = proxyPool.nextEgress(tier);
        ProxyProfile proxy = ProxyProfile.builder()
                .id(UUID.randomUUID().toString())
                .egressUrl(egress)
                .tier(proxyPool.effectiveTier(tier, egress))
                .createdAt(now)
                .expiresAt(now.plus(sessionLifetime()))
                .build();

        return IdentityProfile.builder()
                .id(UUID.randomUUID().toString())
                .template(template)
                .proxySession(proxy)
                .status(IdentityStatus.ACTIVE)
                .createdAt(now)
                .build();
    }

    private Duration sessionLifetime() {
        IngestionGateProperties.Identity cfg = properties.getIdentity();
        long min = cfg.getSessionLifetimeMin().toMinutes();
        long max = cfg.getSessionLifetimeMax().toMinutes();
        long span = Math.max(0, max - min);
        return Duration.ofMinutes(min + (span == 0 ? 0 : (long) (random.nextDouble() * (span + 1))));
    }
}
