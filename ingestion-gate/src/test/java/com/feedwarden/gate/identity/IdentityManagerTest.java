package com.feedwarden.gate.identity;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.IdentityProfile;
import com.feedwarden.gate.model.IdentityStatus;
import com.feedwarden.gate.model.ProxyTier;
import com.feedwarden.gate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IdentityManagerTest {

    private static final String SOURCE = "forum-board";

    private InMemoryIdentityProfileRepository repository;
    private IngestionGateProperties properties;
    private MutableClock clock;
    private IdentityManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIdentityProfileRepository();
        properties = new IngestionGateProperties();
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        manager = new IdentityManager(repository, new ProxyPool(properties), properties, clock, new Random(42));
    }

    @Test
    void profileFor_createsActiveProfileWithBoundedSession() {
        // When
        IdentityProfile profile = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);

        // Then
        assertEquals(IdentityStatus.ACTIVE, profile.getStatus());
        assertNotNull(profile.getTemplate());
        assertTrue(profile.headers().containsKey("User-Agent"));
        assertTrue(profile.getProxySession().isDirect());

        Duration lifetime = Duration.between(profile.getProxySession().getCreatedAt(), profile.getProxySession().getExpiresAt());
        assertTrue(lifetime.compareTo(Duration.ofHours(24)) >= 0, "lifetime too short: " + lifetime);
        assertTrue(lifetime.compareTo(Duration.ofHours(72)) <= 0, "lifetime too long: " + lifetime);
        assertTrue(repository.findById(profile.getId()).isPresent());
    }

    @Test
    void profileFor_reusesCurrentProfileUntilItExpires() {
        // Given
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);

        // When
        IdentityProfile again = manager.profileFor(SOURCE, first.getId(), ProxyTier.DIRECT);

        // Then
        assertEquals(first.getId(), again.getId());
        assertEquals(first.getTemplate(), again.getTemplate());
    }

    @Test
    void profileFor_rotatesWhenProxySessionExpires() {
        // Given
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);
        clock.advance(Duration.ofHours(73));

        // When
        IdentityProfile next = manager.profileFor(SOURCE, first.getId(), ProxyTier.DIRECT);

        // Then
        assertNotEquals(first.getId(), next.getId());
        IdentityProfile retired = repository.findById(first.getId()).orElseThrow();
        assertEquals(IdentityStatus.RETIRED, retired.getStatus());
        assertEquals("proxy_expired", retired.getRetiredReason());
    }

    @Test
    void reportBlock_hardBlockRetiresAndNextCallRotates() {
        // Given
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);

        // When
        manager.reportBlock(SOURCE, first.getId(), true);
        IdentityProfile next = manager.profileFor(SOURCE, first.getId(), ProxyTier.DIRECT);

        // Then
        IdentityProfile retired = repository.findById(first.getId()).orElseThrow();
        assertEquals(IdentityStatus.RETIRED, retired.getStatus());
        assertEquals("hard_block", retired.getRetiredReason());
        assertNotEquals(first.getId(), next.getId());
    }

    @Test
    void reportBlock_hardBlockRetiresPersistedIdentityAfterRestart() {
        // Given: the identity was assigned by an earlier process and only its id survived
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);
        IdentityManager restarted = new IdentityManager(
                repository, new ProxyPool(properties), properties, clock, new Random(7));

        // When
        restarted.reportBlock(SOURCE, first.getId(), true);

        // Then
        IdentityProfile retired = repository.findById(first.getId()).orElseThrow();
        assertEquals(IdentityStatus.RETIRED, retired.getStatus());
        assertEquals("hard_block", retired.getRetiredReason());
    }

    @Test
    void reportBlock_fallsBackToCurrentAssignmentWhenNoIdPersisted() {
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);

        manager.reportBlock(SOURCE, null, true);

        assertEquals(IdentityStatus.RETIRED, repository.findById(first.getId()).orElseThrow().getStatus());
    }

    @Test
    void reportBlock_softBlockKeepsIdentity() {
        IdentityProfile first = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);

        manager.reportBlock(SOURCE, first.getId(), false);

        assertEquals(IdentityStatus.ACTIVE, repository.findById(first.getId()).orElseThrow().getStatus());
        assertEquals(first.getId(), manager.profileFor(SOURCE, first.getId(), ProxyTier.DIRECT).getId());
    }

    @Test
    void retireProfile_isIdempotent() {
        // Given
        IdentityProfile profile = manager.profileFor(SOURCE, null, ProxyTier.DIRECT);
        manager.retireProfile(profile.getId(), "hard_block");
        Instant firstRetiredAt = repository.findById(profile.getId()).orElseThrow().getRetiredAt();

        // When
        clock.advance(Duration.ofMinutes(5));
        manager.retireProfile(profile.getId(), "manual");

        // Then
        IdentityProfile stored = repository.findById(profile.getId()).orElseThrow();
        assertEquals(firstRetiredAt, stored.getRetiredAt());
        assertEquals("hard_block", stored.getRetiredReason());
        assertDoesNotThrow(() -> manager.retireProfile("no-such-profile", "manual"));
    }

    @Test
    void profileFor_usesResidentialPoolForResidentialSources() {
        // Given
        properties.getProxy().setResidential(List.of("http://res-1.proxy.test:8000"));

        // When
        IdentityProfile profile = manager.profileFor(SOURCE, null, ProxyTier.RESIDENTIAL);

        // Then
        assertEquals("http://res-1.proxy.test:8000", profile.getProxySession().getEgressUrl());
        assertEquals(ProxyTier.RESIDENTIAL, profile.getProxySession().getTier());
    }
}
