package com.feedwarden.gate.client;

import com.feedwarden.gate.circuit.CircuitBreaker;
import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.config.SourceRegistry;
import com.feedwarden.gate.health.HealthMonitor;
import com.feedwarden.gate.identity.IdentityManager;
import com.feedwarden.gate.identity.InMemoryIdentityProfileRepository;
import com.feedwarden.gate.identity.ProxyPool;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.FetchOutcome;
import com.feedwarden.gate.model.IdentityStatus;
import com.feedwarden.gate.model.ProxyTier;
import com.feedwarden.gate.model.SourceDefinition;
import com.feedwarden.gate.model.SourceRecord;
import com.feedwarden.gate.model.SourceStatus;
import com.feedwarden.gate.scheduler.FetchScheduler;
import com.feedwarden.gate.store.InMemorySourceRecordStore;
import com.feedwarden.gate.support.FixedRandom;
import com.feedwarden.gate.support.MutableClock;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NetworkClientTest {

    private static final String SOURCE = "news-rss";
    private static final String URL = "https://news.example.org/rss";
    private static final String PROXIED = "board-proxied";
    private static final String PROXIED_URL = "https://board.example.org/latest";
    private static final String ARTICLE = "<rss><channel>" + "<item>Story</item>".repeat(20) + "</channel></rss>";

    private InMemorySourceRecordStore store;
    private InMemoryIdentityProfileRepository identities;
    private IngestionGateProperties properties;
    private MutableClock clock;
    private HttpTransport transport;
    private CircuitBreaker breaker;
    private NetworkClient client;

    @BeforeEach
    void setUp() {
        properties = new IngestionGateProperties();
        properties.setSources(List.of(
                SourceDefinition.builder().key(SOURCE).url(URL).averageInterval(Duration.ofMinutes(30)).build(),
                SourceDefinition.builder().key(PROXIED).url(PROXIED_URL).proxyTier(ProxyTier.RESIDENTIAL).build()));
        properties.getProxy().setResidential(List.of("http://res-1.proxy.test:8000"));

        store = new InMemorySourceRecordStore();
        identities = new InMemoryIdentityProfileRepository();
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        transport = mock(HttpTransport.class);

        breaker = new CircuitBreaker(store, properties, clock);
        client = newClient();
    }

    // A client with its own identity manager and bulkheads, sharing only the persisted state
    private NetworkClient newClient() {
        FixedRandom random = new FixedRandom(0.5);
        SourceRegistry registry = new SourceRegistry(properties);
        BulkheadRegistry bulkheads = BulkheadRegistry.of(BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(Duration.ZERO)
                .build());

        return new NetworkClient(
                store,
                breaker,
                new HealthMonitor(properties),
                new IdentityManager(identities, new ProxyPool(properties), properties, clock, random),
                new FetchScheduler(registry, properties, clock, random),
                new OutcomeClassifier(properties, clock),
                transport,
                bulkheads,
                registry,
                properties,
                clock);
    }

    @Nested
    @DisplayName("Successful fetches")
    class Success {

        @Test
        void fetch_successStoresTokensAndPlansNextFetch() throws Exception {
            // Given
            when(transport.execute(any())).thenReturn(response(200, ARTICLE,
                    Map.of("ETag", List.of("\"v1\""), "Last-Modified", List.of("Fri, 01 Mar 2024 09:00:00 GMT"))));

            // When
            Optional<FetchResult> result = client.fetch(URL, SOURCE, false);

            // Then
            assertTrue(result.isPresent());
            assertTrue(result.get().isSuccess());
            assertArrayEquals(ARTICLE.getBytes(StandardCharsets.UTF_8), result.get().getBody());
            assertFalse(result.get().getMetadata().proxyUsed());
            assertEquals(200, result.get().getMetadata().statusCode());

            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals("\"v1\"", record.getEtag());
            assertEquals("Fri, 01 Mar 2024 09:00:00 GMT", record.getLastModified());
            assertEquals(clock.instant(), record.getLastFetchAt());
            assertEquals(clock.instant(), record.getLastSuccessAt());
            assertEquals(clock.instant().plus(Duration.ofMinutes(30)), record.getNextScheduledAt());
            assertNull(record.getNextAllowedAt());
            assertNotNull(record.getAssignedIdentityId());
            assertEquals(SourceStatus.HEALTHY, record.getStatus());
        }

        @Test
        void fetch_sendsConditionalHeadersAndIdentityHeaders() throws Exception {
            // Given
            store.update(SOURCE, r -> {
                r.setEtag("\"v1\"");
                r.setLastModified("Fri, 01 Mar 2024 09:00:00 GMT");
            });
            when(transport.execute(any())).thenReturn(response(304, "", Map.of()));
            ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);

            // When
            Optional<FetchResult> result = client.fetch(URL, SOURCE, false);

            // Then
            verify(transport).execute(captor.capture());
            Map<String, String> headers = captor.getValue().headers();
            assertEquals("\"v1\"", headers.get("If-None-Match"));
            assertEquals("Fri, 01 Mar 2024 09:00:00 GMT", headers.get("If-Modified-Since"));
            assertTrue(headers.containsKey("User-Agent"));
            assertNull(captor.getValue().proxyUrl());
            assertEquals(Duration.ofSeconds(30), captor.getValue().timeout());

            assertTrue(result.orElseThrow().isNotModified());
            assertNull(result.get().getBody());
            assertEquals("\"v1\"", store.find(SOURCE).orElseThrow().getEtag());
        }

        @Test
        void fetch_keepsIdentityAcrossFetches() throws Exception {
            // Given
            when(transport.execute(any())).thenReturn(response(200, ARTICLE, Map.of()));
            client.fetch(URL, SOURCE, false);
            String firstIdentity = store.find(SOURCE).orElseThrow().getAssignedIdentityId();

            // When
            clock.advance(Duration.ofMinutes(31));
            client.fetch(URL, SOURCE, false);

            // Then
            assertEquals(firstIdentity, store.find(SOURCE).orElseThrow().getAssignedIdentityId());
            verify(transport, times(2)).execute(any());
        }
    }

    @Nested
    @DisplayName("Refusals")
    class Refusals {

        @Test
        void fetch_refusedWhileCircuitOpen() throws Exception {
            // Given
            store.update(SOURCE, r -> {
                r.setCircuitPhase(CircuitPhase.OPEN);
                r.setOpenCycleCount(1);
                r.setCooldownUntil(clock.instant().plus(Duration.ofMinutes(30)));
            });

            // When
            Optional<FetchResult> result = client.fetch(URL, SOURCE, true);

            // Then
            assertTrue(result.isEmpty());
            verify(transport, never()).execute(any());
        }

        @Test
        void fetch_refusedDuringCooldownUnlessProbe() throws Exception {
            // Given
            store.update(SOURCE, r -> r.setNextAllowedAt(clock.instant().plus(Duration.ofMinutes(10))));
            when(transport.execute(any())).thenReturn(response(200, ARTICLE, Map.of()));

            // When / Then
            assertTrue(client.fetch(URL, SOURCE, false).isEmpty());
            verify(transport, never()).execute(any());

            assertTrue(client.fetch(URL, SOURCE, true).isPresent());
            verify(transport, times(1)).execute(any());
        }

        @Test
        void fetch_secondConcurrentCallerIsRejected() throws Exception {
            // Given
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(transport.execute(any())).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return response(200, ARTICLE, Map.of());
            });
            CompletableFuture<Optional<FetchResult>> first =
                    CompletableFuture.supplyAsync(() -> client.fetch(URL, SOURCE, false));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            // When
            Optional<FetchResult> second = client.fetch(URL, SOURCE, false);
            release.countDown();

            // Then
            assertTrue(second.isEmpty());
            assertTrue(first.get(5, TimeUnit.SECONDS).isPresent());
            verify(transport, times(1)).execute(any());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void fetch_timeoutIsReportedAsTransientError() throws Exception {
            // Given
            when(transport.execute(any())).thenThrow(new HttpTimeoutException("request timed out"));

            // When
            FetchResult result = client.fetch(URL, SOURCE, false).orElseThrow();

            // Then
            assertEquals(FetchOutcome.TRANSIENT_ERROR, result.getOutcome());
            assertEquals(ErrorKind.NETWORK_TIMEOUT, result.getErrorKind());
            assertNull(result.getMetadata().statusCode());

            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(1, record.getFailureCount());
            assertEquals(clock.instant().plus(Duration.ofMinutes(5)), record.getNextAllowedAt());
            assertEquals(List.of(ErrorKind.NETWORK_TIMEOUT), record.getRecentErrorKinds());
        }

        @Test
        void fetch_interruptIsReportedAndFlagRestored() throws Exception {
            // Given
            when(transport.execute(any())).thenThrow(new InterruptedException());

            // When
            FetchResult result = client.fetch(URL, SOURCE, false).orElseThrow();

            // Then
            assertTrue(Thread.interrupted(), "interrupt flag should be restored");
            assertEquals(FetchOutcome.TRANSIENT_ERROR, result.getOutcome());
            assertEquals(1, store.find(SOURCE).orElseThrow().getFailureCount());
        }

        @Test
        void fetch_hardBlockRetiresIdentityAndDropsBody() throws Exception {
            // Given
            when(transport.execute(any())).thenReturn(response(403, "Forbidden", Map.of()));

            // When
            FetchResult result = client.fetch(URL, SOURCE, false).orElseThrow();

            // Then
            assertEquals(FetchOutcome.HARD_BLOCK, result.getOutcome());
            assertNull(result.getBody());

            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(clock.instant().plus(Duration.ofHours(24)), record.getNextAllowedAt());
            assertEquals(CircuitPhase.OPEN, record.getCircuitPhase());
            assertEquals(SourceStatus.OPEN, record.getStatus());
            assertEquals(IdentityStatus.RETIRED,
                    identities.findById(record.getAssignedIdentityId()).orElseThrow().getStatus());
        }

        @Test
        void reportOutcome_hardBlockRetiresPersistedIdentityAfterRestart() throws Exception {
            // Given: an identity assigned and persisted by an earlier process
            when(transport.execute(any())).thenReturn(response(200, ARTICLE, Map.of()));
            client.fetch(URL, SOURCE, false);
            String assigned = store.find(SOURCE).orElseThrow().getAssignedIdentityId();
            NetworkClient restarted = newClient();

            // When
            restarted.reportOutcome(SOURCE, Classification.hardBlock(), Duration.ofMillis(150), false, null, null);

            // Then
            assertEquals(IdentityStatus.RETIRED, identities.findById(assigned).orElseThrow().getStatus());
            assertEquals("hard_block", identities.findById(assigned).orElseThrow().getRetiredReason());
        }

        @Test
        void fetch_softBlockHonoursRetryAfterWithinCap() throws Exception {
            // Given
            when(transport.execute(any())).thenReturn(response(429, "", Map.of("Retry-After", List.of("7200"))));

            // When
            client.fetch(URL, SOURCE, false);

            // Then
            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(clock.instant().plus(Duration.ofHours(2)), record.getNextAllowedAt());
            assertEquals(SourceStatus.DEGRADED, record.getStatus());
        }

        @Test
        void fetch_retryAfterIsCappedAtHardBlockCooldown() throws Exception {
            when(transport.execute(any())).thenReturn(response(429, "", Map.of("Retry-After", List.of("9999999"))));

            client.fetch(URL, SOURCE, false);

            assertEquals(clock.instant().plus(Duration.ofHours(24)), store.find(SOURCE).orElseThrow().getNextAllowedAt());
        }

        @Test
        void fetch_unreachableProxyFallsBackToDirectOnce() throws Exception {
            // Given
            when(transport.execute(any())).thenAnswer(invocation -> {
                TransportRequest request = invocation.getArgument(0);
                if (request.proxyUrl() != null) {
                    throw new ConnectException("Connection refused");
                }
                return response(200, ARTICLE, Map.of());
            });
            ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);

            // When
            FetchResult result = client.fetch(PROXIED_URL, PROXIED, false).orElseThrow();

            // Then
            verify(transport, times(2)).execute(captor.capture());
            assertEquals("http://res-1.proxy.test:8000", captor.getAllValues().get(0).proxyUrl());
            assertNull(captor.getAllValues().get(1).proxyUrl());
            assertTrue(result.isSuccess());
            assertFalse(result.getMetadata().proxyUsed());
        }

        @Test
        void fetch_proxyRejectingCredentialsFallsBackToDirect() throws Exception {
            // Given
            when(transport.execute(any())).thenAnswer(invocation -> {
                TransportRequest request = invocation.getArgument(0);
                if (request.proxyUrl() != null) {
                    throw new ProxyRejectedException("Egress proxy rejected request (HTTP 407)");
                }
                return response(200, ARTICLE, Map.of());
            });

            // When
            FetchResult result = client.fetch(PROXIED_URL, PROXIED, false).orElseThrow();

            // Then
            verify(transport, times(2)).execute(any());
            assertTrue(result.isSuccess());
            assertFalse(result.getMetadata().proxyUsed());
            assertEquals(1.0, store.find(PROXIED).orElseThrow().getHealthScore());
        }

        @Test
        void fetch_directConnectionFailureIsNotRetried() throws Exception {
            when(transport.execute(any())).thenThrow(new ConnectException("Connection refused"));

            FetchResult result = client.fetch(URL, SOURCE, false).orElseThrow();

            verify(transport, times(1)).execute(any());
            assertEquals(ErrorKind.NETWORK_TIMEOUT, result.getErrorKind());
        }
    }

    @Nested
    @DisplayName("Breaker scenarios")
    class BreakerScenarios {

        @Test
        void fiveSoftBlocksTripCircuitExactlyOnce() {
            // Given
            Instant start = clock.instant();

            // When
            for (int i = 0; i < 5; i++) {
                client.reportOutcome(SOURCE, Classification.softBlock(ErrorKind.SOFT_BLOCK, null),
                        Duration.ofMillis(200), false, null, null);
            }

            // Then
            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(CircuitPhase.OPEN, record.getCircuitPhase());
            assertEquals(1, record.getOpenCycleCount());
            assertEquals(start.plus(Duration.ofHours(1)), record.getCooldownUntil());
            assertEquals(5, record.getFailureCount());
            assertEquals(SourceStatus.OPEN, record.getStatus());
            assertFalse(record.getNextAllowedAt().isBefore(start.plus(Duration.ofHours(24))));
        }

        @Test
        void lapsedCooldownThenFailedProbeEscalatesToSixHours() throws Exception {
            // Given
            tripWithSoftBlocks(5);
            clock.advance(Duration.ofHours(1));
            assertTrue(breaker.canFetch(SOURCE));
            when(transport.execute(any())).thenReturn(response(429, "", Map.of()));

            // When
            FetchResult result = client.fetch(URL, SOURCE, true).orElseThrow();

            // Then
            assertTrue(result.isProbe());
            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(CircuitPhase.OPEN, record.getCircuitPhase());
            assertEquals(2, record.getOpenCycleCount());
            assertEquals(clock.instant().plus(Duration.ofHours(6)), record.getCooldownUntil());
            assertFalse(breaker.isProbeInFlight(SOURCE));
        }

        @Test
        void successfulProbeClosesCircuitAndResetsCycles() throws Exception {
            // Given
            tripWithSoftBlocks(2);
            clock.advance(Duration.ofHours(1));
            when(transport.execute(any())).thenReturn(response(200, ARTICLE, Map.of()));

            // When
            FetchResult result = client.fetch(URL, SOURCE, true).orElseThrow();

            // Then
            assertTrue(result.isSuccess());
            SourceRecord record = store.find(SOURCE).orElseThrow();
            assertEquals(CircuitPhase.CLOSED, record.getCircuitPhase());
            assertEquals(0, record.getOpenCycleCount());
            assertEquals(0, record.getFailureCount());
            assertNull(record.getNextAllowedAt());
            assertTrue(record.getHealthScore() >= 0.5);
            assertEquals(SourceStatus.DEGRADED, record.getStatus());
        }

        @Test
        void successAfterThreeFailuresResetsCounters() {
            // Given
            for (int i = 0; i < 3; i++) {
                client.reportOutcome(SOURCE, Classification.transientError(ErrorKind.NETWORK_TIMEOUT),
                        Duration.ofSeconds(30), false, null, null);
            }

            // When
            SourceRecord record = client.reportOutcome(SOURCE, Classification.success(),
                    Duration.ofMillis(300), false, null, null);

            // Then: 1.0 - 0.10 - 0.15 - 0.20 + 0.05
            assertEquals(0.60, record.getHealthScore(), 1e-9);
            assertEquals(0, record.getFailureCount());
            assertEquals(0, record.getErrorStreak());
            assertEquals(1, record.getSuccessStreak());
            assertNull(record.getNextAllowedAt());
            assertEquals(CircuitPhase.CLOSED, record.getCircuitPhase());
            assertEquals(SourceStatus.DEGRADED, record.getStatus());
        }

        @Test
        void failureLockoutNeverShorterThanOneDay() {
            // Given
            properties.getClient().setFailureLockout(Duration.ofHours(1));

            for (int i = 1; i <= 7; i++) {
                // When
                SourceRecord record = client.reportOutcome(SOURCE,
                        Classification.transientError(ErrorKind.CLIENT_ERROR),
                        Duration.ofMillis(100), false, null, null);

                // Then
                if (record.getFailureCount() >= 5) {
                    assertEquals(SourceStatus.OPEN, record.getStatus());
                    assertFalse(record.getNextAllowedAt().isBefore(clock.instant().plus(Duration.ofHours(24))),
                            "lockout too short after failure " + i);
                }
                clock.advance(Duration.ofMinutes(10));
            }
        }

        private void tripWithSoftBlocks(int count) {
            for (int i = 0; i < count; i++) {
                client.reportOutcome(SOURCE, Classification.softBlock(ErrorKind.SOFT_BLOCK, null),
                        Duration.ofMillis(200), false, null, null);
            }
            assertEquals(CircuitPhase.OPEN, store.find(SOURCE).orElseThrow().getCircuitPhase());
        }
    }

    private static TransportResponse response(int status, String body, Map<String, List<String>> headers) {
        return new TransportResponse(status, headers, body.getBytes(StandardCharsets.UTF_8), Duration.ofMillis(150));
    }
}
