package com.feedwarden.gate.scheduler;

import com.feedwarden.gate.client.FetchResult;
import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.config.SourceRegistry;
import com.feedwarden.gate.model.SourceDefinition;
import com.feedwarden.gate.output.DiagnosticsCsvWriter;
import com.feedwarden.gate.service.ContentHandoff;
import com.feedwarden.gate.service.IngestionController;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives ingestion for all configured sources.
 *
 * Every tick (default 60s) each enabled source gets one worker on the shared pool, unless
 * its previous worker is still running. The gate decides per source whether anything is
 * actually fetched, so most ticks are cheap no-ops.
 *
 * Override the cadence with ingestion-gate.scheduling.tick-interval.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionController controller;
    private final SourceRegistry sourceRegistry;
    private final ObjectProvider<ContentHandoff> handoffs;
    private final DiagnosticsCsvWriter diagnosticsCsvWriter;
    private final IngestionGateProperties properties;
    private final ExecutorService workers;

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @PostConstruct
    public void onStartup() {
        int sources = sourceRegistry.enabledSources().size();
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, ingesting {} sources now", sources);
            tick();
        } else {
            log.info("Ingestion gate ready. {} sources, tick every {}s",
                    sources, properties.getScheduling().getTickInterval().toSeconds());
        }
    }

    @Scheduled(fixedDelayString = "${ingestion-gate.scheduling.tick-interval:60s}",
            initialDelayString = "${ingestion-gate.scheduling.tick-interval:60s}")
    public void scheduledTick() {
        log.debug("Scheduled tick triggered");
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduled tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Submits one worker per idle source and waits for this round to finish.
     *
     * @return number of workers submitted
     */
    public int tick() {
        List<Future<?>> submitted = new ArrayList<>();
        for (SourceDefinition source : sourceRegistry.enabledSources()) {
            if (!running.add(source.getKey())) {
                log.debug("Worker for {} still running, not submitting another", source.getKey());
                continue;
            }
            try {
                submitted.add(workers.submit(() -> runSource(source)));
            } catch (RejectedExecutionException e) {
                running.remove(source.getKey());
                log.warn("Worker pool rejected {}: {}", source.getKey(), e.getMessage());
            }
        }

        for (Future<?> future : submitted) {
            awaitQuietly(future);
        }

        if (properties.getOutput().getDiagnosticsCsv().isEnabled()) {
            diagnosticsCsvWriter.write(controller.diagnosticsForAll());
        }
        return submitted.size();
    }

    /** Manual trigger: runs a tick off the caller's thread. */
    public void triggerNow() {
        new Thread(this::scheduledTick, "manual-ingestion-tick").start();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    void runSource(SourceDefinition source) {
        try {
            Optional<FetchResult> result = controller.ingestForResult(source.getKey(), source.getUrl());
            result.ifPresent(this::handOff);
        } catch (Exception e) {
            log.error("Ingestion failed for {}: {}", source.getKey(), e.getMessage(), e);
        } finally {
            running.remove(source.getKey());
        }
    }

    private void handOff(FetchResult result) {
        handoffs.orderedStream().forEach(handoff -> {
            try {
                handoff.accept(result);
            } catch (RuntimeException e) {
                log.error("Content handoff {} failed for {}: {}",
                        handoff.getClass().getSimpleName(), result.getSourceId(), e.getMessage(), e);
            }
        });
    }

    private void awaitQuietly(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for ingestion workers");
        } catch (ExecutionException e) {
            log.error("Ingestion worker crashed: {}", e.getCause().getMessage(), e.getCause());
        }
    }
}
