package com.feedwarden.gate.config;

import com.feedwarden.gate.scheduler.IngestionScheduler;
import com.feedwarden.gate.service.IngestionController;
import com.feedwarden.gate.service.SourceDiagnostics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class DiagnosticsController {

    private final IngestionController ingestionController;
    private final IngestionScheduler ingestionScheduler;

    // ── Triggers ─────────────────────────────────────────────────────────────

    @PostMapping("/sources/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        ingestionScheduler.triggerNow();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "all-sources"));
    }

    // ── Read-only state ──────────────────────────────────────────────────────

    @GetMapping("/sources/diagnostics")
    public ResponseEntity<List<SourceDiagnostics>> all() {
        return ResponseEntity.ok(ingestionController.diagnosticsForAll());
    }

    /**
     * GET /sources/{id}/diagnostics
     *
     * Unknown ids report a fresh, never-fetched source rather than 404.
     */
    @GetMapping("/sources/{id}/diagnostics")
    public ResponseEntity<?> one(@PathVariable String id) {
        try {
            return ResponseEntity.ok(ingestionController.diagnostics(id));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Diagnostics failed for {}: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
