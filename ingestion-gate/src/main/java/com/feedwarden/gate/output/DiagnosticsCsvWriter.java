package com.feedwarden.gate.output;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.service.SourceDiagnostics;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Writes a snapshot of every source's state after each tick.
 *
 * Output path: {outputDir}/source_diagnostics.csv, replaced atomically so readers never see a
 * half-written file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiagnosticsCsvWriter {

    static final String FILE_NAME = "source_diagnostics.csv";

    private static final String[] HEADERS = {
            "source_id", "status", "failure_count",
            "health_score", "health_status", "circuit_phase",
            "next_scheduled_at", "last_fetch_at", "last_success_at",
            "assigned_identity_id"
    };

    private final IngestionGateProperties properties;

    public Path write(List<SourceDiagnostics> snapshot) {
        Path outputDir = Paths.get(properties.getOutput().getDiagnosticsCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path target = outputDir.resolve(FILE_NAME);
        Path temp = outputDir.resolve(FILE_NAME + ".tmp");

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(temp.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (SourceDiagnostics d : snapshot) {
                writer.writeNext(toRow(d));
            }
        } catch (IOException e) {
            log.error("Failed to write diagnostics CSV {}: {}", temp, e.getMessage(), e);
            throw new UncheckedIOException("Diagnostics CSV write failed", e);
        }

        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot replace " + target, e);
        }
        log.debug("Written {} source rows to {}", snapshot.size(), target);
        return target;
    }

    private String[] toRow(SourceDiagnostics d) {
        return new String[]{
                str(d.sourceId()),
                str(d.status()),
                str(d.failureCount()),
                String.format(Locale.ROOT, "%.4f", d.healthScore()),
                str(d.healthStatus()),
                str(d.circuitPhase()),
                str(d.nextScheduledAt()),
                str(d.lastFetchAt()),
                str(d.lastSuccessAt()),
                str(d.assignedIdentityId())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
