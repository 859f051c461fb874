package com.feedwarden.gate.store;

import com.feedwarden.gate.model.SourceRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable per-source state. Every mutation of a source's health, circuit, schedule or
 * identity binding goes through {@link #update}, which is atomic per source id.
 *
 * Records handed out are copies; mutating them has no effect on the store.
 * Timestamps are kept at microsecond precision.
 */
public interface SourceRecordStore {

    Optional<SourceRecord> find(String sourceId);

    List<SourceRecord> findAll();

    /**
     * Returns the record for a source, creating a fresh one on first reference.
     */
    default SourceRecord getOrCreate(String sourceId) {
        return find(sourceId).orElseGet(() -> update(sourceId, record -> { }));
    }

    /**
     * Atomically reads, mutates and writes the record for a source (created lazily).
     * If the mutation throws, nothing is written.
     *
     * @return a copy of the record as written
     */
    SourceRecord update(String sourceId, Consumer<SourceRecord> mutation);

    static void normaliseTimestamps(SourceRecord record) {
        record.setNextAllowedAt(micros(record.getNextAllowedAt()));
        record.setLastFetchAt(micros(record.getLastFetchAt()));
        record.setLastSuccessAt(micros(record.getLastSuccessAt()));
        record.setNextScheduledAt(micros(record.getNextScheduledAt()));
        record.setCooldownUntil(micros(record.getCooldownUntil()));
    }

    private static Instant micros(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MICROS);
    }
}
