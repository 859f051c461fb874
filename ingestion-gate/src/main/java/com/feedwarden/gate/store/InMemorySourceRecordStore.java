package com.feedwarden.gate.store;

import com.feedwarden.gate.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Process-local store for tests and ephemeral runs. State does not survive a restart.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "ingestion-gate.store", name = "mode", havingValue = "MEMORY")
public class InMemorySourceRecordStore implements SourceRecordStore {

    private final ConcurrentMap<String, SourceRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<SourceRecord> find(String sourceId) {
        SourceRecord record = records.get(sourceId);
        return Optional.ofNullable(record).map(SourceRecord::copy);
    }

    @Override
    public List<SourceRecord> findAll() {
        return records.values().stream()
                .map(SourceRecord::copy)
                .sorted(Comparator.comparing(SourceRecord::getSourceId))
                .toList();
    }

    @Override
    public SourceRecord update(String sourceId, Consumer<SourceRecord> mutation) {
        SourceRecord written = records.compute(sourceId, (id, existing) -> {
            SourceRecord working = existing == null ? SourceRecord.fresh(id) : existing.copy();
            mutation.accept(working);
            working.setSourceId(id);
            SourceRecordStore.normaliseTimestamps(working);
            if (existing == null) {
                log.debug("Created source record {}", id);
            }
            return working;
        });
        return written.copy();
    }
}
