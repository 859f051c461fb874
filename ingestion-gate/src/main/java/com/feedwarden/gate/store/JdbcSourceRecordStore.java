package com.feedwarden.gate.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedwarden.gate.model.CircuitPhase;
import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.SourceRecord;
import com.feedwarden.gate.model.SourceStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Source records in a relational table, one row per source key.
 *
 * Updates lock the row with SELECT ... FOR UPDATE inside a transaction, so a conditional-token
 * write and a failure-count increment for the same source can never interleave.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ingestion-gate.store", name = "mode", havingValue = "JDBC", matchIfMissing = true)
public class JdbcSourceRecordStore implements SourceRecordStore {

    private static final TypeReference<List<ErrorKind>> ERROR_KINDS = new TypeReference<>() { };

    private static final String COLUMNS = """
            source_id, status, failure_count, next_allowed_at, etag, last_modified,
            last_run_at, last_success_at, next_scheduled_at, assigned_identity_id,
            health_score, error_streak, success_streak, recent_error_kinds,
            circuit_phase, open_cycle_count, cooldown_until
            """;

    private static final String SELECT_ONE = "SELECT " + COLUMNS + " FROM source_records WHERE source_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void ensureSchema() {
        log.info("Ensuring source_records schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS source_records
            (
                source_id            VARCHAR(255)  NOT NULL PRIMARY KEY,
                status               VARCHAR(16)   NOT NULL,
                failure_count        INTEGER       NOT NULL,
                next_allowed_at      TIMESTAMP WITH TIME ZONE,
                etag                 VARCHAR(1024),
                last_modified        VARCHAR(255),
                last_run_at          TIMESTAMP WITH TIME ZONE,
                last_success_at      TIMESTAMP WITH TIME ZONE,
                next_scheduled_at    TIMESTAMP WITH TIME ZONE,
                assigned_identity_id VARCHAR(64),
                health_score         DOUBLE PRECISION NOT NULL,
                error_streak         INTEGER       NOT NULL,
                success_streak       INTEGER       NOT NULL,
                recent_error_kinds   VARCHAR(1024) NOT NULL,
                circuit_phase        VARCHAR(16)   NOT NULL,
                open_cycle_count     INTEGER       NOT NULL,
                cooldown_until       TIMESTAMP WITH TIME ZONE
            )
        """);

        log.info("source_records schema ready.");
    }

    @Override
    public Optional<SourceRecord> find(String sourceId) {
        List<SourceRecord> rows = jdbcTemplate.query(SELECT_ONE, rowMapper(), sourceId);
        return rows.stream().findFirst();
    }

    @Override
    public List<SourceRecord> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM source_records ORDER BY source_id", rowMapper());
    }

    @Override
    public SourceRecord update(String sourceId, Consumer<SourceRecord> mutation) {
        try {
            return transactionTemplate.execute(status -> lockAndWrite(sourceId, mutation));
        } catch (DuplicateKeyException e) {
            // Another worker inserted the row between our SELECT and INSERT; the row now exists.
            log.debug("Concurrent insert for source {}, retrying as update", sourceId);
            return transactionTemplate.execute(status -> lockAndWrite(sourceId, mutation));
        }
    }

    private SourceRecord lockAndWrite(String sourceId, Consumer<SourceRecord> mutation) {
        List<SourceRecord> rows = jdbcTemplate.query(SELECT_ONE + " FOR UPDATE", rowMapper(), sourceId);
        boolean exists = !rows.isEmpty();

        SourceRecord record = exists ? rows.get(0) : SourceRecord.fresh(sourceId);
        mutation.accept(record);
        record.setSourceId(sourceId);
        SourceRecordStore.normaliseTimestamps(record);

        if (exists) {
            jdbcTemplate.update("""
                UPDATE source_records SET
                    status = ?, failure_count = ?, next_allowed_at = ?, etag = ?, last_modified = ?,
                    last_run_at = ?, last_success_at = ?, next_scheduled_at = ?, assigned_identity_id = ?,
                    health_score = ?, error_streak = ?, success_streak = ?, recent_error_kinds = ?,
                    circuit_phase = ?, open_cycle_count = ?, cooldown_until = ?
                WHERE source_id = ?
                """,
                    record.getStatus().name(),
                    record.getFailureCount(),
                    ts(record.getNextAllowedAt()),
                    record.getEtag(),
                    record.getLastModified(),
                    ts(record.getLastFetchAt()),
                    ts(record.getLastSuccessAt()),
                    ts(record.getNextScheduledAt()),
                    record.getAssignedIdentityId(),
                    record.getHealthScore(),
                    record.getErrorStreak(),
                    record.getSuccessStreak(),
                    writeErrorKinds(record.getRecentErrorKinds()),
                    record.getCircuitPhase().name(),
                    record.getOpenCycleCount(),
                    ts(record.getCooldownUntil()),
                    sourceId);
        } else {
            jdbcTemplate.update("INSERT INTO source_records (" + COLUMNS + ") "
                            + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                    sourceId,
                    record.getStatus().name(),
                    record.getFailureCount(),
                    ts(record.getNextAllowedAt()),
                    record.getEtag(),
                    record.getLastModified(),
                    ts(record.getLastFetchAt()),
                    ts(record.getLastSuccessAt()),
                    ts(record.getNextScheduledAt()),
                    record.getAssignedIdentityId(),
                    record.getHealthScore(),
                    record.getErrorStreak(),
                    record.getSuccessStreak(),
                    writeErrorKinds(record.getRecentErrorKinds()),
                    record.getCircuitPhase().name(),
                    record.getOpenCycleCount(),
                    ts(record.getCooldownUntil()));
            log.debug("Created source record {}", sourceId);
        }

        return record.copy();
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private RowMapper<SourceRecord> rowMapper() {
        return (rs, rowNum) -> SourceRecord.builder()
                .sourceId(rs.getString("source_id"))
                .status(SourceStatus.valueOf(rs.getString("status")))
                .failureCount(rs.getInt("failure_count"))
                .nextAllowedAt(instant(rs, "next_allowed_at"))
                .etag(rs.getString("etag"))
                .lastModified(rs.getString("last_modified"))
                .lastFetchAt(instant(rs, "last_run_at"))
                .lastSuccessAt(instant(rs, "last_success_at"))
                .nextScheduledAt(instant(rs, "next_scheduled_at"))
                .assignedIdentityId(rs.getString("assigned_identity_id"))
                .healthScore(rs.getDouble("health_score"))
                .errorStreak(rs.getInt("error_streak"))
                .successStreak(rs.getInt("success_streak"))
                .recentErrorKinds(readErrorKinds(rs.getString("recent_error_kinds")))
                .circuitPhase(CircuitPhase.valueOf(rs.getString("circuit_phase")))
                .openCycleCount(rs.getInt("open_cycle_count"))
                .cooldownUntil(instant(rs, "cooldown_until"))
                .build();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime ts(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private String writeErrorKinds(List<ErrorKind> kinds) {
        try {
            return objectMapper.writeValueAsString(kinds == null ? List.of() : kinds);
        } catch (JsonProcessingException e) {
            throw new SourceStoreException("Cannot serialise recent error kinds", e);
        }
    }

    private List<ErrorKind> readErrorKinds(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(objectMapper.readValue(json, ERROR_KINDS));
        } catch (JsonProcessingException e) {
            throw new SourceStoreException("Corrupt recent_error_kinds column: " + json, e);
        }
    }
}
