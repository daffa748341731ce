package com.casework.engine.persistence.jdbc;

import com.casework.core.exception.StaleVersionException;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;
import com.casework.core.repository.CaseRecordRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;
import static com.casework.engine.persistence.jdbc.JsonColumns.toUuid;

/**
 * PostgreSQL-backed implementation of CaseRecordRepository.
 * Updates are conditional on the stored version, so concurrent writers lose with StaleVersion.
 */
public class JdbcCaseRecordRepository implements CaseRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCaseRecordRepository.class);

    private static final TypeReference<Map<String, String>> CUSTOM_FIELDS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final CaseRecordRowMapper rowMapper;

    public JdbcCaseRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new CaseRecordRowMapper();
    }

    @Override
    @Transactional
    public void save(CaseRecord record) {
        String sql = """
            INSERT INTO case_records (
                id, record_number, record_type, title, description,
                workflow_id, current_state_id,
                classification_id, department_id, location_id, channel,
                assignee_id, reporter_id, priority, severity, custom_fields,
                sla_due_at, sla_breached, source_record_id,
                resolved_at, closed_at, created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            record.id(),
            record.recordNumber(),
            record.recordType().name(),
            record.title(),
            record.description(),
            record.workflowId(),
            record.currentStateId(),
            record.classificationId(),
            record.departmentId(),
            record.locationId(),
            record.channel(),
            record.assigneeId(),
            record.reporterId(),
            record.priority(),
            record.severity(),
            json.toJson(record.customFields()),
            toTimestamp(record.slaDueAt()),
            record.slaBreached(),
            record.sourceRecordId(),
            toTimestamp(record.resolvedAt()),
            toTimestamp(record.closedAt()),
            toTimestamp(record.createdAt()),
            toTimestamp(record.updatedAt()),
            record.version()
        );
    }

    @Override
    @Transactional
    public void update(CaseRecord record) {
        String sql = """
            UPDATE case_records SET
                record_type = ?,
                title = ?,
                description = ?,
                current_state_id = ?,
                classification_id = ?,
                department_id = ?,
                location_id = ?,
                channel = ?,
                assignee_id = ?,
                reporter_id = ?,
                priority = ?,
                severity = ?,
                custom_fields = ?::jsonb,
                sla_due_at = ?,
                sla_breached = ?,
                resolved_at = ?,
                closed_at = ?,
                updated_at = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            record.recordType().name(),
            record.title(),
            record.description(),
            record.currentStateId(),
            record.classificationId(),
            record.departmentId(),
            record.locationId(),
            record.channel(),
            record.assigneeId(),
            record.reporterId(),
            record.priority(),
            record.severity(),
            json.toJson(record.customFields()),
            toTimestamp(record.slaDueAt()),
            record.slaBreached(),
            toTimestamp(record.resolvedAt()),
            toTimestamp(record.closedAt()),
            toTimestamp(record.updatedAt()),
            record.version(),
            record.id(),
            record.version() - 1  // Expected previous version
        );

        if (rows == 0) {
            log.debug("Stale update on record {} at version {}", record.id(), record.version() - 1);
            throw new StaleVersionException("CaseRecord", record.id());
        }
    }

    @Override
    public Optional<CaseRecord> findById(UUID recordId) {
        String sql = "SELECT * FROM case_records WHERE id = ?";
        List<CaseRecord> results = jdbcTemplate.query(sql, rowMapper, recordId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<CaseRecord> findByRecordNumber(String recordNumber) {
        String sql = "SELECT * FROM case_records WHERE record_number = ?";
        List<CaseRecord> results = jdbcTemplate.query(sql, rowMapper, recordNumber);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CaseRecord> findSlaBreachCandidates(Instant now, int limit) {
        String sql = """
            SELECT r.* FROM case_records r
            JOIN workflow_states s ON s.id = r.current_state_id
            WHERE r.sla_breached = FALSE
              AND r.sla_due_at IS NOT NULL
              AND r.sla_due_at < ?
              AND s.is_terminal = FALSE
            ORDER BY r.sla_due_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    @Transactional
    public Optional<CaseRecord> markSlaBreached(UUID recordId, Instant now) {
        String sql = """
            UPDATE case_records SET
                sla_breached = TRUE,
                updated_at = ?,
                version = version + 1
            WHERE id = ?
              AND sla_breached = FALSE
              AND sla_due_at IS NOT NULL
              AND sla_due_at < ?
              AND closed_at IS NULL
            RETURNING *
            """;
        List<CaseRecord> results = jdbcTemplate.query(sql, rowMapper,
            Timestamp.from(now), recordId, Timestamp.from(now));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CaseRecord> findBreached(int limit) {
        String sql = """
            SELECT * FROM case_records
            WHERE sla_breached = TRUE AND closed_at IS NULL
            ORDER BY sla_due_at NULLS LAST
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    @Override
    public long countBreached() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM case_records WHERE sla_breached = TRUE AND closed_at IS NULL", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countByWorkflow(UUID workflowId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM case_records WHERE workflow_id = ?", Long.class, workflowId);
        return count != null ? count : 0L;
    }

    @Override
    @Transactional
    public long nextSequence(RecordType recordType, int year) {
        String sql = """
            INSERT INTO record_sequences (record_type, year, last_value)
            VALUES (?, ?, 1)
            ON CONFLICT (record_type, year)
            DO UPDATE SET last_value = record_sequences.last_value + 1
            RETURNING last_value
            """;
        Long value = jdbcTemplate.queryForObject(sql, Long.class, recordType.name(), year);
        if (value == null) {
            throw new IllegalStateException("Sequence allocation returned no value for " + recordType);
        }
        return value;
    }

    private class CaseRecordRowMapper implements RowMapper<CaseRecord> {
        @Override
        public CaseRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CaseRecord(
                UUID.fromString(rs.getString("id")),
                rs.getString("record_number"),
                RecordType.valueOf(rs.getString("record_type")),
                rs.getString("title"),
                rs.getString("description"),
                UUID.fromString(rs.getString("workflow_id")),
                UUID.fromString(rs.getString("current_state_id")),
                rs.getString("classification_id"),
                rs.getString("department_id"),
                rs.getString("location_id"),
                rs.getString("channel"),
                rs.getString("assignee_id"),
                rs.getString("reporter_id"),
                rs.getString("priority"),
                rs.getString("severity"),
                json.fromJson(rs.getString("custom_fields"), CUSTOM_FIELDS, Map.of()),
                toInstant(rs.getTimestamp("sla_due_at")),
                rs.getBoolean("sla_breached"),
                toUuid(rs.getString("source_record_id")),
                toInstant(rs.getTimestamp("resolved_at")),
                toInstant(rs.getTimestamp("closed_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getLong("version")
            );
        }
    }
}
