package com.casework.engine.persistence.jdbc;

import com.casework.core.model.Page;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.RevisionQuery;
import com.casework.core.repository.RevisionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed audit log.
 * Revision numbers are assigned in the insert itself; the unique (record_id, revision_number)
 * constraint rejects a concurrent duplicate.
 */
public class JdbcRevisionRepository implements RevisionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRevisionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Revision> rowMapper;

    public JdbcRevisionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = (rs, rowNum) -> new Revision(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("record_id")),
            rs.getLong("revision_number"),
            RevisionActionType.valueOf(rs.getString("action_type")),
            rs.getString("performed_by"),
            toInstant(rs.getTimestamp("occurred_at")),
            rs.getString("description"),
            json.toNode(rs.getString("payload"))
        );
    }

    @Override
    @Transactional
    public Revision append(Revision revision) {
        String sql = """
            INSERT INTO revisions (
                id, record_id, revision_number, action_type, performed_by,
                occurred_at, description, payload
            )
            SELECT ?, ?, COALESCE(MAX(revision_number), 0) + 1, ?, ?, ?, ?, ?::jsonb
            FROM revisions WHERE record_id = ?
            RETURNING revision_number
            """;
        Long number = jdbcTemplate.queryForObject(sql, Long.class,
            revision.id(),
            revision.recordId(),
            revision.actionType().name(),
            revision.performedBy(),
            toTimestamp(revision.timestamp()),
            revision.description(),
            json.toJson(revision.payloadSnapshot()),
            revision.recordId()
        );
        if (number == null) {
            throw new IllegalStateException("Revision insert returned no number for record " + revision.recordId());
        }
        return revision.withRevisionNumber(number);
    }

    @Override
    public Page<Revision> query(RevisionQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (query.recordId() != null) {
            where.append(" AND record_id = ?");
            params.add(query.recordId());
        }
        if (query.actionType() != null) {
            where.append(" AND action_type = ?");
            params.add(query.actionType().name());
        }
        if (query.performedBy() != null) {
            where.append(" AND performed_by = ?");
            params.add(query.performedBy());
        }
        if (query.from() != null) {
            where.append(" AND occurred_at >= ?");
            params.add(Timestamp.from(query.from()));
        }
        if (query.to() != null) {
            where.append(" AND occurred_at < ?");
            params.add(Timestamp.from(query.to()));
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM revisions" + where, Long.class, params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(query.size());
        pageParams.add(query.offset());
        List<Revision> items = jdbcTemplate.query(
            "SELECT * FROM revisions" + where
                + " ORDER BY occurred_at DESC, revision_number DESC LIMIT ? OFFSET ?",
            rowMapper, pageParams.toArray());

        return new Page<>(items, query.page(), query.size(), total != null ? total : 0L);
    }

    @Override
    public List<Revision> findByRecord(UUID recordId) {
        return jdbcTemplate.query(
            "SELECT * FROM revisions WHERE record_id = ? ORDER BY revision_number", rowMapper, recordId);
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        int deleted = jdbcTemplate.update("DELETE FROM revisions WHERE occurred_at < ?", Timestamp.from(cutoff));
        log.debug("Deleted {} revisions older than {}", deleted, cutoff);
        return deleted;
    }
}
