package com.casework.engine.persistence.jdbc;

import com.casework.core.model.TransitionHistoryEntry;
import com.casework.core.repository.TransitionHistoryRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed, append-only transition history.
 */
public class JdbcTransitionHistoryRepository implements TransitionHistoryRepository {

    private static final RowMapper<TransitionHistoryEntry> ROW_MAPPER = (rs, rowNum) -> new TransitionHistoryEntry(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("record_id")),
        UUID.fromString(rs.getString("transition_id")),
        UUID.fromString(rs.getString("from_state_id")),
        UUID.fromString(rs.getString("to_state_id")),
        rs.getString("performed_by"),
        toInstant(rs.getTimestamp("occurred_at")),
        rs.getString("comment")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcTransitionHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void append(TransitionHistoryEntry entry) {
        String sql = """
            INSERT INTO transition_history (
                id, record_id, transition_id, from_state_id, to_state_id,
                performed_by, occurred_at, comment
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            entry.id(),
            entry.recordId(),
            entry.transitionId(),
            entry.fromStateId(),
            entry.toStateId(),
            entry.performedBy(),
            toTimestamp(entry.timestamp()),
            entry.comment()
        );
    }

    @Override
    public List<TransitionHistoryEntry> findByRecord(UUID recordId) {
        return jdbcTemplate.query(
            "SELECT * FROM transition_history WHERE record_id = ? ORDER BY occurred_at, id",
            ROW_MAPPER, recordId);
    }
}
