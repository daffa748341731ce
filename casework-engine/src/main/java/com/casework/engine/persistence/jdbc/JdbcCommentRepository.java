package com.casework.engine.persistence.jdbc;

import com.casework.core.model.Comment;
import com.casework.core.repository.CommentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;

public class JdbcCommentRepository implements CommentRepository {

    private static final RowMapper<Comment> ROW_MAPPER = (rs, rowNum) -> new Comment(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("record_id")),
        rs.getString("author_id"),
        rs.getString("body"),
        rs.getBoolean("internal"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcCommentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(Comment comment) {
        jdbcTemplate.update("""
            INSERT INTO record_comments (id, record_id, author_id, body, internal, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            comment.id(), comment.recordId(), comment.authorId(), comment.body(),
            comment.internal(), toTimestamp(comment.createdAt()));
    }

    @Override
    public List<Comment> findByRecord(UUID recordId) {
        return jdbcTemplate.query(
            "SELECT * FROM record_comments WHERE record_id = ? ORDER BY created_at, id", ROW_MAPPER, recordId);
    }
}
