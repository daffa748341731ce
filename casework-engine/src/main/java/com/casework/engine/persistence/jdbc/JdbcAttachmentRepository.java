package com.casework.engine.persistence.jdbc;

import com.casework.core.model.Attachment;
import com.casework.core.repository.AttachmentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;

public class JdbcAttachmentRepository implements AttachmentRepository {

    private static final RowMapper<Attachment> ROW_MAPPER = (rs, rowNum) -> new Attachment(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("record_id")),
        rs.getString("file_name"),
        rs.getString("content_type"),
        rs.getLong("size_bytes"),
        rs.getString("storage_key"),
        rs.getString("uploaded_by"),
        toInstant(rs.getTimestamp("uploaded_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcAttachmentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(Attachment attachment) {
        jdbcTemplate.update("""
            INSERT INTO record_attachments (
                id, record_id, file_name, content_type, size_bytes, storage_key, uploaded_by, uploaded_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            attachment.id(), attachment.recordId(), attachment.fileName(), attachment.contentType(),
            attachment.sizeBytes(), attachment.storageKey(), attachment.uploadedBy(),
            toTimestamp(attachment.uploadedAt()));
    }

    @Override
    public Optional<Attachment> findById(UUID attachmentId) {
        List<Attachment> results =
            jdbcTemplate.query("SELECT * FROM record_attachments WHERE id = ?", ROW_MAPPER, attachmentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Attachment> findByRecord(UUID recordId) {
        return jdbcTemplate.query(
            "SELECT * FROM record_attachments WHERE record_id = ? ORDER BY uploaded_at, id", ROW_MAPPER, recordId);
    }
}
