package com.casework.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A note on a record. Comments captured during transitions are internal.
 */
public record Comment(
    UUID id,
    UUID recordId,
    String authorId,
    String body,
    boolean internal,
    Instant createdAt
) {
    public static Comment create(UUID recordId, String authorId, String body, boolean internal, Instant now) {
        return new Comment(UUID.randomUUID(), recordId, authorId, body, internal, now);
    }
}
