package com.casework.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata of a file stored elsewhere. Content never passes through the engine.
 */
public record Attachment(
    UUID id,
    UUID recordId,
    String fileName,
    String contentType,
    long sizeBytes,
    String storageKey,
    String uploadedBy,
    Instant uploadedAt
) {
    public static Attachment create(
            UUID recordId,
            String fileName,
            String contentType,
            long sizeBytes,
            String storageKey,
            String uploadedBy,
            Instant now) {
        return new Attachment(
            UUID.randomUUID(), recordId, fileName, contentType, sizeBytes, storageKey, uploadedBy, now
        );
    }
}
