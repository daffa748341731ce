package com.casework.engine.persistence;

import com.casework.core.model.Attachment;
import com.casework.core.repository.AttachmentRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAttachmentRepository implements AttachmentRepository {

    private final Map<UUID, Attachment> attachments = new ConcurrentHashMap<>();

    @Override
    public void save(Attachment attachment) {
        attachments.put(attachment.id(), attachment);
    }

    @Override
    public Optional<Attachment> findById(UUID attachmentId) {
        return Optional.ofNullable(attachments.get(attachmentId));
    }

    @Override
    public List<Attachment> findByRecord(UUID recordId) {
        return attachments.values().stream()
            .filter(a -> a.recordId().equals(recordId))
            .sorted(Comparator.comparing(Attachment::uploadedAt))
            .toList();
    }
}
