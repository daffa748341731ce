package com.casework.core.repository;

import com.casework.core.model.Attachment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AttachmentRepository {

    void save(Attachment attachment);

    Optional<Attachment> findById(UUID attachmentId);

    List<Attachment> findByRecord(UUID recordId);
}
