package com.casework.core.repository;

import com.casework.core.model.Comment;

import java.util.List;
import java.util.UUID;

public interface CommentRepository {

    void save(Comment comment);

    /**
     * Comments on a record, oldest first.
     */
    List<Comment> findByRecord(UUID recordId);
}
