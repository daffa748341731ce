package com.casework.engine.persistence;

import com.casework.core.model.Comment;
import com.casework.core.repository.CommentRepository;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryCommentRepository implements CommentRepository {

    private final Map<UUID, List<Comment>> comments = new ConcurrentHashMap<>();

    @Override
    public void save(Comment comment) {
        comments.computeIfAbsent(comment.recordId(), k -> new CopyOnWriteArrayList<>()).add(comment);
    }

    @Override
    public List<Comment> findByRecord(UUID recordId) {
        return List.copyOf(comments.getOrDefault(recordId, List.of()));
    }
}
