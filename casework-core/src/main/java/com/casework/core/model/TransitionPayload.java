package com.casework.core.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * User-supplied data accompanying a transition request.
 *
 * @param comment free text, stored as an internal comment when non-blank
 * @param fields field values checked by FIELD_NOT_EMPTY requirements
 * @param attachmentIds attachments uploaded for this transition
 * @param feedbackRating rating from 1 to 5, required by FEEDBACK requirements
 * @param selectedUserId assignee picked by the caller for manual-selection actions
 * @param selectedDepartmentId department picked by the caller for manual-selection actions
 */
public record TransitionPayload(
    String comment,
    Map<String, String> fields,
    List<UUID> attachmentIds,
    Integer feedbackRating,
    String selectedUserId,
    String selectedDepartmentId
) {
    private static final TransitionPayload EMPTY = new TransitionPayload(null, null, null, null, null, null);

    public TransitionPayload {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
    }

    public static TransitionPayload empty() {
        return EMPTY;
    }

    public static TransitionPayload withComment(String comment) {
        return new TransitionPayload(comment, null, null, null, null, null);
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }

    public TransitionPayload withFields(Map<String, String> newFields) {
        return new TransitionPayload(comment, newFields, attachmentIds, feedbackRating, selectedUserId, selectedDepartmentId);
    }

    public TransitionPayload withAttachments(List<UUID> newAttachmentIds) {
        return new TransitionPayload(comment, fields, newAttachmentIds, feedbackRating, selectedUserId, selectedDepartmentId);
    }

    public TransitionPayload withFeedbackRating(Integer rating) {
        return new TransitionPayload(comment, fields, attachmentIds, rating, selectedUserId, selectedDepartmentId);
    }

    public TransitionPayload withSelectedUser(String userId) {
        return new TransitionPayload(comment, fields, attachmentIds, feedbackRating, userId, selectedDepartmentId);
    }

    public TransitionPayload withSelectedDepartment(String departmentId) {
        return new TransitionPayload(comment, fields, attachmentIds, feedbackRating, selectedUserId, departmentId);
    }
}
