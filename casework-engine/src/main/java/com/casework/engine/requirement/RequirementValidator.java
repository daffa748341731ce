package com.casework.engine.requirement;

import com.casework.core.model.CaseRecord;
import com.casework.core.model.Requirement;
import com.casework.core.model.RequirementViolation;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a transition payload against the transition's requirements.
 * Every requirement is evaluated; the result lists all violations.
 */
public class RequirementValidator {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    public List<RequirementViolation> validate(Transition transition, CaseRecord record, TransitionPayload payload) {
        List<RequirementViolation> violations = new ArrayList<>();
        for (Requirement requirement : transition.requirements()) {
            if (!requirement.mandatory() || isSatisfied(requirement, record, payload)) {
                continue;
            }
            violations.add(new RequirementViolation(
                requirement.kind(), requirement.fieldName(), messageFor(requirement)));
        }
        return violations;
    }

    private boolean isSatisfied(Requirement requirement, CaseRecord record, TransitionPayload payload) {
        return switch (requirement.kind()) {
            case COMMENT -> payload.hasComment();
            case FIELD_NOT_EMPTY -> hasText(fieldValue(requirement.fieldName(), record, payload));
            case ATTACHMENT -> !payload.attachmentIds().isEmpty();
            case MIN_ATTACHMENTS -> payload.attachmentIds().size() >= requirement.minCount();
            case FEEDBACK -> payload.feedbackRating() != null
                && payload.feedbackRating() >= MIN_RATING
                && payload.feedbackRating() <= MAX_RATING;
        };
    }

    // Payload value first, then the record's current value
    private static String fieldValue(String fieldName, CaseRecord record, TransitionPayload payload) {
        String submitted = payload.fields().get(fieldName);
        if (hasText(submitted)) {
            return submitted;
        }
        return record.fieldValue(fieldName);
    }

    private static String messageFor(Requirement requirement) {
        if (hasText(requirement.errorMessage())) {
            return requirement.errorMessage();
        }
        return switch (requirement.kind()) {
            case COMMENT -> "A comment is required";
            case FIELD_NOT_EMPTY -> String.format("Field '%s' must not be empty", requirement.fieldName());
            case ATTACHMENT -> "At least one attachment is required";
            case MIN_ATTACHMENTS -> String.format("At least %d attachments are required", requirement.minCount());
            case FEEDBACK -> String.format("A feedback rating between %d and %d is required", MIN_RATING, MAX_RATING);
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
