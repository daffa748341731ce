package com.casework.engine.action;

import com.casework.core.matching.CriteriaMatcher;
import com.casework.core.matching.MatchDimension;
import com.casework.core.matching.MatchResult;
import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.DepartmentProfile;
import com.casework.core.model.RevisionActionType;
import com.casework.core.port.AssigneeDirectory;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.revision.RevisionSnapshots;

import java.util.Objects;

/**
 * Routes the record to a department.
 *
 * <p>Config: {@code {"departmentId": "..."}} for a fixed department, or
 * {@code {"autoDetect": true}} to pick the department whose classification and location
 * coverage best fits the record. When several departments tie, the caller's selection in
 * the transition payload decides, provided it is one of the tied departments.
 */
public class AssignDepartmentHandler implements ActionHandler {

    private final AssigneeDirectory directory;
    private final RecordWriter writer;
    private final CriteriaMatcher matcher = CriteriaMatcher.over(
        MatchDimension.CLASSIFICATION,
        MatchDimension.LOCATION
    );

    public AssignDepartmentHandler(AssigneeDirectory directory, RecordWriter writer) {
        this.directory = directory;
        this.writer = writer;
    }

    @Override
    public ActionType type() {
        return ActionType.ASSIGN_DEPARTMENT;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        String departmentId = context.getConfig().path("autoDetect").asBoolean(false)
            ? detect(context)
            : fixed(context);

        CaseRecord record = context.getRecord();
        if (Objects.equals(record.departmentId(), departmentId)) {
            return record;
        }
        return writer.apply(
            record,
            b -> b.departmentId(departmentId),
            RevisionActionType.FIELD_CHANGED,
            context.getActor().id(),
            "Routed to department " + departmentId,
            RevisionSnapshots.change("departmentId", record.departmentId(), departmentId)
        );
    }

    private String fixed(ActionContext context) throws ActionException {
        String departmentId = context.requireText("departmentId");
        if (directory.findDepartment(departmentId).isEmpty()) {
            throw new ActionException(ActionException.TARGET_NOT_FOUND, "Unknown department " + departmentId);
        }
        return departmentId;
    }

    private String detect(ActionContext context) throws ActionException {
        MatchResult<DepartmentProfile> result = matcher.match(directory.departments(), context.getRecord().criteria());
        if (result.isEmpty()) {
            throw new ActionException(ActionException.NO_MATCH, "No department covers this record");
        }
        if (result.single()) {
            return result.matches().get(0).id();
        }
        String selected = context.getPayload().selectedDepartmentId();
        return result.matches().stream()
            .map(DepartmentProfile::id)
            .filter(id -> id.equals(selected))
            .findFirst()
            .orElseThrow(() -> new ActionException(ActionException.SELECTION_REQUIRED, String.format(
                "%d departments match; one of them must be selected", result.matches().size())));
    }
}
