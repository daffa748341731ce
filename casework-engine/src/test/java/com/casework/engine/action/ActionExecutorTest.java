package com.casework.engine.action;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.ActionType;
import com.casework.core.model.ActionWarning;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.DepartmentProfile;
import com.casework.core.model.Notification;
import com.casework.core.model.NotificationKind;
import com.casework.core.model.RecordType;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.UserProfile;
import com.casework.core.port.Notifier;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.record.RecordService;
import com.casework.engine.test.CaseworkFixture;
import com.casework.engine.test.CaseworkFixture.IncidentWorkflow;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.casework.engine.test.CaseworkFixture.AGENT;
import static com.casework.engine.test.CaseworkFixture.REPORTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ActionExecutorTest {

    private CaseworkFixture fixture;
    private IncidentWorkflow wf;

    @BeforeEach
    void setUp() {
        fixture = new CaseworkFixture();
        wf = fixture.incidentWorkflow();
        fixture.directory
            .addUser(user("u-north", "agent", MatchConstraints.builder()
                .accept(MatchDimension.LOCATION, "north").build()))
            .addUser(user("u-south", "agent", MatchConstraints.builder()
                .accept(MatchDimension.LOCATION, "south").build()))
            .addUser(user("u-any", "agent", MatchConstraints.none()))
            .addUser(user("u-lead", "supervisor", MatchConstraints.none()))
            .addDepartment(new DepartmentProfile("d-water", "Water", MatchConstraints.builder()
                .accept(MatchDimension.CLASSIFICATION, "leak").build()))
            .addDepartment(new DepartmentProfile("d-roads", "Roads", MatchConstraints.builder()
                .accept(MatchDimension.CLASSIFICATION, "pothole").build()))
            .addDepartment(new DepartmentProfile("d-city", "City works", MatchConstraints.builder()
                .accept(MatchDimension.CLASSIFICATION, "pothole").build()));
    }

    private static UserProfile user(String id, String role, MatchConstraints constraints) {
        return new UserProfile(id, id, Set.of(role), true, constraints);
    }

    private static ObjectNode config(String... keyValues) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (int i = 0; i < keyValues.length; i += 2) {
            node.put(keyValues[i], keyValues[i + 1]);
        }
        return node;
    }

    private static ActionDefinition action(ActionType type, int order, ObjectNode config) {
        return ActionDefinition.create(type, order, config);
    }

    private CaseRecord incident(String classification, String location) {
        return fixture.records.createRecord(
            RecordService.NewRecord.builder(RecordType.INCIDENT, "Report")
                .classificationId(classification)
                .locationId(location)
                .reporterId(REPORTER.id())
                .build(),
            REPORTER);
    }

    private TransitionOutcome startWith(CaseRecord record, TransitionPayload payload, ActionDefinition... actions) {
        Transition start = fixture.withActions(wf.start(), actions);
        return fixture.move(record, start, AGENT, payload);
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("Auto-match picks the role holder whose coverage fits the record best")
        void autoMatchPrefersSpecificUser() {
            CaseRecord record = incident("leak", "south");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_ROLE, 1, config("role", "agent")));

            assertThat(outcome.record().assigneeId()).isEqualTo("u-south");
            assertThat(outcome.hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("Auto-match falls back to any role holder when nobody's coverage fits")
        void autoMatchFallsBackToRole() {
            fixture.directory.addUser(user("u-east", "inspector", MatchConstraints.builder()
                .accept(MatchDimension.LOCATION, "east").build()));
            CaseRecord record = incident("leak", "west");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_ROLE, 1, config("role", "inspector")));

            assertThat(outcome.record().assigneeId()).isEqualTo("u-east");
        }

        @Test
        @DisplayName("Auto-match skips the current assignee")
        void autoMatchSkipsCurrentAssignee() {
            CaseRecord record = incident("leak", "south");
            record = fixture.records.assign(record.id(), record.version(), "u-south", AGENT);

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_ROLE, 1, config("role", "agent")));

            assertThat(outcome.record().assigneeId()).isEqualTo("u-any");
        }

        @Test
        @DisplayName("Manual selection without a pick keeps the current assignee")
        void manualWithoutSelection() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_ROLE, 1, config("role", "agent", "mode", "MANUAL_SELECT")));

            assertThat(outcome.record().assigneeId()).isNull();
            assertThat(outcome.hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("Manual selection of a user without the role is reported as a warning")
        void manualSelectionWrongRole() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty().withSelectedUser("u-lead"),
                action(ActionType.ASSIGN_ROLE, 1, config("role", "agent", "mode", "manual_select")));

            assertThat(outcome.warnings()).singleElement()
                .extracting(ActionWarning::actionType).isEqualTo(ActionType.ASSIGN_ROLE);
            assertThat(outcome.record().currentStateId()).isEqualTo(wf.inProgress().id());
        }

        @Test
        @DisplayName("Fixed user assignment writes an ASSIGNEE_CHANGED revision")
        void fixedUser() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_USER, 1, config("userId", "u-north")));

            assertThat(outcome.record().assigneeId()).isEqualTo("u-north");
            assertThat(outcome.record().version()).isEqualTo(3);
            assertThat(fixture.revisions.revisionsOf(record.id()))
                .extracting(Revision::actionType)
                .containsExactly(RevisionActionType.CREATED, RevisionActionType.TRANSITIONED,
                    RevisionActionType.ASSIGNEE_CHANGED);
        }
    }

    @Nested
    @DisplayName("Department routing")
    class DepartmentRouting {

        private final ObjectNode autoDetect = JsonNodeFactory.instance.objectNode().put("autoDetect", true);

        @Test
        @DisplayName("A single matching department is assigned")
        void singleMatch() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.ASSIGN_DEPARTMENT, 1, autoDetect));

            assertThat(outcome.record().departmentId()).isEqualTo("d-water");
        }

        @Test
        @DisplayName("Tied departments need the caller's selection")
        void tieNeedsSelection() {
            CaseRecord first = incident("pothole", "north");
            TransitionOutcome unresolved = startWith(first, TransitionPayload.empty(),
                action(ActionType.ASSIGN_DEPARTMENT, 1, autoDetect));

            assertThat(unresolved.record().departmentId()).isNull();
            assertThat(unresolved.warnings()).hasSize(1);

            CaseRecord second = incident("pothole", "north");
            TransitionOutcome resolved = startWith(second, TransitionPayload.empty().withSelectedDepartment("d-city"),
                action(ActionType.ASSIGN_DEPARTMENT, 1, autoDetect));

            assertThat(resolved.record().departmentId()).isEqualTo("d-city");
            assertThat(resolved.hasWarnings()).isFalse();
        }
    }

    @Nested
    @DisplayName("Record edits")
    class RecordEdits {

        @Test
        @DisplayName("Set field, change type and recompute SLA run in execution order")
        void runsInOrder() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.RECOMPUTE_SLA, 3, JsonNodeFactory.instance.objectNode().put("hours", 2)),
                action(ActionType.SET_FIELD, 1, config("field", "priority", "value", "P1")),
                action(ActionType.CHANGE_RECORD_TYPE, 2, config("recordType", "complaint")));

            CaseRecord updated = outcome.record();
            assertThat(updated.priority()).isEqualTo("P1");
            assertThat(updated.recordType()).isEqualTo(RecordType.COMPLAINT);
            assertThat(updated.slaDueAt()).isEqualTo(fixture.clock.instant().plus(Duration.ofHours(2)));
            assertThat(updated.version()).isEqualTo(5);
            assertThat(fixture.revisions.revisionsOf(record.id()))
                .extracting(Revision::actionType)
                .containsExactly(
                    RevisionActionType.CREATED,
                    RevisionActionType.TRANSITIONED,
                    RevisionActionType.FIELD_CHANGED,
                    RevisionActionType.RECORD_TYPE_CHANGED,
                    RevisionActionType.FIELD_CHANGED);
        }

        @Test
        @DisplayName("Inactive actions are skipped")
        void inactiveSkipped() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.SET_FIELD, 1, config("field", "priority", "value", "P1")).inactive());

            assertThat(outcome.record().priority()).isNull();
            assertThat(outcome.record().version()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failing action leaves the transition committed and the next action still runs")
        void failureIsolated() {
            CaseRecord record = incident("leak", "north");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.SET_FIELD, 1, config("field", "currentStateId", "value", "x")),
                action(ActionType.ASSIGN_USER, 2, config("userId", "nobody")),
                action(ActionType.SET_FIELD, 3, config("field", "severity", "value", "high")));

            assertThat(outcome.record().currentStateId()).isEqualTo(wf.inProgress().id());
            assertThat(outcome.record().severity()).isEqualTo("high");
            assertThat(outcome.warnings())
                .extracting(ActionWarning::actionType)
                .containsExactly(ActionType.SET_FIELD, ActionType.ASSIGN_USER);

            assertThat(fixture.revisions.revisionsOf(record.id()))
                .filteredOn(r -> r.actionType() == RevisionActionType.ACTION_FAILED)
                .hasSize(2)
                .allSatisfy(r -> assertThat(r.payloadSnapshot().get("errorCode").asText()).startsWith("ACTION_"));

            double failures = fixture.metrics.registry().get(CaseMetrics.ACTION_FAILURES)
                .tag("action", "ASSIGN_USER").counter().count();
            assertThat(failures).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        private ObjectNode notifyConfig(String... recipients) {
            ObjectNode node = config(
                "subject", "{{record_number}} moved to {{to_state}}",
                "message", "{{transition_name}} by {{performed_by}} from {{from_state}}; assignee {{assignee}}");
            var array = node.putArray("recipients");
            for (String recipient : recipients) {
                array.add(recipient);
            }
            return node;
        }

        @Test
        @DisplayName("Recipients are resolved and placeholders rendered")
        void rendersTemplate() {
            CaseRecord record = incident("leak", "north");

            startWith(record, TransitionPayload.empty(),
                action(ActionType.NOTIFY, 1, notifyConfig("reporter", "assignee", "role:supervisor", "user:u-any")));

            List<Notification> sent = fixture.recordingNotifier().sent(NotificationKind.TRANSITION);
            assertThat(sent).singleElement().satisfies(n -> {
                assertThat(n.recipients()).containsExactlyInAnyOrder(REPORTER.id(), "u-lead", "u-any");
                assertThat(n.subject()).isEqualTo(record.recordNumber() + " moved to In Progress");
                assertThat(n.body()).isEqualTo("Start work by agent-1 from New; assignee Unassigned");
            });
        }

        @Test
        @DisplayName("A failing notifier neither fails the action nor rolls back the transition")
        void notifierFailure() {
            Notifier failing = mock(Notifier.class);
            doThrow(new IllegalStateException("smtp down")).when(failing).notify(any());
            fixture = new CaseworkFixture(failing);
            wf = fixture.incidentWorkflow();
            CaseRecord record = fixture.newIncident("Noisy");

            TransitionOutcome outcome = startWith(record, TransitionPayload.empty(),
                action(ActionType.NOTIFY, 1, notifyConfig("reporter")));

            verify(failing).notify(any(Notification.class));
            assertThat(outcome.hasWarnings()).isFalse();
            assertThat(fixture.reload(record.id()).currentStateId()).isEqualTo(wf.inProgress().id());
        }
    }
}
