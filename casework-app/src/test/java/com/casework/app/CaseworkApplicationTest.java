package com.casework.app;

import com.casework.app.config.CaseworkProperties;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.ActionType;
import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.TransitionRequest;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.definition.WorkflowDefinitionService.StateDraft;
import com.casework.engine.definition.WorkflowDefinitionService.TransitionDraft;
import com.casework.engine.definition.WorkflowDefinitionService.WorkflowDraft;
import com.casework.engine.health.CaseworkHealthIndicator;
import com.casework.engine.record.RecordService;
import com.casework.engine.transition.TransitionEngine;
import com.casework.scheduler.RevisionRetentionJob;
import com.casework.scheduler.SlaMonitor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "casework.sla.scan-interval=1h",
    "casework.directory.users[0].id=u-agent",
    "casework.directory.users[0].display-name=Field Agent",
    "casework.directory.users[0].roles=agent"
})
@ActiveProfiles("memory")
class CaseworkApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private CaseworkProperties properties;

    @Autowired
    private WorkflowDefinitionService definitions;

    @Autowired
    private RecordService records;

    @Autowired
    private TransitionEngine transitions;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CaseworkHealthIndicator health;

    @Autowired
    private SlaMonitor slaMonitor;

    @Test
    @DisplayName("Memory profile wires the engine, starts the SLA monitor and skips retention")
    void wiresMemoryProfile() {
        assertThat(properties.getPersistence()).isEqualTo(CaseworkProperties.Persistence.MEMORY);
        assertThat(slaMonitor.isRunning()).isTrue();
        assertThat(context.getBeansOfType(RevisionRetentionJob.class)).isEmpty();

        assertThat(health.health().getStatus()).isEqualTo(Status.UP);
        assertThat(health.health().getDetails()).containsEntry("persistence", "memory");
    }

    @Test
    @DisplayName("A record created and moved through the wired services is auto-assigned from the configured directory")
    void createsAndMovesRecord() {
        Actor admin = properties.actor("admin-1", Set.of("super_admin"));
        Actor agent = properties.actor("agent-1", Set.of("agent"));
        assertThat(admin.superAdmin()).isTrue();
        assertThat(agent.superAdmin()).isFalse();

        Workflow workflow = definitions.createWorkflow(
            WorkflowDraft.of("COMPLAINT-APP", "Complaint", RecordType.COMPLAINT).asDefault(), admin);
        WorkflowStateDefinition open = definitions.addState(workflow.id(), StateDraft.initial("open", "Open", 24));
        WorkflowStateDefinition triage = definitions.addState(workflow.id(),
            StateDraft.intermediate("triage", "Triage", 8, 1));
        definitions.addState(workflow.id(), StateDraft.terminal("done", "Done", 2));
        Transition toTriage = definitions.addTransition(workflow.id(),
            TransitionDraft.of("triage", "Triage", open.id(), triage.id())
                .withAllowedRoles("agent")
                .withActions(ActionDefinition.create(ActionType.ASSIGN_ROLE, 1,
                    objectMapper.createObjectNode().put("role", "agent"))));

        CaseRecord record = records.createRecord(
            RecordService.NewRecord.builder(RecordType.COMPLAINT, "Noise at night").reporterId("citizen-1").build(),
            agent);
        TransitionOutcome outcome = transitions.executeTransition(new TransitionRequest(
            record.id(), toTriage.id(), record.version(), agent, TransitionPayload.empty()));

        assertThat(outcome.hasWarnings()).isFalse();
        assertThat(outcome.record().currentStateId()).isEqualTo(triage.id());
        assertThat(outcome.record().assigneeId()).isEqualTo("u-agent");
        assertThat(records.getRecord(record.id()).version()).isEqualTo(3);
    }
}
