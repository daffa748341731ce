package com.casework.engine.persistence.jdbc;

import com.casework.core.exception.StaleVersionException;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.ActionType;
import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Page;
import com.casework.core.model.RecordType;
import com.casework.core.model.Requirement;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.RevisionQuery;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.TransitionRequest;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.test.MutableClock;
import com.casework.engine.action.ActionExecutor;
import com.casework.engine.action.SetFieldHandler;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.definition.WorkflowDefinitionService.StateDraft;
import com.casework.engine.definition.WorkflowDefinitionService.TransitionDraft;
import com.casework.engine.definition.WorkflowDefinitionService.WorkflowDraft;
import com.casework.engine.definition.WorkflowMatcher;
import com.casework.engine.directory.InMemoryAssigneeDirectory;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.record.RecordService;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.requirement.RequirementValidator;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.transition.TransitionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the record lifecycle against PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcPersistenceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("casework_test")
        .withUsername("test")
        .withPassword("test");

    private static DriverManagerDataSource dataSource;

    private static final Actor ADMIN = new Actor("admin", Set.of(), true);
    private static final Actor AGENT = Actor.of("agent-1", "agent");

    private final MutableClock clock = MutableClock.at("2026-05-04T12:00:00Z");
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CaseMetrics metrics = CaseMetrics.standalone();

    private JdbcTemplate jdbcTemplate;
    private JdbcCaseRecordRepository recordRepository;
    private JdbcRevisionRepository revisionRepository;
    private WorkflowDefinitionService definitions;
    private RevisionLogService revisions;
    private TransitionEngine transitions;
    private RecordService records;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/casework-schema.sql")).execute(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("""
            TRUNCATE record_attachments, record_comments, revisions, transition_history,
                     record_sequences, case_records, workflow_transitions, workflow_states, workflows
            CASCADE
            """);

        JdbcWorkflowRepository workflowRepository = new JdbcWorkflowRepository(jdbcTemplate, objectMapper);
        recordRepository = new JdbcCaseRecordRepository(jdbcTemplate, objectMapper);
        revisionRepository = new JdbcRevisionRepository(jdbcTemplate, objectMapper);
        JdbcUnitOfWork unitOfWork = new JdbcUnitOfWork(new DataSourceTransactionManager(dataSource));
        InMemoryAssigneeDirectory directory = new InMemoryAssigneeDirectory();

        revisions = new RevisionLogService(revisionRepository, clock);
        RecordWriter writer = new RecordWriter(recordRepository, revisions, unitOfWork, clock);
        definitions = new WorkflowDefinitionService(workflowRepository, recordRepository, unitOfWork, clock);
        ActionExecutor actions = new ActionExecutor(List.of(new SetFieldHandler(writer)), revisions, recordRepository, metrics);
        transitions = new TransitionEngine(
            workflowRepository, recordRepository, new JdbcTransitionHistoryRepository(jdbcTemplate),
            new JdbcCommentRepository(jdbcTemplate), revisions, new RequirementValidator(), actions,
            unitOfWork, metrics, clock);
        records = new RecordService(
            recordRepository, new JdbcCommentRepository(jdbcTemplate), new JdbcAttachmentRepository(jdbcTemplate),
            definitions, new WorkflowMatcher(workflowRepository), transitions, revisions, writer, directory,
            unitOfWork, metrics, clock);
    }

    private Transition incidentWorkflow() {
        Workflow workflow = definitions.createWorkflow(
            WorkflowDraft.of("INCIDENT-STD", "Incidents", RecordType.INCIDENT).asDefault(), ADMIN);
        WorkflowStateDefinition open = definitions.addState(workflow.id(), StateDraft.initial("new", "New", 4));
        WorkflowStateDefinition done = definitions.addState(workflow.id(), StateDraft.terminal("resolved", "Resolved", 1));
        return definitions.addTransition(workflow.id(),
            TransitionDraft.of("resolve", "Resolve", open.id(), done.id())
                .withRequirements(Requirement.comment())
                .withActions(ActionDefinition.create(ActionType.SET_FIELD, 1,
                    JsonNodeFactory.instance.objectNode().put("field", "priority").put("value", "P4")))
                .withAllowedRoles("agent"));
    }

    private CaseRecord newIncident(String title) {
        return records.createRecord(RecordService.NewRecord.builder(RecordType.INCIDENT, title)
            .customFields(Map.of("asset", "printer-7"))
            .build(), AGENT);
    }

    @Test
    @DisplayName("Definitions, requirements and actions survive a reload from the database")
    void definitionsRoundTrip() {
        Transition resolve = incidentWorkflow();

        Transition loaded = definitions.getTransition(resolve.id());

        assertThat(loaded.requirements()).containsExactly(Requirement.comment());
        assertThat(loaded.allowedRoles()).containsExactly("agent");
        assertThat(loaded.actions()).singleElement().satisfies(a -> {
            assertThat(a.id()).isEqualTo(resolve.actions().get(0).id());
            assertThat(a.config().get("value").asText()).isEqualTo("P4");
        });
        assertThat(definitions.validate(resolve.workflowId()).isClean()).isTrue();
    }

    @Test
    @DisplayName("A record is created, transitioned and audited through JDBC")
    void recordLifecycle() {
        Transition resolve = incidentWorkflow();
        CaseRecord record = newIncident("Paper jam");
        assertThat(record.recordNumber()).isEqualTo("INC-2026-000001");
        assertThat(newIncident("Toner").recordNumber()).isEqualTo("INC-2026-000002");

        clock.advanceMinutes(30);
        TransitionOutcome outcome = transitions.executeTransition(new TransitionRequest(
            record.id(), resolve.id(), record.version(), AGENT, TransitionPayload.withComment("cleared")));

        CaseRecord stored = records.getRecord(record.id());
        assertThat(outcome.hasWarnings()).isFalse();
        assertThat(stored.version()).isEqualTo(3);
        assertThat(stored.priority()).isEqualTo("P4");
        assertThat(stored.fieldValue("asset")).isEqualTo("printer-7");
        assertThat(stored.resolvedAt()).isEqualTo(clock.instant());
        assertThat(transitions.historyOf(record.id())).singleElement()
            .satisfies(h -> assertThat(h.comment()).isEqualTo("cleared"));
        assertThat(records.commentsOf(record.id())).hasSize(1);
        assertThat(revisions.revisionsOf(record.id())).extracting(Revision::actionType).containsExactly(
            RevisionActionType.CREATED, RevisionActionType.TRANSITIONED, RevisionActionType.FIELD_CHANGED);
    }

    @Test
    @DisplayName("An update against an old version is rejected by the database")
    void compareAndSet() {
        incidentWorkflow();
        CaseRecord record = newIncident("Paper jam");
        records.updateFields(record.id(), record.version(), Map.of("severity", "low"), AGENT);

        CaseRecord stale = record.toBuilder().title("Overwritten").incrementVersion().build();
        assertThatThrownBy(() -> recordRepository.update(stale))
            .isInstanceOf(StaleVersionException.class);
        assertThat(records.getRecord(record.id()).title()).isEqualTo("Paper jam");
    }

    @Test
    @DisplayName("Breach flagging happens once and only for overdue open records")
    void slaBreachFlagging() {
        incidentWorkflow();
        CaseRecord overdue = newIncident("Overdue");
        clock.advanceHours(3);
        CaseRecord onTime = newIncident("On time");
        clock.advanceHours(2);

        List<CaseRecord> candidates = recordRepository.findSlaBreachCandidates(clock.instant(), 10);
        assertThat(candidates).extracting(CaseRecord::id).containsExactly(overdue.id());

        assertThat(recordRepository.markSlaBreached(onTime.id(), clock.instant())).isEmpty();
        assertThat(recordRepository.markSlaBreached(overdue.id(), clock.instant())).isPresent();
        assertThat(recordRepository.markSlaBreached(overdue.id(), clock.instant())).isEmpty();
        assertThat(recordRepository.countBreached()).isEqualTo(1);
        assertThat(records.listBreached(10)).extracting(CaseRecord::id).containsExactly(overdue.id());
    }

    @Test
    @DisplayName("Revision queries page newest first and retention purges by age")
    void revisionQueries() {
        incidentWorkflow();
        CaseRecord record = newIncident("Paper jam");
        clock.advance(Duration.ofDays(40));
        records.addComment(record.id(), "still broken", false, AGENT);

        Page<Revision> page = revisions.query(RevisionQuery.forRecord(record.id()).page(0, 1));
        assertThat(page.total()).isEqualTo(2);
        assertThat(page.items()).singleElement()
            .extracting(Revision::actionType).isEqualTo(RevisionActionType.COMMENT_ADDED);

        int purged = revisions.purgeOlderThan(clock.instant().minus(Duration.ofDays(30)),
            Actor.of("revision-retention", RevisionLogService.RETENTION_AUTHORITY));
        assertThat(purged).isEqualTo(1);
        assertThat(revisionRepository.findByRecord(record.id())).singleElement()
            .extracting(Revision::revisionNumber).isEqualTo(2L);
    }
}
