package com.casework.app.config;

import com.casework.core.port.AssigneeDirectory;
import com.casework.core.port.Notifier;
import com.casework.core.repository.AttachmentRepository;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.CommentRepository;
import com.casework.core.repository.RevisionRepository;
import com.casework.core.repository.TransitionHistoryRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.core.repository.WorkflowRepository;
import com.casework.engine.action.ActionExecutor;
import com.casework.engine.action.AssignDepartmentHandler;
import com.casework.engine.action.AssignRoleHandler;
import com.casework.engine.action.AssignUserHandler;
import com.casework.engine.action.ChangeRecordTypeHandler;
import com.casework.engine.action.NotifyHandler;
import com.casework.engine.action.RecomputeSlaHandler;
import com.casework.engine.action.SetFieldHandler;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.definition.WorkflowMatcher;
import com.casework.engine.directory.InMemoryAssigneeDirectory;
import com.casework.engine.health.CaseworkHealthIndicator;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.notification.LoggingNotifier;
import com.casework.engine.notification.NotificationDispatcher;
import com.casework.engine.portability.WorkflowPortabilityService;
import com.casework.engine.record.RecordService;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.requirement.RequirementValidator;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.transition.TransitionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the engine services. Repositories come from the active persistence configuration.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    @ConditionalOnMissingBean(AssigneeDirectory.class)
    public InMemoryAssigneeDirectory assigneeDirectory(CaseworkProperties properties) {
        InMemoryAssigneeDirectory directory = new InMemoryAssigneeDirectory();
        properties.getDirectory().getDepartments().forEach(d -> directory.addDepartment(d.toProfile()));
        properties.getDirectory().getUsers().forEach(u -> directory.addUser(u.toProfile()));
        log.info("Assignee directory loaded with {} departments and {} users",
            properties.getDirectory().getDepartments().size(), properties.getDirectory().getUsers().size());
        return directory;
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier() {
        return new LoggingNotifier();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(CaseworkProperties properties) {
        return Executors.newFixedThreadPool(properties.getNotifications().getThreads());
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(Notifier notifier, ExecutorService notificationExecutor) {
        return new NotificationDispatcher(notifier, notificationExecutor);
    }

    @Bean
    public RevisionLogService revisionLogService(RevisionRepository revisionRepository, Clock clock) {
        return new RevisionLogService(revisionRepository, clock);
    }

    @Bean
    public RecordWriter recordWriter(
            CaseRecordRepository caseRecordRepository,
            RevisionLogService revisionLogService,
            UnitOfWork unitOfWork,
            Clock clock) {
        return new RecordWriter(caseRecordRepository, revisionLogService, unitOfWork, clock);
    }

    @Bean
    public WorkflowDefinitionService workflowDefinitionService(
            WorkflowRepository workflowRepository,
            CaseRecordRepository caseRecordRepository,
            UnitOfWork unitOfWork,
            Clock clock) {
        return new WorkflowDefinitionService(workflowRepository, caseRecordRepository, unitOfWork, clock);
    }

    @Bean
    public WorkflowMatcher workflowMatcher(WorkflowRepository workflowRepository) {
        return new WorkflowMatcher(workflowRepository);
    }

    @Bean
    public ActionExecutor actionExecutor(
            AssigneeDirectory directory,
            RecordWriter recordWriter,
            NotificationDispatcher notificationDispatcher,
            RevisionLogService revisionLogService,
            CaseRecordRepository caseRecordRepository,
            CaseMetrics metrics,
            Clock clock) {
        return new ActionExecutor(
            List.of(
                new AssignUserHandler(directory, recordWriter),
                new AssignRoleHandler(directory, recordWriter),
                new AssignDepartmentHandler(directory, recordWriter),
                new SetFieldHandler(recordWriter),
                new RecomputeSlaHandler(recordWriter, clock),
                new ChangeRecordTypeHandler(recordWriter),
                new NotifyHandler(directory, notificationDispatcher)),
            revisionLogService,
            caseRecordRepository,
            metrics);
    }

    @Bean
    public TransitionEngine transitionEngine(
            WorkflowRepository workflowRepository,
            CaseRecordRepository caseRecordRepository,
            TransitionHistoryRepository transitionHistoryRepository,
            CommentRepository commentRepository,
            RevisionLogService revisionLogService,
            ActionExecutor actionExecutor,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock) {
        return new TransitionEngine(
            workflowRepository, caseRecordRepository, transitionHistoryRepository, commentRepository,
            revisionLogService, new RequirementValidator(), actionExecutor, unitOfWork, metrics, clock);
    }

    @Bean
    public RecordService recordService(
            CaseRecordRepository caseRecordRepository,
            CommentRepository commentRepository,
            AttachmentRepository attachmentRepository,
            WorkflowDefinitionService workflowDefinitionService,
            WorkflowMatcher workflowMatcher,
            TransitionEngine transitionEngine,
            RevisionLogService revisionLogService,
            RecordWriter recordWriter,
            AssigneeDirectory directory,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock) {
        return new RecordService(
            caseRecordRepository, commentRepository, attachmentRepository, workflowDefinitionService,
            workflowMatcher, transitionEngine, revisionLogService, recordWriter, directory, unitOfWork,
            metrics, clock);
    }

    @Bean
    public WorkflowPortabilityService workflowPortabilityService(
            WorkflowDefinitionService workflowDefinitionService,
            WorkflowRepository workflowRepository,
            AssigneeDirectory directory,
            UnitOfWork unitOfWork,
            ObjectMapper objectMapper,
            Clock clock) {
        return new WorkflowPortabilityService(
            workflowDefinitionService, workflowRepository, directory, unitOfWork, objectMapper, clock);
    }

    @Bean
    public CaseworkHealthIndicator caseworkHealthIndicator(
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            CaseworkProperties properties,
            CaseRecordRepository caseRecordRepository,
            CaseMetrics metrics) {
        JdbcTemplate database = properties.getPersistence() == CaseworkProperties.Persistence.JDBC
            ? jdbcTemplate.getIfAvailable()
            : null;
        return new CaseworkHealthIndicator(database, caseRecordRepository, metrics);
    }
}
