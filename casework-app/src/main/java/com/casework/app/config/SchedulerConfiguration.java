package com.casework.app.config;

import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.notification.NotificationDispatcher;
import com.casework.engine.revision.RevisionLogService;
import com.casework.scheduler.RevisionRetentionJob;
import com.casework.scheduler.SlaMonitor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Background jobs. Each is started with the context and stopped on shutdown.
 */
@Configuration
public class SchedulerConfiguration {

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "casework.sla.enabled", havingValue = "true", matchIfMissing = true)
    public SlaMonitor slaMonitor(
            CaseRecordRepository caseRecordRepository,
            RevisionLogService revisionLogService,
            NotificationDispatcher notificationDispatcher,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock,
            CaseworkProperties properties) {
        CaseworkProperties.Sla sla = properties.getSla();
        return new SlaMonitor(caseRecordRepository, revisionLogService, notificationDispatcher, unitOfWork,
            metrics, clock, sla.getScanInterval(), sla.getBatchSize());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "casework.revisions.retention")
    public RevisionRetentionJob revisionRetentionJob(
            RevisionLogService revisionLogService,
            CaseMetrics metrics,
            Clock clock,
            CaseworkProperties properties) {
        CaseworkProperties.Revisions revisions = properties.getRevisions();
        return new RevisionRetentionJob(revisionLogService, metrics, clock,
            revisions.getRetention(), revisions.getRetentionCheckInterval());
    }
}
