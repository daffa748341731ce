package com.casework.scheduler;

import com.casework.core.model.Actor;
import com.casework.engine.logging.LoggingContext;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.revision.RevisionLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deletes revisions older than the configured retention period.
 * Runs under its own identity, which holds the retention authority.
 */
public class RevisionRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(RevisionRetentionJob.class);

    static final String JOB_NAME = "revision-retention";

    static final Actor RETENTION_ACTOR = Actor.of(JOB_NAME, RevisionLogService.RETENTION_AUTHORITY);

    private final RevisionLogService revisions;
    private final CaseMetrics metrics;
    private final Clock clock;
    private final Duration retention;
    private final Duration checkInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RevisionRetentionJob(
            RevisionLogService revisions,
            CaseMetrics metrics,
            Clock clock,
            Duration retention,
            Duration checkInterval) {
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("Revision retention must be positive: " + retention);
        }
        if (checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("Retention check interval must be positive: " + checkInterval);
        }
        this.revisions = revisions;
        this.metrics = metrics;
        this.clock = clock;
        this.retention = retention;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    public void start() {
        if (running) {
            log.warn("Revision retention job already running");
            return;
        }

        running = true;
        scheduler.scheduleWithFixedDelay(
            this::check,
            checkInterval.toMillis(),
            checkInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Revision retention job started: keeping {}, checking every {}", retention, checkInterval);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Revision retention job stopped");
    }

    private void check() {
        if (!running) return;

        try {
            runOnce();
        } catch (Exception e) {
            log.error("Revision retention run failed", e);
        }
    }

    /**
     * Purge now.
     *
     * @return number of revisions deleted
     */
    public int runOnce() {
        try (var ctx = LoggingContext.forJob(JOB_NAME)) {
            Instant cutoff = clock.instant().minus(retention);
            int deleted = revisions.purgeOlderThan(cutoff, RETENTION_ACTOR);
            metrics.revisionsPurged(deleted);
            return deleted;
        }
    }
}
