package com.casework.scheduler;

import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Notification;
import com.casework.core.model.NotificationKind;
import com.casework.core.model.RevisionActionType;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.engine.logging.LoggingContext;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.notification.NotificationDispatcher;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.revision.RevisionSnapshots;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically flags records whose SLA deadline has passed.
 *
 * Responsibilities:
 * - Find open, unflagged records past their deadline
 * - Flip the breach flag with a compare-and-set, so each record is flagged once
 * - Append an SLA_BREACHED revision
 * - Notify assignee and reporter
 *
 * A failure on one record is logged and does not stop the scan.
 */
public class SlaMonitor {

    private static final Logger log = LoggerFactory.getLogger(SlaMonitor.class);

    static final String JOB_NAME = "sla-monitor";

    private final CaseRecordRepository records;
    private final RevisionLogService revisions;
    private final NotificationDispatcher dispatcher;
    private final UnitOfWork unitOfWork;
    private final CaseMetrics metrics;
    private final Clock clock;
    private final Duration scanInterval;
    private final int batchSize;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public SlaMonitor(
            CaseRecordRepository records,
            RevisionLogService revisions,
            NotificationDispatcher dispatcher,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock,
            Duration scanInterval,
            int batchSize) {
        if (scanInterval.isNegative() || scanInterval.isZero()) {
            throw new IllegalArgumentException("SLA scan interval must be positive: " + scanInterval);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("SLA batch size must be at least 1: " + batchSize);
        }
        this.records = records;
        this.revisions = revisions;
        this.dispatcher = dispatcher;
        this.unitOfWork = unitOfWork;
        this.metrics = metrics;
        this.clock = clock;
        this.scanInterval = scanInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * Start the periodic scan.
     */
    public void start() {
        if (running) {
            log.warn("SLA monitor already running");
            return;
        }

        running = true;
        scheduler.scheduleWithFixedDelay(
            this::scan,
            scanInterval.toMillis(),
            scanInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("SLA monitor started, scanning every {} in batches of {}", scanInterval, batchSize);
    }

    /**
     * Stop the periodic scan.
     */
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
        log.info("SLA monitor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void scan() {
        if (!running) return;

        try {
            runOnce();
        } catch (Exception e) {
            log.error("SLA scan failed", e);
        }
    }

    /**
     * Run one scan now.
     *
     * @return number of records flagged by this scan
     */
    public int runOnce() {
        try (var ctx = LoggingContext.forJob(JOB_NAME)) {
            long started = System.nanoTime();
            Instant now = clock.instant();
            List<CaseRecord> candidates = records.findSlaBreachCandidates(now, batchSize);

            int flagged = 0;
            for (CaseRecord candidate : candidates) {
                LoggingContext.setRecordId(candidate.id());
                try {
                    if (flag(candidate, now)) {
                        flagged++;
                    }
                } catch (Exception e) {
                    log.error("Failed to flag SLA breach on record {}", candidate.id(), e);
                }
            }

            metrics.slaBreachesFlagged(flagged);
            metrics.slaScanCompleted(Duration.ofNanos(System.nanoTime() - started));
            metrics.setBreachedOpen(records.countBreached());

            if (flagged > 0) {
                log.info("Flagged {} SLA breaches", flagged);
            }
            if (candidates.size() == batchSize) {
                log.info("SLA scan hit the batch size of {}; remaining records are handled by the next scan", batchSize);
            }
            return flagged;
        }
    }

    private boolean flag(CaseRecord candidate, Instant now) {
        Optional<CaseRecord> flipped = unitOfWork.inTransaction(() -> {
            Optional<CaseRecord> result = records.markSlaBreached(candidate.id(), now);
            result.ifPresent(record -> revisions.append(
                record.id(),
                RevisionActionType.SLA_BREACHED,
                Actor.SYSTEM_ID,
                String.format("SLA breached: due %s", record.slaDueAt()),
                snapshot(record, now)));
            return result;
        });

        if (flipped.isEmpty()) {
            log.debug("Record {} no longer qualifies for an SLA breach", candidate.id());
            return false;
        }

        CaseRecord record = flipped.get();
        log.warn("Record {} breached its SLA (due {})", record.recordNumber(), record.slaDueAt());
        notifyBreach(record);
        return true;
    }

    private static ObjectNode snapshot(CaseRecord record, Instant now) {
        ObjectNode snapshot = RevisionSnapshots.object();
        RevisionSnapshots.put(snapshot, "slaDueAt", record.slaDueAt());
        RevisionSnapshots.put(snapshot, "detectedAt", now);
        RevisionSnapshots.put(snapshot, "currentStateId", record.currentStateId());
        snapshot.put("version", record.version());
        return snapshot;
    }

    private void notifyBreach(CaseRecord record) {
        Set<String> recipients = new LinkedHashSet<>();
        if (record.assigneeId() != null) {
            recipients.add(record.assigneeId());
        }
        if (record.reporterId() != null) {
            recipients.add(record.reporterId());
        }
        dispatcher.dispatch(new Notification(
            NotificationKind.SLA_BREACHED,
            record.id(),
            recipients,
            "SLA breached: " + record.recordNumber(),
            String.format("Record %s \"%s\" passed its SLA deadline of %s.",
                record.recordNumber(), record.title(), record.slaDueAt())
        ));
    }
}
