package com.casework.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the casework engine.
 *
 * Metrics exposed:
 * - Transitions executed and rejected (by error code)
 * - Action failures by action type
 * - SLA breaches flagged and scan duration
 * - Currently breached records
 */
public class CaseMetrics implements MeterBinder {

    public static final String TRANSITIONS_EXECUTED = "casework.transitions.executed";
    public static final String TRANSITIONS_REJECTED = "casework.transitions.rejected";
    public static final String ACTION_FAILURES = "casework.actions.failed";
    public static final String RECORDS_CREATED = "casework.records.created";
    public static final String SLA_BREACHES = "casework.sla.breaches";
    public static final String SLA_SCAN_DURATION = "casework.sla.scan.duration";
    public static final String SLA_BREACHED_OPEN = "casework.sla.breached.open";
    public static final String REVISIONS_PURGED = "casework.revisions.purged";

    private final AtomicLong breachedOpen = new AtomicLong();
    private MeterRegistry registry;

    /**
     * Metrics bound to a private registry. Used where no registry is wired, e.g. tests.
     */
    public static CaseMetrics standalone() {
        CaseMetrics metrics = new CaseMetrics();
        metrics.bindTo(new SimpleMeterRegistry());
        return metrics;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(SLA_BREACHED_OPEN, breachedOpen, AtomicLong::get)
            .description("Open records whose SLA is breached")
            .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void transitionExecuted(String workflowCode, String transitionCode) {
        Counter.builder(TRANSITIONS_EXECUTED)
            .tag("workflow", workflowCode)
            .tag("transition", transitionCode)
            .description("Transitions committed")
            .register(registry)
            .increment();
    }

    public void transitionRejected(String errorCode) {
        Counter.builder(TRANSITIONS_REJECTED)
            .tag("reason", errorCode)
            .description("Transition requests rejected before commit")
            .register(registry)
            .increment();
    }

    public void actionFailed(String actionType) {
        Counter.builder(ACTION_FAILURES)
            .tag("action", actionType)
            .description("Post-commit actions that failed")
            .register(registry)
            .increment();
    }

    public void recordCreated(String recordType) {
        Counter.builder(RECORDS_CREATED)
            .tag("type", recordType)
            .description("Records created")
            .register(registry)
            .increment();
    }

    public void slaBreachesFlagged(int count) {
        Counter.builder(SLA_BREACHES)
            .description("Records flagged as SLA breached")
            .register(registry)
            .increment(count);
    }

    public void slaScanCompleted(Duration duration) {
        Timer.builder(SLA_SCAN_DURATION)
            .description("Duration of one SLA scan")
            .register(registry)
            .record(duration);
    }

    public void setBreachedOpen(long count) {
        breachedOpen.set(count);
    }

    public void revisionsPurged(int count) {
        Counter.builder(REVISIONS_PURGED)
            .description("Revisions removed by retention cleanup")
            .register(registry)
            .increment(count);
    }
}
