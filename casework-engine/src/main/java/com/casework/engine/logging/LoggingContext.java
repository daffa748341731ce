package com.casework.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures logs emitted while handling a record carry its correlation ids.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTransition(recordId, transitionId, actorId)) {
 *     log.info("Executing transition"); // includes recordId, transitionId, actorId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RECORD_ID = "recordId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String TRANSITION_ID = "transitionId";
    public static final String ACTOR_ID = "actorId";
    public static final String JOB = "job";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    public static LoggingContext forRecord(UUID recordId, String actorId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(RECORD_ID, recordId);
        putIfPresent(ACTOR_ID, actorId);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forTransition(UUID recordId, UUID transitionId, String actorId) {
        LoggingContext ctx = forRecord(recordId, actorId);
        putIfPresent(TRANSITION_ID, transitionId);
        return ctx;
    }

    public static LoggingContext forWorkflow(UUID workflowId, String actorId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(WORKFLOW_ID, workflowId);
        putIfPresent(ACTOR_ID, actorId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for one iteration of a background job.
     */
    public static LoggingContext forJob(String jobName) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(JOB, jobName);
        MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        return ctx;
    }

    /**
     * Add the record id to the current context, e.g. per item inside a job.
     */
    public static void setRecordId(UUID recordId) {
        putIfPresent(RECORD_ID, recordId);
    }

    public static String getRecordId() {
        return MDC.get(RECORD_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(RECORD_ID);
        MDC.remove(WORKFLOW_ID);
        MDC.remove(TRANSITION_ID);
        MDC.remove(ACTOR_ID);
        MDC.remove(JOB);
        // Keep TRACE_ID for request-scoped tracing
    }

    public static void clearAll() {
        MDC.clear();
    }
}
