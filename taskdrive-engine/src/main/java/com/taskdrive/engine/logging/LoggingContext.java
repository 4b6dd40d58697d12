package com.taskdrive.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures every log line of a claim, execution or reclaim carries its task and worker.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(workerId, taskId, retryCount)) {
 *     log.info("Executing task"); // includes workerId, taskId, retryCount
 * }
 * </pre>
 *
 * Contexts nest: closing one restores whatever the enclosing context had put.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKER_ID = "workerId";
    public static final String TASK_ID = "taskId";
    public static final String RETRY_COUNT = "retryCount";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
    }

    /**
     * Create a logging context for worker-level operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one task's claim, execution and finalization.
     */
    public static LoggingContext forTask(String workerId, String taskId, int retryCount) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ctx.put(TASK_ID, taskId);
        ctx.put(RETRY_COUNT, String.valueOf(retryCount));
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Get current task ID from context.
     */
    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        previous.put(key, MDC.get(key));
        MDC.put(key, value);
    }

    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
