package com.taskdrive.worker;

import java.util.Map;

/**
 * Callback executing one task's payload.
 *
 * Implementations must be idempotent: a task whose worker died mid-execution
 * is reclaimed and handed to another worker, so the same payload may run more
 * than once.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute the task.
     *
     * @param context Task details, payload and heartbeat access
     * @return Result recorded in the DONE descriptor, may be null
     * @throws TaskExecutionException on failure; the task ends FAILED
     */
    Map<String, Object> execute(TaskContext context) throws TaskExecutionException;
}
