package com.taskdrive.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdrive.core.model.Task;

import java.util.Map;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {

    private final Task task;
    private final String workerId;
    private final ObjectMapper objectMapper;
    private final HeartbeatCallback heartbeatCallback;
    private final ProgressCallback progressCallback;

    public TaskContext(
            Task task,
            String workerId,
            ObjectMapper objectMapper,
            HeartbeatCallback heartbeatCallback,
            ProgressCallback progressCallback) {
        this.task = task;
        this.workerId = workerId;
        this.objectMapper = objectMapper;
        this.heartbeatCallback = heartbeatCallback;
        this.progressCallback = progressCallback;
    }

    /**
     * Get the claimed task as it was when execution started.
     */
    public Task getTask() {
        return task;
    }

    public String getTaskId() {
        return task.id();
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Get the task payload.
     */
    public Map<String, Object> getPayload() {
        return task.payload();
    }

    /**
     * Get the task payload as a specific type.
     */
    public <T> T getPayload(Class<T> type) {
        return objectMapper.convertValue(task.payload(), type);
    }

    /**
     * Number of times this task has been reclaimed from a dead worker.
     * Non-zero means an earlier execution may have had side effects.
     */
    public int getRetryCount() {
        return task.retryCount();
    }

    /**
     * Renew the lease now, outside the periodic heartbeat.
     *
     * @return true if renewed, false if the lease was lost
     */
    public boolean heartbeat() {
        return heartbeatCallback.sendHeartbeat();
    }

    /**
     * Record progress in the running descriptor.
     * Percentage is clamped to 0..100; null fields keep their previous value.
     *
     * @return true if recorded, false if the task is no longer held
     */
    public boolean reportProgress(Double percentage, String status) {
        return progressCallback.report(percentage, status);
    }

    /**
     * Convert a result object into the map form stored in the descriptor.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toResult(Object result) {
        return objectMapper.convertValue(result, Map.class);
    }

    @FunctionalInterface
    public interface HeartbeatCallback {
        boolean sendHeartbeat();
    }

    @FunctionalInterface
    public interface ProgressCallback {
        boolean report(Double percentage, String status);
    }
}
