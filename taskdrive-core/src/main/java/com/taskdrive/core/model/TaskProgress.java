package com.taskdrive.core.model;

import java.time.Instant;

/**
 * Progress reported by a running task's handler.
 */
public record TaskProgress(
    Double percentage,
    String status,
    Instant updatedAt
) {
    /**
     * Create progress with the percentage clamped to [0, 100].
     */
    public static TaskProgress of(Double percentage, String status, Instant now) {
        Double clamped = percentage == null ? null : Math.max(0.0, Math.min(100.0, percentage));
        return new TaskProgress(clamped, status, now);
    }

    /**
     * Merge a new report into this one, keeping fields the report leaves unset.
     */
    public TaskProgress merge(TaskProgress update) {
        return new TaskProgress(
            update.percentage != null ? update.percentage : percentage,
            update.status != null ? update.status : status,
            update.updatedAt
        );
    }
}
