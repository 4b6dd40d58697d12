package com.taskdrive.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A unit of schedulable work.
 * 
 * Primary Key: id
 * 
 * Invariants:
 * - state comes from the descriptor's suffix, never from its body
 * - owner and heartbeatAt set iff state == RUNNING
 * - retryCount never decreases
 * - result set iff state == DONE, error set iff state == FAILED
 */
public record Task(
    // Identity
    String id,
    TaskState state,

    // Data
    Map<String, Object> payload,
    int priority,

    // Ownership
    String owner,
    Instant heartbeatAt,
    int retryCount,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Long durationMillis,

    // Outcome
    Map<String, Object> result,
    TaskError error,

    // Recovery and progress
    Instant lastReclaimedAt,
    String lastReclaimReason,
    TaskProgress progress
) {
    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        payload = immutableCopy(payload);
        result = result == null ? null : immutableCopy(result);
    }

    /**
     * Generate a fresh task id: {@code task_<epochSeconds>_<8 hex chars>}.
     */
    public static String newId(Instant now) {
        return String.format("task_%d_%08x", now.getEpochSecond(), ThreadLocalRandom.current().nextInt());
    }

    /**
     * Create a new task in PENDING state.
     */
    public static Task create(String id, Map<String, Object> payload, int priority, Instant now) {
        return new Task(
            id, TaskState.PENDING,
            payload, priority,
            null, null, 0,
            now, null, null, null,
            null, null,
            null, null, null
        );
    }

    /**
     * Check if the task is recorded as held by the given worker.
     */
    public boolean isOwnedBy(String workerId) {
        return owner != null && owner.equals(workerId);
    }

    /**
     * Create a copy under a different state suffix, body unchanged.
     */
    public Task withState(TaskState newState) {
        return new Task(
            id, newState, payload, priority,
            owner, heartbeatAt, retryCount,
            createdAt, startedAt, completedAt, durationMillis,
            result, error,
            lastReclaimedAt, lastReclaimReason, progress
        );
    }

    /**
     * Create a copy stamped with its new owner after a claim.
     */
    public Task withClaimed(String workerId, Instant now) {
        return new Task(
            id, TaskState.RUNNING, payload, priority,
            workerId, now, retryCount,
            createdAt, now, null, null,
            null, null,
            lastReclaimedAt, lastReclaimReason, null
        );
    }

    /**
     * Create a copy with a refreshed heartbeat.
     */
    public Task withHeartbeat(Instant now) {
        return new Task(
            id, state, payload, priority,
            owner, now, retryCount,
            createdAt, startedAt, completedAt, durationMillis,
            result, error,
            lastReclaimedAt, lastReclaimReason, progress
        );
    }

    /**
     * Create a copy with merged progress.
     */
    public Task withProgress(TaskProgress update) {
        return new Task(
            id, state, payload, priority,
            owner, update.updatedAt(), retryCount,
            createdAt, startedAt, completedAt, durationMillis,
            result, error,
            lastReclaimedAt, lastReclaimReason,
            progress == null ? update : progress.merge(update)
        );
    }

    /**
     * Create the terminal DONE body. Ownership is cleared.
     */
    public Task withCompleted(Map<String, Object> taskResult, Instant now) {
        return new Task(
            id, TaskState.DONE, payload, priority,
            null, null, retryCount,
            createdAt, startedAt, now, elapsedMillis(now),
            taskResult == null ? Map.of() : taskResult, null,
            lastReclaimedAt, lastReclaimReason, progress
        );
    }

    /**
     * Create the terminal FAILED body. Ownership is cleared.
     */
    public Task withFailed(TaskError taskError, Instant now) {
        return new Task(
            id, TaskState.FAILED, payload, priority,
            null, null, retryCount,
            createdAt, startedAt, now, elapsedMillis(now),
            null, taskError,
            lastReclaimedAt, lastReclaimReason, progress
        );
    }

    /**
     * Create a reclaimed copy: retry count incremented, ownership cleared.
     * The state is left as-is; the caller moves the descriptor.
     */
    public Task withReclaimed(String reason, Instant now) {
        return new Task(
            id, state, payload, priority,
            null, null, retryCount + 1,
            createdAt, null, null, null,
            null, null,
            now, reason, null
        );
    }

    private Long elapsedMillis(Instant now) {
        if (startedAt == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(startedAt, now).toMillis());
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
