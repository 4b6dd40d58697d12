package com.taskdrive.core.repository;

import com.taskdrive.core.model.LockMarker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Advisory per-task mutual exclusion through a marker file.
 * Every method is a single attempt; retrying is the caller's business.
 */
public interface LockManager {

    /**
     * Try to claim the marker for a task.
     * A stale marker (no heartbeat within {@code leaseDuration}) is overwritten.
     * 
     * @param taskId The task ID
     * @param ownerId The claiming worker
     * @param leaseDuration Lease used to judge an existing marker's staleness
     * @return true if the marker now names {@code ownerId}, false if held by another live owner
     */
    boolean tryAcquire(String taskId, String ownerId, Duration leaseDuration);

    /**
     * Refresh the marker's heartbeat.
     * 
     * @return true if renewed, false if the marker is gone or owned by someone else
     */
    boolean renew(String taskId, String ownerId);

    /**
     * Remove the marker if it is still owned by {@code ownerId}.
     * A missing marker or an owner mismatch is silently ignored.
     */
    void release(String taskId, String ownerId);

    /**
     * Remove the marker regardless of owner (recovery only).
     * 
     * @return true if a marker was removed
     */
    boolean forceRelease(String taskId);

    /**
     * Read the current marker.
     */
    Optional<LockMarker> read(String taskId);

    /**
     * Check if the marker currently names {@code ownerId}.
     */
    boolean isHeldBy(String taskId, String ownerId);

    /**
     * Ids of every task that currently has a marker.
     */
    List<String> listMarkedTaskIds();
}
