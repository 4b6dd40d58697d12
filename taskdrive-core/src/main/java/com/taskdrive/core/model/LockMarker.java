package com.taskdrive.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Advisory ownership marker written next to a claimed task.
 * 
 * Invariants:
 * - at most one marker file per task id
 * - only the recorded owner removes its own marker
 * - only a stale marker may be overwritten by another claimant
 */
public record LockMarker(
    String taskId,
    String ownerId,
    Instant acquiredAt,
    Instant lastHeartbeat,
    Duration leaseDuration
) {
    /**
     * Create a fresh marker.
     */
    public static LockMarker create(String taskId, String ownerId, Duration leaseDuration, Instant now) {
        return new LockMarker(taskId, ownerId, now, now, leaseDuration);
    }

    /**
     * Create a copy with a refreshed heartbeat.
     */
    public LockMarker withHeartbeat(Instant now) {
        return new LockMarker(taskId, ownerId, acquiredAt, now, leaseDuration);
    }

    /**
     * A marker is stale once {@code now - lastHeartbeat > lease}.
     */
    public boolean isStale(Instant now, Duration lease) {
        Instant beat = lastHeartbeat != null ? lastHeartbeat : acquiredAt;
        if (beat == null) {
            return true;
        }
        return Duration.between(beat, now).compareTo(lease) > 0;
    }

    /**
     * Check if the marker names the given owner.
     */
    public boolean isOwnedBy(String candidate) {
        return ownerId != null && ownerId.equals(candidate);
    }
}
