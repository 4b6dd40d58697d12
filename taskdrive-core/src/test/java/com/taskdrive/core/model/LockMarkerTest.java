package com.taskdrive.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LockMarkerTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");
    private static final Duration LEASE = Duration.ofSeconds(30);

    @Test
    void create_shouldStampAcquisitionAndHeartbeat() {
        LockMarker marker = LockMarker.create("task-1", "worker-a", LEASE, T0);

        assertEquals("task-1", marker.taskId());
        assertEquals("worker-a", marker.ownerId());
        assertEquals(T0, marker.acquiredAt());
        assertEquals(T0, marker.lastHeartbeat());
        assertEquals(LEASE, marker.leaseDuration());
    }

    @Test
    void isStale_shouldBeFalseWithinLease() {
        LockMarker marker = LockMarker.create("task-1", "worker-a", LEASE, T0);

        assertFalse(marker.isStale(T0.plusSeconds(10), LEASE));
        // exactly at the lease boundary is still live
        assertFalse(marker.isStale(T0.plus(LEASE), LEASE));
    }

    @Test
    void isStale_shouldBeTrueAfterLease() {
        LockMarker marker = LockMarker.create("task-1", "worker-a", LEASE, T0);

        assertTrue(marker.isStale(T0.plus(LEASE).plusMillis(1), LEASE));
    }

    @Test
    void withHeartbeat_shouldExtendLiveness() {
        LockMarker marker = LockMarker.create("task-1", "worker-a", LEASE, T0)
            .withHeartbeat(T0.plusSeconds(25));

        assertFalse(marker.isStale(T0.plusSeconds(50), LEASE));
        assertTrue(marker.isStale(T0.plusSeconds(56), LEASE));
        assertEquals(T0, marker.acquiredAt());
    }

    @Test
    void isStale_shouldTreatMissingTimestampsAsStale() {
        LockMarker marker = new LockMarker("task-1", "worker-a", null, null, LEASE);

        assertTrue(marker.isStale(T0, LEASE));
    }

    @Test
    void isOwnedBy_shouldMatchOwnerOnly() {
        LockMarker marker = LockMarker.create("task-1", "worker-a", LEASE, T0);

        assertTrue(marker.isOwnedBy("worker-a"));
        assertFalse(marker.isOwnedBy("worker-b"));
        assertFalse(marker.isOwnedBy(null));
    }
}
