package com.taskdrive.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskState.DONE.isTerminal());
        assertTrue(TaskState.FAILED.isTerminal());

        assertFalse(TaskState.PENDING.isTerminal());
        assertFalse(TaskState.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldOnlyAllowRunning() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.RUNNING));

        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.DONE));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.FAILED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.PENDING));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowReclaimAndTerminal() {
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.PENDING));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.DONE));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.FAILED));

        assertFalse(TaskState.RUNNING.canTransitionTo(TaskState.RUNNING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (TaskState target : TaskState.values()) {
            assertFalse(TaskState.DONE.canTransitionTo(target));
            assertFalse(TaskState.FAILED.canTransitionTo(target));
        }
    }

    @Test
    void fromSuffix_shouldResolveFileSuffixes() {
        assertEquals(TaskState.PENDING, TaskState.fromSuffix("todo").orElseThrow());
        assertEquals(TaskState.RUNNING, TaskState.fromSuffix("running").orElseThrow());
        assertEquals(TaskState.DONE, TaskState.fromSuffix("done").orElseThrow());
        assertEquals(TaskState.FAILED, TaskState.fromSuffix("failed").orElseThrow());

        assertTrue(TaskState.fromSuffix("lock").isEmpty());
        assertTrue(TaskState.fromSuffix("yaml").isEmpty());
    }

    @Test
    void precedence_shouldRankTerminalAboveRunningAbovePending() {
        assertTrue(TaskState.DONE.precedence() > TaskState.RUNNING.precedence());
        assertTrue(TaskState.FAILED.precedence() > TaskState.RUNNING.precedence());
        assertTrue(TaskState.RUNNING.precedence() > TaskState.PENDING.precedence());
    }
}
