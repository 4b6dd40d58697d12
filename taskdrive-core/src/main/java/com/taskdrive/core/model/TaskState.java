package com.taskdrive.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle states for a task.
 * The state is carried only by the descriptor's file-name suffix.
 */
public enum TaskState {
    /**
     * Waiting to be claimed by a worker.
     * Transitions: -> RUNNING
     */
    PENDING("todo", 0),

    /**
     * Claimed and being executed by its owner.
     * Transitions: -> DONE, FAILED (owner), -> PENDING, FAILED (recovery)
     */
    RUNNING("running", 1),

    /**
     * Completed successfully. Terminal state.
     */
    DONE("done", 2),

    /**
     * Failed by the handler or after exhausting reclaims. Terminal state.
     */
    FAILED("failed", 2);

    private final String suffix;
    private final int precedence;

    TaskState(String suffix, int precedence) {
        this.suffix = suffix;
        this.precedence = precedence;
    }

    /**
     * File-name suffix (without the dot) for descriptors in this state.
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Rank used to pick the surviving copy when one id shows up under several suffixes.
     * Higher wins.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskState target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == PENDING || target == DONE || target == FAILED;
            case DONE, FAILED -> false;
        };
    }

    /**
     * Resolve a state from a file-name suffix.
     */
    public static Optional<TaskState> fromSuffix(String suffix) {
        return Arrays.stream(values())
            .filter(s -> s.suffix.equals(suffix))
            .findFirst();
    }
}
