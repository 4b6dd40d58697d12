package com.taskdrive.worker;

/**
 * States of a worker's scheduling loop.
 *
 * IDLE -> CLAIMING -> EXECUTING -> FINALIZING -> IDLE, and STOPPED once
 * a stop was requested and no task is in flight.
 */
public enum SchedulerState {
    IDLE,
    CLAIMING,
    EXECUTING,
    FINALIZING,
    STOPPED;

    /**
     * Whether a claimed task is being worked on in this state.
     */
    public boolean holdsTask() {
        return this == EXECUTING || this == FINALIZING;
    }
}
