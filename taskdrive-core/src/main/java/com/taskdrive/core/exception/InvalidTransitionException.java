package com.taskdrive.core.exception;

import com.taskdrive.core.model.TaskState;

/**
 * Thrown when a caller asks for a state change the lifecycle does not allow.
 * A programming error, never caused by a concurrent actor.
 */
public class InvalidTransitionException extends TaskDriveException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidTransitionException(String taskId, TaskState currentState, TaskState targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition task '%s' from %s to %s",
            taskId, currentState, targetState
        ));
    }
}
