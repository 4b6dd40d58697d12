package com.taskdrive.core.exception;

/**
 * Thrown when another actor already moved or claimed the resource.
 * Never fatal: callers skip the task and move on.
 */
public class RaceLostException extends TaskDriveException {
    
    public static final String ERROR_CODE = "RACE_LOST";
    
    private final String taskId;
    
    public RaceLostException(String taskId, String detail) {
        super(ERROR_CODE, String.format("Lost race on task '%s': %s", taskId, detail));
        this.taskId = taskId;
    }
    
    public RaceLostException(String taskId, String detail, Throwable cause) {
        super(ERROR_CODE, String.format("Lost race on task '%s': %s", taskId, detail), cause);
        this.taskId = taskId;
    }
    
    public String getTaskId() {
        return taskId;
    }
}
