package com.taskdrive.core.exception;

/**
 * Base exception for all scheduler errors.
 */
public class TaskDriveException extends RuntimeException {
    
    private final String errorCode;
    
    public TaskDriveException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TaskDriveException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
