package com.taskdrive.worker;

/**
 * Exception thrown by task handlers on failure.
 * The error code ends up in the FAILED descriptor.
 */
public class TaskExecutionException extends Exception {

    public static final String DEFAULT_ERROR_CODE = "TASK_FAILED";

    private final String errorCode;

    public TaskExecutionException(String message) {
        this(DEFAULT_ERROR_CODE, message);
    }

    public TaskExecutionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskExecutionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
