package com.taskdrive.core.exception;

/**
 * Thrown when an underlying write, rename, read or listing fails.
 */
public class StorageException extends TaskDriveException {
    
    public static final String ERROR_CODE = "STORAGE_IO";
    
    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
    
    protected StorageException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
