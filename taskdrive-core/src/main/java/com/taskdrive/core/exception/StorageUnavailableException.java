package com.taskdrive.core.exception;

/**
 * Thrown when the shared storage root cannot be accessed at startup. Fatal.
 */
public class StorageUnavailableException extends TaskDriveException {
    
    public static final String ERROR_CODE = "STORAGE_UNAVAILABLE";
    
    public StorageUnavailableException(String root, Throwable cause) {
        super(ERROR_CODE, "Shared storage root is not accessible: " + root, cause);
    }
}
