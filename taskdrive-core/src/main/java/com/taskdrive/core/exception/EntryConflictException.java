package com.taskdrive.core.exception;

/**
 * Thrown when a rename or exclusive write target already exists.
 */
public class EntryConflictException extends StorageException {
    
    public static final String ERROR_CODE = "CONFLICT";
    
    public EntryConflictException(String path) {
        super(ERROR_CODE, "Entry already exists: " + path, null);
    }
    
    public EntryConflictException(String path, Throwable cause) {
        super(ERROR_CODE, "Entry already exists: " + path, cause);
    }
}
