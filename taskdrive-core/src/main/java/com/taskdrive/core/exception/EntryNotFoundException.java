package com.taskdrive.core.exception;

/**
 * Thrown when a rename source no longer exists.
 * Usually means another actor already transitioned the entry.
 */
public class EntryNotFoundException extends StorageException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public EntryNotFoundException(String path) {
        super(ERROR_CODE, "Entry not found: " + path, null);
    }
    
    public EntryNotFoundException(String path, Throwable cause) {
        super(ERROR_CODE, "Entry not found: " + path, cause);
    }
}
