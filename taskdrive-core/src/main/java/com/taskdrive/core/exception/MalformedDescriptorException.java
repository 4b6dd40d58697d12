package com.taskdrive.core.exception;

/**
 * Thrown when a task descriptor or lock marker cannot be parsed.
 * The file is logged and skipped, never deleted automatically.
 */
public class MalformedDescriptorException extends TaskDriveException {
    
    public static final String ERROR_CODE = "MALFORMED_DESCRIPTOR";
    
    private final String path;
    
    public MalformedDescriptorException(String path, String reason) {
        super(ERROR_CODE, String.format("Malformed descriptor %s: %s", path, reason));
        this.path = path;
    }
    
    public MalformedDescriptorException(String path, Throwable cause) {
        super(ERROR_CODE, String.format("Malformed descriptor %s: %s", path, cause.getMessage()), cause);
        this.path = path;
    }
    
    public String getPath() {
        return path;
    }
}
