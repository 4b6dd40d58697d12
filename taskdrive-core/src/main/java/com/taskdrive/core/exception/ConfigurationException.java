package com.taskdrive.core.exception;

/**
 * Thrown when scheduler configuration is missing or invalid. Fatal at startup.
 */
public class ConfigurationException extends TaskDriveException {
    
    public static final String ERROR_CODE = "INVALID_CONFIGURATION";
    
    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ConfigurationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid configuration: %s - %s", field, reason));
    }
}
