package com.taskdrive.core.model;

/**
 * Error recorded on a task that ended in {@link TaskState#FAILED}.
 */
public record TaskError(
    String code,
    String message,
    String type
) {
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * Build an error from an unexpected throwable.
     */
    public static TaskError fromThrowable(Throwable t) {
        return new TaskError(INTERNAL_ERROR, t.getMessage(), t.getClass().getName());
    }

    /**
     * Error for a task reclaimed more often than the retry ceiling allows.
     */
    public static TaskError retriesExhausted(int retryCount, int maxRetries) {
        return new TaskError(
            RETRIES_EXHAUSTED,
            String.format("Task reclaimed %d times, exceeding the retry ceiling of %d", retryCount, maxRetries),
            null
        );
    }
}
