package com.taskdrive.core.config;

import com.taskdrive.core.exception.ConfigurationException;
import com.taskdrive.core.model.BackoffPolicy;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Configuration for one worker process.
 * Built once at startup and handed to every component constructor.
 * 
 * Invariants:
 * - leaseDuration and maxRetries are operator-supplied (no defaults)
 * - heartbeatInterval < leaseDuration
 * - all intervals are positive
 */
public record SchedulerConfig(
    Path rootDirectory,
    String workerId,

    // Polling
    Duration pollInterval,
    Duration maxPollBackoff,
    int claimAttempts,

    // Liveness
    Duration leaseDuration,
    Duration heartbeatInterval,

    // Recovery
    Duration recoveryInterval,
    int maxRetries,
    Duration tempFileMaxAge,

    // Storage
    BackoffPolicy storageRetryPolicy
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_POLL_BACKOFF = Duration.ofSeconds(60);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECOVERY_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_TEMP_FILE_MAX_AGE = Duration.ofHours(1);
    public static final int DEFAULT_CLAIM_ATTEMPTS = 3;

    public SchedulerConfig {
        if (rootDirectory == null) {
            throw new ConfigurationException("rootDirectory", "must be set");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new ConfigurationException("workerId", "must not be blank");
        }
        if (leaseDuration == null) {
            throw new ConfigurationException("leaseDuration", "must be supplied by the operator");
        }
        requirePositive("pollInterval", pollInterval);
        requirePositive("maxPollBackoff", maxPollBackoff);
        requirePositive("leaseDuration", leaseDuration);
        requirePositive("heartbeatInterval", heartbeatInterval);
        requirePositive("recoveryInterval", recoveryInterval);
        requirePositive("tempFileMaxAge", tempFileMaxAge);
        if (maxPollBackoff.compareTo(pollInterval) < 0) {
            throw new ConfigurationException("maxPollBackoff", "must be >= pollInterval");
        }
        if (heartbeatInterval.compareTo(leaseDuration) >= 0) {
            throw new ConfigurationException("heartbeatInterval", "must be shorter than leaseDuration");
        }
        if (maxRetries < 0) {
            throw new ConfigurationException("maxRetries", "must be >= 0");
        }
        if (claimAttempts < 1) {
            throw new ConfigurationException("claimAttempts", "must be >= 1");
        }
        if (storageRetryPolicy == null) {
            throw new ConfigurationException("storageRetryPolicy", "must be set");
        }
    }

    /**
     * Default worker identity: {@code <hostname>-<pid>-<random8>}.
     */
    public static String defaultWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        long pid = ProcessHandle.current().pid();
        return host + "-" + pid + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(field, "must be a positive duration");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path rootDirectory;
        private String workerId;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration maxPollBackoff = DEFAULT_MAX_POLL_BACKOFF;
        private int claimAttempts = DEFAULT_CLAIM_ATTEMPTS;
        private Duration leaseDuration;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration recoveryInterval = DEFAULT_RECOVERY_INTERVAL;
        private Integer maxRetries;
        private Duration tempFileMaxAge = DEFAULT_TEMP_FILE_MAX_AGE;
        private BackoffPolicy storageRetryPolicy = BackoffPolicy.defaultPolicy();

        public Builder rootDirectory(Path rootDirectory) {
            this.rootDirectory = rootDirectory;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxPollBackoff(Duration maxPollBackoff) {
            this.maxPollBackoff = maxPollBackoff;
            return this;
        }

        public Builder claimAttempts(int claimAttempts) {
            this.claimAttempts = claimAttempts;
            return this;
        }

        public Builder leaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder recoveryInterval(Duration recoveryInterval) {
            this.recoveryInterval = recoveryInterval;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder tempFileMaxAge(Duration tempFileMaxAge) {
            this.tempFileMaxAge = tempFileMaxAge;
            return this;
        }

        public Builder storageRetryPolicy(BackoffPolicy storageRetryPolicy) {
            this.storageRetryPolicy = storageRetryPolicy;
            return this;
        }

        public SchedulerConfig build() {
            if (maxRetries == null) {
                throw new ConfigurationException("maxRetries", "must be supplied by the operator");
            }
            return new SchedulerConfig(
                rootDirectory,
                workerId != null ? workerId : defaultWorkerId(),
                pollInterval, maxPollBackoff, claimAttempts,
                leaseDuration, heartbeatInterval,
                recoveryInterval, maxRetries, tempFileMaxAge,
                storageRetryPolicy
            );
        }
    }
}
