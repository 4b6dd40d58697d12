package com.taskdrive.app.config;

import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.exception.ConfigurationException;
import com.taskdrive.core.model.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from {@code taskdrive.*}.
 *
 * The lease duration and retry ceiling have no defaults: operators must
 * choose them for their workload.
 */
@ConfigurationProperties(prefix = "taskdrive")
public class TaskDriveProperties {

    private Path rootDirectory;
    private String workerId;
    private final Worker worker = new Worker();
    private final Lease lease = new Lease();
    private final Recovery recovery = new Recovery();
    private final Storage storage = new Storage();

    public Path getRootDirectory() {
        return rootDirectory;
    }

    public void setRootDirectory(Path rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Worker getWorker() {
        return worker;
    }

    public Lease getLease() {
        return lease;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Storage getStorage() {
        return storage;
    }

    /**
     * Build the validated scheduler configuration.
     *
     * @throws ConfigurationException if a required value is missing or inconsistent
     */
    public SchedulerConfig toSchedulerConfig() {
        SchedulerConfig.Builder builder = SchedulerConfig.builder()
            .rootDirectory(rootDirectory)
            .workerId(workerId == null || workerId.isBlank() ? null : workerId)
            .pollInterval(worker.pollInterval)
            .maxPollBackoff(worker.maxPollBackoff)
            .claimAttempts(worker.claimAttempts)
            .leaseDuration(lease.duration)
            .heartbeatInterval(lease.heartbeatInterval)
            .recoveryInterval(recovery.interval)
            .tempFileMaxAge(recovery.tempFileMaxAge)
            .storageRetryPolicy(BackoffPolicy.builder()
                .maxAttempts(storage.retryAttempts)
                .initialBackoff(storage.retryInitialBackoff)
                .maxBackoff(storage.retryMaxBackoff)
                .build());
        if (recovery.maxRetries == null) {
            throw new ConfigurationException("taskdrive.recovery.max-retries", "must be supplied by the operator");
        }
        return builder.maxRetries(recovery.maxRetries).build();
    }

    public static class Worker {
        private boolean autoStart = true;
        private Duration pollInterval = SchedulerConfig.DEFAULT_POLL_INTERVAL;
        private Duration maxPollBackoff = SchedulerConfig.DEFAULT_MAX_POLL_BACKOFF;
        private int claimAttempts = SchedulerConfig.DEFAULT_CLAIM_ATTEMPTS;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getMaxPollBackoff() {
            return maxPollBackoff;
        }

        public void setMaxPollBackoff(Duration maxPollBackoff) {
            this.maxPollBackoff = maxPollBackoff;
        }

        public int getClaimAttempts() {
            return claimAttempts;
        }

        public void setClaimAttempts(int claimAttempts) {
            this.claimAttempts = claimAttempts;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Lease {
        private Duration duration;
        private Duration heartbeatInterval = SchedulerConfig.DEFAULT_HEARTBEAT_INTERVAL;

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration interval = SchedulerConfig.DEFAULT_RECOVERY_INTERVAL;
        private Integer maxRetries;
        private Duration tempFileMaxAge = SchedulerConfig.DEFAULT_TEMP_FILE_MAX_AGE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getTempFileMaxAge() {
            return tempFileMaxAge;
        }

        public void setTempFileMaxAge(Duration tempFileMaxAge) {
            this.tempFileMaxAge = tempFileMaxAge;
        }
    }

    public static class Storage {
        private int retryAttempts = 5;
        private Duration retryInitialBackoff = Duration.ofMillis(100);
        private Duration retryMaxBackoff = Duration.ofSeconds(5);

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public Duration getRetryInitialBackoff() {
            return retryInitialBackoff;
        }

        public void setRetryInitialBackoff(Duration retryInitialBackoff) {
            this.retryInitialBackoff = retryInitialBackoff;
        }

        public Duration getRetryMaxBackoff() {
            return retryMaxBackoff;
        }

        public void setRetryMaxBackoff(Duration retryMaxBackoff) {
            this.retryMaxBackoff = retryMaxBackoff;
        }
    }
}
