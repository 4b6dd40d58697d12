package com.taskdrive.app.config;

import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class TaskDrivePropertiesTest {

    private TaskDriveProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TaskDriveProperties();
        properties.setRootDirectory(Path.of("/srv/taskdrive"));
        properties.setWorkerId("worker-7");
        properties.getLease().setDuration(Duration.ofMinutes(2));
        properties.getRecovery().setMaxRetries(3);
    }

    @Test
    void toSchedulerConfig_shouldCarryEverySetting() {
        properties.getWorker().setPollInterval(Duration.ofSeconds(2));
        properties.getWorker().setClaimAttempts(5);
        properties.getStorage().setRetryAttempts(7);

        SchedulerConfig config = properties.toSchedulerConfig();

        assertThat(config.rootDirectory()).isEqualTo(Path.of("/srv/taskdrive"));
        assertThat(config.workerId()).isEqualTo("worker-7");
        assertThat(config.leaseDuration()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.claimAttempts()).isEqualTo(5);
        assertThat(config.storageRetryPolicy().maxAttempts()).isEqualTo(7);
        assertThat(config.heartbeatInterval()).isEqualTo(SchedulerConfig.DEFAULT_HEARTBEAT_INTERVAL);
    }

    @Test
    void missingMaxRetries_shouldBeRejected() {
        properties.getRecovery().setMaxRetries(null);

        assertThatThrownBy(() -> properties.toSchedulerConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("max-retries");
    }

    @Test
    void missingLease_shouldBeRejected() {
        properties.getLease().setDuration(null);

        assertThatThrownBy(() -> properties.toSchedulerConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("leaseDuration");
    }

    @Test
    void blankWorkerId_shouldFallBackToGeneratedIdentity() {
        properties.setWorkerId(" ");

        assertThat(properties.toSchedulerConfig().workerId()).isNotBlank().isNotEqualTo(" ");
    }
}
