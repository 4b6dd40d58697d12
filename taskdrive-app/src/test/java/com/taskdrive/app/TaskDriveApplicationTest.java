package com.taskdrive.app;

import com.taskdrive.app.health.SchedulerHealthIndicator;
import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.recovery.RecoveryService;
import com.taskdrive.worker.Scheduler;
import com.taskdrive.worker.SchedulerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = "spring.jmx.enabled=true")
class TaskDriveApplicationTest {

    @TempDir
    static Path root;

    @DynamicPropertySource
    static void taskdriveProperties(DynamicPropertyRegistry registry) {
        registry.add("taskdrive.root-directory", () -> root.toString());
        registry.add("taskdrive.worker-id", () -> "test-worker");
        registry.add("taskdrive.worker.auto-start", () -> "false");
        registry.add("taskdrive.lease.duration", () -> "30s");
        registry.add("taskdrive.lease.heartbeat-interval", () -> "10s");
        registry.add("taskdrive.recovery.enabled", () -> "false");
        registry.add("taskdrive.recovery.max-retries", () -> "2");
    }

    @Autowired
    private SchedulerConfig config;

    @Autowired
    private TaskStore taskStore;

    @Autowired
    private Scheduler scheduler;

    @Autowired
    private RecoveryService recoveryService;

    @Autowired
    private SchedulerHealthIndicator healthIndicator;

    @Autowired
    private HealthEndpoint healthEndpoint;

    @Test
    void contextLoads_withBoundConfiguration() {
        assertThat(config.workerId()).isEqualTo("test-worker");
        assertThat(config.leaseDuration()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.maxRetries()).isEqualTo(2);
        assertThat(Files.isDirectory(root.resolve("tasks"))).isTrue();
        assertThat(Files.isDirectory(root.resolve("locks"))).isTrue();
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(recoveryService.isRunning()).isFalse();
    }

    @Test
    void defaultHandler_shouldEchoPayload() {
        Task task = taskStore.create(Map.of("greeting", "hello"));

        Task done = scheduler.runOnce().orElseThrow();

        assertThat(done.id()).isEqualTo(task.id());
        assertThat(taskStore.find(task.id()).orElseThrow().state()).isEqualTo(TaskState.DONE);
        assertThat(done.result())
            .containsEntry("greeting", "hello")
            .containsEntry("echoedBy", "test-worker");
        assertThat(Files.exists(root.resolve("tasks/" + task.id() + ".done"))).isTrue();
    }

    @Test
    void health_shouldReportWorkerDetails() {
        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("workerId", "test-worker")
            .containsEntry("schedulerState", SchedulerState.IDLE.name())
            .containsKey("tasks");
    }

    @Test
    void healthEndpoint_shouldBeExposedOverJmx() throws MalformedObjectNameException {
        HealthComponent scheduler = healthEndpoint.healthForPath("scheduler");

        assertThat(scheduler).isNotNull();
        assertThat(scheduler.getStatus()).isEqualTo(Status.UP);
        assertThat(ManagementFactory.getPlatformMBeanServer()
            .isRegistered(new ObjectName("org.springframework.boot:type=Endpoint,name=Health"))).isTrue();
    }
}
