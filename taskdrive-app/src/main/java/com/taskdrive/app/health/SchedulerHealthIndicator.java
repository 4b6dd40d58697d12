package com.taskdrive.app.health;

import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.worker.HeartbeatService;
import com.taskdrive.worker.Scheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports worker health based on:
 * - Shared root directory accessibility
 * - Scheduler state and the task in flight
 * - Descriptor counts per state
 */
@Component
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerConfig config;
    private final Scheduler scheduler;
    private final HeartbeatService heartbeatService;
    private final TaskStore taskStore;

    public SchedulerHealthIndicator(
            SchedulerConfig config,
            Scheduler scheduler,
            HeartbeatService heartbeatService,
            TaskStore taskStore) {
        this.config = config;
        this.scheduler = scheduler;
        this.heartbeatService = heartbeatService;
        this.taskStore = taskStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workerId", config.workerId());
        details.put("schedulerState", scheduler.state().name());
        scheduler.currentTaskId().ifPresent(taskId -> details.put("currentTask", taskId));
        details.put("activeHeartbeats", heartbeatService.activeCount());

        Path root = config.rootDirectory();
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            details.put("rootDirectory", root + " (inaccessible)");
            return Health.down().withDetails(details).build();
        }
        details.put("rootDirectory", root.toString());

        try {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (Map.Entry<TaskState, Integer> entry : taskStore.countByState().entrySet()) {
                counts.put(entry.getKey().suffix(), entry.getValue());
            }
            details.put("tasks", counts);
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        return Health.up().withDetails(details).build();
    }
}
