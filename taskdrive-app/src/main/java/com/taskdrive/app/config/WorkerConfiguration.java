package com.taskdrive.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdrive.app.handler.EchoTaskHandler;
import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.core.storage.StorageAdapter;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import com.taskdrive.engine.persistence.StorageLockManager;
import com.taskdrive.engine.persistence.StorageTaskStore;
import com.taskdrive.engine.persistence.codec.LockMarkerCodec;
import com.taskdrive.engine.persistence.codec.TaskDescriptorCodec;
import com.taskdrive.engine.persistence.file.FileStorageAdapter;
import com.taskdrive.recovery.RecoveryService;
import com.taskdrive.worker.HeartbeatService;
import com.taskdrive.worker.Scheduler;
import com.taskdrive.worker.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires one worker: storage, task store, lock manager, heartbeats,
 * recovery and the scheduling loop.
 *
 * An inaccessible root directory fails the context at startup.
 */
@Configuration
public class WorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulerConfig schedulerConfig(TaskDriveProperties properties) {
        SchedulerConfig config = properties.toSchedulerConfig();
        log.info("Worker {} using root {} (lease={}, maxRetries={})",
            config.workerId(), config.rootDirectory(), config.leaseDuration(), config.maxRetries());
        return config;
    }

    @Bean
    public StorageAdapter storageAdapter(SchedulerConfig config, Clock clock) {
        return new FileStorageAdapter(config.rootDirectory(), config.storageRetryPolicy(), clock);
    }

    @Bean
    public TaskStore taskStore(StorageAdapter storage, Clock clock, SchedulerMetrics metrics) {
        return new StorageTaskStore(storage, new TaskDescriptorCodec(), clock, metrics);
    }

    @Bean
    public LockManager lockManager(StorageAdapter storage, Clock clock) {
        return new StorageLockManager(storage, new LockMarkerCodec(), clock);
    }

    @Bean
    public HeartbeatService heartbeatService(
            LockManager lockManager, TaskStore taskStore, Clock clock, SchedulerMetrics metrics) {
        return new HeartbeatService(lockManager, taskStore, clock, metrics);
    }

    @Bean
    public RecoveryService recoveryService(
            TaskStore taskStore, LockManager lockManager, SchedulerConfig config,
            Clock clock, SchedulerMetrics metrics) {
        return new RecoveryService(taskStore, lockManager, config, clock, metrics);
    }

    @Bean
    public Scheduler scheduler(
            SchedulerConfig config, TaskStore taskStore, LockManager lockManager,
            HeartbeatService heartbeatService, ObjectProvider<TaskHandler> taskHandler,
            Clock clock, SchedulerMetrics metrics, ObjectMapper objectMapper) {
        TaskHandler handler = taskHandler.getIfAvailable(() -> {
            log.warn("No TaskHandler bean defined, tasks will be echoed");
            return new EchoTaskHandler();
        });
        return Scheduler.builder()
            .config(config)
            .taskStore(taskStore)
            .lockManager(lockManager)
            .heartbeatService(heartbeatService)
            .handler(handler)
            .clock(clock)
            .metrics(metrics)
            .objectMapper(objectMapper)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    /**
     * Start the loops once the context is up.
     */
    @Bean
    public ApplicationRunner workerStarter(
            TaskDriveProperties properties, Scheduler scheduler, RecoveryService recoveryService) {
        return args -> {
            if (properties.getRecovery().isEnabled()) {
                recoveryService.start();
            }
            if (properties.getWorker().isAutoStart()) {
                scheduler.start();
            } else {
                log.info("Scheduler auto-start disabled");
            }
        };
    }
}
