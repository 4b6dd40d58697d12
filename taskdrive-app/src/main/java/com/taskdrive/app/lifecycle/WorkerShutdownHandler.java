package com.taskdrive.app.lifecycle;

import com.taskdrive.app.config.TaskDriveProperties;
import com.taskdrive.engine.logging.LoggingContext;
import com.taskdrive.recovery.RecoveryService;
import com.taskdrive.worker.HeartbeatService;
import com.taskdrive.worker.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Graceful shutdown for a worker process.
 *
 * On shutdown:
 * 1. Stops polling and waits for the in-flight task to finalize (with timeout)
 * 2. Stops the recovery loop
 * 3. Stops remaining heartbeats
 *
 * A task still executing when the timeout expires keeps its marker; once
 * the lease runs out, recovery on another worker reclaims it.
 */
@Component
public class WorkerShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkerShutdownHandler.class);

    private final Scheduler scheduler;
    private final RecoveryService recoveryService;
    private final HeartbeatService heartbeatService;
    private final Duration shutdownTimeout;

    public WorkerShutdownHandler(
            Scheduler scheduler,
            RecoveryService recoveryService,
            HeartbeatService heartbeatService,
            TaskDriveProperties properties) {
        this.scheduler = scheduler;
        this.recoveryService = recoveryService;
        this.heartbeatService = heartbeatService;
        this.shutdownTimeout = properties.getWorker().getShutdownTimeout();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        try (LoggingContext ctx = LoggingContext.forWorker(scheduler.getWorkerId())) {
            log.info("Initiating graceful shutdown for worker {}", scheduler.getWorkerId());

            boolean drained = scheduler.stop(shutdownTimeout);
            if (!drained) {
                log.warn("Shutdown timeout reached with task {} still executing",
                    scheduler.currentTaskId().orElse("unknown"));
            }

            recoveryService.stop();

            int remaining = heartbeatService.activeCount();
            if (remaining > 0) {
                log.info("Stopping {} remaining heartbeats", remaining);
            }
            heartbeatService.stopAll();

            log.info("Graceful shutdown complete for worker {}", scheduler.getWorkerId());
        }
    }
}
