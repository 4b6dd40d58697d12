package com.taskdrive.worker;

import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.exception.RaceLostException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskProgress;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.engine.logging.LoggingContext;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the lock markers of running tasks fresh.
 *
 * Beats run on their own scheduler threads so a busy handler never starves
 * its own lease. Each beat renews the marker and mirrors the timestamp into
 * the RUNNING descriptor. A failed renewal means another actor owns the
 * marker now: the lease is flagged lost and the beat stops.
 */
public class HeartbeatService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final LockManager lockManager;
    private final TaskStore taskStore;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    private final ScheduledExecutorService heartbeatScheduler;

    private final Map<String, Handle> active = new ConcurrentHashMap<>();

    public HeartbeatService(LockManager lockManager, TaskStore taskStore, Clock clock, SchedulerMetrics metrics) {
        this.lockManager = lockManager;
        this.taskStore = taskStore;
        this.clock = clock;
        this.metrics = metrics;
        this.heartbeatScheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "taskdrive-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Begin renewing the marker of {@code taskId} every {@code interval}.
     * Starting an already active task replaces its previous schedule.
     */
    public void start(String taskId, String ownerId, Duration interval) {
        stop(taskId);

        Handle handle = new Handle(taskId, ownerId);
        active.put(taskId, handle);
        long intervalMs = interval.toMillis();
        handle.future = heartbeatScheduler.scheduleAtFixedRate(
            () -> runScheduledBeat(handle),
            intervalMs, intervalMs, TimeUnit.MILLISECONDS
        );
        log.debug("Heartbeat started for task {} every {}", taskId, interval);
    }

    /**
     * Halt heartbeats for {@code taskId}, waiting for a beat in progress.
     * Safe to call for tasks that were never started or already stopped.
     *
     * @return true if a renewal had found the marker gone or taken
     */
    public boolean stop(String taskId) {
        Handle handle = active.remove(taskId);
        if (handle == null) {
            return false;
        }
        if (handle.future != null) {
            handle.future.cancel(false);
        }
        boolean leaseLost;
        synchronized (handle) {
            handle.stopped = true;
            leaseLost = handle.leaseLost;
        }
        log.debug("Heartbeat stopped for task {}", taskId);
        return leaseLost;
    }

    /**
     * Send one heartbeat immediately.
     *
     * @return true if the marker was renewed
     */
    public boolean beat(String taskId) {
        Handle handle = active.get(taskId);
        if (handle == null) {
            return false;
        }
        return beat(handle);
    }

    /**
     * Merge progress into the RUNNING descriptor of a task this process holds.
     *
     * @return true if recorded
     */
    public boolean reportProgress(String taskId, Double percentage, String status) {
        Handle handle = active.get(taskId);
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            if (handle.stopped || handle.leaseLost) {
                return false;
            }
            try {
                Optional<Task> running = ownedDescriptor(handle);
                if (running.isEmpty()) {
                    return false;
                }
                taskStore.update(running.get().withProgress(TaskProgress.of(percentage, status, clock.instant())));
                return true;
            } catch (RaceLostException e) {
                log.debug("Progress for task {} dropped: {}", taskId, e.getMessage());
                return false;
            } catch (StorageException | MalformedDescriptorException e) {
                log.warn("Could not record progress for task {}: {}", taskId, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Whether a renewal for the active task {@code taskId} found the marker gone or taken.
     */
    public boolean isLeaseLost(String taskId) {
        Handle handle = active.get(taskId);
        return handle != null && handle.leaseLost;
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Stop every active heartbeat.
     */
    public void stopAll() {
        for (String taskId : active.keySet()) {
            stop(taskId);
        }
    }

    @Override
    public void close() {
        stopAll();
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runScheduledBeat(Handle handle) {
        try (LoggingContext ctx = LoggingContext.forWorker(handle.ownerId)) {
            beat(handle);
        } catch (Exception e) {
            log.error("Error in heartbeat for task {}", handle.taskId, e);
        }
    }

    private boolean beat(Handle handle) {
        synchronized (handle) {
            if (handle.stopped || handle.leaseLost) {
                return false;
            }

            boolean renewed;
            try {
                renewed = lockManager.renew(handle.taskId, handle.ownerId);
            } catch (StorageException e) {
                // the next beat may still land inside the lease
                log.warn("Heartbeat write failed for task {}: {}", handle.taskId, e.getMessage());
                metrics.leaseRenewed(false);
                return false;
            }

            metrics.leaseRenewed(renewed);
            if (!renewed) {
                handle.leaseLost = true;
                metrics.leaseLost();
                if (handle.future != null) {
                    handle.future.cancel(false);
                }
                log.warn("Lease lost for task {}: marker gone or owned by another worker", handle.taskId);
                return false;
            }

            mirrorHeartbeat(handle);
            return true;
        }
    }

    private void mirrorHeartbeat(Handle handle) {
        try {
            Optional<Task> running = ownedDescriptor(handle);
            if (running.isPresent()) {
                taskStore.update(running.get().withHeartbeat(clock.instant()));
            }
        } catch (RaceLostException e) {
            log.debug("Descriptor of task {} moved during heartbeat", handle.taskId);
        } catch (StorageException | MalformedDescriptorException e) {
            // the marker is authoritative, the descriptor copy is informational
            log.warn("Could not mirror heartbeat into descriptor of task {}: {}", handle.taskId, e.getMessage());
        }
    }

    private Optional<Task> ownedDescriptor(Handle handle) {
        return taskStore.find(handle.taskId, TaskState.RUNNING)
            .filter(task -> task.isOwnedBy(handle.ownerId));
    }

    private static final class Handle {
        final String taskId;
        final String ownerId;
        volatile ScheduledFuture<?> future;
        boolean stopped;
        volatile boolean leaseLost;

        Handle(String taskId, String ownerId) {
            this.taskId = taskId;
            this.ownerId = ownerId;
        }
    }
}
