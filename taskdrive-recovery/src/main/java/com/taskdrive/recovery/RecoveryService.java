package com.taskdrive.recovery;

import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.exception.RaceLostException;
import com.taskdrive.core.model.LockMarker;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskError;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.engine.logging.LoggingContext;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Recovery service reclaiming work abandoned by dead or hung workers.
 *
 * Responsibilities, per pass:
 * - Resolve ids seen under several state suffixes in two consecutive passes
 * - Return RUNNING tasks with a stale or missing marker to PENDING,
 *   or fail them once the retry ceiling is exceeded
 * - Sweep stale markers that no RUNNING descriptor refers to
 * - Remove orphaned temp files
 *
 * Each step tolerates a concurrent recoverer having done it already.
 * Only the RUNNING to PENDING/FAILED edge is ever written here.
 */
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    static final String REASON_MARKER_MISSING = "lock marker missing";
    static final String REASON_HEARTBEAT_STALE = "heartbeat stale";

    private final TaskStore taskStore;
    private final LockManager lockManager;
    private final SchedulerConfig config;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    private Set<String> suspectedDuplicates = new HashSet<>();
    private Set<String> unstampedSightings = new HashSet<>();

    private final Object lifecycle = new Object();
    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public RecoveryService(
            TaskStore taskStore,
            LockManager lockManager,
            SchedulerConfig config,
            Clock clock,
            SchedulerMetrics metrics) {
        this.taskStore = taskStore;
        this.lockManager = lockManager;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Start periodic recovery at {@code recoveryInterval}.
     */
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                log.warn("Recovery service already running");
                return;
            }

            running = true;
            long intervalMs = config.recoveryInterval().toMillis();
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "taskdrive-recovery");
                thread.setDaemon(true);
                return thread;
            });
            executor.scheduleWithFixedDelay(this::runPass, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }

        log.info("Recovery service started (interval={}, lease={}, maxRetries={})",
            config.recoveryInterval(), config.leaseDuration(), config.maxRetries());
    }

    /**
     * Stop periodic recovery, waiting for a pass in progress.
     */
    public void stop() {
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Recovery service stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runPass() {
        if (!running) return;

        try {
            recoverOnce();
        } catch (Exception e) {
            log.error("Error in recovery pass", e);
        }
    }

    /**
     * Run one full recovery pass.
     */
    public synchronized RecoveryReport recoverOnce() {
        Counts counts = new Counts();

        try (LoggingContext ctx = LoggingContext.forWorker(config.workerId())) {
            try {
                resolveDuplicates(counts);
            } catch (Exception e) {
                log.error("Error in duplicate resolution", e);
            }

            try {
                reclaimStaleTasks(counts);
            } catch (Exception e) {
                log.error("Error in stale task recovery", e);
            }

            try {
                sweepOrphanedMarkers(counts);
            } catch (Exception e) {
                log.error("Error in marker sweep", e);
            }

            try {
                counts.tempFilesRemoved = taskStore.cleanupTempFiles(config.tempFileMaxAge());
            } catch (Exception e) {
                log.error("Error in temp file cleanup", e);
            }

            try {
                taskStore.countByState();
            } catch (Exception e) {
                log.warn("Failed to sync state gauges: {}", e.getMessage());
            }
        }

        RecoveryReport report = counts.toReport();
        if (report.hasChanges()) {
            log.info("Recovery pass: {}", report);
        } else {
            log.debug("Recovery pass: {}", report);
        }
        return report;
    }

    /**
     * Reclaim a single task if it is RUNNING with a stale or missing marker.
     * Calling this for a task that is not RUNNING changes nothing.
     *
     * @return true if this call moved the task
     */
    public synchronized boolean reclaim(String taskId) {
        Optional<Task> task = taskStore.find(taskId, TaskState.RUNNING);
        if (task.isEmpty()) {
            return false;
        }
        Counts counts = new Counts();
        reclaimIfStale(task.get(), counts, unstampedSightings);
        return counts.reclaimed + counts.exhausted > 0;
    }

    // ========== Stale Tasks ==========

    private void reclaimStaleTasks(Counts counts) {
        List<Task> runningTasks = taskStore.list(TaskState.RUNNING);
        counts.scanned = runningTasks.size();
        Set<String> sightings = new HashSet<>();

        for (Task task : runningTasks) {
            try {
                reclaimIfStale(task, counts, sightings);
            } catch (Exception e) {
                log.error("Failed to recover task: {}", task.id(), e);
            }
        }

        unstampedSightings = sightings;
    }

    /**
     * @param sightings collects ids seen with neither marker nor claim stamps,
     *                  which are reclaimed only if already in {@code unstampedSightings}
     */
    private void reclaimIfStale(Task task, Counts counts, Set<String> sightings) {
        Instant now = clock.instant();
        Duration lease = config.leaseDuration();
        Optional<LockMarker> marker = lockManager.read(task.id());

        String reason;
        if (marker.isEmpty()) {
            // a marker may not have propagated yet; the descriptor's own stamps must agree
            Instant lastSign = task.heartbeatAt() != null ? task.heartbeatAt() : task.startedAt();
            if (lastSign == null && !unstampedSightings.contains(task.id())) {
                // renamed to RUNNING, owner stamp and marker still in flight
                sightings.add(task.id());
                log.debug("Task {} RUNNING without marker or claim stamp, re-checking next pass", task.id());
                return;
            }
            if (lastSign != null && Duration.between(lastSign, now).compareTo(lease) <= 0) {
                return;
            }
            reason = REASON_MARKER_MISSING;
        } else if (marker.get().isStale(now, lease)) {
            reason = REASON_HEARTBEAT_STALE + " since " + marker.get().lastHeartbeat();
        } else {
            return;
        }

        try (LoggingContext ctx = LoggingContext.forTask(config.workerId(), task.id(), task.retryCount())) {
            try {
                if (marker.isPresent()) {
                    lockManager.forceRelease(task.id());
                }

                Task reclaimed = task.withReclaimed(reason, now);
                if (reclaimed.retryCount() > config.maxRetries()) {
                    TaskError error = TaskError.retriesExhausted(reclaimed.retryCount(), config.maxRetries());
                    taskStore.writeTerminal(reclaimed.withFailed(error, now));
                    counts.exhausted++;
                    metrics.retriesExhausted();
                    log.warn("Task {} failed after {} reclaims (owner was {}, {})",
                        task.id(), reclaimed.retryCount(), task.owner(), reason);
                } else {
                    taskStore.update(reclaimed);
                    taskStore.transition(reclaimed, TaskState.RUNNING, TaskState.PENDING);
                    counts.reclaimed++;
                    metrics.taskReclaimed();
                    log.info("Reclaimed task {} to PENDING (retry {}/{}, owner was {}, {})",
                        task.id(), reclaimed.retryCount(), config.maxRetries(), task.owner(), reason);
                }
            } catch (RaceLostException e) {
                counts.raceLost++;
                log.debug("Task {} already moved by another actor: {}", task.id(), e.getMessage());
            }
        }
    }

    // ========== Duplicates ==========

    private void resolveDuplicates(Counts counts) {
        Map<String, Set<TaskState>> duplicates = taskStore.findDuplicates();
        Set<String> stillSuspected = new HashSet<>();

        for (Map.Entry<String, Set<TaskState>> entry : duplicates.entrySet()) {
            String taskId = entry.getKey();
            if (!suspectedDuplicates.contains(taskId)) {
                // first sighting may be a rename still propagating
                stillSuspected.add(taskId);
                log.debug("Task {} visible under {}, re-checking next pass", taskId, entry.getValue());
                continue;
            }
            try {
                counts.duplicatesResolved += resolveDuplicate(taskId, entry.getValue());
            } catch (Exception e) {
                log.error("Failed to resolve duplicate task: {}", taskId, e);
                stillSuspected.add(taskId);
            }
        }

        suspectedDuplicates = stillSuspected;
    }

    private int resolveDuplicate(String taskId, Set<TaskState> seen) {
        List<TaskState> present = seen.stream()
            .filter(state -> copyExists(taskId, state))
            .sorted(Comparator.comparingInt(TaskState::precedence).reversed()
                .thenComparingInt(TaskState::ordinal))
            .collect(Collectors.toList());
        if (present.size() < 2) {
            return 0;
        }

        TaskState keep = present.get(0);
        int removed = 0;
        for (TaskState state : present.subList(1, present.size())) {
            if (taskStore.delete(taskId, state)) {
                removed++;
                metrics.duplicateResolved();
                log.warn("Removed duplicate {} copy of task {}, keeping {}", state, taskId, keep);
            }
        }
        return removed;
    }

    private boolean copyExists(String taskId, TaskState state) {
        try {
            return taskStore.find(taskId, state).isPresent();
        } catch (MalformedDescriptorException e) {
            return true;
        }
    }

    // ========== Orphaned Markers ==========

    private void sweepOrphanedMarkers(Counts counts) {
        Instant now = clock.instant();
        for (String taskId : lockManager.listMarkedTaskIds()) {
            if (copyExists(taskId, TaskState.RUNNING)) {
                continue;
            }
            Optional<LockMarker> marker = lockManager.read(taskId);
            if (marker.isPresent() && marker.get().isStale(now, config.leaseDuration())
                    && lockManager.forceRelease(taskId)) {
                counts.markersSwept++;
                log.info("Swept orphaned marker for task {} (owner {})", taskId, marker.get().ownerId());
            }
        }
    }

    private static final class Counts {
        int scanned;
        int reclaimed;
        int exhausted;
        int raceLost;
        int duplicatesResolved;
        int markersSwept;
        int tempFilesRemoved;

        RecoveryReport toReport() {
            return new RecoveryReport(scanned, reclaimed, exhausted, raceLost,
                duplicatesResolved, markersSwept, tempFilesRemoved);
        }
    }
}
