package com.taskdrive.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdrive.core.config.SchedulerConfig;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.exception.RaceLostException;
import com.taskdrive.core.exception.StorageException;
import com.taskdrive.core.model.BackoffPolicy;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskError;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.engine.logging.LoggingContext;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import com.taskdrive.recovery.RecoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One worker's scheduling loop, as an explicit state machine:
 * IDLE -> CLAIMING -> EXECUTING -> FINALIZING -> IDLE.
 *
 * Usage:
 * <pre>
 * Scheduler scheduler = Scheduler.builder()
 *     .config(config)
 *     .taskStore(store)
 *     .lockManager(locks)
 *     .heartbeatService(heartbeats)
 *     .handler(context -> Map.of("ok", true))
 *     .build();
 * scheduler.start();
 * </pre>
 *
 * {@link #step()} advances exactly one transition, so tests can drive the
 * machine with a fake clock and storage. Handler failures of any kind end
 * the task FAILED; they never escape the loop.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    public static final String RESULT_NOT_SERIALIZABLE = "RESULT_NOT_SERIALIZABLE";

    private final SchedulerConfig config;
    private final TaskStore taskStore;
    private final LockManager lockManager;
    private final HeartbeatService heartbeatService;
    private final TaskHandler handler;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final RecoveryService recoveryService;
    private final Sleeper sleeper;
    private final BackoffPolicy idleBackoff;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Object lifecycle = new Object();
    private Thread loopThread;

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile boolean stopRequested = false;
    private volatile Task current;

    private final Deque<Task> candidates = new ArrayDeque<>();
    private Outcome outcome;
    private Task lastFinalized;
    private int idlePolls;
    private boolean backoffBeforePoll;
    private Instant lastRecoveryAt;

    private Scheduler(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
        this.lockManager = Objects.requireNonNull(builder.lockManager, "lockManager");
        this.heartbeatService = Objects.requireNonNull(builder.heartbeatService, "heartbeatService");
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : new SchedulerMetrics();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.recoveryService = builder.recoveryService;
        this.sleeper = builder.sleeper != null
            ? builder.sleeper
            : duration -> stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        this.idleBackoff = BackoffPolicy.builder()
            .maxAttempts(Integer.MAX_VALUE)
            .initialBackoff(config.pollInterval())
            .maxBackoff(config.maxPollBackoff())
            .backoffMultiplier(2.0)
            .jitterFactor(0.2)
            .build();
    }

    // ========== Lifecycle ==========

    /**
     * Run the loop on a background thread until {@link #stop} is called.
     */
    public void start() {
        synchronized (lifecycle) {
            if (loopThread != null) {
                log.warn("Scheduler for worker {} already started", config.workerId());
                return;
            }
            loopThread = new Thread(this::runLoop, "taskdrive-scheduler");
            loopThread.start();
        }
        log.info("Scheduler started for worker {} (poll={}, lease={}, heartbeat={})",
            config.workerId(), config.pollInterval(), config.leaseDuration(), config.heartbeatInterval());
    }

    /**
     * Stop polling and wait up to {@code timeout} for an in-flight task to finalize.
     *
     * @return true if the loop has exited
     */
    public boolean stop(Duration timeout) {
        stopRequested = true;
        stopSignal.countDown();

        Thread thread;
        synchronized (lifecycle) {
            thread = loopThread;
        }
        if (thread == null) {
            return true;
        }

        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (thread.isAlive()) {
            Task inFlight = current;
            log.warn("Scheduler did not stop within {}; task {} still in flight",
                timeout, inFlight != null ? inFlight.id() : "none");
            return false;
        }
        log.info("Scheduler stopped for worker {}", config.workerId());
        return true;
    }

    public boolean isRunning() {
        synchronized (lifecycle) {
            return loopThread != null && loopThread.isAlive();
        }
    }

    private void runLoop() {
        try (LoggingContext ctx = LoggingContext.forWorker(config.workerId())) {
            while (state != SchedulerState.STOPPED) {
                step();
            }
        }
    }

    // ========== State Machine ==========

    public SchedulerState state() {
        return state;
    }

    public String getWorkerId() {
        return config.workerId();
    }

    /**
     * Id of the task currently claimed by this worker, if any.
     */
    public Optional<String> currentTaskId() {
        Task task = current;
        return task == null ? Optional.empty() : Optional.of(task.id());
    }

    /**
     * Advance exactly one transition.
     *
     * @return the state after the transition
     */
    public synchronized SchedulerState step() {
        if (stopRequested && !state.holdsTask() && state != SchedulerState.STOPPED) {
            candidates.clear();
            state = SchedulerState.STOPPED;
            return state;
        }

        try {
            state = switch (state) {
                case IDLE -> idle(true);
                case CLAIMING -> claiming();
                case EXECUTING -> executing();
                case FINALIZING -> finalizing();
                case STOPPED -> SchedulerState.STOPPED;
            };
        } catch (RuntimeException e) {
            log.error("Error in scheduler state {}", state, e);
            abandonCurrent();
            state = SchedulerState.IDLE;
        } catch (Error e) {
            log.error("Fatal error in scheduler state {}, stopping worker {}", state, config.workerId(), e);
            abandonCurrent();
            stopRequested = true;
            state = SchedulerState.STOPPED;
            throw e;
        }
        return state;
    }

    /**
     * Claim, execute and finalize at most one task without idle sleeping.
     *
     * @return the terminal descriptor written, empty if nothing was claimed
     *         or the outcome had to be discarded
     */
    public synchronized Optional<Task> runOnce() {
        if (state == SchedulerState.STOPPED || stopRequested) {
            return Optional.empty();
        }
        if (state != SchedulerState.IDLE) {
            throw new IllegalStateException("runOnce requires an IDLE scheduler, was " + state);
        }
        lastFinalized = null;
        try {
            state = idle(false);
        } catch (RuntimeException e) {
            log.error("Error polling pending tasks", e);
            return Optional.empty();
        }
        while (state == SchedulerState.CLAIMING || state.holdsTask()) {
            step();
        }
        return Optional.ofNullable(lastFinalized);
    }

    // ========== IDLE ==========

    private SchedulerState idle(boolean sleepWhenEmpty) {
        if (sleepWhenEmpty && backoffBeforePoll) {
            backoffBeforePoll = false;
            pause(nextIdleBackoff());
        }
        maybeRecover();

        List<Task> pending;
        try {
            pending = taskStore.list(TaskState.PENDING);
        } catch (StorageException e) {
            log.warn("Could not list pending tasks: {}", e.getMessage());
            if (sleepWhenEmpty) {
                pause(nextIdleBackoff());
            }
            return SchedulerState.IDLE;
        }

        if (pending.isEmpty()) {
            if (sleepWhenEmpty) {
                Duration backoff = nextIdleBackoff();
                log.debug("No pending tasks, sleeping {}", backoff);
                pause(backoff);
            }
            return SchedulerState.IDLE;
        }

        candidates.clear();
        candidates.addAll(pending);
        return SchedulerState.CLAIMING;
    }

    private void maybeRecover() {
        if (recoveryService == null) {
            return;
        }
        Instant now = clock.instant();
        if (lastRecoveryAt != null
                && Duration.between(lastRecoveryAt, now).compareTo(config.recoveryInterval()) < 0) {
            return;
        }
        lastRecoveryAt = now;
        try {
            recoveryService.recoverOnce();
        } catch (Exception e) {
            log.error("Error in embedded recovery pass", e);
        }
    }

    private Duration nextIdleBackoff() {
        idlePolls = Math.min(idlePolls + 1, 32);
        return idleBackoff.computeBackoff(idlePolls);
    }

    // ========== CLAIMING ==========

    private SchedulerState claiming() {
        while (!candidates.isEmpty() && !stopRequested) {
            Task candidate = candidates.poll();
            Optional<Task> claimed = claim(candidate);
            if (claimed.isPresent()) {
                candidates.clear();
                current = claimed.get();
                idlePolls = 0;
                return SchedulerState.EXECUTING;
            }
        }
        candidates.clear();
        backoffBeforePoll = true;
        return SchedulerState.IDLE;
    }

    private Optional<Task> claim(Task candidate) {
        String taskId = candidate.id();
        String workerId = config.workerId();

        boolean acquired;
        int attempt = 1;
        while (true) {
            try {
                acquired = lockManager.tryAcquire(taskId, workerId, config.leaseDuration());
                break;
            } catch (StorageException e) {
                if (attempt >= config.claimAttempts() || stopRequested) {
                    log.warn("Giving up claim of task {} after {} attempts: {}", taskId, attempt, e.getMessage());
                    metrics.claimLost();
                    return Optional.empty();
                }
                log.debug("Claim attempt {} for task {} failed: {}", attempt, taskId, e.getMessage());
                pause(config.storageRetryPolicy().computeBackoff(attempt));
                attempt++;
            }
        }

        if (!acquired) {
            metrics.claimLost();
            log.debug("Task {} is held by another worker", taskId);
            return Optional.empty();
        }

        try {
            taskStore.transition(candidate, TaskState.PENDING, TaskState.RUNNING);
            // re-read: the listed copy may predate a reclaim
            Task running = taskStore.find(taskId, TaskState.RUNNING)
                .orElseThrow(() -> new RaceLostException(taskId, "no longer RUNNING"));
            Task claimed = taskStore.update(running.withClaimed(workerId, clock.instant()));
            heartbeatService.start(taskId, workerId, config.heartbeatInterval());
            metrics.claimAcquired();
            log.info("Claimed task {} (priority {}, retry {})", taskId, claimed.priority(), claimed.retryCount());
            return Optional.of(claimed);
        } catch (RaceLostException e) {
            lockManager.release(taskId, workerId);
            metrics.claimLost();
            log.debug("Lost race for task {}: {}", taskId, e.getMessage());
            return Optional.empty();
        } catch (StorageException | MalformedDescriptorException e) {
            lockManager.release(taskId, workerId);
            metrics.claimLost();
            log.warn("Claim of task {} failed: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    // ========== EXECUTING ==========

    private SchedulerState executing() {
        Task task = current;
        try (LoggingContext ctx = LoggingContext.forTask(config.workerId(), task.id(), task.retryCount())) {
            log.info("Executing task {} (retry {})", task.id(), task.retryCount());

            TaskContext context = new TaskContext(
                task,
                config.workerId(),
                objectMapper,
                () -> heartbeatService.beat(task.id()),
                (percentage, status) -> heartbeatService.reportProgress(task.id(), percentage, status)
            );

            try {
                Map<String, Object> result = handler.execute(context);
                outcome = Outcome.completed(result);
                log.info("Task {} completed successfully", task.id());

            } catch (TaskExecutionException e) {
                log.warn("Task {} failed: {} - {}", task.id(), e.getErrorCode(), e.getMessage());
                outcome = Outcome.failed(new TaskError(e.getErrorCode(), e.getMessage(), e.getClass().getName()));

            } catch (Exception e) {
                log.error("Task {} failed with unexpected error", task.id(), e);
                outcome = Outcome.failed(TaskError.fromThrowable(e));

            } catch (VirtualMachineError e) {
                throw e;

            } catch (Error e) {
                log.error("Task {} failed with error", task.id(), e);
                outcome = Outcome.failed(TaskError.fromThrowable(e));
            }
        }
        return SchedulerState.FINALIZING;
    }

    // ========== FINALIZING ==========

    private SchedulerState finalizing() {
        Task task = current;
        Outcome result = outcome;
        current = null;
        outcome = null;

        try (LoggingContext ctx = LoggingContext.forTask(config.workerId(), task.id(), task.retryCount())) {
            boolean leaseLost = heartbeatService.stop(task.id());
            lastFinalized = finalizeTask(task, result, leaseLost);
        }
        return SchedulerState.IDLE;
    }

    private Task finalizeTask(Task task, Outcome result, boolean leaseLost) {
        String taskId = task.id();
        String workerId = config.workerId();

        if (leaseLost || !lockManager.isHeldBy(taskId, workerId)) {
            if (!leaseLost) {
                metrics.leaseLost();
            }
            log.warn("Lease on task {} was lost during execution, discarding {} outcome", taskId, result.state());
            return null;
        }

        try {
            Optional<Task> latest = taskStore.find(taskId, TaskState.RUNNING)
                .filter(running -> running.isOwnedBy(workerId));
            if (latest.isEmpty()) {
                log.warn("Task {} is no longer recorded as ours, discarding {} outcome", taskId, result.state());
                return null;
            }

            Instant now = clock.instant();
            Task written = writeOutcome(latest.get(), result, now);
            long durationMs = written.durationMillis() != null ? written.durationMillis() : 0L;
            if (written.state() == TaskState.DONE) {
                metrics.taskCompleted(durationMs);
            } else {
                metrics.taskFailed(written.error().code(), durationMs);
            }
            log.info("Task {} finished {} in {}ms", taskId, written.state(), durationMs);
            return written;

        } catch (RaceLostException e) {
            log.warn("Task {} moved by another actor before finalization: {}", taskId, e.getMessage());
            return null;
        } catch (StorageException | MalformedDescriptorException e) {
            log.error("Could not finalize task {}, recovery will reclaim it", taskId, e);
            return null;
        } finally {
            lockManager.release(taskId, workerId);
        }
    }

    private Task writeOutcome(Task latest, Outcome result, Instant now) {
        try {
            return taskStore.writeTerminal(result.applyTo(latest, now));
        } catch (IllegalArgumentException e) {
            log.error("Result of task {} cannot be stored", latest.id(), e);
            TaskError error = new TaskError(RESULT_NOT_SERIALIZABLE, e.getMessage(), e.getClass().getName());
            return taskStore.writeTerminal(latest.withFailed(error, now));
        } catch (StorageException e) {
            if (result.state() == TaskState.FAILED) {
                throw e;
            }
            log.error("Could not record DONE for task {}, recording FAILED instead", latest.id(), e);
            TaskError error = new TaskError(StorageException.ERROR_CODE, e.getMessage(), e.getClass().getName());
            return taskStore.writeTerminal(latest.withFailed(error, now));
        }
    }

    private void abandonCurrent() {
        Task task = current;
        candidates.clear();
        outcome = null;
        current = null;
        if (task != null) {
            // heartbeat stops, the marker goes stale and recovery takes over
            heartbeatService.stop(task.id());
            log.warn("Abandoned task {} after scheduler error", task.id());
        }
    }

    private void pause(Duration duration) {
        if (stopRequested) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    /**
     * Handler result or error, waiting to be written.
     */
    private record Outcome(Map<String, Object> result, TaskError error) {

        static Outcome completed(Map<String, Object> result) {
            return new Outcome(result, null);
        }

        static Outcome failed(TaskError error) {
            return new Outcome(null, error);
        }

        TaskState state() {
            return error == null ? TaskState.DONE : TaskState.FAILED;
        }

        Task applyTo(Task running, Instant now) {
            return error == null ? running.withCompleted(result, now) : running.withFailed(error, now);
        }
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SchedulerConfig config;
        private TaskStore taskStore;
        private LockManager lockManager;
        private HeartbeatService heartbeatService;
        private TaskHandler handler;
        private Clock clock;
        private SchedulerMetrics metrics;
        private ObjectMapper objectMapper;
        private RecoveryService recoveryService;
        private Sleeper sleeper;

        public Builder config(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder taskStore(TaskStore taskStore) {
            this.taskStore = taskStore;
            return this;
        }

        public Builder lockManager(LockManager lockManager) {
            this.lockManager = lockManager;
            return this;
        }

        public Builder heartbeatService(HeartbeatService heartbeatService) {
            this.heartbeatService = heartbeatService;
            return this;
        }

        public Builder handler(TaskHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(SchedulerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Run recovery passes from the poll loop every {@code recoveryInterval}.
         */
        public Builder recoveryService(RecoveryService recoveryService) {
            this.recoveryService = recoveryService;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Scheduler build() {
            return new Scheduler(this);
        }
    }
}
