package com.taskdrive.engine.metrics;

import com.taskdrive.core.model.TaskState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for workers and recovery.
 *
 * Metrics exposed:
 * - Descriptor counts by state (gauges, synced from listings)
 * - Claim outcomes
 * - Task completions, failures and durations
 * - Lease renewals and losses
 * - Reclaims and exhausted retries
 * - Malformed descriptors skipped
 *
 * Until bound to an application registry, meters go to a private
 * {@link SimpleMeterRegistry}.
 */
public class SchedulerMetrics implements MeterBinder {

    // Metric names
    public static final String TASK_COUNT = "taskdrive.tasks";
    public static final String CLAIMS = "taskdrive.claims";
    public static final String TASKS_COMPLETED = "taskdrive.tasks.completed";
    public static final String TASKS_FAILED = "taskdrive.tasks.failed";
    public static final String TASK_DURATION = "taskdrive.task.duration";
    public static final String LEASE_RENEWALS = "taskdrive.lease.renewals";
    public static final String LEASES_LOST = "taskdrive.lease.lost";
    public static final String RECLAIMED = "taskdrive.recovery.reclaimed";
    public static final String RETRIES_EXHAUSTED = "taskdrive.recovery.exhausted";
    public static final String DUPLICATES_RESOLVED = "taskdrive.recovery.duplicates";
    public static final String MALFORMED = "taskdrive.descriptors.malformed";

    private volatile MeterRegistry registry;

    private final Map<TaskState, AtomicInteger> stateGauges = new EnumMap<>(TaskState.class);

    public SchedulerMetrics() {
        for (TaskState state : TaskState.values()) {
            stateGauges.put(state, new AtomicInteger(0));
        }
        bindTo(new SimpleMeterRegistry());
    }

    public SchedulerMetrics(MeterRegistry registry) {
        this();
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (Map.Entry<TaskState, AtomicInteger> entry : stateGauges.entrySet()) {
            Gauge.builder(TASK_COUNT, entry.getValue(), AtomicInteger::get)
                .tag("state", entry.getKey().name())
                .description("Number of task descriptors in " + entry.getKey() + " state")
                .register(registry);
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ========== Claim Metrics ==========

    public void claimAcquired() {
        claim("acquired");
    }

    public void claimLost() {
        claim("lost");
    }

    private void claim(String outcome) {
        Counter.builder(CLAIMS)
            .tag("outcome", outcome)
            .description("Claim attempts by outcome")
            .register(registry)
            .increment();
    }

    // ========== Task Metrics ==========

    public void taskCompleted(long durationMs) {
        Counter.builder(TASKS_COMPLETED)
            .description("Tasks finalized as done")
            .register(registry)
            .increment();

        recordDuration("success", durationMs);
    }

    public void taskFailed(String errorCode, long durationMs) {
        Counter.builder(TASKS_FAILED)
            .tag("error_code", errorCode != null ? errorCode : "unknown")
            .description("Tasks finalized as failed by their handler")
            .register(registry)
            .increment();

        recordDuration("failure", durationMs);
    }

    private void recordDuration(String outcome, long durationMs) {
        Timer.builder(TASK_DURATION)
            .tag("outcome", outcome)
            .description("Handler execution duration")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    // ========== Lease Metrics ==========

    public void leaseRenewed(boolean success) {
        Counter.builder(LEASE_RENEWALS)
            .tag("success", String.valueOf(success))
            .description("Heartbeat renewal attempts")
            .register(registry)
            .increment();
    }

    public void leaseLost() {
        Counter.builder(LEASES_LOST)
            .description("Leases found taken or missing by their owner")
            .register(registry)
            .increment();
    }

    // ========== Recovery Metrics ==========

    public void taskReclaimed() {
        Counter.builder(RECLAIMED)
            .description("Stale tasks returned to pending")
            .register(registry)
            .increment();
    }

    public void retriesExhausted() {
        Counter.builder(RETRIES_EXHAUSTED)
            .description("Stale tasks failed after exceeding the retry ceiling")
            .register(registry)
            .increment();
    }

    public void duplicateResolved() {
        Counter.builder(DUPLICATES_RESOLVED)
            .description("Duplicate descriptor copies removed")
            .register(registry)
            .increment();
    }

    public void malformedDescriptor() {
        Counter.builder(MALFORMED)
            .description("Unparseable descriptors skipped")
            .register(registry)
            .increment();
    }

    // ========== Gauges ==========

    /**
     * Update state gauges from a fresh count of the store.
     */
    public void syncStateCounts(Map<TaskState, Integer> counts) {
        for (Map.Entry<TaskState, AtomicInteger> entry : stateGauges.entrySet()) {
            entry.getValue().set(counts.getOrDefault(entry.getKey(), 0));
        }
    }

    public int stateCount(TaskState state) {
        return stateGauges.get(state).get();
    }
}
