package com.taskdrive.core.test;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure injection for storage chaos tests.
 * Fails either a fixed number of upcoming calls or every call.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector renames = FailureInjector.failNext(2);
 * storage.setFaults((op, path) -> {
 *     if (op.equals("rename")) renames.maybeThrow(() -> new IOException("injected"));
 * });
 * 
 * storage.writeAtomic("tasks/a.todo", bytes);  // survives two failed renames
 * assertThat(renames.getFailureCount()).isEqualTo(2);
 * }</pre>
 */
public class FailureInjector {

    private final double failureRate;
    private final Random random;
    private final AtomicInteger remainingForcedFailures;
    private final AtomicInteger failureCount;
    private final AtomicInteger invocationCount;

    private FailureInjector(double failureRate, int forcedFailures, long seed) {
        this.failureRate = failureRate;
        this.random = new Random(seed);
        this.remainingForcedFailures = new AtomicInteger(forcedFailures);
        this.failureCount = new AtomicInteger(0);
        this.invocationCount = new AtomicInteger(0);
    }

    /**
     * Fail the next {@code count} invocations, then succeed.
     */
    public static FailureInjector failNext(int count) {
        return new FailureInjector(0.0, count, 42L);
    }

    /**
     * Create an injector that always fails.
     */
    public static FailureInjector alwaysFail() {
        return new FailureInjector(1.0, 0, 42L);
    }

    /**
     * Throw the supplied exception if this invocation should fail.
     */
    public <T extends Exception> void maybeThrow(Supplier<T> exceptionSupplier) throws T {
        if (shouldFail()) {
            throw exceptionSupplier.get();
        }
    }

    /**
     * Decide whether this invocation fails, counting it.
     */
    public synchronized boolean shouldFail() {
        invocationCount.incrementAndGet();
        boolean fail = remainingForcedFailures.get() > 0
            ? remainingForcedFailures.getAndDecrement() > 0
            : random.nextDouble() < failureRate;
        if (fail) {
            failureCount.incrementAndGet();
        }
        return fail;
    }

    /**
     * Get the number of failures injected.
     */
    public int getFailureCount() {
        return failureCount.get();
    }

    /**
     * Get the number of invocations seen.
     */
    public int getInvocationCount() {
        return invocationCount.get();
    }
}
