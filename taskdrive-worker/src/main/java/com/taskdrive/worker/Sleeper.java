package com.taskdrive.worker;

import java.time.Duration;

/**
 * Suspension point of the scheduling loop. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
