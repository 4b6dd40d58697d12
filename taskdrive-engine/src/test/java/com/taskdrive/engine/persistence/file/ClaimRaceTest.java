package com.taskdrive.engine.persistence.file;

import com.taskdrive.core.model.BackoffPolicy;
import com.taskdrive.core.repository.LockManager;
import com.taskdrive.engine.persistence.StorageLockManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Two workers, each with its own adapter over the same directory, racing for one marker.
 */
class ClaimRaceTest {

    @TempDir
    Path root;

    @RepeatedTest(10)
    @DisplayName("Exactly one concurrent claimant wins, the loser sees false")
    void testConcurrentClaim() throws Exception {
        LockManager first = new StorageLockManager(adapter(), Clock.systemUTC());
        LockManager second = new StorageLockManager(adapter(), Clock.systemUTC());
        CyclicBarrier start = new CyclicBarrier(2);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            results.add(pool.submit(claim(first, "worker-a", start)));
            results.add(pool.submit(claim(second, "worker-b", start)));

            boolean a = results.get(0).get(10, TimeUnit.SECONDS);
            boolean b = results.get(1).get(10, TimeUnit.SECONDS);

            assertThat(a ^ b).as("exactly one winner (a=%s, b=%s)", a, b).isTrue();
            String winner = a ? "worker-a" : "worker-b";
            assertThat(first.read("task-1").orElseThrow().ownerId()).isEqualTo(winner);
        } finally {
            pool.shutdownNow();
        }
    }

    private FileStorageAdapter adapter() {
        return new FileStorageAdapter(root, BackoffPolicy.defaultPolicy(), Clock.systemUTC());
    }

    private static Callable<Boolean> claim(LockManager locks, String owner, CyclicBarrier start) {
        return () -> {
            start.await(5, TimeUnit.SECONDS);
            return locks.tryAcquire("task-1", owner, Duration.ofSeconds(30));
        };
    }
}
