package com.taskdrive.engine.persistence;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.InvalidTransitionException;
import com.taskdrive.core.exception.RaceLostException;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.test.TimeController;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import com.taskdrive.engine.persistence.codec.TaskDescriptorCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StorageTaskStoreTest {

    private TimeController time;
    private InMemoryStorageAdapter storage;
    private SchedulerMetrics metrics;
    private StorageTaskStore store;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        storage = new InMemoryStorageAdapter(time);
        metrics = new SchedulerMetrics();
        store = new StorageTaskStore(storage, new TaskDescriptorCodec(), time, metrics);
    }

    @Test
    void create_shouldWritePendingDescriptor() {
        Task task = store.create(Map.of("n", 5));

        assertThat(task.id()).startsWith("task_" + time.now().getEpochSecond() + "_");
        assertThat(storage.paths()).containsExactly("tasks/" + task.id() + ".todo");
        assertThat(store.find(task.id())).contains(task);
    }

    @Test
    void create_shouldRejectDuplicateId() {
        Task task = store.create("job-1", Map.of(), 0);
        store.transition(task, TaskState.PENDING, TaskState.RUNNING);

        assertThatThrownBy(() -> store.create("job-1", Map.of(), 0))
            .isInstanceOf(EntryConflictException.class);
        assertThatThrownBy(() -> store.create("../escape", Map.of(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Listing should order by priority, then creation time")
    void testListOrdering() {
        store.create("low", Map.of(), 0);
        time.advanceSeconds(1);
        store.create("high", Map.of(), 10);
        time.advanceSeconds(1);
        store.create("low-later", Map.of(), 0);

        assertThat(store.list(TaskState.PENDING))
            .extracting(Task::id)
            .containsExactly("high", "low", "low-later");
    }

    @Test
    @DisplayName("Malformed descriptors are skipped and counted, never deleted")
    void testMalformedDescriptorSkipped() {
        store.create("good", Map.of(), 0);
        storage.writeAtomic("tasks/bad.todo", "{{{".getBytes(StandardCharsets.UTF_8));

        assertThat(store.list(TaskState.PENDING)).extracting(Task::id).containsExactly("good");
        assertThat(storage.exists("tasks/bad.todo")).isTrue();
        assertThat(metrics.getRegistry().get(SchedulerMetrics.MALFORMED).counter().count()).isEqualTo(1.0);
    }

    @Test
    void transition_shouldRenameSuffix() {
        Task task = store.create("job-1", Map.of(), 0);

        Task running = store.transition(task, TaskState.PENDING, TaskState.RUNNING);

        assertThat(running.state()).isEqualTo(TaskState.RUNNING);
        assertThat(storage.paths()).containsExactly("tasks/job-1.running");
    }

    @Test
    @DisplayName("Losing a transition race is reported as RaceLostException")
    void testTransitionRaceLost() {
        Task task = store.create("job-1", Map.of(), 0);
        store.transition(task, TaskState.PENDING, TaskState.RUNNING);

        assertThatThrownBy(() -> store.transition(task, TaskState.PENDING, TaskState.RUNNING))
            .isInstanceOf(RaceLostException.class)
            .extracting(e -> ((RaceLostException) e).getTaskId())
            .isEqualTo("job-1");
    }

    @Test
    void transition_shouldRejectIllegalEdges() {
        Task task = store.create("job-1", Map.of(), 0);

        assertThatThrownBy(() -> store.transition(task, TaskState.PENDING, TaskState.DONE))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void update_shouldFailWhenDescriptorMoved() {
        Task task = store.create("job-1", Map.of(), 0);
        Task running = store.transition(task, TaskState.PENDING, TaskState.RUNNING);

        store.update(running.withClaimed("worker-a", time.now()));
        assertThat(store.find("job-1", TaskState.RUNNING).orElseThrow().owner()).isEqualTo("worker-a");

        assertThatThrownBy(() -> store.update(task.withHeartbeat(time.now())))
            .isInstanceOf(RaceLostException.class);
        assertThat(storage.exists("tasks/job-1.todo")).isFalse();
    }

    @Test
    @DisplayName("Terminal descriptor is fully populated once visible")
    void testWriteTerminal() {
        Task claimed = store.update(store.transition(store.create("job-1", Map.of("n", 5), 0),
            TaskState.PENDING, TaskState.RUNNING).withClaimed("worker-a", time.now()));
        time.advanceSeconds(2);

        store.writeTerminal(claimed.withCompleted(Map.of("square", 25), time.now()));

        Task done = store.find("job-1").orElseThrow();
        assertThat(done.state()).isEqualTo(TaskState.DONE);
        assertThat(done.result()).containsEntry("square", 25);
        assertThat(done.durationMillis()).isEqualTo(2000L);
        assertThat(storage.paths()).containsExactly("tasks/job-1.done");
    }

    @Test
    void writeTerminal_shouldFailIfTaskWasReclaimed() {
        Task claimed = store.transition(store.create("job-1", Map.of(), 0), TaskState.PENDING, TaskState.RUNNING)
            .withClaimed("worker-a", time.now());
        store.transition(claimed, TaskState.RUNNING, TaskState.PENDING);

        assertThatThrownBy(() -> store.writeTerminal(claimed.withCompleted(Map.of(), time.now())))
            .isInstanceOf(RaceLostException.class);
        assertThat(storage.paths()).containsExactly("tasks/job-1.todo");
    }

    @Test
    void countByState_shouldSyncGauges() {
        store.create("a", Map.of(), 0);
        store.create("b", Map.of(), 0);
        store.transition(store.create("c", Map.of(), 0), TaskState.PENDING, TaskState.RUNNING);

        Map<TaskState, Integer> counts = store.countByState();

        assertThat(counts).containsEntry(TaskState.PENDING, 2)
            .containsEntry(TaskState.RUNNING, 1)
            .containsEntry(TaskState.DONE, 0);
        assertThat(metrics.stateCount(TaskState.PENDING)).isEqualTo(2);
    }

    @Test
    void listOwnedBy_shouldFilterRunningByOwner() {
        for (String id : new String[]{"a", "b"}) {
            Task running = store.transition(store.create(id, Map.of(), 0), TaskState.PENDING, TaskState.RUNNING);
            store.update(running.withClaimed(id.equals("a") ? "worker-a" : "worker-b", time.now()));
        }

        assertThat(store.listOwnedBy("worker-a")).extracting(Task::id).containsExactly("a");
    }

    @Test
    void findDuplicates_shouldReportIdsUnderSeveralSuffixes() {
        Task task = store.create("job-1", Map.of(), 0);
        storage.writeAtomic("tasks/job-1.running", new TaskDescriptorCodec().encode(task));
        store.create("job-2", Map.of(), 0);

        assertThat(store.findDuplicates())
            .containsOnlyKeys("job-1")
            .containsEntry("job-1", EnumSet.of(TaskState.PENDING, TaskState.RUNNING));

        assertThat(store.delete("job-1", TaskState.PENDING)).isTrue();
        assertThat(store.findDuplicates()).isEmpty();
    }

    @Test
    void cleanupTempFiles_shouldCoverTaskAndLockDirectories() {
        storage.writeAtomic("tasks/.a.todo.1.tmp", new byte[0]);
        storage.writeAtomic("locks/.a.lock.2.tmp", new byte[0]);
        time.advance(Duration.ofHours(2));

        assertThat(store.cleanupTempFiles(Duration.ofHours(1))).isEqualTo(2);
    }
}
