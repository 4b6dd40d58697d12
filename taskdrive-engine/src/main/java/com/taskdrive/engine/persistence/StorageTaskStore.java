package com.taskdrive.engine.persistence;

import com.taskdrive.core.exception.EntryConflictException;
import com.taskdrive.core.exception.EntryNotFoundException;
import com.taskdrive.core.exception.InvalidTransitionException;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.exception.RaceLostException;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskState;
import com.taskdrive.core.repository.TaskStore;
import com.taskdrive.core.storage.StorageAdapter;
import com.taskdrive.engine.metrics.SchedulerMetrics;
import com.taskdrive.engine.persistence.codec.TaskDescriptorCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Task store keeping one descriptor per task under {@code tasks/},
 * named {@code <id>.<suffix>} where the suffix is the task's state.
 */
public class StorageTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(StorageTaskStore.class);

    public static final String TASK_DIR = "tasks";

    private static final Comparator<Task> CLAIM_ORDER = Comparator
        .comparingInt(Task::priority).reversed()
        .thenComparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Task::id);

    private static final List<TaskState> BY_PRECEDENCE = Arrays.stream(TaskState.values())
        .sorted(Comparator.comparingInt(TaskState::precedence).reversed())
        .collect(Collectors.toList());

    private final StorageAdapter storage;
    private final TaskDescriptorCodec codec;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    public StorageTaskStore(StorageAdapter storage, TaskDescriptorCodec codec, Clock clock, SchedulerMetrics metrics) {
        this.storage = storage;
        this.codec = codec;
        this.clock = clock;
        this.metrics = metrics;
        storage.ensureDirectory(TASK_DIR);
    }

    public StorageTaskStore(StorageAdapter storage, Clock clock) {
        this(storage, new TaskDescriptorCodec(), clock, new SchedulerMetrics());
    }

    public static String descriptorPath(String taskId, TaskState state) {
        return TASK_DIR + "/" + taskId + "." + state.suffix();
    }

    // ========== Creation ==========

    @Override
    public Task create(Map<String, Object> payload) {
        return create(payload, 0);
    }

    @Override
    public Task create(Map<String, Object> payload, int priority) {
        return create(Task.newId(clock.instant()), payload, priority);
    }

    @Override
    public Task create(String taskId, Map<String, Object> payload, int priority) {
        validateId(taskId);
        for (TaskState state : TaskState.values()) {
            if (storage.exists(descriptorPath(taskId, state))) {
                throw new EntryConflictException(descriptorPath(taskId, state));
            }
        }
        Task task = Task.create(taskId, payload, priority, clock.instant());
        storage.writeExclusive(descriptorPath(taskId, TaskState.PENDING), codec.encode(task));
        log.info("Created task {} (priority {})", taskId, priority);
        return task;
    }

    // ========== Queries ==========

    @Override
    public List<Task> list(TaskState state) {
        String suffix = "." + state.suffix();
        List<Task> tasks = new ArrayList<>();
        for (String name : storage.list(TASK_DIR, suffix)) {
            String taskId = name.substring(0, name.length() - suffix.length());
            try {
                find(taskId, state).ifPresent(tasks::add);
            } catch (MalformedDescriptorException e) {
                log.warn("Skipping malformed descriptor {}: {}", e.getPath(), e.getMessage());
                metrics.malformedDescriptor();
            }
        }
        tasks.sort(CLAIM_ORDER);
        return tasks;
    }

    @Override
    public Optional<Task> find(String taskId, TaskState state) {
        String path = descriptorPath(taskId, state);
        return storage.read(path).map(content -> codec.decode(path, taskId, state, content));
    }

    @Override
    public Optional<Task> find(String taskId) {
        for (TaskState state : BY_PRECEDENCE) {
            Optional<Task> task = find(taskId, state);
            if (task.isPresent()) {
                return task;
            }
        }
        return Optional.empty();
    }

    @Override
    public Map<TaskState, Integer> countByState() {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, storage.list(TASK_DIR, "." + state.suffix()).size());
        }
        metrics.syncStateCounts(counts);
        return counts;
    }

    @Override
    public List<Task> listOwnedBy(String ownerId) {
        return list(TaskState.RUNNING).stream()
            .filter(task -> task.isOwnedBy(ownerId))
            .collect(Collectors.toList());
    }

    @Override
    public Map<String, Set<TaskState>> findDuplicates() {
        Map<String, Set<TaskState>> seen = new TreeMap<>();
        for (TaskState state : TaskState.values()) {
            String suffix = "." + state.suffix();
            for (String name : storage.list(TASK_DIR, suffix)) {
                String taskId = name.substring(0, name.length() - suffix.length());
                seen.computeIfAbsent(taskId, id -> EnumSet.noneOf(TaskState.class)).add(state);
            }
        }
        Map<String, Set<TaskState>> duplicates = new LinkedHashMap<>();
        seen.forEach((taskId, states) -> {
            if (states.size() > 1) {
                duplicates.put(taskId, states);
            }
        });
        return duplicates;
    }

    // ========== Mutations ==========

    @Override
    public Task transition(Task task, TaskState from, TaskState to) {
        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(task.id(), from, to);
        }
        try {
            storage.renameAtomic(descriptorPath(task.id(), from), descriptorPath(task.id(), to));
        } catch (EntryNotFoundException e) {
            throw new RaceLostException(task.id(), "no longer " + from, e);
        } catch (EntryConflictException e) {
            throw new RaceLostException(task.id(), "already " + to, e);
        }
        log.debug("Task {} moved {} -> {}", task.id(), from, to);
        return task.withState(to);
    }

    @Override
    public Task update(Task task) {
        if (!storage.replaceExisting(descriptorPath(task.id(), task.state()), codec.encode(task))) {
            throw new RaceLostException(task.id(), "no longer " + task.state());
        }
        return task;
    }

    @Override
    public Task writeTerminal(Task task) {
        if (!task.state().isTerminal()) {
            throw new InvalidTransitionException(task.id(), TaskState.RUNNING, task.state());
        }
        // body first, so the terminal name is never visible with a partial body
        if (!storage.replaceExisting(descriptorPath(task.id(), TaskState.RUNNING), codec.encode(task))) {
            throw new RaceLostException(task.id(), "no longer RUNNING");
        }
        return transition(task, TaskState.RUNNING, task.state());
    }

    @Override
    public boolean delete(String taskId, TaskState state) {
        return storage.remove(descriptorPath(taskId, state));
    }

    @Override
    public int cleanupTempFiles(Duration olderThan) {
        return storage.cleanupTempFiles(TASK_DIR, olderThan)
            + storage.cleanupTempFiles(StorageLockManager.LOCK_DIR, olderThan);
    }

    private static void validateId(String taskId) {
        if (taskId == null || taskId.isBlank() || taskId.startsWith(".")
                || taskId.contains("/") || taskId.contains("\\")) {
            throw new IllegalArgumentException("Invalid task id: " + taskId);
        }
    }
}
