package com.taskdrive.core.repository;

import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskState;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps task identity and state onto descriptor files.
 * The state of a task is the suffix of its descriptor name.
 */
public interface TaskStore {

    /**
     * Create a new PENDING task with a generated id.
     */
    Task create(Map<String, Object> payload);

    /**
     * Create a new PENDING task with a generated id and a priority.
     */
    Task create(Map<String, Object> payload, int priority);

    /**
     * Create a new PENDING task with a caller-supplied id.
     *
     * @throws com.taskdrive.core.exception.EntryConflictException if a descriptor with this id exists
     */
    Task create(String taskId, Map<String, Object> payload, int priority);

    /**
     * List and parse every descriptor in a state.
     * Malformed descriptors are skipped and reported, never fatal.
     * Sorted by priority (highest first), then creation time.
     */
    List<Task> list(TaskState state);

    /**
     * Find a task in a specific state.
     */
    Optional<Task> find(String taskId, TaskState state);

    /**
     * Find a task in any state, highest precedence first.
     */
    Optional<Task> find(String taskId);

    /**
     * Move a descriptor from one state suffix to another.
     *
     * @return the task under its new state
     * @throws com.taskdrive.core.exception.RaceLostException if the source no longer exists
     */
    Task transition(Task task, TaskState from, TaskState to);

    /**
     * Rewrite a descriptor in place under its current state.
     *
     * @throws com.taskdrive.core.exception.RaceLostException if the descriptor has moved
     */
    Task update(Task task);

    /**
     * Write the final body into the RUNNING descriptor, then rename it to the
     * terminal suffix, so a terminal file is complete the instant it is visible.
     *
     * @param task Terminal body ({@code task.state()} must be DONE or FAILED)
     * @throws com.taskdrive.core.exception.RaceLostException if the RUNNING descriptor is gone
     */
    Task writeTerminal(Task task);

    /**
     * Count descriptors per state.
     */
    Map<TaskState, Integer> countByState();

    /**
     * RUNNING tasks whose descriptor names {@code ownerId}.
     */
    List<Task> listOwnedBy(String ownerId);

    /**
     * Ids visible under more than one state suffix, with the states seen.
     */
    Map<String, Set<TaskState>> findDuplicates();

    /**
     * Delete one copy of a descriptor. Used only to resolve duplicates.
     *
     * @return true if a file was removed
     */
    boolean delete(String taskId, TaskState state);

    /**
     * Remove orphaned temp files from the task and lock directories.
     *
     * @return number of files removed
     */
    int cleanupTempFiles(Duration olderThan);
}
