package com.taskdrive.engine.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.model.Task;
import com.taskdrive.core.model.TaskError;
import com.taskdrive.core.model.TaskProgress;
import com.taskdrive.core.model.TaskState;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Reads and writes task descriptor bodies as YAML.
 *
 * The state is deliberately absent from the body: it is supplied by the
 * caller from the descriptor's file-name suffix when decoding.
 */
public class TaskDescriptorCodec {

    /**
     * On-disk shape of a descriptor.
     */
    record Body(
        String id,
        Map<String, Object> payload,
        Integer priority,
        String owner,
        Instant heartbeatAt,
        Integer retryCount,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Long durationMillis,
        Map<String, Object> result,
        TaskError error,
        Instant lastReclaimedAt,
        String lastReclaimReason,
        TaskProgress progress
    ) {
    }

    private final ObjectMapper mapper;

    public TaskDescriptorCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TaskDescriptorCodec() {
        this(DescriptorMappers.yaml());
    }

    public byte[] encode(Task task) {
        Body body = new Body(
            task.id(),
            task.payload(),
            task.priority(),
            task.owner(),
            task.heartbeatAt(),
            task.retryCount(),
            task.createdAt(),
            task.startedAt(),
            task.completedAt(),
            task.durationMillis(),
            task.result(),
            task.error(),
            task.lastReclaimedAt(),
            task.lastReclaimReason(),
            task.progress()
        );
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task " + task.id() + " is not serializable", e);
        }
    }

    /**
     * Decode a descriptor body.
     *
     * @param path store path, for error reporting
     * @param taskId id derived from the file name
     * @param state state derived from the file-name suffix
     * @throws MalformedDescriptorException if the body cannot be parsed or names another task
     */
    public Task decode(String path, String taskId, TaskState state, byte[] content) {
        Body body;
        try {
            body = mapper.readValue(content, Body.class);
        } catch (IOException e) {
            throw new MalformedDescriptorException(path, e);
        }
        if (body == null) {
            throw new MalformedDescriptorException(path, "empty descriptor");
        }
        if (body.id() != null && !body.id().equals(taskId)) {
            throw new MalformedDescriptorException(path, "body names task '" + body.id() + "'");
        }
        if (body.retryCount() != null && body.retryCount() < 0) {
            throw new MalformedDescriptorException(path, "negative retryCount");
        }
        return new Task(
            taskId,
            state,
            body.payload(),
            body.priority() != null ? body.priority() : 0,
            body.owner(),
            body.heartbeatAt(),
            body.retryCount() != null ? body.retryCount() : 0,
            body.createdAt(),
            body.startedAt(),
            body.completedAt(),
            body.durationMillis(),
            body.result(),
            body.error(),
            body.lastReclaimedAt(),
            body.lastReclaimReason(),
            body.progress()
        );
    }
}
