package com.taskdrive.engine.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdrive.core.exception.MalformedDescriptorException;
import com.taskdrive.core.model.LockMarker;

import java.io.IOException;

/**
 * Reads and writes lock marker bodies as YAML.
 */
public class LockMarkerCodec {

    private final ObjectMapper mapper;

    public LockMarkerCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public LockMarkerCodec() {
        this(DescriptorMappers.yaml());
    }

    public byte[] encode(LockMarker marker) {
        try {
            return mapper.writeValueAsBytes(marker);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Marker for " + marker.taskId() + " is not serializable", e);
        }
    }

    /**
     * @throws MalformedDescriptorException if the body is unreadable or has no owner
     */
    public LockMarker decode(String path, byte[] content) {
        LockMarker marker;
        try {
            marker = mapper.readValue(content, LockMarker.class);
        } catch (IOException e) {
            throw new MalformedDescriptorException(path, e);
        }
        if (marker == null || marker.ownerId() == null) {
            throw new MalformedDescriptorException(path, "marker has no owner");
        }
        return marker;
    }
}
