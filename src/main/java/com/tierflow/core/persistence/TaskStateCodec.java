package com.tierflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tierflow.core.model.TaskState;

/**
 * JSON (de)serialization of {@link TaskState} snapshots for checkpoints.
 */
public class TaskStateCodec {

    private final ObjectMapper objectMapper;

    public TaskStateCodec() {
        this(new ObjectMapper());
    }

    public TaskStateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(TaskState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize state of task " + state.taskId(), e);
        }
    }

    public TaskState decode(String json) {
        try {
            return objectMapper.readValue(json, TaskState.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize checkpoint state", e);
        }
    }
}
