package com.tierflow.core.persistence;

import com.tierflow.core.model.TaskState;

import java.time.Clock;
import java.util.Optional;

/**
 * Shared snapshot encoding and replay for {@link CheckpointStore} implementations.
 */
public abstract class AbstractCheckpointStore implements CheckpointStore {

    protected final TaskStateCodec codec;
    protected final int retention;
    protected final Clock clock;

    protected AbstractCheckpointStore(TaskStateCodec codec, int retention, Clock clock) {
        if (retention < 0) {
            throw new IllegalArgumentException("retention must be >= 0");
        }
        this.codec = codec;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public Checkpoint write(TaskState state) {
        var checkpoint = new Checkpoint(state.taskId(), codec.encode(state), state.sequence(), clock.instant());
        save(checkpoint);
        return checkpoint;
    }

    @Override
    public Optional<TaskState> replay(String taskId) {
        return load(taskId).map(cp -> codec.decode(cp.state()));
    }
}
