package com.tierflow.core.persistence;

import com.tierflow.core.model.TaskState;

import java.util.List;
import java.util.Optional;

/**
 * Durable, per-task ordered store of {@link Checkpoint}s.
 * <p>
 * Single writer per task id (the scheduler's dispatch loop), any number of readers.
 */
public interface CheckpointStore {

    /**
     * Saves a checkpoint atomically. Saving a sequence number that is already stored
     * is a no-op; saving a sequence lower than the latest stored one fails.
     *
     * @throws CheckpointException on out-of-order sequence or storage failure
     */
    void save(Checkpoint checkpoint);

    /**
     * Latest checkpoint of a task.
     */
    Optional<Checkpoint> load(String taskId);

    /**
     * Retained checkpoints of a task, oldest first.
     */
    List<Checkpoint> history(String taskId);

    /**
     * Every task id with at least one checkpoint.
     */
    List<String> listTaskIds();

    /**
     * Serializes and saves a state snapshot under its own sequence number.
     */
    Checkpoint write(TaskState state);

    /**
     * Reconstructs the latest state of a task from its newest checkpoint.
     */
    Optional<TaskState> replay(String taskId);
}
