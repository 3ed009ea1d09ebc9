package com.tierflow.core.graph;

import com.tierflow.core.model.TaskState;

/**
 * Routing rule bound to a node. Must be pure: no side effects and no I/O,
 * so it can be re-evaluated when a task is replayed from a checkpoint.
 * <p>
 * Numbers in the payload are {@code Long} or {@code Double}; {@link TaskState#numericField}
 * reads either, as well as numeric strings. A rule that throws fails the task.
 */
@FunctionalInterface
public interface EdgeRule {
    NodeSelection select(TaskState state);
}
