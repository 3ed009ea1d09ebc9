package com.tierflow.core.scheduler;

import com.tierflow.core.model.TaskView;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Returned by {@link SchedulerCore#submit}. The completion future finishes with the
 * final view once the task reaches SUCCEEDED or FAILED; it never completes exceptionally
 * for task-level failures.
 */
public record TaskHandle(String taskId, CompletableFuture<TaskView> completion) {

    /**
     * Blocks until the task is terminal or the timeout elapses.
     */
    public TaskView await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task " + taskId + " completion failed", e.getCause());
        }
    }

    public boolean isDone() {
        return completion.isDone();
    }
}
