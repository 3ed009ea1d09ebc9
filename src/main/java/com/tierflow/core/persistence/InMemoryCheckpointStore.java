package com.tierflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory {@link CheckpointStore}. Suitable for development and tests; state is lost
 * on restart.
 */
public class InMemoryCheckpointStore extends AbstractCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, Checkpoint>> checkpointsByTask =
            new ConcurrentHashMap<>();

    public InMemoryCheckpointStore() {
        this(new TaskStateCodec(), 0, Clock.systemUTC());
    }

    public InMemoryCheckpointStore(TaskStateCodec codec, int retention, Clock clock) {
        super(codec, retention, clock);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        // compute() holds the per-key lock, making check-then-insert atomic per task
        checkpointsByTask.compute(checkpoint.taskId(), (taskId, existing) -> {
            var sequences = existing != null ? existing : new ConcurrentSkipListMap<Long, Checkpoint>();
            if (sequences.containsKey(checkpoint.sequenceNumber())) {
                log.debug("Checkpoint {}@{} already stored; ignoring", taskId, checkpoint.sequenceNumber());
                return sequences;
            }
            if (!sequences.isEmpty() && sequences.lastKey() > checkpoint.sequenceNumber()) {
                throw new CheckpointException("Out-of-order checkpoint for task " + taskId + ": sequence "
                        + checkpoint.sequenceNumber() + " after " + sequences.lastKey());
            }
            sequences.put(checkpoint.sequenceNumber(), checkpoint);
            if (retention > 0) {
                while (sequences.size() > retention) {
                    sequences.pollFirstEntry();
                }
            }
            log.debug("Saved checkpoint {}@{}", taskId, checkpoint.sequenceNumber());
            return sequences;
        });
    }

    @Override
    public Optional<Checkpoint> load(String taskId) {
        var sequences = checkpointsByTask.get(taskId);
        if (sequences == null || sequences.isEmpty()) {
            return Optional.empty();
        }
        Map.Entry<Long, Checkpoint> last = sequences.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<Checkpoint> history(String taskId) {
        var sequences = checkpointsByTask.get(taskId);
        return sequences == null ? List.of() : new ArrayList<>(sequences.values());
    }

    @Override
    public List<String> listTaskIds() {
        return new ArrayList<>(checkpointsByTask.keySet());
    }
}
