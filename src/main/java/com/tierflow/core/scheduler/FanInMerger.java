package com.tierflow.core.scheduler;

import com.tierflow.core.model.HistoryEntry;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic fan-in: branch results are folded into the parent in branch
 * declaration order, whatever order they finished in.
 * <p>
 * Histories of every branch that reported (succeeded or failed) are appended after the
 * parent's own history. Outputs of succeeded branches are merged into the parent payload;
 * on a key collision the later-declared branch wins. Branches cancelled before reporting
 * contribute nothing.
 */
class FanInMerger {

    TaskState merge(TaskState parent, Instant now) {
        Map<String, Object> payload = new HashMap<>(parent.payload());
        List<HistoryEntry> history = new ArrayList<>(parent.history());
        for (TaskState branch : parent.branches()) {
            if (!branch.status().isTerminal()) {
                continue;
            }
            history.addAll(branch.history());
            if (branch.status() == TaskStatus.SUCCEEDED) {
                payload.putAll(branch.payload());
            }
        }
        return parent.joined(payload, history, now);
    }

    static int succeeded(List<TaskState> branches) {
        return (int) branches.stream().filter(b -> b.status() == TaskStatus.SUCCEEDED).count();
    }

    static int pending(List<TaskState> branches) {
        return (int) branches.stream().filter(b -> !b.status().isTerminal()).count();
    }
}
