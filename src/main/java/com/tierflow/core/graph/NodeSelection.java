package com.tierflow.core.graph;

import java.util.List;

/**
 * What an {@link EdgeRule} selects after a node completes.
 */
public sealed interface NodeSelection
        permits NodeSelection.Next, NodeSelection.FanOut, NodeSelection.End, NodeSelection.Fail {

    /** Continue at a single node. */
    record Next(String nodeId) implements NodeSelection {}

    /** Split into concurrent branches that re-join at {@code joinNode} once {@code quorum} report. */
    record FanOut(List<String> branches, String joinNode, int quorum) implements NodeSelection {
        public FanOut {
            branches = List.copyOf(branches);
        }
    }

    /** Terminal success. */
    record End() implements NodeSelection {}

    /** Terminal failure chosen by routing. */
    record Fail(String reason) implements NodeSelection {}

    static NodeSelection next(String nodeId) {
        return new Next(nodeId);
    }

    static NodeSelection end() {
        return new End();
    }

    static NodeSelection fail(String reason) {
        return new Fail(reason);
    }
}
