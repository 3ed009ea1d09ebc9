package com.tierflow.core.graph;

import java.util.List;

/**
 * Fan-out declared on a node: after {@code from} completes, every branch runs
 * concurrently and {@code join} executes once {@code quorum} branches reported success.
 *
 * @param from     node whose completion fans out
 * @param branches first node of each branch, in declaration order
 * @param join     fan-in node
 * @param quorum   number of successful branches required, 1..branches.size()
 */
public record FanOutEdge(
    String from,
    List<String> branches,
    String join,
    int quorum
) {

    public FanOutEdge {
        branches = List.copyOf(branches);
    }

    public NodeSelection selection() {
        return new NodeSelection.FanOut(branches, join, quorum);
    }
}
