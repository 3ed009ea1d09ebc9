package com.tierflow.core.graph;

import com.tierflow.core.model.OrchestrationException;

import java.util.List;

/**
 * Thrown by {@link WorkflowGraph#validate()} listing every problem found.
 */
public class GraphValidationException extends OrchestrationException {

    private final List<String> problems;

    public GraphValidationException(List<String> problems) {
        super("Invalid workflow graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
