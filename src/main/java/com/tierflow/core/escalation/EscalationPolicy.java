package com.tierflow.core.escalation;

import com.tierflow.config.TierflowProperties;
import com.tierflow.core.graph.NodeDefinition;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tier state machine layered over the workflow graph.
 * <pre>
 *   OPERATIONAL -> MANAGEMENT -> EXECUTIVE
 *        \             \            \
 *         +-------------+------------+--> TERMINAL_SUCCESS | TERMINAL_FAILED
 * </pre>
 * Triggers: configured value thresholds after a node succeeds, retry exhaustion,
 * fatal agent errors, and terminal agent results. Escalation keeps payload and
 * history, increments the escalation count, and is refused once the count reaches
 * {@code maxEscalations}. Decisions are pure; the scheduler applies them.
 */
@Service
public class EscalationPolicy {

    private static final Logger log = LoggerFactory.getLogger(EscalationPolicy.class);

    private final int maxEscalations;
    private final List<ValueThreshold> thresholds;

    @Autowired
    public EscalationPolicy(TierflowProperties properties) {
        this(properties.getEscalation().getMaxEscalations(), properties.getEscalation().getValueThresholds());
    }

    public EscalationPolicy(int maxEscalations, List<ValueThreshold> thresholds) {
        if (maxEscalations < 0) {
            throw new IllegalArgumentException("maxEscalations must be >= 0");
        }
        this.maxEscalations = maxEscalations;
        this.thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
        for (ValueThreshold threshold : this.thresholds) {
            log.info("Escalation threshold '{}': {}.{} >= {} -> {}", threshold.name(), threshold.node(),
                    threshold.field(), threshold.amount(), threshold.target() != null ? threshold.target() : "(graph default)");
        }
    }

    /**
     * Checks every configured threshold against the graph: the node and any explicit
     * target must exist.
     *
     * @return problems found; empty when consistent
     */
    public List<String> checkAgainst(WorkflowGraph graph) {
        return thresholds.stream()
                .flatMap(t -> {
                    var problems = new ArrayList<String>();
                    if (!graph.hasNode(t.node())) {
                        problems.add("threshold '" + t.name() + "' watches unknown node '" + t.node() + "'");
                    }
                    if (t.target() != null && !graph.hasNode(t.target())) {
                        problems.add("threshold '" + t.name() + "' targets unknown node '" + t.target() + "'");
                    }
                    return problems.stream();
                })
                .toList();
    }

    /**
     * Evaluated after {@code node} succeeded and its output was merged into {@code state}.
     */
    public EscalationDecision afterSuccess(TaskState state, NodeDefinition node, WorkflowGraph graph) {
        if (node.resetsTier() && state.tier() != Tier.OPERATIONAL) {
            return new EscalationDecision.ResetTier(Tier.OPERATIONAL,
                    "node '" + node.id() + "' resets tier from " + state.tier());
        }
        for (ValueThreshold threshold : thresholds) {
            if (!threshold.appliesTo(node.id())) {
                continue;
            }
            Double value = state.numericField(threshold.field());
            if (value == null || value < threshold.amount()) {
                continue;
            }
            String reason = "threshold '" + threshold.name() + "': " + threshold.field() + "=" + value
                    + " >= " + threshold.amount();
            if (state.tier().isHighest()) {
                log.info("Task {} already at {}; ignoring {}", state.taskId(), state.tier(), reason);
                return new EscalationDecision.Proceed();
            }
            Tier newTier = state.tier().next();
            Optional<String> target = threshold.target() != null
                    ? Optional.of(threshold.target())
                    : graph.escalationTarget(node.id(), newTier);
            if (target.isEmpty()) {
                log.warn("Task {}: {} matched but no escalation target is defined for {}",
                        state.taskId(), reason, newTier);
                return new EscalationDecision.Proceed();
            }
            return escalate(state, target.get(), newTier, reason);
        }
        return new EscalationDecision.Proceed();
    }

    /**
     * Evaluated when {@code node} used up its retries (or no agent could serve it).
     */
    public EscalationDecision onExhausted(TaskState state, NodeDefinition node, WorkflowGraph graph, String cause) {
        return escalateOrFail(state, node, graph, "node '" + node.id() + "' exhausted: " + cause);
    }

    /**
     * Evaluated when the agent reported a fatal error on a plain (non-branch) node.
     */
    public EscalationDecision onFatal(TaskState state, NodeDefinition node, WorkflowGraph graph, String cause) {
        return escalateOrFail(state, node, graph, "fatal error at '" + node.id() + "': " + cause);
    }

    /**
     * Evaluated when the agent returned an explicit terminal result.
     */
    public EscalationDecision onTerminal(TaskState state, boolean succeeded, String detail) {
        if (succeeded) {
            return new EscalationDecision.Succeed("terminal success reported at '" + state.currentNode() + "'");
        }
        return new EscalationDecision.Fail("terminal failure reported at '" + state.currentNode() + "'"
                + (detail != null ? ": " + detail : ""), false);
    }

    private EscalationDecision escalateOrFail(TaskState state, NodeDefinition node, WorkflowGraph graph,
                                              String reason) {
        if (state.tier().isHighest()) {
            return new EscalationDecision.Fail(reason + " at " + state.tier(), false);
        }
        Tier newTier = state.tier().next();
        Optional<String> target = graph.escalationTarget(node.id(), newTier);
        if (target.isEmpty()) {
            return new EscalationDecision.Fail(reason + "; no escalation target for " + newTier, false);
        }
        return escalate(state, target.get(), newTier, reason);
    }

    private EscalationDecision escalate(TaskState state, String target, Tier newTier, String reason) {
        if (state.escalationCount() >= maxEscalations) {
            var refused = new EscalationExhaustedException(state.taskId(), state.escalationCount());
            return new EscalationDecision.Fail(refused.getMessage() + " (" + reason + ")", true);
        }
        return new EscalationDecision.Escalate(target, newTier, reason);
    }

    public int maxEscalations() {
        return maxEscalations;
    }

    public List<ValueThreshold> thresholds() {
        return thresholds;
    }
}
