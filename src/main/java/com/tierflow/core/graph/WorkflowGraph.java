package com.tierflow.core.graph;

import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Static directed workflow graph: named nodes bound to agent capabilities and
 * routing rules between them.
 * <p>
 * The graph is built with the {@code add*} methods and frozen by {@link #validate()}.
 * Typical topology:
 * <pre>
 *   qualify -> [score >= 70] -> propose -> END
 *           -> [otherwise]   -> END
 *   audit   -> parallel_analysis =>(fan-out) {technical, content, links} =>(fan-in) report -> END
 * </pre>
 * Rules are pure functions of {@link TaskState}; declared targets are used for
 * validation only.
 */
public class WorkflowGraph {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraph.class);

    private static final int DEFAULT_MAX_RETRIES = 2;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final int defaultMaxRetries;
    private final Duration defaultTimeout;

    private final Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, FanOutEdge> fanOuts = new LinkedHashMap<>();
    private final Set<String> entryPoints = new LinkedHashSet<>();
    private final Map<Tier, String> tierHandlers = new EnumMap<>(Tier.class);
    private volatile boolean validated;

    public WorkflowGraph() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_TIMEOUT);
    }

    public WorkflowGraph(int defaultMaxRetries, Duration defaultTimeout) {
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultTimeout = defaultTimeout;
    }

    // -- Building --------------------------------------------------------------

    public WorkflowGraph addNode(String id, String capabilityTag) {
        return addNode(id, capabilityTag, Tier.OPERATIONAL);
    }

    public WorkflowGraph addNode(String id, String capabilityTag, Tier tier) {
        return addNode(NodeDefinition.builder(id).capability(capabilityTag).tier(tier).build());
    }

    public WorkflowGraph addNode(NodeDefinition definition) {
        checkMutable();
        if (TaskState.terminalMarker(definition.id())) {
            throw new IllegalArgumentException("Node id is reserved: " + definition.id());
        }
        if (nodes.containsKey(definition.id())) {
            throw new IllegalArgumentException("Duplicate node: " + definition.id());
        }
        nodes.put(definition.id(), definition.withDefaults(defaultMaxRetries, defaultTimeout));
        return this;
    }

    /**
     * Binds a routing rule to {@code from}. Every node the rule may select must be listed
     * in {@code declaredTargets} so the graph can be validated.
     */
    public WorkflowGraph addEdge(String from, EdgeRule rule, String... declaredTargets) {
        checkMutable();
        checkSingleOutgoing(from);
        edges.put(from, new Edge(from, rule, List.of(declaredTargets)));
        return this;
    }

    public WorkflowGraph addSequentialEdge(String from, String to) {
        return addEdge(from, state -> NodeSelection.next(to), to);
    }

    /**
     * Routes to {@code whenTrue} if the condition holds, otherwise to {@code whenFalse};
     * a null {@code whenFalse} ends the task successfully.
     */
    public WorkflowGraph addConditionalEdge(String from, Predicate<TaskState> condition,
                                            String whenTrue, String whenFalse) {
        EdgeRule rule = state -> condition.test(state)
                ? NodeSelection.next(whenTrue)
                : (whenFalse != null ? NodeSelection.next(whenFalse) : NodeSelection.end());
        return whenFalse != null
                ? addEdge(from, rule, whenTrue, whenFalse)
                : addEdge(from, rule, whenTrue);
    }

    public WorkflowGraph addFanOut(String from, List<String> branches, String join) {
        return addFanOut(from, branches, join, branches.size());
    }

    public WorkflowGraph addFanOut(String from, List<String> branches, String join, int quorum) {
        checkMutable();
        checkSingleOutgoing(from);
        fanOuts.put(from, new FanOutEdge(from, branches, join, quorum));
        return this;
    }

    public WorkflowGraph addEntryPoint(String nodeId) {
        checkMutable();
        entryPoints.add(nodeId);
        return this;
    }

    /**
     * Declares the node that receives tasks escalated into {@code tier} when the
     * exhausted node names no escalation target of its own.
     */
    public WorkflowGraph setTierHandler(Tier tier, String nodeId) {
        checkMutable();
        tierHandlers.put(tier, nodeId);
        return this;
    }

    // -- Validation ------------------------------------------------------------

    /**
     * Validates and freezes the graph.
     *
     * @return this graph
     * @throws GraphValidationException listing every problem found
     */
    public WorkflowGraph validate() {
        if (validated) {
            return this;
        }
        var problems = new ArrayList<String>();

        if (entryPoints.isEmpty()) {
            problems.add("no entry point declared");
        }
        for (String entry : entryPoints) {
            requireKnown(entry, "entry point", problems);
        }
        for (Edge edge : edges.values()) {
            requireKnown(edge.from(), "edge source", problems);
            for (String target : edge.targets()) {
                requireKnown(target, "edge target from '" + edge.from() + "'", problems);
            }
        }
        for (FanOutEdge fanOut : fanOuts.values()) {
            validateFanOut(fanOut, problems);
        }
        for (var handler : tierHandlers.entrySet()) {
            requireKnown(handler.getValue(), "tier handler for " + handler.getKey(), problems);
        }
        for (NodeDefinition node : nodes.values()) {
            if (node.escalationTarget() != null) {
                requireKnown(node.escalationTarget(), "escalation target of '" + node.id() + "'", problems);
            }
        }

        if (problems.isEmpty()) {
            validateConnectivity(problems);
        }

        if (!problems.isEmpty()) {
            throw new GraphValidationException(problems);
        }
        validated = true;
        log.info("Workflow graph validated: {} nodes, {} edges, {} fan-outs, entry points {}",
                nodes.size(), edges.size(), fanOuts.size(), entryPoints);
        return this;
    }

    private void validateFanOut(FanOutEdge fanOut, List<String> problems) {
        String label = "fan-out at '" + fanOut.from() + "'";
        requireKnown(fanOut.from(), label + " source", problems);
        if (fanOut.branches().isEmpty()) {
            problems.add(label + " declares no branches");
        }
        for (String branch : fanOut.branches()) {
            requireKnown(branch, label + " branch", problems);
        }
        if (fanOut.join() == null || !nodes.containsKey(fanOut.join())) {
            problems.add(label + " has no matching fan-in node");
            return;
        }
        if (fanOut.branches().contains(fanOut.join())) {
            problems.add(label + " lists its fan-in node '" + fanOut.join() + "' as a branch");
        }
        if (new HashSet<>(fanOut.branches()).size() != fanOut.branches().size()) {
            problems.add(label + " declares duplicate branches");
        }
        if (fanOut.quorum() < 1 || fanOut.quorum() > fanOut.branches().size()) {
            problems.add(label + " quorum " + fanOut.quorum() + " outside 1.." + fanOut.branches().size());
        }
        for (String branch : fanOut.branches()) {
            if (!nodes.containsKey(branch)) {
                continue;
            }
            if (!branchReachesJoin(branch, fanOut.join(), label, problems)) {
                problems.add(label + ": branch '" + branch + "' never reaches fan-in node '" + fanOut.join() + "'");
            }
        }
    }

    /**
     * Walks a branch over plain edges only; a nested fan-out inside a branch is rejected.
     */
    private boolean branchReachesJoin(String branch, String join, String label, List<String> problems) {
        Deque<String> queue = new ArrayDeque<>(List.of(branch));
        Set<String> seen = new HashSet<>();
        boolean reached = false;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (current.equals(join)) {
                reached = true;
                continue;
            }
            if (fanOuts.containsKey(current)) {
                problems.add(label + ": nested fan-out at '" + current + "' inside branch '" + branch + "'");
                continue;
            }
            Edge edge = edges.get(current);
            if (edge != null) {
                queue.addAll(edge.targets());
            }
        }
        return reached;
    }

    private void validateConnectivity(List<String> problems) {
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        Set<String> hasIncoming = new HashSet<>();
        for (String id : nodes.keySet()) {
            successors.put(id, new LinkedHashSet<>());
        }
        for (Edge edge : edges.values()) {
            successors.get(edge.from()).addAll(edge.targets());
            hasIncoming.addAll(edge.targets());
        }
        for (FanOutEdge fanOut : fanOuts.values()) {
            successors.get(fanOut.from()).addAll(fanOut.branches());
            successors.get(fanOut.from()).add(fanOut.join());
            hasIncoming.addAll(fanOut.branches());
            hasIncoming.add(fanOut.join());
        }
        for (NodeDefinition node : nodes.values()) {
            if (node.escalationTarget() != null) {
                successors.get(node.id()).add(node.escalationTarget());
                hasIncoming.add(node.escalationTarget());
            }
            // any node can be exhausted, so every tier handler is a potential successor
            successors.get(node.id()).addAll(tierHandlers.values());
        }
        hasIncoming.addAll(tierHandlers.values());

        for (NodeDefinition node : nodes.values()) {
            boolean outgoing = edges.containsKey(node.id()) || fanOuts.containsKey(node.id())
                    || node.escalationTarget() != null;
            if (!outgoing && !hasIncoming.contains(node.id()) && !entryPoints.contains(node.id())) {
                problems.add("orphan node '" + node.id() + "' has no edges");
            }
        }

        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(entryPoints);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (reachable.add(current)) {
                queue.addAll(successors.getOrDefault(current, Set.of()));
            }
        }
        for (String id : nodes.keySet()) {
            if (!reachable.contains(id)) {
                String message = "node '" + id + "' is unreachable from every entry point";
                if (!problems.contains("orphan node '" + id + "' has no edges")) {
                    problems.add(message);
                }
            }
        }
    }

    // -- Resolution ------------------------------------------------------------

    /**
     * Evaluates the rule bound to the task's current node. A node without an
     * outgoing rule ends the task; a rule that throws or selects an unknown node fails it.
     */
    public NodeSelection resolve(TaskState state) {
        if (!validated) {
            throw new IllegalStateException("Workflow graph must be validated before use");
        }
        String current = state.currentNode();
        FanOutEdge fanOut = fanOuts.get(current);
        if (fanOut != null) {
            return fanOut.selection();
        }
        Edge edge = edges.get(current);
        if (edge == null) {
            return NodeSelection.end();
        }
        NodeSelection selection;
        try {
            selection = edge.rule().select(state);
        } catch (RuntimeException e) {
            log.warn("Rule at '{}' threw for task {}", current, state.taskId(), e);
            return NodeSelection.fail("rule at '" + current + "' threw: " + e);
        }
        if (selection == null) {
            return NodeSelection.fail("rule at '" + current + "' selected nothing");
        }
        if (selection instanceof NodeSelection.Next next && !nodes.containsKey(next.nodeId())) {
            return NodeSelection.fail("rule at '" + current + "' selected unknown node '" + next.nodeId() + "'");
        }
        return selection;
    }

    // -- Queries ---------------------------------------------------------------

    public Optional<NodeDefinition> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public NodeDefinition requireNode(String id) {
        NodeDefinition node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Collection<NodeDefinition> nodes() {
        return List.copyOf(nodes.values());
    }

    public Set<String> entryPoints() {
        return Set.copyOf(entryPoints);
    }

    public boolean isEntryPoint(String id) {
        return entryPoints.contains(id);
    }

    public Optional<FanOutEdge> fanOutFrom(String nodeId) {
        return Optional.ofNullable(fanOuts.get(nodeId));
    }

    public Optional<String> tierHandler(Tier tier) {
        return Optional.ofNullable(tierHandlers.get(tier));
    }

    /**
     * Node a task escalating out of {@code nodeId} into {@code newTier} should land on:
     * the node's own escalation target, else the tier handler, else empty.
     */
    public Optional<String> escalationTarget(String nodeId, Tier newTier) {
        NodeDefinition node = nodes.get(nodeId);
        if (node != null && node.escalationTarget() != null) {
            return Optional.of(node.escalationTarget());
        }
        return tierHandler(newTier);
    }

    public boolean isValidated() {
        return validated;
    }

    private void requireKnown(String id, String role, List<String> problems) {
        if (id == null || !nodes.containsKey(id)) {
            problems.add(role + " references unknown node '" + id + "'");
        }
    }

    private void checkMutable() {
        if (validated) {
            throw new IllegalStateException("Workflow graph is frozen after validation");
        }
    }

    private void checkSingleOutgoing(String from) {
        if (edges.containsKey(from) || fanOuts.containsKey(from)) {
            throw new IllegalArgumentException("Node '" + from + "' already has an outgoing rule");
        }
    }

    private record Edge(String from, EdgeRule rule, List<String> targets) {}

    @Override
    public String toString() {
        return "WorkflowGraph" + nodes.keySet();
    }
}
