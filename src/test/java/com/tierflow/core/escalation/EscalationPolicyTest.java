package com.tierflow.core.escalation;

import com.tierflow.core.graph.NodeDefinition;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.model.Priority;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscalationPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private WorkflowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new WorkflowGraph()
                .addNode("qualify", "lead_qualification")
                .addNode("propose", "proposal_generation")
                .addNode(NodeDefinition.builder("review").capability("sales_operations").tier(Tier.MANAGEMENT).build())
                .addNode(NodeDefinition.builder("approve").capability("business_development").tier(Tier.EXECUTIVE).build())
                .addNode(NodeDefinition.builder("debrief").capability("reporting").resetsTier().build())
                .addSequentialEdge("qualify", "propose")
                .addSequentialEdge("review", "debrief")
                .addEntryPoint("qualify")
                .setTierHandler(Tier.MANAGEMENT, "review")
                .setTierHandler(Tier.EXECUTIVE, "approve")
                .validate();
    }

    private static TaskState state(String node, Map<String, Object> payload) {
        return TaskState.initial("TF-2026-0001", "qualify", payload, Priority.HIGH, Tier.OPERATIONAL, NOW)
                .movedTo(node, NOW);
    }

    private static ValueThreshold dealThreshold(String target) {
        return new ValueThreshold("large-deal", "propose", "deal_value", 2_500_000, target);
    }

    @Nested
    @DisplayName("value thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("value at or above the amount escalates one tier")
        void valueAboveAmountEscalates() {
            var policy = new EscalationPolicy(2, List.of(dealThreshold("review")));

            var decision = policy.afterSuccess(state("propose", Map.of("deal_value", 3_200_000)),
                    graph.requireNode("propose"), graph);

            var escalate = assertInstanceOf(EscalationDecision.Escalate.class, decision);
            assertEquals("review", escalate.targetNode());
            assertEquals(Tier.MANAGEMENT, escalate.newTier());
            assertTrue(escalate.reason().contains("large-deal"));
        }

        @Test
        @DisplayName("value below the amount or missing proceeds")
        void valueBelowProceeds() {
            var policy = new EscalationPolicy(2, List.of(dealThreshold("review")));
            NodeDefinition propose = graph.requireNode("propose");

            assertInstanceOf(EscalationDecision.Proceed.class,
                    policy.afterSuccess(state("propose", Map.of("deal_value", 1_000_000)), propose, graph));
            assertInstanceOf(EscalationDecision.Proceed.class,
                    policy.afterSuccess(state("propose", Map.of()), propose, graph));
        }

        @Test
        @DisplayName("threshold without a target uses the tier handler")
        void thresholdWithoutTargetUsesTierHandler() {
            var policy = new EscalationPolicy(2, List.of(dealThreshold(null)));

            var decision = policy.afterSuccess(state("propose", Map.of("deal_value", "5000000")),
                    graph.requireNode("propose"), graph);

            assertEquals("review", assertInstanceOf(EscalationDecision.Escalate.class, decision).targetNode());
        }

        @Test
        @DisplayName("only applies to the watched node")
        void onlyWatchedNode() {
            var policy = new EscalationPolicy(2, List.of(dealThreshold("review")));

            assertInstanceOf(EscalationDecision.Proceed.class,
                    policy.afterSuccess(state("qualify", Map.of("deal_value", 9_000_000)),
                            graph.requireNode("qualify"), graph));
        }

        @Test
        @DisplayName("checkAgainst reports thresholds referencing unknown nodes")
        void checkAgainstReportsUnknownNodes() {
            var policy = new EscalationPolicy(2, List.of(
                    new ValueThreshold("ghost", "nowhere", "deal_value", 1, "review"),
                    new ValueThreshold("bad-target", "propose", "deal_value", 1, "missing")));

            List<String> problems = policy.checkAgainst(graph);

            assertEquals(2, problems.size());
            assertTrue(problems.get(0).contains("'nowhere'"));
            assertTrue(problems.get(1).contains("'missing'"));
        }
    }

    @Nested
    @DisplayName("exhaustion and fatal errors")
    class ExhaustionTests {

        private final EscalationPolicy policy = new EscalationPolicy(2, List.of());

        @Test
        @DisplayName("exhaustion at OPERATIONAL escalates to the management handler")
        void exhaustionEscalates() {
            var decision = policy.onExhausted(state("propose", Map.of()), graph.requireNode("propose"), graph, "timeout");

            var escalate = assertInstanceOf(EscalationDecision.Escalate.class, decision);
            assertEquals("review", escalate.targetNode());
            assertEquals(Tier.MANAGEMENT, escalate.newTier());
        }

        @Test
        @DisplayName("exhaustion at EXECUTIVE fails terminally")
        void exhaustionAtExecutiveFails() {
            TaskState atExecutive = state("propose", Map.of())
                    .escalatedTo("review", Tier.MANAGEMENT, NOW)
                    .escalatedTo("approve", Tier.EXECUTIVE, NOW);

            var decision = policy.onExhausted(atExecutive, graph.requireNode("approve"), graph, "boom");

            var fail = assertInstanceOf(EscalationDecision.Fail.class, decision);
            assertFalse(fail.escalationExhausted());
            assertTrue(fail.reason().contains("EXECUTIVE"));
        }

        @Test
        @DisplayName("escalation is refused once the limit is reached")
        void refusedAtLimit() {
            var strict = new EscalationPolicy(1, List.of());
            TaskState escalatedOnce = state("propose", Map.of()).escalatedTo("review", Tier.MANAGEMENT, NOW);

            var decision = strict.onFatal(escalatedOnce, graph.requireNode("review"), graph, "agent crashed");

            var fail = assertInstanceOf(EscalationDecision.Fail.class, decision);
            assertTrue(fail.escalationExhausted());
            assertTrue(fail.reason().contains("Escalation limit reached"));
        }

        @Test
        @DisplayName("fails when no escalation target exists for the next tier")
        void failsWithoutTarget() {
            var bare = new WorkflowGraph().addNode("a", "cap").addEntryPoint("a").validate();

            var decision = policy.onExhausted(state("a", Map.of()), bare.requireNode("a"), bare, "retries used");

            assertInstanceOf(EscalationDecision.Fail.class, decision);
        }
    }

    @Nested
    @DisplayName("terminal results and tier reset")
    class TerminalTests {

        private final EscalationPolicy policy = new EscalationPolicy(2, List.of());

        @Test
        @DisplayName("terminal results end the task directly")
        void terminalResults() {
            assertInstanceOf(EscalationDecision.Succeed.class,
                    policy.onTerminal(state("propose", Map.of()), true, null));
            var fail = assertInstanceOf(EscalationDecision.Fail.class,
                    policy.onTerminal(state("propose", Map.of()), false, "client declined"));
            assertTrue(fail.reason().contains("client declined"));
        }

        @Test
        @DisplayName("a resetting node returns the task to OPERATIONAL")
        void resettingNode() {
            TaskState escalated = state("propose", Map.of()).escalatedTo("debrief", Tier.MANAGEMENT, NOW);

            var decision = policy.afterSuccess(escalated, graph.requireNode("debrief"), graph);

            assertEquals(Tier.OPERATIONAL, assertInstanceOf(EscalationDecision.ResetTier.class, decision).resetTo());
        }

        @Test
        @DisplayName("a resetting node at OPERATIONAL proceeds")
        void resettingNodeAtOperational() {
            assertInstanceOf(EscalationDecision.Proceed.class,
                    policy.afterSuccess(state("debrief", Map.of()), graph.requireNode("debrief"), graph));
        }

        @Test
        @DisplayName("rejects a negative escalation limit")
        void rejectsNegativeLimit() {
            assertThrows(IllegalArgumentException.class, () -> new EscalationPolicy(-1, List.of()));
        }
    }
}
