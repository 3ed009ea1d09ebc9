package com.tierflow.core.scheduler;

import com.tierflow.config.OrchestrationConfig;
import com.tierflow.config.TierflowProperties;
import com.tierflow.core.agent.AgentDescriptor;
import com.tierflow.core.agent.AgentExecutor;
import com.tierflow.core.agent.AgentRegistry;
import com.tierflow.core.agent.AgentResult;
import com.tierflow.core.escalation.EscalationPolicy;
import com.tierflow.core.escalation.ValueThreshold;
import com.tierflow.core.events.EventBus;
import com.tierflow.core.events.EventFilter;
import com.tierflow.core.events.EventTypes;
import com.tierflow.core.events.OrchestrationEvent;
import com.tierflow.core.graph.GraphValidationException;
import com.tierflow.core.graph.NodeDefinition;
import com.tierflow.core.graph.NodeSelection;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.metrics.OrchestrationMetrics;
import com.tierflow.core.model.HistoryEntry;
import com.tierflow.core.model.NodeOutcome;
import com.tierflow.core.model.Priority;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.TaskStatus;
import com.tierflow.core.model.TaskView;
import com.tierflow.core.model.Tier;
import com.tierflow.core.persistence.Checkpoint;
import com.tierflow.core.persistence.CheckpointException;
import com.tierflow.core.persistence.InMemoryCheckpointStore;
import com.tierflow.core.persistence.TaskStateCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerCoreTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private EventBus eventBus;
    private AgentRegistry registry;
    private InMemoryCheckpointStore store;
    private final List<OrchestrationEvent> events = new CopyOnWriteArrayList<>();
    private SchedulerCore scheduler;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new AgentRegistry(3, Map.of(), Duration.ZERO, eventBus);
        store = new InMemoryCheckpointStore();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    // -- Fixtures ---------------------------------------------------------------

    private SchedulerCore start(WorkflowGraph graph, EscalationPolicy policy) {
        return start(graph, policy, false);
    }

    private SchedulerCore start(WorkflowGraph graph, EscalationPolicy policy, boolean recoverOnStartup) {
        scheduler = new SchedulerCore(graph, registry, policy, store, eventBus,
                new OrchestrationMetrics(new SimpleMeterRegistry()),
                new BackoffPolicy(Duration.ofMillis(10), 2.0, Duration.ofMillis(40)),
                Clock.systemUTC(), recoverOnStartup);
        scheduler.start();
        return scheduler;
    }

    private void agent(String id, Tier tier, String capability, int concurrencyLimit, AgentExecutor executor) {
        registry.register(new AgentDescriptor(id, tier, Set.of(capability), concurrencyLimit), executor);
    }

    private static WorkflowGraph referenceGraph() {
        return new OrchestrationConfig().workflowGraph(new TierflowProperties());
    }

    private static EscalationPolicy dealValuePolicy() {
        return new EscalationPolicy(2, List.of(
                new ValueThreshold("proposal-management-review", "propose", "deal_value", 2_500_000, "review"),
                new ValueThreshold("review-executive-approval", "review", "deal_value", 10_000_000, "approve")));
    }

    private static WorkflowGraph singleNode(NodeDefinition node) {
        return new WorkflowGraph()
                .addNode(node)
                .addEntryPoint(node.id());
    }

    private static List<String> historyNodes(TaskView view) {
        return view.history().stream().map(HistoryEntry::nodeId).toList();
    }

    private List<String> eventTypes(String taskId) {
        return events.stream()
                .filter(e -> taskId.equals(e.taskId()))
                .map(OrchestrationEvent::eventType)
                .toList();
    }

    private List<OrchestrationEvent> eventsOfType(String eventType) {
        return events.stream().filter(e -> eventType.equals(e.eventType())).toList();
    }

    private static AgentResult sleepUntilCancelled(CountDownLatch started, CountDownLatch cancelled) {
        started.countDown();
        try {
            Thread.sleep(10_000);
        } catch (InterruptedException e) {
            cancelled.countDown();
            return AgentResult.transientError("interrupted");
        }
        return AgentResult.success(Map.of());
    }

    // -- Sales pipeline ---------------------------------------------------------

    @Nested
    @DisplayName("sales pipeline")
    class SalesPipelineTests {

        @BeforeEach
        void agents() {
            agent("lead-agent", Tier.OPERATIONAL, "lead_qualification", 2,
                    ctx -> AgentResult.success(Map.of("lead_score", ctx.payload().getOrDefault("score_hint", 85))));
            agent("proposal-agent", Tier.OPERATIONAL, "proposal_generation", 2,
                    ctx -> AgentResult.success(Map.of("deal_value", 3_200_000)));
            agent("sales-ops", Tier.MANAGEMENT, "sales_operations", 1,
                    ctx -> AgentResult.success(Map.of("review_status", "approved")));
        }

        @Test
        @DisplayName("qualified high-value lead escalates to management review and succeeds")
        void highValueLeadEscalatesToReview() throws Exception {
            start(referenceGraph(), dealValuePolicy());

            TaskHandle handle = scheduler.submit(new SubmitRequest("TF-2026-0042", "qualify",
                    Map.of("company", "Acme Corp"), Priority.HIGH));
            TaskView view = handle.await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(TaskState.SUCCEEDED_MARKER, view.currentNode());
            assertEquals(Tier.MANAGEMENT, view.tier());
            assertEquals(1, view.escalationCount());
            assertEquals(List.of("qualify", "propose", "review"), historyNodes(view));
            assertEquals(List.of(Tier.OPERATIONAL, Tier.OPERATIONAL, Tier.MANAGEMENT),
                    view.history().stream().map(HistoryEntry::tier).toList());
            assertTrue(view.history().stream().allMatch(h -> h.outcome() == NodeOutcome.SUCCEEDED));

            List<String> types = eventTypes("TF-2026-0042");
            assertEquals(EventTypes.TASK_SUBMITTED, types.get(0));
            assertEquals(EventTypes.TASK_SUCCEEDED, types.get(types.size() - 1));
            assertTrue(types.indexOf(EventTypes.TASK_ESCALATED) > 0);

            OrchestrationEvent escalated = eventsOfType(EventTypes.TASK_ESCALATED).get(0);
            assertEquals("review", escalated.nodeId());
            assertEquals("OPERATIONAL", escalated.get("fromTier"));
            assertEquals("MANAGEMENT", escalated.get("toTier"));
        }

        @Test
        @DisplayName("every transition is checkpointed in increasing sequence order")
        void checkpointsAreOrdered() throws Exception {
            start(referenceGraph(), dealValuePolicy());

            scheduler.submit(new SubmitRequest("TF-2026-0043", "qualify",
                    Map.of("company", "Acme Corp"), Priority.MEDIUM)).await(WAIT);

            List<Checkpoint> history = store.history("TF-2026-0043");
            assertTrue(history.size() > 3);
            for (int i = 1; i < history.size(); i++) {
                assertTrue(history.get(i).sequenceNumber() > history.get(i - 1).sequenceNumber());
            }
            TaskState last = store.replay("TF-2026-0043").orElseThrow();
            assertEquals(TaskStatus.SUCCEEDED, last.status());
            assertEquals(3, last.history().size());
            assertEquals(3_200_000, ((Number) last.payload().get("deal_value")).intValue());
        }

        @Test
        @DisplayName("unqualified lead ends after qualification")
        void unqualifiedLeadEnds() throws Exception {
            start(referenceGraph(), dealValuePolicy());

            TaskView view = scheduler.submit("qualify", Map.of("company", "Initech", "score_hint", 40), Priority.LOW)
                    .await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(Tier.OPERATIONAL, view.tier());
            assertEquals(List.of("qualify"), historyNodes(view));
        }

        @Test
        @DisplayName("generated task ids follow TF-YYYY-NNNN")
        void generatedTaskId() throws Exception {
            start(referenceGraph(), dealValuePolicy());

            TaskHandle handle = scheduler.submit("qualify", Map.of("company", "Globex", "score_hint", 10), null);
            handle.await(WAIT);

            assertTrue(handle.taskId().matches("TF-\\d{4}-\\d{4}"), handle.taskId());
            assertTrue(scheduler.getStatus(handle.taskId()).isPresent());
        }
    }

    // -- Submission validation ----------------------------------------------------

    @Nested
    @DisplayName("submission validation")
    class ValidationTests {

        @BeforeEach
        void startScheduler() {
            agent("lead-agent", Tier.OPERATIONAL, "lead_qualification", 1,
                    ctx -> AgentResult.success(Map.of("lead_score", 10)));
            start(referenceGraph(), dealValuePolicy());
        }

        @Test
        @DisplayName("missing required field is rejected and never checkpointed")
        void missingRequiredField() {
            var ex = assertThrows(ValidationException.class,
                    () -> scheduler.submit(new SubmitRequest("TF-2026-0050", "qualify",
                            Map.of("contact", "jane@acme.test"), Priority.HIGH)));

            assertTrue(ex.getMessage().contains("[company]"), ex.getMessage());
            assertTrue(store.listTaskIds().isEmpty());
            assertTrue(events.isEmpty());
            assertTrue(scheduler.getStatus("TF-2026-0050").isEmpty());
        }

        @Test
        @DisplayName("unknown or non-entry nodes are rejected")
        void badEntryNode() {
            assertThrows(ValidationException.class,
                    () -> scheduler.submit("nowhere", Map.of(), Priority.MEDIUM));
            assertThrows(ValidationException.class,
                    () -> scheduler.submit("propose", Map.of("company", "Acme"), Priority.MEDIUM));
        }

        @Test
        @DisplayName("duplicate task id is rejected")
        void duplicateTaskId() throws Exception {
            var request = new SubmitRequest("TF-2026-0051", "qualify", Map.of("company", "Acme"), Priority.MEDIUM);
            scheduler.submit(request).await(WAIT);

            assertThrows(ValidationException.class, () -> scheduler.submit(request));
        }
    }

    @Test
    @DisplayName("submit before start is refused")
    void submitBeforeStart() {
        scheduler = new SchedulerCore(referenceGraph(), registry, dealValuePolicy(), store, eventBus, null,
                new BackoffPolicy(Duration.ofMillis(10), 2.0, Duration.ofMillis(40)), Clock.systemUTC(), false);

        assertFalse(scheduler.isRunning());
        assertThrows(IllegalStateException.class,
                () -> scheduler.submit("qualify", Map.of("company", "Acme"), Priority.MEDIUM));
    }

    @Test
    @DisplayName("threshold pointing at an unknown node fails construction")
    void thresholdAgainstUnknownNode() {
        var policy = new EscalationPolicy(2, List.of(
                new ValueThreshold("broken", "propose", "deal_value", 1_000_000, "nowhere")));

        assertThrows(GraphValidationException.class,
                () -> new SchedulerCore(referenceGraph(), registry, policy, store, eventBus, null,
                        new BackoffPolicy(Duration.ZERO, 1.0, Duration.ZERO), Clock.systemUTC(), false));
    }

    // -- Retries and escalation ---------------------------------------------------

    @Nested
    @DisplayName("retries and escalation")
    class RetryTests {

        private WorkflowGraph auditGraph() {
            return new WorkflowGraph()
                    .addNode(NodeDefinition.builder("audit").capability("seo_audit").maxRetries(2).build())
                    .addNode("review", "sales_operations", Tier.MANAGEMENT)
                    .addEntryPoint("audit")
                    .setTierHandler(Tier.MANAGEMENT, "review");
        }

        @BeforeEach
        void salesOpsAgent() {
            agent("sales-ops", Tier.MANAGEMENT, "sales_operations", 1,
                    ctx -> AgentResult.success(Map.of("reviewed", true)));
        }

        @Test
        @DisplayName("exhausted node escalates one tier after max retries + 1 attempts")
        void exhaustedNodeEscalates() throws Exception {
            var attempts = new AtomicInteger();
            agent("auditor", Tier.OPERATIONAL, "seo_audit", 1, ctx -> {
                attempts.incrementAndGet();
                return AgentResult.transientError("rate limited");
            });
            start(auditGraph(), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0060", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(3, attempts.get());
            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(Tier.MANAGEMENT, view.tier());
            assertEquals(1, view.escalationCount());
            assertEquals(List.of("audit", "review"), historyNodes(view));
            assertEquals(NodeOutcome.EXHAUSTED, view.history().get(0).outcome());

            List<OrchestrationEvent> retries = eventsOfType(EventTypes.NODE_RETRY_SCHEDULED);
            assertEquals(2, retries.size());
            assertEquals(10L, retries.get(0).get("delayMs"));
            assertEquals(20L, retries.get(1).get("delayMs"));
        }

        @Test
        @DisplayName("refused escalation fails the task and flags exhaustion")
        void escalationRefused() throws Exception {
            agent("auditor", Tier.OPERATIONAL, "seo_audit", 1, ctx -> AgentResult.transientError("rate limited"));
            start(auditGraph(), new EscalationPolicy(0, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0061", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertEquals(TaskState.FAILED_MARKER, view.currentNode());
            OrchestrationEvent failed = eventsOfType(EventTypes.TASK_FAILED).get(0);
            assertEquals(Boolean.TRUE, failed.get("escalationExhausted"));
            assertEquals(TaskStatus.FAILED, store.replay("TF-2026-0061").orElseThrow().status());
        }

        @Test
        @DisplayName("capability without an agent counts as exhausted")
        void unavailableAgentEscalates() throws Exception {
            start(auditGraph(), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0062", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(NodeOutcome.UNAVAILABLE, view.history().get(0).outcome());
            assertEquals(Tier.MANAGEMENT, view.tier());
        }

        @Test
        @DisplayName("transient errors and thrown exceptions are retried until success")
        void retriedUntilSuccess() throws Exception {
            var attempts = new AtomicInteger();
            agent("auditor", Tier.OPERATIONAL, "seo_audit", 1, ctx -> {
                int attempt = attempts.incrementAndGet();
                if (attempt == 1) {
                    throw new IllegalStateException("connection reset");
                }
                if (attempt == 2) {
                    return AgentResult.transientError("rate limited");
                }
                return AgentResult.success(Map.of("issues", 12));
            });
            start(auditGraph(), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0063", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(Tier.OPERATIONAL, view.tier());
            assertEquals(List.of("audit"), historyNodes(view));
            assertEquals(0, store.replay("TF-2026-0063").orElseThrow().retryCount("audit"));
        }

        @Test
        @DisplayName("timed-out call is cancelled and counts as a failed attempt")
        void timeout() throws Exception {
            var started = new CountDownLatch(1);
            var cancelled = new CountDownLatch(1);
            agent("slow", Tier.OPERATIONAL, "enrichment", 1, ctx -> sleepUntilCancelled(started, cancelled));
            start(singleNode(NodeDefinition.builder("enrich").capability("enrichment")
                    .maxRetries(0).timeout(Duration.ofMillis(100)).build()), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit("enrich", Map.of(), Priority.MEDIUM).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertTrue(view.failureReason().contains("timed out"), view.failureReason());
            assertEquals(1, eventsOfType(EventTypes.NODE_TIMED_OUT).size());
            assertTrue(cancelled.await(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("agent raising an Error is retried and gives its worker slot back")
        void agentErrorReleasesSlot() throws Exception {
            var attempts = new AtomicInteger();
            agent("auditor", Tier.OPERATIONAL, "seo_audit", 1, ctx -> {
                if (attempts.incrementAndGet() == 1) {
                    throw new AssertionError("crawler invariant broken");
                }
                return AgentResult.success(Map.of("issues", 3));
            });
            start(auditGraph(), new EscalationPolicy(2, List.of()));

            TaskView first = scheduler.submit(new SubmitRequest("TF-2026-0064", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);
            TaskView second = scheduler.submit(new SubmitRequest("TF-2026-0065", "audit",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, first.status());
            assertEquals(TaskStatus.SUCCEEDED, second.status());
            assertEquals(3, attempts.get());
            assertEquals(0, scheduler.inFlight("auditor"));
            OrchestrationEvent failedCall = eventsOfType(EventTypes.NODE_COMPLETED).get(0);
            assertEquals("TRANSIENT_ERROR", failedCall.get("status"));
            assertTrue(String.valueOf(failedCall.get("error")).contains("AssertionError"));
        }
    }

    // -- Fan-out / fan-in --------------------------------------------------------

    @Nested
    @DisplayName("fan-out and fan-in")
    class FanOutTests {

        private final AtomicInteger mergeCalls = new AtomicInteger();
        private final AtomicReference<Map<String, Object>> mergePayload = new AtomicReference<>();

        private WorkflowGraph analysisGraph(int quorum) {
            return new WorkflowGraph()
                    .addNode(NodeDefinition.builder("parallel_analysis").build())
                    .addNode("technical", "technical_seo_audit", Tier.OPERATIONAL)
                    .addNode("competitive", "competitive_analysis", Tier.OPERATIONAL)
                    .addNode("content", "content_strategy", Tier.OPERATIONAL)
                    .addNode("merge", "reporting", Tier.OPERATIONAL)
                    .addFanOut("parallel_analysis", List.of("technical", "competitive", "content"), "merge", quorum)
                    .addSequentialEdge("technical", "merge")
                    .addSequentialEdge("competitive", "merge")
                    .addSequentialEdge("content", "merge")
                    .addEntryPoint("parallel_analysis");
        }

        @BeforeEach
        void reporter() {
            agent("reporter", Tier.OPERATIONAL, "reporting", 1, ctx -> {
                mergeCalls.incrementAndGet();
                mergePayload.set(ctx.payload());
                return AgentResult.success(Map.of("report", "done"));
            });
        }

        @Test
        @DisplayName("fatal branch cancels its siblings and fails without reaching fan-in")
        void fatalBranchFailsTask() throws Exception {
            var started = new CountDownLatch(2);
            var cancelled = new CountDownLatch(2);
            agent("technical-agent", Tier.OPERATIONAL, "technical_seo_audit", 1,
                    ctx -> sleepUntilCancelled(started, cancelled));
            agent("content-agent", Tier.OPERATIONAL, "content_strategy", 1,
                    ctx -> sleepUntilCancelled(started, cancelled));
            agent("competitive-agent", Tier.OPERATIONAL, "competitive_analysis", 1, ctx -> {
                started.await(5, TimeUnit.SECONDS);
                return AgentResult.fatalError("source data corrupt");
            });
            start(analysisGraph(3), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0070", "parallel_analysis",
                    Map.of("domain", "acme.test"), Priority.HIGH)).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertTrue(view.failureReason().contains("branch 'competitive'"), view.failureReason());
            assertTrue(cancelled.await(5, TimeUnit.SECONDS));
            assertEquals(0, mergeCalls.get());
            assertTrue(eventsOfType(EventTypes.TASK_FANNED_IN).isEmpty());
            assertTrue(events.stream().noneMatch(e -> EventTypes.NODE_DISPATCHED.equals(e.eventType())
                    && "merge".equals(e.nodeId())));
        }

        @Test
        @DisplayName("fan-in merges branches in declaration order whatever order they finish in")
        void deterministicMerge() throws Exception {
            agent("technical-agent", Tier.OPERATIONAL, "technical_seo_audit", 1, ctx -> {
                Thread.sleep(100);
                return AgentResult.success(Map.of("score", 1, "technical_issues", 7));
            });
            agent("competitive-agent", Tier.OPERATIONAL, "competitive_analysis", 1, ctx -> {
                Thread.sleep(50);
                return AgentResult.success(Map.of("competitors", 4));
            });
            agent("content-agent", Tier.OPERATIONAL, "content_strategy", 1,
                    ctx -> AgentResult.success(Map.of("score", 3)));
            start(analysisGraph(3), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0071", "parallel_analysis",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(List.of("parallel_analysis", "technical", "competitive", "content", "merge"),
                    historyNodes(view));
            assertEquals(1, mergeCalls.get());
            assertEquals(3, ((Number) mergePayload.get().get("score")).intValue());
            assertEquals(7, ((Number) mergePayload.get().get("technical_issues")).intValue());
            assertEquals(3, eventsOfType(EventTypes.BRANCH_COMPLETED).size());
        }

        @Test
        @DisplayName("quorum join proceeds without the slowest branch and cancels it")
        void quorumJoin() throws Exception {
            var started = new CountDownLatch(1);
            var cancelled = new CountDownLatch(1);
            agent("technical-agent", Tier.OPERATIONAL, "technical_seo_audit", 1,
                    ctx -> AgentResult.success(Map.of("technical_issues", 7)));
            agent("competitive-agent", Tier.OPERATIONAL, "competitive_analysis", 1,
                    ctx -> AgentResult.success(Map.of("competitors", 4)));
            agent("content-agent", Tier.OPERATIONAL, "content_strategy", 1,
                    ctx -> sleepUntilCancelled(started, cancelled));
            start(analysisGraph(2), new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0072", "parallel_analysis",
                    Map.of("domain", "acme.test"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(List.of("parallel_analysis", "technical", "competitive", "merge"), historyNodes(view));
            assertTrue(mergePayload.get().containsKey("technical_issues"));
            assertTrue(mergePayload.get().containsKey("competitors"));
            assertTrue(cancelled.await(5, TimeUnit.SECONDS));

            OrchestrationEvent fannedIn = eventsOfType(EventTypes.TASK_FANNED_IN).get(0);
            assertEquals(2, fannedIn.get("merged"));
            assertEquals(1, fannedIn.get("cancelled"));
        }
    }

    // -- Concurrency --------------------------------------------------------------

    @Test
    @DisplayName("never runs more calls against an agent than its concurrency limit")
    void concurrencyLimit() throws Exception {
        var current = new AtomicInteger();
        var peak = new AtomicInteger();
        agent("enricher", Tier.OPERATIONAL, "enrichment", 2, ctx -> {
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
            try {
                Thread.sleep(50);
            } finally {
                current.decrementAndGet();
            }
            return AgentResult.success(Map.of());
        });
        start(singleNode(NodeDefinition.builder("enrich").capability("enrichment").build()),
                new EscalationPolicy(2, List.of()));

        var handles = new ArrayList<TaskHandle>();
        for (int i = 0; i < 6; i++) {
            handles.add(scheduler.submit("enrich", Map.of("index", i), Priority.MEDIUM));
        }
        for (TaskHandle handle : handles) {
            assertEquals(TaskStatus.SUCCEEDED, handle.await(WAIT).status());
        }

        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
        assertFalse(eventsOfType(EventTypes.NODE_BACKPRESSURE).isEmpty());
        assertEquals(0, scheduler.inFlight("enricher"));
        assertEquals(0, scheduler.activeTaskCount());
    }

    // -- Cancellation ---------------------------------------------------------------

    @Test
    @DisplayName("cancel fails the task and interrupts the in-flight call")
    void cancel() throws Exception {
        var started = new CountDownLatch(1);
        var cancelled = new CountDownLatch(1);
        agent("slow", Tier.OPERATIONAL, "enrichment", 1, ctx -> sleepUntilCancelled(started, cancelled));
        start(singleNode(NodeDefinition.builder("enrich").capability("enrichment").build()),
                new EscalationPolicy(2, List.of()));

        TaskHandle handle = scheduler.submit(new SubmitRequest("TF-2026-0080", "enrich", Map.of(), Priority.MEDIUM));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.cancel("TF-2026-0080"));
        TaskView view = handle.await(WAIT);

        assertEquals(TaskStatus.FAILED, view.status());
        assertEquals("cancelled by request", view.failureReason());
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
        assertTrue(eventTypes("TF-2026-0080").contains(EventTypes.TASK_CANCELLED));
        assertEquals("cancelled by request", store.replay("TF-2026-0080").orElseThrow().failureReason());
        assertFalse(scheduler.cancel("TF-2026-0080"));
        assertFalse(scheduler.cancel("TF-2026-9999"));
    }

    // -- Checkpointing and recovery ---------------------------------------------------

    @Nested
    @DisplayName("checkpointing and recovery")
    class RecoveryTests {

        private final AtomicInteger qualifyCalls = new AtomicInteger();

        @BeforeEach
        void agents() {
            agent("lead-agent", Tier.OPERATIONAL, "lead_qualification", 1, ctx -> {
                qualifyCalls.incrementAndGet();
                return AgentResult.success(Map.of("lead_score", 85));
            });
            agent("proposal-agent", Tier.OPERATIONAL, "proposal_generation", 1,
                    ctx -> AgentResult.success(Map.of("deal_value", 100_000)));
        }

        private TaskState crashedAtPropose(String taskId) {
            Instant now = Instant.now();
            TaskState state = TaskState.initial(taskId, "qualify", Map.of("company", "Acme", "lead_score", 85),
                            Priority.MEDIUM, Tier.OPERATIONAL, now)
                    .withHistory(new HistoryEntry("qualify", now, NodeOutcome.SUCCEEDED, Tier.OPERATIONAL, "lead-agent"))
                    .movedTo("propose", now);
            store.write(state);
            return state;
        }

        @Test
        @DisplayName("resume continues from the checkpointed node")
        void resume() throws Exception {
            TaskState crashed = crashedAtPropose("TF-2026-0090");
            start(referenceGraph(), dealValuePolicy());

            TaskState replayed = store.replay("TF-2026-0090").orElseThrow();
            assertEquals(crashed.currentNode(), replayed.currentNode());
            assertEquals(crashed.tier(), replayed.tier());
            assertEquals(crashed.history().size(), replayed.history().size());

            TaskView view = scheduler.resume("TF-2026-0090").await(WAIT);

            assertEquals(TaskStatus.SUCCEEDED, view.status());
            assertEquals(List.of("qualify", "propose"), historyNodes(view));
            assertEquals(0, qualifyCalls.get());
            assertTrue(eventTypes("TF-2026-0090").contains(EventTypes.TASK_RESUMED));
        }

        @Test
        @DisplayName("unfinished tasks are recovered on startup")
        void recoverOnStartup() throws Exception {
            crashedAtPropose("TF-2026-0091");
            var done = new CountDownLatch(1);
            eventBus.subscribe(EventFilter.ofTypes(EventTypes.TASK_SUCCEEDED), e -> done.countDown());

            start(referenceGraph(), dealValuePolicy(), true);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(TaskStatus.SUCCEEDED, scheduler.getStatus("TF-2026-0091").orElseThrow().status());
        }

        @Test
        @DisplayName("resume without a checkpoint is rejected")
        void resumeUnknown() {
            start(referenceGraph(), dealValuePolicy());

            assertThrows(ValidationException.class, () -> scheduler.resume("TF-2026-0999"));
            assertTrue(scheduler.getStatus("TF-2026-0999").isEmpty());
        }

        @Test
        @DisplayName("failed checkpoint write stops the task")
        void checkpointFailure() throws Exception {
            store = new InMemoryCheckpointStore() {
                @Override
                public Checkpoint write(TaskState state) {
                    if (state.sequence() > 0) {
                        throw new CheckpointException("disk full");
                    }
                    return super.write(state);
                }
            };
            start(referenceGraph(), dealValuePolicy());

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0092", "qualify",
                    Map.of("company", "Acme"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertEquals("checkpoint write failed: disk full", view.failureReason());
            assertEquals(1, eventsOfType(EventTypes.CHECKPOINT_FAILED).size());
            assertEquals(Boolean.TRUE, eventsOfType(EventTypes.TASK_FAILED).get(0).get("checkpointFailure"));
        }
    }

    // -- Failures inside the dispatch loop ------------------------------------------

    @Nested
    @DisplayName("failures inside the dispatch loop")
    class LoopFailureTests {

        @Test
        @DisplayName("routing rule that throws fails the task with a durable record")
        void throwingRuleFailsTask() throws Exception {
            agent("lead-agent", Tier.OPERATIONAL, "lead_qualification", 1,
                    ctx -> AgentResult.success(Map.of("notes", "no score")));
            WorkflowGraph graph = new WorkflowGraph()
                    .addNode("qualify", "lead_qualification")
                    .addNode("propose", "proposal_generation")
                    .addEdge("qualify", state -> ((Number) state.payload().get("lead_score")).doubleValue() >= 70
                            ? NodeSelection.next("propose")
                            : NodeSelection.end(), "propose")
                    .addEntryPoint("qualify");
            start(graph, new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0100", "qualify",
                    Map.of("company", "Acme"), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertTrue(view.failureReason().startsWith("rule at 'qualify' threw"), view.failureReason());
            TaskState stored = store.replay("TF-2026-0100").orElseThrow();
            assertEquals(TaskStatus.FAILED, stored.status());
            assertEquals(view.failureReason(), stored.failureReason());
            assertTrue(eventTypes("TF-2026-0100").contains(EventTypes.TASK_FAILED));
            assertEquals(0, scheduler.activeTaskCount());
        }

        @Test
        @DisplayName("unexpected exception while dispatching fails the task instead of stranding it")
        void unexpectedDispatchErrorFailsTask() throws Exception {
            registry = mock(AgentRegistry.class);
            when(registry.resolve(eq("enrichment"), any(Tier.class)))
                    .thenThrow(new IllegalStateException("registry corrupted"));
            start(singleNode(NodeDefinition.builder("enrich").capability("enrichment").build()),
                    new EscalationPolicy(2, List.of()));

            TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0101", "enrich",
                    Map.of(), Priority.MEDIUM)).await(WAIT);

            assertEquals(TaskStatus.FAILED, view.status());
            assertEquals("internal error: IllegalStateException: registry corrupted", view.failureReason());
            assertEquals(TaskStatus.FAILED, store.replay("TF-2026-0101").orElseThrow().status());
            assertTrue(eventTypes("TF-2026-0101").contains(EventTypes.TASK_FAILED));
        }
    }

    // -- Tier reset ---------------------------------------------------------------------

    @Test
    @DisplayName("resetting node returns an escalated task to OPERATIONAL and keeps its escalation count")
    void tierReset() throws Exception {
        agent("proposal-agent", Tier.OPERATIONAL, "proposal_generation", 1,
                ctx -> AgentResult.success(Map.of("deal_value", 3_200_000)));
        agent("sales-ops", Tier.MANAGEMENT, "sales_operations", 1,
                ctx -> AgentResult.success(Map.of("review_status", "approved")));
        agent("onboarding-agent", Tier.OPERATIONAL, "client_onboarding", 1,
                ctx -> AgentResult.success(Map.of("onboarded", true)));
        WorkflowGraph graph = new WorkflowGraph()
                .addNode("propose", "proposal_generation")
                .addNode(NodeDefinition.builder("review").capability("sales_operations")
                        .tier(Tier.MANAGEMENT).resetsTier().build())
                .addNode("onboard", "client_onboarding")
                .addSequentialEdge("propose", "onboard")
                .addSequentialEdge("review", "onboard")
                .addEntryPoint("propose")
                .setTierHandler(Tier.MANAGEMENT, "review");
        start(graph, new EscalationPolicy(2, List.of(
                new ValueThreshold("proposal-management-review", "propose", "deal_value", 2_500_000, "review"))));

        TaskView view = scheduler.submit(new SubmitRequest("TF-2026-0110", "propose",
                Map.of("company", "Acme"), Priority.HIGH)).await(WAIT);

        assertEquals(TaskStatus.SUCCEEDED, view.status());
        assertEquals(Tier.OPERATIONAL, view.tier());
        assertEquals(1, view.escalationCount());
        assertEquals(List.of("propose", "review", "onboard"), historyNodes(view));
        assertEquals(List.of(Tier.OPERATIONAL, Tier.MANAGEMENT, Tier.OPERATIONAL),
                view.history().stream().map(HistoryEntry::tier).toList());

        OrchestrationEvent reset = eventsOfType(EventTypes.TASK_TIER_RESET).get(0);
        assertEquals("TF-2026-0110", reset.taskId());
        assertEquals("review", reset.nodeId());
        assertEquals("MANAGEMENT", reset.get("from"));
        assertEquals("OPERATIONAL", reset.get("to"));

        // tiers only go up, except across the reset after 'review'
        var codec = new TaskStateCodec();
        List<TaskState> checkpoints = store.history("TF-2026-0110").stream()
                .map(cp -> codec.decode(cp.state()))
                .toList();
        TaskState atOnboard = checkpoints.stream()
                .filter(state -> "onboard".equals(state.currentNode()))
                .findFirst()
                .orElseThrow();
        assertEquals(Tier.OPERATIONAL, atOnboard.tier());
        assertEquals(1, atOnboard.escalationCount());
        int drops = 0;
        for (int i = 1; i < checkpoints.size(); i++) {
            if (checkpoints.get(i).tier().compareTo(checkpoints.get(i - 1).tier()) < 0) {
                drops++;
                assertEquals("onboard", checkpoints.get(i).currentNode());
            }
        }
        assertEquals(1, drops);
        assertEquals(Tier.OPERATIONAL, store.replay("TF-2026-0110").orElseThrow().tier());
    }

    // -- Finished task views ---------------------------------------------------------------

    @Test
    @DisplayName("finished tasks beyond the cache limit are answered from their checkpoints")
    void finishedViewsAreEvicted() throws Exception {
        agent("enricher", Tier.OPERATIONAL, "enrichment", 2, ctx -> AgentResult.success(Map.of("enriched", true)));
        scheduler = new SchedulerCore(singleNode(NodeDefinition.builder("enrich").capability("enrichment").build()),
                registry, new EscalationPolicy(2, List.of()), store, eventBus,
                new OrchestrationMetrics(new SimpleMeterRegistry()),
                new BackoffPolicy(Duration.ofMillis(10), 2.0, Duration.ofMillis(40)),
                Clock.systemUTC(), false, 1);
        scheduler.start();

        for (int i = 1; i <= 3; i++) {
            TaskView done = scheduler.submit(new SubmitRequest("TF-2026-012" + i, "enrich",
                    Map.of("index", i), Priority.LOW)).await(WAIT);
            assertEquals(TaskStatus.SUCCEEDED, done.status());
        }

        assertEquals(1, scheduler.cachedViewCount());
        TaskView evicted = scheduler.getStatus("TF-2026-0121").orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, evicted.status());
        assertEquals("SUCCEEDED", evicted.phase());
        assertEquals(List.of("enrich"), historyNodes(evicted));
        assertEquals(TaskStatus.SUCCEEDED, scheduler.getStatus("TF-2026-0123").orElseThrow().status());
        assertThrows(ValidationException.class, () -> scheduler.submit(new SubmitRequest("TF-2026-0121", "enrich",
                Map.of(), Priority.LOW)));
    }
}
