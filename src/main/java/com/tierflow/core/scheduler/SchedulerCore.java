package com.tierflow.core.scheduler;

import com.tierflow.config.TierflowProperties;
import com.tierflow.core.agent.AgentContext;
import com.tierflow.core.agent.AgentRegistry;
import com.tierflow.core.agent.AgentResult;
import com.tierflow.core.agent.AgentUnavailableException;
import com.tierflow.core.agent.CancellationSignal;
import com.tierflow.core.agent.ResolvedAgent;
import com.tierflow.core.escalation.EscalationDecision;
import com.tierflow.core.escalation.EscalationPolicy;
import com.tierflow.core.events.EventBus;
import com.tierflow.core.events.EventFilter;
import com.tierflow.core.events.EventTypes;
import com.tierflow.core.events.OrchestrationEvent;
import com.tierflow.core.graph.FanOutEdge;
import com.tierflow.core.graph.GraphValidationException;
import com.tierflow.core.graph.NodeDefinition;
import com.tierflow.core.graph.NodeSelection;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.logging.MdcContext;
import com.tierflow.core.metrics.OrchestrationMetrics;
import com.tierflow.core.model.HistoryEntry;
import com.tierflow.core.model.NodeOutcome;
import com.tierflow.core.model.Priority;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.TaskStatus;
import com.tierflow.core.model.TaskView;
import com.tierflow.core.persistence.CheckpointStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives tasks through the workflow graph.
 * <p>
 * A single dispatch-loop thread owns every {@link TaskState}: submissions, agent results,
 * timeouts, backoff expiry and cancellations are all posted to it as messages. Agent calls
 * run on per-agent worker pools bounded by the agent's concurrency limit; work for a
 * saturated agent is parked (never spun on) until one of its calls returns.
 * <p>
 * Every committed transition is written to the {@link CheckpointStore} before the task is
 * dispatched again, and lifecycle events are published on the {@link EventBus} in the
 * order the transitions happened.
 */
@Service
public class SchedulerCore {

    private static final Logger log = LoggerFactory.getLogger(SchedulerCore.class);

    static final int DEFAULT_FINISHED_VIEW_LIMIT = 1000;

    private final WorkflowGraph graph;
    private final AgentRegistry registry;
    private final EscalationPolicy escalationPolicy;
    private final CheckpointStore checkpointStore;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final boolean recoverOnStartup;

    private final AgentWorkerPools pools = new AgentWorkerPools();
    private final FanInMerger merger = new FanInMerger();
    private final AtomicInteger taskCounter = new AtomicInteger(0);

    private volatile ExecutorService loop;
    private volatile Thread loopThread;
    private volatile ScheduledExecutorService timers;

    // Dispatch-loop state: only touched from the loop thread
    private final Map<String, TaskRun> runs = new HashMap<>();
    private final Map<String, WorkUnit> units = new HashMap<>();
    private final ReadyQueue ready = new ReadyQueue();
    private final Map<String, List<ReadyQueue.Item>> parkedByAgent = new HashMap<>();

    // Readable from any thread; live tasks only
    private final ConcurrentHashMap<String, TaskView> views = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TaskHandle> handles = new ConcurrentHashMap<>();
    // Recently finished tasks, oldest evicted first; older ones are answered from checkpoints
    private final Map<String, TaskView> recentlyFinished;
    private final int finishedViewLimit;

    @Autowired
    public SchedulerCore(TierflowProperties properties, WorkflowGraph graph, AgentRegistry registry,
                         EscalationPolicy escalationPolicy, CheckpointStore checkpointStore,
                         EventBus eventBus, OrchestrationMetrics metrics) {
        this(graph, registry, escalationPolicy, checkpointStore, eventBus, metrics,
                BackoffPolicy.from(properties.getScheduler()), Clock.systemUTC(),
                properties.getScheduler().isRecoverOnStartup(),
                properties.getScheduler().getFinishedViewLimit());
    }

    public SchedulerCore(WorkflowGraph graph, AgentRegistry registry, EscalationPolicy escalationPolicy,
                         CheckpointStore checkpointStore, EventBus eventBus, OrchestrationMetrics metrics,
                         BackoffPolicy backoff, Clock clock, boolean recoverOnStartup) {
        this(graph, registry, escalationPolicy, checkpointStore, eventBus, metrics, backoff, clock,
                recoverOnStartup, DEFAULT_FINISHED_VIEW_LIMIT);
    }

    /**
     * @param finishedViewLimit finished tasks whose final view stays in memory; 0 answers
     *                          every finished task from its checkpoint
     */
    public SchedulerCore(WorkflowGraph graph, AgentRegistry registry, EscalationPolicy escalationPolicy,
                         CheckpointStore checkpointStore, EventBus eventBus, OrchestrationMetrics metrics,
                         BackoffPolicy backoff, Clock clock, boolean recoverOnStartup, int finishedViewLimit) {
        this.graph = graph.isValidated() ? graph : graph.validate();
        List<String> problems = escalationPolicy.checkAgainst(this.graph);
        if (!problems.isEmpty()) {
            throw new GraphValidationException(problems);
        }
        this.registry = registry;
        this.escalationPolicy = escalationPolicy;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.backoff = backoff;
        this.clock = clock;
        this.recoverOnStartup = recoverOnStartup;
        this.finishedViewLimit = Math.max(0, finishedViewLimit);
        this.recentlyFinished = Collections.synchronizedMap(new LinkedHashMap<String, TaskView>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TaskView> eldest) {
                return size() > SchedulerCore.this.finishedViewLimit;
            }
        });
    }

    // -- Lifecycle -------------------------------------------------------------

    @PostConstruct
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tierflow-dispatch");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tierflow-timers");
            t.setDaemon(true);
            return t;
        });
        log.info("Scheduler started (graph={}, backoff base={} factor={} max={})",
                graph, backoff.base(), backoff.factor(), backoff.max());
        if (recoverOnStartup) {
            int resumed = recoverAll();
            if (resumed > 0) {
                log.info("Recovered {} unfinished task(s) from checkpoints", resumed);
            }
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (loop == null) {
            return;
        }
        timers.shutdownNow();
        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        pools.shutdown();
        loop = null;
        log.info("Scheduler stopped");
    }

    // -- Public API ------------------------------------------------------------

    public TaskHandle submit(String entryNode, Map<String, Object> payload, Priority priority) {
        return submit(SubmitRequest.of(entryNode, payload, priority));
    }

    /**
     * Validates and enqueues a task.
     *
     * @throws ValidationException when the entry node is unknown or not an entry point,
     *                             a required payload field is missing, or the id is taken
     */
    public TaskHandle submit(SubmitRequest request) {
        requireStarted();
        NodeDefinition entry = validateSubmission(request);

        String taskId = request.taskId() == null || request.taskId().isBlank()
                ? generateTaskId()
                : request.taskId();
        if (isKnown(taskId)) {
            throw new ValidationException("Duplicate task id: " + taskId);
        }

        TaskState initial = TaskState.initial(taskId, entry.id(), request.payload(), request.priority(),
                entry.tier(), clock.instant());
        if (views.putIfAbsent(taskId, TaskView.of(initial, DispatchPhase.QUEUED.name())) != null) {
            throw new ValidationException("Duplicate task id: " + taskId);
        }
        var handle = new TaskHandle(taskId, new CompletableFuture<>());
        handles.put(taskId, handle);

        log.info("Submitted task {} at '{}' [{}]", taskId, entry.id(), request.priority());
        onLoop(taskId, () -> admit(initial, handle.completion(), EventTypes.TASK_SUBMITTED));
        return handle;
    }

    /**
     * Current view of a task: live while it runs or was finished recently, otherwise
     * reconstructed from its latest checkpoint.
     */
    public Optional<TaskView> getStatus(String taskId) {
        TaskView view = views.get(taskId);
        if (view == null) {
            view = recentlyFinished.get(taskId);
        }
        if (view != null) {
            return Optional.of(view);
        }
        return checkpointStore.replay(taskId).map(state -> TaskView.of(state, phaseForStatus(state.status()).name()));
    }

    /**
     * Cancels a running task. In-flight agent calls are interrupted and the task is marked
     * FAILED without waiting for the agents to cooperate.
     *
     * @return false when the task is unknown or already terminal
     */
    public boolean cancel(String taskId) {
        requireStarted();
        return callOnLoop(() -> {
            TaskRun run = runs.get(taskId);
            if (run == null || run.finished) {
                return false;
            }
            log.info("Cancelling task {}", taskId);
            publish(EventTypes.TASK_CANCELLED, run, run.state.currentNode(), null, fields());
            finishFailed(run, run.state, "cancelled by request", false);
            return true;
        });
    }

    public EventBus.Subscription subscribeEvents(EventFilter filter, Consumer<OrchestrationEvent> consumer) {
        return eventBus.subscribe(filter, consumer);
    }

    /**
     * Resumes a task from its latest checkpoint. The node that was in flight when the
     * checkpoint was taken is dispatched again.
     *
     * @throws ValidationException when the task has no checkpoint
     */
    public TaskHandle resume(String taskId) {
        requireStarted();
        return callOnLoop(() -> {
            if (runs.containsKey(taskId)) {
                return handles.get(taskId);
            }
            TaskState state = checkpointStore.replay(taskId)
                    .orElseThrow(() -> new ValidationException("No checkpoint for task " + taskId));
            if (state.branch()) {
                throw new ValidationException("Branch " + taskId + " can only be resumed through its parent");
            }
            var handle = new TaskHandle(taskId, new CompletableFuture<>());
            if (state.status().isTerminal()) {
                TaskView view = TaskView.of(state, phaseForStatus(state.status()).name());
                recentlyFinished.put(taskId, view);
                handle.completion().complete(view);
                return handle;
            }
            handles.put(taskId, handle);
            recentlyFinished.remove(taskId);
            views.put(taskId, TaskView.of(state, DispatchPhase.QUEUED.name()));
            admit(state, handle.completion(), EventTypes.TASK_RESUMED);
            return handle;
        });
    }

    /**
     * Resumes every unfinished top-level task found in the checkpoint store.
     *
     * @return number of tasks resumed
     */
    public int recoverAll() {
        requireStarted();
        int resumed = 0;
        for (String taskId : checkpointStore.listTaskIds()) {
            try {
                Optional<TaskState> state = checkpointStore.replay(taskId);
                if (state.isEmpty() || state.get().status().isTerminal() || state.get().branch()) {
                    continue;
                }
                resume(taskId);
                resumed++;
            } catch (RuntimeException e) {
                log.warn("Could not recover task {}: {}", taskId, e.getMessage(), e);
            }
        }
        return resumed;
    }

    /**
     * Generates a task id in the format TF-YYYY-NNNN.
     */
    public String generateTaskId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        String id;
        do {
            id = String.format("TF-%d-%04d", year, taskCounter.incrementAndGet());
        } while (isKnown(id));
        return id;
    }

    private boolean isKnown(String taskId) {
        return views.containsKey(taskId) || recentlyFinished.containsKey(taskId)
                || checkpointStore.load(taskId).isPresent();
    }

    public boolean isRunning() {
        return loop != null;
    }

    /**
     * Number of tasks known to this scheduler that have not reached a terminal status.
     */
    public long activeTaskCount() {
        return views.values().stream().filter(v -> !v.status().isTerminal()).count();
    }

    /**
     * Task views held in memory, live and recently finished.
     */
    int cachedViewCount() {
        return views.size() + recentlyFinished.size();
    }

    int inFlight(String agentId) {
        return pools.inFlight(agentId);
    }

    // -- Submission ------------------------------------------------------------

    private NodeDefinition validateSubmission(SubmitRequest request) {
        if (request.entryNode() == null || !graph.hasNode(request.entryNode())) {
            throw new ValidationException("Unknown entry node: " + request.entryNode());
        }
        if (!graph.isEntryPoint(request.entryNode())) {
            throw new ValidationException("Node '" + request.entryNode() + "' is not an entry point");
        }
        NodeDefinition entry = graph.requireNode(request.entryNode());
        List<String> missing = entry.requiredFields().stream()
                .filter(field -> request.payload().get(field) == null)
                .sorted()
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Payload for '" + entry.id() + "' is missing required field(s) " + missing);
        }
        return entry;
    }

    private void admit(TaskState state, CompletableFuture<TaskView> completion, String eventType) {
        var run = new TaskRun(state, completion);
        run.main = new WorkUnit(state.taskId(), run, false);
        runs.put(state.taskId(), run);
        units.put(run.main.id, run.main);
        MdcContext.setTask(state.taskId());

        // a resumed state is already stored under its sequence; saving it again is a no-op
        if (!commit(run, state)) {
            return;
        }
        publish(eventType, run, state.currentNode(), null, fields(
                "priority", state.priority().name(),
                "tier", state.tier().name(),
                "sequence", state.sequence()));

        if (!TaskState.terminalMarker(state.currentNode()) && !graph.hasNode(state.currentNode())) {
            finishFailed(run, state, "node '" + state.currentNode() + "' is not part of the graph", false);
            return;
        }
        if (state.status() == TaskStatus.AWAITING_FAN_IN) {
            restoreFanOut(run);
        } else {
            schedule(run.main);
        }
    }

    private void restoreFanOut(TaskRun run) {
        run.quorum = quorumFor(run.state);
        run.main.phase = DispatchPhase.AWAITING_FAN_IN;
        for (TaskState branch : run.state.branches()) {
            if (branch.status().isTerminal()) {
                continue;
            }
            var unit = new WorkUnit(branch.taskId(), run, true);
            run.branchUnits.put(unit.id, unit);
            units.put(unit.id, unit);
            schedule(unit);
        }
        evaluateFanIn(run);
    }

    private int quorumFor(TaskState parent) {
        List<String> branchNodes = parent.branches().stream().map(TaskState::currentNode).toList();
        return graph.nodes().stream()
                .map(node -> graph.fanOutFrom(node.id()))
                .flatMap(Optional::stream)
                .filter(edge -> edge.join().equals(parent.currentNode()))
                .findFirst()
                .map(FanOutEdge::quorum)
                .orElse(branchNodes.size());
    }

    // -- Dispatch --------------------------------------------------------------

    private void schedule(WorkUnit unit) {
        unit.phase = DispatchPhase.QUEUED;
        ready.offer(unit.id, unit.run.state.priority());
        publishView(unit.run);
    }

    private void drain() {
        ReadyQueue.Item item;
        while ((item = ready.poll()) != null) {
            WorkUnit unit = units.get(item.unitId());
            if (unit == null || unit.run.finished || unit.phase != DispatchPhase.QUEUED) {
                continue;
            }
            try {
                dispatch(unit, item);
            } catch (RejectedExecutionException e) {
                log.debug("Timer rejected while the scheduler stops: {}", e.getMessage());
            } catch (RuntimeException e) {
                failUnexpectedly(unit.run, e);
            }
        }
    }

    private void dispatch(WorkUnit unit, ReadyQueue.Item item) {
        TaskRun run = unit.run;
        TaskState state = stateOf(unit);
        NodeDefinition node = graph.requireNode(state.currentNode());
        MdcContext.setNode(run.taskId(), node.id(), null);

        if (node.routingOnly()) {
            unit.phase = DispatchPhase.APPLYING;
            applySuccess(unit, node, Map.of(), NodeOutcome.ROUTED, null);
            return;
        }

        ResolvedAgent agent;
        try {
            agent = registry.resolve(node.capabilityTag(), state.tier());
        } catch (AgentUnavailableException e) {
            log.warn("No agent for node '{}' of task {}: {}", node.id(), state.taskId(), e.getMessage());
            unit.phase = DispatchPhase.APPLYING;
            exhaust(unit, node, NodeOutcome.UNAVAILABLE, e.getMessage());
            return;
        }

        if (!pools.tryAcquire(agent.descriptor())) {
            park(unit, item, agent.agentId());
            return;
        }

        unit.phase = DispatchPhase.DISPATCHING;
        long attempt = ++unit.attempts;
        Instant deadline = clock.instant().plus(node.timeout());
        var context = new AgentContext(state.taskId(), node.id(), state.payload(), state.tier(),
                deadline, new CancellationSignal());
        var call = new InFlightCall(unit.id, attempt, agent.agentId(), agent.executor(), context,
                outcome -> onLoop(unit.id, () -> onCallFinished(outcome)));

        try {
            pools.execute(agent.descriptor(), call);
        } catch (RejectedExecutionException e) {
            pools.release(agent.agentId());
            log.warn("Worker pool of agent {} rejected {}; scheduler is shutting down", agent.agentId(), unit.id);
            return;
        }
        unit.call = call;
        unit.timer = timers.schedule(() -> onLoop(unit.id, () -> onTimeout(unit.id, attempt)),
                node.timeout().toMillis(), TimeUnit.MILLISECONDS);
        unit.phase = DispatchPhase.AWAITING_AGENT;

        log.debug("Dispatched {}@{} to agent {} (attempt {})", unit.id, node.id(), agent.agentId(), attempt);
        publish(EventTypes.NODE_DISPATCHED, run, node.id(), agent.agentId(), fields(
                "attempt", attempt,
                "tier", state.tier().name(),
                "substituted", agent.substituted(),
                "branchId", unit.branch ? unit.id : null));
        publishView(run);
    }

    private void park(WorkUnit unit, ReadyQueue.Item item, String agentId) {
        parkedByAgent.computeIfAbsent(agentId, id -> new ArrayList<>()).add(item);
        log.debug("Agent {} saturated; {} waits", agentId, unit.id);
        if (metrics != null) {
            metrics.recordBackpressure(agentId);
        }
        publish(EventTypes.NODE_BACKPRESSURE, unit.run, stateOf(unit).currentNode(), agentId, fields(
                "inFlight", pools.inFlight(agentId),
                "branchId", unit.branch ? unit.id : null));
    }

    private void unpark(String agentId) {
        List<ReadyQueue.Item> parked = parkedByAgent.remove(agentId);
        if (parked == null) {
            return;
        }
        for (ReadyQueue.Item item : parked) {
            WorkUnit unit = units.get(item.unitId());
            if (unit != null && !unit.run.finished && unit.phase == DispatchPhase.QUEUED) {
                ready.requeue(item);
            }
        }
    }

    // -- Agent results ---------------------------------------------------------

    private void onCallFinished(InFlightCall.Outcome outcome) {
        InFlightCall call = outcome.call();
        pools.release(call.agentId());
        unpark(call.agentId());

        WorkUnit unit = units.get(call.unitId());
        if (unit == null || unit.call != call || unit.phase != DispatchPhase.AWAITING_AGENT) {
            log.debug("Ignoring stale result of {}@{} from agent {}", call.unitId(), call.nodeId(), call.agentId());
            return;
        }
        cancelTimer(unit);
        unit.call = null;
        unit.phase = DispatchPhase.APPLYING;

        TaskState state = stateOf(unit);
        NodeDefinition node = graph.requireNode(state.currentNode());
        MdcContext.setNode(unit.run.taskId(), node.id(), call.agentId());

        AgentResult result = outcome.result() != null
                ? outcome.result()
                : AgentResult.transientError(describe(outcome.error()));
        switch (result.status()) {
            case SUCCESS, TERMINAL -> registry.recordSuccess(call.agentId());
            case TRANSIENT_ERROR, FATAL_ERROR -> registry.recordFailure(call.agentId());
        }
        if (metrics != null) {
            metrics.recordNodeExecution(call.agentId(), result.status().name(), outcome.durationMs());
        }
        publish(EventTypes.NODE_COMPLETED, unit.run, node.id(), call.agentId(), fields(
                "status", result.status().name(),
                "succeeded", result.status() == AgentResult.Status.SUCCESS
                        || (result.status() == AgentResult.Status.TERMINAL && result.terminalSucceeded()),
                "durationMs", outcome.durationMs(),
                "tier", state.tier().name(),
                "error", result.error(),
                "branchId", unit.branch ? unit.id : null));

        switch (result.status()) {
            case SUCCESS -> applySuccess(unit, node, result.output(), NodeOutcome.SUCCEEDED, call.agentId());
            case TRANSIENT_ERROR -> applyTransient(unit, node, result.error());
            case FATAL_ERROR -> applyFatal(unit, node, result.error());
            case TERMINAL -> applyTerminal(unit, node, result);
        }
    }

    private void onTimeout(String unitId, long attempt) {
        WorkUnit unit = units.get(unitId);
        if (unit == null || unit.call == null || unit.call.attempt() != attempt
                || unit.phase != DispatchPhase.AWAITING_AGENT) {
            return;
        }
        InFlightCall call = unit.call;
        unit.call = null;
        unit.timer = null;
        unit.phase = DispatchPhase.TIMED_OUT;

        NodeDefinition node = graph.requireNode(stateOf(unit).currentNode());
        MdcContext.setNode(unit.run.taskId(), node.id(), call.agentId());
        log.warn("Agent {} timed out after {} on {}@{}", call.agentId(), node.timeout(), unit.id, node.id());
        call.cancel("timed out after " + node.timeout());
        registry.recordFailure(call.agentId());
        if (metrics != null) {
            metrics.recordTimeout(call.agentId());
        }
        publish(EventTypes.NODE_TIMED_OUT, unit.run, node.id(), call.agentId(), fields(
                "timeoutMs", node.timeout().toMillis(),
                "attempt", attempt,
                "branchId", unit.branch ? unit.id : null));
        applyTransient(unit, node, "timed out after " + node.timeout());
    }

    private void onBackoffElapsed(String unitId, long attempt) {
        WorkUnit unit = units.get(unitId);
        if (unit == null || unit.run.finished || unit.phase != DispatchPhase.BACKOFF || unit.attempts != attempt) {
            return;
        }
        unit.timer = null;
        schedule(unit);
    }

    private void applySuccess(WorkUnit unit, NodeDefinition node, Map<String, Object> output,
                              NodeOutcome outcome, String agentId) {
        Instant now = clock.instant();
        TaskState state = stateOf(unit).withPayloadMerged(output, now);
        if (state.retryCount(node.id()) > 0) {
            state = state.withRetryCount(node.id(), 0, now);
        }
        state = state.withHistory(new HistoryEntry(node.id(), now, outcome, state.tier(), agentId));

        if (unit.branch) {
            advanceBranch(unit, state);
            return;
        }

        EscalationDecision decision = escalationPolicy.afterSuccess(state, node, graph);
        if (decision instanceof EscalationDecision.ResetTier reset) {
            log.info("Task {}: {}", state.taskId(), reset.reason());
            String previousTier = state.tier().name();
            state = state.withTierReset(reset.resetTo(), now);
            publish(EventTypes.TASK_TIER_RESET, unit.run, node.id(), agentId, fields(
                    "from", previousTier,
                    "to", reset.resetTo().name(),
                    "reason", reset.reason()));
            route(unit, state);
        } else if (decision instanceof EscalationDecision.Escalate escalate) {
            escalate(unit, state, escalate);
        } else {
            route(unit, state);
        }
    }

    private void applyTransient(WorkUnit unit, NodeDefinition node, String error) {
        Instant now = clock.instant();
        TaskState state = stateOf(unit);
        int retries = state.retryCount(node.id());
        if (retries >= node.maxRetries()) {
            exhaust(unit, node, NodeOutcome.EXHAUSTED,
                    "retries exhausted (" + node.maxRetries() + "), last error: " + error);
            return;
        }

        int retry = retries + 1;
        if (!commitUnit(unit, state.withRetryCount(node.id(), retry, now))) {
            return;
        }
        Duration delay = backoff.delayFor(retry);
        unit.phase = DispatchPhase.BACKOFF;
        long attempt = unit.attempts;
        unit.timer = timers.schedule(() -> onLoop(unit.id, () -> onBackoffElapsed(unit.id, attempt)),
                delay.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Retrying {}@{} in {} (retry {}/{}): {}", unit.id, node.id(), delay, retry, node.maxRetries(), error);
        if (metrics != null) {
            metrics.recordRetry(node.id());
        }
        publish(EventTypes.NODE_RETRY_SCHEDULED, unit.run, node.id(), null, fields(
                "retry", retry,
                "maxRetries", node.maxRetries(),
                "delayMs", delay.toMillis(),
                "error", error,
                "branchId", unit.branch ? unit.id : null));
        publishView(unit.run);
    }

    private void applyFatal(WorkUnit unit, NodeDefinition node, String error) {
        Instant now = clock.instant();
        TaskState state = stateOf(unit)
                .withHistory(new HistoryEntry(node.id(), now, NodeOutcome.FATAL, stateOf(unit).tier(), error));
        if (unit.branch) {
            String reason = "fatal error in branch '" + node.id() + "': " + error;
            unit.phase = DispatchPhase.FAILED;
            TaskState parent = unit.run.state.withBranches(replaceBranch(unit.run.state, state.failed(reason, now)), now);
            finishFailed(unit.run, parent, reason, false);
            return;
        }
        applyDecision(unit, state, escalationPolicy.onFatal(state, node, graph, String.valueOf(error)));
    }

    private void applyTerminal(WorkUnit unit, NodeDefinition node, AgentResult result) {
        Instant now = clock.instant();
        boolean succeeded = result.terminalSucceeded();
        TaskState state = stateOf(unit);
        if (succeeded) {
            state = state.withPayloadMerged(result.output(), now);
        }
        state = state.withHistory(new HistoryEntry(node.id(), now,
                succeeded ? NodeOutcome.TERMINAL_SUCCESS : NodeOutcome.TERMINAL_FAILURE, state.tier(), result.error()));
        if (unit.branch) {
            String reason = result.error() != null ? result.error() : "terminal failure reported at '" + node.id() + "'";
            branchFinished(unit, succeeded ? state.succeeded(now) : state.failed(reason, now));
            return;
        }
        applyDecision(unit, state, escalationPolicy.onTerminal(state, succeeded, result.error()));
    }

    private void exhaust(WorkUnit unit, NodeDefinition node, NodeOutcome outcome, String cause) {
        Instant now = clock.instant();
        TaskState state = stateOf(unit).withHistory(new HistoryEntry(node.id(), now, outcome, stateOf(unit).tier(), cause));
        if (unit.branch) {
            branchFinished(unit, state.failed("branch '" + node.id() + "' " + cause, now));
            return;
        }
        applyDecision(unit, state, escalationPolicy.onExhausted(state, node, graph, cause));
    }

    private void applyDecision(WorkUnit unit, TaskState state, EscalationDecision decision) {
        if (decision instanceof EscalationDecision.Escalate escalate) {
            escalate(unit, state, escalate);
        } else if (decision instanceof EscalationDecision.Fail fail) {
            finishFailed(unit.run, state, fail.reason(), fail.escalationExhausted());
        } else if (decision instanceof EscalationDecision.Succeed) {
            finishSucceeded(unit.run, state);
        } else if (decision instanceof EscalationDecision.ResetTier reset) {
            route(unit, state.withTierReset(reset.resetTo(), clock.instant()));
        } else {
            route(unit, state);
        }
    }

    // -- Routing ---------------------------------------------------------------

    private void route(WorkUnit unit, TaskState state) {
        NodeSelection selection = graph.resolve(state);
        if (selection instanceof NodeSelection.Next next) {
            if (!commit(unit.run, state.movedTo(next.nodeId(), clock.instant()))) {
                return;
            }
            schedule(unit);
        } else if (selection instanceof NodeSelection.FanOut fanOut) {
            startFanOut(unit.run, state, fanOut);
        } else if (selection instanceof NodeSelection.Fail fail) {
            finishFailed(unit.run, state, fail.reason(), false);
        } else {
            finishSucceeded(unit.run, state);
        }
    }

    private void escalate(WorkUnit unit, TaskState state, EscalationDecision.Escalate escalate) {
        String from = state.currentNode();
        String fromTier = state.tier().name();
        TaskState escalated = state.escalatedTo(escalate.targetNode(), escalate.newTier(), clock.instant());
        if (!commit(unit.run, escalated)) {
            return;
        }
        log.info("Task {} escalated {} -> {} at '{}': {}", escalated.taskId(), fromTier, escalate.newTier(),
                escalate.targetNode(), escalate.reason());
        if (metrics != null) {
            metrics.incrementEscalations(escalate.newTier().name());
        }
        publish(EventTypes.TASK_ESCALATED, unit.run, escalate.targetNode(), null, fields(
                "fromNode", from,
                "fromTier", fromTier,
                "toTier", escalate.newTier().name(),
                "escalationCount", escalated.escalationCount(),
                "reason", escalate.reason()));
        schedule(unit);
    }

    // -- Fan-out / fan-in ------------------------------------------------------

    private void startFanOut(TaskRun run, TaskState state, NodeSelection.FanOut fanOut) {
        Instant now = clock.instant();
        List<TaskState> branches = fanOut.branches().stream()
                .map(branchNode -> state.forkBranch(branchNode, now))
                .toList();
        if (!commit(run, state.awaitingFanIn(fanOut.joinNode(), branches, now))) {
            return;
        }
        int quorum = fanOut.quorum();
        run.quorum = quorum < 1 || quorum > branches.size() ? branches.size() : quorum;
        run.main.phase = DispatchPhase.AWAITING_FAN_IN;

        log.info("Task {} fanned out to {} (join '{}', quorum {})", run.taskId(), fanOut.branches(),
                fanOut.joinNode(), run.quorum);
        publish(EventTypes.TASK_FANNED_OUT, run, state.currentNode(), null, fields(
                "branches", fanOut.branches(),
                "join", fanOut.joinNode(),
                "quorum", run.quorum));
        for (TaskState branch : branches) {
            var unit = new WorkUnit(branch.taskId(), run, true);
            run.branchUnits.put(unit.id, unit);
            units.put(unit.id, unit);
            schedule(unit);
        }
    }

    private void advanceBranch(WorkUnit unit, TaskState branch) {
        Instant now = clock.instant();
        String join = unit.run.state.currentNode();
        NodeSelection selection = graph.resolve(branch);
        if (selection instanceof NodeSelection.Next next && !next.nodeId().equals(join)) {
            if (!commitUnit(unit, branch.movedTo(next.nodeId(), now))) {
                return;
            }
            schedule(unit);
        } else if (selection instanceof NodeSelection.Next || selection instanceof NodeSelection.End) {
            branchFinished(unit, branch.succeeded(now));
        } else if (selection instanceof NodeSelection.Fail fail) {
            branchFinished(unit, branch.failed(fail.reason(), now));
        } else {
            branchFinished(unit, branch.failed("nested fan-out is not supported", now));
        }
    }

    private void branchFinished(WorkUnit unit, TaskState branch) {
        TaskRun run = unit.run;
        unit.phase = branch.status() == TaskStatus.SUCCEEDED ? DispatchPhase.SUCCEEDED : DispatchPhase.FAILED;
        if (!commitUnit(unit, branch)) {
            return;
        }
        log.info("Branch {} finished {}", branch.taskId(), branch.status());
        publish(EventTypes.BRANCH_COMPLETED, run, branch.currentNode(), null, fields(
                "branchId", branch.taskId(),
                "status", branch.status().name(),
                "reason", branch.failureReason()));
        evaluateFanIn(run);
    }

    private void evaluateFanIn(TaskRun run) {
        if (run.finished || run.state.status() != TaskStatus.AWAITING_FAN_IN) {
            return;
        }
        List<TaskState> branches = run.state.branches();
        int succeeded = FanInMerger.succeeded(branches);
        int pending = FanInMerger.pending(branches);
        if (succeeded >= run.quorum) {
            join(run);
        } else if (succeeded + pending < run.quorum) {
            finishFailed(run, run.state, "fan-in at '" + run.state.currentNode() + "' cannot reach quorum "
                    + run.quorum + " (" + succeeded + " succeeded, " + pending + " pending)", false);
        }
    }

    private void join(TaskRun run) {
        int cancelled = cancelBranches(run, "quorum reached at '" + run.state.currentNode() + "'");
        int merged = (int) run.state.branches().stream().filter(b -> b.status().isTerminal()).count();
        TaskState joined = merger.merge(run.state, clock.instant());
        if (!commit(run, joined)) {
            return;
        }
        log.info("Task {} joined at '{}' ({} merged, {} cancelled)", run.taskId(), joined.currentNode(),
                merged, cancelled);
        if (metrics != null) {
            metrics.recordFanIn(merged, cancelled);
        }
        publish(EventTypes.TASK_FANNED_IN, run, joined.currentNode(), null, fields(
                "merged", merged,
                "cancelled", cancelled));
        schedule(run.main);
    }

    /**
     * Cancels every branch that has not reported yet and forgets all branch units.
     *
     * @return number of branches cancelled
     */
    private int cancelBranches(TaskRun run, String reason) {
        int cancelled = 0;
        for (WorkUnit unit : run.branchUnits.values()) {
            if (!unit.phase.isTerminal()) {
                cancelUnit(unit, reason);
                cancelled++;
            }
            units.remove(unit.id);
        }
        run.branchUnits.clear();
        return cancelled;
    }

    private void cancelUnit(WorkUnit unit, String reason) {
        cancelTimer(unit);
        if (unit.call != null) {
            unit.call.cancel(reason);
            unit.call = null;
        }
        ready.remove(unit.id);
        unit.phase = DispatchPhase.FAILED;
    }

    private List<TaskState> replaceBranch(TaskState parent, TaskState branch) {
        List<TaskState> branches = new ArrayList<>(parent.branches());
        for (int i = 0; i < branches.size(); i++) {
            if (branches.get(i).taskId().equals(branch.taskId())) {
                branches.set(i, branch);
                return branches;
            }
        }
        throw new IllegalStateException("Unknown branch " + branch.taskId() + " of task " + parent.taskId());
    }

    // -- Terminal transitions --------------------------------------------------

    private void finishSucceeded(TaskRun run, TaskState state) {
        if (!commit(run, state.succeeded(clock.instant()))) {
            return;
        }
        complete(run, EventTypes.TASK_SUCCEEDED, false, false);
    }

    private void finishFailed(TaskRun run, TaskState state, String reason, boolean escalationExhausted) {
        cancelBranches(run, reason);
        cancelUnit(run.main, reason);
        if (!commit(run, state.failed(reason, clock.instant()))) {
            return;
        }
        log.warn("Task {} failed: {}", run.taskId(), reason);
        complete(run, EventTypes.TASK_FAILED, escalationExhausted, false);
    }

    /**
     * Fails a task whose checkpoint could not be written. The failure stays in memory only.
     */
    private void abort(TaskRun run, String reason) {
        cancelBranches(run, reason);
        cancelUnit(run.main, reason);
        run.state = run.state.failed(reason, clock.instant());
        log.error("Task {} stopped: {}", run.taskId(), reason);
        complete(run, EventTypes.TASK_FAILED, false, true);
    }

    private void complete(TaskRun run, String eventType, boolean escalationExhausted, boolean checkpointFailure) {
        run.finished = true;
        TaskState state = run.state;
        run.main.phase = state.status() == TaskStatus.SUCCEEDED ? DispatchPhase.SUCCEEDED : DispatchPhase.FAILED;
        units.remove(run.main.id);
        runs.remove(run.taskId());
        TaskView view = TaskView.of(state, phaseOf(run).name());
        recentlyFinished.put(run.taskId(), view);
        views.remove(run.taskId());
        handles.remove(run.taskId());

        Instant now = clock.instant();
        boolean slaBreached = state.slaDeadline() != null && now.isAfter(state.slaDeadline());
        if (metrics != null) {
            metrics.recordTaskResult(state.status().name());
        }
        log.info("Task {} finished {} at tier {} after {} history entries", run.taskId(), state.status(),
                state.tier(), state.history().size());
        publish(eventType, run, state.currentNode(), null, fields(
                "status", state.status().name(),
                "priority", state.priority().name(),
                "tier", state.tier().name(),
                "escalationCount", state.escalationCount(),
                "durationMs", Duration.between(state.createdAt(), now).toMillis(),
                "slaBreached", slaBreached,
                "slaDeadline", state.slaDeadline() != null ? state.slaDeadline().toString() : null,
                "reason", state.failureReason(),
                "escalationExhausted", escalationExhausted,
                "checkpointFailure", checkpointFailure));
        run.completion.complete(view);
    }

    // -- Commit / publish ------------------------------------------------------

    /**
     * Installs a new state and writes it ahead of any further dispatch.
     *
     * @return false when the checkpoint failed and the task was stopped
     */
    private boolean commit(TaskRun run, TaskState state) {
        run.state = state;
        try {
            checkpointStore.write(state);
        } catch (RuntimeException e) {
            log.error("Checkpoint {}@{} failed", state.taskId(), state.sequence(), e);
            if (metrics != null) {
                metrics.recordCheckpointFailure();
            }
            publish(EventTypes.CHECKPOINT_FAILED, run, state.currentNode(), null, fields(
                    "sequence", state.sequence(),
                    "error", e.getMessage()));
            abort(run, "checkpoint write failed: " + e.getMessage());
            return false;
        }
        publishView(run);
        return true;
    }

    private boolean commitUnit(WorkUnit unit, TaskState state) {
        if (!unit.branch) {
            return commit(unit.run, state);
        }
        TaskState parent = unit.run.state;
        return commit(unit.run, parent.withBranches(replaceBranch(parent, state), clock.instant()));
    }

    private TaskState stateOf(WorkUnit unit) {
        if (!unit.branch) {
            return unit.run.state;
        }
        for (TaskState branch : unit.run.state.branches()) {
            if (branch.taskId().equals(unit.id)) {
                return branch;
            }
        }
        throw new IllegalStateException("Unknown branch " + unit.id);
    }

    private void publishView(TaskRun run) {
        if (run.finished) {
            return;
        }
        views.put(run.taskId(), TaskView.of(run.state, phaseOf(run).name()));
    }

    private DispatchPhase phaseOf(TaskRun run) {
        if (run.state.status() == TaskStatus.RUNNING) {
            return run.main.phase;
        }
        return phaseForStatus(run.state.status());
    }

    private static DispatchPhase phaseForStatus(TaskStatus status) {
        return switch (status) {
            case SUCCEEDED -> DispatchPhase.SUCCEEDED;
            case FAILED -> DispatchPhase.FAILED;
            case AWAITING_FAN_IN -> DispatchPhase.AWAITING_FAN_IN;
            case RUNNING -> DispatchPhase.QUEUED;
        };
    }

    private void publish(String eventType, TaskRun run, String nodeId, String agentId, Map<String, Object> payload) {
        eventBus.publish(new OrchestrationEvent(eventType, run.taskId(), nodeId, agentId, payload, clock.instant()));
    }

    /**
     * Builds an event payload from key/value pairs, skipping null values.
     */
    private static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }

    // -- Loop plumbing ---------------------------------------------------------

    private void cancelTimer(WorkUnit unit) {
        if (unit.timer != null) {
            unit.timer.cancel(false);
            unit.timer = null;
        }
    }

    /**
     * Queues a message for the dispatch loop on behalf of the work unit (or task) {@code unitId}.
     */
    private void onLoop(String unitId, Runnable message) {
        ExecutorService current = loop;
        if (current == null) {
            log.debug("Scheduler stopped; dropping message for {}", unitId);
            return;
        }
        try {
            current.execute(() -> runMessage(unitId, message));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler stopped; dropping message for {}", unitId);
        }
    }

    private void runMessage(String unitId, Runnable message) {
        try {
            message.run();
        } catch (RejectedExecutionException e) {
            log.debug("Timer rejected while the scheduler stops: {}", e.getMessage());
        } catch (RuntimeException e) {
            failUnexpectedly(runOf(unitId), e);
        }
        try {
            drain();
        } finally {
            MdcContext.clear();
        }
    }

    private TaskRun runOf(String unitId) {
        WorkUnit unit = units.get(unitId);
        return unit != null ? unit.run : runs.get(unitId);
    }

    /**
     * Fails the task whose message threw. The task is never left running without a
     * terminal transition; if even that cannot be recorded its handle completes exceptionally.
     */
    private void failUnexpectedly(TaskRun run, RuntimeException e) {
        if (run == null || run.finished) {
            log.error("Dispatch loop message failed", e);
            return;
        }
        log.error("Task {} failed in the dispatch loop", run.taskId(), e);
        try {
            finishFailed(run, run.state, "internal error: " + describe(e), false);
        } catch (RuntimeException nested) {
            log.error("Could not record the failure of task {}", run.taskId(), nested);
            run.finished = true;
            units.remove(run.main.id);
            runs.remove(run.taskId());
            views.remove(run.taskId());
            handles.remove(run.taskId());
            run.completion.completeExceptionally(nested);
        }
    }

    private <T> T callOnLoop(Supplier<T> call) {
        if (Thread.currentThread() == loopThread) {
            return call.get();
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    T value = call.get();
                    drain();
                    return value;
                } finally {
                    MdcContext.clear();
                }
            }, loop).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private void requireStarted() {
        if (loop == null) {
            throw new IllegalStateException("Scheduler is not started");
        }
    }

    // -- Loop-owned bookkeeping ------------------------------------------------

    private static final class TaskRun {
        TaskState state;
        final CompletableFuture<TaskView> completion;
        WorkUnit main;
        final Map<String, WorkUnit> branchUnits = new LinkedHashMap<>();
        int quorum;
        boolean finished;

        TaskRun(TaskState state, CompletableFuture<TaskView> completion) {
            this.state = state;
            this.completion = completion;
        }

        String taskId() {
            return state.taskId();
        }
    }

    /**
     * A strand of execution: the task itself or one of its fan-out branches.
     */
    private static final class WorkUnit {
        final String id;
        final TaskRun run;
        final boolean branch;
        DispatchPhase phase = DispatchPhase.QUEUED;
        long attempts;
        InFlightCall call;
        ScheduledFuture<?> timer;

        WorkUnit(String id, TaskRun run, boolean branch) {
            this.id = id;
            this.run = run;
            this.branch = branch;
        }
    }
}
