package io.statewalk.core.execution;

import io.statewalk.core.agent.AgentContextBuilder;
import io.statewalk.core.agent.AgentInvocation;
import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.agent.ToolCallRecord;
import io.statewalk.core.condition.ConditionEvaluator;
import io.statewalk.core.context.ContextAccessResolver;
import io.statewalk.core.context.ContextPermission;
import io.statewalk.core.context.SharedAttributeStore;
import io.statewalk.core.dispatch.DispatchOutcome;
import io.statewalk.core.dispatch.ToolExecutionDispatcher;
import io.statewalk.core.exception.AgentProtocolException;
import io.statewalk.core.exception.AgentUnavailableException;
import io.statewalk.core.exception.CycleDetectedException;
import io.statewalk.core.exception.ExecutionCancelledException;
import io.statewalk.core.exception.ExecutionTimeoutException;
import io.statewalk.core.exception.InvalidToolCallException;
import io.statewalk.core.exception.LimitExceededException;
import io.statewalk.core.exception.MachineStructureException;
import io.statewalk.core.exception.PermissionDeniedException;
import io.statewalk.core.exception.StateMachineException;
import io.statewalk.core.exception.UnknownTransitionException;
import io.statewalk.core.execution.result.ExecutionResult;
import io.statewalk.core.execution.result.HistoryEntry;
import io.statewalk.core.execution.result.PathResult;
import io.statewalk.core.execution.result.TransitionSource;
import io.statewalk.core.graph.GraphAnalyzer;
import io.statewalk.core.graph.ValidationReport;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeKind;
import io.statewalk.core.tool.SessionToolRegistry;
import io.statewalk.core.transition.ConditionWarning;
import io.statewalk.core.transition.TransitionDecision;
import io.statewalk.core.transition.TransitionEvaluator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Interprets a machine model by stepping one or more paths through it.
///
/// A single cooperative loop owns all paths, the live model and the attribute store.
/// Each call to {@link #step()} runs one iteration:
/// 1. fail every unfinished path if the time budget is spent, then apply cancellations
/// 2. dispatch agent responses that have arrived, in arrival order
/// 3. pick a path: automated or terminal decisions first (earliest-created), otherwise
///    round-robin over active paths; with only waiting paths left, wait for a response
/// 4. enforce `maxNodeInvocations` on the first evaluation after an arrival
/// 5. apply an automated transition, complete a terminal path, or submit an agent request
///
/// ### Contracts
/// - **Precondition**: the model has at least one entry point
/// - **Postcondition**: {@link #run()} returns a result with every path's status and
///   history, never null
/// - **Invariant**: the failure of one path never aborts its siblings
///
/// ### Usage
/// {@snippet :
/// ExecutionResult result = ExecutionEngine.builder(model)
///     .agent(agent)
///     .config(EngineConfig.builder().limits(limits).build())
///     .build()
///     .run();
/// }
///
/// @implNote **Not thread-safe**, apart from {@link #cancel()} and {@link #cancelPath},
/// which may be called from any thread and take effect between steps. Agent calls run
/// inline unless an agent pool is configured; responses are always dispatched on the
/// loop thread.
///
/// @see TransitionEvaluator for the automated-vs-agent decision
/// @see ToolExecutionDispatcher for tool call handling
public class ExecutionEngine {

    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    private static final long RESPONSE_POLL_MS = 50;

    private final MachineModel model;
    private final DecisionAgent agent;
    private final ExecutionLimits limits;
    private final ExecutionListener listener;
    private final Clock clock;
    private final int agentPoolSize;

    private final ContextAccessResolver access;
    private final ConditionEvaluator conditions;
    private final TransitionEvaluator transitions;
    private final SharedAttributeStore store;
    private final SessionToolRegistry tools;
    private final AgentContextBuilder contextBuilder;
    private final ToolExecutionDispatcher dispatcher;

    private final Map<String, ExecutionPath> paths = new LinkedHashMap<>();
    private final Map<String, Integer> nodeInvocations = new HashMap<>();
    private final Map<String, Integer> nodeVisits = new HashMap<>();
    private final List<ExecutionWarning> warnings = new ArrayList<>();
    private final BlockingQueue<AgentCompletion> completions = new LinkedBlockingQueue<>();
    private final Set<String> pathCancellations = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelRequested;

    private ExecutorService agentPool;
    private Instant startedAt;
    private Instant finishedAt;
    private int totalSteps;
    private int pathSequence;
    private String lastServedPathId;

    private ExecutionEngine(Builder builder) {
        this.model = builder.model.copy();
        this.agent = builder.agent;
        this.limits = builder.config.getLimits();
        this.agentPoolSize = builder.config.getAgentPoolSize();
        this.listener = builder.listener;
        this.clock = builder.clock;

        this.access = new ContextAccessResolver(model);
        this.conditions = new ConditionEvaluator();
        this.transitions = new TransitionEvaluator(model, conditions);
        this.store = SharedAttributeStore.seededFrom(model);
        this.tools = new SessionToolRegistry();
        this.contextBuilder =
                new AgentContextBuilder(
                        model, access, transitions, tools, builder.config.getHistoryTail());
        this.dispatcher = new ToolExecutionDispatcher(model, access, store, tools);
    }

    /// Creates a builder for an engine over a copy of `model`.
    ///
    /// @param model machine model, not null; the engine works on its own copy
    /// @return new builder, never null
    public static Builder builder(MachineModel model) {
        return new Builder(model);
    }

    /// Runs the execution until every path is finished or the time budget is spent.
    ///
    /// @apiNote **Side effects**: mutates the engine's live model and store, invokes the
    /// agent and logs progress at INFO level
    ///
    /// @return the execution result, never null
    /// @throws MachineStructureException if the model has no entry points
    public ExecutionResult run() {
        try {
            while (step()) {
                // each step advances at most one path
            }
        } catch (RuntimeException e) {
            if (agentPool != null) {
                agentPool.shutdownNow();
            }
            throw e;
        }
        return result();
    }

    /// Runs one scheduler iteration, starting the execution on the first call.
    ///
    /// @return `true` while unfinished paths remain
    /// @throws MachineStructureException if the model has no entry points
    public boolean step() {
        if (startedAt == null) {
            start();
        }
        if (finishedAt != null) {
            return false;
        }

        if (timedOut()) {
            long elapsed = elapsed().toMillis();
            for (ExecutionPath path : unfinished()) {
                fail(
                        path,
                        new ExecutionTimeoutException(
                                "Execution timed out after "
                                        + elapsed
                                        + " ms (limit "
                                        + limits.timeoutMs()
                                        + " ms)"));
            }
        } else {
            applyCancellations();
            drainCompletions();
            if (!unfinished().isEmpty()) {
                Optional<Selection> selection = selectPath();
                if (selection.isPresent()) {
                    advance(selection.get().path(), selection.get().decision());
                } else {
                    awaitCompletion();
                }
            }
        }

        if (unfinished().isEmpty()) {
            finish();
        }
        if (listener != ExecutionListener.NOOP) {
            listener.onSnapshot(snapshot());
        }
        return finishedAt == null;
    }

    /// Requests cancellation of the whole execution.
    ///
    /// Every unfinished path fails with {@link ExecutionCancelledException} at the next
    /// step; late agent responses are discarded.
    public void cancel() {
        cancelRequested = true;
    }

    /// Requests cancellation of one path.
    ///
    /// @param pathId path to cancel, not null; unknown or finished paths are ignored
    public void cancelPath(String pathId) {
        pathCancellations.add(Objects.requireNonNull(pathId, "pathId must not be null"));
    }

    /// Builds the current visualization snapshot.
    ///
    /// @return snapshot, never null
    public VisualizationSnapshot snapshot() {
        List<VisualizationSnapshot.PathView> pathViews = new ArrayList<>();
        Map<String, List<String>> activeByNode = new HashMap<>();
        for (ExecutionPath path : paths.values()) {
            List<String> available = List.of();
            if (!path.isFinished()) {
                activeByNode
                        .computeIfAbsent(path.getCurrentNode(), n -> new ArrayList<>())
                        .add(path.getId());
                available =
                        transitions.candidates(path.getCurrentNode()).stream()
                                .flatMap(edge -> transitions.transitionTargets(edge).stream())
                                .distinct()
                                .toList();
            }
            pathViews.add(
                    new VisualizationSnapshot.PathView(
                            path.getId(),
                            path.getStatus(),
                            path.getCurrentNode(),
                            path.getStepCount(),
                            available));
        }

        Map<String, VisualizationSnapshot.NodeView> nodeViews = new LinkedHashMap<>();
        for (MachineNode node : model.nodes()) {
            nodeViews.put(
                    node.name(),
                    new VisualizationSnapshot.NodeView(
                            node.name(),
                            nodeVisits.getOrDefault(node.name(), 0),
                            activeByNode.getOrDefault(node.name(), List.of())));
        }
        return new VisualizationSnapshot(model.title(), totalSteps, pathViews, nodeViews);
    }

    /// Builds the result from the current state of all paths.
    ///
    /// @return result, never null
    public ExecutionResult result() {
        List<PathResult> results = new ArrayList<>();
        for (ExecutionPath path : paths.values()) {
            results.add(
                    new PathResult(
                            path.getId(),
                            path.getParentPathId(),
                            path.getStatus(),
                            path.getCurrentNode(),
                            path.getStepCount(),
                            path.getHistory().getEntries(),
                            path.getVisitCounts(),
                            path.getFailure()));
        }
        Duration duration = startedAt != null ? elapsed() : Duration.ZERO;
        return new ExecutionResult(
                model.title(), results, warnings, totalSteps, duration, snapshot());
    }

    /// Returns the engine's live model, including definition updates made by agents.
    ///
    /// @return live model, never null
    public MachineModel getModel() {
        return model;
    }

    public SharedAttributeStore getStore() {
        return store;
    }

    public SessionToolRegistry getTools() {
        return tools;
    }

    public List<ExecutionPath> getPaths() {
        return List.copyOf(paths.values());
    }

    // -- Lifecycle ------------------------------------------------------------------

    private void start() {
        startedAt = clock.instant();
        GraphAnalyzer analyzer = new GraphAnalyzer(model);
        ValidationReport report = analyzer.validate();
        for (ValidationReport.Issue issue : report.issues()) {
            logger.warning("Model '" + model.title() + "': " + issue.message());
        }

        List<String> starts =
                model.nodes().stream()
                        .filter(node -> node.kind() == NodeKind.INIT)
                        .map(MachineNode::name)
                        .collect(Collectors.toCollection(ArrayList::new));
        if (starts.isEmpty()) {
            List<String> entryPoints = analyzer.findEntryPoints();
            if (entryPoints.isEmpty()) {
                throw new MachineStructureException(
                        "Model '" + model.title() + "' has no entry points");
            }
            starts.add(entryPoints.get(0));
        }

        if (agentPoolSize > 0) {
            agentPool = Executors.newFixedThreadPool(agentPoolSize);
        }
        logger.info(
                "Starting execution of '"
                        + model.title()
                        + "' with "
                        + starts.size()
                        + " path(s) from "
                        + starts);

        for (String start : starts) {
            String node = transitions.resolveEntry(start);
            ExecutionPath path = new ExecutionPath(nextPathId(), null, node);
            paths.put(path.getId(), path);
            path.visit(visitOf(node));
            nodeVisits.merge(node, 1, Integer::sum);
            listener.onPathCreated(path);
            listener.onNodeEntered(path.getId(), node);
        }
    }

    private void finish() {
        finishedAt = clock.instant();
        if (agentPool != null) {
            agentPool.shutdownNow();
        }
        long completed =
                paths.values().stream().filter(p -> p.getStatus() == PathStatus.COMPLETED).count();
        logger.info(
                "Execution of '"
                        + model.title()
                        + "' finished: "
                        + completed
                        + "/"
                        + paths.size()
                        + " path(s) completed, "
                        + totalSteps
                        + " step(s) in "
                        + elapsed().toMillis()
                        + " ms");
    }

    private boolean timedOut() {
        return elapsed().toMillis() >= limits.timeoutMs();
    }

    private Duration elapsed() {
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        return Duration.between(startedAt, end);
    }

    private List<ExecutionPath> unfinished() {
        return paths.values().stream().filter(p -> !p.isFinished()).toList();
    }

    private String nextPathId() {
        return "path-" + (++pathSequence);
    }

    private void applyCancellations() {
        if (cancelRequested) {
            for (ExecutionPath path : unfinished()) {
                fail(path, new ExecutionCancelledException("Execution cancelled"));
            }
        }
        for (ExecutionPath path : unfinished()) {
            if (pathCancellations.remove(path.getId())) {
                fail(path, new ExecutionCancelledException("Path " + path.getId() + " cancelled"));
            }
        }
    }

    // -- Scheduling -----------------------------------------------------------------

    private record Selection(ExecutionPath path, TransitionDecision decision) {}

    private Optional<Selection> selectPath() {
        List<ExecutionPath> active =
                paths.values().stream().filter(p -> p.getStatus() == PathStatus.ACTIVE).toList();
        if (active.isEmpty()) {
            return Optional.empty();
        }

        Map<ExecutionPath, TransitionDecision> decisions = new LinkedHashMap<>();
        for (ExecutionPath path : active) {
            TransitionDecision decision = transitions.evaluate(path.getCurrentNode(), store);
            if (!(decision instanceof TransitionDecision.AgentRequired)) {
                return Optional.of(select(path, decision));
            }
            decisions.put(path, decision);
        }

        // round-robin over the agent-bound paths, in creation order
        ExecutionPath next = active.get(0);
        if (lastServedPathId != null) {
            List<String> order = new ArrayList<>(paths.keySet());
            int served = order.indexOf(lastServedPathId);
            for (ExecutionPath path : active) {
                if (order.indexOf(path.getId()) > served) {
                    next = path;
                    break;
                }
            }
        }
        return Optional.of(select(next, decisions.get(next)));
    }

    private Selection select(ExecutionPath path, TransitionDecision decision) {
        lastServedPathId = path.getId();
        return new Selection(path, decision);
    }

    private void advance(ExecutionPath path, TransitionDecision decision) {
        String node = path.getCurrentNode();
        try {
            if (path.consumeArrival()) {
                int invocations = nodeInvocations.merge(node, 1, Integer::sum);
                if (invocations > limits.maxNodeInvocations()) {
                    throw new LimitExceededException(
                            "Node "
                                    + node
                                    + " exceeded maxNodeInvocations ("
                                    + limits.maxNodeInvocations()
                                    + ")");
                }
            }
            for (ConditionWarning warning : decision.warnings()) {
                warn(new ExecutionWarning(path.getId(), warning));
            }

            if (decision instanceof TransitionDecision.Automated automated) {
                logger.fine("[" + path.getId() + "] " + automated.reason());
                applyTransition(
                        path, automated.edge(), automated.reason(), TransitionSource.AUTOMATED);
            } else if (decision instanceof TransitionDecision.Terminal terminal) {
                complete(path, terminal.reason());
            } else if (decision instanceof TransitionDecision.AgentRequired required) {
                path.beginDecision(required.candidates(), required.reason());
                submit(path);
            }
        } catch (StateMachineException e) {
            fail(path, e);
        }
    }

    private void warn(ExecutionWarning warning) {
        warnings.add(warning);
        logger.warning(warning.message());
        listener.onWarning(warning);
    }

    private void complete(ExecutionPath path, String reason) {
        path.moveTo(PathStatus.COMPLETED);
        logger.info(
                "["
                        + path.getId()
                        + "] Completed at "
                        + path.getCurrentNode()
                        + " after "
                        + path.getStepCount()
                        + " step(s): "
                        + reason);
        listener.onPathFinished(path);
    }

    private void fail(ExecutionPath path, StateMachineException cause) {
        path.fail(cause);
        logger.warning(
                "["
                        + path.getId()
                        + "] Failed at "
                        + path.getCurrentNode()
                        + " ("
                        + cause.getKind()
                        + "): "
                        + cause.getMessage());
        listener.onPathFinished(path);
    }

    // -- Transitions ----------------------------------------------------------------

    private void applyTransition(
            ExecutionPath path, MachineEdge edge, String reason, TransitionSource source) {
        if (totalSteps >= limits.maxSteps()) {
            throw new LimitExceededException(
                    "Execution exceeded maxSteps (" + limits.maxSteps() + ")");
        }
        List<String> targets = transitions.transitionTargets(edge);
        if (targets.isEmpty()) {
            throw new MachineStructureException(
                    "Edge #" + edge.index() + " from " + edge.source() + " has no transition target");
        }

        totalSteps++;
        String from = path.getCurrentNode();
        List<ExecutionPath> forks = new ArrayList<>();
        for (int i = 1; i < targets.size(); i++) {
            forks.add(path.fork(nextPathId()));
        }

        String to = transitions.resolveEntry(targets.get(0));
        HistoryEntry entry =
                new HistoryEntry(
                        totalSteps,
                        path.getId(),
                        from,
                        to,
                        edge.label(),
                        clock.instant(),
                        reason,
                        source,
                        edge.index());
        enter(path, entry, to);
        logger.fine("[" + path.getId() + "] " + entry);

        for (int i = 0; i < forks.size(); i++) {
            ExecutionPath fork = forks.get(i);
            String forkTarget = transitions.resolveEntry(targets.get(i + 1));
            paths.put(fork.getId(), fork);
            listener.onPathCreated(fork);
            HistoryEntry forkEntry =
                    new HistoryEntry(
                            totalSteps,
                            fork.getId(),
                            from,
                            forkTarget,
                            edge.label(),
                            clock.instant(),
                            "forked from " + path.getId(),
                            TransitionSource.FORK,
                            edge.index());
            enter(fork, forkEntry, forkTarget);
            logger.info("[" + path.getId() + "] Forked " + fork.getId() + " to " + forkTarget);
        }

        checkCycle(path);
        for (ExecutionPath fork : forks) {
            checkCycle(fork);
        }
    }

    private void enter(ExecutionPath path, HistoryEntry entry, String target) {
        path.advance(entry, target);
        path.visit(visitOf(target));
        nodeVisits.merge(target, 1, Integer::sum);
        listener.onTransition(path.getId(), entry);
        listener.onNodeEntered(path.getId(), target);
    }

    private void checkCycle(ExecutionPath path) {
        if (path.isFinished()) {
            return;
        }
        Optional<List<VisitRecord>> cycle =
                CycleDetector.detect(path.getVisits(), limits.cycleDetectionWindow());
        if (cycle.isPresent()) {
            String nodes =
                    cycle.get().stream().map(VisitRecord::node).collect(Collectors.joining(" -> "));
            fail(
                    path,
                    new CycleDetectedException(
                            "Path "
                                    + path.getId()
                                    + " repeats "
                                    + nodes
                                    + " without any change in observed state"));
        }
    }

    /// Captures a node visit with every value the node's logic can observe.
    private VisitRecord visitOf(String node) {
        Map<String, Object> observed = new HashMap<>();
        for (MachineEdge edge : transitions.candidates(node)) {
            if (edge.condition() != null) {
                for (String reference : conditions.references(edge.condition(), edge.source())) {
                    observed.put(reference, store.get(reference).orElse(null));
                }
            }
        }
        store.valuesOf(node)
                .forEach(
                        (attribute, value) ->
                                observed.put(SharedAttributeStore.qualify(node, attribute), value));
        for (ContextPermission permission : access.accessible(node).values()) {
            store.valuesOf(permission.context())
                    .forEach(
                            (attribute, value) -> {
                                if (permission.canReadField(attribute)) {
                                    observed.put(
                                            SharedAttributeStore.qualify(
                                                    permission.context(), attribute),
                                            value);
                                }
                            });
        }
        return new VisitRecord(node, observed);
    }

    // -- Agent decisions ------------------------------------------------------------

    private record AgentCompletion(
            String pathId, String requestId, AgentResponse response, RuntimeException error) {}

    private void submit(ExecutionPath path) {
        if (agent == null) {
            throw new AgentUnavailableException(
                    "Node " + path.getCurrentNode() + " needs a decision but no agent is configured");
        }
        if (path.turn() >= limits.maxAgentTurns()) {
            throw new LimitExceededException(
                    "Agent decision at "
                            + path.getCurrentNode()
                            + " exceeded maxAgentTurns ("
                            + limits.maxAgentTurns()
                            + ")");
        }

        List<MachineEdge> candidates =
                path.candidates().stream().map(edge -> model.edges().get(edge.index())).toList();
        AgentInvocation invocation =
                contextBuilder.build(
                        path.getCurrentNode(),
                        candidates,
                        path.decisionReason(),
                        store,
                        path.getHistory(),
                        path.previousCalls());
        String requestId =
                AgentRequest.requestId(
                        path.getId(), path.getCurrentNode(), path.getStepCount(), path.turn());
        AgentRequest request = invocation.toRequest(requestId, path.getId());
        path.awaitResponse(requestId, invocation.catalogue());

        logger.fine("[" + path.getId() + "] Requesting decision " + requestId);
        listener.onAgentRequest(request);
        Runnable call =
                () -> {
                    try {
                        AgentResponse response = agent.decide(request);
                        if (response == null) {
                            throw new AgentProtocolException(
                                    "Agent returned no response for " + requestId);
                        }
                        completions.add(new AgentCompletion(path.getId(), requestId, response, null));
                    } catch (RuntimeException e) {
                        completions.add(new AgentCompletion(path.getId(), requestId, null, e));
                    }
                };
        if (agentPool != null) {
            agentPool.execute(call);
        } else {
            call.run();
        }
    }

    private void drainCompletions() {
        int available = completions.size();
        for (int i = 0; i < available; i++) {
            AgentCompletion completion = completions.poll();
            if (completion == null) {
                return;
            }
            handleCompletion(completion);
        }
    }

    private void awaitCompletion() {
        long remaining = limits.timeoutMs() - elapsed().toMillis();
        try {
            AgentCompletion completion =
                    completions.poll(
                            Math.max(1, Math.min(remaining, RESPONSE_POLL_MS)),
                            TimeUnit.MILLISECONDS);
            if (completion != null) {
                handleCompletion(completion);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while waiting for agent responses; cancelling execution");
            cancel();
        }
    }

    private void handleCompletion(AgentCompletion completion) {
        ExecutionPath path = paths.get(completion.pathId());
        if (path == null
                || path.getStatus() != PathStatus.WAITING_FOR_AGENT
                || !completion.requestId().equals(path.pendingRequestId())) {
            logger.fine("Discarding response for abandoned request " + completion.requestId());
            return;
        }

        try {
            if (completion.error() != null) {
                RuntimeException error = completion.error();
                if (error instanceof StateMachineException stateMachineException) {
                    throw stateMachineException;
                }
                throw new AgentUnavailableException(
                        "Agent failed on " + completion.requestId() + ": " + error.getMessage(),
                        error);
            }
            AgentResponse response = completion.response();
            listener.onAgentResponse(path.getId(), response);
            applyResponse(path, completion.requestId(), response);
        } catch (StateMachineException e) {
            fail(path, e);
        }
    }

    private void applyResponse(ExecutionPath path, String requestId, AgentResponse response) {
        DispatchOutcome outcome;
        try {
            if (!requestId.equals(response.requestId())) {
                throw new InvalidToolCallException(
                        "Response carries request id "
                                + response.requestId()
                                + ", expected "
                                + requestId);
            }
            outcome = dispatcher.dispatch(path.getCurrentNode(), path.pendingCatalogue(), response);
        } catch (InvalidToolCallException | UnknownTransitionException | PermissionDeniedException e) {
            int invalid =
                    path.recordInvalidCall(
                            ToolCallRecord.failure(
                                    response.toolName(), response.arguments(), e.getMessage()));
            logger.warning(
                    "["
                            + path.getId()
                            + "] Invalid tool call "
                            + response.toolName()
                            + " ("
                            + invalid
                            + "/"
                            + limits.maxInvalidToolCalls()
                            + "): "
                            + e.getMessage());
            if (invalid > limits.maxInvalidToolCalls()) {
                throw new AgentProtocolException(
                        "Agent exceeded maxInvalidToolCalls ("
                                + limits.maxInvalidToolCalls()
                                + ") at "
                                + path.getCurrentNode(),
                        e);
            }
            submit(path);
            return;
        }

        if (outcome instanceof DispatchOutcome.TransitionTaken taken) {
            path.clearDecision();
            path.moveTo(PathStatus.ACTIVE);
            String reason = taken.reason() != null ? taken.reason() : response.reasoning();
            applyTransition(path, taken.edge(), reason, TransitionSource.AGENT);
        } else {
            path.recordCall(outcome.record());
            logger.fine("[" + path.getId() + "] Applied " + response.toolName());
            submit(path);
        }
    }

    /// Builder for {@link ExecutionEngine}.
    public static final class Builder {
        private final MachineModel model;
        private DecisionAgent agent;
        private EngineConfig config = new EngineConfig();
        private ExecutionListener listener = ExecutionListener.NOOP;
        private Clock clock = Clock.systemUTC();

        private Builder(MachineModel model) {
            this.model = Objects.requireNonNull(model, "model must not be null");
        }

        /// Sets the agent asked for non-automated decisions.
        ///
        /// @param agent decision agent, may be null when the model needs no decisions
        /// @return this builder for chaining
        public Builder agent(DecisionAgent agent) {
            this.agent = agent;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Shortcut for a default configuration with the given limits.
        ///
        /// @param limits execution limits, not null
        /// @return this builder for chaining
        public Builder limits(ExecutionLimits limits) {
            this.config = EngineConfig.builder().limits(limits).build();
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /// Sets the clock used for timeouts and history timestamps.
        ///
        /// @param clock time source, not null
        /// @return this builder for chaining
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(this);
        }
    }
}
