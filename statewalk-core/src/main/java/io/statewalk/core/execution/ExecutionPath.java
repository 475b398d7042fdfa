package io.statewalk.core.execution;

import io.statewalk.core.agent.ToolCallRecord;
import io.statewalk.core.exception.StateMachineException;
import io.statewalk.core.execution.result.ExecutionHistory;
import io.statewalk.core.execution.result.HistoryEntry;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.tool.ToolCatalogue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A token walking the graph.
///
/// Holds the path's position, status, history and visits, plus the state of an agent
/// decision in progress. Only the engine mutates a path; listeners and results see it
/// through the public getters.
///
/// ### Contracts
/// - **Invariant**: `currentNode` names a node of the model
/// - **Invariant**: status only moves forward, see {@link PathStatus#canMoveTo}
/// - **Invariant**: `stepCount` never decreases
///
/// @implNote Not thread-safe. Owned by the engine loop thread.
public final class ExecutionPath {

    private final String id;
    private final String parentPathId;
    private String currentNode;
    private PathStatus status = PathStatus.ACTIVE;
    private int stepCount;
    private final ExecutionHistory history;
    private final List<VisitRecord> visits;
    private final Map<String, Integer> visitCounts;
    private StateMachineException failure;
    private boolean arrivalPending = true;

    // agent decision in progress
    private List<MachineEdge> candidates = List.of();
    private String decisionReason;
    private final List<ToolCallRecord> previousCalls = new ArrayList<>();
    private int turn;
    private int invalidCalls;
    private String pendingRequestId;
    private ToolCatalogue pendingCatalogue;

    ExecutionPath(String id, String parentPathId, String startNode) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.parentPathId = parentPathId;
        this.currentNode = Objects.requireNonNull(startNode, "startNode must not be null");
        this.history = new ExecutionHistory();
        this.visits = new ArrayList<>();
        this.visitCounts = new LinkedHashMap<>();
    }

    private ExecutionPath(String id, ExecutionPath parent) {
        this.id = id;
        this.parentPathId = parent.id;
        this.currentNode = parent.currentNode;
        this.stepCount = parent.stepCount;
        this.history = parent.history.copy();
        this.visits = new ArrayList<>(parent.visits);
        this.visitCounts = new LinkedHashMap<>(parent.visitCounts);
    }

    public String getId() {
        return id;
    }

    /// Returns the id of the path this one was forked from.
    ///
    /// @return parent id, or null for paths created at start
    public String getParentPathId() {
        return parentPathId;
    }

    public String getCurrentNode() {
        return currentNode;
    }

    public PathStatus getStatus() {
        return status;
    }

    public int getStepCount() {
        return stepCount;
    }

    public ExecutionHistory getHistory() {
        return history;
    }

    public List<VisitRecord> getVisits() {
        return Collections.unmodifiableList(visits);
    }

    /// Returns how often the path entered each node, in first-visit order.
    ///
    /// @return node name to visit count, never null
    public Map<String, Integer> getVisitCounts() {
        return Collections.unmodifiableMap(visitCounts);
    }

    /// Returns the error that failed the path.
    ///
    /// @return failure cause, or null unless the status is FAILED
    public StateMachineException getFailure() {
        return failure;
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    // -- engine-side mutation -------------------------------------------------------

    void moveTo(PathStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException(
                    "Path " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    void fail(StateMachineException cause) {
        this.failure = Objects.requireNonNull(cause, "cause must not be null");
        clearDecision();
        moveTo(PathStatus.FAILED);
    }

    void visit(VisitRecord visit) {
        visits.add(visit);
        visitCounts.merge(visit.node(), 1, Integer::sum);
        arrivalPending = true;
    }

    void advance(HistoryEntry entry, String target) {
        history.add(entry);
        stepCount++;
        currentNode = target;
    }

    ExecutionPath fork(String forkId) {
        return new ExecutionPath(forkId, this);
    }

    /// Returns and clears the arrival flag; `true` once per node entry.
    boolean consumeArrival() {
        boolean pending = arrivalPending;
        arrivalPending = false;
        return pending;
    }

    void beginDecision(List<MachineEdge> decisionCandidates, String reason) {
        clearDecision();
        this.candidates = List.copyOf(decisionCandidates);
        this.decisionReason = reason;
    }

    void awaitResponse(String requestId, ToolCatalogue catalogue) {
        this.pendingRequestId = requestId;
        this.pendingCatalogue = catalogue;
        if (status == PathStatus.ACTIVE) {
            moveTo(PathStatus.WAITING_FOR_AGENT);
        }
    }

    void recordCall(ToolCallRecord call) {
        previousCalls.add(call);
        turn++;
    }

    int recordInvalidCall(ToolCallRecord call) {
        recordCall(call);
        return ++invalidCalls;
    }

    void clearDecision() {
        candidates = List.of();
        decisionReason = null;
        previousCalls.clear();
        turn = 0;
        invalidCalls = 0;
        pendingRequestId = null;
        pendingCatalogue = null;
    }

    List<MachineEdge> candidates() {
        return candidates;
    }

    String decisionReason() {
        return decisionReason;
    }

    List<ToolCallRecord> previousCalls() {
        return List.copyOf(previousCalls);
    }

    int turn() {
        return turn;
    }

    String pendingRequestId() {
        return pendingRequestId;
    }

    ToolCatalogue pendingCatalogue() {
        return pendingCatalogue;
    }

    @Override
    public String toString() {
        return "ExecutionPath{id='" + id + "', node='" + currentNode + "', status=" + status + "}";
    }
}
