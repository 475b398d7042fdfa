package io.statewalk.core.execution;

import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.execution.result.HistoryEntry;

/// Listener for execution lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only
/// the events they care about.
///
/// ### Callback Order
/// For one transition of a path:
/// ```
/// onAgentRequest(request)             - only when an agent decides
/// onAgentResponse(pathId, response)   - once per tool call
/// onTransition(pathId, entry)
/// onNodeEntered(pathId, node)
/// onPathCreated(fork)                 - once per extra fork target
/// onSnapshot(snapshot)                - after every step
/// ```
///
/// @implNote Callbacks run on the engine loop thread. A listener that blocks stalls the
/// whole execution.
///
/// @see ExecutionEngine
public interface ExecutionListener {

    /// Called when a path is created at start or by a fork.
    ///
    /// @param path the new path, not null
    default void onPathCreated(ExecutionPath path) {}

    /// Called when a path arrives at a node.
    ///
    /// @param pathId arriving path, not null
    /// @param node entered node, not null
    default void onNodeEntered(String pathId, String node) {}

    /// Called after a transition was appended to a path's history.
    ///
    /// @param pathId moving path, not null
    /// @param entry the new history entry, not null
    default void onTransition(String pathId, HistoryEntry entry) {}

    /// Called before a request is submitted to the agent.
    ///
    /// @param request the request, not null
    default void onAgentRequest(AgentRequest request) {}

    /// Called when a response is accepted for dispatch.
    ///
    /// @param pathId waiting path, not null
    /// @param response the agent's call, not null
    default void onAgentResponse(String pathId, AgentResponse response) {}

    /// Called once when a path is completed or failed.
    ///
    /// @param path the finished path, not null
    default void onPathFinished(ExecutionPath path) {}

    /// Called for every data warning.
    ///
    /// @param warning the warning, not null
    default void onWarning(ExecutionWarning warning) {}

    /// Called after every step with the current state of all paths.
    ///
    /// @param snapshot visualization snapshot, not null
    default void onSnapshot(VisualizationSnapshot snapshot) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
