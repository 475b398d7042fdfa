package io.statewalk.core.agent;

/// External reasoning service that picks a tool for a decision point.
///
/// The boundary is transport-agnostic: an implementation may call a model synchronously,
/// exchange files, or go over the network, as long as the returned response carries the
/// request's id.
///
/// ### Contracts
/// - **Precondition**: `request` is fully built; its tools are the only valid choices
/// - **Postcondition**: returns a response for `request.requestId()`, or throws
///   {@link io.statewalk.core.exception.AgentUnavailableException}
///
/// @implNote Implementations may be called from a worker thread when the engine is
/// configured with an agent pool; they must not touch engine state.
///
/// @see AgentRequest
/// @see io.statewalk.core.recording.PlaybackDecisionAgent for replaying recorded decisions
public interface DecisionAgent {

    /// Chooses one tool call for the request.
    ///
    /// @param request decision request, not null
    /// @return the chosen call, never null
    /// @throws io.statewalk.core.exception.AgentUnavailableException if the agent cannot
    ///         be reached or fails to answer
    AgentResponse decide(AgentRequest request);

    /// Returns an identifier for logging and diagnostics.
    ///
    /// @return agent id, never null
    default String getId() {
        return getClass().getSimpleName();
    }
}
