package io.statewalk.core.execution.result;

/// What caused a history entry.
public enum TransitionSource {
    /// Edge taken by the transition evaluator without an agent.
    AUTOMATED,
    /// Edge chosen by an agent's transition tool call.
    AGENT,
    /// Entry recorded on a path created by a multi-target edge.
    FORK
}
