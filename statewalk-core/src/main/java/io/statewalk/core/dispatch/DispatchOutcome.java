package io.statewalk.core.dispatch;

import io.statewalk.core.agent.ToolCallRecord;
import io.statewalk.core.model.MachineEdge;
import java.util.Objects;

/// Result of dispatching one valid tool call.
///
/// A {@link TransitionTaken} ends the decision; the engine applies the edge. A
/// {@link ToolApplied} has already taken effect and the agent is asked again.
public sealed interface DispatchOutcome
        permits DispatchOutcome.TransitionTaken, DispatchOutcome.ToolApplied {

    /// Returns the call as it is reported back to the agent.
    ///
    /// @return call record, never null
    ToolCallRecord record();

    /// The agent chose a candidate edge.
    ///
    /// @param edge chosen edge, not null
    /// @param reason agent-supplied reason, may be null
    /// @param record call record, not null
    record TransitionTaken(MachineEdge edge, String reason, ToolCallRecord record)
            implements DispatchOutcome {

        public TransitionTaken {
            Objects.requireNonNull(edge, "edge must not be null");
            Objects.requireNonNull(record, "record must not be null");
        }
    }

    /// A non-transition tool was applied.
    ///
    /// @param record call record with the tool result, not null
    record ToolApplied(ToolCallRecord record) implements DispatchOutcome {

        public ToolApplied {
            Objects.requireNonNull(record, "record must not be null");
        }
    }
}
