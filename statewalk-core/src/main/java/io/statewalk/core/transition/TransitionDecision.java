package io.statewalk.core.transition;

import io.statewalk.core.model.MachineEdge;
import java.util.List;
import java.util.Objects;

/// Outcome of evaluating a node's outbound transitions.
///
/// ### Permitted Implementations
/// - {@link Automated} - exactly one edge is taken without an agent
/// - {@link AgentRequired} - an agent must choose among the candidates
/// - {@link Terminal} - no edge can ever be taken; the path completes
///
/// @see TransitionEvaluator#evaluate
public sealed interface TransitionDecision
        permits TransitionDecision.Automated,
                TransitionDecision.AgentRequired,
                TransitionDecision.Terminal {

    /// Conditions that could not be decided while producing this decision.
    ///
    /// @return warnings in edge order, never null
    List<ConditionWarning> warnings();

    /// @param edge the selected edge, not null
    /// @param reason why the edge was selected, not null
    /// @param warnings undecidable conditions met on the way, not null
    record Automated(MachineEdge edge, String reason, List<ConditionWarning> warnings)
            implements TransitionDecision {

        public Automated {
            Objects.requireNonNull(edge, "edge must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
            warnings = List.copyOf(warnings);
        }
    }

    /// @param candidates every candidate edge in declaration order, never empty
    /// @param reason why no automated choice was possible, not null
    /// @param warnings undecidable conditions, not null
    record AgentRequired(List<MachineEdge> candidates, String reason, List<ConditionWarning> warnings)
            implements TransitionDecision {

        public AgentRequired {
            candidates = List.copyOf(candidates);
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("candidates must not be empty");
            }
            Objects.requireNonNull(reason, "reason must not be null");
            warnings = List.copyOf(warnings);
        }
    }

    record Terminal(String reason, List<ConditionWarning> warnings) implements TransitionDecision {

        public Terminal {
            Objects.requireNonNull(reason, "reason must not be null");
            warnings = List.copyOf(warnings);
        }
    }
}
