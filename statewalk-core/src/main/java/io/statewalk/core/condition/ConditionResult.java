package io.statewalk.core.condition;

import java.util.Objects;
import java.util.Set;

/// Tri-state outcome of evaluating a condition.
///
/// @param outcome whether the condition held, failed or could not be decided, not null
/// @param missingReferences qualified attribute paths that were not set, never null
/// @param error syntax error message when the condition could not be parsed, may be null
public record ConditionResult(Outcome outcome, Set<String> missingReferences, String error) {

    public ConditionResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        missingReferences = missingReferences != null ? Set.copyOf(missingReferences) : Set.of();
    }

    public static ConditionResult of(boolean value) {
        return new ConditionResult(value ? Outcome.TRUE : Outcome.FALSE, Set.of(), null);
    }

    public boolean isTrue() {
        return outcome == Outcome.TRUE;
    }

    public boolean isDecidable() {
        return outcome != Outcome.UNDECIDABLE;
    }

    public enum Outcome {
        TRUE,
        FALSE,
        /// A referenced attribute is not set, or the expression is malformed.
        UNDECIDABLE
    }
}
