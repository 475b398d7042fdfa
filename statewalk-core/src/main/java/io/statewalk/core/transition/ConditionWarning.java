package io.statewalk.core.transition;

import java.util.Objects;
import java.util.Set;

/// A condition that could not be decided automatically.
///
/// Reported as a warning; the affected decision is handed to an agent instead of being
/// coerced to true or false.
///
/// @param node node whose outbound edges were evaluated, not null
/// @param edgeIndex declaration index of the edge carrying the condition
/// @param condition the condition text, not null
/// @param kind why the condition was undecidable, not null
/// @param missingReferences qualified attribute paths that were not set, never null
/// @param message human-readable description, not null
public record ConditionWarning(
        String node,
        int edgeIndex,
        String condition,
        Kind kind,
        Set<String> missingReferences,
        String message) {

    public ConditionWarning {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        missingReferences = missingReferences != null ? Set.copyOf(missingReferences) : Set.of();
    }

    public enum Kind {
        /// Condition references an attribute that is not set.
        MISSING_CONTEXT,
        /// Condition text is not a valid expression.
        CONDITION_SYNTAX
    }
}
