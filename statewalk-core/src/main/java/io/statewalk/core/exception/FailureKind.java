package io.statewalk.core.exception;

/// Closed classification of the ways a path or an execution can fail.
///
/// Every {@link StateMachineException} carries one of these so callers can branch on the
/// failure category without inspecting exception types.
///
/// @see StateMachineException#getKind()
public enum FailureKind {
    /// Model could not be executed at all (bad references, no entry points).
    STRUCTURE(Category.STRUCTURAL),
    UNKNOWN_TRANSITION(Category.DECISION),
    PERMISSION_DENIED(Category.DECISION),
    INVALID_TOOL_CALL(Category.DECISION),
    AGENT_PROTOCOL(Category.DECISION),
    AGENT_UNAVAILABLE(Category.DECISION),
    CYCLE_DETECTED(Category.SAFETY),
    LIMIT_EXCEEDED(Category.SAFETY),
    TIMEOUT(Category.SAFETY),
    CANCELLED(Category.SAFETY);

    private final Category category;

    FailureKind(Category category) {
        this.category = category;
    }

    /// Returns the broad category this failure belongs to.
    ///
    /// @return the category, never null
    public Category category() {
        return category;
    }

    /// Broad failure categories used for reporting.
    public enum Category {
        /// Problems with the model itself.
        STRUCTURAL,
        /// Problems with an agent's choice; local to one path.
        DECISION,
        /// Safety bounds that terminate a path.
        SAFETY
    }
}
