package io.statewalk.core.execution;

/// Lifecycle status of an execution path.
///
/// Status only moves forward:
/// ```
/// ACTIVE -> WAITING_FOR_AGENT | COMPLETED | FAILED
/// WAITING_FOR_AGENT -> ACTIVE | FAILED
/// ```
public enum PathStatus {
    ACTIVE,
    WAITING_FOR_AGENT,
    COMPLETED,
    FAILED;

    /// Returns whether the path is finished.
    ///
    /// @return `true` for COMPLETED and FAILED
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /// Checks whether a move to `next` is allowed.
    ///
    /// @param next requested status, not null
    /// @return `true` if the move is allowed
    public boolean canMoveTo(PathStatus next) {
        return switch (this) {
            case ACTIVE -> next != ACTIVE;
            case WAITING_FOR_AGENT -> next == ACTIVE || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
