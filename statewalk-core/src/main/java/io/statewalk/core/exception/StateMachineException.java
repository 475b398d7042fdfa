package io.statewalk.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base class for every failure raised by the state-machine engine.
///
/// Failures are unchecked: decision and safety failures are caught by the engine and
/// recorded on the affected path, while structural failures propagate to the caller of
/// {@link io.statewalk.core.execution.ExecutionEngine#run()}.
///
/// @see FailureKind for the closed set of failure categories
public abstract class StateMachineException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4126619088437316257L;

    private final FailureKind kind;

    /// Creates an exception of the given kind.
    ///
    /// @param kind failure classification, not null
    /// @param message description of the failure, not null
    protected StateMachineException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Creates an exception of the given kind with an underlying cause.
    ///
    /// @param kind failure classification, not null
    /// @param message description of the failure, not null
    /// @param cause the underlying exception, may be null
    protected StateMachineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the failure classification.
    ///
    /// @return the kind, never null
    public FailureKind getKind() {
        return kind;
    }
}
