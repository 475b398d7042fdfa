package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when a path, or the whole execution, is cancelled by the caller.
public class ExecutionCancelledException extends StateMachineException {

    @Serial private static final long serialVersionUID = -7441960380027741163L;

    public ExecutionCancelledException(String message) {
        super(FailureKind.CANCELLED, message);
    }

    public ExecutionCancelledException(String message, Throwable cause) {
        super(FailureKind.CANCELLED, message, cause);
    }
}
