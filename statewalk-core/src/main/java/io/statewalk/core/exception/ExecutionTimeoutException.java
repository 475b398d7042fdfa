package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when the wall-clock budget of an execution elapses with paths still running.
public class ExecutionTimeoutException extends StateMachineException {

    @Serial private static final long serialVersionUID = 6057712318860047821L;

    public ExecutionTimeoutException(String message) {
        super(FailureKind.TIMEOUT, message);
    }

    public ExecutionTimeoutException(String message, Throwable cause) {
        super(FailureKind.TIMEOUT, message, cause);
    }
}
