package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when a path would exceed the step budget or a node's invocation budget.
public class LimitExceededException extends StateMachineException {

    @Serial private static final long serialVersionUID = -1345209776188830545L;

    public LimitExceededException(String message) {
        super(FailureKind.LIMIT_EXCEEDED, message);
    }

    public LimitExceededException(String message, Throwable cause) {
        super(FailureKind.LIMIT_EXCEEDED, message, cause);
    }
}
