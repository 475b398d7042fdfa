package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when an agent selects a transition tool that was not offered for the current node.
public class UnknownTransitionException extends StateMachineException {

    @Serial private static final long serialVersionUID = -2206474610924386473L;

    public UnknownTransitionException(String message) {
        super(FailureKind.UNKNOWN_TRANSITION, message);
    }

    public UnknownTransitionException(String message, Throwable cause) {
        super(FailureKind.UNKNOWN_TRANSITION, message, cause);
    }
}
