package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown for tool calls that name no catalogued tool or carry malformed arguments.
public class InvalidToolCallException extends StateMachineException {

    @Serial private static final long serialVersionUID = 3188802247719532645L;

    public InvalidToolCallException(String message) {
        super(FailureKind.INVALID_TOOL_CALL, message);
    }

    public InvalidToolCallException(String message, Throwable cause) {
        super(FailureKind.INVALID_TOOL_CALL, message, cause);
    }
}
