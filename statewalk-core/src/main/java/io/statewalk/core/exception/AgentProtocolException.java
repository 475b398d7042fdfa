package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when an agent keeps producing invalid tool calls for a single decision.
///
/// The cause is the last rejected call's exception, typically an
/// {@link UnknownTransitionException}, {@link PermissionDeniedException} or
/// {@link InvalidToolCallException}.
public class AgentProtocolException extends StateMachineException {

    @Serial private static final long serialVersionUID = -3060485516370512318L;

    /// Creates exception with message.
    ///
    /// @param message description of the protocol violation
    public AgentProtocolException(String message) {
        super(FailureKind.AGENT_PROTOCOL, message);
    }

    /// Creates exception with message and the last rejected call.
    ///
    /// @param message description of the protocol violation
    /// @param cause the exception raised by the last invalid call
    public AgentProtocolException(String message, Throwable cause) {
        super(FailureKind.AGENT_PROTOCOL, message, cause);
    }
}
