package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when the agent call itself fails at the transport level.
///
/// The engine never retries such failures; the waiting path is marked failed and the
/// retry-or-abort decision is left to the caller.
public class AgentUnavailableException extends StateMachineException {

    @Serial private static final long serialVersionUID = -4590123784462204717L;

    public AgentUnavailableException(String message) {
        super(FailureKind.AGENT_UNAVAILABLE, message);
    }

    public AgentUnavailableException(String message, Throwable cause) {
        super(FailureKind.AGENT_UNAVAILABLE, message, cause);
    }
}
