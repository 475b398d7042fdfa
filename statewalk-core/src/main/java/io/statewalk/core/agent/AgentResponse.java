package io.statewalk.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// An agent's answer: exactly one tool call plus free-text reasoning.
///
/// @param requestId id of the request answered, not null
/// @param toolName the chosen tool, not null
/// @param arguments call arguments, not null (may be empty)
/// @param reasoning agent's explanation, may be null
public record AgentResponse(
        String requestId, String toolName, Map<String, Object> arguments, String reasoning) {

    public AgentResponse {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        arguments =
                arguments != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                        : Map.of();
    }

    /// Creates a response without arguments.
    ///
    /// @param requestId request answered, not null
    /// @param toolName chosen tool, not null
    /// @param reasoning explanation, may be null
    /// @return new response, never null
    public static AgentResponse call(String requestId, String toolName, String reasoning) {
        return new AgentResponse(requestId, toolName, Map.of(), reasoning);
    }
}
