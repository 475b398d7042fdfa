package io.statewalk.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Outcome of one non-transition tool call made earlier in the same decision.
///
/// Fed back to the agent on its next turn.
///
/// @param toolName tool that was called, not null
/// @param arguments arguments passed, not null
/// @param success whether the call was applied
/// @param result returned value, may be null
/// @param error rejection message when `success` is false, may be null
public record ToolCallRecord(
        String toolName, Map<String, Object> arguments, boolean success, Object result, String error) {

    public ToolCallRecord {
        Objects.requireNonNull(toolName, "toolName must not be null");
        arguments =
                arguments != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                        : Map.of();
    }

    public static ToolCallRecord success(String toolName, Map<String, Object> arguments, Object result) {
        return new ToolCallRecord(toolName, arguments, true, result, null);
    }

    public static ToolCallRecord failure(String toolName, Map<String, Object> arguments, String error) {
        return new ToolCallRecord(toolName, arguments, false, null, error);
    }
}
