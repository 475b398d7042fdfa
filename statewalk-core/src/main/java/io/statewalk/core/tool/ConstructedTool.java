package io.statewalk.core.tool;

import java.util.Objects;

/// Tool descriptor added at runtime through `construct_tool`.
///
/// @param definition what agents see, not null
/// @param strategy how the tool is interpreted, not null
/// @param details instructions or composition for the strategy, not null
/// @param constructedBy node that constructed the tool, not null
/// @param sequence position in construction order, starting at 1
public record ConstructedTool(
        ToolDefinition definition,
        ToolStrategy strategy,
        String details,
        String constructedBy,
        int sequence) {

    public ConstructedTool {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(details, "details must not be null");
        Objects.requireNonNull(constructedBy, "constructedBy must not be null");
    }

    public String name() {
        return definition.name();
    }
}
