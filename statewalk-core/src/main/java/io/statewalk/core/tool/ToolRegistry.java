package io.statewalk.core.tool;

import java.util.List;
import java.util.Optional;

/// Registry of tools constructed during an execution session.
///
/// The registry is append-only: a tool, once constructed, stays available to every
/// path for the rest of the session and is never replaced. Lookup happens at dispatch
/// time by name.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new SessionToolRegistry();
/// registry.register(definition, ToolStrategy.AGENT_BACKED, "Summarize the input", "planner");
/// Optional<ConstructedTool> tool = registry.get("summarize");
/// }
///
/// @see SessionToolRegistry for the default implementation
public interface ToolRegistry {

    /// Appends a new tool.
    ///
    /// @apiNote **Side effects**: Modifies the registry
    ///
    /// @param definition agent-facing definition, not null
    /// @param strategy interpretation strategy, not null
    /// @param details strategy details, not null
    /// @param constructedBy node that constructed the tool, not null
    /// @return the registered tool, never null
    /// @throws IllegalArgumentException if a tool with the same name already exists
    ConstructedTool register(
            ToolDefinition definition, ToolStrategy strategy, String details, String constructedBy);

    /// Retrieves a tool by name.
    ///
    /// @param name tool name, not null
    /// @return the tool if registered, empty otherwise
    Optional<ConstructedTool> get(String name);

    /// Returns all tools in construction order.
    ///
    /// @return unmodifiable list, never null (may be empty)
    List<ConstructedTool> all();

    default boolean contains(String name) {
        return get(name).isPresent();
    }

    default int size() {
        return all().size();
    }
}
