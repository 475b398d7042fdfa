package io.statewalk.core.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Ordered set of tools offered to an agent for one decision.
///
/// ### Contracts
/// - **Invariant**: tool names are unique, order is the order entries were built in
///
/// @see io.statewalk.core.agent.AgentContextBuilder for construction
public final class ToolCatalogue {

    /// Prefix of transition tool names.
    public static final String TRANSITION_PREFIX = "transition_to_";
    public static final String READ_PREFIX = "read_";
    public static final String WRITE_PREFIX = "write_";

    public static final String CONSTRUCT_TOOL = "construct_tool";
    public static final String GET_DEFINITION = "get_definition";
    public static final String UPDATE_DEFINITION = "update_definition";

    private final Map<String, CatalogueEntry> entries;

    /// Creates a catalogue.
    ///
    /// @param entries entries in offer order, not null
    /// @throws IllegalArgumentException if two entries share a name
    public ToolCatalogue(List<CatalogueEntry> entries) {
        Map<String, CatalogueEntry> byName = new LinkedHashMap<>();
        for (CatalogueEntry entry : entries) {
            if (byName.putIfAbsent(entry.name(), entry) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + entry.name());
            }
        }
        this.entries = byName;
    }

    public static ToolCatalogue empty() {
        return new ToolCatalogue(List.of());
    }

    public Optional<CatalogueEntry> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public List<CatalogueEntry> entries() {
        return List.copyOf(entries.values());
    }

    /// Returns the entries of one kind in offer order.
    ///
    /// @param kind tool kind, not null
    /// @return matching entries, never null
    public List<CatalogueEntry> entriesOf(ToolKind kind) {
        return entries.values().stream().filter(e -> e.kind() == kind).toList();
    }

    /// Returns the agent-facing definitions in offer order.
    ///
    /// @return definitions, never null
    public List<ToolDefinition> definitions() {
        return entries.values().stream().map(CatalogueEntry::definition).toList();
    }

    public int size() {
        return entries.size();
    }

    /// Normalizes a node name into a tool-name fragment.
    ///
    /// Characters outside `[A-Za-z0-9_-]` become underscores.
    ///
    /// @param name node name, not null
    /// @return tool-name safe fragment
    public static String toolFragment(String name) {
        return name.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
