package io.statewalk.core.tool;

import io.statewalk.core.model.MachineEdge;
import java.util.Objects;

/// A tool offered for one decision, together with what it acts on.
///
/// @param definition agent-facing definition, not null
/// @param kind tool shape, not null
/// @param subject transition target, context name, meta tool name or constructed tool
///        name, not null
/// @param edge the candidate edge for transition tools, null otherwise
public record CatalogueEntry(ToolDefinition definition, ToolKind kind, String subject, MachineEdge edge) {

    public CatalogueEntry {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        if (kind == ToolKind.TRANSITION && edge == null) {
            throw new IllegalArgumentException("transition tool '" + definition.name() + "' needs an edge");
        }
    }

    public String name() {
        return definition.name();
    }
}
