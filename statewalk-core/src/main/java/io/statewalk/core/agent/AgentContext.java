package io.statewalk.core.agent;

import io.statewalk.core.execution.result.HistoryEntry;
import io.statewalk.core.model.NodeKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Structured description of a decision point, given to an agent with the tool catalogue.
///
/// @param nodeName current node, not null
/// @param kind current node kind, not null
/// @param title display title, defaults to the node name, not null
/// @param description node description, may be null
/// @param prompt node objective, may be null
/// @param attributes current values of the node's own attributes, not null
/// @param recentHistory last transitions of the path, oldest first, not null
/// @param transitions candidate transitions in offer order, not null
/// @param contexts accessible contexts in declaration order, not null
/// @param metaEnabled whether meta tools are offered
/// @param reason why the decision needs an agent, not null
/// @param previousCalls tool calls already made in this decision, not null
public record AgentContext(
        String nodeName,
        NodeKind kind,
        String title,
        String description,
        String prompt,
        Map<String, Object> attributes,
        List<HistoryEntry> recentHistory,
        List<TransitionOption> transitions,
        Map<String, ContextView> contexts,
        boolean metaEnabled,
        String reason,
        List<ToolCallRecord> previousCalls) {

    public AgentContext {
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        title = title != null ? title : nodeName;
        attributes = unmodifiableCopy(attributes);
        recentHistory = recentHistory != null ? List.copyOf(recentHistory) : List.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
        contexts =
                contexts != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(contexts))
                        : Map.of();
        Objects.requireNonNull(reason, "reason must not be null");
        previousCalls = previousCalls != null ? List.copyOf(previousCalls) : List.of();
    }

    /// Renders the context as a plain-text prompt for text-based agents.
    ///
    /// @return markdown-formatted prompt, never null
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Current Position\n");
        sb.append("- **Node**: ").append(nodeName).append('\n');
        sb.append("- **Type**: ").append(kind.name().toLowerCase(Locale.ROOT)).append('\n');
        if (!title.equals(nodeName)) {
            sb.append("- **Title**: ").append(title).append('\n');
        }
        if (description != null) {
            sb.append("- **Description**: ").append(description).append('\n');
        }
        if (prompt != null) {
            sb.append("- **Objective**: ").append(prompt).append('\n');
        }

        if (!recentHistory.isEmpty()) {
            sb.append("\n# Recent Transitions\n");
            for (HistoryEntry entry : recentHistory) {
                sb.append("- ").append(entry).append('\n');
            }
        }

        if (!contexts.isEmpty()) {
            sb.append("\n# Available Context\n");
            for (ContextView view : contexts.values()) {
                sb.append("## ").append(view.name()).append('\n');
                sb.append("- **Permissions**: ").append(view.permissionText()).append('\n');
                if (!view.values().isEmpty()) {
                    sb.append("- **Current Values**:\n");
                    view.values()
                            .forEach(
                                    (field, value) ->
                                            sb.append("  - ")
                                                    .append(field)
                                                    .append(": ")
                                                    .append(value)
                                                    .append('\n'));
                }
            }
        }

        sb.append("\n# Available Transitions\n");
        for (TransitionOption option : transitions) {
            sb.append("## ").append(option.toolName()).append('\n');
            sb.append("- **Target**: ").append(String.join(", ", option.targets())).append('\n');
            if (option.label() != null) {
                sb.append("- **Description**: ").append(option.label()).append('\n');
            }
            if (option.condition() != null) {
                sb.append("- **Condition**: ").append(option.condition()).append('\n');
            }
        }

        if (!previousCalls.isEmpty()) {
            sb.append("\n# Tool Results So Far\n");
            for (ToolCallRecord call : previousCalls) {
                sb.append("- ").append(call.toolName()).append(": ");
                sb.append(call.success() ? String.valueOf(call.result()) : "ERROR " + call.error());
                sb.append('\n');
            }
        }

        sb.append("\n# Instructions\n");
        sb.append(reason).append(".\n");
        sb.append("Use the read and write tools to work with context data, then call exactly one ")
                .append("transition tool to move forward.\n");
        return sb.toString();
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return source != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
                : Map.of();
    }

    /// One candidate transition.
    ///
    /// @param toolName tool that takes this transition, not null
    /// @param targets transition targets, more than one for forking edges, not null
    /// @param label edge label, may be null
    /// @param condition edge condition, may be null
    /// @param priority explicit priority, may be null
    public record TransitionOption(
            String toolName, List<String> targets, String label, String condition, Integer priority) {

        public TransitionOption {
            Objects.requireNonNull(toolName, "toolName must not be null");
            targets = List.copyOf(targets);
        }
    }

    /// Snapshot of one accessible context.
    ///
    /// @param name context name, not null
    /// @param canRead read permission
    /// @param canWrite write permission
    /// @param readFields read restriction, empty for all
    /// @param writeFields write restriction, empty for all
    /// @param values currently set, readable values; empty when not readable
    public record ContextView(
            String name,
            boolean canRead,
            boolean canWrite,
            Set<String> readFields,
            Set<String> writeFields,
            Map<String, Object> values) {

        public ContextView {
            Objects.requireNonNull(name, "name must not be null");
            readFields = readFields != null ? Set.copyOf(readFields) : Set.of();
            writeFields = writeFields != null ? Set.copyOf(writeFields) : Set.of();
            values = unmodifiableCopy(values);
        }

        String permissionText() {
            StringBuilder text = new StringBuilder();
            if (canRead) {
                text.append("read");
                if (!readFields.isEmpty()) {
                    text.append(" ").append(new TreeSet<>(readFields));
                }
            }
            if (canWrite) {
                text.append(canRead ? ", " : "").append("write");
                if (!writeFields.isEmpty()) {
                    text.append(" ").append(new TreeSet<>(writeFields));
                }
            }
            return text.toString();
        }
    }
}
