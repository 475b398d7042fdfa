package io.statewalk.core.agent;

import io.statewalk.core.context.ContextAccessResolver;
import io.statewalk.core.context.ContextPermission;
import io.statewalk.core.context.SharedAttributeStore;
import io.statewalk.core.execution.result.ExecutionHistory;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.tool.CatalogueEntry;
import io.statewalk.core.tool.ConstructedTool;
import io.statewalk.core.tool.ToolCatalogue;
import io.statewalk.core.tool.ToolDefinition;
import io.statewalk.core.tool.ToolDefinition.ParameterType;
import io.statewalk.core.tool.ToolDefinition.ToolParameter;
import io.statewalk.core.tool.ToolKind;
import io.statewalk.core.tool.ToolRegistry;
import io.statewalk.core.transition.TransitionEvaluator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Builds the context and tool catalogue for a node that needs an agent decision.
///
/// ### Catalogue order
/// 1. `transition_to_<target>` per candidate edge, in declaration order
/// 2. `read_<context>` / `write_<context>` per accessible context, in context
///    declaration order, read before write
/// 3. `construct_tool`, `get_definition`, `update_definition` on meta-enabled nodes
/// 4. Tools constructed earlier in the session, in construction order
///
/// Two candidate edges reaching the same first target get suffixed names
/// (`transition_to_done`, `transition_to_done_2`).
///
/// ### Contracts
/// - **Postcondition**: the catalogue depends only on the model, the candidates and the
///   session tool registry; equal inputs give equal catalogues
///
/// @see AgentInvocation
public class AgentContextBuilder {

    /// Default number of history entries included in a context.
    public static final int DEFAULT_HISTORY_TAIL = 5;

    private final MachineModel model;
    private final ContextAccessResolver access;
    private final TransitionEvaluator transitions;
    private final ToolRegistry tools;
    private final int historyTail;

    /// Creates a builder.
    ///
    /// @param model live model, not null
    /// @param access context permission resolver, not null
    /// @param transitions transition evaluator used for target resolution, not null
    /// @param tools session tool registry, not null
    /// @param historyTail number of history entries to include, not negative
    public AgentContextBuilder(
            MachineModel model,
            ContextAccessResolver access,
            TransitionEvaluator transitions,
            ToolRegistry tools,
            int historyTail) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.access = Objects.requireNonNull(access, "access must not be null");
        this.transitions = Objects.requireNonNull(transitions, "transitions must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        if (historyTail < 0) {
            throw new IllegalArgumentException("historyTail must not be negative");
        }
        this.historyTail = historyTail;
    }

    /// Builds the context and catalogue for one agent turn.
    ///
    /// @param nodeName node needing a decision, not null
    /// @param candidates candidate edges, not null or empty
    /// @param reason why an agent is needed, not null
    /// @param store current attribute values, not null
    /// @param history the waiting path's history, not null
    /// @param previousCalls tool calls already made in this decision, not null
    /// @return context and catalogue, never null
    public AgentInvocation build(
            String nodeName,
            List<MachineEdge> candidates,
            String reason,
            SharedAttributeStore store,
            ExecutionHistory history,
            List<ToolCallRecord> previousCalls) {
        MachineNode node = model.requireNode(nodeName);
        ToolCatalogue catalogue = buildCatalogue(nodeName, candidates);

        List<AgentContext.TransitionOption> options = new ArrayList<>();
        for (CatalogueEntry entry : catalogue.entriesOf(ToolKind.TRANSITION)) {
            MachineEdge edge = entry.edge();
            options.add(
                    new AgentContext.TransitionOption(
                            entry.name(),
                            transitions.transitionTargets(edge),
                            edge.label(),
                            edge.condition(),
                            edge.priority()));
        }

        Map<String, AgentContext.ContextView> contexts = new LinkedHashMap<>();
        for (ContextPermission permission : access.accessible(nodeName).values()) {
            Map<String, Object> values = new LinkedHashMap<>();
            if (permission.canRead()) {
                store.valuesOf(permission.context())
                        .forEach(
                                (field, value) -> {
                                    if (permission.canReadField(field)) {
                                        values.put(field, value);
                                    }
                                });
            }
            contexts.put(
                    permission.context(),
                    new AgentContext.ContextView(
                            permission.context(),
                            permission.canRead(),
                            permission.canWrite(),
                            permission.readFields(),
                            permission.writeFields(),
                            values));
        }

        AgentContext context =
                new AgentContext(
                        nodeName,
                        node.kind(),
                        node.textAttribute("title").orElse(nodeName),
                        node.textAttribute("description").orElse(null),
                        node.textAttribute(MachineNode.PROMPT_ATTRIBUTE).orElse(null),
                        store.valuesOf(nodeName),
                        history.tail(historyTail),
                        options,
                        contexts,
                        node.isMetaEnabled(),
                        reason,
                        previousCalls);
        return new AgentInvocation(context, catalogue);
    }

    /// Builds the tool catalogue for a node.
    ///
    /// @param nodeName node needing a decision, not null
    /// @param candidates candidate edges in declaration order, not null
    /// @return the catalogue, never null
    public ToolCatalogue buildCatalogue(String nodeName, List<MachineEdge> candidates) {
        MachineNode node = model.requireNode(nodeName);
        List<CatalogueEntry> entries = new ArrayList<>();
        Set<String> used = new HashSet<>();

        for (MachineEdge edge : candidates) {
            List<String> targets = transitions.transitionTargets(edge);
            String base = ToolCatalogue.TRANSITION_PREFIX + ToolCatalogue.toolFragment(targets.get(0));
            String name = base;
            for (int n = 2; !used.add(name); n++) {
                name = base + "_" + n;
            }
            entries.add(
                    new CatalogueEntry(
                            new ToolDefinition(
                                    name,
                                    transitionDescription(edge, targets),
                                    List.of(
                                            ToolParameter.optional(
                                                    "reason",
                                                    ParameterType.STRING,
                                                    "Why this transition is taken"))),
                            ToolKind.TRANSITION,
                            targets.get(0),
                            edge));
        }

        for (ContextPermission permission : access.accessible(nodeName).values()) {
            String fragment = ToolCatalogue.toolFragment(permission.context());
            if (permission.canRead()) {
                entries.add(
                        new CatalogueEntry(
                                new ToolDefinition(
                                        ToolCatalogue.READ_PREFIX + fragment,
                                        "Read attributes of context '" + permission.context() + "'",
                                        List.of(
                                                ToolParameter.optional(
                                                        "fields",
                                                        ParameterType.ARRAY,
                                                        "Attribute names to read; omit for all"))),
                                ToolKind.READ,
                                permission.context(),
                                null));
            }
            if (permission.canWrite()) {
                entries.add(
                        new CatalogueEntry(
                                new ToolDefinition(
                                        ToolCatalogue.WRITE_PREFIX + fragment,
                                        "Write attributes of context '" + permission.context() + "'",
                                        List.of(
                                                ToolParameter.required(
                                                        "data",
                                                        ParameterType.OBJECT,
                                                        "Attribute values to set"))),
                                ToolKind.WRITE,
                                permission.context(),
                                null));
            }
        }

        if (node.isMetaEnabled()) {
            entries.addAll(metaEntries());
        }

        for (ConstructedTool tool : tools.all()) {
            entries.add(
                    new CatalogueEntry(tool.definition(), ToolKind.CONSTRUCTED, tool.name(), null));
        }
        return new ToolCatalogue(entries);
    }

    private static String transitionDescription(MachineEdge edge, List<String> targets) {
        StringBuilder sb = new StringBuilder();
        sb.append(edge.label() != null ? edge.label() : "Transition to " + targets.get(0));
        if (targets.size() > 1) {
            sb.append(" (forks to ").append(String.join(", ", targets)).append(")");
        }
        if (edge.condition() != null) {
            sb.append(" when ").append(edge.condition());
        }
        return sb.toString();
    }

    private static List<CatalogueEntry> metaEntries() {
        return List.of(
                new CatalogueEntry(
                        new ToolDefinition(
                                ToolCatalogue.CONSTRUCT_TOOL,
                                "Construct a new tool available for the rest of the session",
                                List.of(
                                        ToolParameter.required(
                                                "name", ParameterType.STRING, "Tool name in snake_case"),
                                        ToolParameter.required(
                                                "description",
                                                ParameterType.STRING,
                                                "What the tool does"),
                                        ToolParameter.optional(
                                                "parameters",
                                                ParameterType.OBJECT,
                                                "Parameter name to {type, description, required}"),
                                        ToolParameter.required(
                                                "strategy",
                                                ParameterType.STRING,
                                                "agent_backed or composition"),
                                        ToolParameter.required(
                                                "details",
                                                ParameterType.STRING,
                                                "Instructions or composition for the strategy"))),
                        ToolKind.META,
                        ToolCatalogue.CONSTRUCT_TOOL,
                        null),
                new CatalogueEntry(
                        new ToolDefinition(
                                ToolCatalogue.GET_DEFINITION,
                                "Get the current machine definition",
                                List.of()),
                        ToolKind.META,
                        ToolCatalogue.GET_DEFINITION,
                        null),
                new CatalogueEntry(
                        new ToolDefinition(
                                ToolCatalogue.UPDATE_DEFINITION,
                                "Update node attributes and edge labels, conditions or priorities",
                                List.of(
                                        ToolParameter.optional(
                                                "nodes",
                                                ParameterType.OBJECT,
                                                "Node name to attribute values to set"),
                                        ToolParameter.optional(
                                                "edges",
                                                ParameterType.ARRAY,
                                                "Edge changes: {index, label, condition, priority}"),
                                        ToolParameter.required(
                                                "reason",
                                                ParameterType.STRING,
                                                "Why the definition is changed"))),
                        ToolKind.META,
                        ToolCatalogue.UPDATE_DEFINITION,
                        null));
    }
}
