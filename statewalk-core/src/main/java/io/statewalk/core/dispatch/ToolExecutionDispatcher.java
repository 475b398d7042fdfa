package io.statewalk.core.dispatch;

import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.ToolCallRecord;
import io.statewalk.core.context.ContextAccessResolver;
import io.statewalk.core.context.ContextPermission;
import io.statewalk.core.context.SharedAttributeStore;
import io.statewalk.core.exception.InvalidToolCallException;
import io.statewalk.core.exception.PermissionDeniedException;
import io.statewalk.core.exception.UnknownTransitionException;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import io.statewalk.core.tool.CatalogueEntry;
import io.statewalk.core.tool.ConstructedTool;
import io.statewalk.core.tool.ToolCatalogue;
import io.statewalk.core.tool.ToolDefinition;
import io.statewalk.core.tool.ToolDefinition.ParameterType;
import io.statewalk.core.tool.ToolDefinition.ToolParameter;
import io.statewalk.core.tool.ToolRegistry;
import io.statewalk.core.tool.ToolStrategy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Validates an agent's tool call against the catalogue offered for the current node and
/// applies it.
///
/// ### Call handling
/// | Tool | Effect |
/// |---|---|
/// | `transition_to_*` | returns {@link DispatchOutcome.TransitionTaken}; the engine moves the path |
/// | `read_*` | returns readable values, {@link NotSet#NOT_SET} for unset fields |
/// | `write_*` | checks permissions, then writes all fields to the store at once |
/// | `construct_tool` | appends a tool to the session registry |
/// | `get_definition` | returns a structural view of the live model |
/// | `update_definition` | changes attribute values and edge decorations |
/// | constructed tool | echoes its description and arguments; nothing executes |
///
/// ### Contracts
/// - **Precondition**: `catalogue` is the catalogue offered in the request being answered
/// - **Postcondition**: a call that throws leaves the store, model and registry unchanged
///
/// @implNote Not thread-safe. Called only from the engine loop thread, which owns the
/// store and the live model.
///
/// @see io.statewalk.core.agent.AgentContextBuilder for catalogue construction
public class ToolExecutionDispatcher {

    private static final Logger logger = Logger.getLogger(ToolExecutionDispatcher.class.getName());

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");
    private static final Set<String> EDGE_UPDATE_KEYS =
            Set.of("index", "label", "condition", "priority");

    private final MachineModel model;
    private final ContextAccessResolver access;
    private final SharedAttributeStore store;
    private final ToolRegistry tools;

    /// Creates a dispatcher over the engine's live state.
    ///
    /// @param model live model, not null
    /// @param access context permission resolver for `model`, not null
    /// @param store shared attribute store, not null
    /// @param tools session tool registry, not null
    public ToolExecutionDispatcher(
            MachineModel model,
            ContextAccessResolver access,
            SharedAttributeStore store,
            ToolRegistry tools) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.access = Objects.requireNonNull(access, "access must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
    }

    /// Applies one tool call.
    ///
    /// @param nodeName node the decision belongs to, not null
    /// @param catalogue tools offered for the decision, not null
    /// @param response the agent's call, not null
    /// @return the outcome, never null
    /// @throws UnknownTransitionException if a transition tool was not offered
    /// @throws PermissionDeniedException if a context access is not permitted
    /// @throws InvalidToolCallException if the tool is unknown or the arguments are malformed
    public DispatchOutcome dispatch(
            String nodeName, ToolCatalogue catalogue, AgentResponse response) {
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(catalogue, "catalogue must not be null");
        Objects.requireNonNull(response, "response must not be null");

        String toolName = response.toolName();
        Map<String, Object> arguments = response.arguments();
        CatalogueEntry entry = catalogue.find(toolName).orElse(null);
        if (entry == null) {
            throw notOffered(nodeName, toolName);
        }
        checkRequired(entry.definition(), arguments);

        return switch (entry.kind()) {
            case TRANSITION -> {
                String reason = optionalText(arguments, "reason", toolName);
                yield new DispatchOutcome.TransitionTaken(
                        entry.edge(),
                        reason,
                        ToolCallRecord.success(toolName, arguments, entry.subject()));
            }
            case READ -> applied(toolName, arguments, read(nodeName, entry.subject(), arguments));
            case WRITE -> applied(toolName, arguments, write(nodeName, entry.subject(), arguments));
            case META -> applied(toolName, arguments, meta(nodeName, entry.subject(), arguments));
            case CONSTRUCTED ->
                    applied(toolName, arguments, invokeConstructed(entry.subject(), arguments));
        };
    }

    private static DispatchOutcome applied(
            String toolName, Map<String, Object> arguments, Object result) {
        return new DispatchOutcome.ToolApplied(ToolCallRecord.success(toolName, arguments, result));
    }

    private RuntimeException notOffered(String nodeName, String toolName) {
        if (toolName.startsWith(ToolCatalogue.TRANSITION_PREFIX)) {
            return new UnknownTransitionException(
                    "Transition tool '" + toolName + "' is not available at node " + nodeName);
        }
        String context = contextNamed(toolName, ToolCatalogue.WRITE_PREFIX);
        if (context != null) {
            return new PermissionDeniedException(
                    "Node " + nodeName + " has no write access to context " + context);
        }
        context = contextNamed(toolName, ToolCatalogue.READ_PREFIX);
        if (context != null) {
            return new PermissionDeniedException(
                    "Node " + nodeName + " has no read access to context " + context);
        }
        return new InvalidToolCallException(
                "Unknown tool '" + toolName + "' at node " + nodeName);
    }

    private String contextNamed(String toolName, String prefix) {
        if (!toolName.startsWith(prefix)) {
            return null;
        }
        String fragment = toolName.substring(prefix.length());
        return model.nodes().stream()
                .filter(MachineNode::isContext)
                .map(MachineNode::name)
                .filter(name -> ToolCatalogue.toolFragment(name).equals(fragment))
                .findFirst()
                .orElse(null);
    }

    private static void checkRequired(ToolDefinition definition, Map<String, Object> arguments) {
        for (String required : definition.requiredParameterNames()) {
            if (arguments.get(required) == null) {
                throw new InvalidToolCallException(
                        "Tool '" + definition.name() + "' requires argument '" + required + "'");
            }
        }
    }

    // -- Context tools --------------------------------------------------------------

    private Map<String, Object> read(String nodeName, String context, Map<String, Object> arguments) {
        ContextPermission permission = access.permission(nodeName, context);
        Object requested = arguments.get("fields");
        Collection<String> fields;
        if (requested == null) {
            fields = knownFields(context);
        } else {
            fields = stringList(requested, "fields", ToolCatalogue.READ_PREFIX + context);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : fields) {
            if (permission.canReadField(field)) {
                values.put(field, store.get(context, field).orElse(NotSet.NOT_SET));
            } else {
                values.put(field, NotSet.NOT_SET);
            }
        }
        logger.fine("Node " + nodeName + " read " + values.keySet() + " from " + context);
        return values;
    }

    private Set<String> knownFields(String context) {
        Set<String> fields = new LinkedHashSet<>();
        for (NodeAttribute attribute : model.requireNode(context).attributes()) {
            fields.add(attribute.name());
        }
        fields.addAll(store.valuesOf(context).keySet());
        return fields;
    }

    private Map<String, Object> write(String nodeName, String context, Map<String, Object> arguments) {
        ContextPermission permission = access.permission(nodeName, context);
        if (!permission.canWrite()) {
            throw new PermissionDeniedException(
                    "Node " + nodeName + " has no write access to context " + context);
        }
        Map<String, Object> data =
                objectArgument(arguments.get("data"), "data", ToolCatalogue.WRITE_PREFIX + context);
        for (String field : data.keySet()) {
            if (!permission.canWriteField(field)) {
                throw new PermissionDeniedException(
                        "Node "
                                + nodeName
                                + " may not write field '"
                                + field
                                + "' of context "
                                + context
                                + "; writable fields: "
                                + permission.writeFields());
            }
        }

        store.putAll(context, data);
        logger.fine("Node " + nodeName + " wrote " + data.keySet() + " to " + context);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("context", context);
        result.put("written", List.copyOf(data.keySet()));
        return result;
    }

    // -- Meta tools -----------------------------------------------------------------

    private Object meta(String nodeName, String tool, Map<String, Object> arguments) {
        return switch (tool) {
            case ToolCatalogue.CONSTRUCT_TOOL -> constructTool(nodeName, arguments);
            case ToolCatalogue.GET_DEFINITION -> definitionView();
            case ToolCatalogue.UPDATE_DEFINITION -> updateDefinition(nodeName, arguments);
            default -> throw new InvalidToolCallException("Unknown meta tool '" + tool + "'");
        };
    }

    private Map<String, Object> constructTool(String nodeName, Map<String, Object> arguments) {
        String name = requiredText(arguments, "name", ToolCatalogue.CONSTRUCT_TOOL);
        if (!TOOL_NAME.matcher(name).matches()) {
            throw new InvalidToolCallException("Invalid tool name '" + name + "'");
        }
        if (isReserved(name)) {
            throw new InvalidToolCallException("Tool name '" + name + "' is reserved");
        }
        if (tools.contains(name)) {
            throw new InvalidToolCallException("Tool '" + name + "' already exists");
        }
        String description = requiredText(arguments, "description", ToolCatalogue.CONSTRUCT_TOOL);
        String details = requiredText(arguments, "details", ToolCatalogue.CONSTRUCT_TOOL);
        ToolStrategy strategy;
        try {
            strategy =
                    ToolStrategy.fromWireName(
                            requiredText(arguments, "strategy", ToolCatalogue.CONSTRUCT_TOOL));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolCallException(e.getMessage(), e);
        }
        List<ToolParameter> parameters = parameters(arguments.get("parameters"));

        ToolDefinition definition;
        try {
            definition = new ToolDefinition(name, description, parameters);
        } catch (IllegalArgumentException e) {
            throw new InvalidToolCallException(e.getMessage(), e);
        }
        ConstructedTool tool = tools.register(definition, strategy, details, nodeName);
        logger.info(
                "Node "
                        + nodeName
                        + " constructed tool '"
                        + name
                        + "' ("
                        + strategy.wireName()
                        + ")");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", tool.name());
        result.put("strategy", strategy.wireName());
        result.put("sequence", tool.sequence());
        return result;
    }

    private static boolean isReserved(String name) {
        return name.startsWith(ToolCatalogue.TRANSITION_PREFIX)
                || name.startsWith(ToolCatalogue.READ_PREFIX)
                || name.startsWith(ToolCatalogue.WRITE_PREFIX)
                || name.equals(ToolCatalogue.CONSTRUCT_TOOL)
                || name.equals(ToolCatalogue.GET_DEFINITION)
                || name.equals(ToolCatalogue.UPDATE_DEFINITION);
    }

    /// Accepts `{param: "type"}` or `{param: {type, description, required}}`.
    private static List<ToolParameter> parameters(Object raw) {
        if (raw == null) {
            return List.of();
        }
        Map<String, Object> declared =
                objectArgument(raw, "parameters", ToolCatalogue.CONSTRUCT_TOOL);
        List<ToolParameter> parameters = new ArrayList<>();
        for (Map.Entry<String, Object> param : declared.entrySet()) {
            Object spec = param.getValue();
            if (spec instanceof String type) {
                parameters.add(
                        ToolParameter.optional(
                                param.getKey(), ParameterType.fromSchemaName(type), param.getKey()));
            } else if (spec instanceof Map<?, ?> details) {
                Object type = details.get("type");
                Object description = details.get("description");
                parameters.add(
                        new ToolParameter(
                                param.getKey(),
                                ParameterType.fromSchemaName(type != null ? type.toString() : null),
                                description != null ? description.toString() : param.getKey(),
                                Boolean.TRUE.equals(details.get("required"))));
            } else {
                throw new InvalidToolCallException(
                        "Parameter '" + param.getKey() + "' must be a type name or an object");
            }
        }
        return parameters;
    }

    /// Builds a structural description of the live model.
    ///
    /// @return title, revision, nodes and indexed edges, never null
    public Map<String, Object> definitionView() {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (MachineNode node : model.nodes()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("name", node.name());
            view.put("kind", node.kind().name().toLowerCase(Locale.ROOT));
            if (node.parent() != null) {
                view.put("parent", node.parent());
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            for (NodeAttribute attribute : node.attributes()) {
                attributes.put(
                        attribute.name(),
                        store.get(node.name(), attribute.name()).orElse(attribute.value()));
            }
            view.put("attributes", attributes);
            view.put("meta", node.isMetaEnabled());
            nodes.add(view);
        }

        List<Map<String, Object>> edges = new ArrayList<>();
        for (MachineEdge edge : model.edges()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("index", edge.index());
            view.put("source", edge.source());
            view.put("targets", edge.targets());
            view.put("label", edge.label());
            view.put("condition", edge.condition());
            view.put("priority", edge.priority());
            edges.add(view);
        }

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("title", model.title());
        definition.put("revision", model.revision());
        definition.put("nodes", nodes);
        definition.put("edges", edges);
        return definition;
    }

    private Map<String, Object> updateDefinition(String nodeName, Map<String, Object> arguments) {
        String reason = requiredText(arguments, "reason", ToolCatalogue.UPDATE_DEFINITION);

        // validate everything before touching the model
        Map<String, Map<String, Object>> attributeChanges = new LinkedHashMap<>();
        List<MachineNode> nodeUpdates = new ArrayList<>();
        Object rawNodes = arguments.get("nodes");
        if (rawNodes != null) {
            Map<String, Object> nodes =
                    objectArgument(rawNodes, "nodes", ToolCatalogue.UPDATE_DEFINITION);
            for (Map.Entry<String, Object> change : nodes.entrySet()) {
                MachineNode node =
                        model.node(change.getKey())
                                .orElseThrow(
                                        () ->
                                                new InvalidToolCallException(
                                                        "Structural change rejected: node '"
                                                                + change.getKey()
                                                                + "' does not exist"));
                Map<String, Object> values =
                        objectArgument(
                                change.getValue(),
                                "nodes." + change.getKey(),
                                ToolCatalogue.UPDATE_DEFINITION);
                for (Map.Entry<String, Object> value : values.entrySet()) {
                    node = node.withAttributeValue(value.getKey(), value.getValue());
                }
                attributeChanges.put(node.name(), values);
                nodeUpdates.add(node);
            }
        }

        List<MachineEdge> edgeUpdates = new ArrayList<>();
        Object rawEdges = arguments.get("edges");
        if (rawEdges != null) {
            if (!(rawEdges instanceof List<?> edges)) {
                throw new InvalidToolCallException(
                        "Argument 'edges' of update_definition must be an array");
            }
            Set<Integer> touched = new HashSet<>();
            for (Object rawEdge : edges) {
                MachineEdge edge = edgeUpdate(rawEdge);
                if (!touched.add(edge.index())) {
                    throw new InvalidToolCallException(
                            "Edge #" + edge.index() + " appears more than once in one update");
                }
                edgeUpdates.add(edge);
            }
        }

        for (MachineNode node : nodeUpdates) {
            model.updateNode(node);
            store.putAll(node.name(), attributeChanges.get(node.name()));
        }
        for (MachineEdge edge : edgeUpdates) {
            model.updateEdge(edge);
        }

        logger.info(
                "Node "
                        + nodeName
                        + " updated definition ("
                        + nodeUpdates.size()
                        + " nodes, "
                        + edgeUpdates.size()
                        + " edges): "
                        + reason);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("updatedNodes", nodeUpdates.stream().map(MachineNode::name).toList());
        result.put("updatedEdges", edgeUpdates.stream().map(MachineEdge::index).toList());
        result.put("revision", model.revision());
        return result;
    }

    private MachineEdge edgeUpdate(Object rawEdge) {
        Map<String, Object> change =
                objectArgument(rawEdge, "edges[]", ToolCatalogue.UPDATE_DEFINITION);
        for (String key : change.keySet()) {
            if (!EDGE_UPDATE_KEYS.contains(key)) {
                throw new InvalidToolCallException(
                        "Structural change rejected: edge field '" + key + "' cannot be changed");
            }
        }
        if (!(change.get("index") instanceof Number number)
                || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new InvalidToolCallException("Edge change requires an integer 'index'");
        }
        int index = number.intValue();
        if (index < 0 || index >= model.edges().size()) {
            throw new InvalidToolCallException(
                    "Structural change rejected: edge #" + index + " does not exist");
        }
        MachineEdge edge = model.edges().get(index);

        String label = edge.label();
        if (change.containsKey("label")) {
            label = change.get("label") != null ? change.get("label").toString() : null;
        }
        String condition = edge.condition();
        if (change.containsKey("condition")) {
            condition = change.get("condition") != null ? change.get("condition").toString() : null;
        }
        Integer priority = edge.priority();
        if (change.containsKey("priority")) {
            Object value = change.get("priority");
            if (value != null && !(value instanceof Number)) {
                throw new InvalidToolCallException("Edge priority must be a number");
            }
            priority = value != null ? ((Number) value).intValue() : null;
        }
        return edge.withDecoration(label, condition, priority);
    }

    // -- Constructed tools ----------------------------------------------------------

    private Map<String, Object> invokeConstructed(String name, Map<String, Object> arguments) {
        ConstructedTool tool =
                tools.get(name)
                        .orElseThrow(() -> new InvalidToolCallException("Unknown tool '" + name + "'"));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tool", tool.name());
        result.put("strategy", tool.strategy().wireName());
        result.put("description", tool.definition().description());
        result.put("details", tool.details());
        result.put("arguments", arguments);
        result.put("executed", false);
        return result;
    }

    // -- Argument helpers -----------------------------------------------------------

    private static String requiredText(Map<String, Object> arguments, String name, String tool) {
        String value = optionalText(arguments, name, tool);
        if (value == null || value.isBlank()) {
            throw new InvalidToolCallException("Tool '" + tool + "' requires argument '" + name + "'");
        }
        return value;
    }

    private static String optionalText(Map<String, Object> arguments, String name, String tool) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new InvalidToolCallException(
                    "Argument '" + name + "' of " + tool + " must be a string");
        }
        return text;
    }

    private static Map<String, Object> objectArgument(Object value, String name, String tool) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidToolCallException(
                    "Argument '" + name + "' of " + tool + " must be an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new InvalidToolCallException(
                        "Argument '" + name + "' of " + tool + " must have string keys");
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    private static List<String> stringList(Object value, String name, String tool) {
        if (!(value instanceof List<?> list)) {
            throw new InvalidToolCallException(
                    "Argument '" + name + "' of " + tool + " must be an array");
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String text)) {
                throw new InvalidToolCallException(
                        "Argument '" + name + "' of " + tool + " must contain strings");
            }
            strings.add(text);
        }
        return strings;
    }
}
