package io.statewalk.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.statewalk.core.model.AccessMarker;
import io.statewalk.core.model.EdgeEndType;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import io.statewalk.core.model.NodeCapability;
import io.statewalk.core.model.NodeKind;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Reads the flattened node/edge document back into a `MachineModel`.
///
/// Node kinds and end types are resolved leniently through {@link NodeKind#fromName} and
/// {@link EdgeEndType#fromName}, so documents produced by other tools may use aliases
/// such as `"initial"` or arrow notation such as `"=>"`. Attribute values are read as
/// plain Java values (strings, numbers, booleans, maps and lists).
///
/// Structural validation is left to {@link MachineModel.Builder#build()}; its
/// `MachineStructureException` propagates unchanged.
///
/// @implNote Package-private. Registered by {@link StatewalkJacksonModule}.
/// @see MachineModelJsonSerializer for the inverse operation
class MachineModelJsonDeserializer extends StdDeserializer<MachineModel> {

    @Serial private static final long serialVersionUID = -6021837519473625390L;

    MachineModelJsonDeserializer() {
        super(MachineModel.class);
    }

    @Override
    public MachineModel deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return fromTree(mapper, mapper.readTree(p));
    }

    /// Builds a model from an already parsed document.
    ///
    /// @param mapper mapper used to convert attribute values, not null
    /// @param root document root, not null
    /// @return the built model, never null
    /// @throws IOException if a required field is missing or has the wrong shape
    static MachineModel fromTree(ObjectMapper mapper, JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Machine model document must be a JSON object");
        }
        MachineModel.Builder builder = MachineModel.builder(text(root, "title", "untitled"));

        int position = 0;
        for (JsonNode node : root.path("nodes")) {
            builder.node(readNode(mapper, node, position++));
        }
        position = 0;
        for (JsonNode edge : root.path("edges")) {
            builder.edge(readEdge(edge, position++));
        }
        return builder.build();
    }

    private static MachineNode readNode(ObjectMapper mapper, JsonNode node, int position)
            throws IOException {
        String name = required(node, "name", "node #" + position);
        List<NodeAttribute> attributes = new ArrayList<>();
        for (JsonNode attribute : node.path("attributes")) {
            JsonNode value = attribute.get("value");
            attributes.add(
                    new NodeAttribute(
                            required(attribute, "name", "attribute of node '" + name + "'"),
                            text(attribute, "type", null),
                            value == null || value.isNull()
                                    ? null
                                    : mapper.treeToValue(value, Object.class)));
        }

        Set<NodeCapability> capabilities = EnumSet.noneOf(NodeCapability.class);
        for (JsonNode capability : node.path("capabilities")) {
            String capabilityName = capability.asText().trim().toUpperCase(Locale.ROOT);
            try {
                capabilities.add(NodeCapability.valueOf(capabilityName));
            } catch (IllegalArgumentException e) {
                throw new IOException(
                        "Unknown capability '" + capability.asText() + "' on node '" + name + "'", e);
            }
        }

        return new MachineNode(
                name,
                NodeKind.fromName(text(node, "kind", null)),
                text(node, "parent", null),
                attributes,
                capabilities);
    }

    private static MachineEdge readEdge(JsonNode edge, int position) throws IOException {
        String where = "edge #" + position;
        MachineEdge.Builder builder = MachineEdge.from(required(edge, "source", where));
        for (JsonNode segment : edge.path("segments")) {
            builder.to(
                    required(segment, "target", "segment of " + where),
                    EdgeEndType.fromName(text(segment, "endType", null)));
        }
        JsonNode priority = edge.get("priority");
        try {
            return builder.label(text(edge, "label", null))
                    .condition(text(edge, "condition", null))
                    .priority(priority == null || priority.isNull() ? null : priority.asInt())
                    .reads(marker(edge.get("reads"), where))
                    .writes(marker(edge.get("writes"), where))
                    .automatic(edge.path("automatic").asBoolean(false))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid " + where + ": " + e.getMessage(), e);
        }
    }

    private static AccessMarker marker(JsonNode value, String where) throws IOException {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            if (MachineModelJsonSerializer.UNRESTRICTED.equals(value.asText().trim())) {
                return AccessMarker.ALL;
            }
            return AccessMarker.of(value.asText().trim());
        }
        if (value.isArray()) {
            List<String> fields = new ArrayList<>();
            for (JsonNode field : value) {
                fields.add(field.asText());
            }
            return new AccessMarker(fields);
        }
        throw new IOException("Access marker of " + where + " must be \"*\" or an array of fields");
    }

    private static String required(JsonNode node, String field, String where) throws IOException {
        String value = text(node, field, null);
        if (value == null || value.isBlank()) {
            throw new IOException("Missing '" + field + "' in " + where);
        }
        return value;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }
}
