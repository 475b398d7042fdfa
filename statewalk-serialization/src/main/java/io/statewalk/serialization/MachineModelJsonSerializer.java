package io.statewalk.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.statewalk.core.model.AccessMarker;
import io.statewalk.core.model.EdgeSegment;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import io.statewalk.core.model.NodeCapability;
import java.io.IOException;
import java.io.Serial;

/// Writes a `MachineModel` as its flattened node/edge document.
///
/// ```
/// Section   Fields
/// ——————————+—————————————————————————————————————————————————————————————————
/// model     │ title, nodes, edges
/// node      │ name, kind, parent?, attributes, capabilities
/// attribute │ name, type?, value
/// edge      │ source, segments, label?, condition?, priority?, reads?, writes?,
///           │ automatic
/// segment   │ target, endType
/// ```
///
/// Access markers are written as `"*"` when unrestricted and as an array of field names
/// otherwise. Absent markers are omitted. Edge indexes are not written; they follow from
/// the order of the `edges` array.
///
/// @implNote Package-private. Registered by {@link StatewalkJacksonModule}.
/// @see MachineModelJsonDeserializer for the inverse operation
class MachineModelJsonSerializer extends StdSerializer<MachineModel> {

    @Serial private static final long serialVersionUID = 4410958271166210385L;

    static final String UNRESTRICTED = "*";

    MachineModelJsonSerializer() {
        super(MachineModel.class);
    }

    @Override
    public void serialize(MachineModel model, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("title", model.title());

        gen.writeArrayFieldStart("nodes");
        for (MachineNode node : model.nodes()) {
            writeNode(node, gen, provider);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("edges");
        for (MachineEdge edge : model.edges()) {
            writeEdge(edge, gen);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writeNode(MachineNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", node.name());
        gen.writeStringField("kind", node.kind().name());
        if (node.parent() != null) {
            gen.writeStringField("parent", node.parent());
        }

        gen.writeArrayFieldStart("attributes");
        for (NodeAttribute attribute : node.attributes()) {
            gen.writeStartObject();
            gen.writeStringField("name", attribute.name());
            if (attribute.declaredType() != null) {
                gen.writeStringField("type", attribute.declaredType());
            }
            gen.writeFieldName("value");
            provider.defaultSerializeValue(attribute.value(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("capabilities");
        for (NodeCapability capability : NodeCapability.values()) {
            if (node.capabilities().contains(capability)) {
                gen.writeString(capability.name());
            }
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writeEdge(MachineEdge edge, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("source", edge.source());

        gen.writeArrayFieldStart("segments");
        for (EdgeSegment segment : edge.segments()) {
            gen.writeStartObject();
            gen.writeStringField("target", segment.target());
            gen.writeStringField("endType", segment.endType().name());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (edge.label() != null) {
            gen.writeStringField("label", edge.label());
        }
        if (edge.condition() != null) {
            gen.writeStringField("condition", edge.condition());
        }
        if (edge.priority() != null) {
            gen.writeNumberField("priority", edge.priority());
        }
        writeMarker("reads", edge.reads(), gen);
        writeMarker("writes", edge.writes(), gen);
        gen.writeBooleanField("automatic", edge.automatic());

        gen.writeEndObject();
    }

    private void writeMarker(String field, AccessMarker marker, JsonGenerator gen)
            throws IOException {
        if (marker == null) {
            return;
        }
        if (marker.isUnrestricted()) {
            gen.writeStringField(field, UNRESTRICTED);
            return;
        }
        gen.writeArrayFieldStart(field);
        for (String name : marker.fields()) {
            gen.writeString(name);
        }
        gen.writeEndArray();
    }
}
