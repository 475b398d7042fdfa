package io.statewalk.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statewalk.core.exception.MachineStructureException;
import io.statewalk.core.model.AccessMarker;
import io.statewalk.core.model.EdgeEndType;
import io.statewalk.core.model.EdgeSegment;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import io.statewalk.core.model.NodeCapability;
import io.statewalk.core.model.NodeKind;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/// Tests for the machine model JSON document.
class MachineModelSerializerTest {

    private static MachineModel reviewModel() {
        return MachineModel.builder("review")
                .node(MachineNode.of("start", NodeKind.INIT))
                .node(
                        new MachineNode(
                                "review",
                                NodeKind.STATE,
                                null,
                                List.of(NodeAttribute.of(MachineNode.PROMPT_ATTRIBUTE, "Check the draft")),
                                Set.of(NodeCapability.META)))
                .node(
                        new MachineNode(
                                "draft",
                                NodeKind.TASK,
                                "review",
                                List.of(new NodeAttribute("attempts", "int", 2)),
                                Set.of()))
                .node(MachineNode.of("publish", NodeKind.STATE))
                .node(MachineNode.of("archive", NodeKind.STATE))
                .node(
                        new MachineNode(
                                "metrics",
                                NodeKind.CONTEXT,
                                null,
                                List.of(
                                        NodeAttribute.of("score", null),
                                        NodeAttribute.of("owner", "ops"),
                                        NodeAttribute.of("limits", Map.of("max", 10))),
                                Set.of()))
                .edge(MachineEdge.from("start").to("review").build())
                .edge(
                        MachineEdge.from("review")
                                .to("publish", EdgeEndType.CAUSAL)
                                .to("archive")
                                .label("ship it")
                                .condition("metrics.score >= 7")
                                .priority(2)
                                .build())
                .edge(
                        MachineEdge.from("review")
                                .to("metrics")
                                .reads(AccessMarker.ALL)
                                .writes(AccessMarker.of("score", "owner"))
                                .build())
                .build();
    }

    @Nested
    class RoundTrip {

        @Test
        void shouldRestoreEquivalentModel() {
            // Given
            MachineModel original = reviewModel();

            // When
            MachineModel restored = MachineModelSerializer.fromJson(MachineModelSerializer.toJson(original));

            // Then
            assertThat(restored.title()).isEqualTo("review");
            assertThat(restored.nodes()).isEqualTo(original.nodes());
            assertThat(restored.edges()).isEqualTo(original.edges());
        }

        @Test
        void shouldBindThroughRegisteredDeserializer() throws Exception {
            ObjectMapper mapper = MachineModelSerializer.createMapper();

            MachineModel restored =
                    mapper.readValue(mapper.writeValueAsString(reviewModel()), MachineModel.class);

            assertThat(restored.children("review")).containsExactly("draft");
            assertThat(restored.requireNode("review").isMetaEnabled()).isTrue();
        }

        @Test
        void shouldReadAndWriteFiles(@TempDir Path directory) {
            Path file = directory.resolve("review.json");

            MachineModelSerializer.write(reviewModel(), file);
            MachineModel restored = MachineModelSerializer.read(file);

            assertThat(restored.edges()).hasSize(3);
        }
    }

    @Nested
    class DocumentShape {

        @Test
        void shouldWriteFlattenedNodeAndEdgeDocument() throws Exception {
            // When
            JsonNode root =
                    MachineModelSerializer.createMapper()
                            .readTree(MachineModelSerializer.toJson(reviewModel()));

            // Then
            JsonNode draft = root.get("nodes").get(2);
            assertThat(draft.get("kind").asText()).isEqualTo("TASK");
            assertThat(draft.get("parent").asText()).isEqualTo("review");
            assertThat(draft.get("attributes").get(0).get("type").asText()).isEqualTo("int");
            assertThat(root.get("nodes").get(0).has("parent")).isFalse();

            JsonNode decisionEdge = root.get("edges").get(1);
            assertThat(decisionEdge.get("segments").get(0).get("endType").asText()).isEqualTo("CAUSAL");
            assertThat(decisionEdge.get("priority").asInt()).isEqualTo(2);
            assertThat(decisionEdge.has("reads")).isFalse();

            JsonNode accessEdge = root.get("edges").get(2);
            assertThat(accessEdge.get("reads").asText()).isEqualTo("*");
            assertThat(accessEdge.get("writes")).hasSize(2);
            assertThat(accessEdge.get("automatic").asBoolean()).isFalse();
        }
    }

    @Nested
    class LenientReading {

        @Test
        void shouldAcceptAliasesAndDefaults() {
            // Given
            String json =
                    """
                    {
                      "title": "aliases",
                      "nodes": [
                        {"name": "begin", "kind": "initial"},
                        {"name": "end"},
                        {"name": "store", "kind": "data", "capabilities": ["meta"]}
                      ],
                      "edges": [
                        {"source": "begin", "segments": [{"target": "end", "endType": "=>"}]},
                        {"source": "begin", "segments": [{"target": "store"}], "reads": []}
                      ]
                    }
                    """;

            // When
            MachineModel model = MachineModelSerializer.fromJson(json);

            // Then
            assertThat(model.requireNode("begin").kind()).isEqualTo(NodeKind.INIT);
            assertThat(model.requireNode("end").kind()).isEqualTo(NodeKind.OTHER);
            assertThat(model.requireNode("store").kind()).isEqualTo(NodeKind.CONTEXT);
            assertThat(model.requireNode("store").capabilities()).containsExactly(NodeCapability.META);
            assertThat(model.edges().get(0).segments())
                    .containsExactly(new EdgeSegment("end", EdgeEndType.CAUSAL));
            assertThat(model.edges().get(1).reads().isUnrestricted()).isTrue();
            assertThat(model.edges().get(1).writes()).isNull();
        }

        @Test
        void shouldDefaultTitle() {
            MachineModel model = MachineModelSerializer.fromJson("{\"nodes\": [{\"name\": \"a\"}]}");

            assertThat(model.title()).isEqualTo("untitled");
        }
    }

    @Nested
    class Errors {

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> MachineModelSerializer.fromJson("{\"title\": "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize machine model");
        }

        @Test
        void shouldRejectNonObjectDocument() {
            assertThatThrownBy(() -> MachineModelSerializer.fromJson("[]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be a JSON object");
        }

        @Test
        void shouldReportMissingNodeName() {
            assertThatThrownBy(
                            () -> MachineModelSerializer.fromJson("{\"nodes\": [{\"kind\": \"state\"}]}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Missing 'name' in node #0");
        }

        @Test
        void shouldReportEdgeWithoutSegments() {
            String json =
                    """
                    {"nodes": [{"name": "a"}], "edges": [{"source": "a", "segments": []}]}
                    """;

            assertThatThrownBy(() -> MachineModelSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid edge #0");
        }

        @Test
        void shouldReportUnknownCapability() {
            String json = "{\"nodes\": [{\"name\": \"a\", \"capabilities\": [\"fly\"]}]}";

            assertThatThrownBy(() -> MachineModelSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown capability 'fly'");
        }

        @Test
        void shouldPropagateStructuralErrors() {
            String json =
                    """
                    {"nodes": [{"name": "a"}],
                     "edges": [{"source": "a", "segments": [{"target": "ghost"}]}]}
                    """;

            assertThatThrownBy(() -> MachineModelSerializer.fromJson(json))
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("ghost");
        }
    }
}
