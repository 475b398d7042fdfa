package io.statewalk.core.model;

import static io.statewalk.core.TestModels.child;
import static io.statewalk.core.TestModels.context;
import static io.statewalk.core.TestModels.state;
import static io.statewalk.core.TestModels.withAttributes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.statewalk.core.exception.MachineStructureException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MachineModelTest {

    private static MachineModel nestedModel() {
        return MachineModel.builder("nested")
                .node(state("module"))
                .node(child("inner", NodeKind.STATE, "module"))
                .node(child("leaf", NodeKind.TASK, "inner"))
                .node(state("done"))
                .node(context("settings", "retries", 3))
                .edge(MachineEdge.from("module").to("done").label("finish").build())
                .edge(MachineEdge.from("leaf").to("settings").build())
                .build();
    }

    @Nested
    class Building {

        @Test
        void shouldAssignEdgeIndexesInDeclarationOrder() {
            MachineModel model = nestedModel();

            assertThat(model.edges()).extracting(MachineEdge::index).containsExactly(0, 1);
        }

        @Test
        void shouldRejectDuplicateNodeNames() {
            assertThatThrownBy(() -> MachineModel.builder("dup").node(state("a")).node(state("a")))
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("Duplicate node name");
        }

        @Test
        void shouldRejectUndeclaredEdgeTarget() {
            MachineModel.Builder builder =
                    MachineModel.builder("broken")
                            .node(state("a"))
                            .edge(MachineEdge.from("a").to("ghost").build());

            assertThatThrownBy(builder::build)
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("undeclared target 'ghost'");
        }

        @Test
        void shouldRejectUndeclaredParent() {
            MachineModel.Builder builder =
                    MachineModel.builder("broken").node(child("a", NodeKind.STATE, "missing"));

            assertThatThrownBy(builder::build)
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("undeclared parent");
        }

        @Test
        void shouldRejectParentCycle() {
            MachineModel.Builder builder =
                    MachineModel.builder("loop")
                            .node(child("a", NodeKind.STATE, "b"))
                            .node(child("b", NodeKind.STATE, "a"));

            assertThatThrownBy(builder::build)
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("Parent cycle");
        }

        @Test
        void shouldRejectContextsSharingToolName() {
            // Given
            MachineModel.Builder builder =
                    MachineModel.builder("clash")
                            .node(state("review"))
                            .node(context("my ctx"))
                            .node(context("my_ctx"))
                            .edge(MachineEdge.from("review").to("my ctx").build())
                            .edge(MachineEdge.from("review").to("my_ctx").build());

            // When / Then
            assertThatThrownBy(builder::build)
                    .isInstanceOf(MachineStructureException.class)
                    .hasMessageContaining("Contexts 'my ctx' and 'my_ctx'")
                    .hasMessageContaining("read_my_ctx");
        }

        @Test
        void shouldAcceptStateNamesThatNormalizeLikeContexts() {
            MachineModel model =
                    MachineModel.builder("mixed")
                            .node(state("my ctx"))
                            .node(context("my_ctx"))
                            .build();

            assertThat(model.nodes()).hasSize(2);
        }

        @Test
        void shouldRejectEdgeWithoutTargets() {
            assertThatThrownBy(() -> MachineEdge.from("a").build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Navigation {

        @Test
        void shouldIndexOutgoingAndIncomingEdges() {
            MachineModel model = nestedModel();

            assertThat(model.outgoing("module")).extracting(MachineEdge::label).containsExactly("finish");
            assertThat(model.incoming("settings")).extracting(MachineEdge::source).containsExactly("leaf");
            assertThat(model.outgoing("done")).isEmpty();
        }

        @Test
        void shouldListAncestorsNearestFirst() {
            MachineModel model = nestedModel();

            assertThat(model.ancestors("leaf")).containsExactly("inner", "module");
            assertThat(model.depth("leaf")).isEqualTo(2);
            assertThat(model.depth("done")).isZero();
            assertThat(model.children("module")).containsExactly("inner");
        }

        @Test
        void shouldRecognizeContextNodes() {
            MachineModel model = nestedModel();

            assertThat(model.isContext("settings")).isTrue();
            assertThat(model.isContext("done")).isFalse();
            assertThat(model.isContext("unknown")).isFalse();
        }

        @Test
        void shouldThrowForUnknownRequiredNode() {
            assertThatThrownBy(() -> nestedModel().requireNode("ghost"))
                    .isInstanceOf(MachineStructureException.class);
        }
    }

    @Nested
    class Updates {

        @Test
        void shouldUpdateNodeAttributesAndBumpRevision() {
            MachineModel model =
                    MachineModel.builder("m").node(withAttributes("a", NodeKind.STATE, "count", 1)).build();

            model.updateNode(model.requireNode("a").withAttributeValue("count", 2));

            assertThat(model.requireNode("a").attribute("count"))
                    .map(NodeAttribute::value)
                    .contains(2);
            assertThat(model.revision()).isEqualTo(1);
        }

        @Test
        void shouldRejectStructuralNodeChange() {
            MachineModel model = MachineModel.builder("m").node(state("a")).build();

            assertThatThrownBy(() -> model.updateNode(MachineNode.of("a", NodeKind.TASK)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Structural change");
            assertThat(model.revision()).isZero();
        }

        @Test
        void shouldUpdateEdgeDecorationOnly() {
            MachineModel model = nestedModel();
            MachineEdge edge = model.edges().get(0);

            model.updateEdge(edge.withDecoration("leave", "ready", 5));

            assertThat(model.edges().get(0).label()).isEqualTo("leave");
            assertThat(model.edges().get(0).condition()).isEqualTo("ready");
            assertThat(model.outgoing("module").get(0).priority()).isEqualTo(5);
        }

        @Test
        void shouldRejectEdgeRetarget() {
            MachineModel model = nestedModel();
            MachineEdge retargeted =
                    MachineEdge.from("module").to("leaf").label("finish").build().withIndex(0);

            assertThatThrownBy(() -> model.updateEdge(retargeted))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldKeepCopiesIndependent() {
            MachineModel model = nestedModel();
            MachineModel copy = model.copy();

            copy.updateNode(copy.requireNode("settings").withAttributeValue("retries", 9));

            assertThat(model.requireNode("settings").attribute("retries"))
                    .map(NodeAttribute::value)
                    .contains(3);
            assertThat(model.revision()).isZero();
            assertThat(copy.revision()).isEqualTo(1);
        }
    }

    @Test
    void shouldResolveKindAliases() {
        assertThat(NodeKind.fromName("Initial")).isEqualTo(NodeKind.INIT);
        assertThat(NodeKind.fromName("output")).isEqualTo(NodeKind.CONTEXT);
        assertThat(NodeKind.fromName("widget")).isEqualTo(NodeKind.OTHER);
        assertThat(NodeKind.fromName(null)).isEqualTo(NodeKind.OTHER);
    }

    @Test
    void shouldResolveEndTypesFromArrows() {
        assertThat(EdgeEndType.fromName("=>")).isEqualTo(EdgeEndType.CAUSAL);
        assertThat(EdgeEndType.fromName("composition")).isEqualTo(EdgeEndType.COMPOSITION);
        assertThat(EdgeEndType.fromName("~~>")).isEqualTo(EdgeEndType.PLAIN);
    }
}
