package io.statewalk.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionToolRegistryTest {

    private SessionToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionToolRegistry();
    }

    private static ToolDefinition definition(String name) {
        return new ToolDefinition(
                name,
                "Tool " + name,
                List.of(
                        ToolDefinition.ToolParameter.required(
                                "input", ToolDefinition.ParameterType.STRING, "Input text")));
    }

    @Nested
    class Registration {

        @Test
        void shouldRegisterToolWithSequence() {
            ConstructedTool first =
                    registry.register(definition("summarize"), ToolStrategy.AGENT_BACKED, "Summarize", "planner");
            ConstructedTool second =
                    registry.register(definition("chain"), ToolStrategy.COMPOSITION, "a then b", "planner");

            assertThat(first.sequence()).isEqualTo(1);
            assertThat(second.sequence()).isEqualTo(2);
            assertThat(registry.size()).isEqualTo(2);
        }

        @Test
        void shouldRejectDuplicateName() {
            registry.register(definition("summarize"), ToolStrategy.AGENT_BACKED, "Summarize", "planner");

            assertThatThrownBy(
                            () ->
                                    registry.register(
                                            definition("summarize"),
                                            ToolStrategy.COMPOSITION,
                                            "other",
                                            "worker"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("already exists");
            assertThat(registry.get("summarize")).get().extracting(ConstructedTool::details).isEqualTo("Summarize");
        }
    }

    @Nested
    class Retrieval {

        @Test
        void shouldReturnToolsInConstructionOrder() {
            registry.register(definition("b"), ToolStrategy.AGENT_BACKED, "b", "n");
            registry.register(definition("a"), ToolStrategy.AGENT_BACKED, "a", "n");

            assertThat(registry.all()).extracting(ConstructedTool::name).containsExactly("b", "a");
        }

        @Test
        void shouldReturnEmptyForUnknownTool() {
            assertThat(registry.get("nothing")).isEmpty();
            assertThat(registry.contains("nothing")).isFalse();
        }
    }

    @Test
    void shouldResolveStrategyWireNames() {
        assertThat(ToolStrategy.fromWireName(" Agent_Backed ")).isEqualTo(ToolStrategy.AGENT_BACKED);
        assertThat(ToolStrategy.COMPOSITION.wireName()).isEqualTo("composition");
        assertThatThrownBy(() -> ToolStrategy.fromWireName("script"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported tool strategy");
    }

    @Test
    void shouldNormalizeToolFragments() {
        assertThat(ToolCatalogue.toolFragment("review step.v2")).isEqualTo("review_step_v2");
        assertThat(ToolCatalogue.toolFragment("ok-name_1")).isEqualTo("ok-name_1");
    }

    @Test
    void shouldRejectDuplicateCatalogueEntries() {
        CatalogueEntry entry =
                new CatalogueEntry(definition("x"), ToolKind.CONSTRUCTED, "x", null);

        assertThatThrownBy(() -> new ToolCatalogue(List.of(entry, entry)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate tool name");
    }
}
