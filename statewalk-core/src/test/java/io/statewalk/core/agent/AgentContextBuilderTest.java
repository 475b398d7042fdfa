package io.statewalk.core.agent;

import static io.statewalk.core.TestModels.context;
import static io.statewalk.core.TestModels.meta;
import static io.statewalk.core.TestModels.prompted;
import static io.statewalk.core.TestModels.state;
import static org.assertj.core.api.Assertions.assertThat;

import io.statewalk.core.condition.ConditionEvaluator;
import io.statewalk.core.context.ContextAccessResolver;
import io.statewalk.core.context.SharedAttributeStore;
import io.statewalk.core.execution.result.ExecutionHistory;
import io.statewalk.core.execution.result.HistoryEntry;
import io.statewalk.core.execution.result.TransitionSource;
import io.statewalk.core.model.AccessMarker;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.tool.CatalogueEntry;
import io.statewalk.core.tool.SessionToolRegistry;
import io.statewalk.core.tool.ToolCatalogue;
import io.statewalk.core.tool.ToolDefinition;
import io.statewalk.core.tool.ToolKind;
import io.statewalk.core.tool.ToolStrategy;
import io.statewalk.core.transition.TransitionEvaluator;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AgentContextBuilderTest {

    private MachineModel model;
    private SharedAttributeStore store;
    private SessionToolRegistry tools;
    private AgentContextBuilder builder;

    @BeforeEach
    void setUp() {
        model =
                MachineModel.builder("review flow")
                        .node(prompted("review", "Decide whether the draft is ready", "draft", "v1"))
                        .node(state("publish"))
                        .node(state("rework"))
                        .node(state("archive"))
                        .node(context("metrics", "score", 7, "secret", "hidden"))
                        .node(context("output"))
                        .edge(MachineEdge.from("review").to("publish").label("Ship it").condition("metrics.score > 5").build())
                        .edge(MachineEdge.from("review").to("rework").build())
                        .edge(MachineEdge.from("review").to("publish").to("archive").build())
                        .edge(MachineEdge.from("review").to("metrics").reads(AccessMarker.of("score")).build())
                        .edge(MachineEdge.from("review").to("output").writes(AccessMarker.ALL).build())
                        .build();
        store = SharedAttributeStore.seededFrom(model);
        tools = new SessionToolRegistry();
        TransitionEvaluator transitions = new TransitionEvaluator(model, new ConditionEvaluator());
        builder =
                new AgentContextBuilder(
                        model,
                        new ContextAccessResolver(model),
                        transitions,
                        tools,
                        AgentContextBuilder.DEFAULT_HISTORY_TAIL);
    }

    private List<MachineEdge> candidates() {
        return new TransitionEvaluator(model, new ConditionEvaluator()).candidates("review");
    }

    @Nested
    class Catalogue {

        @Test
        void shouldNameTransitionToolsAfterFirstTargetWithSuffixForDuplicates() {
            ToolCatalogue catalogue = builder.buildCatalogue("review", candidates());

            assertThat(catalogue.entriesOf(ToolKind.TRANSITION))
                    .extracting(CatalogueEntry::name)
                    .containsExactly(
                            "transition_to_publish", "transition_to_rework", "transition_to_publish_2");
        }

        @Test
        void shouldDescribeTransitionsWithLabelConditionAndForks() {
            ToolCatalogue catalogue = builder.buildCatalogue("review", candidates());

            assertThat(catalogue.find("transition_to_publish"))
                    .get()
                    .extracting(entry -> entry.definition().description())
                    .isEqualTo("Ship it when metrics.score > 5");
            assertThat(catalogue.find("transition_to_publish_2"))
                    .get()
                    .extracting(entry -> entry.definition().description())
                    .isEqualTo("Transition to publish (forks to publish, archive)");
        }

        @Test
        void shouldOfferContextToolsByPermission() {
            ToolCatalogue catalogue = builder.buildCatalogue("review", candidates());

            assertThat(catalogue.find("read_metrics")).isPresent();
            assertThat(catalogue.find("write_metrics")).isEmpty();
            assertThat(catalogue.find("write_output"))
                    .get()
                    .extracting(entry -> entry.definition().requiredParameterNames())
                    .isEqualTo(List.of("data"));
            assertThat(catalogue.find("read_output")).isEmpty();
        }

        @Test
        void shouldOfferMetaToolsOnlyToMetaEnabledNodes() {
            assertThat(builder.buildCatalogue("review", candidates()).entriesOf(ToolKind.META))
                    .isEmpty();

            MachineModel metaModel =
                    MachineModel.builder("meta")
                            .node(meta("planner", "Plan the work"))
                            .node(state("done"))
                            .edge(MachineEdge.from("planner").to("done").build())
                            .build();
            AgentContextBuilder metaBuilder =
                    new AgentContextBuilder(
                            metaModel,
                            new ContextAccessResolver(metaModel),
                            new TransitionEvaluator(metaModel, new ConditionEvaluator()),
                            tools,
                            3);

            ToolCatalogue catalogue =
                    metaBuilder.buildCatalogue("planner", metaModel.outgoing("planner"));

            assertThat(catalogue.entries())
                    .extracting(CatalogueEntry::name)
                    .containsExactly(
                            "transition_to_done",
                            ToolCatalogue.CONSTRUCT_TOOL,
                            ToolCatalogue.GET_DEFINITION,
                            ToolCatalogue.UPDATE_DEFINITION);
        }

        @Test
        void shouldAppendConstructedToolsLast() {
            tools.register(
                    new ToolDefinition("summarize", "Summarize text", List.of()),
                    ToolStrategy.AGENT_BACKED,
                    "Write three sentences",
                    "planner");

            ToolCatalogue catalogue = builder.buildCatalogue("review", candidates());

            assertThat(catalogue.entries().get(catalogue.size() - 1).name()).isEqualTo("summarize");
            assertThat(catalogue.find("summarize"))
                    .get()
                    .extracting(CatalogueEntry::kind)
                    .isEqualTo(ToolKind.CONSTRUCTED);
        }
    }

    @Nested
    class Context {

        @Test
        void shouldExposeOnlyReadableFields() {
            AgentInvocation invocation =
                    builder.build(
                            "review",
                            candidates(),
                            "Node 'review' carries a prompt",
                            store,
                            new ExecutionHistory(),
                            List.of());

            AgentContext context = invocation.context();
            assertThat(context.contexts().get("metrics").values()).containsOnlyKeys("score");
            assertThat(context.contexts().get("output").values()).isEmpty();
            assertThat(context.contexts().get("output").canWrite()).isTrue();
            assertThat(context.attributes()).containsEntry("draft", "v1");
            assertThat(context.prompt()).isEqualTo("Decide whether the draft is ready");
        }

        @Test
        void shouldIncludeOnlyTheHistoryTail() {
            ExecutionHistory history = new ExecutionHistory();
            for (int i = 1; i <= 8; i++) {
                history.add(
                        new HistoryEntry(
                                i,
                                "path-1",
                                "n" + i,
                                "n" + (i + 1),
                                null,
                                Instant.EPOCH,
                                null,
                                TransitionSource.AUTOMATED,
                                0));
            }

            AgentContext context =
                    builder.build("review", candidates(), "why", store, history, List.of()).context();

            assertThat(context.recentHistory()).hasSize(5);
            assertThat(context.recentHistory().get(0).from()).isEqualTo("n4");
        }

        @Test
        void shouldRenderPromptWithTransitionsAndPreviousCalls() {
            ToolCallRecord call =
                    ToolCallRecord.success("read_metrics", Map.of(), Map.of("score", 7));

            String rendered =
                    builder.build(
                                    "review",
                                    candidates(),
                                    "Node 'review' carries a prompt",
                                    store,
                                    new ExecutionHistory(),
                                    List.of(call))
                            .context()
                            .render();

            assertThat(rendered)
                    .contains("- **Node**: review")
                    .contains("- **Objective**: Decide whether the draft is ready")
                    .contains("## metrics")
                    .contains("- **Permissions**: read [score]")
                    .contains("## transition_to_publish_2")
                    .contains("- **Target**: publish, archive")
                    .contains("- read_metrics: {score=7}")
                    .contains("Node 'review' carries a prompt.")
                    .doesNotContain("hidden");
        }

        @Test
        void shouldCarryCatalogueIntoRequest() {
            AgentInvocation invocation =
                    builder.build("review", candidates(), "why", store, new ExecutionHistory(), List.of());

            AgentRequest request = invocation.toRequest("path-1:review:0:0", "path-1");

            assertThat(request.tools())
                    .extracting(ToolDefinition::name)
                    .containsExactlyElementsOf(
                            invocation.catalogue().definitions().stream()
                                    .map(ToolDefinition::name)
                                    .toList());
            assertThat(request.nodeName()).isEqualTo("review");
        }
    }
}
