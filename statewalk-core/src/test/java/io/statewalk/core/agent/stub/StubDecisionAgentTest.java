package io.statewalk.core.agent.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.AgentContext;
import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.model.NodeKind;
import io.statewalk.core.tool.ToolDefinition;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StubDecisionAgentTest {

    private static AgentRequest request(String node, String... tools) {
        AgentContext context =
                new AgentContext(
                        node, NodeKind.STATE, null, null, null, null, null, null, null, false,
                        "Node '" + node + "' carries a prompt", null);
        List<ToolDefinition> definitions =
                Arrays.stream(tools)
                        .map(name -> new ToolDefinition(name, "tool " + name, List.of()))
                        .toList();
        return new AgentRequest("path-1:" + node + ":0:0", "path-1", node, context, definitions);
    }

    @Nested
    class Choice {

        @Test
        void shouldChooseFirstTransitionTool() {
            StubDecisionAgent agent = new StubDecisionAgent("stub");

            AgentResponse response =
                    agent.decide(request("review", "read_metrics", "transition_to_a", "transition_to_b"));

            assertThat(response.toolName()).isEqualTo("transition_to_a");
            assertThat(response.requestId()).isEqualTo("path-1:review:0:0");
            assertThat(response.reasoning()).isEqualTo("stub choice");
        }

        @Test
        void shouldHonourPreferenceByTargetName() {
            StubDecisionAgent agent = new StubDecisionAgent("stub").prefer("review", "b");

            AgentResponse response =
                    agent.decide(request("review", "transition_to_a", "transition_to_b"));

            assertThat(response.toolName()).isEqualTo("transition_to_b");
        }

        @Test
        void shouldHonourPreferenceByToolName() {
            StubDecisionAgent agent = new StubDecisionAgent("stub").prefer("review", "read_metrics");

            AgentResponse response =
                    agent.decide(request("review", "transition_to_a", "read_metrics"));

            assertThat(response.toolName()).isEqualTo("read_metrics");
        }

        @Test
        void shouldFallBackWhenPreferenceIsNotOffered() {
            StubDecisionAgent agent = new StubDecisionAgent("stub").prefer("review", "gone");

            AgentResponse response = agent.decide(request("review", "write_output"));

            assertThat(response.toolName()).isEqualTo("write_output");
        }

        @Test
        void shouldFailWithoutTools() {
            StubDecisionAgent agent = new StubDecisionAgent("stub");

            assertThatThrownBy(() -> agent.decide(request("review")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("offers no tools");
        }
    }

    @Nested
    class Provider {

        private final StubDecisionAgentProvider provider = new StubDecisionAgentProvider();

        @Test
        void shouldAlwaysSupportStubModel() {
            assertThat(provider.getName()).isEqualTo("stub");
            assertThat(provider.supportsModel("stub")).isTrue();
            assertThat(provider.supportsModel("STUB")).isTrue();
        }

        @Test
        void shouldCreateAgentForStubModel() {
            AgentConfig config = AgentConfig.builder().id("reviewer").model("stub").build();

            DecisionAgent agent = provider.createAgent("reviewer", config, Map.of());

            assertThat(agent).isInstanceOf(StubDecisionAgent.class);
            assertThat(agent.getId()).isEqualTo("reviewer");
        }

        @Test
        void shouldCreateAgentForAnyModelWhenEnabledThroughCredentials() {
            AgentConfig config = AgentConfig.builder().id("reviewer").model("gpt-4o").build();

            DecisionAgent agent =
                    provider.createAgent(
                            "reviewer",
                            config,
                            Map.of(StubDecisionAgentProvider.ENABLED_KEY, "true"));

            assertThat(agent).isInstanceOf(StubDecisionAgent.class);
        }

        @Test
        void shouldRefuseOtherModelsWhenDisabled() {
            AgentConfig config = AgentConfig.builder().id("reviewer").model("gpt-4o").build();

            assertThatThrownBy(
                            () ->
                                    provider.createAgent(
                                            "reviewer",
                                            config,
                                            Map.of(StubDecisionAgentProvider.ENABLED_KEY, "false")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("not enabled");
        }
    }
}
