package io.statewalk.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.agent.DecisionAgentFactory;
import io.statewalk.core.agent.spi.DecisionAgentProvider;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LangChain4jProviderTest {

    private final LangChain4jProvider provider = new LangChain4jProvider(name -> null);

    private static AgentConfig config(String model) {
        return AgentConfig.builder().id("agent").model(model).timeout(5_000L).build();
    }

    @Nested
    class ModelSupport {

        @ParameterizedTest
        @ValueSource(strings = {"claude-sonnet-4", "gpt-4o", "o3-mini", "gemini-2.0-flash", "deepseek-chat"})
        void shouldSupportKnownModelFamilies(String model) {
            assertThat(provider.supportsModel(model)).isTrue();
        }

        @Test
        void shouldNotSupportOtherModels() {
            assertThat(provider.supportsModel("llama-3")).isFalse();
            assertThat(provider.supportsModel(null)).isFalse();
        }

        @Test
        void shouldRejectUnsupportedModelOnCreate() {
            assertThatThrownBy(() -> provider.createModel(config("llama-3"), Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported model");
        }
    }

    @Nested
    class ModelCreation {

        @Test
        void shouldCreateAnthropicModelFromCredentials() {
            assertThat(
                            provider.createModel(
                                    config("claude-sonnet-4"), Map.of("ANTHROPIC_API_KEY", "test-key")))
                    .isInstanceOf(AnthropicChatModel.class);
        }

        @Test
        void shouldCreateOpenAiCompatibleModelForDeepSeek() {
            assertThat(
                            provider.createModel(
                                    config("deepseek-chat"), Map.of("DEEPSEEK_API_KEY", "test-key")))
                    .isInstanceOf(OpenAiChatModel.class);
        }

        @Test
        void shouldWrapModelInDecisionAgent() {
            DecisionAgent agent =
                    provider.createAgent(
                            "reviewer", config("gpt-4o"), Map.of("openai_api_key", "test-key"));

            assertThat(agent).isInstanceOf(LangChain4jDecisionAgent.class);
            assertThat(agent.getId()).isEqualTo("reviewer");
        }

        @Test
        void shouldFailWithoutApiKey() {
            assertThatThrownBy(() -> provider.createModel(config("claude-sonnet-4"), Map.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("ANTHROPIC_API_KEY");
        }
    }

    @Nested
    class Credentials {

        @Test
        void shouldPreferCredentialsOverEnvironment() {
            LangChain4jProvider withEnvironment = new LangChain4jProvider(name -> "from-env");

            assertThat(
                            withEnvironment.requireApiKey(
                                    Map.of("GOOGLE_API_KEY", "from-map"), "google_api_key", "GOOGLE_API_KEY"))
                    .isEqualTo("from-map");
        }

        @Test
        void shouldFallBackToEnvironment() {
            LangChain4jProvider withEnvironment =
                    new LangChain4jProvider(name -> "OPENAI_API_KEY".equals(name) ? "from-env" : null);

            assertThat(withEnvironment.requireApiKey(Map.of(), "openai_api_key", "OPENAI_API_KEY"))
                    .isEqualTo("from-env");
        }

        @Test
        void shouldIgnoreBlankValues() {
            assertThatThrownBy(
                            () -> provider.requireApiKey(Map.of("OPENAI_API_KEY", " "), "OPENAI_API_KEY"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void shouldBeDiscoveredThroughServiceLoader() {
        DecisionAgentFactory factory = new DecisionAgentFactory(Map.of());

        assertThat(factory.getProviders())
                .extracting(DecisionAgentProvider::getName)
                .contains("langchain4j", "stub");
        assertThat(factory.isModelSupported("claude-sonnet-4")).isTrue();
    }
}
