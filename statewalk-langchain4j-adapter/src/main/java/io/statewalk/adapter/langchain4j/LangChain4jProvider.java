package io.statewalk.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.agent.spi.DecisionAgentProvider;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link DecisionAgentProvider}.
///
/// Creates {@link ChatModel} instances for supported AI providers and wraps them in
/// {@link LangChain4jDecisionAgent}. Supports Anthropic (Claude), OpenAI (GPT/o-series),
/// Google (Gemini/Gemma) and DeepSeek models. DeepSeek uses the OpenAI-compatible API with
/// a custom base URL.
///
/// API keys are looked up in the credentials map first, then in the environment
/// (`ANTHROPIC_API_KEY`, `OPENAI_API_KEY`, `GOOGLE_API_KEY`, `DEEPSEEK_API_KEY`).
///
/// @implNote Stateless and thread-safe. Each call to {@link #createAgent} creates a new
/// model instance.
///
/// @see LangChain4jDecisionAgent for the agent implementation
public class LangChain4jProvider implements DecisionAgentProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final long DEFAULT_TIMEOUT_MS = 60_000;
    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private final Function<String, String> environment;

    public LangChain4jProvider() {
        this(System::getenv);
    }

    LangChain4jProvider(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    @Override
    public DecisionAgent createAgent(
            String agentId, AgentConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j agent: " + agentId + " with model: " + config.getModel());
        ChatModel model = createModel(config, credentials);
        return new LangChain4jDecisionAgent(agentId, config, model);
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the appropriate {@link ChatModel} based on model name prefix.
    ///
    /// @param config agent configuration containing the model name, not null
    /// @param credentials API keys keyed by variable name, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if model name is not supported
    /// @throws IllegalStateException if required API key is missing
    ChatModel createModel(AgentConfig config, Map<String, String> credentials) {
        String modelName = config.getModel();

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(config, credentials);
        } else if (modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")) {
            return createOpenAiModel(config, credentials, null);
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return createGoogleAiModel(config, credentials);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(config, credentials, DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createAnthropicModel(AgentConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY");

        var builder =
                AnthropicChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(config.getTemperature())
                        .maxTokens(maxTokens(config))
                        .timeout(timeout(config));

        if (config.getTopP() != null) builder.topP(config.getTopP());

        return builder.build();
    }

    /// Creates an OpenAI-compatible model, used for both OpenAI and DeepSeek (via base URL
    /// override).
    ///
    /// @param config agent configuration, not null
    /// @param credentials API keys, not null
    /// @param baseUrl custom API endpoint, may be null (uses OpenAI default)
    /// @return configured model, never null
    private ChatModel createOpenAiModel(
            AgentConfig config, Map<String, String> credentials, String baseUrl) {
        String apiKey =
                baseUrl != null
                        ? requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY")
                        : requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");

        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(config.getTemperature())
                        .maxTokens(maxTokens(config))
                        .timeout(timeout(config));

        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (config.getTopP() != null) builder.topP(config.getTopP());

        return builder.build();
    }

    private ChatModel createGoogleAiModel(AgentConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY");

        var builder =
                GoogleAiGeminiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(config.getTemperature())
                        .maxOutputTokens(maxTokens(config))
                        .timeout(timeout(config));

        if (config.getTopP() != null) builder.topP(config.getTopP());

        return builder.build();
    }

    /// Looks up an API key, trying each key name in the credentials and then in the
    /// environment.
    ///
    /// @param credentials credential map to search first, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        for (String keyName : keyNames) {
            String value = environment.apply(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private int maxTokens(AgentConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }

    private Duration timeout(AgentConfig config) {
        return Duration.ofMillis(config.getTimeout() != null ? config.getTimeout() : DEFAULT_TIMEOUT_MS);
    }
}
