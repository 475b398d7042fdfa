package io.statewalk.core.agent;

import io.statewalk.core.agent.spi.DecisionAgentProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Factory for creating decision agents using discovered SPI providers.
///
/// Uses {@link ServiceLoader} to discover {@link DecisionAgentProvider} implementations.
/// When creating an agent, selects the highest-priority provider that supports the
/// requested model.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// immutable once the factory is created.
///
/// @see DecisionAgentProvider for implementing custom agent backends
public class DecisionAgentFactory {

    private static final Logger logger = Logger.getLogger(DecisionAgentFactory.class.getName());

    private final List<DecisionAgentProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory that discovers providers with {@link ServiceLoader}.
    ///
    /// @param credentials credential keys to values (e.g., `ANTHROPIC_API_KEY`), not null
    public DecisionAgentFactory(Map<String, String> credentials) {
        this(credentials, loadProviders());
    }

    /// Creates a factory with an explicit provider list.
    ///
    /// @param credentials credential keys to values, not null
    /// @param providers providers to choose from, not null
    public DecisionAgentFactory(
            Map<String, String> credentials, List<DecisionAgentProvider> providers) {
        this.credentials = new HashMap<>(credentials);
        this.providers = List.copyOf(providers);

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " agent providers: "
                        + this.providers.stream().map(DecisionAgentProvider::getName).toList());
    }

    /// Creates an agent using the highest-priority provider for the configured model.
    ///
    /// @param config agent configuration, not null
    /// @return the created agent, never null
    /// @throws IllegalStateException if no provider supports the configured model
    public DecisionAgent createAgent(AgentConfig config) {
        String modelName = config.getModel();

        DecisionAgentProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(DecisionAgentProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(DecisionAgentProvider::getName)
                                                                .toList()));

        logger.info(
                "Creating agent '" + config.getId() + "' with provider: " + provider.getName());
        return provider.createAgent(config.getId(), config, credentials);
    }

    public List<DecisionAgentProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    /// Checks if any loaded provider supports the given model.
    ///
    /// @param modelName model identifier, not null
    /// @return `true` if at least one provider supports this model
    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }

    private static List<DecisionAgentProvider> loadProviders() {
        List<DecisionAgentProvider> discovered = new ArrayList<>();
        for (DecisionAgentProvider provider : ServiceLoader.load(DecisionAgentProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered provider: " + provider.getName());
        }
        return discovered;
    }
}
