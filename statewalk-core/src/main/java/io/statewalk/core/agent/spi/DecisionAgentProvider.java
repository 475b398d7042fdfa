package io.statewalk.core.agent.spi;

import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.DecisionAgent;
import java.util.Map;

/// Provider interface for pluggable decision agent backends.
///
/// Implementations are discovered by {@link io.statewalk.core.agent.DecisionAgentFactory}
/// through {@link java.util.ServiceLoader}, from
/// `META-INF/services/io.statewalk.core.agent.spi.DecisionAgentProvider`.
///
/// ### Priority System
/// When multiple providers support the same model, the one with the highest
/// {@link #getPriority()} value is selected. Testing stubs use a high priority to
/// intercept every model when enabled.
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.statewalk.core.agent.stub.StubDecisionAgentProvider for a testing implementation
public interface DecisionAgentProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name (e.g., "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can handle the specified model.
    ///
    /// @param modelName model identifier, not null
    /// @return `true` if this provider can create agents for this model
    boolean supportsModel(String modelName);

    /// Creates an agent for the specified configuration.
    ///
    /// @param agentId identifier for the agent, not null
    /// @param config agent configuration, not null
    /// @param credentials API keys and other credentials, not null
    /// @return configured agent, never null
    /// @throws IllegalStateException if required credentials are missing
    DecisionAgent createAgent(String agentId, AgentConfig config, Map<String, String> credentials);

    /// Returns this provider's priority for model selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
