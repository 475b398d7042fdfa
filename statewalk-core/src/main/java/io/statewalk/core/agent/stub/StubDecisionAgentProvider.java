package io.statewalk.core.agent.stub;

import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.agent.spi.DecisionAgentProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Agent provider that returns stub agents for testing without external API calls.
///
/// When enabled, intercepts ALL model requests with the highest priority (1000).
///
/// ### Enabling Stub Mode
/// Enable via any of these methods (checked in order):
/// - Credentials map: `credentials.put("STATEWALK_STUB_ENABLED", "true")`
/// - System property: `-Dstatewalk.stub.enabled=true`
/// - Environment variable: `STATEWALK_STUB_ENABLED=true`
///
/// The model name `stub` is always supported, whether or not stub mode is enabled.
///
/// @see StubDecisionAgent for the choice logic
public class StubDecisionAgentProvider implements DecisionAgentProvider {

    private static final Logger logger =
            Logger.getLogger(StubDecisionAgentProvider.class.getName());

    static final String ENABLED_KEY = "STATEWALK_STUB_ENABLED";
    static final String ENABLED_PROPERTY = "statewalk.stub.enabled";
    static final String STUB_MODEL = "stub";

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return STUB_MODEL.equalsIgnoreCase(modelName) || isEnabledGlobally();
    }

    /// Creates a stub agent for the given configuration.
    ///
    /// @throws IllegalStateException if stub mode is disabled and the model is not `stub`
    @Override
    public DecisionAgent createAgent(
            String agentId, AgentConfig config, Map<String, String> credentials) {
        if (!STUB_MODEL.equalsIgnoreCase(config.getModel()) && !isEnabled(credentials)) {
            throw new IllegalStateException(
                    "Stub provider called for model " + config.getModel() + " but not enabled");
        }

        logger.info("[STUB] Creating stub agent: " + agentId + " (model: " + config.getModel() + ")");
        return new StubDecisionAgent(agentId);
    }

    /// Returns the provider priority.
    ///
    /// @return 1000 when enabled, -1 otherwise
    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }

    private boolean isEnabled(Map<String, String> credentials) {
        if (credentials != null) {
            String value = credentials.get(ENABLED_KEY);
            if (value == null) {
                value = credentials.get(ENABLED_PROPERTY);
            }
            if (value != null) {
                return "true".equalsIgnoreCase(value);
            }
        }
        return isEnabledGlobally();
    }
}
