package io.statewalk.core.agent;

import java.util.Objects;

/// Immutable configuration for a decision agent.
///
/// Names the model that backs the agent and the sampling parameters passed to it.
/// Created via the {@link Builder} pattern.
///
/// ### Required Fields
/// - `id` - Identifier used in logs and request diagnostics
/// - `model` - Model identifier (e.g., "claude-sonnet-4", "gpt-4o", "stub")
///
/// ### Optional Parameters
/// - `temperature` - Sampling temperature (default: 0.0, deterministic choices)
/// - `maxTokens` - Maximum response tokens
/// - `instructions` - System-level instructions prepended to every request
/// - `topP` - Nucleus sampling parameter
/// - `timeout` - Request timeout in milliseconds
///
/// @implNote Thread-safe. All fields are immutable after construction.
///
/// @see DecisionAgentFactory for creating agents from configurations
public final class AgentConfig {

    private final String id;
    private final String model;
    private final double temperature;
    private final Integer maxTokens;
    private final String instructions;
    private final Double topP;
    private final Long timeout;

    private AgentConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Agent ID required");
        this.model = Objects.requireNonNull(builder.model, "Model required");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.instructions = builder.instructions;
        this.topP = builder.topP;
        this.timeout = builder.timeout;
    }

    public String getId() {
        return id;
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    /// Returns the maximum number of tokens in the response.
    ///
    /// @return max tokens limit, may be null (provider default used)
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// Returns system-level instructions for the agent.
    ///
    /// @return instruction text, may be null
    public String getInstructions() {
        return instructions;
    }

    /// Returns the nucleus sampling parameter.
    ///
    /// @return top-p value, may be null (provider default used)
    public Double getTopP() {
        return topP;
    }

    /// Returns the request timeout in milliseconds.
    ///
    /// @return timeout value, may be null (provider default used)
    public Long getTimeout() {
        return timeout;
    }

    /// Creates a new builder for constructing AgentConfig instances.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable {@link AgentConfig} instances.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private String id;
        private String model;
        private double temperature = 0.0;
        private Integer maxTokens;
        private String instructions;
        private Double topP;
        private Long timeout;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /// Sets the sampling temperature.
        ///
        /// @param temperature value typically between 0.0 and 2.0
        /// @return this builder for chaining
        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        /// Sets the request timeout.
        ///
        /// @param timeout timeout in milliseconds, may be null
        /// @return this builder for chaining
        public Builder timeout(Long timeout) {
            this.timeout = timeout;
            return this;
        }

        /// Builds an immutable AgentConfig instance.
        ///
        /// @return the constructed configuration, never null
        /// @throws NullPointerException if id or model is null
        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentConfig that)) return false;
        return Objects.equals(id, that.id) && Objects.equals(model, that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, model);
    }

    @Override
    public String toString() {
        return "AgentConfig{id='" + id + "', model='" + model + "'}";
    }
}
