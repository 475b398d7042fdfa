package io.statewalk.core.execution;

import io.statewalk.core.agent.AgentContextBuilder;

/// Configuration options for an {@link ExecutionEngine}.
///
/// ### Default Values
/// - `limits`: {@link ExecutionLimits#DEFAULTS}
/// - `agentPoolSize`: `0` (agent calls run inline on the loop thread)
/// - `historyTail`: `5` history entries per agent context
///
/// @implNote **Not thread-safe**. Configure before passing to the engine builder and do
/// not modify afterwards.
///
/// @see Builder
public class EngineConfig {

    private ExecutionLimits limits = ExecutionLimits.DEFAULTS;
    private int agentPoolSize = 0;
    private int historyTail = AgentContextBuilder.DEFAULT_HISTORY_TAIL;

    /// Creates a configuration with default values.
    public EngineConfig() {}

    public ExecutionLimits getLimits() {
        return limits;
    }

    public void setLimits(ExecutionLimits limits) {
        this.limits = limits;
    }

    /// Returns the number of worker threads used for agent calls.
    ///
    /// @return pool size; `0` runs agent calls inline, which keeps execution deterministic
    public int getAgentPoolSize() {
        return agentPoolSize;
    }

    public void setAgentPoolSize(int agentPoolSize) {
        this.agentPoolSize = agentPoolSize;
    }

    public int getHistoryTail() {
        return historyTail;
    }

    public void setHistoryTail(int historyTail) {
        this.historyTail = historyTail;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link EngineConfig}.
    public static class Builder {
        private final EngineConfig config = new EngineConfig();

        public Builder limits(ExecutionLimits limits) {
            config.limits = limits;
            return this;
        }

        /// Sets the agent worker pool size.
        ///
        /// @param agentPoolSize number of threads, `0` for inline calls
        /// @return this builder for chaining, never null
        public Builder agentPoolSize(int agentPoolSize) {
            config.agentPoolSize = agentPoolSize;
            return this;
        }

        public Builder historyTail(int historyTail) {
            config.historyTail = historyTail;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        /// @throws IllegalArgumentException if a value is out of range
        public EngineConfig build() {
            if (config.limits == null) {
                throw new IllegalArgumentException("limits must not be null");
            }
            if (config.agentPoolSize < 0) {
                throw new IllegalArgumentException("agentPoolSize must not be negative");
            }
            if (config.historyTail < 0) {
                throw new IllegalArgumentException("historyTail must not be negative");
            }
            return config;
        }
    }
}
