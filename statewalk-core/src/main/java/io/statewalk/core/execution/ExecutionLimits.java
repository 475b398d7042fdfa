package io.statewalk.core.execution;

import java.util.Properties;
import java.util.logging.Logger;

/// Safety bounds that keep a graph walk finite.
///
/// ### Default Values
/// | Limit | Default | Scope |
/// |---|---|---|
/// | `maxSteps` | 1000 | transitions applied, engine-wide |
/// | `maxNodeInvocations` | 100 | evaluations per node name, engine-wide |
/// | `timeoutMs` | 300000 | wall clock from start |
/// | `cycleDetectionWindow` | 20 | visits inspected per path, 0 disables |
/// | `maxAgentTurns` | 50 | tool calls per agent decision |
/// | `maxInvalidToolCalls` | 3 | invalid calls tolerated per agent decision |
///
/// ### System Properties
/// {@link #fromSystemProperties()} overrides defaults from `statewalk.limits.maxSteps`,
/// `statewalk.limits.maxNodeInvocations`, `statewalk.limits.timeoutMs`,
/// `statewalk.limits.cycleDetectionWindow`, `statewalk.limits.maxAgentTurns` and
/// `statewalk.limits.maxInvalidToolCalls`.
///
/// @param maxSteps maximum transitions applied across all paths, positive
/// @param maxNodeInvocations maximum evaluations of any single node, positive
/// @param timeoutMs execution time budget in milliseconds, positive
/// @param cycleDetectionWindow visits inspected for repetition, 0 to disable
/// @param maxAgentTurns maximum tool calls in one agent decision, positive
/// @param maxInvalidToolCalls invalid calls tolerated in one agent decision, not negative
public record ExecutionLimits(
        int maxSteps,
        int maxNodeInvocations,
        long timeoutMs,
        int cycleDetectionWindow,
        int maxAgentTurns,
        int maxInvalidToolCalls) {

    private static final Logger logger = Logger.getLogger(ExecutionLimits.class.getName());

    static final String PROPERTY_PREFIX = "statewalk.limits.";

    /// Limits with all default values.
    public static final ExecutionLimits DEFAULTS = builder().build();

    public ExecutionLimits {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        if (maxNodeInvocations <= 0) {
            throw new IllegalArgumentException(
                    "maxNodeInvocations must be positive: " + maxNodeInvocations);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (cycleDetectionWindow < 0) {
            throw new IllegalArgumentException(
                    "cycleDetectionWindow must not be negative: " + cycleDetectionWindow);
        }
        if (maxAgentTurns <= 0) {
            throw new IllegalArgumentException("maxAgentTurns must be positive: " + maxAgentTurns);
        }
        if (maxInvalidToolCalls < 0) {
            throw new IllegalArgumentException(
                    "maxInvalidToolCalls must not be negative: " + maxInvalidToolCalls);
        }
    }

    /// Reads limits from system properties, falling back to defaults.
    ///
    /// @return limits, never null
    /// @throws IllegalArgumentException if a property is not a number or out of range
    public static ExecutionLimits fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Reads limits from `statewalk.limits.*` entries, falling back to defaults.
    ///
    /// @param properties property source, not null
    /// @return limits, never null
    /// @throws IllegalArgumentException if a property is not a number or out of range
    public static ExecutionLimits fromProperties(Properties properties) {
        ExecutionLimits defaults = DEFAULTS;
        ExecutionLimits limits =
                builder()
                        .maxSteps((int) read(properties, "maxSteps", defaults.maxSteps))
                        .maxNodeInvocations(
                                (int)
                                        read(
                                                properties,
                                                "maxNodeInvocations",
                                                defaults.maxNodeInvocations))
                        .timeoutMs(read(properties, "timeoutMs", defaults.timeoutMs))
                        .cycleDetectionWindow(
                                (int)
                                        read(
                                                properties,
                                                "cycleDetectionWindow",
                                                defaults.cycleDetectionWindow))
                        .maxAgentTurns((int) read(properties, "maxAgentTurns", defaults.maxAgentTurns))
                        .maxInvalidToolCalls(
                                (int)
                                        read(
                                                properties,
                                                "maxInvalidToolCalls",
                                                defaults.maxInvalidToolCalls))
                        .build();
        if (!limits.equals(defaults)) {
            logger.info("Using execution limits " + limits);
        }
        return limits;
    }

    private static long read(Properties properties, String name, long fallback) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + PROPERTY_PREFIX + name + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these limits.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .maxSteps(maxSteps)
                .maxNodeInvocations(maxNodeInvocations)
                .timeoutMs(timeoutMs)
                .cycleDetectionWindow(cycleDetectionWindow)
                .maxAgentTurns(maxAgentTurns)
                .maxInvalidToolCalls(maxInvalidToolCalls);
    }

    /// Builder for {@link ExecutionLimits}, starting from the defaults.
    public static final class Builder {
        private int maxSteps = 1000;
        private int maxNodeInvocations = 100;
        private long timeoutMs = 300_000L;
        private int cycleDetectionWindow = 20;
        private int maxAgentTurns = 50;
        private int maxInvalidToolCalls = 3;

        private Builder() {}

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxNodeInvocations(int maxNodeInvocations) {
            this.maxNodeInvocations = maxNodeInvocations;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        /// Sets the number of recent visits inspected for repetition.
        ///
        /// @param cycleDetectionWindow window size, 0 disables cycle detection
        /// @return this builder for chaining
        public Builder cycleDetectionWindow(int cycleDetectionWindow) {
            this.cycleDetectionWindow = cycleDetectionWindow;
            return this;
        }

        public Builder maxAgentTurns(int maxAgentTurns) {
            this.maxAgentTurns = maxAgentTurns;
            return this;
        }

        public Builder maxInvalidToolCalls(int maxInvalidToolCalls) {
            this.maxInvalidToolCalls = maxInvalidToolCalls;
            return this;
        }

        /// Builds the limits.
        ///
        /// @return limits, never null
        /// @throws IllegalArgumentException if a value is out of range
        public ExecutionLimits build() {
            return new ExecutionLimits(
                    maxSteps,
                    maxNodeInvocations,
                    timeoutMs,
                    cycleDetectionWindow,
                    maxAgentTurns,
                    maxInvalidToolCalls);
        }
    }
}
