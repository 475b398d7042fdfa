package io.statewalk.core.tool;

import java.util.Locale;

/// How a constructed tool is meant to be carried out.
///
/// Constructed tools never execute code; the strategy tells the agent how to interpret
/// the tool's details when it calls it.
public enum ToolStrategy {
    /// The details are instructions the agent follows itself.
    AGENT_BACKED,
    /// The details describe a chain of existing tools.
    COMPOSITION;

    /// Resolves a strategy from its wire name (`agent_backed`, `composition`).
    ///
    /// @param value wire name, not null
    /// @return the strategy, never null
    /// @throws IllegalArgumentException if the name is not a supported strategy
    public static ToolStrategy fromWireName(String value) {
        for (ToolStrategy strategy : values()) {
            if (strategy.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unsupported tool strategy: " + value);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
