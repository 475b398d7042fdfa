package io.statewalk.core.model;

import java.util.Locale;

/// Closed set of node kinds understood by the engine.
///
/// Kind names coming from a parsed definition are resolved once, at load time, through
/// {@link #fromName(String)}. Decision logic only ever compares enum constants.
public enum NodeKind {
    /// Explicit starting node; every init node seeds its own path.
    INIT,
    STATE,
    TASK,
    /// Attribute container read or written by other nodes, never a transition target.
    CONTEXT,
    RESOURCE,
    OTHER;

    /// Resolves a declared type name to a kind.
    ///
    /// Matching is case-insensitive. Aliases used by definitions (`initial`, `start`,
    /// `input`, `output`, `data`) are folded into their canonical kinds; anything
    /// unknown becomes {@link #OTHER}.
    ///
    /// @param name declared type name, may be null
    /// @return the resolved kind, never null
    public static NodeKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "init", "initial", "start" -> INIT;
            case "state" -> STATE;
            case "task" -> TASK;
            case "context", "input", "output", "data" -> CONTEXT;
            case "resource" -> RESOURCE;
            default -> OTHER;
        };
    }
}
