package io.statewalk.core.tool;

/// Closed set of tool shapes an agent can call.
public enum ToolKind {
    /// `transition_to_<target>`: take a candidate edge.
    TRANSITION,
    /// `read_<context>`: read attributes of an accessible context.
    READ,
    /// `write_<context>`: write attributes of a writable context.
    WRITE,
    /// `construct_tool`, `get_definition`, `update_definition`.
    META,
    /// A tool added during the session through `construct_tool`.
    CONSTRUCTED
}
