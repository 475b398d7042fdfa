package io.statewalk.core.model;

/// Optional capabilities a node can declare.
public enum NodeCapability {
    /// Node may use the meta tools (`construct_tool`, `get_definition`, `update_definition`).
    META
}
