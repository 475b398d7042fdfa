package io.statewalk.core.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable node of a machine model.
///
/// ### Contracts
/// - **Precondition**: `name` is not blank, attribute names are unique
/// - **Postcondition**: All fields immutable after construction
///
/// @param name unique node name, not null
/// @param kind resolved node kind, not null
/// @param parent name of the owning node, null for top-level nodes
/// @param attributes ordered declared attributes, not null (may be empty)
/// @param capabilities declared capabilities, not null (may be empty)
/// @see MachineModel for the owning arena
public record MachineNode(
        String name,
        NodeKind kind,
        String parent,
        List<NodeAttribute> attributes,
        Set<NodeCapability> capabilities) {

    /// Attribute whose presence makes a node agent-driven.
    public static final String PROMPT_ATTRIBUTE = "prompt";

    /// Compact constructor with validation and defensive copying.
    public MachineNode {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(kind, "kind must not be null");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        long distinct = attributes.stream().map(NodeAttribute::name).distinct().count();
        if (distinct != attributes.size()) {
            throw new IllegalArgumentException("Duplicate attribute names on node '" + name + "'");
        }
        capabilities =
                capabilities == null || capabilities.isEmpty()
                        ? Set.of()
                        : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    /// Creates a top-level node without attributes.
    ///
    /// @param name node name, not null
    /// @param kind node kind, not null
    /// @return new node, never null
    public static MachineNode of(String name, NodeKind kind) {
        return new MachineNode(name, kind, null, List.of(), Set.of());
    }

    /// Looks up a declared attribute.
    ///
    /// @param attributeName attribute name, not null
    /// @return the attribute if declared, empty otherwise
    public Optional<NodeAttribute> attribute(String attributeName) {
        for (NodeAttribute attribute : attributes) {
            if (attribute.name().equals(attributeName)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /// Returns an attribute value rendered as text.
    ///
    /// @param attributeName attribute name, not null
    /// @return the value's string form if declared and non-null, empty otherwise
    public Optional<String> textAttribute(String attributeName) {
        return attribute(attributeName).map(NodeAttribute::value).map(String::valueOf);
    }

    public boolean isContext() {
        return kind == NodeKind.CONTEXT;
    }

    /// Returns whether this node may use meta tools.
    ///
    /// A node is meta-enabled through the {@link NodeCapability#META} capability or a
    /// `meta` attribute whose value is `true`.
    ///
    /// @return true if meta tools are offered on this node
    public boolean isMetaEnabled() {
        if (capabilities.contains(NodeCapability.META)) {
            return true;
        }
        return attribute("meta")
                .map(NodeAttribute::value)
                .map(v -> Boolean.TRUE.equals(v) || "true".equalsIgnoreCase(String.valueOf(v)))
                .orElse(false);
    }

    /// Returns whether this node carries a non-empty prompt.
    ///
    /// @return true if the `prompt` attribute is set to non-blank text
    public boolean hasPrompt() {
        return textAttribute(PROMPT_ATTRIBUTE).map(p -> !p.isBlank()).orElse(false);
    }

    /// Returns a copy of this node with one attribute set.
    ///
    /// Existing attributes keep their position and declared type; a new attribute is
    /// appended.
    ///
    /// @param attributeName attribute name, not null
    /// @param value new value, may be null
    /// @return updated copy, never null
    public MachineNode withAttributeValue(String attributeName, Object value) {
        List<NodeAttribute> updated = new ArrayList<>(attributes.size() + 1);
        boolean replaced = false;
        for (NodeAttribute attribute : attributes) {
            if (attribute.name().equals(attributeName)) {
                updated.add(attribute.withValue(value));
                replaced = true;
            } else {
                updated.add(attribute);
            }
        }
        if (!replaced) {
            updated.add(NodeAttribute.of(attributeName, value));
        }
        return new MachineNode(name, kind, parent, updated, capabilities);
    }
}
