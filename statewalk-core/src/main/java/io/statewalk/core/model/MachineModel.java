package io.statewalk.core.model;

import io.statewalk.core.exception.MachineStructureException;
import io.statewalk.core.tool.ToolCatalogue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Flat arena holding the nodes and edges of one machine.
///
/// Nodes are indexed by name and kept in declaration order; parent/child relationships
/// are plain name references. The structure (which nodes exist, their kinds and parents,
/// and where each edge leads) is fixed at build time. Only non-structural properties can
/// change afterwards, through {@link #updateNode} and {@link #updateEdge}, which is how
/// the `update_definition` meta tool mutates the live model.
///
/// ### Contracts
/// - **Precondition**: node names unique, every edge endpoint and parent declared,
///   no parent cycles
/// - **Invariant**: structure never changes after {@link Builder#build()}
///
/// ### Usage
/// {@snippet :
/// MachineModel model = MachineModel.builder("Pipeline")
///     .node(MachineNode.of("start", NodeKind.INIT))
///     .node(MachineNode.of("done", NodeKind.STATE))
///     .edge(MachineEdge.from("start").to("done").build())
///     .build();
/// }
///
/// @implNote **Not thread-safe**. A live model is owned by a single execution loop;
/// use {@link #copy()} to hand an independent instance to another execution.
public final class MachineModel {

    private final String title;
    private final Map<String, MachineNode> nodes;
    private final List<MachineEdge> edges;
    private final Map<String, List<Integer>> outgoing;
    private final Map<String, List<Integer>> incoming;
    private final Map<String, List<String>> children;
    private int revision;

    private MachineModel(
            String title, Map<String, MachineNode> nodes, List<MachineEdge> edges, int revision) {
        this.title = title;
        this.nodes = nodes;
        this.edges = edges;
        this.revision = revision;
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
        this.children = new LinkedHashMap<>();
        index();
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public String title() {
        return title;
    }

    /// Returns all nodes in declaration order.
    ///
    /// @return unmodifiable node list, never null
    public List<MachineNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /// Returns all edges in declaration order.
    ///
    /// @return unmodifiable edge list, never null
    public List<MachineEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Optional<MachineNode> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /// Returns a node that must exist.
    ///
    /// @param name node name, not null
    /// @return the node, never null
    /// @throws MachineStructureException if no such node is declared
    public MachineNode requireNode(String name) {
        MachineNode node = nodes.get(name);
        if (node == null) {
            throw new MachineStructureException("Unknown node: " + name);
        }
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /// Returns the declaration position of a node, or -1 when unknown.
    ///
    /// @param name node name, not null
    /// @return zero-based position
    public int positionOf(String name) {
        int position = 0;
        for (String key : nodes.keySet()) {
            if (key.equals(name)) {
                return position;
            }
            position++;
        }
        return -1;
    }

    /// Returns edges leaving the given node, in declaration order.
    ///
    /// @param name source node name, not null
    /// @return outbound edges, never null (may be empty)
    public List<MachineEdge> outgoing(String name) {
        return resolve(outgoing.getOrDefault(name, List.of()));
    }

    /// Returns edges with at least one segment reaching the given node.
    ///
    /// @param name target node name, not null
    /// @return inbound edges in declaration order, never null (may be empty)
    public List<MachineEdge> incoming(String name) {
        return resolve(incoming.getOrDefault(name, List.of()));
    }

    /// Returns the direct children of a node in declaration order.
    ///
    /// @param name parent node name, not null
    /// @return child names, never null (may be empty)
    public List<String> children(String name) {
        return children.getOrDefault(name, List.of());
    }

    /// Returns the ancestors of a node, nearest first.
    ///
    /// @param name node name, not null
    /// @return ancestor names, never null (empty for top-level nodes)
    public List<String> ancestors(String name) {
        List<String> result = new ArrayList<>();
        MachineNode current = nodes.get(name);
        while (current != null && current.parent() != null) {
            result.add(current.parent());
            current = nodes.get(current.parent());
        }
        return result;
    }

    /// Returns the nesting depth of a node; top-level nodes have depth 0.
    ///
    /// @param name node name, not null
    /// @return depth
    public int depth(String name) {
        return ancestors(name).size();
    }

    public boolean isContext(String name) {
        MachineNode node = nodes.get(name);
        return node != null && node.isContext();
    }

    /// Returns the number of applied definition updates.
    ///
    /// @return revision counter, starting at 0
    public int revision() {
        return revision;
    }

    /// Replaces a node with an updated version of itself.
    ///
    /// @apiNote **Side effects**: Modifies the live model and bumps the revision
    ///
    /// @param updated replacement node with the same name, kind, parent and capabilities
    /// @throws IllegalArgumentException if the replacement changes structure
    /// @throws MachineStructureException if the node is not declared
    public void updateNode(MachineNode updated) {
        Objects.requireNonNull(updated, "updated must not be null");
        MachineNode existing = requireNode(updated.name());
        if (existing.kind() != updated.kind()
                || !Objects.equals(existing.parent(), updated.parent())
                || !existing.capabilities().equals(updated.capabilities())) {
            throw new IllegalArgumentException(
                    "Structural change to node '" + updated.name() + "' is not allowed");
        }
        nodes.put(updated.name(), updated);
        revision++;
    }

    /// Replaces an edge with an updated version of itself.
    ///
    /// @apiNote **Side effects**: Modifies the live model and bumps the revision
    ///
    /// @param updated replacement edge at the same index with the same source, segments
    ///        and access markers
    /// @throws IllegalArgumentException if the replacement changes structure
    public void updateEdge(MachineEdge updated) {
        Objects.requireNonNull(updated, "updated must not be null");
        if (updated.index() < 0 || updated.index() >= edges.size()) {
            throw new IllegalArgumentException("Unknown edge index: " + updated.index());
        }
        MachineEdge existing = edges.get(updated.index());
        if (!existing.source().equals(updated.source())
                || !existing.segments().equals(updated.segments())
                || !Objects.equals(existing.reads(), updated.reads())
                || !Objects.equals(existing.writes(), updated.writes())
                || existing.automatic() != updated.automatic()) {
            throw new IllegalArgumentException(
                    "Structural change to edge #" + updated.index() + " is not allowed");
        }
        edges.set(updated.index(), updated);
        revision++;
    }

    /// Creates an independent copy sharing no mutable state with this model.
    ///
    /// @return copy with the same nodes, edges and revision, never null
    public MachineModel copy() {
        return new MachineModel(title, new LinkedHashMap<>(nodes), new ArrayList<>(edges), revision);
    }

    private List<MachineEdge> resolve(List<Integer> indexes) {
        List<MachineEdge> result = new ArrayList<>(indexes.size());
        for (Integer i : indexes) {
            result.add(edges.get(i));
        }
        return result;
    }

    private void index() {
        for (MachineNode node : nodes.values()) {
            if (node.parent() != null) {
                children.computeIfAbsent(node.parent(), k -> new ArrayList<>()).add(node.name());
            }
        }
        for (MachineEdge edge : edges) {
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.index());
            Set<String> seen = new HashSet<>();
            for (EdgeSegment segment : edge.segments()) {
                if (seen.add(segment.target())) {
                    incoming.computeIfAbsent(segment.target(), k -> new ArrayList<>())
                            .add(edge.index());
                }
            }
        }
    }

    /// Builder for {@link MachineModel}.
    public static final class Builder {
        private final String title;
        private final Map<String, MachineNode> nodes = new LinkedHashMap<>();
        private final List<MachineEdge> edges = new ArrayList<>();

        private Builder(String title) {
            this.title = title != null ? title : "machine";
        }

        /// Adds a node.
        ///
        /// @param node node to add, not null
        /// @return this builder for chaining
        /// @throws MachineStructureException if a node with the same name exists
        public Builder node(MachineNode node) {
            Objects.requireNonNull(node, "node must not be null");
            if (nodes.putIfAbsent(node.name(), node) != null) {
                throw new MachineStructureException("Duplicate node name: " + node.name());
            }
            return this;
        }

        /// Adds an edge; its index is its position among added edges.
        ///
        /// @param edge edge to add, not null
        /// @return this builder for chaining
        public Builder edge(MachineEdge edge) {
            Objects.requireNonNull(edge, "edge must not be null");
            edges.add(edge.withIndex(edges.size()));
            return this;
        }

        /// Validates references and builds the model.
        ///
        /// @return new model, never null
        /// @throws MachineStructureException if a parent or edge endpoint is undeclared,
        ///         the parent relation contains a cycle, or two context names normalize to
        ///         the same tool name
        public MachineModel build() {
            for (MachineNode node : nodes.values()) {
                if (node.parent() != null && !nodes.containsKey(node.parent())) {
                    throw new MachineStructureException(
                            "Node '" + node.name() + "' has undeclared parent '" + node.parent() + "'");
                }
            }
            for (MachineNode node : nodes.values()) {
                Set<String> seen = new HashSet<>();
                MachineNode current = node;
                while (current != null && current.parent() != null) {
                    if (!seen.add(current.name())) {
                        throw new MachineStructureException(
                                "Parent cycle involving node '" + node.name() + "'");
                    }
                    current = nodes.get(current.parent());
                }
            }
            for (MachineEdge edge : edges) {
                if (!nodes.containsKey(edge.source())) {
                    throw new MachineStructureException(
                            "Edge #" + edge.index() + " has undeclared source '" + edge.source() + "'");
                }
                for (EdgeSegment segment : edge.segments()) {
                    if (!nodes.containsKey(segment.target())) {
                        throw new MachineStructureException(
                                "Edge #"
                                        + edge.index()
                                        + " has undeclared target '"
                                        + segment.target()
                                        + "'");
                    }
                }
            }
            Map<String, String> contextsByFragment = new HashMap<>();
            for (MachineNode node : nodes.values()) {
                if (!node.isContext()) {
                    continue;
                }
                String clash =
                        contextsByFragment.putIfAbsent(
                                ToolCatalogue.toolFragment(node.name()), node.name());
                if (clash != null) {
                    throw new MachineStructureException(
                            "Contexts '"
                                    + clash
                                    + "' and '"
                                    + node.name()
                                    + "' map to the same tool name '"
                                    + ToolCatalogue.READ_PREFIX
                                    + ToolCatalogue.toolFragment(node.name())
                                    + "'");
                }
            }
            return new MachineModel(
                    title, new LinkedHashMap<>(nodes), new ArrayList<>(edges), 0);
        }
    }
}
