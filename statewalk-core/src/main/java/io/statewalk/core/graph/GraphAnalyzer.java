package io.statewalk.core.graph;

import io.statewalk.core.model.EdgeSegment;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Static structural analysis of a machine model.
///
/// Works on the transition graph: edges between non-context nodes. Edges touching a
/// context node express data access and never move a path, so they are left out of
/// reachability, cycle and path queries. Entering a module enters its children, and a
/// node without exits of its own leaves through its nearest ancestor's exits; both rules
/// are reflected in the adjacency the analyzer builds.
///
/// ### Contracts
/// - **Postcondition**: every result is deterministic and ordered by declaration order
/// - **Invariant**: the analyzer never mutates the model
///
/// ### Usage
/// {@snippet :
/// GraphAnalyzer analyzer = new GraphAnalyzer(model);
/// List<List<String>> cycles = analyzer.detectCycles();
/// ValidationReport report = analyzer.validate();
/// }
///
/// @implNote Thread-safe once constructed. Adjacency is computed eagerly from the
/// model's structure, which never changes after build.
public class GraphAnalyzer {

    private static final Logger logger = Logger.getLogger(GraphAnalyzer.class.getName());

    private final MachineModel model;
    private final List<String> order;
    private final Map<String, Integer> position;
    private final Map<String, List<String>> successors;
    private final Map<String, Integer> incomingTransitions;

    /// Creates an analyzer for the given model.
    ///
    /// @param model the model to analyze, not null
    public GraphAnalyzer(MachineModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.order = model.nodes().stream().map(MachineNode::name).toList();
        this.position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }
        this.successors = new LinkedHashMap<>();
        this.incomingTransitions = new HashMap<>();
        buildAdjacency();
    }

    /// Returns nodes where execution can start.
    ///
    /// A non-context node is an entry point when it is declared {@link NodeKind#INIT}, or
    /// when nothing transitions into it and it is not nested inside a non-context node.
    ///
    /// @return entry point names in declaration order, never null
    public List<String> findEntryPoints() {
        List<String> result = new ArrayList<>();
        for (MachineNode node : model.nodes()) {
            if (node.isContext()) {
                continue;
            }
            if (node.kind() == NodeKind.INIT
                    || (incomingTransitions.getOrDefault(node.name(), 0) == 0 && isTopLevel(node))) {
                result.add(node.name());
            }
        }
        return result;
    }

    /// Returns non-context nodes without any outgoing edge.
    ///
    /// @return exit point names in declaration order, never null
    public List<String> findExitPoints() {
        List<String> result = new ArrayList<>();
        for (MachineNode node : model.nodes()) {
            if (!node.isContext() && model.outgoing(node.name()).isEmpty()) {
                result.add(node.name());
            }
        }
        return result;
    }

    /// Returns non-context nodes that no entry point can reach.
    ///
    /// @return unreachable node names in declaration order, never null
    public List<String> findUnreachableNodes() {
        Set<String> reached = reachableFrom(findEntryPoints());
        List<String> result = new ArrayList<>();
        for (MachineNode node : model.nodes()) {
            if (!node.isContext() && !reached.contains(node.name())) {
                result.add(node.name());
            }
        }
        return result;
    }

    /// Returns nodes with neither incoming nor outgoing edges.
    ///
    /// Init nodes and context nodes are never reported: the former are entered by
    /// definition, the latter are reached through nesting.
    ///
    /// @return orphaned node names in declaration order, never null
    public List<String> findOrphanedNodes() {
        List<String> result = new ArrayList<>();
        for (MachineNode node : model.nodes()) {
            if (node.kind() == NodeKind.INIT || node.isContext()) {
                continue;
            }
            if (model.outgoing(node.name()).isEmpty() && model.incoming(node.name()).isEmpty()) {
                result.add(node.name());
            }
        }
        return result;
    }

    /// Enumerates every elementary cycle of the transition graph.
    ///
    /// Each cycle is reported once, starting at its earliest-declared node and following
    /// edge order. A self-loop is a cycle of length one.
    ///
    /// @implNote For each start node the search only walks through nodes declared at or
    /// after the start, so a cycle is found exactly from its earliest node and rotations
    /// are never reported twice.
    ///
    /// @return cycles as node-name sequences without the closing repetition, never null
    public List<List<String>> detectCycles() {
        List<List<String>> cycles = new ArrayList<>();
        for (String start : order) {
            if (model.isContext(start)) {
                continue;
            }
            int floor = position.get(start);
            Deque<String> stack = new ArrayDeque<>();
            Set<String> onStack = new HashSet<>();
            stack.addLast(start);
            onStack.add(start);
            collectCycles(start, start, floor, stack, onStack, cycles);
        }
        logger.fine("Detected " + cycles.size() + " cycle(s) in '" + model.title() + "'");
        return cycles;
    }

    /// Finds a shortest transition path between two nodes.
    ///
    /// @param from start node name, not null
    /// @param to end node name, not null
    /// @return node names from `from` to `to` inclusive, empty when unreachable
    public List<String> findPath(String from, String to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (!model.contains(from) || !model.contains(to)) {
            return List.of();
        }
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, List.of())) {
                if (seen.add(next)) {
                    previous.put(next, current);
                    if (next.equals(to)) {
                        return unwind(previous, from, to);
                    }
                    queue.add(next);
                }
            }
        }
        return List.of();
    }

    /// Finds the longest simple path starting at any entry point.
    ///
    /// @return node names of the longest path, the earliest found on ties; empty when the
    ///         model has no entry points
    public List<String> findLongestPath() {
        List<String> best = new ArrayList<>();
        for (String entry : findEntryPoints()) {
            List<String> current = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            best = longestFrom(entry, current, visited, best);
        }
        return List.copyOf(best);
    }

    /// Computes summary counts for the model.
    ///
    /// @return statistics, never null
    public GraphStatistics getStatistics() {
        Map<NodeKind, Integer> byKind = new EnumMap<>(NodeKind.class);
        int maxDepth = 0;
        for (MachineNode node : model.nodes()) {
            byKind.merge(node.kind(), 1, Integer::sum);
            maxDepth = Math.max(maxDepth, model.depth(node.name()));
        }
        return new GraphStatistics(
                order.size(),
                model.edges().size(),
                findEntryPoints().size(),
                findExitPoints().size(),
                detectCycles().size(),
                findUnreachableNodes().size(),
                findOrphanedNodes().size(),
                maxDepth,
                byKind);
    }

    /// Collects structural findings.
    ///
    /// @return report of warnings, never null
    public ValidationReport validate() {
        List<ValidationReport.Issue> issues = new ArrayList<>();
        if (findEntryPoints().isEmpty()) {
            issues.add(
                    new ValidationReport.Issue(
                            ValidationReport.IssueType.NO_ENTRY_POINTS,
                            "Machine has no entry points",
                            List.of()));
        }
        for (String node : findUnreachableNodes()) {
            issues.add(
                    new ValidationReport.Issue(
                            ValidationReport.IssueType.UNREACHABLE_NODE,
                            "Node '" + node + "' is not reachable from any entry point",
                            List.of(node)));
        }
        for (String node : findOrphanedNodes()) {
            issues.add(
                    new ValidationReport.Issue(
                            ValidationReport.IssueType.ORPHANED_NODE,
                            "Node '" + node + "' has no incoming or outgoing edges",
                            List.of(node)));
        }
        for (List<String> cycle : detectCycles()) {
            issues.add(
                    new ValidationReport.Issue(
                            ValidationReport.IssueType.CYCLE,
                            "Cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0),
                            cycle));
        }
        if (!issues.isEmpty()) {
            logger.info(
                    "Validation of '" + model.title() + "' found " + issues.size() + " issue(s)");
        }
        return new ValidationReport(model.title(), issues);
    }

    /// Returns the transition successors of a node, including inherited exits and
    /// module entry.
    ///
    /// @param name node name, not null
    /// @return successor names in edge order, never null
    public List<String> successors(String name) {
        return successors.getOrDefault(name, List.of());
    }

    private void buildAdjacency() {
        for (String name : order) {
            if (model.isContext(name)) {
                continue;
            }
            Set<String> next = new LinkedHashSet<>();
            for (MachineEdge edge : exitEdges(name)) {
                for (EdgeSegment segment : edge.segments()) {
                    if (!model.isContext(segment.target())) {
                        next.add(segment.target());
                    }
                }
            }
            for (String child : model.children(name)) {
                if (!model.isContext(child)) {
                    next.add(child);
                }
            }
            successors.put(name, List.copyOf(next));
        }
        for (MachineEdge edge : model.edges()) {
            if (model.isContext(edge.source())) {
                continue;
            }
            for (EdgeSegment segment : edge.segments()) {
                if (!model.isContext(segment.target())) {
                    incomingTransitions.merge(segment.target(), 1, Integer::sum);
                }
            }
        }
    }

    // Own transition edges, or the nearest ancestor's when the node has none.
    private List<MachineEdge> exitEdges(String name) {
        List<MachineEdge> own = transitionEdges(name);
        if (!own.isEmpty()) {
            return own;
        }
        for (String ancestor : model.ancestors(name)) {
            List<MachineEdge> inherited = transitionEdges(ancestor);
            if (!inherited.isEmpty()) {
                return inherited;
            }
        }
        return List.of();
    }

    private List<MachineEdge> transitionEdges(String name) {
        List<MachineEdge> result = new ArrayList<>();
        for (MachineEdge edge : model.outgoing(name)) {
            if (edge.segments().stream().anyMatch(s -> !model.isContext(s.target()))) {
                result.add(edge);
            }
        }
        return result;
    }

    private boolean isTopLevel(MachineNode node) {
        for (String ancestor : model.ancestors(node.name())) {
            if (!model.isContext(ancestor)) {
                return false;
            }
        }
        return true;
    }

    private Set<String> reachableFrom(List<String> roots) {
        Set<String> reached = new LinkedHashSet<>(roots);
        Deque<String> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, List.of())) {
                if (reached.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reached;
    }

    private void collectCycles(
            String start,
            String current,
            int floor,
            Deque<String> stack,
            Set<String> onStack,
            List<List<String>> cycles) {
        for (String next : successors.getOrDefault(current, List.of())) {
            if (next.equals(start)) {
                cycles.add(List.copyOf(stack));
            } else if (position.get(next) > floor && !onStack.contains(next)) {
                stack.addLast(next);
                onStack.add(next);
                collectCycles(start, next, floor, stack, onStack, cycles);
                onStack.remove(next);
                stack.removeLast();
            }
        }
    }

    private List<String> longestFrom(
            String node, List<String> current, Set<String> visited, List<String> best) {
        current.add(node);
        visited.add(node);
        List<String> result = best;
        if (current.size() > result.size()) {
            result = new ArrayList<>(current);
        }
        for (String next : successors.getOrDefault(node, List.of())) {
            if (!visited.contains(next)) {
                result = longestFrom(next, current, visited, result);
            }
        }
        visited.remove(node);
        current.remove(current.size() - 1);
        return result;
    }

    private static List<String> unwind(Map<String, String> previous, String from, String to) {
        List<String> path = new ArrayList<>();
        String step = to;
        while (step != null) {
            path.add(step);
            step = step.equals(from) ? null : previous.get(step);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }
}
