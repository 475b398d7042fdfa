package io.statewalk.core.transition;

import io.statewalk.core.condition.ConditionEvaluator;
import io.statewalk.core.condition.ConditionResult;
import io.statewalk.core.context.SharedAttributeStore;
import io.statewalk.core.model.EdgeSegment;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Decides how a path leaves its current node.
///
/// ### Decision procedure
/// 1. Candidates are the node's outbound edges that reach at least one non-context
///    node. A node with none inherits the candidates of its nearest ancestor that has
///    some; if still none, the decision is {@link TransitionDecision.Terminal}.
/// 2. A node with a non-empty `prompt` attribute always needs an agent.
/// 3. An edge is automated-eligible when it is flagged `automatic`, when it is the only
///    candidate and unconditional, or when its condition evaluates to a definite value.
/// 4. Eligible edges whose condition holds (or that have none) fire. If any fire, the
///    one with the highest priority, then the earliest declaration, is taken.
/// 5. If nothing fires and every candidate's condition is definitely false, the node
///    is terminal. Anything else goes to an agent with all candidates.
///
/// Bare condition references resolve against the node that declares the edge.
///
/// @implNote Stateless apart from the model reference; reads the live model on every
/// call so condition and priority updates take effect immediately.
///
/// @see TransitionDecision
/// @see ConditionEvaluator
public class TransitionEvaluator {

    private static final Comparator<MachineEdge> SELECTION_ORDER =
            Comparator.comparingInt(MachineEdge::effectivePriority)
                    .reversed()
                    .thenComparingInt(MachineEdge::index);

    private final MachineModel model;
    private final ConditionEvaluator conditions;

    /// Creates an evaluator.
    ///
    /// @param model the live model, not null
    /// @param conditions condition evaluator, not null
    public TransitionEvaluator(MachineModel model, ConditionEvaluator conditions) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.conditions = Objects.requireNonNull(conditions, "conditions must not be null");
    }

    /// Evaluates the transitions leaving a node.
    ///
    /// @param nodeName the current node, not null
    /// @param store current attribute values, not null
    /// @return the decision, never null
    public TransitionDecision evaluate(String nodeName, SharedAttributeStore store) {
        MachineNode node = model.requireNode(nodeName);
        List<MachineEdge> candidates = candidates(nodeName);

        if (candidates.isEmpty()) {
            return new TransitionDecision.Terminal("Node '" + nodeName + "' has no exits", List.of());
        }
        if (node.hasPrompt()) {
            return new TransitionDecision.AgentRequired(
                    candidates, "Node '" + nodeName + "' carries a prompt", List.of());
        }

        List<ConditionWarning> warnings = new ArrayList<>();
        List<MachineEdge> firing = new ArrayList<>();
        boolean allFalse = true;
        boolean sole = candidates.size() == 1;

        for (MachineEdge edge : candidates) {
            if (!edge.isConditional()) {
                allFalse = false;
                if (edge.automatic() || sole) {
                    firing.add(edge);
                }
                continue;
            }
            ConditionResult result = conditions.evaluate(edge.condition(), edge.source(), store);
            if (!result.isDecidable()) {
                allFalse = false;
                warnings.add(warningFor(nodeName, edge, result));
            } else if (result.isTrue()) {
                allFalse = false;
                firing.add(edge);
            }
        }

        if (!firing.isEmpty()) {
            MachineEdge chosen = firing.stream().min(SELECTION_ORDER).orElseThrow();
            return new TransitionDecision.Automated(chosen, describe(chosen), warnings);
        }
        if (allFalse) {
            return new TransitionDecision.Terminal(
                    "No condition holds on exits of '" + nodeName + "'", warnings);
        }
        String reason =
                warnings.isEmpty()
                        ? "Multiple transitions from '" + nodeName + "' need a choice"
                        : "Conditions on '" + nodeName + "' are not decidable";
        return new TransitionDecision.AgentRequired(candidates, reason, warnings);
    }

    /// Returns the edges a path at this node may take, with ancestor fallback.
    ///
    /// @param nodeName the current node, not null
    /// @return candidate edges in declaration order, never null
    public List<MachineEdge> candidates(String nodeName) {
        List<MachineEdge> own = transitionEdges(nodeName);
        if (!own.isEmpty()) {
            return own;
        }
        for (String ancestor : model.ancestors(nodeName)) {
            List<MachineEdge> inherited = transitionEdges(ancestor);
            if (!inherited.isEmpty()) {
                return inherited;
            }
        }
        return List.of();
    }

    /// Returns the non-context targets of an edge, in segment order.
    ///
    /// @param edge the edge, not null
    /// @return target names, never null
    public List<String> transitionTargets(MachineEdge edge) {
        List<String> result = new ArrayList<>();
        for (EdgeSegment segment : edge.segments()) {
            if (!model.isContext(segment.target()) && !result.contains(segment.target())) {
                result.add(segment.target());
            }
        }
        return result;
    }

    /// Resolves the node a path actually lands on when moving to a target.
    ///
    /// Entering a module (a node with non-context children) enters its first task
    /// child, else its first state child, else its first other child; repeated until a
    /// node without such children is reached.
    ///
    /// @param target the declared target, not null
    /// @return the node to land on, never null
    public String resolveEntry(String target) {
        String current = target;
        while (true) {
            List<MachineNode> children =
                    model.children(current).stream()
                            .map(model::requireNode)
                            .filter(n -> !n.isContext())
                            .toList();
            if (children.isEmpty()) {
                return current;
            }
            current =
                    firstOfKind(children, NodeKind.TASK)
                            .or(() -> firstOfKind(children, NodeKind.STATE))
                            .orElse(children.get(0).name());
        }
    }

    private static Optional<String> firstOfKind(List<MachineNode> nodes, NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).map(MachineNode::name).findFirst();
    }

    private List<MachineEdge> transitionEdges(String nodeName) {
        List<MachineEdge> result = new ArrayList<>();
        for (MachineEdge edge : model.outgoing(nodeName)) {
            if (!transitionTargets(edge).isEmpty()) {
                result.add(edge);
            }
        }
        return result;
    }

    private static String describe(MachineEdge edge) {
        if (edge.isConditional()) {
            return "Condition '" + edge.condition() + "' holds";
        }
        return edge.automatic() ? "Automatic transition" : "Single unconditional transition";
    }

    private static ConditionWarning warningFor(
            String nodeName, MachineEdge edge, ConditionResult result) {
        if (result.error() != null) {
            return new ConditionWarning(
                    nodeName,
                    edge.index(),
                    edge.condition(),
                    ConditionWarning.Kind.CONDITION_SYNTAX,
                    result.missingReferences(),
                    "Malformed condition '" + edge.condition() + "': " + result.error());
        }
        return new ConditionWarning(
                nodeName,
                edge.index(),
                edge.condition(),
                ConditionWarning.Kind.MISSING_CONTEXT,
                result.missingReferences(),
                "Condition '"
                        + edge.condition()
                        + "' references unset "
                        + result.missingReferences());
    }
}
