package io.statewalk.core.context;

import io.statewalk.core.model.AccessMarker;
import io.statewalk.core.model.EdgeSegment;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Computes which context nodes a node may read and write.
///
/// ### Rules
/// - An edge from the node to a context with a `reads:` marker grants read, with a
///   `writes:` marker grants write; field lists restrict the grant
/// - An edge from the node to a context with no markers grants read
/// - An edge from a context to the node grants read
/// - Every context ancestor grants read, never write
/// - Write access never implies read access
///
/// Permissions do not flow through non-context ancestors: a node does not inherit the
/// explicit grants of the module it is nested in.
///
/// @implNote Results depend only on the model's structure and are cached per node.
/// **Not thread-safe**; owned by one execution loop.
///
/// @see ContextPermission
public class ContextAccessResolver {

    private final MachineModel model;
    private final Map<String, Map<String, ContextPermission>> cache = new HashMap<>();

    /// Creates a resolver for the given model.
    ///
    /// @param model the model to resolve against, not null
    public ContextAccessResolver(MachineModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /// Returns the contexts a node may access.
    ///
    /// @param nodeName the accessing node, not null
    /// @return permissions keyed by context name, in context declaration order; never null
    public Map<String, ContextPermission> accessible(String nodeName) {
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        return cache.computeIfAbsent(nodeName, this::compute);
    }

    /// Returns the permission for one context.
    ///
    /// @param nodeName the accessing node, not null
    /// @param contextName the context, not null
    /// @return the permission, or a no-access permission when none was granted
    public ContextPermission permission(String nodeName, String contextName) {
        ContextPermission permission = accessible(nodeName).get(contextName);
        return permission != null
                ? permission
                : new ContextPermission(contextName, false, false, Set.of(), Set.of(), false);
    }

    private Map<String, ContextPermission> compute(String nodeName) {
        Map<String, ContextPermission> grants = new HashMap<>();

        for (MachineEdge edge : model.outgoing(nodeName)) {
            for (EdgeSegment segment : edge.segments()) {
                if (model.isContext(segment.target())) {
                    grant(grants, fromMarkers(segment.target(), edge));
                }
            }
        }

        for (MachineEdge edge : model.incoming(nodeName)) {
            if (model.isContext(edge.source())) {
                grant(grants, read(edge.source()));
            }
        }

        for (String ancestor : model.ancestors(nodeName)) {
            if (model.isContext(ancestor)) {
                grant(grants, ContextPermission.inheritedRead(ancestor));
            }
        }

        Map<String, ContextPermission> ordered = new LinkedHashMap<>();
        for (MachineNode node : model.nodes()) {
            ContextPermission permission = grants.get(node.name());
            if (permission != null) {
                ordered.put(node.name(), permission);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    private static ContextPermission fromMarkers(String context, MachineEdge edge) {
        AccessMarker reads = edge.reads();
        AccessMarker writes = edge.writes();
        if (reads == null && writes == null) {
            return read(context);
        }
        return new ContextPermission(
                context,
                reads != null,
                writes != null,
                reads != null ? Set.copyOf(reads.fields()) : Set.of(),
                writes != null ? Set.copyOf(writes.fields()) : Set.of(),
                false);
    }

    private static ContextPermission read(String context) {
        return new ContextPermission(context, true, false, Set.of(), Set.of(), false);
    }

    private static void grant(Map<String, ContextPermission> grants, ContextPermission permission) {
        grants.merge(permission.context(), permission, ContextPermission::merge);
    }
}
