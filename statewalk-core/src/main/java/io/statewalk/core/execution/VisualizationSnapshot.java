package io.statewalk.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Point-in-time view of an execution for rendering.
///
/// @param title model title, not null
/// @param totalSteps transitions applied so far
/// @param paths all paths in creation order, not null
/// @param nodes per-node activity in model declaration order, not null
public record VisualizationSnapshot(
        String title, int totalSteps, List<PathView> paths, Map<String, NodeView> nodes) {

    public VisualizationSnapshot {
        Objects.requireNonNull(title, "title must not be null");
        paths = List.copyOf(paths);
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /// One path.
    ///
    /// @param id path id, not null
    /// @param status current status, not null
    /// @param currentNode current node, not null
    /// @param stepCount transitions taken
    /// @param availableTransitions targets of the current candidate edges; empty for
    ///        finished paths
    public record PathView(
            String id,
            PathStatus status,
            String currentNode,
            int stepCount,
            List<String> availableTransitions) {

        public PathView {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(status, "status must not be null");
            availableTransitions = List.copyOf(availableTransitions);
        }
    }

    /// Activity at one node.
    ///
    /// @param name node name, not null
    /// @param visitCount entries across all paths
    /// @param activePaths unfinished paths currently at the node, not null
    public record NodeView(String name, int visitCount, List<String> activePaths) {

        public NodeView {
            Objects.requireNonNull(name, "name must not be null");
            activePaths = List.copyOf(activePaths);
        }

        public boolean isActive() {
            return !activePaths.isEmpty();
        }
    }
}
