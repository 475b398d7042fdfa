package io.statewalk.core.graph;

import io.statewalk.core.model.NodeKind;
import java.util.Map;

/// Summary counts for a machine model.
///
/// @param nodeCount number of declared nodes
/// @param edgeCount number of declared edges
/// @param entryPointCount number of entry points
/// @param exitPointCount number of exit points
/// @param cycleCount number of elementary cycles
/// @param unreachableCount number of unreachable non-context nodes
/// @param orphanedCount number of orphaned nodes
/// @param maxDepth deepest nesting level, 0 when the model is flat
/// @param nodesByKind node count per kind, in enum order
public record GraphStatistics(
        int nodeCount,
        int edgeCount,
        int entryPointCount,
        int exitPointCount,
        int cycleCount,
        int unreachableCount,
        int orphanedCount,
        int maxDepth,
        Map<NodeKind, Integer> nodesByKind) {

    public GraphStatistics {
        nodesByKind = nodesByKind != null ? Map.copyOf(nodesByKind) : Map.of();
    }
}
