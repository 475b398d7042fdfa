package io.statewalk.core.execution.result;

import io.statewalk.core.exception.StateMachineException;
import io.statewalk.core.execution.PathStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Final state of one path.
///
/// @param pathId path id, not null
/// @param parentPathId id of the forking path, null for start paths
/// @param status final status, not null
/// @param currentNode node the path ended at, not null
/// @param stepCount transitions taken
/// @param history full transition history, not null
/// @param visitCounts node to number of entries, not null
/// @param failure error that failed the path, null unless FAILED
public record PathResult(
        String pathId,
        String parentPathId,
        PathStatus status,
        String currentNode,
        int stepCount,
        List<HistoryEntry> history,
        Map<String, Integer> visitCounts,
        StateMachineException failure) {

    public PathResult {
        Objects.requireNonNull(pathId, "pathId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(currentNode, "currentNode must not be null");
        history = List.copyOf(history);
        visitCounts = Collections.unmodifiableMap(new LinkedHashMap<>(visitCounts));
    }

    public boolean isCompleted() {
        return status == PathStatus.COMPLETED;
    }
}
