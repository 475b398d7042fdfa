package io.statewalk.core.execution.result;

import io.statewalk.core.execution.ExecutionWarning;
import io.statewalk.core.execution.PathStatus;
import io.statewalk.core.execution.VisualizationSnapshot;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of an execution: every path's final state plus engine-wide totals.
///
/// The result always includes each path's status and full history, whether it
/// completed, failed or was cut off by a timeout or cancellation.
///
/// @param title model title, not null
/// @param paths path results in creation order, not null
/// @param warnings data warnings in the order raised, not null
/// @param totalSteps transitions applied across all paths
/// @param duration elapsed time on the engine clock, not null
/// @param snapshot final visualization snapshot, not null
public record ExecutionResult(
        String title,
        List<PathResult> paths,
        List<ExecutionWarning> warnings,
        int totalSteps,
        Duration duration,
        VisualizationSnapshot snapshot) {

    public ExecutionResult {
        Objects.requireNonNull(title, "title must not be null");
        paths = List.copyOf(paths);
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    /// Returns whether every path completed.
    ///
    /// @return `true` if no path failed
    public boolean isSuccessful() {
        return paths.stream().allMatch(PathResult::isCompleted);
    }

    public Optional<PathResult> path(String pathId) {
        return paths.stream().filter(p -> p.pathId().equals(pathId)).findFirst();
    }

    public List<PathResult> failedPaths() {
        return paths.stream().filter(p -> p.status() == PathStatus.FAILED).toList();
    }
}
