package io.statewalk.core.execution.result;

import java.time.Instant;
import java.util.Objects;

/// One applied transition of a path.
///
/// ### Contracts
/// - **Precondition**: `pathId`, `from`, `to`, `timestamp` and `source` must not be null
/// - **Postcondition**: Immutable after construction
///
/// @param step engine-wide step number of the transition, starting at 1
/// @param pathId path the transition was applied to, not null
/// @param from node the path left, not null
/// @param to node the path landed on, not null
/// @param transitionLabel edge label, may be null
/// @param timestamp when the transition was applied, from the engine clock, not null
/// @param reason why the transition was taken, may be null
/// @param source what selected the transition, not null
/// @param edgeIndex declaration index of the edge taken
public record HistoryEntry(
        int step,
        String pathId,
        String from,
        String to,
        String transitionLabel,
        Instant timestamp,
        String reason,
        TransitionSource source,
        int edgeIndex) {

    /// Compact constructor with validation.
    public HistoryEntry {
        Objects.requireNonNull(pathId, "pathId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return from + " -> " + to + (transitionLabel != null ? " [" + transitionLabel + "]" : "");
    }
}
