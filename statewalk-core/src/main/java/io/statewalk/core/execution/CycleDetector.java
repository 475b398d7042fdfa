package io.statewalk.core.execution;

import java.util.List;
import java.util.Optional;

/// Detects a path repeating the same sequence of visits.
///
/// For each block length `L` from 2 to `window / 2`, the last `L` visits are compared
/// with the `L` visits before them. A match means the path has made no progress over a
/// full round and would repeat it forever.
///
/// A self-loop without state change is reported once four identical visits are recorded.
final class CycleDetector {

    private CycleDetector() {}

    /// Looks for a repeated block at the end of `visits`.
    ///
    /// @param visits visits in order, not null
    /// @param window number of recent visits inspected, 0 disables detection
    /// @return the repeated block, oldest first, or empty
    static Optional<List<VisitRecord>> detect(List<VisitRecord> visits, int window) {
        int size = visits.size();
        for (int length = 2; length <= window / 2 && 2 * length <= size; length++) {
            List<VisitRecord> last = visits.subList(size - length, size);
            List<VisitRecord> before = visits.subList(size - 2 * length, size - length);
            if (last.equals(before)) {
                return Optional.of(List.copyOf(last));
            }
        }
        return Optional.empty();
    }
}
