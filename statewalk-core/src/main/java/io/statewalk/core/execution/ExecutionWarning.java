package io.statewalk.core.execution;

import io.statewalk.core.transition.ConditionWarning;
import java.util.Objects;

/// A data warning raised while a path was evaluated.
///
/// @param pathId path being evaluated, not null
/// @param warning the condition warning, not null
public record ExecutionWarning(String pathId, ConditionWarning warning) {

    public ExecutionWarning {
        Objects.requireNonNull(pathId, "pathId must not be null");
        Objects.requireNonNull(warning, "warning must not be null");
    }

    public String message() {
        return "[" + pathId + "] " + warning.message();
    }
}
