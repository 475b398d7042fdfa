package io.statewalk.core.graph;

import java.util.List;
import java.util.Objects;

/// Structural findings for a machine model.
///
/// Findings are warnings: a model with findings can still be executed.
///
/// @param title model title, not null
/// @param issues findings in a stable order, not null (may be empty)
public record ValidationReport(String title, List<Issue> issues) {

    public ValidationReport {
        Objects.requireNonNull(title, "title must not be null");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    /// Returns the findings of one type.
    ///
    /// @param type issue type, not null
    /// @return matching issues in report order, never null
    public List<Issue> issuesOf(IssueType type) {
        return issues.stream().filter(i -> i.type() == type).toList();
    }

    public enum IssueType {
        NO_ENTRY_POINTS,
        UNREACHABLE_NODE,
        ORPHANED_NODE,
        CYCLE
    }

    /// A single finding.
    ///
    /// @param type finding type, not null
    /// @param message human-readable description, not null
    /// @param nodes nodes involved, in a stable order
    public record Issue(IssueType type, String message, List<String> nodes) {

        public Issue {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(message, "message must not be null");
            nodes = nodes != null ? List.copyOf(nodes) : List.of();
        }
    }
}
