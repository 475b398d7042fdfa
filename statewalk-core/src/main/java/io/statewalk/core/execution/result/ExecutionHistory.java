package io.statewalk.core.execution.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordered record of the transitions a path has taken.
///
/// A forked path starts with a copy of its parent's history, so every path's history
/// reads as a complete walk from its entry point.
///
/// @implNote **Not thread-safe**. Owned by the execution loop. The `copy()` method
/// creates an independent history for forks and snapshots.
///
/// @see HistoryEntry for individual entries
public class ExecutionHistory {

    private final List<HistoryEntry> entries;

    /// Creates an empty history.
    public ExecutionHistory() {
        this.entries = new ArrayList<>();
    }

    private ExecutionHistory(List<HistoryEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    /// Creates a history from existing entries, e.g. when loading a stored result.
    ///
    /// @param entries entries in order, not null
    /// @return new history, never null
    public static ExecutionHistory of(List<HistoryEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        return new ExecutionHistory(entries);
    }

    /// Appends an entry.
    ///
    /// @apiNote **Side effects**: Modifies internal entry list
    ///
    /// @param entry the entry to record, not null
    public void add(HistoryEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /// Returns all recorded entries.
    ///
    /// @return immutable copy of the entries, never null
    public List<HistoryEntry> getEntries() {
        return List.copyOf(entries);
    }

    /// Returns the most recent entries.
    ///
    /// @param count maximum number of entries to return, not negative
    /// @return up to `count` entries, oldest first; never null
    public List<HistoryEntry> tail(int count) {
        int from = Math.max(0, entries.size() - count);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Creates an independent copy of this history.
    ///
    /// @return a new ExecutionHistory with copied entries, never null
    public ExecutionHistory copy() {
        return new ExecutionHistory(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionHistory other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ExecutionHistory" + entries;
    }
}
