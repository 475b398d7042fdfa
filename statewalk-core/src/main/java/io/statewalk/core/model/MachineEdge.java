package io.statewalk.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable edge of a machine model.
///
/// An edge leaves one `source` and reaches one or more targets through its segments.
/// Segments pointing at context nodes make the edge an access edge; every other segment
/// is a transition target.
///
/// ### Contracts
/// - **Precondition**: `source` not null, at least one segment
/// - **Postcondition**: All fields immutable after construction
///
/// @param source source node name, not null
/// @param segments ordered targets, not null or empty
/// @param label display label, may be null
/// @param condition boolean guard expression, may be null
/// @param priority explicit priority, higher wins, may be null
/// @param reads `reads:` marker, null when absent
/// @param writes `writes:` marker, null when absent
/// @param automatic whether the edge may be taken without an agent
/// @param index position of the edge in declaration order
/// @see MachineModel
public record MachineEdge(
        String source,
        List<EdgeSegment> segments,
        String label,
        String condition,
        Integer priority,
        AccessMarker reads,
        AccessMarker writes,
        boolean automatic,
        int index) {

    /// Compact constructor with validation.
    public MachineEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("edge from '" + source + "' has no targets");
        }
        segments = List.copyOf(segments);
        if (condition != null && condition.isBlank()) {
            condition = null;
        }
    }

    /// Creates a new builder.
    ///
    /// @param source source node name, not null
    /// @return a new builder, never null
    public static Builder from(String source) {
        return new Builder(source);
    }

    /// Returns whether the edge carries a guard condition.
    ///
    /// @return true if a non-blank condition is present
    public boolean isConditional() {
        return condition != null;
    }

    /// Returns the effective priority, treating a missing priority as zero.
    ///
    /// @return explicit priority or 0
    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    /// Returns the target names of all segments in declaration order.
    ///
    /// @return target names, never null
    public List<String> targets() {
        return segments.stream().map(EdgeSegment::target).toList();
    }

    /// Returns a copy of this edge with its index replaced.
    ///
    /// @param newIndex declaration index
    /// @return re-indexed copy, never null
    public MachineEdge withIndex(int newIndex) {
        return new MachineEdge(
                source, segments, label, condition, priority, reads, writes, automatic, newIndex);
    }

    /// Returns a copy with mutable, non-structural properties replaced.
    ///
    /// @param newLabel replacement label, may be null
    /// @param newCondition replacement condition, may be null
    /// @param newPriority replacement priority, may be null
    /// @return updated copy, never null
    public MachineEdge withDecoration(String newLabel, String newCondition, Integer newPriority) {
        return new MachineEdge(
                source, segments, newLabel, newCondition, newPriority, reads, writes, automatic, index);
    }

    /// Builder for {@link MachineEdge}.
    public static final class Builder {
        private final String source;
        private final List<EdgeSegment> segments = new ArrayList<>();
        private String label;
        private String condition;
        private Integer priority;
        private AccessMarker reads;
        private AccessMarker writes;
        private boolean automatic;

        private Builder(String source) {
            this.source = source;
        }

        public Builder to(String target) {
            segments.add(EdgeSegment.to(target));
            return this;
        }

        public Builder to(String target, EdgeEndType endType) {
            segments.add(new EdgeSegment(target, endType));
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder reads(AccessMarker reads) {
            this.reads = reads;
            return this;
        }

        public Builder writes(AccessMarker writes) {
            this.writes = writes;
            return this;
        }

        public Builder automatic(boolean automatic) {
            this.automatic = automatic;
            return this;
        }

        /// Builds the edge. The declaration index is assigned by the model builder.
        ///
        /// @return new edge, never null
        /// @throws IllegalArgumentException if no target was added
        public MachineEdge build() {
            return new MachineEdge(
                    source, segments, label, condition, priority, reads, writes, automatic, -1);
        }
    }
}
