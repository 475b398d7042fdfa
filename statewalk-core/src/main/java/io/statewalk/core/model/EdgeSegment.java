package io.statewalk.core.model;

import java.util.Objects;

/// One target of an edge. An edge with several segments forks when taken.
///
/// @param target name of the target node, not null
/// @param endType arrow flavour, not null
public record EdgeSegment(String target, EdgeEndType endType) {

    /// Compact constructor with validation.
    public EdgeSegment {
        Objects.requireNonNull(target, "target must not be null");
        endType = endType != null ? endType : EdgeEndType.PLAIN;
    }

    /// Creates a plain segment.
    ///
    /// @param target target node name, not null
    /// @return new segment, never null
    public static EdgeSegment to(String target) {
        return new EdgeSegment(target, EdgeEndType.PLAIN);
    }
}
