package io.statewalk.core.model;

import java.util.List;

/// A `reads:` or `writes:` marker on an edge.
///
/// @param fields attribute names the marker covers; empty means every attribute
public record AccessMarker(List<String> fields) {

    /// Marker covering every attribute of the context.
    public static final AccessMarker ALL = new AccessMarker(List.of());

    /// Compact constructor with defensive copying.
    public AccessMarker {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    /// Creates a marker restricted to the given fields.
    ///
    /// @param fields attribute names, not null
    /// @return new marker, never null
    public static AccessMarker of(String... fields) {
        return new AccessMarker(List.of(fields));
    }

    public boolean isUnrestricted() {
        return fields.isEmpty();
    }
}
