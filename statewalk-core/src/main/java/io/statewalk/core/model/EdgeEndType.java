package io.statewalk.core.model;

import java.util.Locale;

/// Closed set of edge end types.
///
/// End types carry the semantic flavour of an arrow in the source definition. The
/// engine treats every end type as traversable; the type is kept for reporting and
/// round-tripping.
public enum EdgeEndType {
    PLAIN("->"),
    DEPENDENCY("-->"),
    CAUSAL("=>"),
    INHERITANCE("<|--"),
    COMPOSITION("*-->"),
    AGGREGATION("o-->"),
    BIDIRECTIONAL("<-->");

    private final String arrow;

    EdgeEndType(String arrow) {
        this.arrow = arrow;
    }

    /// Returns the arrow notation for this end type.
    ///
    /// @return arrow string, never null
    public String arrow() {
        return arrow;
    }

    /// Resolves an end type from its enum name or its arrow notation.
    ///
    /// @param value enum name (any case) or arrow, may be null
    /// @return the matching end type, {@link #PLAIN} when null or unknown
    public static EdgeEndType fromName(String value) {
        if (value == null || value.isBlank()) {
            return PLAIN;
        }
        String trimmed = value.trim();
        for (EdgeEndType type : values()) {
            if (type.arrow.equals(trimmed) || type.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        return PLAIN;
    }
}
