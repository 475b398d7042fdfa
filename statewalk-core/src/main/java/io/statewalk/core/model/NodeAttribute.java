package io.statewalk.core.model;

import java.util.Objects;

/// A declared attribute of a node.
///
/// @param name attribute name, unique within its node, not null or blank
/// @param declaredType type annotation from the definition, may be null
/// @param value initial value, may be null (an attribute without a value is "not set")
public record NodeAttribute(String name, String declaredType, Object value) {

    /// Compact constructor with validation.
    public NodeAttribute {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /// Creates an untyped attribute.
    ///
    /// @param name attribute name, not null
    /// @param value value, may be null
    /// @return new attribute, never null
    public static NodeAttribute of(String name, Object value) {
        return new NodeAttribute(name, null, value);
    }

    /// Returns a copy of this attribute holding a different value.
    ///
    /// @param newValue the replacement value, may be null
    /// @return new attribute with the same name and declared type, never null
    public NodeAttribute withValue(Object newValue) {
        return new NodeAttribute(name, declaredType, newValue);
    }
}
