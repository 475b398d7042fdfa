package io.statewalk.core.context;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Access a node has to one context node.
///
/// Field sets restrict a granted permission to specific attributes; an empty set on a
/// granted permission means every attribute is covered.
///
/// @param context name of the context node, not null
/// @param canRead whether the node may read the context
/// @param canWrite whether the node may write the context
/// @param readFields attributes readable, empty for all (ignored when `canRead` is false)
/// @param writeFields attributes writable, empty for all (ignored when `canWrite` is false)
/// @param inherited true when read access comes only from nesting inside the context
public record ContextPermission(
        String context,
        boolean canRead,
        boolean canWrite,
        Set<String> readFields,
        Set<String> writeFields,
        boolean inherited) {

    public ContextPermission {
        Objects.requireNonNull(context, "context must not be null");
        readFields = readFields != null ? Set.copyOf(readFields) : Set.of();
        writeFields = writeFields != null ? Set.copyOf(writeFields) : Set.of();
    }

    /// Read-only permission inherited from an enclosing context.
    ///
    /// @param context context name, not null
    /// @return new permission, never null
    public static ContextPermission inheritedRead(String context) {
        return new ContextPermission(context, true, false, Set.of(), Set.of(), true);
    }

    /// Returns whether one attribute may be read.
    ///
    /// @param field attribute name, not null
    /// @return true if readable
    public boolean canReadField(String field) {
        return canRead && (readFields.isEmpty() || readFields.contains(field));
    }

    /// Returns whether one attribute may be written.
    ///
    /// @param field attribute name, not null
    /// @return true if writable
    public boolean canWriteField(String field) {
        return canWrite && (writeFields.isEmpty() || writeFields.contains(field));
    }

    /// Combines two grants on the same context.
    ///
    /// Each permission is the union of both sides. A field restriction survives only if both
    /// granting sides restrict it; an unrestricted grant always wins.
    ///
    /// @param other grant on the same context, not null
    /// @return combined permission, never null
    /// @throws IllegalArgumentException if the contexts differ
    public ContextPermission merge(ContextPermission other) {
        if (!context.equals(other.context)) {
            throw new IllegalArgumentException(
                    "Cannot merge permissions of '" + context + "' and '" + other.context + "'");
        }
        return new ContextPermission(
                context,
                canRead || other.canRead,
                canWrite || other.canWrite,
                mergeFields(canRead, readFields, other.canRead, other.readFields),
                mergeFields(canWrite, writeFields, other.canWrite, other.writeFields),
                inherited && other.inherited);
    }

    private static Set<String> mergeFields(
            boolean granted, Set<String> fields, boolean otherGranted, Set<String> otherFields) {
        if (!granted) {
            return otherFields;
        }
        if (!otherGranted) {
            return fields;
        }
        if (fields.isEmpty() || otherFields.isEmpty()) {
            return Set.of();
        }
        Set<String> union = new LinkedHashSet<>(fields);
        union.addAll(otherFields);
        return union;
    }
}
