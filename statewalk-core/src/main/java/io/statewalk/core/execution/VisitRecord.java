package io.statewalk.core.execution;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// One arrival of a path at a node, with the attribute values the node's logic depends on.
///
/// Two visits are equal when they reached the same node and observed the same values;
/// unset attributes are recorded as `null`.
///
/// @param node visited node, not null
/// @param observed qualified attribute path to value, not null
public record VisitRecord(String node, Map<String, Object> observed) {

    public VisitRecord {
        Objects.requireNonNull(node, "node must not be null");
        observed =
                observed != null
                        ? Collections.unmodifiableMap(new TreeMap<>(observed))
                        : Map.of();
    }

    @Override
    public String toString() {
        return node;
    }
}
