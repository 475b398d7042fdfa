package io.statewalk.core.context;

import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Attribute values shared by every path of one execution.
///
/// Keys are qualified attribute paths of the form `node.attribute`. The store is seeded
/// from the attribute values declared in the model; afterwards it changes only through
/// context writes and definition updates applied by the dispatcher.
///
/// ### Contracts
/// - **Invariant**: `null` is never stored; writing `null` unsets the attribute
/// - **Invariant**: {@link #revision()} increases with every effective mutation
///
/// @implNote **Not thread-safe**. The execution loop is the only writer and reader, so
/// no locking is needed.
public class SharedAttributeStore {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private long revision;

    /// Creates an empty store.
    public SharedAttributeStore() {}

    /// Creates a store seeded with the declared attribute values of a model.
    ///
    /// @param model the model to seed from, not null
    /// @return new store, never null
    public static SharedAttributeStore seededFrom(MachineModel model) {
        Objects.requireNonNull(model, "model must not be null");
        SharedAttributeStore store = new SharedAttributeStore();
        for (MachineNode node : model.nodes()) {
            for (NodeAttribute attribute : node.attributes()) {
                if (attribute.value() != null) {
                    store.values.put(qualify(node.name(), attribute.name()), attribute.value());
                }
            }
        }
        return store;
    }

    /// Builds a qualified attribute path.
    ///
    /// @param node node name, not null
    /// @param attribute attribute name, not null
    /// @return `node.attribute`
    public static String qualify(String node, String attribute) {
        return node + "." + attribute;
    }

    public Optional<Object> get(String path) {
        return Optional.ofNullable(values.get(path));
    }

    public Optional<Object> get(String node, String attribute) {
        return get(qualify(node, attribute));
    }

    public boolean contains(String path) {
        return values.containsKey(path);
    }

    /// Sets one attribute.
    ///
    /// @apiNote **Side effects**: Modifies the store and bumps the revision when the
    /// value changes
    ///
    /// @param node node name, not null
    /// @param attribute attribute name, not null
    /// @param value new value; null unsets the attribute
    public void put(String node, String attribute, Object value) {
        String path = qualify(node, attribute);
        Object previous = value == null ? values.remove(path) : values.put(path, value);
        if (!Objects.equals(previous, value)) {
            revision++;
        }
    }

    /// Sets several attributes of one node in a single update.
    ///
    /// @apiNote **Side effects**: Modifies the store
    ///
    /// @param node node name, not null
    /// @param updates attribute values keyed by attribute name, not null
    public void putAll(String node, Map<String, ?> updates) {
        Objects.requireNonNull(updates, "updates must not be null");
        updates.forEach((attribute, value) -> put(node, attribute, value));
    }

    /// Returns the current values of one node's attributes.
    ///
    /// @param node node name, not null
    /// @return values keyed by attribute name, in insertion order; never null
    public Map<String, Object> valuesOf(String node) {
        String prefix = node + ".";
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach(
                (path, value) -> {
                    if (path.startsWith(prefix)) {
                        result.put(path.substring(prefix.length()), value);
                    }
                });
        return Collections.unmodifiableMap(result);
    }

    /// Returns a copy of every stored value.
    ///
    /// @return qualified paths to values, never null
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public long revision() {
        return revision;
    }
}
