package io.statewalk.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// Default thread-safe, append-only implementation of {@link ToolRegistry}.
///
/// @implNote Thread-safe. Registration order is kept in a copy-on-write list, lookup goes
/// through a concurrent map; registrations are rare compared to catalogue reads.
public final class SessionToolRegistry implements ToolRegistry {

    private final Map<String, ConstructedTool> byName = new ConcurrentHashMap<>();
    private final List<ConstructedTool> ordered = new CopyOnWriteArrayList<>();

    @Override
    public synchronized ConstructedTool register(
            ToolDefinition definition, ToolStrategy strategy, String details, String constructedBy) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (byName.containsKey(definition.name())) {
            throw new IllegalArgumentException(
                    "Tool '" + definition.name() + "' already exists");
        }
        ConstructedTool tool =
                new ConstructedTool(definition, strategy, details, constructedBy, ordered.size() + 1);
        byName.put(tool.name(), tool);
        ordered.add(tool);
        return tool;
    }

    @Override
    public Optional<ConstructedTool> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public List<ConstructedTool> all() {
        return List.copyOf(ordered);
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return byName.containsKey(name);
    }

    @Override
    public int size() {
        return ordered.size();
    }
}
