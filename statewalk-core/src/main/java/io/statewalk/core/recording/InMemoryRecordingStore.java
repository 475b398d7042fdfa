package io.statewalk.core.recording;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Recording store backed by an insertion-ordered map.
public class InMemoryRecordingStore implements RecordingStore {

    private final Map<String, AgentInteraction> interactions = new LinkedHashMap<>();

    @Override
    public synchronized void save(AgentInteraction interaction) {
        Objects.requireNonNull(interaction, "interaction must not be null");
        interactions.put(interaction.requestId(), interaction);
    }

    @Override
    public synchronized Optional<AgentInteraction> find(String requestId) {
        return Optional.ofNullable(interactions.get(requestId));
    }

    @Override
    public synchronized List<String> listRequestIds() {
        return new ArrayList<>(interactions.keySet());
    }

    public synchronized int size() {
        return interactions.size();
    }
}
