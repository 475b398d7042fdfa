package io.statewalk.core.recording;

import java.util.List;
import java.util.Optional;

/// Storage for recorded agent interactions, keyed by request id.
///
/// Request ids are deterministic (`<pathId>:<node>:<step>:<turn>`), so a replay of the
/// same model with the same limits asks for the same ids in the same order.
///
/// @implNote Implementations must be thread-safe; recording agents may be called from
/// an agent worker pool.
///
/// @see InMemoryRecordingStore
public interface RecordingStore {

    /// Saves an interaction, replacing any earlier one with the same request id.
    ///
    /// @param interaction interaction to save, not null
    void save(AgentInteraction interaction);

    /// Finds the interaction recorded for a request.
    ///
    /// @param requestId request id, not null
    /// @return the interaction, or empty if none was recorded
    Optional<AgentInteraction> find(String requestId);

    /// Lists the recorded request ids in recording order.
    ///
    /// @return request ids, never null
    List<String> listRequestIds();
}
