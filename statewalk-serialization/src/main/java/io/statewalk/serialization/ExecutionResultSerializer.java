package io.statewalk.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.statewalk.core.execution.VisualizationSnapshot;
import io.statewalk.core.execution.result.ExecutionResult;
import io.statewalk.core.execution.result.HistoryEntry;
import java.util.List;
import java.util.Objects;

/// Writes execution results, path histories and visualization snapshots as JSON.
///
/// Results are written only: failures are reduced to `{type, kind, category, message}` and
/// cannot be turned back into exceptions. Histories round-trip, so a stored history can be
/// compared with the history of a replay.
///
/// @see StatewalkJacksonModule
public final class ExecutionResultSerializer {

    private static final TypeReference<List<HistoryEntry>> HISTORY = new TypeReference<>() {};

    private ExecutionResultSerializer() {}

    /// Serializes a full result: paths with histories, warnings, totals and final snapshot.
    ///
    /// @param result the result, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return MachineModelSerializer.createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution result: " + e.getMessage(), e);
        }
    }

    /// Serializes a snapshot for a visualization feed.
    ///
    /// @param snapshot the snapshot, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(VisualizationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            return MachineModelSerializer.createMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize snapshot: " + e.getMessage(), e);
        }
    }

    public static String historyToJson(List<HistoryEntry> history) {
        Objects.requireNonNull(history, "history must not be null");
        try {
            return MachineModelSerializer.createMapper().writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize history: " + e.getMessage(), e);
        }
    }

    public static List<HistoryEntry> historyFromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return List.copyOf(MachineModelSerializer.createMapper().readValue(json, HISTORY));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize history: " + e.getMessage(), e);
        }
    }
}
