package io.statewalk.core.agent;

import io.statewalk.core.tool.ToolDefinition;
import java.util.List;
import java.util.Objects;

/// A decision request sent to an agent.
///
/// The request id is deterministic (`<pathId>:<node>:<step>:<turn>`), so a recorded
/// response can be matched to the same request when an execution is replayed.
///
/// @param requestId opaque pairing id, not null
/// @param pathId path waiting for the decision, not null
/// @param nodeName node the path is at, not null
/// @param context structured description of the situation, not null
/// @param tools tools the agent may call, in offer order, not null
public record AgentRequest(
        String requestId, String pathId, String nodeName, AgentContext context, List<ToolDefinition> tools) {

    public AgentRequest {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(pathId, "pathId must not be null");
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(context, "context must not be null");
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    /// Builds the deterministic request id.
    ///
    /// @param pathId path id, not null
    /// @param nodeName node name, not null
    /// @param step engine step count when the decision started
    /// @param turn tool call number within the decision, starting at 0
    /// @return request id, never null
    public static String requestId(String pathId, String nodeName, int step, int turn) {
        return pathId + ":" + nodeName + ":" + step + ":" + turn;
    }
}
