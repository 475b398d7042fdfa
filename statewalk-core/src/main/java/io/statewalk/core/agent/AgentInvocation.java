package io.statewalk.core.agent;

import io.statewalk.core.tool.ToolCatalogue;
import java.util.Objects;

/// Context and catalogue built for one agent turn.
///
/// @param context situation description, not null
/// @param catalogue tools offered, not null
public record AgentInvocation(AgentContext context, ToolCatalogue catalogue) {

    public AgentInvocation {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(catalogue, "catalogue must not be null");
    }

    /// Creates the request to send for this invocation.
    ///
    /// @param requestId pairing id, not null
    /// @param pathId waiting path, not null
    /// @return new request, never null
    public AgentRequest toRequest(String requestId, String pathId) {
        return new AgentRequest(
                requestId, pathId, context.nodeName(), context, catalogue.definitions());
    }
}
