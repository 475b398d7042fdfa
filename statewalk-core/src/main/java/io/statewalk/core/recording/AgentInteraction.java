package io.statewalk.core.recording;

import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import java.util.Objects;

/// One recorded request/response pair.
///
/// @param request the request sent to the agent, not null
/// @param response the agent's answer, not null
public record AgentInteraction(AgentRequest request, AgentResponse response) {

    public AgentInteraction {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(response, "response must not be null");
    }

    public String requestId() {
        return request.requestId();
    }
}
