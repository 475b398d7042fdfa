package io.statewalk.core.recording;

import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.exception.AgentUnavailableException;
import java.util.Objects;
import java.util.logging.Logger;

/// Agent that answers from a recording instead of a model.
///
/// ### Contracts
/// - **Precondition**: the recording was made with the same model and limits
/// - **Postcondition**: returns the recorded response for the request id, or throws
///   {@link AgentUnavailableException} when nothing was recorded for it
///
/// @see RecordingDecisionAgent
public class PlaybackDecisionAgent implements DecisionAgent {

    private static final Logger logger = Logger.getLogger(PlaybackDecisionAgent.class.getName());

    private final RecordingStore store;

    public PlaybackDecisionAgent(RecordingStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public String getId() {
        return "playback";
    }

    @Override
    public AgentResponse decide(AgentRequest request) {
        AgentInteraction interaction =
                store.find(request.requestId())
                        .orElseThrow(
                                () ->
                                        new AgentUnavailableException(
                                                "No recording for request " + request.requestId()));
        logger.fine("Replaying " + request.requestId() + " -> " + interaction.response().toolName());
        return interaction.response();
    }
}
