package io.statewalk.core.recording;

import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import java.util.Objects;
import java.util.logging.Logger;

/// Decorator that records every request/response pair of a delegate agent.
///
/// Failed calls are not recorded; the delegate's exception propagates unchanged.
///
/// @see PlaybackDecisionAgent for replaying the recording
public class RecordingDecisionAgent implements DecisionAgent {

    private static final Logger logger = Logger.getLogger(RecordingDecisionAgent.class.getName());

    private final DecisionAgent delegate;
    private final RecordingStore store;

    /// Creates a recording decorator.
    ///
    /// @param delegate agent that answers requests, not null
    /// @param store where interactions are saved, not null
    public RecordingDecisionAgent(DecisionAgent delegate, RecordingStore store) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public String getId() {
        return "recording(" + delegate.getId() + ")";
    }

    @Override
    public AgentResponse decide(AgentRequest request) {
        AgentResponse response = delegate.decide(request);
        store.save(new AgentInteraction(request, response));
        logger.fine("Recorded " + request.requestId() + " -> " + response.toolName());
        return response;
    }
}
