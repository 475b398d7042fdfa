package io.statewalk.core.agent.stub;

import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.tool.ToolCatalogue;
import io.statewalk.core.tool.ToolDefinition;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Testing agent that answers without calling an external model.
///
/// ### Choice Resolution Order
/// 1. A preference registered for the node with {@link #prefer(String, String)}, when the
///    preferred tool is offered
/// 2. The first offered transition tool
/// 3. The first offered tool of any kind
///
/// @implNote Thread-safe. Preferences are held in a concurrent map.
///
/// @see StubDecisionAgentProvider for enabling stub mode
public class StubDecisionAgent implements DecisionAgent {

    private static final Logger logger = Logger.getLogger(StubDecisionAgent.class.getName());

    private final String id;
    private final Map<String, String> preferences = new ConcurrentHashMap<>();

    public StubDecisionAgent(String id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String getId() {
        return id;
    }

    /// Registers the tool to call whenever the given node asks for a decision.
    ///
    /// A bare node name is accepted as shorthand for its transition tool.
    ///
    /// @param nodeName deciding node, not null
    /// @param toolOrTarget tool name or transition target, not null
    /// @return this agent for chaining
    public StubDecisionAgent prefer(String nodeName, String toolOrTarget) {
        preferences.put(nodeName, toolOrTarget);
        return this;
    }

    @Override
    public AgentResponse decide(AgentRequest request) {
        String preferred = preferences.get(request.nodeName());
        String chosen = null;
        if (preferred != null) {
            chosen = find(request, preferred);
            if (chosen == null) {
                chosen =
                        find(
                                request,
                                ToolCatalogue.TRANSITION_PREFIX + ToolCatalogue.toolFragment(preferred));
            }
        }
        if (chosen == null) {
            chosen =
                    request.tools().stream()
                            .map(ToolDefinition::name)
                            .filter(name -> name.startsWith(ToolCatalogue.TRANSITION_PREFIX))
                            .findFirst()
                            .orElse(null);
        }
        if (chosen == null && !request.tools().isEmpty()) {
            chosen = request.tools().get(0).name();
        }
        if (chosen == null) {
            throw new IllegalStateException("Request " + request.requestId() + " offers no tools");
        }

        logger.info("[STUB] Agent '" + id + "' chose " + chosen + " at " + request.nodeName());
        return AgentResponse.call(request.requestId(), chosen, "stub choice");
    }

    private static String find(AgentRequest request, String toolName) {
        return request.tools().stream()
                .map(ToolDefinition::name)
                .filter(toolName::equals)
                .findFirst()
                .orElse(null);
    }
}
