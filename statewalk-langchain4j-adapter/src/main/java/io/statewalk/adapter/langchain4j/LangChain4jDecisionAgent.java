package io.statewalk.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.agent.DecisionAgent;
import io.statewalk.core.exception.AgentUnavailableException;
import io.statewalk.core.exception.InvalidToolCallException;
import io.statewalk.core.tool.ToolDefinition;
import io.statewalk.core.tool.ToolDefinition.ToolParameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link DecisionAgent}.
///
/// Each request becomes one chat call: a system message with the agent instructions and the
/// tool protocol, a user message with the rendered decision context, and one
/// {@link ToolSpecification} per offered tool. The first tool call in the model's answer is
/// returned as the agent's choice.
///
/// ### Answer mapping
/// - **Tool call**: tool name plus JSON arguments parsed into a map; the answer text becomes
///   the reasoning
/// - **Text only**: returned as a call to {@value #NO_TOOL_CALL}, which the engine rejects as
///   an invalid call and reports back on the next turn
/// - **Malformed arguments**: {@link InvalidToolCallException}
/// - **Transport failure**: {@link AgentUnavailableException} with the model error as cause
///
/// @implNote Thread-safe when the wrapped model is. Every request is answered from its own
/// context; earlier turns of the same decision reach the model through the rendered
/// `previousCalls` section, not through a conversation buffer.
///
/// @see LangChain4jProvider for agent creation
public class LangChain4jDecisionAgent implements DecisionAgent {

    private static final Logger logger = Logger.getLogger(LangChain4jDecisionAgent.class.getName());

    static final String NO_TOOL_CALL = "no_tool_call";

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private static final String PROTOCOL =
            "You steer a state machine. At every decision point you must answer with exactly one"
                    + " tool call. Transition tools move to the next node; read and write tools"
                    + " inspect or change shared context; definition tools change the machine"
                    + " itself. Prefer a transition once you have what you need.";

    private final String id;
    private final AgentConfig config;
    private final ChatModel model;
    private final ObjectMapper mapper;

    /// Creates a new agent wrapping the given chat model.
    ///
    /// @param id agent identifier, not null
    /// @param config agent configuration (model name, instructions), not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jDecisionAgent(String id, AgentConfig config, ChatModel model) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public String getId() {
        return id;
    }

    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public AgentResponse decide(AgentRequest request) {
        logger.fine(
                "Agent '"
                        + id
                        + "' deciding "
                        + request.requestId()
                        + " with "
                        + request.tools().size()
                        + " tools");

        ChatRequest chatRequest =
                ChatRequest.builder()
                        .messages(buildMessages(request))
                        .toolSpecifications(toSpecifications(request.tools()))
                        .build();

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException e) {
            logger.warning("Agent '" + id + "' model call failed: " + e.getMessage());
            throw new AgentUnavailableException(
                    "Model " + config.getModel() + " failed on " + request.requestId() + ": " + e.getMessage(),
                    e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new AgentUnavailableException(
                    "No response from model " + config.getModel() + " for " + request.requestId());
        }

        AiMessage answer = response.aiMessage();
        if (!answer.hasToolExecutionRequests()) {
            logger.fine("Agent '" + id + "' answered " + request.requestId() + " without a tool call");
            return AgentResponse.call(request.requestId(), NO_TOOL_CALL, answer.text());
        }

        List<ToolExecutionRequest> calls = answer.toolExecutionRequests();
        if (calls.size() > 1) {
            logger.fine(
                    "Agent '"
                            + id
                            + "' returned "
                            + calls.size()
                            + " tool calls for "
                            + request.requestId()
                            + "; using the first");
        }
        ToolExecutionRequest call = calls.get(0);
        return new AgentResponse(
                request.requestId(), call.name(), parseArguments(call), answer.text());
    }

    /// Builds the message list: system instructions, then the rendered context.
    private List<ChatMessage> buildMessages(AgentRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        String instructions = config.getInstructions();
        messages.add(
                SystemMessage.from(
                        instructions != null && !instructions.isBlank()
                                ? instructions + "\n\n" + PROTOCOL
                                : PROTOCOL));
        messages.add(UserMessage.from(request.context().render()));
        return messages;
    }

    /// Maps offered tools to LangChain4j tool specifications, keeping their order.
    ///
    /// @param tools offered tools, not null
    /// @return specifications, never null
    static List<ToolSpecification> toSpecifications(List<ToolDefinition> tools) {
        List<ToolSpecification> specifications = new ArrayList<>(tools.size());
        for (ToolDefinition tool : tools) {
            JsonObjectSchema.Builder parameters = JsonObjectSchema.builder();
            for (ToolParameter parameter : tool.parameters()) {
                switch (parameter.type()) {
                    case NUMBER -> parameters.addNumberProperty(parameter.name(), parameter.description());
                    case BOOLEAN -> parameters.addBooleanProperty(parameter.name(), parameter.description());
                    case OBJECT ->
                            parameters.addProperty(
                                    parameter.name(),
                                    JsonObjectSchema.builder()
                                            .description(parameter.description())
                                            .additionalProperties(true)
                                            .build());
                    case ARRAY ->
                            parameters.addProperty(
                                    parameter.name(),
                                    JsonArraySchema.builder()
                                            .description(parameter.description())
                                            .items(JsonStringSchema.builder().build())
                                            .build());
                    default -> parameters.addStringProperty(parameter.name(), parameter.description());
                }
            }
            parameters.required(tool.requiredParameterNames());
            specifications.add(
                    ToolSpecification.builder()
                            .name(tool.name())
                            .description(tool.description())
                            .parameters(parameters.build())
                            .build());
        }
        return specifications;
    }

    private Map<String, Object> parseArguments(ToolExecutionRequest call) {
        String arguments = call.arguments();
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = mapper.readValue(arguments, ARGUMENTS);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new InvalidToolCallException(
                    "Malformed arguments for tool '" + call.name() + "': " + e.getOriginalMessage(), e);
        }
    }
}
