package io.statewalk.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.statewalk.core.agent.AgentConfig;
import io.statewalk.core.agent.AgentContext;
import io.statewalk.core.agent.AgentRequest;
import io.statewalk.core.agent.AgentResponse;
import io.statewalk.core.exception.AgentUnavailableException;
import io.statewalk.core.exception.InvalidToolCallException;
import io.statewalk.core.execution.ExecutionEngine;
import io.statewalk.core.execution.result.ExecutionResult;
import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.MachineNode;
import io.statewalk.core.model.NodeAttribute;
import io.statewalk.core.model.NodeKind;
import io.statewalk.core.tool.ToolDefinition;
import io.statewalk.core.tool.ToolDefinition.ParameterType;
import io.statewalk.core.tool.ToolDefinition.ToolParameter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jDecisionAgentTest {

    @Mock private ChatModel model;

    private LangChain4jDecisionAgent agent;

    @BeforeEach
    void setUp() {
        AgentConfig config =
                AgentConfig.builder()
                        .id("reviewer")
                        .model("claude-sonnet-4")
                        .instructions("You review release drafts.")
                        .build();
        agent = new LangChain4jDecisionAgent("reviewer", config, model);
    }

    private static AgentRequest request() {
        AgentContext context =
                new AgentContext(
                        "review", NodeKind.STATE, null, null, "Approve or reject", null, null, null, null,
                        false, "Node 'review' carries a prompt", null);
        List<ToolDefinition> tools =
                List.of(
                        new ToolDefinition(
                                "transition_to_done",
                                "Approve and finish",
                                List.of(ToolParameter.optional("reason", ParameterType.STRING, "Why"))),
                        new ToolDefinition(
                                "write_results",
                                "Write results",
                                List.of(
                                        ToolParameter.required(
                                                "data", ParameterType.OBJECT, "Attribute values to set"))),
                        new ToolDefinition(
                                "read_results",
                                "Read results",
                                List.of(ToolParameter.optional("fields", ParameterType.ARRAY, "Fields"))));
        return new AgentRequest("path-1:review:1:0", "path-1", "review", context, tools);
    }

    private static ChatResponse toolCall(String text, String tool, String arguments) {
        ToolExecutionRequest call =
                ToolExecutionRequest.builder().id("call-1").name(tool).arguments(arguments).build();
        return ChatResponse.builder().aiMessage(AiMessage.from(text, List.of(call))).build();
    }

    @Nested
    class RequestMapping {

        @Test
        void shouldSendContextAndToolSpecifications() {
            // Given
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(toolCall("ok", "transition_to_done", "{}"));
            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);

            // When
            agent.decide(request());

            // Then
            verify(model).chat(captor.capture());
            ChatRequest sent = captor.getValue();
            assertThat(sent.messages()).hasSize(2);
            assertThat(((SystemMessage) sent.messages().get(0)).text())
                    .startsWith("You review release drafts.");
            assertThat(((UserMessage) sent.messages().get(1)).singleText())
                    .contains("Approve or reject");
            assertThat(sent.toolSpecifications())
                    .extracting(ToolSpecification::name)
                    .containsExactly("transition_to_done", "write_results", "read_results");
        }

        @Test
        void shouldMapParameterTypesAndRequiredNames() {
            List<ToolSpecification> specifications =
                    LangChain4jDecisionAgent.toSpecifications(request().tools());

            JsonObjectSchema write = specifications.get(1).parameters();
            assertThat(write.required()).containsExactly("data");
            assertThat(write.properties().get("data")).isInstanceOf(JsonObjectSchema.class);

            JsonObjectSchema read = specifications.get(2).parameters();
            assertThat(read.required()).isEmpty();
            assertThat(read.properties().get("fields")).isInstanceOf(JsonArraySchema.class);
        }
    }

    @Nested
    class ResponseMapping {

        @Test
        void shouldReturnToolCallWithParsedArguments() {
            // Given
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(toolCall("Scoring first", "write_results", "{\"data\":{\"score\":9}}"));

            // When
            AgentResponse response = agent.decide(request());

            // Then
            assertThat(response.requestId()).isEqualTo("path-1:review:1:0");
            assertThat(response.toolName()).isEqualTo("write_results");
            assertThat(response.arguments()).containsEntry("data", Map.of("score", 9));
            assertThat(response.reasoning()).isEqualTo("Scoring first");
        }

        @Test
        void shouldTurnTextAnswerIntoRejectedCall() {
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("I would approve")).build());

            AgentResponse response = agent.decide(request());

            assertThat(response.toolName()).isEqualTo(LangChain4jDecisionAgent.NO_TOOL_CALL);
            assertThat(response.reasoning()).isEqualTo("I would approve");
        }

        @Test
        void shouldRejectMalformedArguments() {
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(toolCall(null, "write_results", "{\"data\": "));

            assertThatThrownBy(() -> agent.decide(request()))
                    .isInstanceOf(InvalidToolCallException.class)
                    .hasMessageContaining("Malformed arguments for tool 'write_results'");
        }

        @Test
        void shouldReportTransportFailureAsUnavailable() {
            when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("connection reset"));

            assertThatThrownBy(() -> agent.decide(request()))
                    .isInstanceOf(AgentUnavailableException.class)
                    .hasMessageContaining("connection reset")
                    .hasCauseInstanceOf(RuntimeException.class);
        }
    }

    @Test
    void shouldDriveEngineToCompletion() {
        // Given
        MachineModel machine =
                MachineModel.builder("release")
                        .node(MachineNode.of("start", NodeKind.INIT))
                        .node(
                                new MachineNode(
                                        "review",
                                        NodeKind.STATE,
                                        null,
                                        List.of(NodeAttribute.of(MachineNode.PROMPT_ATTRIBUTE, "Approve?")),
                                        Set.of()))
                        .node(MachineNode.of("published", NodeKind.STATE))
                        .node(MachineNode.of("rejected", NodeKind.STATE))
                        .edge(MachineEdge.from("start").to("review").build())
                        .edge(MachineEdge.from("review").to("published").build())
                        .edge(MachineEdge.from("review").to("rejected").build())
                        .build();
        when(model.chat(any(ChatRequest.class)))
                .thenReturn(toolCall("Looks fine", "transition_to_published", "{\"reason\":\"approved\"}"));

        // When
        ExecutionResult result = ExecutionEngine.builder(machine).agent(agent).build().run();

        // Then
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.paths().get(0).currentNode()).isEqualTo("published");
        assertThat(result.paths().get(0).history().get(1).reason()).isEqualTo("approved");
    }
}
