package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.domain.model.LlmRequest;
import me.golemcore.runtime.domain.model.LlmResponse;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private RuntimeProperties properties;
    private ChatModel chatModel;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getLlm().setModel("gpt-test");
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jAdapter(properties, RuntimeConfiguration.objectMapper(), chatModel);
    }

    @Test
    void availabilityFollowsApiKey() {
        Langchain4jAdapter unconfigured = new Langchain4jAdapter(properties, RuntimeConfiguration.objectMapper());
        assertFalse(unconfigured.isAvailable());

        properties.getLlm().setApiKey("sk-test");
        assertTrue(unconfigured.isAvailable());
        assertEquals("langchain4j", unconfigured.getProviderId());
        assertEquals("gpt-test", unconfigured.getCurrentModel());
    }

    @Test
    void chatWithoutApiKeyFails() {
        Langchain4jAdapter unconfigured = new Langchain4jAdapter(properties, RuntimeConfiguration.objectMapper());

        assertThrows(Exception.class, () -> unconfigured.chat(LlmRequest.builder().build()).join());
    }

    // ==================== messages ====================

    @Test
    void convertsConversationIncludingToolRoundTrip() {
        ToolCallRequest call = ToolCallRequest.of("call-1", "read_file", Map.of("path", "notes.md"));
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("You are a sub-agent")
                .messages(List.of(
                        Message.user("Summarize notes.md"),
                        Message.assistant(null, List.of(call)),
                        Message.toolResult(call, "three notes"),
                        Message.assistant("Done", null)))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("You are a sub-agent", ((SystemMessage) messages.get(0)).text());
        assertEquals("Summarize notes.md", ((UserMessage) messages.get(1)).singleText());
        ToolExecutionRequest toolRequest = ((AiMessage) messages.get(2)).toolExecutionRequests().get(0);
        assertEquals("call-1", toolRequest.id());
        assertEquals("read_file", toolRequest.name());
        assertEquals("{\"path\":\"notes.md\"}", toolRequest.arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call-1", result.id());
        assertEquals("read_file", result.toolName());
        assertEquals("three notes", result.text());
        assertEquals("Done", ((AiMessage) messages.get(4)).text());
    }

    @Test
    void blankSystemPromptIsOmitted() {
        LlmRequest request = LlmRequest.builder().systemPrompt(" ").messages(List.of(Message.user("hi"))).build();

        assertEquals(1, adapter.convertMessages(request).size());
    }

    // ==================== tools ====================

    @Test
    void convertsToolSchemas() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("cron")
                .description("Schedule jobs")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "action", Map.of("type", "string", "enum", List.of("add", "list")),
                                "every_seconds", Map.of("type", "integer", "description", "Interval"),
                                "tags", Map.of("type", "array", "items", Map.of("type", "string")),
                                "message", Map.of("type", "string")),
                        "required", List.of("action")))
                .build();

        List<ToolSpecification> specs = adapter.convertTools(List.of(definition));

        assertEquals(1, specs.size());
        ToolSpecification spec = specs.get(0);
        assertEquals("cron", spec.name());
        JsonObjectSchema parameters = spec.parameters();
        assertEquals(List.of("action"), parameters.required());
        assertEquals(List.of("add", "list"), ((JsonEnumSchema) parameters.properties().get("action")).enumValues());
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("every_seconds"));
        assertInstanceOf(JsonStringSchema.class,
                ((JsonArraySchema) parameters.properties().get("tags")).items());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("message"));
    }

    @Test
    void toolWithoutParametersHasNoSchema() {
        ToolDefinition definition = ToolDefinition.builder().name("ping").description("Ping").build();

        assertNull(adapter.convertTools(List.of(definition)).get(0).parameters());
        assertTrue(adapter.convertTools(null).isEmpty());
    }

    // ==================== responses ====================

    @Test
    void chatReturnsToolCallsFromModel() {
        AiMessage aiMessage = AiMessage.from(List.of(ToolExecutionRequest.builder()
                .id("call-9").name("exec").arguments("{\"command\":\"ls\"}").build()));
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(aiMessage)
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.user("list files")))
                .build()).join();

        assertTrue(response.hasToolCalls());
        assertEquals(ToolCallRequest.of("call-9", "exec", Map.of("command", "ls")), response.getToolCalls().get(0));
        assertEquals("TOOL_EXECUTION", response.getFinishReason());
        assertEquals("gpt-test", response.getModel());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().messages().size());
    }

    @Test
    void malformedToolArgumentsBecomeEmptyMap() {
        AiMessage aiMessage = AiMessage.from(List.of(ToolExecutionRequest.builder()
                .id("call-1").name("exec").arguments("{not json").build()));

        LlmResponse response = adapter.convertResponse(ChatResponse.builder().aiMessage(aiMessage).build());

        assertEquals(Map.of(), response.getToolCalls().get(0).getArguments());
        assertEquals("STOP", response.getFinishReason());
    }

    @Test
    void textResponseHasNoToolCalls() {
        LlmResponse response = adapter.convertResponse(ChatResponse.builder()
                .aiMessage(AiMessage.from("All done"))
                .finishReason(FinishReason.STOP)
                .build());

        assertFalse(response.hasToolCalls());
        assertEquals("All done", response.getContent());
    }
}
