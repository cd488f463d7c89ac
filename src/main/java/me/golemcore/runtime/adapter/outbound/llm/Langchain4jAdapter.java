package me.golemcore.runtime.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.LlmRequest;
import me.golemcore.runtime.domain.model.LlmResponse;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.LlmPort;
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
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LlmPort} over langchain4j's OpenAI-compatible chat model with native
 * function calling. Any endpoint speaking the OpenAI chat API works through
 * {@code runtime.llm.base-url}.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final RuntimeProperties.LlmProperties config;
    private final ObjectMapper objectMapper;
    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jAdapter(RuntimeProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    Langchain4jAdapter(RuntimeProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public String getCurrentModel() {
        return config.getModel();
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null || (config.getApiKey() != null && !config.getApiKey().isBlank());
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getOrCreateModel();
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .toolSpecifications(convertTools(request.getTools()))
                    .build();
            log.trace("[LLM] Calling {} with {} message(s), {} tool(s)", config.getModel(),
                    chatRequest.messages().size(), request.getTools().size());
            return convertResponse(model.chat(chatRequest));
        });
    }

    private ChatModel getOrCreateModel() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                if (!isAvailable()) {
                    throw new IllegalStateException("LLM API key is not configured (runtime.llm.api-key)");
                }
                var builder = OpenAiChatModel.builder()
                        .apiKey(config.getApiKey())
                        .modelName(config.getModel())
                        .temperature(config.getTemperature())
                        .maxTokens(config.getMaxTokens())
                        .timeout(Duration.ofMillis(config.getTimeoutMs()));
                if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                    builder.baseUrl(config.getBaseUrl());
                }
                chatModel = builder.build();
                log.info("[LLM] Initialized model {}", config.getModel());
            }
            return chatModel;
        }
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> messages.add(toAiMessage(msg));
            case Message.ROLE_TOOL -> messages.add(
                    ToolExecutionResultMessage.from(msg.getToolCallId(), msg.getToolName(), msg.getContent()));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> log.warn("[LLM] Skipping message with unknown role: {}", msg.getRole());
            }
        }
        return messages;
    }

    private AiMessage toAiMessage(Message msg) {
        if (!msg.hasToolCalls()) {
            return AiMessage.from(msg.getContent() != null ? msg.getContent() : "");
        }
        List<ToolExecutionRequest> requests = msg.getToolCalls().stream()
                .map(call -> ToolExecutionRequest.builder()
                        .id(call.getId())
                        .name(call.getName())
                        .arguments(toJson(call.getArguments()))
                        .build())
                .toList();
        if (msg.getContent() != null && !msg.getContent().isBlank()) {
            return AiMessage.from(msg.getContent(), requests);
        }
        return AiMessage.from(requests);
    }

    List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        List<ToolSpecification> specs = new ArrayList<>();
        if (tools == null) {
            return specs;
        }
        for (ToolDefinition tool : tools) {
            ToolSpecification.Builder builder = ToolSpecification.builder()
                    .name(tool.getName())
                    .description(tool.getDescription());
            Map<String, Map<String, Object>> params = tool.parameterSchemas();
            if (!params.isEmpty()) {
                JsonObjectSchema.Builder schema = JsonObjectSchema.builder();
                params.forEach((name, paramSchema) -> schema.addProperty(name, toJsonSchemaElement(paramSchema)));
                if (!tool.requiredParameters().isEmpty()) {
                    schema.required(tool.requiredParameters());
                }
                builder.parameters(schema.build());
            }
            specs.add(builder.build());
        }
        return specs;
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        Object enumValues = paramSchema.get("enum");

        if (enumValues instanceof List<?> values && !values.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(values.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                nested.forEach((name, schema) -> builder.addProperty(String.valueOf(name),
                        toJsonSchemaElement((Map<String, Object>) schema)));
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<ToolCallRequest> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(request -> ToolCallRequest.of(request.id(), request.name(), parseArgs(request.arguments())))
                    .toList();
        }
        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(config.getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "STOP")
                .build();
    }

    private String toJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseArgs(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Model produced malformed tool arguments: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
