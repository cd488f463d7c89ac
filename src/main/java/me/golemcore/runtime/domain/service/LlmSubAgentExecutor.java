package me.golemcore.runtime.domain.service;

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

import me.golemcore.runtime.domain.model.LlmRequest;
import me.golemcore.runtime.domain.model.LlmResponse;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link SubAgentExecutor}: a bounded reasoning loop over
 * {@link LlmPort} whose tool calls go through the dispatcher, restricted to
 * the file, shell and web tools.
 */
@Component
@Slf4j
public class LlmSubAgentExecutor implements SubAgentExecutor {

    static final Set<String> SUBAGENT_TOOLS = Set.of(
            "read_file", "write_file", "edit_file", "list_dir", "exec", "web_search", "web_fetch");

    private final LlmPort llmPort;
    private final ObjectProvider<ToolDispatchService> dispatchServiceProvider;
    private final SubAgentPromptBuilder promptBuilder;
    private final RuntimeProperties properties;

    public LlmSubAgentExecutor(LlmPort llmPort, ObjectProvider<ToolDispatchService> dispatchServiceProvider,
            SubAgentPromptBuilder promptBuilder, RuntimeProperties properties) {
        this.llmPort = llmPort;
        this.dispatchServiceProvider = dispatchServiceProvider;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
    }

    @Override
    public String execute(SubAgentTask task) throws Exception {
        if (!llmPort.isAvailable()) {
            throw new IllegalStateException("LLM provider '" + llmPort.getProviderId() + "' is not configured");
        }
        ToolDispatchService dispatcher = dispatchServiceProvider.getObject();
        RuntimeProperties.SubAgentProperties config = properties.getSubagents();
        ToolCallContext context = ToolCallContext.of(task.getOrigin(), task.getId());

        String systemPrompt = promptBuilder.build(task);
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(task.getDescription()));

        for (int iteration = 1; iteration <= config.getMaxIterations(); iteration++) {
            if (task.isCancellationRequested()) {
                return "Cancelled before iteration " + iteration;
            }
            LlmRequest request = LlmRequest.builder()
                    .model(llmPort.getCurrentModel())
                    .systemPrompt(systemPrompt)
                    .messages(new ArrayList<>(messages))
                    .tools(new ArrayList<>(dispatcher.getDefinitions(SUBAGENT_TOOLS)))
                    .temperature(properties.getLlm().getTemperature())
                    .maxTokens(properties.getLlm().getMaxTokens())
                    .build();
            LlmResponse response = llmPort.chat(request).get(config.getLlmTimeoutSeconds(), TimeUnit.SECONDS);

            if (!response.hasToolCalls()) {
                String content = response.getContent();
                log.debug("[SubAgent] {} finished after {} iteration(s)", task.getId(), iteration);
                return content != null && !content.isBlank()
                        ? content
                        : "Task completed but no final response was generated.";
            }

            messages.add(Message.assistant(response.getContent(), response.getToolCalls()));
            for (ToolCallRequest call : response.getToolCalls()) {
                if (task.isCancellationRequested()) {
                    return "Cancelled during iteration " + iteration;
                }
                log.debug("[SubAgent] {} calls {}", task.getId(), call.getName());
                ToolResult result = dispatcher.dispatch(call, context, SUBAGENT_TOOLS);
                messages.add(Message.toolResult(call, result.toContent()));
            }
        }
        throw new IllegalStateException("No final answer after " + config.getMaxIterations() + " iterations");
    }
}
