package me.golemcore.runtime.tools;

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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.OutboundMessage;
import me.golemcore.runtime.domain.model.SessionKey;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.service.OutboundMessageService;
import me.golemcore.runtime.domain.service.ToolCallContextHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a message to a user. Defaults to the calling session; {@code channel}
 * and {@code chat_id} address someone else.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageTool implements ToolComponent {

    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_CHAT_ID = "chat_id";

    private final OutboundMessageService outboundMessageService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("message")
                .description("Send a message to the user. Use this when you want to communicate something.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_CONTENT, ToolSchemas.string("The message content to send"),
                        PARAM_CHANNEL, ToolSchemas.string("Optional target channel (e.g. telegram, cli)"),
                        PARAM_CHAT_ID, ToolSchemas.string("Optional target chat/user id")),
                        List.of(PARAM_CONTENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String content = (String) parameters.get(PARAM_CONTENT);
        SessionKey target = resolveTarget(ToolCallContextHolder.get(),
                ToolSchemas.optionalString(parameters, PARAM_CHANNEL),
                ToolSchemas.optionalString(parameters, PARAM_CHAT_ID));
        if (!outboundMessageService.hasChannel(target.channel())) {
            throw OperationException.validation(PARAM_CHANNEL, "Unknown channel: " + target.channel()
                    + ". Available: " + outboundMessageService.getChannelTypes());
        }

        return outboundMessageService.send(OutboundMessage.to(target, content, OutboundMessage.Source.TOOL))
                .thenApply(ignored -> {
                    log.debug("[Message] Sent to {}", target);
                    return ToolResult.success("Message sent to " + target, Map.of("target", target.toString()));
                });
    }

    private SessionKey resolveTarget(ToolCallContext context, String channel, String chatId) {
        SessionKey origin = context != null ? context.origin() : null;
        String targetChannel = channel != null ? channel : origin != null ? origin.channel() : null;
        String targetChat = chatId != null ? chatId : origin != null ? origin.recipientId() : null;
        if (targetChannel == null || targetChat == null) {
            throw OperationException.validation(targetChannel == null ? PARAM_CHANNEL : PARAM_CHAT_ID,
                    "No target: specify channel and chat_id");
        }
        return new SessionKey(targetChannel, targetChat);
    }
}
