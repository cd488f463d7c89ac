package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * A delivery action: text routed to a channel and recipient. Produced by the
 * message tool, fired cron jobs, the heartbeat runner and finished sub-agents.
 */
@Data
@Builder
public class OutboundMessage {

    private String channel;
    private String chatId;
    private String content;
    private Source source;
    private Map<String, Object> metadata;
    private Instant createdAt;

    public enum Source {
        TOOL, CRON, HEARTBEAT, SUBAGENT
    }

    public static OutboundMessage to(SessionKey target, String content, Source source) {
        return OutboundMessage.builder()
                .channel(target.channel())
                .chatId(target.recipientId())
                .content(content)
                .source(source)
                .metadata(Map.of())
                .build();
    }
}
