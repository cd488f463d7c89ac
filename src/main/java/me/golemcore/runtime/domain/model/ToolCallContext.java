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

/**
 * Who is making a tool call and on behalf of which conversation.
 *
 * @param callId
 *            id of the call being executed, null outside a dispatch
 * @param origin
 *            session that replies and cron deliveries default to, may be null
 *            for unattended actors
 * @param actor
 *            "main", "heartbeat", "cron" or a sub-agent task id
 */
public record ToolCallContext(String callId, SessionKey origin, String actor) {

    public static final String ACTOR_MAIN = "main";
    public static final String ACTOR_HEARTBEAT = "heartbeat";

    public static ToolCallContext of(SessionKey origin, String actor) {
        return new ToolCallContext(null, origin, actor);
    }

    public ToolCallContext withCallId(String id) {
        return new ToolCallContext(id, origin, actor);
    }
}
