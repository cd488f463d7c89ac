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
 * Session identifier in the form {@code <channel>:<recipient_id>}. The
 * recipient part may itself contain colons; only the first one separates.
 */
public record SessionKey(String channel, String recipientId) {

    private static final String SEPARATOR = ":";

    public SessionKey {
        if (channel == null || channel.isBlank()) {
            throw OperationException.validation("channel", "Session channel must not be blank");
        }
        if (recipientId == null || recipientId.isBlank()) {
            throw OperationException.validation("recipient_id", "Session recipient must not be blank");
        }
    }

    public static SessionKey parse(String value) {
        if (value == null || !value.contains(SEPARATOR)) {
            throw OperationException.validation("session", "Expected <channel>:<recipient_id>, got: " + value);
        }
        int idx = value.indexOf(SEPARATOR);
        return new SessionKey(value.substring(0, idx), value.substring(idx + 1));
    }

    public DeliveryTarget toDeliveryTarget() {
        return new DeliveryTarget(channel, recipientId);
    }

    @Override
    public String toString() {
        return channel + SEPARATOR + recipientId;
    }
}
