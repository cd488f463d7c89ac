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

import me.golemcore.runtime.domain.model.OutboundMessage;
import me.golemcore.runtime.port.outbound.ChannelPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery action: routes an {@link OutboundMessage} to the
 * {@link ChannelPort} registered for its channel type.
 */
@Service
@Slf4j
public class OutboundMessageService {

    private final Map<String, ChannelPort> channels = new ConcurrentHashMap<>();
    private final Clock clock;

    public OutboundMessageService(List<ChannelPort> channelPorts, Clock clock) {
        for (ChannelPort port : channelPorts) {
            channels.put(port.getChannelType(), port);
        }
        this.clock = clock;
    }

    /**
     * @return completes when the channel accepted the message; completes
     *         exceptionally for an unknown channel or a channel failure
     */
    public CompletableFuture<Void> send(OutboundMessage message) {
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(clock.instant());
        }
        ChannelPort channel = message.getChannel() != null ? channels.get(message.getChannel()) : null;
        if (channel == null) {
            log.warn("[Delivery] No channel '{}' for {} message to {}", message.getChannel(), message.getSource(),
                    message.getChatId());
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Unknown channel: " + message.getChannel()));
        }
        log.debug("[Delivery] {} -> {}:{}", message.getSource(), message.getChannel(), message.getChatId());
        try {
            return channel.sendMessage(message.getChatId(), message.getContent());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public Set<String> getChannelTypes() {
        return Set.copyOf(channels.keySet());
    }

    public boolean hasChannel(String channelType) {
        return channelType != null && channels.containsKey(channelType);
    }
}
