package me.golemcore.runtime.adapter.outbound.channel;

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

import me.golemcore.runtime.port.outbound.ChannelPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ChannelPort} for the {@code cli} channel: deliveries are printed to
 * standard output, one block per message, prefixed with the recipient.
 */
@Component
@Slf4j
public class ConsoleChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "cli";

    private final PrintStream out;

    public ConsoleChannelAdapter() {
        this(System.out);
    }

    ConsoleChannelAdapter(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        log.debug("[Console] Delivering {} chars to {}", content != null ? content.length() : 0, chatId);
        synchronized (out) {
            out.println("[" + chatId + "] " + content);
            out.flush();
        }
        return CompletableFuture.completedFuture(null);
    }
}
