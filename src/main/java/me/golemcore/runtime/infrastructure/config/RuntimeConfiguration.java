package me.golemcore.runtime.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.port.outbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Core beans (clock, JSON mapper) and startup logging.
 *
 * <p>
 * The {@link Clock} bean is the single time source of the cron scheduler, the
 * heartbeat runner and the sub-agent spawner; tests replace it with a
 * controllable clock.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RuntimeConfiguration {

    private final RuntimeProperties properties;
    private final List<ToolComponent> tools;
    private final List<ChannelPort> channels;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Runtime v{} starting...", version);
        log.info("Workspace: {}", properties.getWorkspace().getPath());
        log.info("Tools: {}", tools.stream().map(ToolComponent::getToolName).toList());
        log.info("Channels: {}", channels.stream().map(ChannelPort::getChannelType).toList());
        log.info("Sub-agents: max {} concurrent, overflow {}",
                properties.getSubagents().getMaxConcurrent(), properties.getSubagents().getOverflowPolicy());
    }
}
