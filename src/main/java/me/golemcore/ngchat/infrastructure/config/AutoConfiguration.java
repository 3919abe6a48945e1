package me.golemcore.ngchat.infrastructure.config;

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
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.service.ToolDispatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup logging.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final NgChatProperties properties;
    private final ToolDispatcher toolDispatcher;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Map keys are written in insertion order; viewer states depend on it.
     * Doubles are written in the viewer's own number format.
     */
    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new SimpleModule("ViewerNumbers")
                .addSerializer(Double.class, new ViewerNumberSerializer())
                .addSerializer(Double.TYPE, new ViewerNumberSerializer()));
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("LLM Provider: {} (model {})", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Viewer base URL: {}", properties.getViewer().getBaseUrl());
        log.info("Tool loop ceilings: buffered={}, streamed={}", properties.getToolLoop().getMaxIterations(),
                properties.getToolLoop().getStreamMaxIterations());
        log.info("Registered tools: {}", toolDispatcher.getToolNames());
    }
}
