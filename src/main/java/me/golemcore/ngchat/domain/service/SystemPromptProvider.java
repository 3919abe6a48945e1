package me.golemcore.ngchat.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the agent's system prompt from a classpath resource once.
 */
@Component
@Slf4j
public class SystemPromptProvider {

    static final String FALLBACK_PROMPT = "You are a Neuroglancer assistant. Use the ng_* tools to change the "
            + "viewer, and answer briefly.";

    private final NgChatProperties properties;
    private volatile String cached;

    public SystemPromptProvider(NgChatProperties properties) {
        this.properties = properties;
    }

    public String getSystemPrompt() {
        String prompt = cached;
        if (prompt == null) {
            prompt = load();
            cached = prompt;
        }
        return prompt;
    }

    private String load() {
        String location = properties.getPrompts().getSystemPromptResource();
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("[Prompt] System prompt resource '{}' not found, using built-in prompt", location);
            return FALLBACK_PROMPT;
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.warn("[Prompt] Failed to read system prompt '{}': {}", location, e.getMessage());
            return FALLBACK_PROMPT;
        }
    }
}
