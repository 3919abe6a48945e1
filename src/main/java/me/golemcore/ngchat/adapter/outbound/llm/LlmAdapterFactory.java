package me.golemcore.ngchat.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.model.LlmChunk;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code ngchat.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible endpoint via langchain4j
 * <li>none - placeholder answers, no external calls
 * </ul>
 *
 * <p>
 * An unknown provider, or langchain4j without an API key, falls back to the
 * no-op adapter.
 *
 * @see LlmProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final NgChatProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        LlmProviderAdapter selected = adaptersByProvider.get(provider);
        if (selected != null && (selected.isAvailable() || PROVIDER_NONE.equals(provider))) {
            activeAdapter = selected;
            activeAdapter.initialize();
            log.info("Active LLM provider: {}", provider);
            return;
        }

        activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
        if (activeAdapter == null && !adapters.isEmpty()) {
            activeAdapter = adapters.get(0);
        }
        log.warn("Provider '{}' not found or not configured, using: {}",
                provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
    }

    /**
     * Get the active LLM adapter based on current configuration.
     */
    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return activeAdapter.chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return activeAdapter.chatStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        return activeAdapter != null && activeAdapter.supportsStreaming();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
