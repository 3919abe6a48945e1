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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.yml under the
 * {@code ngchat.*} prefix.
 * <ul>
 * <li>{@link LlmProperties} - model provider settings</li>
 * <li>{@link ToolLoopProperties} - iteration ceilings and tool output
 * truncation</li>
 * <li>{@link ViewerProperties} - default viewer base URL</li>
 * <li>{@link MaskingProperties} - link labels in chat answers</li>
 * <li>{@link PointerProperties} - pointer fetch timeout and object-storage
 * endpoints</li>
 * <li>{@link PromptsProperties} - system prompt resource</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "ngchat")
@Data
public class NgChatProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ViewerProperties viewer = new ViewerProperties();
    private MaskingProperties masking = new MaskingProperties();
    private PointerProperties pointer = new PointerProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class LlmProperties {
        /**
         * {@code langchain4j} for an OpenAI-compatible endpoint, {@code none} to
         * disable the model.
         */
        private String provider = "langchain4j";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.2;
        private Integer maxTokens;
        private long timeoutMs = 120_000;
    }

    @Data
    public static class ToolLoopProperties {
        /**
         * Ceiling on model calls per buffered chat turn.
         */
        private int maxIterations = 6;

        /**
         * Ceiling on model calls per streamed chat turn.
         */
        private int streamMaxIterations = 10;

        private int toolResultMaxChars = 4000;
        private int streamResultMaxChars = 5000;
    }

    @Data
    public static class ViewerProperties {
        private String baseUrl = "https://neuroglancer-demo.appspot.com";
    }

    @Data
    public static class MaskingProperties {
        private String label = "Updated Neuroglancer view";
        private List<String> hostMarkers = new ArrayList<>(List.of("neuroglancer"));
    }

    @Data
    public static class PointerProperties {
        private long connectTimeoutMs = 10_000;
        private long readTimeoutMs = 30_000;
        private String s3Endpoint = "https://%s.s3.amazonaws.com/%s";
        private String gsEndpoint = "https://storage.googleapis.com/%s/%s";
    }

    @Data
    public static class PromptsProperties {
        private String systemPromptResource = "prompts/system-prompt.md";
    }
}
