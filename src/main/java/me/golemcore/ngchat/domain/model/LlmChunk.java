package me.golemcore.ngchat.domain.model;

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

import java.util.List;

/**
 * One element of a streamed model answer. The last chunk has {@code done}
 * set and may carry usage and the finish reason.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private List<ToolCallDelta> toolCallDeltas;
    private boolean done;
    private LlmUsage usage;
    private String finishReason;

    public static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasToolCallDeltas() {
        return toolCallDeltas != null && !toolCallDeltas.isEmpty();
    }
}
