package me.golemcore.ngchat.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.ngchat.domain.component.ToolComponent;
import me.golemcore.ngchat.domain.model.SummaryDetail;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NgStateSummaryTool implements ToolComponent {

    private final ViewerStateSummarizer summarizer;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_state_summary")
                .description("Describe the current viewer state: layout, position, dimensions, layers and "
                        + "annotation layers.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "detail", Map.of(
                                        "type", "string",
                                        "enum", List.of("minimal", "standard", "full"),
                                        "description", "Default standard")),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        SummaryDetail detail = SummaryDetail.parse(ToolArguments.string(parameters, "detail"));
        Map<String, Object> summary = summarizer.summarize(session.getState(), detail);
        return ToolResult.success("Viewer state summary (" + detail.wireName() + ")", summary);
    }
}
