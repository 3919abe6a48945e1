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
import me.golemcore.ngchat.domain.model.QueryRequest;
import me.golemcore.ngchat.domain.model.QueryResult;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.port.outbound.QuerySandboxPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a read-only query over an uploaded table through the query sandbox.
 * Disabled while no sandbox is available.
 */
@Component
@RequiredArgsConstructor
public class DataQueryTool implements ToolComponent {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final QuerySandboxPort querySandbox;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("data_query")
                .description("Run a read-only query expression over an uploaded table or summary.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "file_id", Map.of("type", "string"),
                                "summary_id", Map.of("type", "string"),
                                "expression", Map.of("type", "string", "description", "Query expression"),
                                "limit", Map.of("type", "integer", "description", "Row cap (default 100)")),
                        "required", List.of("expression")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        QueryRequest request = QueryRequest.builder()
                .fileId(ToolArguments.string(parameters, "file_id"))
                .summaryId(ToolArguments.string(parameters, "summary_id"))
                .expression(ToolArguments.requireString(parameters, "expression"))
                .limit(Math.max(1, Math.min(ToolArguments.integer(parameters, "limit", DEFAULT_LIMIT), MAX_LIMIT)))
                .build();
        QueryResult result = querySandbox.execute(request);
        if (result == null || !result.isOk()) {
            String error = result != null && result.getError() != null ? result.getError() : "Query failed";
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, error);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ok", true);
        data.put("columns", result.getColumns() != null ? result.getColumns() : List.of());
        data.put("rows", result.getRows() != null ? result.getRows() : List.of());
        data.put("truncated", result.isTruncated());
        return ToolResult.success("Query returned " + ((List<?>) data.get("rows")).size() + " row(s)", data);
    }

    @Override
    public boolean isEnabled() {
        return querySandbox.isAvailable();
    }
}
