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

import me.golemcore.ngchat.domain.component.ToolComponent;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Toggles viewer chrome (scale bar, default annotations, axis lines) and the
 * panel layout.
 */
@Component
public class NgSetViewerSettingsTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_set_viewer_settings")
                .description("Change viewer display settings. Only the given settings change.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "showScaleBar", Map.of("type", "boolean"),
                                "showDefaultAnnotations", Map.of("type", "boolean"),
                                "showAxisLines", Map.of("type", "boolean"),
                                "layout", Map.of(
                                        "type", "string",
                                        "enum", List.of("xy", "xz", "yz", "3d", "4panel"))),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        ViewerState state = session.getState().setViewerSettings(
                ToolArguments.bool(parameters, "showScaleBar"),
                ToolArguments.bool(parameters, "showDefaultAnnotations"),
                ToolArguments.bool(parameters, "showAxisLines"),
                ToolArguments.string(parameters, "layout"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ok", true);
        data.put("showScaleBar", state.getShowScaleBar());
        data.put("showDefaultAnnotations", state.getShowDefaultAnnotations());
        data.put("showAxisLines", state.getShowAxisLines());
        data.put("layout", state.getLayout());
        return ToolResult.success("Viewer settings updated", data);
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
