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
import me.golemcore.ngchat.domain.model.Zoom;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves the viewer to a point, optionally changing zoom and panel layout.
 */
@Component
public class NgSetViewTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_set_view")
                .description("Set the viewer center (in voxel coordinates), zoom and orientation. "
                        + "Extra axes such as time keep their current value.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "center", ToolArguments.vectorSchema("View center"),
                                "zoom", Map.of(
                                        "type", "string",
                                        "description", "'fit' to reset, or a numeric cross-section scale"),
                                "orientation", Map.of(
                                        "type", "string",
                                        "enum", List.of("xy", "yz", "xz", "3d"),
                                        "description", "Panel layout to switch to")),
                        "required", List.of("center")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        List<Double> center = ToolArguments.vector(parameters, "center");
        Zoom zoom = Zoom.parse(parameters.get("zoom"));
        String orientation = ToolArguments.string(parameters, "orientation");

        ViewerState state = session.getState().setView(center, zoom, orientation);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ok", true);
        data.put("position", state.getPosition());
        data.put("crossSectionScale", state.getCrossSectionScale());
        data.put("layout", state.getLayout());
        return ToolResult.success("View set to " + state.getPosition(), data);
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
