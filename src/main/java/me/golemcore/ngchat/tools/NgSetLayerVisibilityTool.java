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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class NgSetLayerVisibilityTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_set_layer_visibility")
                .description("Show or hide a layer by name.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of("type", "string", "description", "Layer name"),
                                "visible", Map.of("type", "boolean", "description", "Default true")),
                        "required", List.of("name")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String name = ToolArguments.requireString(parameters, "name");
        Boolean visible = ToolArguments.bool(parameters, "visible");
        boolean target = visible == null || visible;
        boolean found = session.getState().findLayer(name).isPresent();
        session.getState().setLayerVisibility(name, target);
        return ToolResult.success(found ? "Layer '" + name + "' visible=" + target
                : "No layer named '" + name + "'; nothing changed",
                Map.of("ok", true, "layer", name, "visible", target, "found", found));
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
