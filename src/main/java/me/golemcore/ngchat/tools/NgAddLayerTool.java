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
import me.golemcore.ngchat.domain.model.LayerOptions;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Adds an image, segmentation or annotation layer. Adding a name that already
 * exists changes nothing.
 */
@Component
public class NgAddLayerTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_add_layer")
                .description("Add a layer to the viewer. Does nothing if a layer with the same name exists.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of("type", "string", "description", "Unique layer name"),
                                "layer_type", Map.of(
                                        "type", "string",
                                        "enum", List.of("image", "segmentation", "annotation"),
                                        "description", "Layer type (default image)"),
                                "source", Map.of(
                                        "description", "Data source URL (e.g. precomputed://...) or source object"),
                                "visible", Map.of("type", "boolean", "description", "Default true"),
                                "annotation_color", Map.of(
                                        "type", "string",
                                        "description", "Hex color for annotation layers, e.g. #ff0000")),
                        "required", List.of("name")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String name = ToolArguments.requireString(parameters, "name");
        String layerType = parameters.containsKey("layer_type") && parameters.get("layer_type") != null
                ? parameters.get("layer_type").toString()
                : "image";
        Boolean visible = ToolArguments.bool(parameters, "visible");
        LayerOptions options = LayerOptions.builder()
                .visible(visible != null ? visible : Boolean.TRUE)
                .annotationColor(ToolArguments.string(parameters, "annotation_color"))
                .build();

        ViewerState state = session.getState();
        boolean existed = state.findLayer(name).isPresent();
        state.addLayer(name, layerType, parameters.get("source"), options);

        String output = existed
                ? "Layer '" + name + "' already exists; nothing changed"
                : "Added " + layerType + " layer '" + name + "'";
        return ToolResult.success(output, Map.of(
                "ok", true,
                "layer", name,
                "added", !existed,
                "layers", state.getLayerNames()));
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
