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
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.Layer;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.VolumeLayer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sets the display range (lookup table) of an image layer.
 */
@Component
public class NgSetLutTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_set_lut")
                .description("Set the normalized value range (contrast window) of an image layer.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "layer", Map.of("type", "string", "description", "Layer name"),
                                "vmin", Map.of("type", "number", "description", "Lower bound"),
                                "vmax", Map.of("type", "number", "description", "Upper bound")),
                        "required", List.of("layer", "vmin", "vmax")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String layerName = ToolArguments.requireString(parameters, "layer");
        double vmin = ToolArguments.requireNumber(parameters, "vmin");
        double vmax = ToolArguments.requireNumber(parameters, "vmax");
        if (vmin > vmax) {
            throw new ValidationException("vmin (" + vmin + ") must not exceed vmax (" + vmax + ")");
        }

        Optional<Layer> layer = session.getState().findLayer(layerName);
        session.getState().setLut(layerName, vmin, vmax);
        boolean applied = layer.isPresent() && layer.get() instanceof VolumeLayer;
        String output = applied
                ? "Range of '" + layerName + "' set to [" + vmin + ", " + vmax + "]"
                : "No image or segmentation layer named '" + layerName + "'; nothing changed";
        return ToolResult.success(output, Map.of(
                "ok", true,
                "layer", layerName,
                "applied", applied,
                "range", List.of(vmin, vmax)));
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
