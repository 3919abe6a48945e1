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
import me.golemcore.ngchat.domain.model.AnnotationItem;
import me.golemcore.ngchat.domain.model.BoxAnnotation;
import me.golemcore.ngchat.domain.model.EllipsoidAnnotation;
import me.golemcore.ngchat.domain.model.PointAnnotation;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adds point, box and ellipsoid annotations to an annotation layer, creating
 * the layer when needed. Boxes span {@code center ± size/2}; ellipsoid radii
 * are {@code size/2}.
 */
@Component
public class NgAnnotationsAddTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_annotations_add")
                .description("Add annotations to an annotation layer (created if missing).")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "layer", Map.of("type", "string", "description", "Annotation layer name"),
                                "items", Map.of(
                                        "type", "array",
                                        "items", Map.of(
                                                "type", "object",
                                                "properties", Map.of(
                                                        "id", Map.of("type", "string"),
                                                        "type", Map.of(
                                                                "type", "string",
                                                                "enum", List.of("point", "box", "ellipsoid")),
                                                        "center", ToolArguments.vectorSchema("Center"),
                                                        "size", ToolArguments.vectorSchema(
                                                                "Extent, required for box and ellipsoid")),
                                                "required", List.of("type", "center")))),
                        "required", List.of("layer", "items")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String layer = ToolArguments.requireString(parameters, "layer");
        List<Map<String, Object>> rawItems = ToolArguments.objects(parameters, "items");
        if (rawItems.isEmpty()) {
            throw new ValidationException("items must contain at least one annotation");
        }
        List<AnnotationItem> items = new ArrayList<>(rawItems.size());
        for (Map<String, Object> raw : rawItems) {
            items.add(toItem(raw));
        }
        session.getState().addAnnotations(layer, items);
        return ToolResult.success("Added " + items.size() + " annotation(s) to '" + layer + "'",
                Map.of("ok", true, "layer", layer, "added", items.size()));
    }

    private AnnotationItem toItem(Map<String, Object> raw) {
        String id = ToolArguments.string(raw, "id");
        String type = ToolArguments.requireString(raw, "type");
        List<Double> center = ToolArguments.vector(raw, "center");
        List<Double> size = ToolArguments.vector(raw, "size");
        return switch (type) {
        case "point" -> new PointAnnotation(id, center);
        case "box" -> BoxAnnotation.centered(id, center, requireSize(size, type));
        case "ellipsoid" -> EllipsoidAnnotation.fromSize(id, center, requireSize(size, type));
        default -> throw new ValidationException("Unsupported annotation type '" + type + "'");
        };
    }

    private static List<Double> requireSize(List<Double> size, String type) {
        if (size == null) {
            throw new ValidationException("size is required for " + type + " annotations");
        }
        return size;
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
