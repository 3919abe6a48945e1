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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.component.ToolComponent;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.PointAnnotation;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one viewer link per row of points (for example the top hits of a
 * query). Each row branches a copy of the current state; the session state
 * then becomes the first row's view.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NgViewsTableTool implements ToolComponent {

    static final int MAX_ROWS = 50;
    private static final int DEFAULT_ROWS = 5;
    private static final String DEFAULT_ANNOTATION_LAYER = "annotations";

    private final ViewerStateCodec codec;
    private final ViewerLinkMasker masker;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("ng_views_table")
                .description("Create one Neuroglancer view link per row (id, x, y, z). Optionally set an image "
                        + "range and drop a point annotation at each row. The current view becomes the first row.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "rows", Map.of(
                                        "type", "array",
                                        "items", Map.of(
                                                "type", "object",
                                                "properties", Map.of(
                                                        "id", Map.of("type", "string"),
                                                        "x", Map.of("type", "number"),
                                                        "y", Map.of("type", "number"),
                                                        "z", Map.of("type", "number"),
                                                        "label", Map.of("type", "string")),
                                                "required", List.of("x", "y", "z"))),
                                "top_n", Map.of(
                                        "type", "integer",
                                        "description", "Rows to use (default 5, at most 50)"),
                                "lut", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "layer", Map.of("type", "string"),
                                                "min", Map.of("type", "number"),
                                                "max", Map.of("type", "number")),
                                        "required", List.of("layer", "min", "max")),
                                "annotations", Map.of(
                                        "type", "boolean",
                                        "description", "Add a point annotation at each row"),
                                "annotation_layer", Map.of(
                                        "type", "string",
                                        "description", "Default 'annotations'")),
                        "required", List.of("rows")))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        List<Map<String, Object>> rows = ToolArguments.objects(parameters, "rows");
        int topN = Math.max(1, Math.min(ToolArguments.integer(parameters, "top_n", DEFAULT_ROWS), MAX_ROWS));
        Map<String, Object> lut = ToolArguments.object(parameters, "lut");
        boolean annotate = Boolean.TRUE.equals(ToolArguments.bool(parameters, "annotations"));
        String annotationLayer = ToolArguments.string(parameters, "annotation_layer");
        if (annotationLayer == null || annotationLayer.isBlank()) {
            annotationLayer = DEFAULT_ANNOTATION_LAYER;
        }

        ViewerState base = session.getState();
        List<Map<String, Object>> out = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        ViewerState firstView = null;
        int limit = Math.min(topN, rows.size());
        for (int i = 0; i < limit; i++) {
            Map<String, Object> row = rows.get(i);
            String id = row.get("id") != null ? row.get("id").toString() : String.valueOf(i + 1);
            try {
                List<Double> center = List.of(
                        ToolArguments.requireNumber(row, "x"),
                        ToolArguments.requireNumber(row, "y"),
                        ToolArguments.requireNumber(row, "z"));
                ViewerState view = base.copy().setView(center, null, null);
                if (lut != null) {
                    view.setLut(ToolArguments.requireString(lut, "layer"),
                            ToolArguments.requireNumber(lut, "min"),
                            ToolArguments.requireNumber(lut, "max"));
                }
                if (annotate) {
                    view.addAnnotations(annotationLayer, List.of(new PointAnnotation(id, center)));
                }
                String url = codec.encode(view);
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("id", id);
                if (row.get("label") != null) {
                    record.put("label", row.get("label").toString());
                }
                record.put("x", center.get(0));
                record.put("y", center.get(1));
                record.put("z", center.get(2));
                record.put("link", masker.rowLink(url));
                record.put("url", url);
                out.add(record);
                if (firstView == null) {
                    firstView = view;
                }
            } catch (ValidationException e) {
                log.debug("[Tools] Skipping views-table row {}: {}", id, e.getMessage());
                warnings.add("row " + id + ": " + e.getMessage());
            }
        }
        if (firstView == null) {
            throw new ValidationException("No rows processed" + (warnings.isEmpty() ? "" : ": " + warnings));
        }
        session.replaceState(firstView);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ok", true);
        data.put("n", out.size());
        data.put("rows", out);
        data.put("first_link", out.get(0).get("url"));
        if (rows.size() > limit) {
            warnings.add("only the first " + limit + " of " + rows.size() + " rows were used");
        }
        if (!warnings.isEmpty()) {
            data.put("warnings", warnings);
        }
        return ToolResult.success("Built " + out.size() + " view link(s)", data);
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
