package me.golemcore.ngchat.domain.service;

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

import me.golemcore.ngchat.domain.model.AnnotationItem;
import me.golemcore.ngchat.domain.model.AnnotationLayer;
import me.golemcore.ngchat.domain.model.Dimension;
import me.golemcore.ngchat.domain.model.Layer;
import me.golemcore.ngchat.domain.model.SummaryDetail;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.model.VolumeLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Describes a viewer state for the model: a short text block for the chat
 * context and a structured form for the summary tool and endpoint.
 */
@Component
public class ViewerStateSummarizer {

    private static final int SUMMARY_VERSION = 1;

    /**
     * Short deterministic text: layout, position, one line per layer.
     */
    public String summarizeText(ViewerState state) {
        List<String> lines = new ArrayList<>();
        lines.add("Layout: " + (state.getLayout() != null ? state.getLayout() : "xy"));
        lines.add("Position: " + (state.getPosition() != null ? state.getPosition() : List.of(0.0, 0.0, 0.0)));
        List<Layer> layers = state.getLayers();
        if (layers == null || layers.isEmpty()) {
            lines.add("Layers: (none)");
        } else {
            lines.add("Layers:");
            for (Layer layer : layers) {
                String name = layer.getName() != null ? layer.getName() : "(unnamed)";
                lines.add("- " + name + " (" + (layer.getType() != null ? layer.getType() : "unknown") + ")");
            }
        }
        return String.join("\n", lines);
    }

    public Map<String, Object> summarize(ViewerState state, SummaryDetail detail) {
        List<Map<String, Object>> layersOut = new ArrayList<>();
        List<Map<String, Object>> annotationLayers = new ArrayList<>();
        List<Layer> layers = state.getLayers() != null ? state.getLayers() : List.of();
        for (Layer layer : layers) {
            layersOut.add(describeLayer(layer, detail));
            if (layer instanceof AnnotationLayer annotationLayer) {
                annotationLayers.add(describeAnnotations(annotationLayer));
            }
        }

        Map<String, Object> dimensions = new LinkedHashMap<>();
        if (state.getDimensions() != null) {
            for (Map.Entry<String, Dimension> entry : state.getDimensions().entrySet()) {
                dimensions.put(entry.getKey(), entry.getValue().toJson());
            }
        }
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("showAxisLines", state.getShowAxisLines());
        flags.put("showScaleBar", state.getShowScaleBar());
        flags.put("showDefaultAnnotations", state.getShowDefaultAnnotations());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("layout", state.getLayout());
        summary.put("position", state.getPosition());
        summary.put("dimensions", dimensions);
        summary.put("layers", layersOut);
        summary.put("annotation_layers", annotationLayers);
        summary.put("flags", flags);
        summary.put("version", SUMMARY_VERSION);
        summary.put("detail", detail.wireName());
        return summary;
    }

    private Map<String, Object> describeLayer(Layer layer, SummaryDetail detail) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", layer.getName());
        out.put("type", layer.getType());
        if (detail == SummaryDetail.MINIMAL) {
            return out;
        }
        out.put("visible", layer.isShown());
        if (layer instanceof VolumeLayer volume) {
            List<String> kinds = sourceKinds(volume.getSource());
            if (volume.getSource() instanceof List<?> sources) {
                out.put("num_sources", sources.size());
            }
            if (!kinds.isEmpty()) {
                out.put("source_kinds", kinds);
            }
            List<Object> range = volume.getNormalizedRange();
            if (range != null) {
                out.put("normalized_range", range);
            }
            if (detail == SummaryDetail.FULL && volume.getShader() != null && !volume.getShader().isEmpty()) {
                out.put("shader_len", volume.getShader().length());
            }
        } else if (layer instanceof AnnotationLayer annotationLayer) {
            out.put("annotation_count", annotationLayer.getAnnotationCount());
        }
        return out;
    }

    private Map<String, Object> describeAnnotations(AnnotationLayer layer) {
        TreeSet<String> types = new TreeSet<>();
        if (layer.getAnnotations() != null) {
            for (AnnotationItem item : layer.getAnnotations()) {
                if (item.getType() != null) {
                    types.add(item.getType());
                }
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", layer.getName());
        out.put("count", layer.getAnnotationCount());
        out.put("types", new ArrayList<>(types));
        return out;
    }

    private static List<String> sourceKinds(Object source) {
        TreeSet<String> kinds = new TreeSet<>();
        if (source instanceof List<?> sources) {
            for (Object item : sources) {
                addKind(kinds, item);
            }
        } else {
            addKind(kinds, source);
        }
        return new ArrayList<>(kinds);
    }

    private static void addKind(TreeSet<String> kinds, Object source) {
        Object url = source instanceof Map<?, ?> map ? map.get("url") : source;
        if (url instanceof String text && text.contains("://")) {
            kinds.add(text.substring(0, text.indexOf("://")));
        }
    }
}
