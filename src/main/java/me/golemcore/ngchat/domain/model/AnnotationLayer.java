package me.golemcore.ngchat.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer holding point, box and ellipsoid annotations.
 */
@JsonPropertyOrder({ "type", "source", "tool", "tab", "annotationColor", "annotations", "name", "visible" })
@Getter
@Setter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AnnotationLayer extends Layer {

    static final String DEFAULT_SOURCE_URL = "local://annotations";
    static final String DEFAULT_TOOL = "annotatePoint";
    static final String DEFAULT_TAB = "annotations";
    static final String DEFAULT_COLOR = "#cecd11";

    private Object source;
    private String tool;
    private String tab;
    private String annotationColor;
    private List<AnnotationItem> annotations;

    public static AnnotationLayer create(String name, Object source, LayerOptions options) {
        AnnotationLayer layer = new AnnotationLayer();
        layer.setName(name);
        layer.setSource(normalizeSource(source));
        layer.setTool(options.getTool() != null ? options.getTool() : DEFAULT_TOOL);
        layer.setTab(options.getTab() != null ? options.getTab() : DEFAULT_TAB);
        layer.setAnnotationColor(options.getAnnotationColor() != null ? options.getAnnotationColor() : DEFAULT_COLOR);
        layer.setAnnotations(new ArrayList<>());
        layer.setVisible(options.getVisible());
        return layer;
    }

    private static Object normalizeSource(Object source) {
        if (source == null || source instanceof String text && text.isBlank()) {
            Map<String, Object> local = new LinkedHashMap<>();
            local.put("url", DEFAULT_SOURCE_URL);
            return local;
        }
        if (source instanceof String text) {
            Map<String, Object> remote = new LinkedHashMap<>();
            remote.put("url", text);
            return remote;
        }
        return source;
    }

    public void appendAnnotation(AnnotationItem item) {
        if (annotations == null) {
            annotations = new ArrayList<>();
        }
        annotations.add(item);
    }

    @JsonIgnore
    public int getAnnotationCount() {
        return annotations != null ? annotations.size() : 0;
    }

    @Override
    public String getType() {
        return LayerType.ANNOTATION.getWireName();
    }

    @Override
    public AnnotationLayer copy() {
        AnnotationLayer copy = copyCommonInto(new AnnotationLayer());
        copy.setSource(JsonValues.deepCopy(source));
        copy.setTool(tool);
        copy.setTab(tab);
        copy.setAnnotationColor(annotationColor);
        if (annotations != null) {
            List<AnnotationItem> items = new ArrayList<>(annotations.size());
            for (AnnotationItem item : annotations) {
                items.add(item.copy());
            }
            copy.setAnnotations(items);
        }
        return copy;
    }
}
