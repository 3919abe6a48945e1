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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Common shape of voxel-backed layers (image and segmentation): an opaque data
 * source plus optional shader and shader controls.
 */
@Getter
@Setter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class VolumeLayer extends Layer {

    static final String DEFAULT_SOURCE = "precomputed://example";
    private static final String NORMALIZED = "normalized";
    private static final String RANGE = "range";

    private Object source;
    private String shader;
    private Map<String, Object> shaderControls;

    /**
     * Sets {@code shaderControls.normalized.range} to {@code [min, max]}, keeping
     * every other control.
     */
    @SuppressWarnings("unchecked")
    public void setNormalizedRange(double min, double max) {
        Map<String, Object> controls = shaderControls != null
                ? new LinkedHashMap<>(shaderControls)
                : new LinkedHashMap<>();
        Object existing = controls.get(NORMALIZED);
        Map<String, Object> normalized = existing instanceof Map<?, ?> map
                ? new LinkedHashMap<>((Map<String, Object>) map)
                : new LinkedHashMap<>();
        normalized.put(RANGE, List.of(min, max));
        controls.put(NORMALIZED, normalized);
        shaderControls = controls;
    }

    /**
     * Returns the normalized range if one is set, otherwise {@code null}.
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public List<Object> getNormalizedRange() {
        if (shaderControls == null || !(shaderControls.get(NORMALIZED) instanceof Map<?, ?> normalized)) {
            return null;
        }
        Object range = ((Map<String, Object>) normalized).get(RANGE);
        return range instanceof List<?> list ? List.copyOf(list) : null;
    }

    protected <T extends VolumeLayer> T copyVolumeInto(T target) {
        copyCommonInto(target);
        target.setSource(JsonValues.deepCopy(source));
        target.setShader(shader);
        target.setShaderControls(JsonValues.copyMap(shaderControls));
        return target;
    }

    static void applyDefaults(VolumeLayer layer, String name, Object source, LayerOptions options) {
        layer.setName(name);
        layer.setSource(source != null ? source : DEFAULT_SOURCE);
        layer.setVisible(options.getVisible() != null ? options.getVisible() : Boolean.TRUE);
        layer.setShader(options.getShader());
    }
}
