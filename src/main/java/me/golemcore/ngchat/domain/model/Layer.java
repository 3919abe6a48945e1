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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named layer of the viewer state. The JSON {@code type} key selects the
 * concrete subtype; keys this model does not know about are kept in
 * {@link #getExtras()} and written back after the known ones.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type",
        visible = true, defaultImpl = GenericLayer.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ImageLayer.class, name = "image"),
        @JsonSubTypes.Type(value = SegmentationLayer.class, name = "segmentation"),
        @JsonSubTypes.Type(value = AnnotationLayer.class, name = "annotation")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@Setter
@EqualsAndHashCode
@ToString
public abstract class Layer {

    private String name;
    private Boolean visible;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extras = new LinkedHashMap<>();

    /**
     * Wire type id, e.g. {@code image}.
     */
    @JsonProperty("type")
    public abstract String getType();

    /**
     * The type id of a modelled layer is fixed by its class, so the incoming
     * value is dropped here.
     */
    @JsonProperty("type")
    void acceptType(String type) {
    }

    /**
     * Returns a fully independent copy of this layer.
     */
    public abstract Layer copy();

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    @JsonIgnore
    public boolean isShown() {
        return visible == null || visible;
    }

    protected <T extends Layer> T copyCommonInto(T target) {
        target.setName(name);
        target.setVisible(visible);
        target.getExtras().putAll(JsonValues.copyMap(extras));
        return target;
    }
}
