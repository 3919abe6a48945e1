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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import me.golemcore.ngchat.domain.exception.ValidationException;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One annotation inside an annotation layer. Items are appended or replaced
 * wholesale, never edited in place.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type",
        visible = true, defaultImpl = GenericAnnotation.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = PointAnnotation.class, name = "point"),
        @JsonSubTypes.Type(value = BoxAnnotation.class, name = "box"),
        @JsonSubTypes.Type(value = EllipsoidAnnotation.class, name = "ellipsoid")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode
@ToString
public abstract class AnnotationItem {

    @JsonProperty("id")
    private String id;

    private final Map<String, Object> extras = new LinkedHashMap<>();

    protected AnnotationItem() {
    }

    protected AnnotationItem(String id) {
        this.id = id;
    }

    @JsonProperty("type")
    public abstract String getType();

    @JsonProperty("type")
    void acceptType(String type) {
    }

    public String getId() {
        return id;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    public abstract AnnotationItem copy();

    protected <T extends AnnotationItem> T withCommon(T target) {
        ((AnnotationItem) target).id = id;
        target.getExtras().putAll(JsonValues.copyMap(extras));
        return target;
    }

    protected static List<Double> vector(List<Double> values, String field) {
        if (values == null || values.size() < 3) {
            throw new ValidationException(field + " must have at least 3 coordinates");
        }
        for (Double value : values) {
            if (value == null) {
                throw new ValidationException(field + " must not contain null coordinates");
            }
        }
        return List.copyOf(values);
    }
}
