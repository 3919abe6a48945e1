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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Annotation of a type this service does not create, such as {@code line},
 * {@code polyline} or {@code axis_aligned_bounding_box}. Its geometry stays in
 * the extras.
 */
@JsonPropertyOrder({ "type", "id" })
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GenericAnnotation extends AnnotationItem {

    private String type;

    GenericAnnotation() {
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    @JsonProperty("type")
    void acceptType(String type) {
        this.type = type;
    }

    @Override
    public GenericAnnotation copy() {
        GenericAnnotation copy = withCommon(new GenericAnnotation());
        copy.type = type;
        return copy;
    }
}
