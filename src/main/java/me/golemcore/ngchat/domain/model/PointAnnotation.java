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
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@JsonPropertyOrder({ "point", "type", "id" })
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PointAnnotation extends AnnotationItem {

    @JsonProperty("point")
    private List<Double> point;

    PointAnnotation() {
    }

    public PointAnnotation(String id, List<Double> point) {
        super(id);
        this.point = vector(point, "point");
    }

    @Override
    public String getType() {
        return "point";
    }

    @Override
    public PointAnnotation copy() {
        PointAnnotation copy = withCommon(new PointAnnotation());
        copy.point = JsonValues.copyNumbers(point);
        return copy;
    }
}
