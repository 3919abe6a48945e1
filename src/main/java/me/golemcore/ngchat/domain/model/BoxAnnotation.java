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

import java.util.ArrayList;
import java.util.List;

/**
 * Axis-aligned box between two opposite corners.
 */
@JsonPropertyOrder({ "pointA", "pointB", "type", "id" })
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BoxAnnotation extends AnnotationItem {

    @JsonProperty("pointA")
    private List<Double> pointA;

    @JsonProperty("pointB")
    private List<Double> pointB;

    BoxAnnotation() {
    }

    public BoxAnnotation(String id, List<Double> pointA, List<Double> pointB) {
        super(id);
        this.pointA = vector(pointA, "pointA");
        this.pointB = vector(pointB, "pointB");
    }

    /**
     * Builds the box spanning {@code center - size/2} to {@code center + size/2}.
     */
    public static BoxAnnotation centered(String id, List<Double> center, List<Double> size) {
        List<Double> c = vector(center, "center");
        List<Double> s = vector(size, "size");
        List<Double> a = new ArrayList<>(c.size());
        List<Double> b = new ArrayList<>(c.size());
        for (int i = 0; i < c.size(); i++) {
            double half = i < s.size() ? s.get(i) / 2.0 : 0.0;
            a.add(c.get(i) - half);
            b.add(c.get(i) + half);
        }
        return new BoxAnnotation(id, a, b);
    }

    @Override
    public String getType() {
        return "box";
    }

    @Override
    public BoxAnnotation copy() {
        BoxAnnotation copy = withCommon(new BoxAnnotation());
        copy.pointA = JsonValues.copyNumbers(pointA);
        copy.pointB = JsonValues.copyNumbers(pointB);
        return copy;
    }
}
