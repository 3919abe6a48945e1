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

@JsonPropertyOrder({ "center", "radii", "type", "id" })
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EllipsoidAnnotation extends AnnotationItem {

    @JsonProperty("center")
    private List<Double> center;

    @JsonProperty("radii")
    private List<Double> radii;

    EllipsoidAnnotation() {
    }

    public EllipsoidAnnotation(String id, List<Double> center, List<Double> radii) {
        super(id);
        this.center = vector(center, "center");
        this.radii = vector(radii, "radii");
    }

    /**
     * Builds the ellipsoid inscribed in a box of the given size.
     */
    public static EllipsoidAnnotation fromSize(String id, List<Double> center, List<Double> size) {
        List<Double> radii = new ArrayList<>();
        for (Double extent : vector(size, "size")) {
            radii.add(extent / 2.0);
        }
        return new EllipsoidAnnotation(id, center, radii);
    }

    @Override
    public String getType() {
        return "ellipsoid";
    }

    @Override
    public EllipsoidAnnotation copy() {
        EllipsoidAnnotation copy = withCommon(new EllipsoidAnnotation());
        copy.center = JsonValues.copyNumbers(center);
        copy.radii = JsonValues.copyNumbers(radii);
        return copy;
    }
}
