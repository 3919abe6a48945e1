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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.golemcore.ngchat.domain.exception.ValidationException;

import java.util.List;

/**
 * Scale and unit of one viewer axis. Written as the two-element JSON array
 * {@code [scale, "unit"]}.
 */
public record Dimension(double scale, String unit) {

    public static Dimension of(double scale, String unit) {
        return new Dimension(scale, unit);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Dimension fromJson(List<Object> pair) {
        if (pair == null || pair.size() != 2 || !(pair.get(0) instanceof Number scale)) {
            throw new ValidationException("Dimension must be a [scale, unit] pair: " + pair);
        }
        Object unit = pair.get(1);
        return new Dimension(scale.doubleValue(), unit != null ? unit.toString() : "");
    }

    @JsonValue
    public List<Object> toJson() {
        return List.of(scale, unit != null ? unit : "");
    }
}
