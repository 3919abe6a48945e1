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

import com.fasterxml.jackson.annotation.JsonValue;
import me.golemcore.ngchat.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Layer kinds the viewer state understands, with their wire names.
 */
public enum LayerType {

    IMAGE("image"), SEGMENTATION("segmentation"), ANNOTATION("annotation");

    private final String wireName;

    LayerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static LayerType fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (LayerType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unsupported layer type '" + value + "'. Allowed: "
                + Arrays.stream(values()).map(LayerType::getWireName).sorted().toList());
    }
}
