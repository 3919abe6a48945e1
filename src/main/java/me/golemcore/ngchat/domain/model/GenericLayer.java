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
 * Layer of a type this service does not model (mesh, skeleton, ...), loaded
 * from a foreign viewer state. Everything except name and visibility is kept
 * in the extras and written back unchanged.
 */
@JsonPropertyOrder({ "type", "name", "visible" })
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GenericLayer extends Layer {

    private String type;

    GenericLayer() {
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
    public GenericLayer copy() {
        GenericLayer copy = copyCommonInto(new GenericLayer());
        copy.type = type;
        return copy;
    }
}
