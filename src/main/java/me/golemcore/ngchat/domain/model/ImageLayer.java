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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Grayscale or multichannel image volume.
 */
@JsonPropertyOrder({ "type", "name", "source", "visible", "shader", "shaderControls" })
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ImageLayer extends VolumeLayer {

    public static ImageLayer create(String name, Object source, LayerOptions options) {
        ImageLayer layer = new ImageLayer();
        applyDefaults(layer, name, source, options);
        return layer;
    }

    @Override
    public String getType() {
        return LayerType.IMAGE.getWireName();
    }

    @Override
    public ImageLayer copy() {
        return copyVolumeInto(new ImageLayer());
    }
}
