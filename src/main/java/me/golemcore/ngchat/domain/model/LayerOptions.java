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

import lombok.Builder;
import lombok.Data;

/**
 * Optional settings for {@link ViewerState#addLayer}. Unset values fall back to
 * the per-type defaults.
 */
@Data
@Builder
public class LayerOptions {

    private Boolean visible;
    private String annotationColor;
    private String tool;
    private String tab;
    private String shader;

    public static LayerOptions defaults() {
        return LayerOptions.builder().build();
    }
}
