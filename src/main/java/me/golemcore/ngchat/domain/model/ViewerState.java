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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import me.golemcore.ngchat.domain.exception.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Neuroglancer viewer state document.
 *
 * <p>
 * The insertion order of {@link #getDimensions()} is significant:
 * {@code position[i]} belongs to the i-th axis. Keys of a loaded document that
 * this model does not know about are kept in order and written back after the
 * known keys.
 *
 * <p>
 * All mutators edit the document in place and return {@code this}. Use
 * {@link #copy()} to branch a view.
 */
@JsonPropertyOrder({ "dimensions", "position", "crossSectionScale", "projectionScale", "layers", "layout",
        "showAxisLines", "showScaleBar", "showDefaultAnnotations" })
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ViewerState {

    private static final double DEFAULT_AXIS_SCALE = 1e-9;
    private static final String DEFAULT_AXIS_UNIT = "m";
    private static final double DEFAULT_CROSS_SECTION_SCALE = 1.0;
    private static final double DEFAULT_PROJECTION_SCALE = 1024;
    private static final String DEFAULT_LAYOUT = "xy";

    private LinkedHashMap<String, Dimension> dimensions;
    private List<Double> position;
    private Double crossSectionScale;
    private Double projectionScale;
    private List<Layer> layers;
    private String layout;
    private Boolean showAxisLines;
    private Boolean showScaleBar;
    private Boolean showDefaultAnnotations;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extras = new LinkedHashMap<>();

    /**
     * Creates an empty document. Used for deserialization; new sessions start
     * from {@link #createDefault()}.
     */
    public ViewerState() {
    }

    /**
     * Default document: x, y, z at 1 nm, origin position, no layers, xy layout.
     */
    public static ViewerState createDefault() {
        ViewerState state = new ViewerState();
        LinkedHashMap<String, Dimension> dims = new LinkedHashMap<>();
        dims.put("x", Dimension.of(DEFAULT_AXIS_SCALE, DEFAULT_AXIS_UNIT));
        dims.put("y", Dimension.of(DEFAULT_AXIS_SCALE, DEFAULT_AXIS_UNIT));
        dims.put("z", Dimension.of(DEFAULT_AXIS_SCALE, DEFAULT_AXIS_UNIT));
        state.dimensions = dims;
        state.position = new ArrayList<>(List.of(0.0, 0.0, 0.0));
        state.crossSectionScale = DEFAULT_CROSS_SECTION_SCALE;
        state.projectionScale = DEFAULT_PROJECTION_SCALE;
        state.layers = new ArrayList<>();
        state.layout = DEFAULT_LAYOUT;
        return state;
    }

    /**
     * Moves the view. The first {@code center.size()} position entries are
     * overwritten; trailing entries (for example a time axis) are kept, and the
     * position is padded with zeros up to the number of dimensions.
     *
     * @param center
     *            new center coordinates, in dimension order
     * @param zoom
     *            {@code null} keeps the current cross-section scale
     * @param orientation
     *            {@code null} keeps the current layout
     */
    public ViewerState setView(List<Double> center, Zoom zoom, String orientation) {
        Objects.requireNonNull(center, "center");
        List<Double> updated = new ArrayList<>(center.size());
        for (Double value : center) {
            if (value == null) {
                throw new ValidationException("center must not contain null coordinates");
            }
            updated.add(value);
        }
        if (position != null && position.size() > updated.size()) {
            updated.addAll(position.subList(updated.size(), position.size()));
        }
        int axes = dimensions != null ? dimensions.size() : 0;
        while (updated.size() < axes) {
            updated.add(0.0);
        }
        position = updated;
        if (zoom != null) {
            crossSectionScale = zoom.crossSectionScale();
        }
        if (orientation != null && !orientation.isBlank()) {
            layout = orientation;
        }
        return this;
    }

    /**
     * Sets the normalized value range of an image or segmentation layer. Does
     * nothing when the layer is absent or is an annotation layer.
     */
    public ViewerState setLut(String layerName, double min, double max) {
        findLayer(layerName).ifPresent(layer -> {
            if (layer instanceof VolumeLayer volume) {
                volume.setNormalizedRange(min, max);
            }
        });
        return this;
    }

    /**
     * Adds a layer unless one with the same name already exists.
     *
     * @throws ValidationException
     *             if the type is not image, segmentation or annotation, or the
     *             name is blank
     */
    public ViewerState addLayer(String name, String type, Object source, LayerOptions options) {
        LayerType layerType = LayerType.fromWireName(type);
        if (name == null || name.isBlank()) {
            throw new ValidationException("Layer name must not be blank");
        }
        if (findLayer(name).isPresent()) {
            return this;
        }
        LayerOptions effective = options != null ? options : LayerOptions.defaults();
        Layer layer = switch (layerType) {
        case IMAGE -> ImageLayer.create(name, source, effective);
        case SEGMENTATION -> SegmentationLayer.create(name, source, effective);
        case ANNOTATION -> AnnotationLayer.create(name, source, effective);
        };
        mutableLayers().add(layer);
        return this;
    }

    public ViewerState setLayerVisibility(String layerName, boolean visible) {
        findLayer(layerName).ifPresent(layer -> layer.setVisible(visible));
        return this;
    }

    /**
     * Appends annotations to the named annotation layer, creating it first if
     * needed.
     *
     * @throws ValidationException
     *             if a non-annotation layer already uses the name
     */
    public ViewerState addAnnotations(String layerName, List<? extends AnnotationItem> items) {
        Objects.requireNonNull(items, "items");
        if (findLayer(layerName).isEmpty()) {
            addLayer(layerName, LayerType.ANNOTATION.getWireName(), null, null);
        }
        Layer layer = findLayer(layerName).orElseThrow();
        if (!(layer instanceof AnnotationLayer annotationLayer)) {
            throw new ValidationException("Layer '" + layerName + "' is a " + layer.getType()
                    + " layer, not an annotation layer");
        }
        for (AnnotationItem item : items) {
            annotationLayer.appendAnnotation(Objects.requireNonNull(item, "annotation item"));
        }
        return this;
    }

    public ViewerState setViewerSettings(Boolean showScaleBar, Boolean showDefaultAnnotations,
            Boolean showAxisLines, String layout) {
        if (showScaleBar != null) {
            this.showScaleBar = showScaleBar;
        }
        if (showDefaultAnnotations != null) {
            this.showDefaultAnnotations = showDefaultAnnotations;
        }
        if (showAxisLines != null) {
            this.showAxisLines = showAxisLines;
        }
        if (layout != null && !layout.isBlank()) {
            this.layout = layout;
        }
        return this;
    }

    public Optional<Layer> findLayer(String layerName) {
        if (layers == null || layerName == null) {
            return Optional.empty();
        }
        return layers.stream().filter(layer -> layerName.equals(layer.getName())).findFirst();
    }

    @JsonIgnore
    public List<String> getLayerNames() {
        if (layers == null) {
            return List.of();
        }
        return layers.stream().map(Layer::getName).toList();
    }

    /**
     * Returns a fully independent deep copy.
     */
    public ViewerState copy() {
        ViewerState copy = new ViewerState();
        copy.dimensions = dimensions != null ? new LinkedHashMap<>(dimensions) : null;
        copy.position = JsonValues.copyNumbers(position);
        copy.crossSectionScale = crossSectionScale;
        copy.projectionScale = projectionScale;
        if (layers != null) {
            copy.layers = new ArrayList<>(layers.size());
            for (Layer layer : layers) {
                copy.layers.add(layer.copy());
            }
        }
        copy.layout = layout;
        copy.showAxisLines = showAxisLines;
        copy.showScaleBar = showScaleBar;
        copy.showDefaultAnnotations = showDefaultAnnotations;
        copy.extras = JsonValues.copyMap(extras);
        return copy;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    public Object removeExtra(String key) {
        return extras.remove(key);
    }

    private List<Layer> mutableLayers() {
        if (layers == null) {
            layers = new ArrayList<>();
        } else if (!(layers instanceof ArrayList)) {
            layers = new ArrayList<>(layers);
        }
        return layers;
    }
}
