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

import me.golemcore.ngchat.domain.exception.ValidationException;

/**
 * Requested zoom of a view change: either "fit" (reset the cross-section scale)
 * or an explicit cross-section scale.
 */
public record Zoom(boolean fit, double scale) {

    private static final String FIT = "fit";
    private static final double FIT_SCALE = 1.0;

    public static Zoom toFit() {
        return new Zoom(true, FIT_SCALE);
    }

    public static Zoom of(double scale) {
        if (Double.isNaN(scale) || Double.isInfinite(scale) || scale <= 0) {
            throw new ValidationException("Zoom must be a positive number, got " + scale);
        }
        return new Zoom(false, scale);
    }

    /**
     * Parses a tool argument: {@code null} stays absent, {@code "fit"} and
     * numbers (or numeric strings) are accepted.
     */
    public static Zoom parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        String text = raw.toString().trim();
        if (FIT.equalsIgnoreCase(text)) {
            return toFit();
        }
        try {
            return of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new ValidationException("Zoom must be 'fit' or a number, got '" + text + "'", e);
        }
    }

    public double crossSectionScale() {
        return fit ? FIT_SCALE : scale;
    }
}
