/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.HashMap;
import java.util.Map;

/**
 * SVG elements handled by the converter.  Other elements are
 * {@link #UNKNOWN}: transparent containers whose content is still
 * processed.
 */
enum ElementKind {

    SVG("svg"),
    G("g"),
    DEFS("defs"),
    SYMBOL("symbol"),
    CLIP_PATH("clipPath"),
    LINEAR_GRADIENT("linearGradient"),
    RADIAL_GRADIENT("radialGradient"),
    STOP("stop"),
    USE("use"),
    PATH("path"),
    RECT("rect"),
    CIRCLE("circle"),
    ELLIPSE("ellipse"),
    LINE("line"),
    POLYLINE("polyline"),
    POLYGON("polygon"),
    IMAGE("image"),
    TEXT("text"),
    TSPAN("tspan"),
    UNKNOWN("");

    private static final Map<String, ElementKind> byName = new HashMap<>();
    static {
        for (ElementKind kind : values()) {
            byName.put(kind.localName, kind);
        }
    }

    private final String localName;

    private ElementKind(String localName) {
        this.localName = localName;
    }

    static ElementKind of(String localName) {
        return byName.getOrDefault(localName, UNKNOWN);
    }

    String localName() {
        return localName;
    }

    boolean isShape() {
        switch (this) {
        case PATH:
        case RECT:
        case CIRCLE:
        case ELLIPSE:
        case LINE:
        case POLYLINE:
        case POLYGON:
            return true;
        default:
            return false;
        }
    }

    /**
     * {@return whether {@code x} and {@code y} position the element itself,
     * rather than needing a translation}
     */
    boolean isPositioned() {
        switch (this) {
        case RECT:
        case IMAGE:
        case TEXT:
        case TSPAN:
        case SVG:
        case USE:
            return true;
        default:
            return false;
        }
    }

    /**
     * {@return whether the element registers definitions rather than
     * graphics}
     */
    boolean isDefinition() {
        return this == CLIP_PATH || this == LINEAR_GRADIENT
                || this == RADIAL_GRADIENT || this == STOP;
    }

}
