/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.HashMap;
import java.util.Map;

/**
 * Known presentation properties with their document defaults.
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/propidx.html">SVG 1.1: Property Index</a>
 */
public enum Property {

    ALIGNMENT_BASELINE("alignment-baseline", "auto", false),
    BASELINE_SHIFT("baseline-shift", "baseline", false),
    CLIP("clip", "auto", false),
    CLIP_PATH("clip-path", "none", false),
    CLIP_RULE("clip-rule", "nonzero", true),
    COLOR("color", "black", true),
    COLOR_INTERPOLATION("color-interpolation", "sRGB", true),
    COLOR_INTERPOLATION_FILTERS("color-interpolation-filters", "linearRGB", true),
    COLOR_PROFILE("color-profile", "auto", true),
    COLOR_RENDERING("color-rendering", "auto", true),
    CURSOR("cursor", "auto", true),
    DIRECTION("direction", "ltr", true),
    DISPLAY("display", "inline", false),
    DOMINANT_BASELINE("dominant-baseline", "auto", false),
    ENABLE_BACKGROUND("enable-background", "accumulate", false),
    FILL("fill", "black", true),
    FILL_OPACITY("fill-opacity", "1", true),
    FILL_RULE("fill-rule", "nonzero", true),
    FILTER("filter", "none", false),
    FLOOD_COLOR("flood-color", "black", false),
    FLOOD_OPACITY("flood-opacity", "1", false),
    FONT("font", "", true),
    FONT_FAMILY("font-family", "helvetica", true),
    FONT_SIZE("font-size", "medium", true),
    FONT_SIZE_ADJUST("font-size-adjust", "none", true),
    FONT_STRETCH("font-stretch", "normal", true),
    FONT_STYLE("font-style", "normal", true),
    FONT_VARIANT("font-variant", "normal", true),
    FONT_WEIGHT("font-weight", "normal", true),
    GLYPH_ORIENTATION_HORIZONTAL("glyph-orientation-horizontal", "0deg", true),
    GLYPH_ORIENTATION_VERTICAL("glyph-orientation-vertical", "auto", true),
    IMAGE_RENDERING("image-rendering", "auto", true),
    KERNING("kerning", "auto", true),
    LETTER_SPACING("letter-spacing", "normal", true),
    LIGHTING_COLOR("lighting-color", "white", false),
    MARKER("marker", "", true),
    MARKER_END("marker-end", "none", true),
    MARKER_MID("marker-mid", "none", true),
    MARKER_START("marker-start", "none", true),
    MASK("mask", "none", false),
    MIX_BLEND_MODE("mix-blend-mode", "normal", true),
    OPACITY("opacity", "1", false),
    OVERFLOW("overflow", "auto", false),
    POINTER_EVENTS("pointer-events", "visiblePainted", true),
    SHAPE_RENDERING("shape-rendering", "auto", true),
    STOP_COLOR("stop-color", "black", false),
    STOP_OPACITY("stop-opacity", "1", false),
    STROKE("stroke", "none", true),
    STROKE_DASHARRAY("stroke-dasharray", "none", true),
    STROKE_DASHOFFSET("stroke-dashoffset", "0", true),
    STROKE_LINECAP("stroke-linecap", "butt", true),
    STROKE_LINEJOIN("stroke-linejoin", "miter", true),
    STROKE_MITERLIMIT("stroke-miterlimit", "4", true),
    STROKE_OPACITY("stroke-opacity", "1", true),
    STROKE_WIDTH("stroke-width", "1", true),
    TEXT_ANCHOR("text-anchor", "start", true),
    TEXT_DECORATION("text-decoration", "none", false),
    TEXT_RENDERING("text-rendering", "auto", true),
    UNICODE_BIDI("unicode-bidi", "normal", false),
    VISIBILITY("visibility", "visible", true),
    WORD_SPACING("word-spacing", "normal", true),
    WRITING_MODE("writing-mode", "lr-tb", true);

    private static final Map<String, Property> byName = new HashMap<>();
    static {
        for (Property p : values()) {
            byName.put(p.cssName, p);
        }
    }

    private final String cssName;
    private final String defaultValue;
    private final boolean inherited;

    private Property(String cssName, String defaultValue, boolean inherited) {
        this.cssName = cssName;
        this.defaultValue = defaultValue;
        this.inherited = inherited;
    }

    /**
     * {@return the property for the given attribute/declaration name, or
     * {@code null} if not a known property}
     */
    public static Property forName(String name) {
        return byName.get(name);
    }

    public String cssName() {
        return cssName;
    }

    public String defaultValue() {
        return defaultValue;
    }

    /** {@return whether descendants take this property from the parent} */
    public boolean isInherited() {
        return inherited;
    }

    @Override
    public String toString() {
        return cssName;
    }

}
