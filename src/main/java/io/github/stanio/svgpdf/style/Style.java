/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.Units;

/**
 * Resolved presentation properties of a single element.  Immutable.
 * <p>
 * Every {@link Property} has a value.  Declarations with no corresponding
 * {@code Property} are kept in a separate, non-inherited map of
 * {@linkplain #extra(String) extras}.</p>
 *
 * @see  StyleResolver
 */
public final class Style {

    private static final Style DEFAULTS;
    static {
        EnumMap<Property, String> values = new EnumMap<>(Property.class);
        for (Property p : Property.values()) {
            values.put(p, p.defaultValue());
        }
        DEFAULTS = new Style(values, Collections.emptyMap(), AffineMatrix.IDENTITY);
    }

    private static final Pattern CLIP_RECT = Pattern.compile("\\s*rect\\s*\\(([^)]*)\\)\\s*",
                                                             Pattern.CASE_INSENSITIVE);

    private final EnumMap<Property, String> values;
    private final Map<String, String> extras;
    private final AffineMatrix transform;

    Style(EnumMap<Property, String> values,
          Map<String, String> extras,
          AffineMatrix transform) {
        this.values = values;
        this.extras = extras;
        this.transform = transform;
    }

    /**
     * {@return the document default style}
     */
    public static Style defaults() {
        return DEFAULTS;
    }

    public String get(Property property) {
        return values.get(property);
    }

    /**
     * {@return the value of a declaration with no corresponding
     * {@code Property}, or {@code null}}
     */
    public String extra(String name) {
        return extras.get(name);
    }

    public Map<String, String> extras() {
        return Collections.unmodifiableMap(extras);
    }

    /** {@return the element's own {@code transform}} */
    public AffineMatrix transform() {
        return transform;
    }

    private boolean is(Property property, String value) {
        return get(property).strip().equalsIgnoreCase(value);
    }

    /** {@return {@code false} for {@code display: none}} */
    public boolean isDisplayed() {
        return !is(Property.DISPLAY, "none");
    }

    /** {@return {@code false} for {@code visibility: hidden | collapse}} */
    public boolean isVisible() {
        return !(is(Property.VISIBILITY, "hidden")
                || is(Property.VISIBILITY, "collapse"));
    }

    public double opacity() {
        return Units.fraction(get(Property.OPACITY), 1);
    }

    public double fillOpacity() {
        return Units.fraction(get(Property.FILL_OPACITY), 1);
    }

    public double strokeOpacity() {
        return Units.fraction(get(Property.STROKE_OPACITY), 1);
    }

    public double stopOpacity() {
        return Units.fraction(get(Property.STOP_OPACITY), 1);
    }

    public BlendMode blendMode() {
        return BlendMode.of(get(Property.MIX_BLEND_MODE));
    }

    public Paint fill() {
        return Paint.parse(get(Property.FILL), get(Property.COLOR));
    }

    public Paint stroke() {
        return Paint.parse(get(Property.STROKE), get(Property.COLOR));
    }

    public boolean isEvenOddFill() {
        return is(Property.FILL_RULE, "evenodd");
    }

    public boolean isEvenOddClip() {
        return is(Property.CLIP_RULE, "evenodd");
    }

    /**
     * {@return the resolved font size in user units}
     *
     * @param  defaultSize  the size to use if not resolved to a number
     */
    public double fontSize(double defaultSize) {
        return Units.number(get(Property.FONT_SIZE), defaultSize);
    }

    /**
     * {@return the id referenced by {@code clip-path}, or {@code null}}
     */
    public String clipPathReference() {
        return Paint.referenceId(get(Property.CLIP_PATH));
    }

    /**
     * Parses an old-style {@code clip: rect(top, right, bottom, left)}.
     * {@code auto} offsets are returned as {@code NaN}.
     *
     * @return  the four offsets in top, right, bottom, left order, or
     *          {@code null} for {@code auto} and invalid values
     */
    public double[] clipRect() {
        Matcher m = CLIP_RECT.matcher(get(Property.CLIP));
        if (!m.matches()) return null;

        String[] args = m.group(1).strip().split("\\s*,\\s*|\\s+");
        if (args.length != 4) return null;

        double[] offsets = new double[4];
        for (int i = 0; i < 4; i++) {
            offsets[i] = args[i].toLowerCase(Locale.ROOT).equals("auto")
                         ? Double.NaN
                         : Units.number(args[i], 0);
        }
        return offsets;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("Style(");
        values.forEach((property, value) -> {
            if (!value.equals(property.defaultValue())) {
                buf.append(property).append(": ").append(value).append("; ");
            }
        });
        if (!transform.isIdentity()) {
            buf.append("transform: ").append(transform);
        }
        return buf.append(')').toString();
    }

}
