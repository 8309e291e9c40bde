/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import io.github.stanio.svgpdf.geom.TransformParser;
import io.github.stanio.svgpdf.geom.Units;

/**
 * Computes element styles from the parent style, presentation attributes,
 * and {@code style} declarations.
 * <p>
 * For each property the first applicable source wins:</p>
 * <ol>
 * <li>the presentation attribute, unless {@code inherit};</li>
 * <li>the {@code style} declaration, unless {@code inherit};</li>
 * <li>the parent value for inherited properties, and for other properties
 * explicitly declared {@code inherit};</li>
 * <li>the document default.</li>
 * </ol>
 * <p>
 * The {@code font} shorthand fills in longhand properties not given
 * otherwise.  Font sizes are resolved to absolute user units against the
 * parent font size.</p>
 */
public class StyleResolver {

    private static final String INHERIT = "inherit";

    private static final double FONT_SCALE = 1.2;

    private final Units units;
    private final double defaultFontSize;

    public StyleResolver(Units units, double defaultFontSize) {
        this.units = units;
        this.defaultFontSize = defaultFontSize;
    }

    public double defaultFontSize() {
        return defaultFontSize;
    }

    /**
     * Resolves the style of an element.
     *
     * @param   parent  the parent element style
     * @param   attributes  element attributes by local name
     * @return  the element style
     */
    public Style resolve(Style parent, Map<String, String> attributes) {
        Map<String, String> declarations = InlineStyle.parse(attributes.get("style"));
        Map<String, String> shorthand = fontShorthand(attributes, declarations);

        EnumMap<Property, String> values = new EnumMap<>(Property.class);
        for (Property property : Property.values()) {
            String name = property.cssName();
            String attr = attributes.get(name);
            String decl = declarations.get(name);
            String value;
            if (attr != null && !isInherit(attr)) {
                value = attr.strip();
            } else if (decl != null && !isInherit(decl)) {
                value = decl;
            } else if (attr == null && decl == null
                    && shorthand.containsKey(name)) {
                value = shorthand.get(name);
            } else if (property.isInherited()
                    || isInherit(attr) || isInherit(decl)) {
                value = parent.get(property);
            } else {
                value = property.defaultValue();
            }
            values.put(property, value);
        }

        double parentSize = parent.fontSize(defaultFontSize);
        values.put(Property.FONT_SIZE,
                   number(fontSize(values.get(Property.FONT_SIZE), parentSize)));

        Map<String, String> extras = Collections.emptyMap();
        for (Map.Entry<String, String> entry : declarations.entrySet()) {
            if (Property.forName(entry.getKey()) == null) {
                if (extras.isEmpty()) {
                    extras = new LinkedHashMap<>();
                }
                extras.put(entry.getKey(), entry.getValue());
            }
        }

        return new Style(values, extras,
                TransformParser.parse(attributes.get("transform")));
    }

    private static Map<String, String> fontShorthand(Map<String, String> attributes,
                                                     Map<String, String> declarations) {
        String font = attributes.get(Property.FONT.cssName());
        if (font == null || isInherit(font)) {
            font = declarations.get(Property.FONT.cssName());
        }
        return isInherit(font) ? Collections.emptyMap()
                               : InlineStyle.expandFont(font);
    }

    private static boolean isInherit(String value) {
        return value != null && value.strip().equalsIgnoreCase(INHERIT);
    }

    /**
     * Resolves a {@code font-size} value to user units.
     *
     * @param   value  the specified value
     * @param   parentSize  the parent font size in user units
     * @return  the absolute font size
     */
    public double fontSize(String value, double parentSize) {
        String keyword = value.strip().toLowerCase(Locale.ROOT);
        switch (keyword) {
        case "xx-small": return defaultFontSize / (FONT_SCALE * FONT_SCALE * FONT_SCALE);
        case "x-small":  return defaultFontSize / (FONT_SCALE * FONT_SCALE);
        case "small":    return defaultFontSize / FONT_SCALE;
        case "medium":   return defaultFontSize;
        case "large":    return defaultFontSize * FONT_SCALE;
        case "x-large":  return defaultFontSize * FONT_SCALE * FONT_SCALE;
        case "xx-large": return defaultFontSize * FONT_SCALE * FONT_SCALE * FONT_SCALE;
        case "larger":   return parentSize * FONT_SCALE;
        case "smaller":  return parentSize / FONT_SCALE;
        default:
            double size = units.length(keyword, parentSize, parentSize, parentSize);
            return (size > 0) ? size : parentSize;
        }
    }

    private static String number(double value) {
        return (value == Math.rint(value) && Math.abs(value) < 1e15)
               ? Long.toString((long) value)
               : Double.toString(value);
    }

}
