/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code style} attribute declaration lists.
 */
public final class InlineStyle {

    private static final Pattern IMPORTANT = Pattern.compile("\\s*!\\s*important\\s*$",
                                                             Pattern.CASE_INSENSITIVE);

    private static final Pattern FONT_SIZE = Pattern.compile(
            "(?:[-+]?(?:\\d*\\.\\d+|\\d+\\.?)[a-z%]*|(?:xx?-)?(?:small|large)|medium|larger|smaller)"
            + "(?:/\\S+)?", Pattern.CASE_INSENSITIVE);

    private InlineStyle() {/* no instances */}

    /**
     * Parses the given declaration list.  Property names are lower-cased,
     * values are trimmed and stripped of {@code !important}.  Later
     * declarations override earlier ones.
     *
     * @param   style  the {@code style} attribute value, possibly {@code null}
     * @return  property name to value map in declaration order
     */
    public static Map<String, String> parse(String style) {
        if (style == null || style.isBlank())
            return Collections.emptyMap();

        Map<String, String> declarations = new LinkedHashMap<>();
        for (String item : style.split(";")) {
            int colon = item.indexOf(':');
            if (colon <= 0) continue;

            String name = item.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            String value = IMPORTANT.matcher(item.substring(colon + 1)).replaceFirst("").strip();
            if (name.isEmpty() || value.isEmpty()) continue;

            declarations.remove(name);
            declarations.put(name, value);
        }
        return declarations;
    }

    /**
     * Expands the {@code font} shorthand:
     * <pre>
     * <code>[ <var>style</var> || <var>variant</var> || <var>weight</var> ]? <var>size</var>[/<var>line-height</var>] <var>family</var></code></pre>
     *
     * @param   font  the shorthand value
     * @return  the longhand declarations found; empty if the value has no
     *          recognizable font size
     */
    public static Map<String, String> expandFont(String font) {
        if (font == null || font.isBlank())
            return Collections.emptyMap();

        Map<String, String> longhand = new LinkedHashMap<>();
        String[] tokens = font.strip().split("\\s+");
        int index = 0;
        for (; index < tokens.length; index++) {
            String token = tokens[index];
            String lower = token.toLowerCase(Locale.ROOT);
            if (lower.equals("italic") || lower.equals("oblique")) {
                longhand.put(Property.FONT_STYLE.cssName(), lower);
            } else if (lower.equals("small-caps")) {
                longhand.put(Property.FONT_VARIANT.cssName(), lower);
            } else if (lower.matches("bold|bolder|lighter|[1-9]00")) {
                longhand.put(Property.FONT_WEIGHT.cssName(), lower);
            } else if (!lower.equals("normal")) {
                break;
            }
        }
        if (index >= tokens.length)
            return Collections.emptyMap();

        Matcher size = FONT_SIZE.matcher(tokens[index]);
        if (!size.matches())
            return Collections.emptyMap();

        String sizeValue = tokens[index];
        int slash = sizeValue.indexOf('/');
        longhand.put(Property.FONT_SIZE.cssName(),
                     (slash > 0) ? sizeValue.substring(0, slash) : sizeValue);

        StringBuilder family = new StringBuilder();
        for (index++; index < tokens.length; index++) {
            if (family.length() > 0) family.append(' ');
            family.append(tokens[index]);
        }
        if (family.length() > 0) {
            longhand.put(Property.FONT_FAMILY.cssName(), family.toString());
        }
        return longhand;
    }

}
