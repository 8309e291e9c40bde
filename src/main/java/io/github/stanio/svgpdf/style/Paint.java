/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code fill} or {@code stroke} value: none, a color, or a reference to
 * a paint server (gradient) with an optional fallback color.
 */
public final class Paint {

    public enum Kind { NONE, COLOR, REFERENCE }

    public static final Paint NONE = new Paint(Kind.NONE, null, null);

    private static final Pattern REFERENCE = Pattern.compile("\\s*url\\(\\s*['\"]?#([^'\")]+)['\"]?\\s*\\)\\s*(.*)");

    private final Kind kind;
    private final String color;
    private final String reference;

    private Paint(Kind kind, String color, String reference) {
        this.kind = kind;
        this.color = color;
        this.reference = reference;
    }

    public static Paint color(String color) {
        return new Paint(Kind.COLOR, color, null);
    }

    /**
     * Parses a paint specification.
     *
     * @param   value  the property value
     * @param   currentColor  the value of the {@code color} property, used
     *          for {@code currentColor}
     * @return  the paint
     */
    public static Paint parse(String value, String currentColor) {
        if (value == null) return NONE;

        String spec = value.strip();
        if (spec.isEmpty() || spec.equalsIgnoreCase("none"))
            return NONE;

        Matcher m = REFERENCE.matcher(spec);
        if (m.matches()) {
            String fallback = m.group(2).strip();
            if (fallback.isEmpty() || fallback.equalsIgnoreCase("none")) {
                fallback = null;
            } else if (fallback.equalsIgnoreCase("currentColor")) {
                fallback = currentColor;
            }
            return new Paint(Kind.REFERENCE, fallback, m.group(1).strip());
        }

        if (spec.toLowerCase(Locale.ROOT).equals("currentcolor")) {
            return (currentColor == null) ? NONE : color(currentColor);
        }
        return color(spec);
    }

    /**
     * {@return the id referenced by a {@code url(#id)} value, or {@code null}}
     */
    public static String referenceId(String value) {
        if (value == null) return null;

        Matcher m = REFERENCE.matcher(value);
        return m.matches() ? m.group(1).strip() : null;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * {@return the color, or the fallback color of a reference;
     * {@code null} if none}
     */
    public String color() {
        return color;
    }

    /** {@return the referenced paint server id, or {@code null}} */
    public String reference() {
        return reference;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Paint)) return false;

        Paint other = (Paint) obj;
        return kind == other.kind
                && Objects.equals(color, other.color)
                && Objects.equals(reference, other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, color, reference);
    }

    @Override
    public String toString() {
        switch (kind) {
        case COLOR:
            return color;
        case REFERENCE:
            return "url(#" + reference + ")" + (color == null ? "" : " " + color);
        default:
            return "none";
        }
    }

}
