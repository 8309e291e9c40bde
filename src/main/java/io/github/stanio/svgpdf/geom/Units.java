/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts SVG lengths to user units.  A user unit is a CSS pixel at the
 * configured resolution (pixels per inch).
 */
public final class Units {

    private static final Pattern LENGTH = Pattern.compile("(?ix) \\s*"
            + "( [-+]? (?:\\d*\\.\\d+|\\d+\\.?) (?:e[-+]?\\d+)? )"
            + "\\s* (px|pt|pc|mm|cm|in|em|ex|%)? \\s*");

    private static final double POINTS_PER_INCH = 72;

    private final double pixelsPerInch;

    public Units(double pixelsPerInch) {
        if (!(pixelsPerInch > 0))
            throw new IllegalArgumentException("pixelsPerInch: " + pixelsPerInch);

        this.pixelsPerInch = pixelsPerInch;
    }

    public double pixelsPerInch() {
        return pixelsPerInch;
    }

    /**
     * {@return the number of PDF points one user unit spans}
     */
    public double pointsPerUserUnit() {
        return POINTS_PER_INCH / pixelsPerInch;
    }

    /**
     * Converts the given length value to user units.
     *
     * @param   value  the length specification, possibly {@code null}
     * @param   percentBase  the reference length for percentages
     * @param   fontSize  the reference length for {@code em} and {@code ex}
     * @param   defaultValue  returned for {@code null} and unparseable values
     * @return  the length in user units
     */
    public double length(String value, double percentBase,
                         double fontSize, double defaultValue) {
        if (value == null) return defaultValue;

        Matcher m = LENGTH.matcher(value);
        if (!m.matches()) return defaultValue;

        double number = Double.parseDouble(m.group(1));
        String unit = m.group(2);
        if (unit == null) return number;

        switch (unit.toLowerCase(Locale.ROOT)) {
        case "pt":
            return number * pixelsPerInch / POINTS_PER_INCH;
        case "pc":
            return number * 12 * pixelsPerInch / POINTS_PER_INCH;
        case "mm":
            return number * pixelsPerInch / 25.4;
        case "cm":
            return number * pixelsPerInch / 2.54;
        case "in":
            return number * pixelsPerInch;
        case "em":
            return number * fontSize;
        case "ex":
            return number * fontSize / 2;
        case "%":
            return number * percentBase / 100;
        default:
            return number;
        }
    }

    /**
     * {@return whether the given value is a percentage}
     */
    public static boolean isPercentage(String value) {
        return value != null && value.strip().endsWith("%");
    }

    /**
     * Lenient number parsing: leading number of the given text or the
     * default value.
     */
    public static double number(String value, double defaultValue) {
        if (value == null) return defaultValue;

        Matcher m = LENGTH.matcher(value);
        return m.lookingAt() ? Double.parseDouble(m.group(1)) : defaultValue;
    }

    /**
     * Parses an opacity-like value: a number or percentage, clamped to
     * [0, 1].
     */
    public static double fraction(String value, double defaultValue) {
        if (value == null) return defaultValue;

        double number = number(value, defaultValue);
        if (isPercentage(value)) {
            number /= 100;
        }
        return Math.max(0, Math.min(1, number));
    }

}
