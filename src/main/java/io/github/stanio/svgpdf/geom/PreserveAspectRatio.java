/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code preserveAspectRatio} value.
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/coords.html#PreserveAspectRatioAttribute"
 *          >SVG 1.1: The 'preserveAspectRatio' attribute</a>
 */
public final class PreserveAspectRatio {

    public static final PreserveAspectRatio DEFAULT =
            new PreserveAspectRatio(false, 0.5, 0.5, false);

    public static final PreserveAspectRatio NONE =
            new PreserveAspectRatio(true, 0, 0, false);

    private static final Pattern SYNTAX = Pattern.compile("\\s*(?:defer\\s+)?"
            + "(none|x(Min|Mid|Max)Y(Min|Mid|Max))(?:\\s+(meet|slice))?\\s*");

    private final boolean none;
    private final double alignX;
    private final double alignY;
    private final boolean slice;

    private PreserveAspectRatio(boolean none, double alignX, double alignY, boolean slice) {
        this.none = none;
        this.alignX = alignX;
        this.alignY = alignY;
        this.slice = slice;
    }

    /**
     * {@return the parsed value, or {@link #DEFAULT} ({@code xMidYMid meet})
     * for {@code null} and invalid values}
     */
    public static PreserveAspectRatio parse(String value) {
        if (value == null) return DEFAULT;

        Matcher m = SYNTAX.matcher(value);
        if (!m.matches()) return DEFAULT;

        if (m.group(1).equals("none")) return NONE;

        return new PreserveAspectRatio(false,
                                       alignment(m.group(2)),
                                       alignment(m.group(3)),
                                       "slice".equals(m.group(4)));
    }

    private static double alignment(String token) {
        switch (token) {
        case "Min": return 0;
        case "Max": return 1;
        default:    return 0.5;
        }
    }

    /** {@return whether non-uniform scaling is requested} */
    public boolean isNone() {
        return none;
    }

    /** {@return the horizontal alignment: 0 (min), 0.5 (mid), or 1 (max)} */
    public double alignX() {
        return alignX;
    }

    /** {@return the vertical alignment: 0 (min), 0.5 (mid), or 1 (max)} */
    public double alignY() {
        return alignY;
    }

    /** {@return {@code true} for {@code slice}, {@code false} for {@code meet}} */
    public boolean isSlice() {
        return slice;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PreserveAspectRatio)) return false;

        PreserveAspectRatio other = (PreserveAspectRatio) obj;
        return none == other.none
                && alignX == other.alignX
                && alignY == other.alignY
                && slice == other.slice;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(none) * 31 * 31 * 31
                + Double.hashCode(alignX) * 31 * 31
                + Double.hashCode(alignY) * 31
                + Boolean.hashCode(slice);
    }

    @Override
    public String toString() {
        if (none) return "none";

        return "x" + token(alignX) + "Y" + token(alignY)
                + (slice ? " slice" : " meet");
    }

    private static String token(double align) {
        return (align == 0) ? "Min" : (align == 1) ? "Max" : "Mid";
    }

}
