/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.gradient;

import java.util.Objects;

/**
 * A gradient ramp point.
 */
public final class GradientStop {

    private final double offset;
    private final String color;
    private final double opacity;

    /**
     * @param  offset  position along the gradient vector
     * @param  color  color specification (resolved by the color resolver)
     * @param  opacity  opacity in [0, 1]
     */
    public GradientStop(double offset, String color, double opacity) {
        this.offset = offset;
        this.color = Objects.requireNonNull(color, "null color");
        this.opacity = opacity;
    }

    public double offset() {
        return offset;
    }

    public String color() {
        return color;
    }

    public double opacity() {
        return opacity;
    }

    GradientStop withOffset(double offset) {
        return (offset == this.offset) ? this
                                       : new GradientStop(offset, color, opacity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GradientStop)) return false;

        GradientStop other = (GradientStop) obj;
        return offset == other.offset
                && color.equals(other.color)
                && opacity == other.opacity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, color, opacity);
    }

    @Override
    public String toString() {
        return "GradientStop(" + offset + ", " + color + ", " + opacity + ")";
    }

}
