/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.util.Arrays;

/**
 * An RGB color with components in [0, 1], and an optional alpha.
 */
public final class DeviceColor {

    public static final DeviceColor BLACK = new DeviceColor(0, 0, 0, 1);

    private final double red;
    private final double green;
    private final double blue;
    private final double alpha;

    public DeviceColor(double red, double green, double blue, double alpha) {
        this.red = clamp(red);
        this.green = clamp(green);
        this.blue = clamp(blue);
        this.alpha = clamp(alpha);
    }

    public static DeviceColor rgb(int red, int green, int blue) {
        return new DeviceColor(red / 255.0, green / 255.0, blue / 255.0, 1);
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }

    public double red() {
        return red;
    }

    public double green() {
        return green;
    }

    public double blue() {
        return blue;
    }

    /** {@return the alpha carried by the color specification itself} */
    public double alpha() {
        return alpha;
    }

    public double[] components() {
        return new double[] { red, green, blue };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DeviceColor)) return false;

        DeviceColor other = (DeviceColor) obj;
        return red == other.red && green == other.green
                && blue == other.blue && alpha == other.alpha;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new double[] { red, green, blue, alpha });
    }

    @Override
    public String toString() {
        return "DeviceColor(" + red + ", " + green + ", " + blue
                + (alpha < 1 ? ", " + alpha : "") + ")";
    }

}
