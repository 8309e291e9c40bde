/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.Arrays;
import java.util.Locale;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * Immutable 2D affine matrix in the SVG/PDF order {@code (a, b, c, d, e, f)}:
 * <pre>
 * <code>x' = a*x + c*y + e
 * y' = b*x + d*y + f</code></pre>
 * <p>
 * {@code m1.multiply(m2)} yields the matrix that applies {@code m2} first,
 * then {@code m1}, matching the left-to-right composition of SVG
 * {@code transform} lists.</p>
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/coords.html#TransformMatrixDefined"
 *          >SVG 1.1: The transformation matrix</a>
 */
public final class AffineMatrix {

    public static final AffineMatrix IDENTITY = new AffineMatrix(1, 0, 0, 1, 0, 0);

    private final double a;
    private final double b;
    private final double c;
    private final double d;
    private final double e;
    private final double f;

    public AffineMatrix(double a, double b, double c,
                        double d, double e, double f) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
        this.f = f;
    }

    public static AffineMatrix translate(double tx, double ty) {
        return new AffineMatrix(1, 0, 0, 1, tx, ty);
    }

    public static AffineMatrix scale(double sx, double sy) {
        return new AffineMatrix(sx, 0, 0, sy, 0, 0);
    }

    /**
     * {@return rotation by the given angle around the given pivot}
     *
     * @param   degrees  angle in degrees, positive values rotate from the
     *          positive x-axis toward the positive y-axis
     * @param   cx  pivot x
     * @param   cy  pivot y
     */
    public static AffineMatrix rotate(double degrees, double cx, double cy) {
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new AffineMatrix(cos, sin, -sin, cos,
                                cx * (1 - cos) + cy * sin,
                                cy * (1 - cos) - cx * sin);
    }

    public static AffineMatrix skewX(double degrees) {
        return new AffineMatrix(1, 0, Math.tan(Math.toRadians(degrees)), 1, 0, 0);
    }

    public static AffineMatrix skewY(double degrees) {
        return new AffineMatrix(1, Math.tan(Math.toRadians(degrees)), 0, 1, 0, 0);
    }

    public static AffineMatrix of(AffineTransform transform) {
        return new AffineMatrix(transform.getScaleX(), transform.getShearY(),
                                transform.getShearX(), transform.getScaleY(),
                                transform.getTranslateX(), transform.getTranslateY());
    }

    public double a() { return a; }
    public double b() { return b; }
    public double c() { return c; }
    public double d() { return d; }
    public double e() { return e; }
    public double f() { return f; }

    public boolean isIdentity() {
        return a == 1 && b == 0 && c == 0 && d == 1 && e == 0 && f == 0;
    }

    /**
     * {@return {@code this × other}}
     *
     * Applied to a point, {@code other} acts first.
     */
    public AffineMatrix multiply(AffineMatrix other) {
        if (other.isIdentity()) return this;
        if (isIdentity()) return other;

        return new AffineMatrix(a * other.a + c * other.b,
                                b * other.a + d * other.b,
                                a * other.c + c * other.d,
                                b * other.c + d * other.d,
                                a * other.e + c * other.f + e,
                                b * other.e + d * other.f + f);
    }

    public Point2D transform(double x, double y) {
        return new Point2D.Double(a * x + c * y + e, b * x + d * y + f);
    }

    /**
     * {@return the scale factor this matrix applies to lengths}
     *
     * Geometric mean of the axis scales, used for radii and stroke widths.
     */
    public double meanScale() {
        return Math.sqrt(Math.abs(a * d - b * c));
    }

    /**
     * Converts this matrix from the top-left-origin (y-down) SVG space to the
     * bottom-left-origin PDF space of a page with the given height.  Points
     * drawn under the converted matrix must have their y coordinate flipped
     * ({@code pageHeight - y}) as well.
     *
     * @param   pageHeight  height of the target page
     * @return  {@code F × this × F}, where {@code F} is the y-flip
     *          {@code (1, 0, 0, -1, 0, pageHeight)}
     */
    public AffineMatrix flipConjugate(double pageHeight) {
        return new AffineMatrix(a, -b, -c, d,
                                e + c * pageHeight,
                                pageHeight * (1 - d) - f);
    }

    /**
     * {@return {@code F × this}}, mapping this matrix's (y-down) output
     * space onto the PDF page, leaving its input space unflipped}
     */
    public AffineMatrix flipOutput(double pageHeight) {
        return new AffineMatrix(a, -b, c, -d, e, pageHeight - f);
    }

    public AffineTransform toAffineTransform() {
        return new AffineTransform(a, b, c, d, e, f);
    }

    public double[] toArray() {
        return new double[] { a, b, c, d, e, f };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AffineMatrix)) return false;

        return Arrays.equals(toArray(), ((AffineMatrix) obj).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "matrix(%s %s %s %s %s %s)", a, b, c, d, e, f);
    }

}
