/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.awt.geom.Point2D;

/**
 * Center parameterization of an elliptical arc.
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/implnote.html#ArcConversionEndpointToCenter"
 *          >SVG 1.1: Conversion from endpoint to center parameterization</a>
 */
public final class EllipticalArc {

    private static final double TWO_PI = 2 * Math.PI;

    private final double cx;
    private final double cy;
    private final double rx;
    private final double ry;
    private final double rotation;
    private final double startAngle;
    private final double sweepAngle;

    /**
     * @param  cx  center x
     * @param  cy  center y
     * @param  rx  x-radius
     * @param  ry  y-radius
     * @param  rotation  x-axis rotation in radians
     * @param  startAngle  start angle in radians
     * @param  sweepAngle  signed angular extent in radians
     */
    public EllipticalArc(double cx, double cy, double rx, double ry,
                         double rotation, double startAngle, double sweepAngle) {
        this.cx = cx;
        this.cy = cy;
        this.rx = rx;
        this.ry = ry;
        this.rotation = rotation;
        this.startAngle = startAngle;
        this.sweepAngle = sweepAngle;
    }

    /**
     * Solves the center parameterization of an SVG arc segment.  The caller
     * handles the degenerate cases: zero radii, and start point equal to the
     * end point.
     *
     * @param   x0  start point x
     * @param   y0  start point y
     * @param   rx  x-radius (sign ignored)
     * @param   ry  y-radius (sign ignored)
     * @param   xAxisRotation  rotation in degrees
     * @param   largeArc  large-arc-flag
     * @param   sweep  sweep-flag
     * @param   x  end point x
     * @param   y  end point y
     * @return  the arc in center parameterization
     */
    public static EllipticalArc fromEndpoints(double x0, double y0,
                                              double rx, double ry,
                                              double xAxisRotation,
                                              boolean largeArc, boolean sweep,
                                              double x, double y) {
        double phi = Math.toRadians(xAxisRotation % 360);
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);

        double dx2 = (x0 - x) / 2;
        double dy2 = (y0 - y) / 2;
        double x1 = cos * dx2 + sin * dy2;
        double y1 = -sin * dx2 + cos * dy2;

        rx = Math.abs(rx);
        ry = Math.abs(ry);
        double lambda = (x1 * x1) / (rx * rx) + (y1 * y1) / (ry * ry);
        if (lambda > 1) {
            double scale = Math.sqrt(lambda);
            rx *= scale;
            ry *= scale;
        }

        double rx2 = rx * rx;
        double ry2 = ry * ry;
        double num = rx2 * ry2 - rx2 * y1 * y1 - ry2 * x1 * x1;
        double den = rx2 * y1 * y1 + ry2 * x1 * x1;
        double coef = Math.sqrt(Math.max(0, num / den));
        if (largeArc == sweep) {
            coef = -coef;
        }
        double cx1 = coef * rx * y1 / ry;
        double cy1 = -coef * ry * x1 / rx;

        double cx = cos * cx1 - sin * cy1 + (x0 + x) / 2;
        double cy = sin * cx1 + cos * cy1 + (y0 + y) / 2;

        double ux = (x1 - cx1) / rx;
        double uy = (y1 - cy1) / ry;
        double vx = (-x1 - cx1) / rx;
        double vy = (-y1 - cy1) / ry;
        double start = vectorAngle(1, 0, ux, uy);
        double extent = vectorAngle(ux, uy, vx, vy);
        if (!sweep && extent > 0) {
            extent -= TWO_PI;
        } else if (sweep && extent < 0) {
            extent += TWO_PI;
        }
        return new EllipticalArc(cx, cy, rx, ry, phi, start, extent);
    }

    /**
     * {@return the signed angle from vector {@code u} to vector {@code v}}
     *
     * The sign is the sign of the cross product {@code u × v}; zero cross
     * product counts as positive.
     */
    public static double vectorAngle(double ux, double uy, double vx, double vy) {
        double len = Math.sqrt((ux * ux + uy * uy) * (vx * vx + vy * vy));
        if (len == 0) return 0;

        double cos = Math.max(-1, Math.min(1, (ux * vx + uy * vy) / len));
        double angle = Math.acos(cos);
        return (ux * vy - uy * vx < 0) ? -angle : angle;
    }

    public double centerX() { return cx; }
    public double centerY() { return cy; }
    public double radiusX() { return rx; }
    public double radiusY() { return ry; }

    /** {@return x-axis rotation in radians} */
    public double rotation() { return rotation; }

    /** {@return start angle in radians} */
    public double startAngle() { return startAngle; }

    /** {@return signed angular extent in radians} */
    public double sweepAngle() { return sweepAngle; }

    public Point2D pointAt(double angle) {
        double cos = Math.cos(rotation);
        double sin = Math.sin(rotation);
        double ex = rx * Math.cos(angle);
        double ey = ry * Math.sin(angle);
        return new Point2D.Double(cx + cos * ex - sin * ey,
                                  cy + sin * ex + cos * ey);
    }

    /**
     * {@return the exact bounds of the arc}
     */
    public BoundingBox bounds() {
        BoundingBox box = new BoundingBox();
        addPoint(box, startAngle);
        addPoint(box, startAngle + sweepAngle);

        double cos = Math.cos(rotation);
        double sin = Math.sin(rotation);
        // Parameters of the horizontal and vertical tangents
        double tx = Math.atan2(-ry * sin, rx * cos);
        double ty = Math.atan2(ry * cos, rx * sin);
        for (double t : new double[] { tx, tx + Math.PI, ty, ty + Math.PI }) {
            if (spans(t)) {
                addPoint(box, t);
            }
        }
        return box;
    }

    private void addPoint(BoundingBox box, double angle) {
        Point2D p = pointAt(angle);
        box.add(p.getX(), p.getY());
    }

    private boolean spans(double angle) {
        double delta = (sweepAngle >= 0) ? angle - startAngle
                                         : startAngle - angle;
        delta %= TWO_PI;
        if (delta < 0) {
            delta += TWO_PI;
        }
        return delta <= Math.abs(sweepAngle);
    }

    /**
     * Emits cubic Bézier segments of at most 90° each, approximating this
     * arc.  The sink's current point is expected at the arc start.
     */
    public void toCubics(PathSink sink) {
        int segments = Math.max(1, (int) Math.ceil(Math.abs(sweepAngle) / (Math.PI / 2) - 1e-9));
        double delta = sweepAngle / segments;
        double k = 4.0 / 3 * Math.tan(delta / 4);

        double cos = Math.cos(rotation);
        double sin = Math.sin(rotation);
        double t1 = startAngle;
        Point2D p1 = pointAt(t1);
        for (int i = 0; i < segments; i++) {
            double t2 = t1 + delta;
            Point2D p2 = pointAt(t2);

            // Derivatives at t1 and t2
            double d1x = -rx * cos * Math.sin(t1) - ry * sin * Math.cos(t1);
            double d1y = -rx * sin * Math.sin(t1) + ry * cos * Math.cos(t1);
            double d2x = -rx * cos * Math.sin(t2) - ry * sin * Math.cos(t2);
            double d2y = -rx * sin * Math.sin(t2) + ry * cos * Math.cos(t2);

            sink.curveTo(p1.getX() + k * d1x, p1.getY() + k * d1y,
                         p2.getX() - k * d2x, p2.getY() - k * d2y,
                         p2.getX(), p2.getY());
            t1 = t2;
            p1 = p2;
        }
    }

    @Override
    public String toString() {
        return "EllipticalArc(center: " + cx + ", " + cy
                + ", radii: " + rx + ", " + ry
                + ", rotation: " + Math.toDegrees(rotation)
                + ", start: " + Math.toDegrees(startAngle)
                + ", sweep: " + Math.toDegrees(sweepAngle) + ")";
    }

}
