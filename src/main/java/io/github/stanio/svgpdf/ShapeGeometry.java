/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.NumberList;
import io.github.stanio.svgpdf.geom.PathInterpreter;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.geom.Units;

/**
 * Builds the outlines of the basic shapes and paths.
 */
final class ShapeGeometry {

    private static final Logger log = Logger.getLogger(ShapeGeometry.class.getName());

    /** Control point distance approximating a quarter circle of radius 1. */
    static final double KAPPA = 4 * (Math.sqrt(2) - 1) / 3;

    private final Units units;
    private final PathInterpreter interpreter;

    ShapeGeometry(Units units, PathInterpreter interpreter) {
        this.units = units;
        this.interpreter = interpreter;
    }

    /**
     * Sends the outline of the given shape element to the given sink.
     *
     * @param   kind  the shape kind
     * @param   attributes  the element attributes
     * @param   sink  receives the outline
     * @param   scope  the scope providing viewport dimensions
     * @param   fontSize  the element font size for {@code em} lengths
     * @return  the bounding box of the outline in the element's user space;
     *          empty if the shape is not rendered
     */
    BoundingBox draw(ElementKind kind, Map<String, String> attributes,
                     PathSink sink, ScopeFrame scope, double fontSize) {
        double width = scope.viewportWidth();
        double height = scope.viewportHeight();
        double diagonal = scope.viewportDiagonal();
        switch (kind) {
        case PATH:
            String d = attributes.get("d");
            return (d == null) ? new BoundingBox() : interpreter.interpret(d, sink);

        case RECT:
            return rect(length(attributes, "x", width, fontSize),
                        length(attributes, "y", height, fontSize),
                        length(attributes, "width", width, fontSize),
                        length(attributes, "height", height, fontSize),
                        units.length(attributes.get("rx"), width, fontSize, Double.NaN),
                        units.length(attributes.get("ry"), height, fontSize, Double.NaN),
                        sink);

        case CIRCLE:
            double r = length(attributes, "r", diagonal, fontSize);
            return ellipse(length(attributes, "cx", width, fontSize),
                           length(attributes, "cy", height, fontSize), r, r, sink);

        case ELLIPSE:
            double rx = units.length(attributes.get("rx"), width, fontSize, Double.NaN);
            double ry = units.length(attributes.get("ry"), height, fontSize, Double.NaN);
            if (Double.isNaN(rx)) rx = ry;
            if (Double.isNaN(ry)) ry = rx;
            return ellipse(length(attributes, "cx", width, fontSize),
                           length(attributes, "cy", height, fontSize), rx, ry, sink);

        case LINE:
            double x1 = length(attributes, "x1", width, fontSize);
            double y1 = length(attributes, "y1", height, fontSize);
            double x2 = length(attributes, "x2", width, fontSize);
            double y2 = length(attributes, "y2", height, fontSize);
            sink.moveTo(x1, y1);
            sink.lineTo(x2, y2);
            BoundingBox box = new BoundingBox();
            box.add(x1, y1);
            box.add(x2, y2);
            return box;

        case POLYLINE:
            return polyline(NumberList.parse(attributes.get("points")), false, sink);

        case POLYGON:
            return polyline(NumberList.parse(attributes.get("points")), true, sink);

        default:
            throw new IllegalArgumentException("Not a shape: " + kind);
        }
    }

    private double length(Map<String, String> attributes, String name,
                          double percentBase, double fontSize) {
        return units.length(attributes.get(name), percentBase, fontSize, 0);
    }

    static BoundingBox rect(double x, double y, double width, double height,
                            double rx, double ry, PathSink sink) {
        if (width <= 0 || height <= 0) {
            log.log(Level.FINE, "Rectangle not rendered: {0}x{1}",
                                new Object[] { width, height });
            return new BoundingBox();
        }

        if (Double.isNaN(rx)) rx = ry;
        if (Double.isNaN(ry)) ry = rx;
        if (Double.isNaN(rx) || rx <= 0 || ry <= 0) {
            sink.rect(x, y, width, height);
            return BoundingBox.of(x, y, width, height);
        }

        rx = Math.min(rx, width / 2);
        ry = Math.min(ry, height / 2);
        double kx = rx * KAPPA;
        double ky = ry * KAPPA;
        double right = x + width;
        double bottom = y + height;
        sink.moveTo(x + rx, y);
        sink.lineTo(right - rx, y);
        sink.curveTo(right - rx + kx, y, right, y + ry - ky, right, y + ry);
        sink.lineTo(right, bottom - ry);
        sink.curveTo(right, bottom - ry + ky, right - rx + kx, bottom, right - rx, bottom);
        sink.lineTo(x + rx, bottom);
        sink.curveTo(x + rx - kx, bottom, x, bottom - ry + ky, x, bottom - ry);
        sink.lineTo(x, y + ry);
        sink.curveTo(x, y + ry - ky, x + rx - kx, y, x + rx, y);
        sink.closePath();
        return BoundingBox.of(x, y, width, height);
    }

    static BoundingBox ellipse(double cx, double cy, double rx, double ry, PathSink sink) {
        if (!(rx > 0 && ry > 0)) {
            log.log(Level.FINE, "Ellipse not rendered: rx={0}, ry={1}",
                                new Object[] { rx, ry });
            return new BoundingBox();
        }

        double kx = rx * KAPPA;
        double ky = ry * KAPPA;
        sink.moveTo(cx + rx, cy);
        sink.curveTo(cx + rx, cy + ky, cx + kx, cy + ry, cx, cy + ry);
        sink.curveTo(cx - kx, cy + ry, cx - rx, cy + ky, cx - rx, cy);
        sink.curveTo(cx - rx, cy - ky, cx - kx, cy - ry, cx, cy - ry);
        sink.curveTo(cx + kx, cy - ry, cx + rx, cy - ky, cx + rx, cy);
        sink.closePath();
        return BoundingBox.of(cx - rx, cy - ry, 2 * rx, 2 * ry);
    }

    static BoundingBox polyline(double[] points, boolean close, PathSink sink) {
        BoundingBox box = new BoundingBox();
        int count = points.length / 2;
        if (count < 2) {
            log.fine("Polyline with less than two points not rendered");
            return box;
        }

        for (int i = 0; i < count; i++) {
            double x = points[2 * i];
            double y = points[2 * i + 1];
            if (i == 0) {
                sink.moveTo(x, y);
            } else {
                sink.lineTo(x, y);
            }
            box.add(x, y);
        }
        if (close) {
            sink.closePath();
        }
        return box;
    }

}
