/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.gradient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import java.awt.geom.Point2D;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.gradient.GradientDef.CoordinateMode;
import io.github.stanio.svgpdf.gradient.GradientDef.Kind;

/**
 * Resolves gradient definitions against the bounding box of the painted
 * element.
 * <p>
 * {@code href} references supply the stops and the gradient units when not
 * given locally.  The coordinates, kind, and {@code gradientTransform} of
 * the referencing gradient are always its own.</p>
 * <p>
 * With {@code objectBoundingBox} units (the default), and in the percentage
 * and ratio modes, the coordinates are fractions of the bounding box which
 * the placement matrix maps onto the box.  With {@code userSpaceOnUse}
 * lengths, the coordinates are converted to user units and renormalized to
 * a square anchored at the box origin with a side of the larger box
 * dimension, preserving circular radial gradients.</p>
 */
public class GradientResolver {

    private static final Logger log = Logger.getLogger(GradientResolver.class.getName());

    private static final double[] DEGENERATE_LINEAR = { 1, 0, 0.999, 0 };

    private final Units units;

    public GradientResolver(Units units) {
        this.units = units;
    }

    /**
     * Resolves the given gradient reference.
     *
     * @param   id  the gradient id
     * @param   gradients  the document gradients
     * @param   box  bounding box of the painted element in user space
     * @param   viewportWidth  width of the nearest viewport, for
     *          {@code userSpaceOnUse} percentages
     * @param   viewportHeight  height of the nearest viewport
     * @return  the resolved gradient, or {@code null} if the gradient is
     *          unknown, has no stops, or the box is degenerate
     */
    public ResolvedGradient resolve(String id, Map<String, GradientDef> gradients,
                                    BoundingBox box, double viewportWidth,
                                    double viewportHeight) {
        GradientDef def = gradients.get(id);
        if (def == null) {
            log.log(Level.WARNING, "Unknown gradient reference: #{0}", id);
            return null;
        }

        List<GradientStop> stops = def.stops();
        Boolean userSpace = def.userSpaceOnUse();
        Set<String> visited = new HashSet<>();
        visited.add(def.id());
        GradientDef current = def;
        while ((stops.isEmpty() || userSpace == null)
                && current.reference() != null) {
            String ref = current.reference();
            if (!visited.add(ref)) {
                log.log(Level.WARNING, "Circular gradient reference: #{0}", ref);
                break;
            }
            current = gradients.get(ref);
            if (current == null) {
                log.log(Level.WARNING, "Unknown gradient reference: #{0}", ref);
                break;
            }
            if (stops.isEmpty()) {
                stops = current.stops();
            }
            if (userSpace == null) {
                userSpace = current.userSpaceOnUse();
            }
        }

        if (stops.isEmpty()) {
            log.log(Level.FINE, "Gradient #{0} has no stops", id);
            return null;
        }
        stops = normalizeStops(stops);
        if (stops.size() == 1) {
            return new ResolvedGradient(def.kind(), null, new double[0], stops);
        }

        boolean userSpaceOnUse = Boolean.TRUE.equals(userSpace);
        boolean fractions = def.mode() != CoordinateMode.MEASURE || !userSpaceOnUse;
        double width = box.width();
        double height = box.height();
        double side = Math.max(width, height);
        if (box.isEmpty() || (fractions ? width <= 0 || height <= 0 : side <= 0)) {
            log.log(Level.FINE, "Gradient #{0} not applicable to empty box: {1}",
                                new Object[] { id, box });
            return null;
        }

        double[] coords = fractions
                          ? fractionCoordinates(def)
                          : userCoordinates(def, viewportWidth, viewportHeight);
        if (def.transform() != null) {
            applyTransform(def.kind(), def.transform(), coords);
        }

        AffineMatrix placement;
        if (fractions) {
            placement = new AffineMatrix(width, 0, 0, height, box.minX(), box.minY());
        } else {
            for (int i = 0; i < 4; i++) {
                double origin = (i % 2 == 0) ? box.minX() : box.minY();
                coords[i] = (coords[i] - origin) / side;
            }
            if (def.kind() == Kind.RADIAL) {
                coords[4] /= side;
            }
            placement = new AffineMatrix(side, 0, 0, side, box.minX(), box.minY());
        }

        if (def.kind() == Kind.LINEAR
                && coords[0] == coords[2] && coords[1] == coords[3]) {
            // The last stop color takes over the whole area
            coords = DEGENERATE_LINEAR.clone();
        }
        return new ResolvedGradient(def.kind(), placement, coords, stops);
    }

    /**
     * {@return the normalized stops of the given gradient, possibly
     * inherited through {@code href} references; empty if none or unknown}
     */
    public List<GradientStop> stops(String id, Map<String, GradientDef> gradients) {
        Set<String> visited = new HashSet<>();
        GradientDef current = gradients.get(id);
        while (current != null && visited.add(current.id())) {
            if (!current.stops().isEmpty()) {
                return normalizeStops(current.stops());
            }
            current = (current.reference() == null)
                      ? null : gradients.get(current.reference());
        }
        return List.of();
    }

    /**
     * Clamps offsets to [0, 1] and makes them monotonic: an offset less
     * than a preceding one is raised to it.
     */
    static List<GradientStop> normalizeStops(List<GradientStop> stops) {
        List<GradientStop> result = new ArrayList<>(stops.size());
        double previous = 0;
        for (GradientStop stop : stops) {
            double offset = Math.max(previous, Math.max(0, Math.min(1, stop.offset())));
            result.add(stop.withOffset(offset));
            previous = offset;
        }
        return result;
    }

    private static double[] fractionCoordinates(GradientDef def) {
        String[] raw = def.coordinates();
        boolean clamp = def.mode() == CoordinateMode.PERCENTAGE;
        double[] coords = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double value = Units.number(raw[i], 0);
            if (Units.isPercentage(raw[i])) {
                value /= 100;
            }
            coords[i] = clamp ? Math.max(0, Math.min(1, value)) : value;
        }
        return coords;
    }

    private double[] userCoordinates(GradientDef def,
                                     double viewportWidth,
                                     double viewportHeight) {
        String[] raw = def.coordinates();
        double diagonal = Math.sqrt((viewportWidth * viewportWidth
                                     + viewportHeight * viewportHeight) / 2);
        double[] coords = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double base = (i == 4) ? diagonal
                                   : (i % 2 == 0) ? viewportWidth : viewportHeight;
            coords[i] = units.length(raw[i], base, 0, 0);
        }
        return coords;
    }

    private static void applyTransform(Kind kind, AffineMatrix transform, double[] coords) {
        Point2D p1 = transform.transform(coords[0], coords[1]);
        Point2D p2 = transform.transform(coords[2], coords[3]);
        coords[0] = p1.getX();
        coords[1] = p1.getY();
        coords[2] = p2.getX();
        coords[3] = p2.getY();
        if (kind == Kind.RADIAL) {
            coords[4] *= transform.meanScale();
        }
    }

}
