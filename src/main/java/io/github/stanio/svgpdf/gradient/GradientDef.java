/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.gradient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.TransformParser;
import io.github.stanio.svgpdf.geom.Units;

/**
 * A {@code <linearGradient>} or {@code <radialGradient>} definition as
 * declared.  Stops are added as the {@code <stop>} children are read.
 *
 * @see  GradientResolver
 */
public final class GradientDef {

    public enum Kind { LINEAR, RADIAL }

    /**
     * How the coordinates are to be interpreted.
     */
    public enum CoordinateMode {
        /** Bounding box fractions given as percentages. */
        PERCENTAGE,
        /** Lengths, interpreted according to the gradient units. */
        MEASURE,
        /** Radial bounding box fractions given as plain numbers. */
        RATIO
    }

    private static final String[] LINEAR_ATTRS = { "x1", "y1", "x2", "y2" };
    private static final String[] LINEAR_DEFAULTS = { "0%", "0%", "100%", "0%" };

    private final String id;
    private final Kind kind;
    private final Boolean userSpaceOnUse;
    private final CoordinateMode mode;
    private final String[] coordinates;
    private final AffineMatrix transform;
    private final String reference;
    private final List<GradientStop> stops = new ArrayList<>();

    private GradientDef(String id, Kind kind, Boolean userSpaceOnUse,
                        CoordinateMode mode, String[] coordinates,
                        AffineMatrix transform, String reference) {
        this.id = id;
        this.kind = kind;
        this.userSpaceOnUse = userSpaceOnUse;
        this.mode = mode;
        this.coordinates = coordinates;
        this.transform = transform;
        this.reference = reference;
    }

    /**
     * Creates a gradient definition from element attributes.
     *
     * @param   id  the gradient id
     * @param   kind  linear or radial
     * @param   attributes  element attributes by local name
     * @return  a new definition with no stops
     */
    public static GradientDef of(String id, Kind kind, Map<String, String> attributes) {
        String units = attributes.get("gradientUnits");
        Boolean userSpaceOnUse = (units == null)
                                 ? null
                                 : Boolean.valueOf(units.strip().equals("userSpaceOnUse"));
        String transformList = attributes.get("gradientTransform");
        AffineMatrix transform = (transformList == null)
                                 ? null
                                 : TransformParser.parse(transformList);
        String href = attributes.get("href");
        String reference = (href != null && href.strip().startsWith("#"))
                           ? href.strip().substring(1)
                           : null;

        if (kind == Kind.LINEAR) {
            return linear(id, attributes, userSpaceOnUse, transform, reference);
        }
        return radial(id, attributes, userSpaceOnUse, transform, reference);
    }

    private static GradientDef linear(String id, Map<String, String> attributes,
            Boolean userSpaceOnUse, AffineMatrix transform, String reference) {
        boolean anySet = false;
        boolean anyPercent = false;
        String[] coords = new String[4];
        for (int i = 0; i < 4; i++) {
            String value = attributes.get(LINEAR_ATTRS[i]);
            anySet |= (value != null);
            anyPercent |= Units.isPercentage(value);
            coords[i] = (value == null) ? LINEAR_DEFAULTS[i] : value.strip();
        }
        CoordinateMode mode = (!anySet || anyPercent)
                              ? CoordinateMode.PERCENTAGE
                              : CoordinateMode.MEASURE;
        return new GradientDef(id, Kind.LINEAR, userSpaceOnUse,
                               mode, coords, transform, reference);
    }

    private static GradientDef radial(String id, Map<String, String> attributes,
            Boolean userSpaceOnUse, AffineMatrix transform, String reference) {
        String cx = attributes.get("cx");
        String cy = attributes.get("cy");
        String r = attributes.get("r");

        CoordinateMode mode;
        if (cx == null && cy == null
                || Units.isPercentage(cx) || Units.isPercentage(cy)) {
            mode = CoordinateMode.PERCENTAGE;
        } else if (r != null && !Units.isPercentage(r)
                && Units.number(r, Double.NaN) <= 1) {
            mode = CoordinateMode.RATIO;
        } else {
            mode = CoordinateMode.MEASURE;
        }

        cx = (cx == null) ? "50%" : cx.strip();
        cy = (cy == null) ? "50%" : cy.strip();
        String fx = attributes.get("fx");
        String fy = attributes.get("fy");
        String[] coords = {
            cx, cy,
            (fx == null) ? cx : fx.strip(),
            (fy == null) ? cy : fy.strip(),
            (r == null) ? "50%" : r.strip()
        };
        return new GradientDef(id, Kind.RADIAL, userSpaceOnUse,
                               mode, coords, transform, reference);
    }

    public String id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * {@return {@code TRUE} for {@code userSpaceOnUse}, {@code FALSE} for
     * {@code objectBoundingBox}, {@code null} if not specified}
     */
    public Boolean userSpaceOnUse() {
        return userSpaceOnUse;
    }

    public CoordinateMode mode() {
        return mode;
    }

    /**
     * {@return the raw coordinates: {@code x1 y1 x2 y2} for linear, and
     * {@code cx cy fx fy r} for radial gradients}
     */
    public String[] coordinates() {
        return coordinates.clone();
    }

    /** {@return the {@code gradientTransform}, or {@code null}} */
    public AffineMatrix transform() {
        return transform;
    }

    /** {@return the id of the referenced gradient, or {@code null}} */
    public String reference() {
        return reference;
    }

    public void addStop(GradientStop stop) {
        stops.add(stop);
    }

    public List<GradientStop> stops() {
        return Collections.unmodifiableList(stops);
    }

    @Override
    public String toString() {
        return "GradientDef(" + id + ", " + kind + ", " + mode
                + ", stops: " + stops.size() + ")";
    }

}
