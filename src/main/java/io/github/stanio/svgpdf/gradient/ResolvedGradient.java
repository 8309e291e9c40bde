/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.gradient;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.github.stanio.svgpdf.geom.AffineMatrix;

/**
 * A gradient ready for shading emission.
 * <p>
 * The coordinates are given in a unit space which the {@linkplain
 * #placement() placement} matrix maps onto the current user space:
 * {@code x1 y1 x2 y2} for linear, {@code cx cy fx fy r} for radial
 * gradients.</p>
 */
public final class ResolvedGradient {

    private final GradientDef.Kind kind;
    private final AffineMatrix placement;
    private final double[] coordinates;
    private final List<GradientStop> stops;

    ResolvedGradient(GradientDef.Kind kind, AffineMatrix placement,
                     double[] coordinates, List<GradientStop> stops) {
        this.kind = kind;
        this.placement = placement;
        this.coordinates = coordinates;
        this.stops = Collections.unmodifiableList(stops);
    }

    public GradientDef.Kind kind() {
        return kind;
    }

    /**
     * {@return the unit space to user space matrix; {@code null} for a
     * single-stop gradient}
     */
    public AffineMatrix placement() {
        return placement;
    }

    public double[] coordinates() {
        return coordinates.clone();
    }

    /** {@return offset-sorted stops} */
    public List<GradientStop> stops() {
        return stops;
    }

    /**
     * {@return whether this gradient paints a single solid color}
     *
     * @see  #solidStop()
     */
    public boolean isSolid() {
        return stops.size() == 1;
    }

    /** {@return the only stop of a solid gradient} */
    public GradientStop solidStop() {
        if (!isSolid())
            throw new IllegalStateException("Not a single-stop gradient");

        return stops.get(0);
    }

    @Override
    public String toString() {
        return "ResolvedGradient(" + kind + ", " + placement
                + ", " + Arrays.toString(coordinates) + ", " + stops + ")";
    }

}
