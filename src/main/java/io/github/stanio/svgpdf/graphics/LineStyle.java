/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.util.Locale;

import io.github.stanio.svgpdf.geom.NumberList;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.style.Property;
import io.github.stanio.svgpdf.style.Style;

/**
 * Stroke geometry parameters.
 */
public final class LineStyle {

    public static final LineStyle DEFAULT = new LineStyle(1, 0, 0, 4, new double[0], 0);

    private final double width;
    private final int cap;
    private final int join;
    private final double miterLimit;
    private final double[] dashArray;
    private final double dashPhase;

    /**
     * @param  width  line width in user units
     * @param  cap  PDF line cap style: 0 butt, 1 round, 2 square
     * @param  join  PDF line join style: 0 miter, 1 round, 2 bevel
     * @param  miterLimit  miter limit
     * @param  dashArray  dash lengths, empty for solid lines
     * @param  dashPhase  dash offset
     */
    public LineStyle(double width, int cap, int join, double miterLimit,
                     double[] dashArray, double dashPhase) {
        this.width = width;
        this.cap = cap;
        this.join = join;
        this.miterLimit = miterLimit;
        this.dashArray = dashArray.clone();
        this.dashPhase = dashPhase;
    }

    /**
     * Extracts the stroke parameters of the given style.
     *
     * @param   style  element style
     * @param   units  for converting lengths
     * @param   percentBase  reference length for percentages
     * @return  the line style
     */
    public static LineStyle of(Style style, Units units, double percentBase) {
        double fontSize = style.fontSize(0);
        double width = units.length(style.get(Property.STROKE_WIDTH),
                                    percentBase, fontSize, 1);
        int cap;
        switch (style.get(Property.STROKE_LINECAP).strip().toLowerCase(Locale.ROOT)) {
        case "round":  cap = 1; break;
        case "square": cap = 2; break;
        default:       cap = 0;
        }
        int join;
        switch (style.get(Property.STROKE_LINEJOIN).strip().toLowerCase(Locale.ROOT)) {
        case "round": join = 1; break;
        case "bevel": join = 2; break;
        default:      join = 0;
        }
        double miterLimit = Units.number(style.get(Property.STROKE_MITERLIMIT), 4);

        double[] dashes = NumberList.parse(style.get(Property.STROKE_DASHARRAY));
        boolean validDashes = dashes.length > 0;
        double total = 0;
        for (double d : dashes) {
            validDashes &= (d >= 0);
            total += d;
        }
        if (!validDashes || total <= 0) {
            dashes = new double[0];
        } else if (dashes.length % 2 != 0) {
            double[] repeated = new double[dashes.length * 2];
            System.arraycopy(dashes, 0, repeated, 0, dashes.length);
            System.arraycopy(dashes, 0, repeated, dashes.length, dashes.length);
            dashes = repeated;
        }
        double phase = units.length(style.get(Property.STROKE_DASHOFFSET),
                                    percentBase, fontSize, 0);
        return new LineStyle(Math.max(0, width), cap, join,
                             Math.max(1, miterLimit), dashes, phase);
    }

    public double width() {
        return width;
    }

    public int cap() {
        return cap;
    }

    public int join() {
        return join;
    }

    public double miterLimit() {
        return miterLimit;
    }

    public double[] dashArray() {
        return dashArray.clone();
    }

    public double dashPhase() {
        return dashPhase;
    }

}
