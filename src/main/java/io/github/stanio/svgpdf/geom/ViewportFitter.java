/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.awt.geom.Rectangle2D;

/**
 * Computes the transformation projecting a {@code viewBox} onto a viewport.
 */
public final class ViewportFitter {

    private ViewportFitter() {/* no instances */}

    /**
     * {@return the parsed {@code viewBox}, or {@code null} when absent,
     * malformed, or of non-positive size}
     */
    public static Rectangle2D parseViewBox(String value) {
        double[] values = NumberList.parse(value);
        if (values.length != 4 || values[2] <= 0 || values[3] <= 0)
            return null;

        return new Rectangle2D.Double(values[0], values[1], values[2], values[3]);
    }

    /**
     * Computes the scale and offset placing the given view-box into a
     * viewport of the given size at the origin.
     * <p>
     * With {@code none} the axes scale independently.  Otherwise a uniform
     * scale is used: the smaller of the axis scales for {@code meet}, the
     * larger one for {@code slice}.  The leftover space of each axis
     * ({@code viewport - viewBox * scale}) is distributed according to the
     * alignment: none of it for {@code Min}, half for {@code Mid}, all of it
     * for {@code Max}.</p>
     *
     * @param   viewBox  the source view-box
     * @param   width  viewport width
     * @param   height  viewport height
     * @param   aspectRatio  the fit policy
     * @return  the view-box to viewport transformation
     */
    public static AffineMatrix fit(Rectangle2D viewBox,
                                   double width, double height,
                                   PreserveAspectRatio aspectRatio) {
        double sx = width / viewBox.getWidth();
        double sy = height / viewBox.getHeight();
        if (aspectRatio.isNone()) {
            return new AffineMatrix(sx, 0, 0, sy,
                                    -viewBox.getX() * sx,
                                    -viewBox.getY() * sy);
        }

        double scale = aspectRatio.isSlice() ? Math.max(sx, sy)
                                             : Math.min(sx, sy);
        double tx = aspectRatio.alignX() * (width - viewBox.getWidth() * scale);
        double ty = aspectRatio.alignY() * (height - viewBox.getHeight() * scale);
        return new AffineMatrix(scale, 0, 0, scale,
                                tx - viewBox.getX() * scale,
                                ty - viewBox.getY() * scale);
    }

}
