/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.util.List;
import java.util.Map;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.gradient.ResolvedGradient;
import io.github.stanio.svgpdf.style.BlendMode;

/**
 * Produces page-description (content stream) operators.
 * <p>
 * Path coordinates are given in the top-left-origin SVG space and flipped
 * by the engine using the page height.  Matrices are given already
 * converted to the bottom-left-origin page space.</p>
 */
public interface GraphicsEngine {

    /** {@return the save graphics state operator} */
    String saveState();

    /** {@return the restore graphics state operator} */
    String restoreState();

    /**
     * {@return the operator concatenating the given matrix to the current
     * transformation, or an empty string for an identity}
     */
    String transform(AffineMatrix pageMatrix);

    /**
     * Creates a path sink appending path construction operators to the
     * given buffer.
     *
     * @param   out  the output buffer
     * @param   pageHeight  page height for flipping y coordinates
     * @return  a new path sink
     */
    PathSink path(StringBuilder out, double pageHeight);

    /** {@return the given path-painting operator} */
    String paint(PaintOp op);

    String lineStyle(LineStyle style);

    String fillColor(DeviceColor color);

    String strokeColor(DeviceColor color);

    /**
     * Registers a graphics state parameter dictionary as necessary.
     *
     * @param   strokeAlpha  stroking alpha
     * @param   fillAlpha  non-stroking alpha
     * @param   blendMode  blend mode
     * @return  the operator setting the graphics state; an empty string
     *          when all values are defaults
     */
    String alpha(double strokeAlpha, double fillAlpha, BlendMode blendMode);

    /**
     * Registers a shading for the given gradient and returns the operators
     * painting it over the current clip region.
     *
     * @param   gradient  the resolved gradient, not solid
     * @param   colors  device colors corresponding to the gradient stops
     * @param   pagePlacement  the gradient unit space to page space matrix
     * @return  shading paint operators
     */
    String shading(ResolvedGradient gradient, List<DeviceColor> colors,
                   AffineMatrix pagePlacement);

    /**
     * {@return the named resources (graphics states, shadings) referenced
     * by operators produced so far, mapped to their dictionary sources}
     */
    Map<String, String> resources();

}
