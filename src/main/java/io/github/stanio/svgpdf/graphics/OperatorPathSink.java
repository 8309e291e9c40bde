/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static io.github.stanio.svgpdf.graphics.PdfGraphics.format;

import io.github.stanio.svgpdf.geom.PathSink;

/**
 * Appends PDF path construction operators, flipping y coordinates.
 */
public class OperatorPathSink implements PathSink {

    private final StringBuilder out;
    private final double pageHeight;

    public OperatorPathSink(StringBuilder out, double pageHeight) {
        this.out = out;
        this.pageHeight = pageHeight;
    }

    private OperatorPathSink point(double x, double y) {
        out.append(format(x)).append(' ')
           .append(format(pageHeight - y)).append(' ');
        return this;
    }

    @Override
    public void moveTo(double x, double y) {
        point(x, y).out.append("m\n");
    }

    @Override
    public void lineTo(double x, double y) {
        point(x, y).out.append("l\n");
    }

    @Override
    public void curveTo(double x1, double y1,
                        double x2, double y2,
                        double x, double y) {
        point(x1, y1).point(x2, y2).point(x, y).out.append("c\n");
    }

    @Override
    public void closePath() {
        out.append("h\n");
    }

    @Override
    public void rect(double x, double y, double width, double height) {
        out.append(format(x)).append(' ')
           .append(format(pageHeight - y - height)).append(' ')
           .append(format(width)).append(' ')
           .append(format(height)).append(" re\n");
    }

}
