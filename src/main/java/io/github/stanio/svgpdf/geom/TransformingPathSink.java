/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.awt.geom.Point2D;

/**
 * Maps all points through an affine matrix before passing them on.  Arcs
 * get decomposed into cubic segments which transform exactly.
 */
public class TransformingPathSink implements PathSink {

    private final PathSink target;
    private final AffineMatrix matrix;

    public TransformingPathSink(PathSink target, AffineMatrix matrix) {
        this.target = target;
        this.matrix = matrix;
    }

    /**
     * {@return a sink transforming through the given matrix, or the target
     * itself when the matrix is an identity}
     */
    public static PathSink of(PathSink target, AffineMatrix matrix) {
        return matrix.isIdentity() ? target
                                   : new TransformingPathSink(target, matrix);
    }

    @Override
    public void moveTo(double x, double y) {
        Point2D p = matrix.transform(x, y);
        target.moveTo(p.getX(), p.getY());
    }

    @Override
    public void lineTo(double x, double y) {
        Point2D p = matrix.transform(x, y);
        target.lineTo(p.getX(), p.getY());
    }

    @Override
    public void curveTo(double x1, double y1,
                        double x2, double y2,
                        double x, double y) {
        Point2D p1 = matrix.transform(x1, y1);
        Point2D p2 = matrix.transform(x2, y2);
        Point2D p = matrix.transform(x, y);
        target.curveTo(p1.getX(), p1.getY(),
                       p2.getX(), p2.getY(),
                       p.getX(), p.getY());
    }

    @Override
    public void closePath() {
        target.closePath();
    }

}
