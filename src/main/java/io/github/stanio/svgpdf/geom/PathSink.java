/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

/**
 * Receives path construction calls.
 *
 * @see  PathInterpreter
 */
public interface PathSink {

    /** Discards everything.  Used for bounding-box only interpretation. */
    PathSink NULL = new PathSink() {
        @Override public void moveTo(double x, double y) {/* discard */}
        @Override public void lineTo(double x, double y) {/* discard */}
        @Override public void curveTo(double x1, double y1,
                                      double x2, double y2,
                                      double x, double y) {/* discard */}
        @Override public void closePath() {/* discard */}
        @Override public void ellipticalArc(EllipticalArc arc) {/* discard */}
    };

    void moveTo(double x, double y);

    void lineTo(double x, double y);

    void curveTo(double x1, double y1, double x2, double y2, double x, double y);

    void closePath();

    /**
     * Appends the given arc, starting at the current point.  The default
     * implementation approximates it with cubic Bézier segments.
     */
    default void ellipticalArc(EllipticalArc arc) {
        arc.toCubics(this);
    }

    /**
     * Appends a closed axis-aligned rectangle subpath.
     */
    default void rect(double x, double y, double width, double height) {
        moveTo(x, y);
        lineTo(x + width, y);
        lineTo(x + width, y + height);
        lineTo(x, y + height);
        closePath();
    }

}
