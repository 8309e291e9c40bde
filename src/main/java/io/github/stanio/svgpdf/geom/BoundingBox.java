/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.awt.geom.Rectangle2D;

/**
 * Running min/max bounding box.  Empty until the first point is added.
 */
public final class BoundingBox {

    private double minX = Double.POSITIVE_INFINITY;
    private double minY = Double.POSITIVE_INFINITY;
    private double maxX = Double.NEGATIVE_INFINITY;
    private double maxY = Double.NEGATIVE_INFINITY;

    public BoundingBox() {
        // empty
    }

    public static BoundingBox of(double x, double y, double width, double height) {
        BoundingBox box = new BoundingBox();
        box.add(x, y);
        box.add(x + width, y + height);
        return box;
    }

    public boolean isEmpty() {
        return minX > maxX;
    }

    public void add(double x, double y) {
        minX = Math.min(minX, x);
        minY = Math.min(minY, y);
        maxX = Math.max(maxX, x);
        maxY = Math.max(maxY, y);
    }

    public void add(BoundingBox other) {
        if (other.isEmpty()) return;

        add(other.minX, other.minY);
        add(other.maxX, other.maxY);
    }

    public double minX() { return minX; }
    public double minY() { return minY; }
    public double maxX() { return maxX; }
    public double maxY() { return maxY; }

    public double width() {
        return isEmpty() ? 0 : maxX - minX;
    }

    public double height() {
        return isEmpty() ? 0 : maxY - minY;
    }

    public BoundingBox copy() {
        BoundingBox copy = new BoundingBox();
        copy.add(this);
        return copy;
    }

    /**
     * {@return the box as a rectangle; an empty box maps to an empty
     * rectangle at the origin}
     */
    public Rectangle2D toRectangle() {
        return isEmpty() ? new Rectangle2D.Double()
                         : new Rectangle2D.Double(minX, minY, width(), height());
    }

    @Override
    public String toString() {
        return isEmpty() ? "BoundingBox(empty)"
                         : "BoundingBox(" + minX + ", " + minY
                                 + " - " + maxX + ", " + maxY + ")";
    }

}
