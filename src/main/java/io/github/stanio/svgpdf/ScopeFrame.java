/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.style.Style;

/**
 * Persistent (parent-linked) frame of the style and transformation scope
 * established by container elements.
 */
final class ScopeFrame {

    private final ScopeFrame parent;
    private final Style style;
    private final AffineMatrix ctm;
    private final double viewportWidth;
    private final double viewportHeight;
    private final boolean painting;
    private final double groupAlpha;
    private final int depth;

    private ScopeFrame(ScopeFrame parent, Style style, AffineMatrix ctm,
                       double viewportWidth, double viewportHeight,
                       boolean painting, double groupAlpha) {
        this.parent = parent;
        this.style = style;
        this.ctm = ctm;
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
        this.painting = painting;
        this.groupAlpha = groupAlpha;
        this.depth = (parent == null) ? 1 : parent.depth + 1;
    }

    /**
     * @param  style  the root element style
     * @param  ctm  root user space to (unflipped) page space
     * @param  viewportWidth  root viewport width in user units
     * @param  viewportHeight  root viewport height in user units
     */
    static ScopeFrame root(Style style, AffineMatrix ctm,
                           double viewportWidth, double viewportHeight) {
        return new ScopeFrame(null, style, ctm, viewportWidth, viewportHeight,
                              isPainting(style), style.opacity());
    }

    ScopeFrame push(Style style, AffineMatrix local) {
        return push(style, local, viewportWidth, viewportHeight);
    }

    ScopeFrame push(Style style, AffineMatrix local,
                    double viewportWidth, double viewportHeight) {
        return push(style, local, viewportWidth, viewportHeight, true);
    }

    /**
     * @param  renderable  {@code false} to disable painting of the new scope
     *         regardless of the style
     */
    ScopeFrame push(Style style, AffineMatrix local,
                    double viewportWidth, double viewportHeight,
                    boolean renderable) {
        return new ScopeFrame(this, style, ctm.multiply(local),
                              viewportWidth, viewportHeight,
                              renderable && painting && isPainting(style),
                              groupAlpha * style.opacity());
    }

    static boolean isPainting(Style style) {
        return style.isDisplayed() && style.isVisible();
    }

    ScopeFrame parent() {
        return parent;
    }

    Style style() {
        return style;
    }

    AffineMatrix ctm() {
        return ctm;
    }

    double viewportWidth() {
        return viewportWidth;
    }

    double viewportHeight() {
        return viewportHeight;
    }

    /** Normalized diagonal, the percentage base for non-directional lengths. */
    double viewportDiagonal() {
        return Math.sqrt((viewportWidth * viewportWidth
                          + viewportHeight * viewportHeight) / 2);
    }

    boolean isPainting() {
        return painting;
    }

    /** Product of the opacities of this and the enclosing scopes. */
    double groupAlpha() {
        return groupAlpha;
    }

    int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return "ScopeFrame(depth: " + depth + ", ctm: " + ctm
                + ", viewport: " + viewportWidth + "x" + viewportHeight
                + (painting ? "" : ", not painting") + ")";
    }

}
