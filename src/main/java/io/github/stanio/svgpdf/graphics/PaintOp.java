/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

/**
 * Path-painting (and clipping) operators ending a path object.
 */
public enum PaintOp {

    FILL("f"),
    FILL_EVEN_ODD("f*"),
    STROKE("S"),
    FILL_STROKE("B"),
    FILL_STROKE_EVEN_ODD("B*"),
    CLIP("W n"),
    CLIP_EVEN_ODD("W* n"),
    /** Ends the path without painting. */
    NONE("n");

    private final String operator;

    private PaintOp(String operator) {
        this.operator = operator;
    }

    /**
     * {@return the paint operator for the given combination; {@code NONE}
     * when neither fill nor stroke}
     */
    public static PaintOp of(boolean fill, boolean stroke, boolean evenOdd) {
        if (fill && stroke) {
            return evenOdd ? FILL_STROKE_EVEN_ODD : FILL_STROKE;
        } else if (fill) {
            return evenOdd ? FILL_EVEN_ODD : FILL;
        } else if (stroke) {
            return STROKE;
        }
        return NONE;
    }

    public static PaintOp clip(boolean evenOdd) {
        return evenOdd ? CLIP_EVEN_ODD : CLIP;
    }

    public String operator() {
        return operator;
    }

}
