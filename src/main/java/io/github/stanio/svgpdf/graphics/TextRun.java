/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

/**
 * A piece of text to lay out at a given position.
 */
public final class TextRun {

    public enum Anchor { START, MIDDLE, END }

    private final String text;
    private final double x;
    private final double y;
    private final Anchor anchor;
    private final boolean rightToLeft;
    private final String fontFamily;
    private final String fontWeight;
    private final String fontStyle;
    private final double fontSize;

    /**
     * @param  text  the text, whitespace already collapsed
     * @param  x  anchor point x in user space
     * @param  y  baseline y in user space
     * @param  anchor  {@code text-anchor}
     * @param  rightToLeft  {@code direction: rtl}
     * @param  fontFamily  {@code font-family}
     * @param  fontWeight  {@code font-weight}
     * @param  fontStyle  {@code font-style}
     * @param  fontSize  font size in user units
     */
    public TextRun(String text, double x, double y,
                   Anchor anchor, boolean rightToLeft,
                   String fontFamily, String fontWeight,
                   String fontStyle, double fontSize) {
        this.text = text;
        this.x = x;
        this.y = y;
        this.anchor = anchor;
        this.rightToLeft = rightToLeft;
        this.fontFamily = fontFamily;
        this.fontWeight = fontWeight;
        this.fontStyle = fontStyle;
        this.fontSize = fontSize;
    }

    /**
     * {@return the anchor for the given {@code text-anchor} value}
     */
    public static Anchor anchor(String value) {
        if (value == null) return Anchor.START;

        switch (value.strip()) {
        case "middle": return Anchor.MIDDLE;
        case "end":    return Anchor.END;
        default:       return Anchor.START;
        }
    }

    public String text() { return text; }
    public double x() { return x; }
    public double y() { return y; }
    public Anchor anchor() { return anchor; }
    public boolean isRightToLeft() { return rightToLeft; }
    public String fontFamily() { return fontFamily; }
    public String fontWeight() { return fontWeight; }
    public String fontStyle() { return fontStyle; }
    public double fontSize() { return fontSize; }

    @Override
    public String toString() {
        return "TextRun(\"" + text + "\", " + x + ", " + y + ", " + anchor
                + (rightToLeft ? ", rtl" : "") + ", " + fontFamily
                + " " + fontSize + ")";
    }

}
