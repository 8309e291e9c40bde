/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static io.github.stanio.svgpdf.graphics.PdfGraphics.format;

/**
 * Text layout using a single font resource and an average character
 * advance.  No font metrics are consulted.
 */
public class BasicTextLayout implements TextLayout {

    private final String fontResource;
    private final double averageCharWidth;

    /**
     * @param  fontResource  font resource name, like {@code F1}
     * @param  averageCharWidth  character advance as a fraction of the font
     *         size
     */
    public BasicTextLayout(String fontResource, double averageCharWidth) {
        this.fontResource = fontResource;
        this.averageCharWidth = averageCharWidth;
    }

    /**
     * {@return the estimated advance width of the given text}
     */
    public double width(String text, double fontSize) {
        return text.codePointCount(0, text.length()) * averageCharWidth * fontSize;
    }

    @Override
    public Result layout(TextRun run, double pageHeight) {
        double width = width(run.text(), run.fontSize());
        // Left edge of the text box
        double left;
        switch (run.anchor()) {
        case MIDDLE:
            left = run.x() - width / 2;
            break;
        case END:
            left = run.isRightToLeft() ? run.x() : run.x() - width;
            break;
        default:
            left = run.isRightToLeft() ? run.x() - width : run.x();
        }
        double endX = run.isRightToLeft() ? left : left + width;

        if (run.text().isEmpty())
            return new Result("", endX);

        String operators = "BT\n/" + fontResource + " " + format(run.fontSize()) + " Tf\n"
                + format(left) + " " + format(pageHeight - run.y()) + " Td\n"
                + "(" + escape(run.text()) + ") Tj\nET\n";
        return new Result(operators, endX);
    }

    /**
     * Escapes a PDF literal string.
     */
    static String escape(String text) {
        StringBuilder buf = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
            case '(':
            case ')':
            case '\\':
                buf.append('\\').append(ch);
                break;
            case '\n':
                buf.append("\\n");
                break;
            case '\r':
                buf.append("\\r");
                break;
            default:
                buf.append(ch);
            }
        }
        return buf.toString();
    }

}
