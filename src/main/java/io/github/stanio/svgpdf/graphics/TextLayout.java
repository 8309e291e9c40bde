/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

/**
 * Lays out single lines of text.
 */
@FunctionalInterface
public interface TextLayout {

    /**
     * Lays out the given text run.
     *
     * @param   run  the text with its position and font
     * @param   pageHeight  page height for flipping y coordinates
     * @return  the text showing operators and the position following the
     *          text
     */
    Result layout(TextRun run, double pageHeight);


    final class Result {

        private final String operators;
        private final double endX;

        public Result(String operators, double endX) {
            this.operators = operators;
            this.endX = endX;
        }

        public String operators() {
            return operators;
        }

        /** {@return the x coordinate for text continuing this run} */
        public double endX() {
            return endX;
        }

    } // class Result


}
