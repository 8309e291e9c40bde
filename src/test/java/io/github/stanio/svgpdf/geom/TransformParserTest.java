/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.Point2D;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class TransformParserTest {

    private static void assertMatrix(AffineMatrix actual, double... expected) {
        assertThat(actual.toArray()).as("%s", actual)
                .containsExactly(expected, within(1e-9));
    }

    @Test
    void translateThenScale() {
        assertMatrix(TransformParser.parse("translate(10 20) scale(2)"),
                     2, 0, 0, 2, 10, 20);
    }

    @Test
    void commaSeparatedArguments() {
        assertMatrix(TransformParser.parse("translate(10,20),scale(2,3)"),
                     2, 0, 0, 3, 10, 20);
    }

    @Test
    void singleArgumentDefaults() {
        assertMatrix(TransformParser.parse("translate(7)"), 1, 0, 0, 1, 7, 0);
        assertMatrix(TransformParser.parse("scale(3)"), 3, 0, 0, 3, 0, 0);
    }

    @Test
    void matrix() {
        assertMatrix(TransformParser.parse("matrix(1 2 3 4 5 6)"), 1, 2, 3, 4, 5, 6);
    }

    @Test
    void rotate() {
        assertMatrix(TransformParser.parse("rotate(90)"), 0, 1, -1, 0, 0, 0);
    }

    @Test
    void rotateAroundPivot() {
        AffineMatrix m = TransformParser.parse("rotate(90, 10, 10)");

        Point2D p = m.transform(20, 10);
        assertThat(p.getX()).as("x").isCloseTo(10, within(1e-9));
        assertThat(p.getY()).as("y").isCloseTo(20, within(1e-9));
        Point2D pivot = m.transform(10, 10);
        assertThat(pivot.getX()).as("pivot x").isCloseTo(10, within(1e-9));
        assertThat(pivot.getY()).as("pivot y").isCloseTo(10, within(1e-9));
    }

    @Test
    void skew() {
        assertMatrix(TransformParser.parse("skewX(45)"), 1, 0, 1, 1, 0, 0);
        assertMatrix(TransformParser.parse("skewY(45)"), 1, 1, 0, 1, 0, 0);
    }

    @Test
    void unknownFunctionIsIdentity() {
        assertMatrix(TransformParser.parse("translate(5) bogus(3) translate(0 5)"),
                     1, 0, 0, 1, 5, 5);
    }

    @ParameterizedTest
    @ValueSource(strings = { "scale(1 2 3)", "rotate(1 2)", "matrix(1 2 3)",
                             "skewX()", "foo(1)", "translate" })
    void invalidIsIdentity(String transform) {
        assertThat(TransformParser.parse(transform).isIdentity())
                .as(transform).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "  " })
    void absentIsIdentity(String transform) {
        assertThat(TransformParser.parse(transform)).isSameAs(AffineMatrix.IDENTITY);
    }

}
