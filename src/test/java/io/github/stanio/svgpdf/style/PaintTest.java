/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PaintTest {

    @Test
    void none() {
        assertThat(Paint.parse("none", "red")).as("none").isSameAs(Paint.NONE);
        assertThat(Paint.parse(null, "red")).as("null").isSameAs(Paint.NONE);
        assertThat(Paint.parse(" ", "red")).as("blank").isSameAs(Paint.NONE);
    }

    @Test
    void color() {
        Paint paint = Paint.parse(" #abc ", null);

        assertThat(paint.kind()).isEqualTo(Paint.Kind.COLOR);
        assertThat(paint.color()).isEqualTo("#abc");
    }

    @Test
    void referenceWithoutFallback() {
        Paint paint = Paint.parse("url(#grad)", "red");

        assertThat(paint.kind()).as("kind").isEqualTo(Paint.Kind.REFERENCE);
        assertThat(paint.reference()).as("reference").isEqualTo("grad");
        assertThat(paint.color()).as("fallback").isNull();
    }

    @Test
    void referenceWithFallback() {
        Paint paint = Paint.parse("url('#grad') blue", "red");

        assertThat(paint.reference()).as("reference").isEqualTo("grad");
        assertThat(paint.color()).as("fallback").isEqualTo("blue");
    }

    @ParameterizedTest
    @CsvSource({
        "url(#a),           a",
        "'url( \"#b\" )',   b",
        "url(#c) none,      c",
        "red,",
        "url(other.svg#d),"
    })
    void referenceId(String value, String expected) {
        assertThat(Paint.referenceId(value)).as(value).isEqualTo(expected);
    }

}
