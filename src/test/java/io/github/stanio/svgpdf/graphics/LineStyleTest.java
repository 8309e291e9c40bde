/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.style.Style;
import io.github.stanio.svgpdf.style.StyleResolver;

class LineStyleTest {

    private final Units units = new Units(96);

    private final StyleResolver resolver = new StyleResolver(units, 12);

    private LineStyle lineStyle(Map<String, String> attributes) {
        Style style = resolver.resolve(Style.defaults(), attributes);
        return LineStyle.of(style, units, 100);
    }

    @Test
    void defaults() {
        LineStyle style = lineStyle(Map.of());

        assertThat(style.width()).as("width").isEqualTo(1);
        assertThat(style.cap()).as("cap").isEqualTo(0);
        assertThat(style.join()).as("join").isEqualTo(0);
        assertThat(style.miterLimit()).as("miterLimit").isEqualTo(4);
        assertThat(style.dashArray()).as("dashArray").isEmpty();
        assertThat(style.dashPhase()).as("dashPhase").isEqualTo(0);
    }

    @Test
    void strokeProperties() {
        LineStyle style = lineStyle(Map.of("stroke-width", "5%",
                                           "stroke-linecap", "round",
                                           "stroke-linejoin", "bevel",
                                           "stroke-miterlimit", "10",
                                           "stroke-dashoffset", "2"));

        assertThat(style.width()).as("width").isEqualTo(5);
        assertThat(style.cap()).as("cap").isEqualTo(1);
        assertThat(style.join()).as("join").isEqualTo(2);
        assertThat(style.miterLimit()).as("miterLimit").isEqualTo(10);
        assertThat(style.dashPhase()).as("dashPhase").isEqualTo(2);
    }

    @Test
    void oddDashArrayRepeated() {
        assertThat(lineStyle(Map.of("stroke-dasharray", "5 3 2")).dashArray())
                .containsExactly(5, 3, 2, 5, 3, 2);
    }

    @Test
    void invalidDashArraySolid() {
        assertThat(lineStyle(Map.of("stroke-dasharray", "-1 2")).dashArray())
                .as("negative").isEmpty();
        assertThat(lineStyle(Map.of("stroke-dasharray", "0, 0")).dashArray())
                .as("zero total").isEmpty();
        assertThat(lineStyle(Map.of("stroke-dasharray", "none")).dashArray())
                .as("none").isEmpty();
    }

    @Test
    void negativeWidthClamped() {
        assertThat(lineStyle(Map.of("stroke-width", "-3")).width()).isEqualTo(0);
    }

}
