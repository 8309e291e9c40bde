/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

class InlineStyleTest {

    @Test
    void laterDeclarationWins() {
        assertThat(InlineStyle.parse("fill: red; stroke:blue !important; FILL: green"))
                .containsExactly(entry("stroke", "blue"), entry("fill", "green"));
    }

    @Test
    void malformedDeclarationsSkipped() {
        assertThat(InlineStyle.parse(";fill;:red; opacity: ;stroke : none;"))
                .containsExactly(entry("stroke", "none"));
    }

    @Test
    void valueMayContainColon() {
        assertThat(InlineStyle.parse("fill: url(data:x)"))
                .containsExactly(entry("fill", "url(data:x)"));
    }

    @Test
    void emptyStyle() {
        assertThat(InlineStyle.parse(null)).isEmpty();
        assertThat(InlineStyle.parse("  ")).isEmpty();
    }

    @Test
    void expandFont() {
        assertThat(InlineStyle.expandFont("italic bold 12px/14px Arial, sans-serif"))
                .containsOnly(entry("font-style", "italic"),
                              entry("font-weight", "bold"),
                              entry("font-size", "12px"),
                              entry("font-family", "Arial, sans-serif"));
    }

    @Test
    void expandFontSizeAndFamily() {
        assertThat(InlineStyle.expandFont("10pt serif"))
                .containsOnly(entry("font-size", "10pt"),
                              entry("font-family", "serif"));
    }

    @Test
    void expandFontWithoutSize() {
        assertThat(InlineStyle.expandFont("Arial")).isEmpty();
        assertThat(InlineStyle.expandFont("bold")).isEmpty();
    }

}
