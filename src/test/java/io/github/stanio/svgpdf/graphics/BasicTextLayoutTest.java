/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.github.stanio.svgpdf.graphics.TextRun.Anchor;

class BasicTextLayoutTest {

    private final BasicTextLayout layout = new BasicTextLayout("F1", 0.5);

    private static TextRun run(String text, Anchor anchor, boolean rtl) {
        return new TextRun(text, 10, 20, anchor, rtl,
                           "helvetica", "normal", "normal", 10);
    }

    @Test
    void startAnchor() {
        TextLayout.Result result = layout.layout(run("abcd", Anchor.START, false), 100);

        assertThat(result.operators()).as("operators")
                .isEqualTo("BT\n/F1 10.000000 Tf\n10.000000 80.000000 Td\n(abcd) Tj\nET\n");
        assertThat(result.endX()).as("endX").isEqualTo(30);
    }

    @Test
    void middleAnchor() {
        TextLayout.Result result = layout.layout(run("abcd", Anchor.MIDDLE, false), 100);

        assertThat(result.operators()).as("operators")
                .contains("0.000000 80.000000 Td\n");
        assertThat(result.endX()).as("endX").isEqualTo(20);
    }

    @Test
    void endAnchor() {
        TextLayout.Result result = layout.layout(run("abcd", Anchor.END, false), 100);

        assertThat(result.operators()).as("operators")
                .contains("-10.000000 80.000000 Td\n");
        assertThat(result.endX()).as("endX").isEqualTo(10);
    }

    @Test
    void rightToLeft() {
        TextLayout.Result start = layout.layout(run("abcd", Anchor.START, true), 100);
        TextLayout.Result end = layout.layout(run("abcd", Anchor.END, true), 100);

        assertThat(start.operators()).as("start operators")
                .contains("-10.000000 80.000000 Td\n");
        assertThat(start.endX()).as("start endX").isEqualTo(-10);
        assertThat(end.operators()).as("end operators")
                .contains("10.000000 80.000000 Td\n");
        assertThat(end.endX()).as("end endX").isEqualTo(10);
    }

    @Test
    void emptyText() {
        TextLayout.Result result = layout.layout(run("", Anchor.START, false), 100);

        assertThat(result.operators()).as("operators").isEmpty();
        assertThat(result.endX()).as("endX").isEqualTo(10);
    }

    @Test
    void escape() {
        assertThat(BasicTextLayout.escape("a(b)\\c"))
                .isEqualTo("a\\(b\\)\\\\c");
    }

    @Test
    void anchorKeyword() {
        assertThat(TextRun.anchor("middle")).isEqualTo(Anchor.MIDDLE);
        assertThat(TextRun.anchor("end")).isEqualTo(Anchor.END);
        assertThat(TextRun.anchor("bogus")).isEqualTo(Anchor.START);
        assertThat(TextRun.anchor(null)).isEqualTo(Anchor.START);
    }

}
