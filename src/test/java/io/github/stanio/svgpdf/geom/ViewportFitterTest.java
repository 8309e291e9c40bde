/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.Rectangle2D;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ViewportFitterTest {

    private static final Rectangle2D WIDE = new Rectangle2D.Double(0, 0, 100, 50);

    private static void assertMatrix(AffineMatrix actual, double... expected) {
        assertThat(actual.toArray()).as("%s", actual)
                .containsExactly(expected, within(1e-9));
    }

    @Test
    void parseViewBox() {
        assertThat(ViewportFitter.parseViewBox("0 0 100 50")).isEqualTo(WIDE);
        assertThat(ViewportFitter.parseViewBox(" -5,10, 20 ,30 "))
                .isEqualTo(new Rectangle2D.Double(-5, 10, 20, 30));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "0 0 0 10", "0 0 10 -1", "1 2 3", "1 2 3 4 5", "none" })
    void invalidViewBox(String value) {
        assertThat(ViewportFitter.parseViewBox(value)).as("%s", value).isNull();
    }

    @Test
    void defaultMeetCentered() {
        assertMatrix(ViewportFitter.fit(WIDE, 200, 200, PreserveAspectRatio.DEFAULT),
                     2, 0, 0, 2, 0, 50);
    }

    @Test
    void meetAlignedMax() {
        assertMatrix(ViewportFitter.fit(WIDE, 200, 200,
                                        PreserveAspectRatio.parse("xMaxYMax meet")),
                     2, 0, 0, 2, 0, 100);
    }

    @Test
    void sliceAlignedMin() {
        assertMatrix(ViewportFitter.fit(WIDE, 200, 200,
                                        PreserveAspectRatio.parse("xMinYMin slice")),
                     4, 0, 0, 4, 0, 0);
    }

    @Test
    void sliceCentered() {
        assertMatrix(ViewportFitter.fit(WIDE, 200, 200,
                                        PreserveAspectRatio.parse("xMidYMid slice")),
                     4, 0, 0, 4, -100, 0);
    }

    @Test
    void noneScalesIndependently() {
        assertMatrix(ViewportFitter.fit(WIDE, 200, 200, PreserveAspectRatio.NONE),
                     2, 0, 0, 4, 0, 0);
    }

    @Test
    void viewBoxOriginOffset() {
        Rectangle2D viewBox = new Rectangle2D.Double(10, 20, 100, 50);

        assertMatrix(ViewportFitter.fit(viewBox, 100, 50, PreserveAspectRatio.DEFAULT),
                     1, 0, 0, 1, -10, -20);
    }

    @Test
    void parseAspectRatio() {
        PreserveAspectRatio value = PreserveAspectRatio.parse("defer xMinYMax slice");

        assertThat(value.isNone()).as("none").isFalse();
        assertThat(value.alignX()).as("alignX").isEqualTo(0);
        assertThat(value.alignY()).as("alignY").isEqualTo(1);
        assertThat(value.isSlice()).as("slice").isTrue();
    }

    @Test
    void parseAspectRatioNone() {
        assertThat(PreserveAspectRatio.parse("none")).isSameAs(PreserveAspectRatio.NONE);
        assertThat(PreserveAspectRatio.parse("none slice").isNone()).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "bogus", "xMidYMid wrong", "xmidymid" })
    void invalidAspectRatioIsDefault(String value) {
        assertThat(PreserveAspectRatio.parse(value)).as("%s", value)
                .isSameAs(PreserveAspectRatio.DEFAULT);
    }

}
