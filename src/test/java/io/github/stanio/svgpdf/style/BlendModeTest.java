/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BlendModeTest {

    @ParameterizedTest
    @CsvSource({
        "normal,       NORMAL,      Normal",
        "multiply,     MULTIPLY,    Multiply",
        "' Multiply ', MULTIPLY,    Multiply",
        "color-dodge,  COLOR_DODGE, ColorDodge",
        "hard-light,   HARD_LIGHT,  HardLight",
        "luminosity,   LUMINOSITY,  Luminosity",
        "bogus,        NORMAL,      Normal",
        ",             NORMAL,      Normal"
    })
    void cssKeyword(String keyword, BlendMode expected, String pdfName) {
        BlendMode mode = BlendMode.of(keyword);

        assertThat(mode).as("%s", keyword).isEqualTo(expected);
        assertThat(mode.pdfName()).as("pdfName").isEqualTo(pdfName);
    }

}
