/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.style;

import java.util.Locale;

/**
 * PDF blend modes corresponding to the CSS {@code mix-blend-mode} values.
 */
public enum BlendMode {

    NORMAL("Normal"),
    MULTIPLY("Multiply"),
    SCREEN("Screen"),
    OVERLAY("Overlay"),
    DARKEN("Darken"),
    LIGHTEN("Lighten"),
    COLOR_DODGE("ColorDodge"),
    COLOR_BURN("ColorBurn"),
    HARD_LIGHT("HardLight"),
    SOFT_LIGHT("SoftLight"),
    DIFFERENCE("Difference"),
    EXCLUSION("Exclusion"),
    HUE("Hue"),
    SATURATION("Saturation"),
    COLOR("Color"),
    LUMINOSITY("Luminosity");

    private final String pdfName;

    private BlendMode(String pdfName) {
        this.pdfName = pdfName;
    }

    /**
     * Maps a CSS {@code mix-blend-mode} keyword (case-insensitive), like
     * {@code color-dodge}, to the blend mode.
     *
     * @param   value  the CSS keyword
     * @return  the corresponding blend mode, or {@code NORMAL} for unknown
     *          and {@code null} values
     */
    public static BlendMode of(String value) {
        if (value == null) return NORMAL;

        String name = value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        for (BlendMode mode : values()) {
            if (mode.name().equals(name)) {
                return mode;
            }
        }
        return NORMAL;
    }

    /** {@return the PDF name (without the leading slash)} */
    public String pdfName() {
        return pdfName;
    }

}
