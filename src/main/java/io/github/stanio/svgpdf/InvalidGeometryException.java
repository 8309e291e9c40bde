/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

/**
 * Non-positive width or height after resolving explicit, intrinsic, and
 * {@code viewBox} dimensions.
 */
public class InvalidGeometryException extends SVGConversionException {

    private static final long serialVersionUID = 7614090155294380186L;

    public InvalidGeometryException(String message) {
        super(message);
    }

}
