/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.io.IOException;

/**
 * Signals an SVG document cannot be converted, as opposed to an error
 * reading it (device error).
 *
 * @see  InvalidInputException
 * @see  InvalidGeometryException
 * @see  MalformedDocumentException
 */
public class SVGConversionException extends IOException {

    private static final long serialVersionUID = -3390524461727385364L;

    public SVGConversionException(String message) {
        super(message);
    }

    public SVGConversionException(String message, Throwable cause) {
        super(message, cause);
    }

}
