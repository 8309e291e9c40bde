/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

/**
 * No usable content: empty source, or undecodable data.
 */
public class InvalidInputException extends SVGConversionException {

    private static final long serialVersionUID = 2052279426190640436L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

}
