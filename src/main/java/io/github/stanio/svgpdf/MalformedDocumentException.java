/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

/**
 * The document is not well-formed XML.
 */
public class MalformedDocumentException extends SVGConversionException {

    private static final long serialVersionUID = -1850806046823573922L;

    private final int lineNumber;
    private final int columnNumber;

    public MalformedDocumentException(String message,
                                      int lineNumber,
                                      int columnNumber,
                                      Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    /** {@return the line of the error, or -1 if not available} */
    public int getLineNumber() {
        return lineNumber;
    }

    /** {@return the column of the error, or -1 if not available} */
    public int getColumnNumber() {
        return columnNumber;
    }

    @Override
    public String getMessage() {
        return "Line " + lineNumber + ", column " + columnNumber
                + ": " + super.getMessage();
    }

}
