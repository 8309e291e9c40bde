/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.NoSuchElementException;

/**
 * The given handle has not been produced by the converter.
 */
public class UnknownHandleException extends NoSuchElementException {

    private static final long serialVersionUID = 4981170217043926154L;

    private final int handle;

    public UnknownHandleException(int handle) {
        super("Unknown handle: " + handle);
        this.handle = handle;
    }

    public int handle() {
        return handle;
    }

}
