/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

/**
 * Maps color specifications to device colors.
 */
@FunctionalInterface
public interface ColorResolver {

    /**
     * {@return the device color for the given specification, or
     * {@code null} if not recognized}
     */
    DeviceColor resolve(String color);

}
