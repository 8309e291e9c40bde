/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans number lists as found in path data, {@code points}, {@code viewBox},
 * and transform arguments.
 * <p>
 * The number syntax is deliberately optimistic: an optional sign, digits,
 * and an optional fractional part.  Exponents are not recognized, and
 * anything that doesn't match (separators, stray characters) is skipped.</p>
 */
public final class NumberList {

    static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d*\\.\\d+|\\d+\\.?)");

    private static final double[] EMPTY = new double[0];

    private NumberList() {/* no instances */}

    public static double[] parse(CharSequence text) {
        if (text == null || text.length() == 0)
            return EMPTY;

        double[] values = new double[8];
        int count = 0;
        Matcher m = NUMBER.matcher(text);
        while (m.find()) {
            if (count == values.length) {
                values = Arrays.copyOf(values, count * 2);
            }
            values[count++] = Double.parseDouble(m.group());
        }
        return (count == values.length) ? values : Arrays.copyOf(values, count);
    }

    /**
     * {@return the first number in the given text, or the given default}
     */
    public static double first(CharSequence text, double defaultValue) {
        if (text == null) return defaultValue;

        Matcher m = NUMBER.matcher(text);
        return m.find() ? Double.parseDouble(m.group()) : defaultValue;
    }

}
