/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code #rgb}, {@code #rgba}, {@code #rrggbb}, {@code #rrggbbaa},
 * {@code rgb(...)}, {@code rgba(...)}, and the basic CSS color keywords.
 */
public class BasicColorResolver implements ColorResolver {

    private static final Pattern HEX = Pattern.compile("#([0-9a-fA-F]{3,4}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");

    private static final Pattern FUNCTION = Pattern.compile("(?ix) rgba? \\s* \\( ([^)]*) \\)");

    private static final Map<String, DeviceColor> KEYWORDS = new HashMap<>();
    static {
        keyword("black", 0x000000);
        keyword("silver", 0xC0C0C0);
        keyword("gray", 0x808080);
        keyword("grey", 0x808080);
        keyword("white", 0xFFFFFF);
        keyword("maroon", 0x800000);
        keyword("red", 0xFF0000);
        keyword("purple", 0x800080);
        keyword("fuchsia", 0xFF00FF);
        keyword("magenta", 0xFF00FF);
        keyword("green", 0x008000);
        keyword("lime", 0x00FF00);
        keyword("olive", 0x808000);
        keyword("yellow", 0xFFFF00);
        keyword("navy", 0x000080);
        keyword("blue", 0x0000FF);
        keyword("teal", 0x008080);
        keyword("aqua", 0x00FFFF);
        keyword("cyan", 0x00FFFF);
        keyword("orange", 0xFFA500);
        keyword("brown", 0xA52A2A);
        keyword("pink", 0xFFC0CB);
        keyword("gold", 0xFFD700);
        keyword("darkgray", 0xA9A9A9);
        keyword("darkgrey", 0xA9A9A9);
        keyword("lightgray", 0xD3D3D3);
        keyword("lightgrey", 0xD3D3D3);
        KEYWORDS.put("transparent", new DeviceColor(0, 0, 0, 0));
    }

    private static void keyword(String name, int rgb) {
        KEYWORDS.put(name, DeviceColor.rgb((rgb >> 16) & 0xFF,
                                           (rgb >> 8) & 0xFF,
                                           rgb & 0xFF));
    }

    @Override
    public DeviceColor resolve(String color) {
        if (color == null) return null;

        String spec = color.strip();
        Matcher m = HEX.matcher(spec);
        if (m.matches()) {
            return hex(m.group(1));
        }
        m = FUNCTION.matcher(spec);
        if (m.matches()) {
            return function(m.group(1));
        }
        return KEYWORDS.get(spec.toLowerCase(Locale.ROOT));
    }

    private static DeviceColor hex(String digits) {
        if (digits.length() <= 4) {
            StringBuilder full = new StringBuilder(8);
            for (char ch : digits.toCharArray()) {
                full.append(ch).append(ch);
            }
            digits = full.toString();
        }
        int red = Integer.parseInt(digits.substring(0, 2), 16);
        int green = Integer.parseInt(digits.substring(2, 4), 16);
        int blue = Integer.parseInt(digits.substring(4, 6), 16);
        int alpha = (digits.length() == 8)
                    ? Integer.parseInt(digits.substring(6, 8), 16)
                    : 255;
        return new DeviceColor(red / 255.0, green / 255.0,
                               blue / 255.0, alpha / 255.0);
    }

    private static DeviceColor function(String arguments) {
        String[] args = arguments.strip().split("\\s*[,/]\\s*|\\s+");
        if (args.length < 3 || args.length > 4)
            return null;

        double[] rgb = new double[3];
        for (int i = 0; i < 3; i++) {
            double value = component(args[i], 255);
            if (Double.isNaN(value)) return null;
            rgb[i] = value;
        }
        double alpha = (args.length == 4) ? component(args[3], 1) : 1;
        if (Double.isNaN(alpha)) return null;

        return new DeviceColor(rgb[0], rgb[1], rgb[2], alpha);
    }

    private static double component(String value, double scale) {
        try {
            if (value.endsWith("%")) {
                return Double.parseDouble(value.substring(0, value.length() - 1)) / 100;
            }
            return Double.parseDouble(value) / scale;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

}
