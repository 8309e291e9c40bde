/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code transform} attribute values.
 * <p>
 * The transform functions are composed left to right, so the rightmost one
 * acts first on a point:</p>
 * <pre>
 * <code>translate(10,20) scale(2)</code> maps (1, 0) to (12, 20)</pre>
 * <p>
 * Unknown functions, and functions with an unsupported number of arguments,
 * contribute an identity.</p>
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/coords.html#TransformAttribute"
 *          >SVG 1.1: The 'transform' attribute</a>
 */
public final class TransformParser {

    private static final Logger log = Logger.getLogger(TransformParser.class.getName());

    private static final Pattern FUNCTION = Pattern.compile("([A-Za-z]+)\\s*\\(([^)]*)\\)");

    private TransformParser() {/* no instances */}

    /**
     * {@return the composition of the given transform list; identity for
     * {@code null} or blank values}
     */
    public static AffineMatrix parse(String transformList) {
        if (transformList == null || transformList.isBlank())
            return AffineMatrix.IDENTITY;

        AffineMatrix result = AffineMatrix.IDENTITY;
        Matcher m = FUNCTION.matcher(transformList);
        while (m.find()) {
            AffineMatrix step = function(m.group(1), NumberList.parse(m.group(2)));
            result = result.multiply(step);
        }
        return result;
    }

    private static AffineMatrix function(String name, double[] args) {
        switch (name) {
        case "matrix":
            if (args.length == 6) {
                return new AffineMatrix(args[0], args[1], args[2],
                                        args[3], args[4], args[5]);
            }
            break;

        case "translate":
            if (args.length == 1) {
                return AffineMatrix.translate(args[0], 0);
            } else if (args.length == 2) {
                return AffineMatrix.translate(args[0], args[1]);
            }
            break;

        case "scale":
            if (args.length == 1) {
                return AffineMatrix.scale(args[0], args[0]);
            } else if (args.length == 2) {
                return AffineMatrix.scale(args[0], args[1]);
            }
            break;

        case "rotate":
            if (args.length == 1) {
                return AffineMatrix.rotate(args[0], 0, 0);
            } else if (args.length == 3) {
                return AffineMatrix.rotate(args[0], args[1], args[2]);
            }
            break;

        case "skewX":
            if (args.length == 1) {
                return AffineMatrix.skewX(args[0]);
            }
            break;

        case "skewY":
            if (args.length == 1) {
                return AffineMatrix.skewY(args[0]);
            }
            break;

        default:
            log.log(Level.FINE, "Unknown transform function ignored: {0}", name);
            return AffineMatrix.IDENTITY;
        }
        log.log(Level.FINE, "Invalid {0} arguments ignored: {1}",
                            new Object[] { name, args.length });
        return AffineMatrix.IDENTITY;
    }

}
