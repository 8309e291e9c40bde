/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.gradient.GradientDef;
import io.github.stanio.svgpdf.gradient.GradientStop;
import io.github.stanio.svgpdf.gradient.ResolvedGradient;
import io.github.stanio.svgpdf.style.BlendMode;

/**
 * Default graphics engine producing PDF content stream operators.
 * <p>
 * Graphics state parameter dictionaries are registered once per distinct
 * value set and referenced as {@code /GS<var>n</var>}; shadings as
 * {@code /Sh<var>n</var>}.  The numbers come from the supplied object id
 * sequence.</p>
 */
public class PdfGraphics implements GraphicsEngine {

    private final IntSupplier objectIds;

    private final Map<String, String> graphicStates = new LinkedHashMap<>();
    private final Map<String, String> resources = new LinkedHashMap<>();

    public PdfGraphics() {
        this(new AtomicInteger()::incrementAndGet);
    }

    public PdfGraphics(IntSupplier objectIds) {
        this.objectIds = objectIds;
    }

    /**
     * Formats the given number with six fraction digits, avoiding negative
     * zero.
     */
    public static String format(double value) {
        String str = String.format(Locale.ROOT, "%.6f", value);
        return str.equals("-0.000000") ? "0.000000" : str;
    }

    @Override
    public String saveState() {
        return "q\n";
    }

    @Override
    public String restoreState() {
        return "Q\n";
    }

    @Override
    public String transform(AffineMatrix pageMatrix) {
        if (pageMatrix.isIdentity()) return "";

        StringBuilder buf = new StringBuilder();
        for (double value : pageMatrix.toArray()) {
            buf.append(format(value)).append(' ');
        }
        return buf.append("cm\n").toString();
    }

    @Override
    public PathSink path(StringBuilder out, double pageHeight) {
        return new OperatorPathSink(out, pageHeight);
    }

    @Override
    public String paint(PaintOp op) {
        return op.operator() + "\n";
    }

    @Override
    public String lineStyle(LineStyle style) {
        StringBuilder buf = new StringBuilder();
        buf.append(format(style.width())).append(" w ")
           .append(style.cap()).append(" J ")
           .append(style.join()).append(" j ")
           .append(format(style.miterLimit())).append(" M ");
        buf.append('[');
        double[] dashes = style.dashArray();
        for (int i = 0; i < dashes.length; i++) {
            if (i > 0) buf.append(' ');
            buf.append(format(dashes[i]));
        }
        buf.append("] ").append(format(style.dashPhase())).append(" d\n");
        return buf.toString();
    }

    private static String rgb(DeviceColor color) {
        return format(color.red()) + " " + format(color.green())
                + " " + format(color.blue());
    }

    @Override
    public String fillColor(DeviceColor color) {
        return rgb(color) + " rg\n";
    }

    @Override
    public String strokeColor(DeviceColor color) {
        return rgb(color) + " RG\n";
    }

    @Override
    public String alpha(double strokeAlpha, double fillAlpha, BlendMode blendMode) {
        if (strokeAlpha >= 1 && fillAlpha >= 1 && blendMode == BlendMode.NORMAL)
            return "";

        StringBuilder dict = new StringBuilder("<< /Type /ExtGState");
        if (strokeAlpha < 1) {
            dict.append(" /CA ").append(format(strokeAlpha));
        }
        if (fillAlpha < 1) {
            dict.append(" /ca ").append(format(fillAlpha));
        }
        if (blendMode != BlendMode.NORMAL) {
            dict.append(" /BM /").append(blendMode.pdfName());
        }
        dict.append(" >>");

        String name = graphicStates.computeIfAbsent(dict.toString(), k -> {
            String key = "GS" + objectIds.getAsInt();
            resources.put(key, k);
            return key;
        });
        return "/" + name + " gs\n";
    }

    @Override
    public String shading(ResolvedGradient gradient,
                          List<DeviceColor> colors,
                          AffineMatrix pagePlacement) {
        double[] coords = gradient.coordinates();
        StringBuilder dict = new StringBuilder("<< ");
        if (gradient.kind() == GradientDef.Kind.LINEAR) {
            dict.append("/ShadingType 2 /ColorSpace /DeviceRGB /Coords [")
                .append(format(coords[0])).append(' ')
                .append(format(coords[1])).append(' ')
                .append(format(coords[2])).append(' ')
                .append(format(coords[3])).append(']');
        } else {
            dict.append("/ShadingType 3 /ColorSpace /DeviceRGB /Coords [")
                .append(format(coords[2])).append(' ')
                .append(format(coords[3])).append(' ')
                .append(format(0)).append(' ')
                .append(format(coords[0])).append(' ')
                .append(format(coords[1])).append(' ')
                .append(format(coords[4])).append(']');
        }
        dict.append(" /Function ")
            .append(function(gradient.stops(), colors))
            .append(" /Extend [true true] >>");

        String name = "Sh" + objectIds.getAsInt();
        resources.put(name, dict.toString());
        return transform(pagePlacement) + "/" + name + " sh\n";
    }

    private static String function(List<GradientStop> stops, List<DeviceColor> colors) {
        if (stops.size() != colors.size())
            throw new IllegalArgumentException("stops: " + stops.size()
                                               + ", colors: " + colors.size());

        int last = stops.size() - 1;
        if (last == 1 && stops.get(0).offset() == 0 && stops.get(1).offset() == 1) {
            return interpolation(colors.get(0), colors.get(1));
        }

        StringBuilder functions = new StringBuilder();
        StringBuilder bounds = new StringBuilder();
        StringBuilder encode = new StringBuilder();
        if (stops.get(0).offset() > 0) {
            appendSegment(functions, bounds, encode,
                          colors.get(0), colors.get(0), stops.get(0).offset());
        }
        for (int i = 0; i < last; i++) {
            appendSegment(functions, bounds, encode,
                          colors.get(i), colors.get(i + 1), stops.get(i + 1).offset());
        }
        if (stops.get(last).offset() < 1) {
            appendSegment(functions, bounds, encode,
                          colors.get(last), colors.get(last), 1);
        }
        // The last segment's bound is the end of the domain
        int cut = bounds.lastIndexOf(" ");
        String innerBounds = (cut < 0) ? "" : bounds.substring(0, cut);
        return "<< /FunctionType 3 /Domain [0 1] /Functions [" + functions.toString().strip()
                + "] /Bounds [" + innerBounds.strip() + "] /Encode [" + encode.toString().strip()
                + "] >>";
    }

    private static void appendSegment(StringBuilder functions,
                                      StringBuilder bounds,
                                      StringBuilder encode,
                                      DeviceColor from, DeviceColor to,
                                      double end) {
        functions.append(interpolation(from, to)).append(' ');
        bounds.append(' ').append(format(end));
        encode.append("0 1 ");
    }

    private static String interpolation(DeviceColor from, DeviceColor to) {
        return "<< /FunctionType 2 /Domain [0 1] /C0 [" + rgb(from)
                + "] /C1 [" + rgb(to) + "] /N 1 >>";
    }

    @Override
    public Map<String, String> resources() {
        return Collections.unmodifiableMap(resources);
    }

}
