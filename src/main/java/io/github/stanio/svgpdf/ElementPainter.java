/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.geom.TransformingPathSink;
import io.github.stanio.svgpdf.gradient.GradientStop;
import io.github.stanio.svgpdf.gradient.ResolvedGradient;
import io.github.stanio.svgpdf.graphics.DeviceColor;
import io.github.stanio.svgpdf.graphics.GraphicsEngine;
import io.github.stanio.svgpdf.graphics.LineStyle;
import io.github.stanio.svgpdf.graphics.PaintOp;
import io.github.stanio.svgpdf.style.Paint;
import io.github.stanio.svgpdf.style.Style;

/**
 * Emits the operators painting shapes and text, and setting up clip
 * regions, into a document's output.
 */
final class ElementPainter {

    private static final Logger log = Logger.getLogger(ElementPainter.class.getName());

    private final ConversionContext context;
    private final DocumentContext document;
    private final GraphicsEngine graphics;
    private final double pageHeight;

    ElementPainter(ConversionContext context, DocumentContext document) {
        this.context = context;
        this.document = document;
        this.graphics = context.graphics();
        this.pageHeight = context.pageHeight();
    }

    private StringBuilder out() {
        return document.output();
    }

    void append(String operators) {
        out().append(operators);
    }

    void saveState() {
        out().append(graphics.saveState());
    }

    void restoreState() {
        out().append(graphics.restoreState());
    }

    /**
     * Concatenates the given user space matrix to the current
     * transformation.
     */
    void transform(AffineMatrix local) {
        out().append(graphics.transform(local.flipConjugate(pageHeight)));
    }

    /**
     * Intersects the current clip region with the given rectangle.
     */
    void clipRect(double x, double y, double width, double height) {
        StringBuilder out = out();
        graphics.path(out, pageHeight).rect(x, y, width, height);
        out.append(graphics.paint(PaintOp.CLIP));
    }

    /**
     * Applies an old-style {@code clip: rect(...)}, relative to the given
     * element box.  Does nothing for {@code clip: auto}.
     */
    void clipOffsets(Style style, double x, double y, double width, double height) {
        double[] offsets = style.clipRect();
        if (offsets == null) return;

        double top = Double.isNaN(offsets[0]) ? 0 : Math.max(0, offsets[0]);
        double right = Double.isNaN(offsets[1]) ? width : Math.min(width, offsets[1]);
        double bottom = Double.isNaN(offsets[2]) ? height : Math.min(height, offsets[2]);
        double left = Double.isNaN(offsets[3]) ? 0 : Math.max(0, offsets[3]);
        clipRect(x + left, y + top,
                 Math.max(0, right - left), Math.max(0, bottom - top));
    }

    /**
     * Replays the clip path referenced by the given style as the current
     * clip region.  An unknown reference leaves the clip region unchanged.
     * A clip path with no shapes clips everything.
     *
     * @param  style  the element style
     * @param  box  the element bounding box, for {@code objectBoundingBox}
     *         clip paths; {@code null} if not known
     */
    void clipPath(Style style, BoundingBox box) {
        String id = style.clipPathReference();
        if (id == null) return;

        ClipPathSet.Entry clip = document.clipPaths().get(id);
        if (clip == null) {
            log.log(Level.WARNING, "Unknown clip path reference: #{0}", id);
            return;
        }

        AffineMatrix base = clip.transform();
        if (clip.isObjectBoundingBox()) {
            if (box == null || box.isEmpty()) {
                log.log(Level.FINE, "No bounding box for clip path #{0}", id);
                return;
            }
            base = new AffineMatrix(box.width(), 0, 0, box.height(),
                                    box.minX(), box.minY()).multiply(base);
        }

        StringBuilder out = out();
        PathSink sink = graphics.path(out, pageHeight);
        ScopeFrame scope = document.scope();
        BoundingBox clipBox = new BoundingBox();
        for (ClipPathSet.ClipShape shape : clip.shapes()) {
            Style shapeStyle = context.styles().resolve(scope.style(), shape.attributes);
            clipBox.add(context.geometry().draw(shape.kind, shape.attributes,
                    TransformingPathSink.of(sink, base.multiply(shape.matrix)),
                    scope, shapeStyle.fontSize(context.styles().defaultFontSize())));
        }
        if (clipBox.isEmpty()) {
            sink.rect(0, 0, 0, 0);
        }
        out.append(graphics.paint(PaintOp.clip(clip.isEvenOdd())));
    }

    /**
     * Paints a shape: clip, graphics state, and the fill and stroke of the
     * given outline.
     *
     * @param  style  the element style
     * @param  path  the outline construction operators
     * @param  box  the outline bounding box
     */
    void shape(Style style, String path, BoundingBox box) {
        ScopeFrame scope = document.scope();
        double opacity = scope.groupAlpha() * style.opacity();

        DeviceColor fillColor = null;
        ResolvedGradient gradient = null;
        Paint fill = style.fill();
        if (fill.kind() == Paint.Kind.REFERENCE) {
            gradient = context.gradients().resolve(fill.reference(),
                    document.gradients(), box,
                    scope.viewportWidth(), scope.viewportHeight());
            if (gradient == null) {
                fillColor = color(fill.color());
            } else if (gradient.isSolid()) {
                fillColor = stopColor(gradient.solidStop());
                gradient = null;
            }
        } else if (fill.kind() == Paint.Kind.COLOR) {
            fillColor = color(fill.color());
        }

        DeviceColor strokeColor = null;
        LineStyle lineStyle = LineStyle.of(style, context.units(), scope.viewportDiagonal());
        Paint stroke = style.stroke();
        if (lineStyle.width() > 0) {
            if (stroke.kind() == Paint.Kind.REFERENCE) {
                strokeColor = color(stroke.color());
                if (strokeColor == null) {
                    List<GradientStop> stops = context.gradients()
                            .stops(stroke.reference(), document.gradients());
                    if (!stops.isEmpty()) {
                        strokeColor = stopColor(stops.get(0));
                    }
                }
            } else if (stroke.kind() == Paint.Kind.COLOR) {
                strokeColor = color(stroke.color());
            }
        }

        boolean filled = fillColor != null || gradient != null;
        boolean stroked = strokeColor != null;
        if (!filled && !stroked) {
            log.log(Level.FINER, "Nothing to paint: {0}", style);
            return;
        }

        StringBuilder out = out();
        double fillAlpha = filled ? opacity * style.fillOpacity()
                                    * (fillColor == null ? 1 : fillColor.alpha())
                                  : 1;
        double strokeAlpha = stroked ? opacity * style.strokeOpacity() * strokeColor.alpha()
                                     : 1;
        out.append(graphics.alpha(strokeAlpha, fillAlpha, style.blendMode()));
        if (stroked) {
            out.append(graphics.lineStyle(lineStyle))
               .append(graphics.strokeColor(strokeColor));
        }

        boolean evenOdd = style.isEvenOddFill();
        if (gradient != null) {
            out.append(graphics.saveState())
               .append(path)
               .append(graphics.paint(PaintOp.clip(evenOdd)))
               .append(graphics.shading(gradient, stopColors(gradient.stops()),
                                        gradient.placement().flipOutput(pageHeight)))
               .append(graphics.restoreState());
            if (stroked) {
                out.append(path).append(graphics.paint(PaintOp.STROKE));
            }
        } else {
            if (filled) {
                out.append(graphics.fillColor(fillColor));
            }
            out.append(path).append(graphics.paint(PaintOp.of(filled, stroked, evenOdd)));
        }
    }

    /**
     * Paints laid out text with the fill of the given style.
     */
    void text(Style style, String operators) {
        if (operators.isEmpty()) return;

        Paint fill = style.fill();
        DeviceColor color;
        if (fill.kind() == Paint.Kind.REFERENCE) {
            color = color(fill.color());
            if (color == null) {
                List<GradientStop> stops = context.gradients()
                        .stops(fill.reference(), document.gradients());
                color = stops.isEmpty() ? null : stopColor(stops.get(0));
            }
        } else {
            color = (fill.kind() == Paint.Kind.COLOR) ? color(fill.color()) : null;
        }
        if (color == null) return;

        double alpha = document.scope().groupAlpha() * style.fillOpacity() * color.alpha();
        out().append(graphics.alpha(1, alpha, style.blendMode()))
             .append(graphics.fillColor(color))
             .append(operators);
    }

    private DeviceColor color(String spec) {
        if (spec == null) return null;

        DeviceColor color = context.colors().resolve(spec);
        if (color == null) {
            log.log(Level.FINE, "Unrecognized color: {0}", spec);
        }
        return color;
    }

    private DeviceColor stopColor(GradientStop stop) {
        DeviceColor color = color(stop.color());
        if (color == null) {
            color = DeviceColor.BLACK;
        }
        return new DeviceColor(color.red(), color.green(), color.blue(),
                               color.alpha() * stop.opacity());
    }

    private List<DeviceColor> stopColors(List<GradientStop> stops) {
        List<DeviceColor> colors = new ArrayList<>(stops.size());
        for (GradientStop stop : stops) {
            colors.add(stopColor(stop));
        }
        return colors;
    }

}
