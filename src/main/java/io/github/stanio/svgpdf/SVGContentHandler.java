/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import java.awt.geom.Rectangle2D;

import org.xml.sax.Attributes;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.ext.DefaultHandler2;

import io.github.stanio.svgpdf.DefinitionsTable.Event;
import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.geom.PreserveAspectRatio;
import io.github.stanio.svgpdf.geom.TransformParser;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.geom.ViewportFitter;
import io.github.stanio.svgpdf.gradient.GradientDef;
import io.github.stanio.svgpdf.gradient.GradientStop;
import io.github.stanio.svgpdf.graphics.DefaultResourceLoader;
import io.github.stanio.svgpdf.graphics.PdfGraphics;
import io.github.stanio.svgpdf.graphics.TextLayout;
import io.github.stanio.svgpdf.graphics.TextRun;
import io.github.stanio.svgpdf.style.Property;
import io.github.stanio.svgpdf.style.Style;
import io.github.stanio.svgpdf.style.StyleResolver;

/**
 * Translates SVG parse events into page content operators.
 * <p>
 * Besides normal rendering, the handler has two capture modes:</p>
 * <ul>
 * <li><em>definitions</em>: inside {@code <defs>} (and {@code <symbol>})
 * elements are only recorded for later {@code <use>} expansion;</li>
 * <li><em>clip path</em>: inside {@code <clipPath>} shapes are collected as
 * clip geometry.</li>
 * </ul>
 * <p>
 * Gradients register in any mode but clip path capture.  Every element
 * with an {@code id} is recorded, so {@code <use>} may also reference
 * rendered content preceding it.</p>
 */
class SVGContentHandler extends DefaultHandler2 {

    static final String SVG_NS = "http://www.w3.org/2000/svg";

    private static final Logger log = Logger.getLogger(SVGContentHandler.class.getName());

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");

    /**
     * Placement of the root viewport.
     */
    static final class Placement {

        final AffineMatrix outer;
        final double x;
        final double y;
        final double width;
        final double height;
        final PreserveAspectRatio aspectRatio;

        /**
         * @param  outer  the space the viewport is positioned in, relative to
         *         the (unflipped) page
         * @param  x  viewport x
         * @param  y  viewport y
         * @param  width  viewport width, or 0 to derive from the document
         * @param  height  viewport height, or 0 to derive from the document
         * @param  aspectRatio  overrides the document's own
         *         {@code preserveAspectRatio}, or {@code null}
         */
        Placement(AffineMatrix outer, double x, double y,
                  double width, double height,
                  PreserveAspectRatio aspectRatio) {
            this.outer = outer;
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
            this.aspectRatio = aspectRatio;
        }

    }

    private static final class OpenElement {

        final ElementKind kind;
        final String name;

        boolean recorded;
        boolean recording;
        boolean scope;
        boolean svg;
        boolean defs;
        boolean clipPath;
        boolean clipMatrix;
        boolean gradient;
        boolean text;

        OpenElement(ElementKind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

    }

    private static final class TextState {

        final Style style;
        final StringBuilder text = new StringBuilder();

        TextState(Style style) {
            this.style = style;
        }

    }

    private final ConversionContext context;
    private final DocumentContext document;
    private final Placement placement;

    private final ElementPainter painter;
    private final StyleResolver styles;
    private final Units units;

    private Locator locator;
    private boolean rootSeen;

    private final Deque<OpenElement> openElements = new ArrayDeque<>();

    private int defsDepth;

    private ClipPathSet.Entry activeClip;
    private final Deque<AffineMatrix> clipMatrices = new ArrayDeque<>();

    private final Deque<String> activeUses = new ArrayDeque<>();

    private GradientDef currentGradient;

    private final Deque<TextState> texts = new ArrayDeque<>();
    private boolean textStart;

    SVGContentHandler(ConversionContext context,
                      DocumentContext document,
                      Placement placement) {
        this.context = context;
        this.document = document;
        this.placement = placement;
        this.painter = new ElementPainter(context, document);
        this.styles = context.styles();
        this.units = context.units();
    }

    @Override
    public void setDocumentLocator(Locator locator) {
        this.locator = locator;
    }

    Locator locator() {
        return locator;
    }

    @Override
    public void startElement(String uri, String localName,
                             String qName, Attributes attrs)
            throws SAXException {
        String name = localName.isEmpty() ? localPart(qName) : localName;
        ElementKind kind = (uri.isEmpty() || uri.equals(SVG_NS))
                           ? ElementKind.of(name)
                           : ElementKind.UNKNOWN;
        try {
            start(kind, name, attributeMap(attrs));
        } catch (IOException e) {
            throw new SAXException(e);
        }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        end();
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        text(new String(ch, start, length));
    }

    private static String localPart(String qName) {
        int colon = qName.indexOf(':');
        return (colon < 0) ? qName : qName.substring(colon + 1);
    }

    /**
     * Maps attributes by local name.  Namespace declarations are skipped.
     */
    static Map<String, String> attributeMap(Attributes attrs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0, len = attrs.getLength(); i < len; i++) {
            String qName = attrs.getQName(i);
            if (qName.equals("xmlns") || qName.startsWith("xmlns:"))
                continue;

            String name = attrs.getLocalName(i);
            if (name == null || name.isEmpty()) {
                name = localPart(qName);
            }
            map.put(name, attrs.getValue(i));
        }
        return map;
    }

    private void start(ElementKind kind, String name, Map<String, String> attrs)
            throws IOException {
        OpenElement open = new OpenElement(kind, name);
        openElements.push(open);
        record(open, attrs);

        if (!rootSeen) {
            if (kind != ElementKind.SVG)
                throw new InvalidInputException("Not an SVG document: <" + name + ">");

            rootSeen = true;
            startRoot(attrs, open);
            return;
        }

        if (activeClip != null) {
            startInClip(kind, attrs, open);
            return;
        }

        switch (kind) {
        case DEFS:
            defsDepth += 1;
            open.defs = true;
            return;

        case SYMBOL:
            if (activeUses.isEmpty()) {
                defsDepth += 1;
                open.defs = true;
                return;
            }
            break;

        case CLIP_PATH:
            startClipPath(attrs, open);
            return;

        case LINEAR_GRADIENT:
        case RADIAL_GRADIENT:
            startGradient(kind, attrs, open);
            return;

        case STOP:
            addStop(attrs);
            return;

        default:
            break;
        }

        if (defsDepth > 0) return;

        switch (kind) {
        case SVG:
        case SYMBOL:
            startSvg(attrs, open);
            break;

        case G:
            startGroup(attrs, open);
            break;

        case USE:
            expandUse(attrs);
            break;

        case IMAGE:
            image(attrs);
            break;

        case TEXT:
        case TSPAN:
            startText(kind, attrs, open);
            break;

        default:
            if (kind.isShape()) {
                shape(kind, attrs);
            } else {
                log.log(Level.FINEST, "Transparent element: <{0}>", name);
            }
        }
    }

    private void end() {
        OpenElement open = openElements.pop();
        if (open.text) {
            flushText(texts.pop(), open.kind == ElementKind.TEXT);
        }
        if (open.scope) {
            painter.restoreState();
            document.popScope();
        }
        if (open.svg) {
            document.exitSvg();
        }
        if (open.clipMatrix) {
            clipMatrices.pop();
        }
        if (open.clipPath) {
            log.log(Level.FINE, "Clip path #{0}: {1} shapes",
                    new Object[] { activeClip.id(), activeClip.shapes().size() });
            activeClip = null;
            clipMatrices.clear();
        }
        if (open.defs) {
            defsDepth -= 1;
        }
        if (open.gradient) {
            currentGradient = null;
        }

        DefinitionsTable definitions = document.definitions();
        if (open.recorded || open.recording) {
            definitions.append(Event.end(open.kind, open.name));
        }
        if (open.recording) {
            log.log(Level.FINER, "Recorded definition #{0}", definitions.end());
        }
    }

    private void text(String chars) {
        if (activeUses.isEmpty() && activeClip == null
                && document.definitions().isRecording()) {
            document.definitions().append(Event.text(chars));
        }

        if (defsDepth == 0 && activeClip == null && !texts.isEmpty()) {
            texts.peek().text.append(chars);
        }
    }

    private void record(OpenElement open, Map<String, String> attrs) {
        if (!activeUses.isEmpty() || activeClip != null
                || open.kind.isDefinition()) return;

        DefinitionsTable definitions = document.definitions();
        Event start = Event.start(open.kind, open.name, attrs);
        if (definitions.isRecording()) {
            definitions.append(start);
            open.recorded = true;
        }

        String id = attrs.get("id");
        if (id != null && !id.isBlank()) {
            definitions.begin(id.strip(), start);
            open.recording = true;
        } else if (!open.recorded && defsDepth > 0) {
            log.log(Level.FINE, "Definition without id dropped: <{0}>", open.name);
        }
    }

    private void replay(Event event) throws IOException {
        switch (event.type) {
        case START:
            start(event.kind, event.name, event.attributes);
            break;

        case TEXT:
            text(event.text);
            break;

        default:
            end();
        }
    }

    private double fontSize(Style style) {
        return style.fontSize(styles.defaultFontSize());
    }

    private void startRoot(Map<String, String> attrs, OpenElement open)
            throws InvalidGeometryException {
        Style style = styles.resolve(context.baseStyle(), attrs);
        double fontSize = fontSize(style);
        Rectangle2D viewBox = ViewportFitter.parseViewBox(attrs.get("viewBox"));
        double intrinsicWidth = intrinsicLength(attrs.get("width"), fontSize,
                (viewBox == null) ? Double.NaN : viewBox.getWidth());
        double intrinsicHeight = intrinsicLength(attrs.get("height"), fontSize,
                (viewBox == null) ? Double.NaN : viewBox.getHeight());

        double pointsPerUnit = units.pointsPerUserUnit();
        double width = placement.width;
        double height = placement.height;
        if (width < 0 || height < 0)
            throw new InvalidGeometryException("Negative size: " + width + "x" + height);

        if (width == 0 && height == 0) {
            width = intrinsicWidth * pointsPerUnit;
            height = intrinsicHeight * pointsPerUnit;
        } else if (width == 0) {
            width = height * intrinsicWidth / intrinsicHeight;
        } else if (height == 0) {
            height = width * intrinsicHeight / intrinsicWidth;
        }
        if (!(width > 0 && height > 0)
                || Double.isInfinite(width) || Double.isInfinite(height))
            throw new InvalidGeometryException("Cannot determine the size of "
                    + document.source() + ": " + width + "x" + height);

        if (viewBox == null) {
            viewBox = new Rectangle2D.Double(0, 0,
                    (intrinsicWidth > 0) ? intrinsicWidth : width / pointsPerUnit,
                    (intrinsicHeight > 0) ? intrinsicHeight : height / pointsPerUnit);
        }

        PreserveAspectRatio aspectRatio = (placement.aspectRatio != null)
                ? placement.aspectRatio
                : PreserveAspectRatio.parse(attrs.get("preserveAspectRatio"));
        double x = placement.x;
        double y = placement.y;
        AffineMatrix fit = AffineMatrix.translate(x, y)
                .multiply(ViewportFitter.fit(viewBox, width, height, aspectRatio))
                .multiply(style.transform());
        log.log(Level.FINE, "{0}: {1}x{2} at ({3}, {4}), viewBox {5}",
                new Object[] { document, width, height, x, y, viewBox });

        painter.saveState();
        painter.transform(placement.outer);
        painter.clipRect(x, y, width, height);
        painter.clipOffsets(style, x, y, width, height);
        painter.transform(fit);
        document.enterSvg();
        document.pushScope(ScopeFrame.root(style, placement.outer.multiply(fit),
                                           viewBox.getWidth(), viewBox.getHeight()));
        painter.clipPath(style, null);
        open.scope = true;
        open.svg = true;
    }

    private double intrinsicLength(String value, double fontSize, double fallback) {
        if (value == null || Units.isPercentage(value))
            return fallback;

        double length = units.length(value, 0, fontSize, Double.NaN);
        return (length > 0) ? length : fallback;
    }

    /**
     * Opens a nested viewport: an inner {@code <svg>}, or a {@code <symbol>}
     * instantiated by {@code <use>}.
     */
    private void startSvg(Map<String, String> attrs, OpenElement open) {
        ScopeFrame scope = document.scope();
        Style style = styles.resolve(scope.style(), attrs);
        double fontSize = fontSize(style);
        double x = units.length(attrs.get("x"), scope.viewportWidth(), fontSize, 0);
        double y = units.length(attrs.get("y"), scope.viewportHeight(), fontSize, 0);
        double width = units.length(attrs.get("width"),
                scope.viewportWidth(), fontSize, scope.viewportWidth());
        double height = units.length(attrs.get("height"),
                scope.viewportHeight(), fontSize, scope.viewportHeight());
        boolean renderable = width > 0 && height > 0;
        if (!renderable) {
            log.log(Level.FINE, "Viewport not rendered: {0}x{1}",
                                new Object[] { width, height });
        }

        Rectangle2D viewBox = ViewportFitter.parseViewBox(attrs.get("viewBox"));
        AffineMatrix fit = AffineMatrix.translate(x, y);
        if (viewBox != null && renderable) {
            fit = fit.multiply(ViewportFitter.fit(viewBox, width, height,
                    PreserveAspectRatio.parse(attrs.get("preserveAspectRatio"))));
        }

        AffineMatrix local = style.transform();
        painter.saveState();
        painter.transform(local);
        painter.clipPath(style, BoundingBox.of(x, y, width, height));
        if (renderable) {
            painter.clipRect(x, y, width, height);
            painter.clipOffsets(style, x, y, width, height);
        }
        painter.transform(fit);
        log.log(Level.FINER, "Nested viewport (depth {0})", document.enterSvg());
        open.svg = true;
        document.pushScope(document.scope().push(style, local.multiply(fit),
                (viewBox == null) ? width : viewBox.getWidth(),
                (viewBox == null) ? height : viewBox.getHeight(), renderable));
        open.scope = true;
    }

    private void startGroup(Map<String, String> attrs, OpenElement open) {
        ScopeFrame scope = document.scope();
        Style style = styles.resolve(scope.style(), attrs);
        painter.saveState();
        painter.transform(style.transform());
        painter.clipPath(style, null);
        document.pushScope(scope.push(style, style.transform()));
        open.scope = true;
    }

    private void shape(ElementKind kind, Map<String, String> attrs) {
        ScopeFrame scope = document.scope();
        Style style = styles.resolve(scope.style(), attrs);
        boolean painting = scope.isPainting() && ScopeFrame.isPainting(style);

        StringBuilder path = new StringBuilder();
        PathSink sink = painting
                        ? context.graphics().path(path, context.pageHeight())
                        : PathSink.NULL;
        BoundingBox box = context.geometry()
                .draw(kind, attrs, sink, scope, fontSize(style));
        if (!painting || path.length() == 0) {
            log.log(Level.FINER, "Not painted: <{0}> {1}",
                                 new Object[] { kind.localName(), box });
            return;
        }

        painter.saveState();
        painter.transform(style.transform());
        painter.clipPath(style, box);
        painter.clipOffsets(style, box.minX(), box.minY(), box.width(), box.height());
        painter.shape(style, path.toString(), box);
        painter.restoreState();
    }

    private void startClipPath(Map<String, String> attrs, OpenElement open) {
        String id = attrs.get("id");
        if (id == null || id.isBlank()) {
            id = "clipPath" + context.nextId();
            log.log(Level.FINE, "Clip path without id: {0}", id);
        }
        String clipUnits = attrs.getOrDefault("clipPathUnits", "");
        activeClip = document.clipPaths().define(id.strip(),
                clipUnits.strip().equals("objectBoundingBox"),
                TransformParser.parse(attrs.get("transform")));
        clipMatrices.clear();
        clipMatrices.push(AffineMatrix.IDENTITY);
        open.clipPath = true;
    }

    private void startInClip(ElementKind kind, Map<String, String> attrs, OpenElement open)
            throws IOException {
        if (kind == ElementKind.USE) {
            expandUse(attrs);
            return;
        }

        AffineMatrix matrix = clipMatrices.peek()
                .multiply(TransformParser.parse(attrs.get("transform")));
        if (kind.isShape()) {
            Style style = styles.resolve(document.scope().style(), attrs);
            if (ScopeFrame.isPainting(style)) {
                activeClip.add(new ClipPathSet.ClipShape(kind, attrs,
                        matrix, style.isEvenOddClip()));
            }
        } else if (kind != ElementKind.G && kind != ElementKind.UNKNOWN) {
            log.log(Level.FINE, "Not supported in clip path: <{0}>", open.name);
        }
        clipMatrices.push(matrix);
        open.clipMatrix = true;
    }

    private void startGradient(ElementKind kind, Map<String, String> attrs, OpenElement open) {
        String id = attrs.get("id");
        if (id == null || id.isBlank()) {
            log.log(Level.FINE, "Gradient without id: <{0}>", open.name);
            id = "gradient" + context.nextId();
        }
        GradientDef gradient = GradientDef.of(id.strip(), kind == ElementKind.LINEAR_GRADIENT
                                                          ? GradientDef.Kind.LINEAR
                                                          : GradientDef.Kind.RADIAL,
                                              attrs);
        document.gradients().put(gradient.id(), gradient);
        currentGradient = gradient;
        open.gradient = true;
    }

    private void addStop(Map<String, String> attrs) {
        if (currentGradient == null) {
            log.fine("Stop outside gradient ignored");
            return;
        }

        Style style = styles.resolve(context.baseStyle(), attrs);
        String offset = attrs.get("offset");
        double value = Units.number(offset, 0);
        if (Units.isPercentage(offset)) {
            value /= 100;
        }
        String color = style.get(Property.STOP_COLOR).strip();
        if (color.equalsIgnoreCase("currentColor")) {
            color = style.get(Property.COLOR);
        }
        currentGradient.addStop(new GradientStop(value, color, style.stopOpacity()));
    }

    private void expandUse(Map<String, String> attrs) throws IOException {
        String href = attrs.getOrDefault("href", "").strip();
        if (!href.startsWith("#")) {
            log.log(Level.FINE, "Unsupported use reference: \"{0}\"", href);
            return;
        }

        String id = href.substring(1);
        List<Event> events = document.definitions().lookup(id);
        if (events == null) {
            log.log(Level.WARNING, "Unknown use reference: {0}", href);
            return;
        }
        if (activeUses.contains(id)) {
            log.log(Level.WARNING, "Circular use reference: {0}", href);
            return;
        }
        if (activeUses.size() >= context.config().maxUseDepth()) {
            log.log(Level.WARNING, "Use expansion too deep ({0}): {1}",
                    new Object[] { activeUses.size(), href });
            return;
        }

        Event root = events.get(0);
        activeUses.push(id);
        try {
            start(root.kind, root.name, mergeUse(root.kind, root.attributes, attrs));
            for (int i = 1, len = events.size(); i < len; i++) {
                replay(events.get(i));
            }
        } finally {
            activeUses.pop();
        }
    }

    /**
     * Merges the attributes of a {@code <use>} element into the attributes
     * of the referenced element.
     */
    Map<String, String> mergeUse(ElementKind kind,
                                 Map<String, String> definition,
                                 Map<String, String> use) {
        Map<String, String> merged = new LinkedHashMap<>(definition);
        merged.remove("id");
        boolean viewport = kind == ElementKind.SVG || kind == ElementKind.SYMBOL;
        use.forEach((name, value) -> {
            switch (name) {
            case "id":
            case "href":
            case "x":
            case "y":
            case "transform":
            case "style":
                break;

            case "width":
            case "height":
                if (viewport) {
                    merged.put(name, value);
                }
                break;

            default:
                merged.put(name, value);
            }
        });

        ScopeFrame scope = document.scope();
        double fontSize = styles.defaultFontSize();
        double dx = units.length(use.get("x"), scope.viewportWidth(), fontSize, 0);
        double dy = units.length(use.get("y"), scope.viewportHeight(), fontSize, 0);
        String inner = definition.get("transform");
        if (dx != 0 || dy != 0) {
            if (kind.isPositioned()) {
                merged.put("x", PdfGraphics.format(dx + units.length(firstItem(definition
                        .get("x")), scope.viewportWidth(), fontSize, 0)));
                merged.put("y", PdfGraphics.format(dy + units.length(firstItem(definition
                        .get("y")), scope.viewportHeight(), fontSize, 0)));
            } else {
                inner = join(" ", "translate(" + PdfGraphics.format(dx)
                                  + " " + PdfGraphics.format(dy) + ")", inner);
            }
        }
        putOrRemove(merged, "transform", join(" ", use.get("transform"), inner));
        putOrRemove(merged, "style", join(";", definition.get("style"), use.get("style")));
        return merged;
    }

    private static String join(String separator, String first, String second) {
        if (first == null || first.isBlank()) return second;
        if (second == null || second.isBlank()) return first;
        return first + separator + second;
    }

    private static void putOrRemove(Map<String, String> map, String name, String value) {
        if (value == null) {
            map.remove(name);
        } else {
            map.put(name, value);
        }
    }

    private static String firstItem(String list) {
        if (list == null) return null;

        for (String item : LIST_SEPARATOR.split(list.strip())) {
            if (!item.isEmpty()) return item;
        }
        return null;
    }

    private void image(Map<String, String> attrs) {
        ScopeFrame scope = document.scope();
        Style style = styles.resolve(scope.style(), attrs);
        double fontSize = fontSize(style);
        double x = units.length(attrs.get("x"), scope.viewportWidth(), fontSize, 0);
        double y = units.length(attrs.get("y"), scope.viewportHeight(), fontSize, 0);
        double width = units.length(attrs.get("width"), scope.viewportWidth(), fontSize, 0);
        double height = units.length(attrs.get("height"), scope.viewportHeight(), fontSize, 0);
        String href = attrs.getOrDefault("href", "").strip();
        if (href.isEmpty() || !(width > 0 && height > 0)) {
            log.log(Level.FINE, "Image not rendered: \"{0}\" {1}x{2}",
                    new Object[] { ConversionContext.abbreviate(href), width, height });
            return;
        }
        if (!scope.isPainting() || !ScopeFrame.isPainting(style)) return;

        Rectangle2D bounds = new Rectangle2D.Double(x, y, width, height);
        if (isSVG(href)) {
            embedSVG(href, style, bounds, attrs.get("preserveAspectRatio"));
            return;
        }

        byte[] data;
        try {
            data = document.loader().load(href);
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load image: "
                    + ConversionContext.abbreviate(href), e);
            return;
        }

        painter.saveState();
        painter.transform(style.transform());
        painter.clipPath(style, BoundingBox.of(x, y, width, height));
        painter.clipOffsets(style, x, y, width, height);
        try {
            painter.append(context.images().embed(href, data, bounds, context.pageHeight()));
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not embed image: "
                    + ConversionContext.abbreviate(href), e);
        }
        painter.restoreState();
    }

    static boolean isSVG(String href) {
        if (DefaultResourceLoader.isDataURI(href)) {
            return DefaultResourceLoader.mediaType(href).equals("image/svg+xml");
        }
        String path = href.toLowerCase(Locale.ROOT);
        int end = path.length();
        for (char delim : new char[] { '#', '?' }) {
            int index = path.indexOf(delim);
            if (index >= 0) end = Math.min(end, index);
        }
        path = path.substring(0, end);
        return path.endsWith(".svg") || path.endsWith(".svgz");
    }

    private void embedSVG(String href, Style style,
                          Rectangle2D bounds, String aspectRatio) {
        AffineMatrix outer = document.scope().ctm().multiply(style.transform());
        Placement child = new Placement(outer, bounds.getX(), bounds.getY(),
                bounds.getWidth(), bounds.getHeight(),
                (aspectRatio == null) ? null : PreserveAspectRatio.parse(aspectRatio));
        try {
            int handle = context.converter().convertEmbedded(context, document, href, child);
            if (handle > 0) {
                document.addChild(handle);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Embedded SVG not rendered: "
                    + ConversionContext.abbreviate(href), e);
        }
    }

    private void startText(ElementKind kind, Map<String, String> attrs, OpenElement open) {
        if (kind == ElementKind.TSPAN && !texts.isEmpty()) {
            flushText(texts.peek(), false);
        }

        ScopeFrame scope = document.scope();
        Style style = styles.resolve(scope.style(), attrs);
        double fontSize = fontSize(style);
        double x = document.textX();
        double y = document.textY();
        if (kind == ElementKind.TEXT) {
            x = 0;
            y = 0;
            textStart = true;
        }
        String first = firstItem(attrs.get("x"));
        if (first != null) {
            x = units.length(first, scope.viewportWidth(), fontSize, x);
        }
        first = firstItem(attrs.get("y"));
        if (first != null) {
            y = units.length(first, scope.viewportHeight(), fontSize, y);
        }
        x += units.length(firstItem(attrs.get("dx")), scope.viewportWidth(), fontSize, 0);
        y += units.length(firstItem(attrs.get("dy")), scope.viewportHeight(), fontSize, 0);
        document.textPosition(x, y);

        painter.saveState();
        painter.transform(style.transform());
        painter.clipPath(style, null);
        document.pushScope(scope.push(style, style.transform()));
        open.scope = true;
        texts.push(new TextState(style));
        open.text = true;
    }

    private void flushText(TextState state, boolean end) {
        String text = WHITESPACE.matcher(state.text).replaceAll(" ");
        state.text.setLength(0);
        if (textStart) {
            text = text.stripLeading();
        }
        if (end) {
            text = text.stripTrailing();
        }
        if (text.isEmpty()) return;

        textStart = false;
        Style style = state.style;
        TextRun run = new TextRun(text, document.textX(), document.textY(),
                TextRun.anchor(style.get(Property.TEXT_ANCHOR)),
                style.get(Property.DIRECTION).strip().equals("rtl"),
                style.get(Property.FONT_FAMILY),
                style.get(Property.FONT_WEIGHT),
                style.get(Property.FONT_STYLE),
                fontSize(style));
        TextLayout.Result result = context.textLayout().layout(run, context.pageHeight());
        document.textPosition(result.endX(), document.textY());
        if (document.scope().isPainting()) {
            painter.text(style, result.operators());
        }
    }

}
