/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import io.github.stanio.svgpdf.SVGContentHandler.Placement;
import io.github.stanio.svgpdf.config.ConverterConfig;
import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.graphics.BasicColorResolver;
import io.github.stanio.svgpdf.graphics.BasicTextLayout;
import io.github.stanio.svgpdf.graphics.ColorResolver;
import io.github.stanio.svgpdf.graphics.DefaultResourceLoader;
import io.github.stanio.svgpdf.graphics.GraphicsEngine;
import io.github.stanio.svgpdf.graphics.ImageEmbedder;
import io.github.stanio.svgpdf.graphics.PdfGraphics;
import io.github.stanio.svgpdf.graphics.ResourceLoader;
import io.github.stanio.svgpdf.graphics.TextLayout;
import io.github.stanio.svgpdf.util.LocalXMLReader;

/**
 * Converts SVG documents to page content operators.
 * <p>
 * Each {@link #convert conversion} yields a handle to its result.  SVG
 * images embedded into a document are converted to separate results,
 * which {@link #render(int)} appends to the content of the embedding
 * document.  Graphics state and shading resources referenced by the
 * operators are collected by the {@link #graphics() graphics engine}.</p>
 * <p>
 * Instances are not thread-safe.</p>
 */
public class SVGConverter {

    private static final Logger log = Logger.getLogger(SVGConverter.class.getName());

    private static final LocalXMLReader localXMLReader = LocalXMLReader.newInstance();

    private final ConverterConfig config;
    private final GraphicsEngine graphics;
    private final ColorResolver colors;
    private final TextLayout textLayout;
    private final ImageEmbedder images;
    private final ResourceLoader loader;

    private final Map<Integer, DocumentContext> documents = new LinkedHashMap<>();

    private int lastHandle;
    private int lastObjectId;

    public SVGConverter() {
        this(ConverterConfig.defaults());
    }

    public SVGConverter(ConverterConfig config) {
        this(config, new PdfGraphics(), new BasicColorResolver(),
                new BasicTextLayout(config.fontResource(), config.averageCharWidth()),
                ImageEmbedder.NONE, new DefaultResourceLoader());
    }

    public SVGConverter(ConverterConfig config,
                        GraphicsEngine graphics,
                        ColorResolver colors,
                        TextLayout textLayout,
                        ImageEmbedder images,
                        ResourceLoader loader) {
        this.config = Objects.requireNonNull(config, "null config");
        this.graphics = Objects.requireNonNull(graphics, "null graphics");
        this.colors = Objects.requireNonNull(colors, "null colors");
        this.textLayout = Objects.requireNonNull(textLayout, "null textLayout");
        this.images = Objects.requireNonNull(images, "null images");
        this.loader = Objects.requireNonNull(loader, "null loader");
    }

    public ConverterConfig config() {
        return config;
    }

    public GraphicsEngine graphics() {
        return graphics;
    }

    ColorResolver colors() {
        return colors;
    }

    TextLayout textLayout() {
        return textLayout;
    }

    ImageEmbedder images() {
        return images;
    }

    int nextObjectId() {
        return ++lastObjectId;
    }

    /**
     * Converts an SVG document.
     * <p>
     * The source may be given as:</p>
     * <ul>
     * <li>literal markup prefixed with {@code @};</li>
     * <li>literal markup starting with {@code <};</li>
     * <li>a {@code data:} URI;</li>
     * <li>a file path or {@code file:} URI.</li>
     * </ul>
     * <p>
     * Zero {@code width} or {@code height} is derived from the document's
     * intrinsic size and aspect ratio.</p>
     *
     * @param   source  the SVG source
     * @param   x  viewport x on the page, from the top-left page corner
     * @param   y  viewport y on the page, from the top-left page corner
     * @param   width  viewport width on the page, or 0
     * @param   height  viewport height on the page, or 0
     * @param   pageHeight  height of the target page
     * @return  handle to the conversion result
     * @throws  InvalidInputException  if the source is empty or cannot be
     *          read, or is not an SVG document
     * @throws  MalformedDocumentException  if the source is not well-formed
     * @throws  InvalidGeometryException  if the viewport size cannot be
     *          determined
     * @throws  IOException  if other I/O error occurs
     * @see     #render(int)
     */
    public int convert(String source,
                       double x, double y,
                       double width, double height,
                       double pageHeight)
            throws IOException {
        if (source == null || source.isBlank())
            throw new InvalidInputException("Empty SVG source");

        ConversionContext context = new ConversionContext(this, pageHeight);
        InputSource input;
        URI base = null;
        String description;
        String spec = source.strip();
        if (source.startsWith("@")) {
            input = markup(source.substring(1));
            description = "markup";
        } else if (spec.startsWith("<")) {
            input = markup(source);
            description = "markup";
        } else if (DefaultResourceLoader.isDataURI(spec)) {
            input = content(read(spec, loader));
            description = ConversionContext.abbreviate(spec);
        } else {
            base = fileURI(spec);
            input = content(read(spec, loader));
            description = spec;
        }
        if (base != null) {
            input.setSystemId(base.toString());
        }

        DocumentContext document = new DocumentContext(++lastHandle,
                description, base, (base == null) ? loader : loader.relativeTo(base));
        Placement placement = new Placement(AffineMatrix.IDENTITY,
                                            x, y, width, height, null);
        String key = (base == null) ? description : base.toString();
        context.enter(key);
        try {
            parse(context, document, input, placement);
        } finally {
            context.exit(key);
        }
        documents.put(document.handle(), document);
        return document.handle();
    }

    /**
     * Converts an SVG image embedded into the given parent document.
     *
     * @return  handle to the conversion result, or {@code -1} if the
     *          image is skipped as circular or nested too deep
     */
    int convertEmbedded(ConversionContext context,
                        DocumentContext parent,
                        String href,
                        Placement placement)
            throws IOException {
        boolean data = DefaultResourceLoader.isDataURI(href);
        URI base = data ? parent.base() : resolve(parent.base(), href);
        String key = (data || base == null) ? href : base.toString();
        if (!context.enter(key)) return -1;

        try {
            InputSource input = content(read(href, parent.loader()));
            if (base != null) {
                input.setSystemId(base.toString());
            }
            DocumentContext document = new DocumentContext(++lastHandle,
                    ConversionContext.abbreviate(href), base,
                    (base == null) ? parent.loader() : parent.loader().relativeTo(base));
            parse(context, document, input, placement);
            documents.put(document.handle(), document);
            return document.handle();
        } finally {
            context.exit(key);
        }
    }

    private static void parse(ConversionContext context,
                              DocumentContext document,
                              InputSource input,
                              Placement placement)
            throws IOException {
        SVGContentHandler handler = new SVGContentHandler(context, document, placement);
        try {
            localXMLReader.parse(input, handler);
        } catch (SAXParseException e) {
            if (e.getException() instanceof IOException)
                throw (IOException) e.getException();

            throw new MalformedDocumentException(e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            if (e.getException() instanceof IOException)
                throw (IOException) e.getException();

            int line = -1;
            int column = -1;
            if (handler.locator() != null) {
                line = handler.locator().getLineNumber();
                column = handler.locator().getColumnNumber();
            }
            throw new MalformedDocumentException(e.getMessage(), line, column, e);
        } finally {
            document.seal();
        }
        log.log(Level.FINE, "{0}: {1} definitions, {2} gradients, {3} clip paths",
                new Object[] { document, document.definitions().ids().size(),
                               document.gradients().size(),
                               document.clipPaths().size() });
    }

    private static InputSource markup(String text) throws InvalidInputException {
        if (text.isBlank())
            throw new InvalidInputException("Empty SVG markup");

        return new InputSource(new StringReader(text));
    }

    private static InputSource content(byte[] data) throws IOException {
        if (data.length == 0)
            throw new InvalidInputException("Empty SVG content");

        InputStream stream = new ByteArrayInputStream(data);
        if (data.length > 1 && data[0] == (byte) 0x1F && data[1] == (byte) 0x8B) {
            stream = new GZIPInputStream(stream);
        }
        return new InputSource(stream);
    }

    private static byte[] read(String reference, ResourceLoader loader)
            throws IOException {
        try {
            return loader.load(reference);
        } catch (SVGConversionException e) {
            throw e;
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read SVG source: "
                    + ConversionContext.abbreviate(reference), e);
        }
    }

    private static URI fileURI(String reference) {
        try {
            URI uri = new URI(reference);
            if ("file".equalsIgnoreCase(uri.getScheme()))
                return uri;
        } catch (URISyntaxException e) {
            log.log(Level.FINEST, "Not a URI: {0}", e.getMessage());
        }
        try {
            return Path.of(reference).toAbsolutePath().toUri();
        } catch (InvalidPathException e) {
            log.log(Level.FINE, "Not a path: {0}", e.getMessage());
            return null;
        }
    }

    private static URI resolve(URI base, String href) {
        try {
            URI uri = new URI(href);
            return (base == null) ? (uri.isAbsolute() ? uri : null)
                                  : base.resolve(uri);
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.log(Level.FINE, "Cannot resolve image reference: {0}", e.getMessage());
            return null;
        }
    }

    /**
     * Renders the content of the given conversion result, followed by the
     * content of its embedded images, in document order.
     *
     * @param   handle  a handle returned by {@link #convert convert}
     * @return  page content operators
     * @throws  UnknownHandleException  if the handle is not known
     */
    public String render(int handle) {
        DocumentContext document = documents.get(handle);
        if (document == null)
            throw new UnknownHandleException(handle);

        StringBuilder content = new StringBuilder(document.content());
        for (int child : document.children()) {
            content.append(render(child));
        }
        return content.toString();
    }

    /**
     * Discards the given conversion result and its embedded images.
     *
     * @param   handle  a handle returned by {@link #convert convert}
     * @throws  UnknownHandleException  if the handle is not known
     */
    public void release(int handle) {
        DocumentContext document = documents.remove(handle);
        if (document == null)
            throw new UnknownHandleException(handle);

        for (int child : document.children()) {
            release(child);
        }
    }

    /**
     * {@return whether the given handle refers to a conversion result}
     */
    public boolean isKnown(int handle) {
        return documents.containsKey(handle);
    }

}
