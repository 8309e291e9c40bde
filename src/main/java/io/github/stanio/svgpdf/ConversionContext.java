/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.svgpdf.config.ConverterConfig;
import io.github.stanio.svgpdf.geom.PathInterpreter;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.gradient.GradientResolver;
import io.github.stanio.svgpdf.graphics.ColorResolver;
import io.github.stanio.svgpdf.graphics.GraphicsEngine;
import io.github.stanio.svgpdf.graphics.ImageEmbedder;
import io.github.stanio.svgpdf.graphics.TextLayout;
import io.github.stanio.svgpdf.style.Style;
import io.github.stanio.svgpdf.style.StyleResolver;

/**
 * Settings and collaborators shared by a top-level conversion and the SVG
 * images embedded into it.
 */
final class ConversionContext {

    private static final Logger log = Logger.getLogger(ConversionContext.class.getName());

    private final SVGConverter converter;
    private final ConverterConfig config;
    private final double pageHeight;

    private final Units units;
    private final StyleResolver styles;
    private final GradientResolver gradients;
    private final ShapeGeometry geometry;
    private final Style baseStyle;

    private final Deque<String> activeSources = new ArrayDeque<>();

    ConversionContext(SVGConverter converter, double pageHeight) {
        this.converter = converter;
        this.config = converter.config();
        this.pageHeight = pageHeight;
        this.units = new Units(config.pixelsPerInch());
        this.styles = new StyleResolver(units, config.defaultFontSize());
        this.gradients = new GradientResolver(units);
        this.geometry = new ShapeGeometry(units,
                new PathInterpreter(config.minimumLength()));
        this.baseStyle = styles.resolve(Style.defaults(),
                Map.of("font-family", config.defaultFontFamily()));
    }

    SVGConverter converter() {
        return converter;
    }

    ConverterConfig config() {
        return config;
    }

    double pageHeight() {
        return pageHeight;
    }

    Units units() {
        return units;
    }

    StyleResolver styles() {
        return styles;
    }

    GradientResolver gradients() {
        return gradients;
    }

    ShapeGeometry geometry() {
        return geometry;
    }

    /** Document default style with the configured font family. */
    Style baseStyle() {
        return baseStyle;
    }

    GraphicsEngine graphics() {
        return converter.graphics();
    }

    ColorResolver colors() {
        return converter.colors();
    }

    TextLayout textLayout() {
        return converter.textLayout();
    }

    ImageEmbedder images() {
        return converter.images();
    }

    int nextId() {
        return converter.nextObjectId();
    }

    /**
     * Marks the given source as being converted.
     *
     * @param   key  identifies the source
     * @return  {@code false} if the source is already being converted, or
     *          the nesting limit is reached
     */
    boolean enter(String key) {
        if (activeSources.contains(key)) {
            log.log(Level.WARNING, "Circular image reference: {0}", abbreviate(key));
            return false;
        }
        // The top-level document counts too
        if (activeSources.size() > config.maxNestingDepth()) {
            log.log(Level.WARNING, "Image nesting too deep ({0}): {1}",
                    new Object[] { activeSources.size(), abbreviate(key) });
            return false;
        }
        activeSources.push(key);
        return true;
    }

    void exit(String key) {
        String top = activeSources.pop();
        assert top.equals(key);
    }

    static String abbreviate(String source) {
        return (source.length() > 64) ? source.substring(0, 61) + "..." : source;
    }

}
