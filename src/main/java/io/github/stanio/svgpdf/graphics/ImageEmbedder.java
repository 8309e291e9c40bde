/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

/**
 * Embeds raster images.
 */
@FunctionalInterface
public interface ImageEmbedder {

    /** Draws nothing. */
    ImageEmbedder NONE = (href, data, bounds, pageHeight) -> {
        Logger.getLogger(ImageEmbedder.class.getName())
              .log(Level.FINE, "Raster image not embedded: {0}", href);
        return "";
    };

    /**
     * Produces the operators drawing the given image into the given
     * bounds.
     *
     * @param   href  the image reference, for diagnostics
     * @param   data  the image file content
     * @param   bounds  target bounds in user space
     * @param   pageHeight  page height for flipping y coordinates
     * @return  image drawing operators
     * @throws  IOException  if the image data cannot be decoded
     */
    String embed(String href, byte[] data, Rectangle2D bounds, double pageHeight)
            throws IOException;

}
