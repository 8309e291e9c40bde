/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.io.IOException;
import java.net.URI;

/**
 * Loads the bytes of referenced resources.
 */
@FunctionalInterface
public interface ResourceLoader {

    /**
     * Loads the given resource.
     *
     * @param   reference  a path or URI, possibly relative
     * @return  the resource content
     * @throws  IOException  if the resource cannot be read
     */
    byte[] load(String reference) throws IOException;

    /**
     * {@return a loader resolving relative references against the given
     * base; by default this loader}
     */
    default ResourceLoader relativeTo(URI base) {
        return this;
    }

}
