/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.github.stanio.svgpdf.geom.AffineMatrix;

/**
 * Clip path definitions by id.
 */
final class ClipPathSet {

    /**
     * Clip path member shape with the transformation in effect relative to
     * the referencing element's user space.
     */
    static final class ClipShape {

        final ElementKind kind;
        final Map<String, String> attributes;
        final AffineMatrix matrix;
        final boolean evenOdd;

        ClipShape(ElementKind kind, Map<String, String> attributes,
                  AffineMatrix matrix, boolean evenOdd) {
            this.kind = kind;
            this.attributes = Collections.unmodifiableMap(attributes);
            this.matrix = matrix;
            this.evenOdd = evenOdd;
        }

    }

    static final class Entry {

        private final String id;
        private final boolean objectBoundingBox;
        private final AffineMatrix transform;
        private final List<ClipShape> shapes = new ArrayList<>();

        Entry(String id, boolean objectBoundingBox, AffineMatrix transform) {
            this.id = id;
            this.objectBoundingBox = objectBoundingBox;
            this.transform = transform;
        }

        String id() {
            return id;
        }

        boolean isObjectBoundingBox() {
            return objectBoundingBox;
        }

        /** The {@code clipPath} element's own transformation. */
        AffineMatrix transform() {
            return transform;
        }

        void add(ClipShape shape) {
            shapes.add(shape);
        }

        List<ClipShape> shapes() {
            return Collections.unmodifiableList(shapes);
        }

        boolean isEvenOdd() {
            return !shapes.isEmpty() && shapes.get(0).evenOdd;
        }

    }

    private final Map<String, Entry> entries = new HashMap<>();

    Entry define(String id, boolean objectBoundingBox, AffineMatrix transform) {
        Entry entry = new Entry(id, objectBoundingBox, transform);
        entries.put(id, entry);
        return entry;
    }

    Entry get(String id) {
        return entries.get(id);
    }

    int size() {
        return entries.size();
    }

}
