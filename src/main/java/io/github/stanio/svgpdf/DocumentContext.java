/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.github.stanio.svgpdf.gradient.GradientDef;
import io.github.stanio.svgpdf.graphics.ResourceLoader;

/**
 * State of a single converted document: its output buffer, definition
 * tables, and scope stack.  Sealed once the document is parsed.
 */
final class DocumentContext {

    private final int handle;
    private final String source;
    private final URI base;
    private final ResourceLoader loader;

    private final StringBuilder output = new StringBuilder();
    private final Map<String, GradientDef> gradients = new HashMap<>();
    private final DefinitionsTable definitions = new DefinitionsTable();
    private final ClipPathSet clipPaths = new ClipPathSet();
    private final List<Integer> children = new ArrayList<>();

    private ScopeFrame scope;
    private int svgDepth;
    private double textX;
    private double textY;

    private boolean sealed;

    DocumentContext(int handle, String source, URI base, ResourceLoader loader) {
        this.handle = handle;
        this.source = source;
        this.base = base;
        this.loader = loader;
    }

    int handle() {
        return handle;
    }

    /** Short description of the document source, for diagnostics. */
    String source() {
        return source;
    }

    /** {@return the document location, or {@code null} if not known} */
    URI base() {
        return base;
    }

    /** Loads resources relative to the document. */
    ResourceLoader loader() {
        return loader;
    }

    StringBuilder output() {
        checkNotSealed();
        return output;
    }

    /**
     * {@return the complete operator content of this document; excludes
     * embedded child documents}
     */
    String content() {
        return output.toString();
    }

    Map<String, GradientDef> gradients() {
        return gradients;
    }

    DefinitionsTable definitions() {
        return definitions;
    }

    ClipPathSet clipPaths() {
        return clipPaths;
    }

    void addChild(int childHandle) {
        checkNotSealed();
        children.add(childHandle);
    }

    List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    ScopeFrame scope() {
        return scope;
    }

    void pushScope(ScopeFrame frame) {
        assert scope == null || frame.parent() == scope;
        scope = frame;
    }

    void popScope() {
        scope = scope.parent();
    }

    int enterSvg() {
        return ++svgDepth;
    }

    void exitSvg() {
        svgDepth -= 1;
    }

    int svgDepth() {
        return svgDepth;
    }

    double textX() {
        return textX;
    }

    double textY() {
        return textY;
    }

    void textPosition(double x, double y) {
        this.textX = x;
        this.textY = y;
    }

    void seal() {
        sealed = true;
    }

    boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed)
            throw new IllegalStateException("Document #" + handle + " already converted");
    }

    @Override
    public String toString() {
        return "Document #" + handle + "(" + source + ")";
    }

}
