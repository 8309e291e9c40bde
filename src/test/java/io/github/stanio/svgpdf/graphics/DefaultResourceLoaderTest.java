/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.stanio.svgpdf.InvalidInputException;

class DefaultResourceLoaderTest {

    private final DefaultResourceLoader loader = new DefaultResourceLoader();

    @Test
    void base64Data() throws Exception {
        assertThat(loader.load("data:image/svg+xml;base64,PHN2Zy8+"))
                .asString(StandardCharsets.UTF_8).isEqualTo("<svg/>");
    }

    @Test
    void percentEncodedData() throws Exception {
        assertThat(loader.load("data:,a%20b%3C"))
                .asString(StandardCharsets.UTF_8).isEqualTo("a b<");
    }

    @Test
    void malformedData() {
        assertThatThrownBy(() -> loader.load("data:abc"))
                .as("no comma")
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> loader.load("data:,a%2"))
                .as("truncated escape")
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void mediaType() {
        assertThat(DefaultResourceLoader.mediaType("data:Image/SVG+xml;base64,AA"))
                .isEqualTo("image/svg+xml");
        assertThat(DefaultResourceLoader.mediaType("data:,x"))
                .isEqualTo("text/plain");
    }

    @Test
    void isDataURI() {
        assertThat(DefaultResourceLoader.isDataURI("DATA:,x")).isTrue();
        assertThat(DefaultResourceLoader.isDataURI("file.svg")).isFalse();
    }

    @Test
    void relativeToBase(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("image.svg"), "<svg/>");

        ResourceLoader relative = loader.relativeTo(dir.toUri());

        assertThat(relative.load("image.svg"))
                .asString(StandardCharsets.UTF_8).isEqualTo("<svg/>");
        assertThat(loader.load(dir.resolve("image.svg").toUri().toString()))
                .as("file URI")
                .asString(StandardCharsets.UTF_8).isEqualTo("<svg/>");
    }

    @Test
    void missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.relativeTo(dir.toUri()).load("missing.svg"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void invalidPath() {
        assertThatThrownBy(() -> loader.load("bad\u0000name.svg"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid resource reference");
    }

    @Test
    void unsupportedScheme() {
        assertThatThrownBy(() -> loader.load("http://example.com/image.svg"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unsupported resource scheme");
    }

}
