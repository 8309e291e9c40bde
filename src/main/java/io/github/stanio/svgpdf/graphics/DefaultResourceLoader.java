/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

import io.github.stanio.svgpdf.InvalidInputException;

/**
 * Loads {@code data:} URIs and local files.  Other URI schemes are
 * rejected.
 */
public class DefaultResourceLoader implements ResourceLoader {

    private final URI base;

    public DefaultResourceLoader() {
        this(null);
    }

    /**
     * @param  base  base for resolving relative references, or {@code null}
     *         to resolve against the current directory
     */
    public DefaultResourceLoader(URI base) {
        this.base = base;
    }

    @Override
    public ResourceLoader relativeTo(URI base) {
        return new DefaultResourceLoader(base);
    }

    public static boolean isDataURI(String reference) {
        return reference.regionMatches(true, 0, "data:", 0, 5);
    }

    /**
     * {@return the media type of the given {@code data:} URI, lower-cased;
     * {@code text/plain} if not specified}
     */
    public static String mediaType(String dataURI) {
        int comma = dataURI.indexOf(',');
        String header = dataURI.substring(5, (comma < 0) ? dataURI.length() : comma);
        int semicolon = header.indexOf(';');
        String type = (semicolon < 0) ? header : header.substring(0, semicolon);
        type = type.strip().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? "text/plain" : type;
    }

    @Override
    public byte[] load(String reference) throws IOException {
        String ref = reference.strip();
        if (isDataURI(ref)) {
            return decodeData(ref);
        }
        return Files.readAllBytes(resolve(ref));
    }

    private Path resolve(String reference) throws IOException {
        try {
            URI uri;
            try {
                uri = new URI(reference);
            } catch (URISyntaxException e) {
                // Native path syntax, like C:\dir\file.svg
                return Path.of(reference);
            }

            if (uri.getScheme() != null && uri.getScheme().length() > 1) {
                return filePath(uri);
            } else if (base != null) {
                return filePath(base.resolve(uri));
            }
            return Path.of(reference);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid resource reference: " + reference, e);
        }
    }

    private static Path filePath(URI uri) throws IOException {
        if (!"file".equalsIgnoreCase(uri.getScheme()))
            throw new IOException("Unsupported resource scheme: " + uri);

        return Path.of(uri);
    }

    static byte[] decodeData(String dataURI) throws IOException {
        int comma = dataURI.indexOf(',');
        if (comma < 0)
            throw new InvalidInputException("Malformed data URI (no comma)");

        String header = dataURI.substring(5, comma).toLowerCase(Locale.ROOT);
        String payload = dataURI.substring(comma + 1);
        if (header.endsWith(";base64")) {
            try {
                return Base64.getMimeDecoder().decode(percentDecode(payload));
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Malformed base64 data", e);
            }
        }
        return percentDecode(payload);
    }

    private static byte[] percentDecode(String text) throws InvalidInputException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            if (b == '%') {
                if (i + 2 >= bytes.length)
                    throw new InvalidInputException("Malformed percent-encoding: " + text);

                int hi = Character.digit(bytes[i + 1], 16);
                int lo = Character.digit(bytes[i + 2], 16);
                if (hi < 0 || lo < 0)
                    throw new InvalidInputException("Malformed percent-encoding: " + text);

                out.write((hi << 4) | lo);
                i += 2;
            } else {
                out.write(b);
            }
        }
        return out.toByteArray();
    }

}
