/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

/**
 * Converter settings.
 * <p>
 * Defaults may be overridden with system properties of the same name
 * prefixed with {@code svgpdf.}, like {@code -Dsvgpdf.pixelsPerInch=72}.
 * A JSON configuration file overrides both:</p>
 * <pre>
 * <code>{
 *   "minimumLength": 0.01,
 *   "pixelsPerInch": 96,
 *   "defaultFontSize": 12,
 *   "defaultFontFamily": "helvetica",
 *   "fontResource": "F1",
 *   "averageCharWidth": 0.5,
 *   "maxUseDepth": 16,
 *   "maxNestingDepth": 8
 * }</code></pre>
 */
public class ConverterConfig {

    /** Path parameters of smaller magnitude are taken as zero. */
    double minimumLength = doubleProperty("minimumLength", 0.01);

    /** Resolution of user units (CSS pixels). */
    double pixelsPerInch = doubleProperty("pixelsPerInch", 96);

    double defaultFontSize = doubleProperty("defaultFontSize", 12);

    String defaultFontFamily = System.getProperty("svgpdf.defaultFontFamily", "helvetica");

    /** Font resource name used by the default text layout. */
    String fontResource = System.getProperty("svgpdf.fontResource", "F1");

    /** Character advance (fraction of the font size) for the default text layout. */
    double averageCharWidth = doubleProperty("averageCharWidth", 0.5);

    /** Maximum {@code <use>} expansion depth. */
    int maxUseDepth = Integer.getInteger("svgpdf.maxUseDepth", 16);

    /** Maximum embedded SVG image nesting depth. */
    int maxNestingDepth = Integer.getInteger("svgpdf.maxNestingDepth", 8);

    public ConverterConfig() {
        // defaults
    }

    private static double doubleProperty(String name, double defaultValue) {
        String value = System.getProperty("svgpdf." + name, "");
        return value.isBlank() ? defaultValue : Double.parseDouble(value.strip());
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig().validate();
    }

    /**
     * Loads settings from the given JSON file.  Settings not specified
     * take their defaults.
     *
     * @param   configFile  the JSON file
     * @return  the loaded settings
     * @throws  IOException  if I/O error occurs
     * @throws  JsonParseException  if the content is not valid
     */
    public static ConverterConfig load(Path configFile)
            throws IOException, JsonParseException {
        try (InputStream fin = Files.newInputStream(configFile);
                Reader text = new InputStreamReader(fin, StandardCharsets.UTF_8)) {
            return load(text);
        }
    }

    public static ConverterConfig load(Reader json)
            throws IOException, JsonParseException {
        ConverterConfig config;
        try {
            config = new Gson().fromJson(json, ConverterConfig.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }
        if (config == null) {
            throw new JsonParseException("Empty configuration");
        }
        return config.validate();
    }

    private ConverterConfig validate() throws JsonParseException {
        if (!(pixelsPerInch > 0))
            throw new JsonParseException("pixelsPerInch must be positive: " + pixelsPerInch);
        if (!(defaultFontSize > 0))
            throw new JsonParseException("defaultFontSize must be positive: " + defaultFontSize);
        if (minimumLength < 0)
            throw new JsonParseException("minimumLength must not be negative: " + minimumLength);
        if (maxUseDepth < 0 || maxNestingDepth < 0)
            throw new JsonParseException("Expansion depth limits must not be negative");
        if (fontResource == null || fontResource.isBlank())
            throw new JsonParseException("null or blank fontResource");
        if (defaultFontFamily == null)
            defaultFontFamily = "helvetica";
        return this;
    }

    public double minimumLength() {
        return minimumLength;
    }

    public double pixelsPerInch() {
        return pixelsPerInch;
    }

    public double defaultFontSize() {
        return defaultFontSize;
    }

    public String defaultFontFamily() {
        return defaultFontFamily;
    }

    public String fontResource() {
        return fontResource;
    }

    public double averageCharWidth() {
        return averageCharWidth;
    }

    public int maxUseDepth() {
        return maxUseDepth;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    @Override
    public String toString() {
        return new Gson().toJson(this);
    }

}
