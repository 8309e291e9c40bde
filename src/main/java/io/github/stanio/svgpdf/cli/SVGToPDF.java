/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

import com.google.gson.JsonParseException;

import io.github.stanio.svgpdf.SVGConverter;
import io.github.stanio.svgpdf.cli.CommandLine.ArgumentException;
import io.github.stanio.svgpdf.config.ConverterConfig;

/**
 * Converts an SVG file to page content operators.
 *
 * @see  SVGConverter
 */
public final class SVGToPDF {

    /** A4 height in points. */
    static final double DEFAULT_PAGE_HEIGHT = 841.89;

    private SVGToPDF() {/* no instances */}

    static void printHelp(PrintStream out) {
        out.println("USAGE: svgpdf [--page-height <pt>] [--x <pt>] [--y <pt>]"
                + " [--width <pt>] [--height <pt>]");
        out.println("              [--config <json-file>] [--resources]"
                + " <svg-file> [<output-file>]");
        out.println();
        out.println("Width and height of 0 (default) take the SVG intrinsic size.");
        out.println("--resources appends the graphics state and shading dictionaries.");
    }

    public static void main(String[] args) {
        CommandArgs cmdArgs;
        try {
            cmdArgs = CommandArgs.of(args);
        } catch (ArgumentException e) {
            exitMessage(1, SVGToPDF::printHelp, "Error: ", e.getMessage());
            return;
        }
        if (cmdArgs.help) {
            printHelp(System.out);
            return;
        }

        try {
            ConverterConfig config = (cmdArgs.configFile == null)
                                     ? ConverterConfig.defaults()
                                     : ConverterConfig.load(cmdArgs.configFile);
            String content = convert(new SVGConverter(config), cmdArgs);
            if (cmdArgs.outputFile == null) {
                System.out.print(content);
                System.out.flush();
            } else {
                try (Writer out = Files.newBufferedWriter(cmdArgs.outputFile,
                                                          StandardCharsets.UTF_8)) {
                    out.write(content);
                }
            }
        } catch (IOException | JsonParseException e) {
            exitMessage(2, null, "Error: ", e);
        }
    }

    static String convert(SVGConverter converter, CommandArgs cmdArgs) throws IOException {
        int handle = converter.convert(cmdArgs.svgFile.toString(),
                                       cmdArgs.x, cmdArgs.y,
                                       cmdArgs.width, cmdArgs.height,
                                       cmdArgs.pageHeight);
        StringBuilder content = new StringBuilder(converter.render(handle));
        if (cmdArgs.resources) {
            for (Map.Entry<String, String> entry
                    : converter.graphics().resources().entrySet()) {
                content.append("% /").append(entry.getKey())
                       .append(' ').append(entry.getValue()).append('\n');
            }
        }
        return content.toString();
    }

    static void exitMessage(int status, Consumer<PrintStream> help, Object... message) {
        PrintStream out = (status == 0) ? System.out : System.err;
        for (Object item : message) {
            if (item instanceof Throwable) {
                out.print(ArgumentException.userMessage((Throwable) item));
            } else {
                out.print(item);
            }
        }
        out.println();
        if (help != null) {
            out.println();
            help.accept(out);
        }
        System.exit(status);
    }


    static class CommandArgs {

        double pageHeight = DEFAULT_PAGE_HEIGHT;
        double x;
        double y;
        double width;
        double height;
        Path configFile;
        boolean resources;
        boolean help;
        Path svgFile;
        Path outputFile;

        private CommandArgs(String... args) {
            CommandLine cmd = new CommandLine()
                    .acceptOption("--page-height", v -> pageHeight = v, CommandLine::nonNegative)
                    .acceptOption("--x", v -> x = v, Double::valueOf)
                    .acceptOption("--y", v -> y = v, Double::valueOf)
                    .acceptOption("--width", v -> width = v, CommandLine::nonNegative)
                    .acceptOption("--height", v -> height = v, CommandLine::nonNegative)
                    .acceptOption("--config", p -> configFile = p, Path::of)
                    .acceptFlag("--resources", () -> resources = true)
                    .acceptFlag("--help", () -> help = true)
                    .acceptFlag("-h", () -> help = true)
                    .parseOptions(args);
            if (help) return;

            cmd.withMaxArgs(2);
            try {
                svgFile = Path.of(cmd.requireArg(0, "<svg-file>"));
                outputFile = cmd.arg(1).map(Path::of).orElse(null);
            } catch (InvalidPathException e) {
                throw ArgumentException.of(e.getInput(), e);
            }
        }

        static CommandArgs of(String... args) {
            return new CommandArgs(args);
        }

    }

}
