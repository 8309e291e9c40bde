/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.stanio.svgpdf.SVGConverter;
import io.github.stanio.svgpdf.cli.CommandLine.ArgumentException;
import io.github.stanio.svgpdf.cli.SVGToPDF.CommandArgs;

class SVGToPDFTest {

    @Test
    void defaultArguments() {
        CommandArgs args = CommandArgs.of("icon.svg");

        assertThat(args.svgFile).as("svgFile").isEqualTo(Path.of("icon.svg"));
        assertThat(args.outputFile).as("outputFile").isNull();
        assertThat(args.pageHeight).as("pageHeight").isEqualTo(SVGToPDF.DEFAULT_PAGE_HEIGHT);
        assertThat(args.width).as("width").isEqualTo(0);
        assertThat(args.resources).as("resources").isFalse();
    }

    @Test
    void allOptions() {
        CommandArgs args = CommandArgs.of("--page-height", "200", "--x=10", "--y", "-5",
                "--width", "50", "--height=40", "--config", "cfg.json",
                "--resources", "in.svg", "out.txt");

        assertThat(args.pageHeight).as("pageHeight").isEqualTo(200);
        assertThat(args.x).as("x").isEqualTo(10);
        assertThat(args.y).as("y").isEqualTo(-5);
        assertThat(args.width).as("width").isEqualTo(50);
        assertThat(args.height).as("height").isEqualTo(40);
        assertThat(args.configFile).as("configFile").isEqualTo(Path.of("cfg.json"));
        assertThat(args.resources).as("resources").isTrue();
        assertThat(args.svgFile).as("svgFile").isEqualTo(Path.of("in.svg"));
        assertThat(args.outputFile).as("outputFile").isEqualTo(Path.of("out.txt"));
    }

    @Test
    void helpNeedsNoFile() {
        assertThat(CommandArgs.of("-h").help).isTrue();
    }

    @Test
    void missingFile() {
        assertThatThrownBy(() -> CommandArgs.of("--resources"))
                .isInstanceOf(ArgumentException.class)
                .hasMessage("Specify <svg-file>");
    }

    @Test
    void tooManyArguments() {
        assertThatThrownBy(() -> CommandArgs.of("a.svg", "b.txt", "c"))
                .isInstanceOf(ArgumentException.class)
                .hasMessage("1 too many argument(s): c");
    }

    @Test
    void negativeWidth() {
        assertThatThrownBy(() -> CommandArgs.of("--width", "-2", "a.svg"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageStartingWith("--width: ");
    }

    @Test
    void convertWithResources(@TempDir Path dir) throws Exception {
        Path svg = dir.resolve("square.svg");
        Files.writeString(svg, "<svg xmlns='http://www.w3.org/2000/svg' width='10' height='10'>"
                + "<rect width='10' height='10' opacity='0.5'/></svg>");
        CommandArgs args = CommandArgs.of("--page-height", "10", "--resources", svg.toString());

        String content = SVGToPDF.convert(new SVGConverter(), args);

        assertThat(content).as("content")
                .contains("0.000000 0.000000 10.000000 10.000000 re\nf\n")
                .endsWith("% /GS1 << /Type /ExtGState /ca 0.500000 >>\n");
    }

}
