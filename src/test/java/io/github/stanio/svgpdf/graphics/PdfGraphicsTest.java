/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.graphics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.PathSink;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.gradient.GradientDef;
import io.github.stanio.svgpdf.gradient.GradientResolver;
import io.github.stanio.svgpdf.gradient.GradientStop;
import io.github.stanio.svgpdf.gradient.ResolvedGradient;
import io.github.stanio.svgpdf.style.BlendMode;

class PdfGraphicsTest {

    private static final DeviceColor RED = DeviceColor.rgb(255, 0, 0);
    private static final DeviceColor LIME = DeviceColor.rgb(0, 255, 0);
    private static final DeviceColor BLUE = DeviceColor.rgb(0, 0, 255);

    private PdfGraphics graphics;

    @BeforeEach
    void setUp() {
        graphics = new PdfGraphics();
    }

    @Test
    void format() {
        assertThat(PdfGraphics.format(1.5)).as("1.5").isEqualTo("1.500000");
        assertThat(PdfGraphics.format(-0.0)).as("-0.0").isEqualTo("0.000000");
        assertThat(PdfGraphics.format(-1e-9)).as("-1e-9").isEqualTo("0.000000");
        assertThat(PdfGraphics.format(-2.25)).as("-2.25").isEqualTo("-2.250000");
        assertThat(PdfGraphics.format(1234567.0000004)).as("large")
                .isEqualTo("1234567.000000");
    }

    @Test
    void stateAndTransform() {
        assertThat(graphics.saveState()).as("save").isEqualTo("q\n");
        assertThat(graphics.restoreState()).as("restore").isEqualTo("Q\n");
        assertThat(graphics.transform(AffineMatrix.IDENTITY)).as("identity").isEmpty();
        assertThat(graphics.transform(AffineMatrix.translate(1, 2))).as("translate")
                .isEqualTo("1.000000 0.000000 0.000000 1.000000 1.000000 2.000000 cm\n");
    }

    @Test
    void pathFlipsCoordinates() {
        StringBuilder out = new StringBuilder();
        PathSink path = graphics.path(out, 100);
        path.moveTo(10, 20);
        path.lineTo(30, 20);
        path.curveTo(30, 30, 20, 40, 10, 40);
        path.closePath();
        path.rect(5, 10, 20, 30);

        assertThat(out).hasToString("10.000000 80.000000 m\n"
                + "30.000000 80.000000 l\n"
                + "30.000000 70.000000 20.000000 60.000000 10.000000 60.000000 c\n"
                + "h\n"
                + "5.000000 60.000000 20.000000 30.000000 re\n");
    }

    @Test
    void paintOperators() {
        assertThat(graphics.paint(PaintOp.of(true, false, false))).isEqualTo("f\n");
        assertThat(graphics.paint(PaintOp.of(true, false, true))).isEqualTo("f*\n");
        assertThat(graphics.paint(PaintOp.of(false, true, false))).isEqualTo("S\n");
        assertThat(graphics.paint(PaintOp.of(true, true, false))).isEqualTo("B\n");
        assertThat(graphics.paint(PaintOp.of(true, true, true))).isEqualTo("B*\n");
        assertThat(graphics.paint(PaintOp.of(false, false, false))).isEqualTo("n\n");
        assertThat(graphics.paint(PaintOp.clip(false))).isEqualTo("W n\n");
        assertThat(graphics.paint(PaintOp.clip(true))).isEqualTo("W* n\n");
    }

    @Test
    void colors() {
        assertThat(graphics.fillColor(RED)).as("fill")
                .isEqualTo("1.000000 0.000000 0.000000 rg\n");
        assertThat(graphics.strokeColor(new DeviceColor(0, 0.5, 1, 0.2))).as("stroke")
                .isEqualTo("0.000000 0.500000 1.000000 RG\n");
    }

    @Test
    void defaultLineStyle() {
        assertThat(graphics.lineStyle(LineStyle.DEFAULT))
                .isEqualTo("1.000000 w 0 J 0 j 4.000000 M [] 0.000000 d\n");
    }

    @Test
    void dashedLineStyle() {
        LineStyle style = new LineStyle(2, 1, 2, 10, new double[] { 3, 1 }, 0.5);

        assertThat(graphics.lineStyle(style))
                .isEqualTo("2.000000 w 1 J 2 j 10.000000 M [3.000000 1.000000] 0.500000 d\n");
    }

    @Test
    void opaqueNormalNeedsNoGraphicsState() {
        assertThat(graphics.alpha(1, 1, BlendMode.NORMAL)).isEmpty();
        assertThat(graphics.resources()).isEmpty();
    }

    @Test
    void graphicsStateDictionary() {
        String op = graphics.alpha(0.5, 0.5, BlendMode.MULTIPLY);

        assertThat(op).as("operator").isEqualTo("/GS1 gs\n");
        assertThat(graphics.resources()).as("resources").containsExactly(
                entry("GS1", "<< /Type /ExtGState /CA 0.500000 /ca 0.500000 /BM /Multiply >>"));
    }

    @Test
    void graphicsStateOmitsDefaults() {
        graphics.alpha(1, 0.4, BlendMode.MULTIPLY);
        graphics.alpha(0.3, 1, BlendMode.NORMAL);

        assertThat(graphics.resources().values()).containsExactly(
                "<< /Type /ExtGState /ca 0.400000 /BM /Multiply >>",
                "<< /Type /ExtGState /CA 0.300000 >>");
    }

    @Test
    void graphicsStateDeduplicated() {
        String first = graphics.alpha(0.5, 0.5, BlendMode.NORMAL);
        String second = graphics.alpha(0.5, 0.5, BlendMode.NORMAL);

        assertThat(second).isEqualTo(first);
        assertThat(graphics.resources()).hasSize(1);
    }

    private static ResolvedGradient gradient(GradientDef.Kind kind, GradientStop... stops) {
        GradientDef def = GradientDef.of("g", kind, Map.of());
        for (GradientStop stop : stops) {
            def.addStop(stop);
        }
        Map<String, GradientDef> gradients = new HashMap<>();
        gradients.put("g", def);
        return new GradientResolver(new Units(96))
                .resolve("g", gradients, BoundingBox.of(0, 0, 10, 10), 100, 100);
    }

    @Test
    void linearShading() {
        ResolvedGradient linear = gradient(GradientDef.Kind.LINEAR,
                new GradientStop(0, "red", 1), new GradientStop(1, "blue", 1));

        String op = graphics.shading(linear, List.of(RED, BLUE),
                                     AffineMatrix.scale(10, 10));

        assertThat(op).as("operators")
                .isEqualTo("10.000000 0.000000 0.000000 10.000000 0.000000 0.000000 cm\n"
                           + "/Sh1 sh\n");
        assertThat(graphics.resources()).as("resources").containsExactly(entry("Sh1",
                "<< /ShadingType 2 /ColorSpace /DeviceRGB"
                + " /Coords [0.000000 0.000000 1.000000 0.000000]"
                + " /Function << /FunctionType 2 /Domain [0 1]"
                + " /C0 [1.000000 0.000000 0.000000] /C1 [0.000000 0.000000 1.000000] /N 1 >>"
                + " /Extend [true true] >>"));
    }

    @Test
    void radialShadingStitchesStops() {
        ResolvedGradient radial = gradient(GradientDef.Kind.RADIAL,
                new GradientStop(0, "red", 1),
                new GradientStop(0.5, "lime", 1),
                new GradientStop(1, "blue", 1));

        graphics.shading(radial, List.of(RED, LIME, BLUE), AffineMatrix.IDENTITY);

        String dict = graphics.resources().get("Sh1");
        assertThat(dict).as("shading")
                .startsWith("<< /ShadingType 3 /ColorSpace /DeviceRGB"
                        + " /Coords [0.500000 0.500000 0.000000 0.500000 0.500000 0.500000]")
                .contains("/FunctionType 3")
                .contains("/Bounds [0.500000] /Encode [0 1 0 1]");
    }

    @Test
    void stitchingPadsUncoveredEnds() {
        ResolvedGradient linear = gradient(GradientDef.Kind.LINEAR,
                new GradientStop(0.25, "red", 1), new GradientStop(0.75, "blue", 1));

        graphics.shading(linear, List.of(RED, BLUE), AffineMatrix.IDENTITY);

        assertThat(graphics.resources().get("Sh1"))
                .contains("/Bounds [0.250000 0.750000] /Encode [0 1 0 1 0 1]");
    }

}
