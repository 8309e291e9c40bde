/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.gradient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.stanio.svgpdf.geom.AffineMatrix;
import io.github.stanio.svgpdf.geom.BoundingBox;
import io.github.stanio.svgpdf.geom.Units;
import io.github.stanio.svgpdf.gradient.GradientDef.Kind;

class GradientResolverTest {

    private static final BoundingBox BOX = BoundingBox.of(10, 20, 100, 50);

    private final GradientResolver resolver = new GradientResolver(new Units(96));

    private Map<String, GradientDef> gradients;

    @BeforeEach
    void setUp() {
        gradients = new HashMap<>();
    }

    private GradientDef define(String id, Kind kind, Map<String, String> attributes,
                               GradientStop... stops) {
        GradientDef def = GradientDef.of(id, kind, attributes);
        for (GradientStop stop : stops) {
            def.addStop(stop);
        }
        gradients.put(id, def);
        return def;
    }

    private static GradientStop[] redToBlue() {
        return new GradientStop[] {
            new GradientStop(0, "red", 1),
            new GradientStop(1, "blue", 1)
        };
    }

    private ResolvedGradient resolve(String id) {
        return resolver.resolve(id, gradients, BOX, 200, 200);
    }

    private static void assertMatrix(AffineMatrix actual, double... expected) {
        assertThat(actual.toArray()).as("placement %s", actual)
                .containsExactly(expected, within(1e-9));
    }

    @Test
    void linearDefaults() {
        define("a", Kind.LINEAR, Map.of(), redToBlue());

        ResolvedGradient gradient = resolve("a");

        assertThat(gradient.kind()).as("kind").isEqualTo(Kind.LINEAR);
        assertThat(gradient.coordinates()).as("coordinates")
                .containsExactly(new double[] { 0, 0, 1, 0 }, within(1e-9));
        assertMatrix(gradient.placement(), 100, 0, 0, 50, 10, 20);
        assertThat(gradient.stops()).as("stops").hasSize(2);
    }

    @Test
    void radialDefaults() {
        define("r", Kind.RADIAL, Map.of(), redToBlue());

        ResolvedGradient gradient = resolve("r");

        assertThat(gradient.kind()).as("kind").isEqualTo(Kind.RADIAL);
        assertThat(gradient.coordinates()).as("coordinates")
                .containsExactly(new double[] { 0.5, 0.5, 0.5, 0.5, 0.5 }, within(1e-9));
    }

    @Test
    void radialFocalPoint() {
        define("r", Kind.RADIAL, Map.of("cx", "50%", "cy", "50%",
                                        "fx", "25%", "r", "40%"), redToBlue());

        assertThat(resolve("r").coordinates())
                .containsExactly(new double[] { 0.5, 0.5, 0.25, 0.5, 0.4 }, within(1e-9));
    }

    @Test
    void unknownGradient() {
        assertThat(resolve("missing")).isNull();
    }

    @Test
    void gradientWithoutStops() {
        define("a", Kind.LINEAR, Map.of());

        assertThat(resolve("a")).isNull();
    }

    @Test
    void singleStopIsSolid() {
        define("a", Kind.LINEAR, Map.of(), new GradientStop(0.3, "green", 0.5));

        ResolvedGradient gradient = resolve("a");

        assertThat(gradient.isSolid()).as("solid").isTrue();
        assertThat(gradient.placement()).as("placement").isNull();
        assertThat(gradient.solidStop().color()).as("color").isEqualTo("green");
        assertThat(gradient.solidStop().opacity()).as("opacity").isEqualTo(0.5);
    }

    @Test
    void emptyBox() {
        define("a", Kind.LINEAR, Map.of(), redToBlue());

        assertThat(resolver.resolve("a", gradients, new BoundingBox(), 200, 200))
                .as("empty box").isNull();
        assertThat(resolver.resolve("a", gradients, BoundingBox.of(0, 0, 10, 0), 200, 200))
                .as("zero height").isNull();
    }

    @Test
    void stopsInheritedThroughReference() {
        define("base", Kind.LINEAR, Map.of(), redToBlue());
        define("derived", Kind.RADIAL, Map.of("href", "#base"));

        ResolvedGradient gradient = resolve("derived");

        assertThat(gradient.kind()).as("kind").isEqualTo(Kind.RADIAL);
        assertThat(gradient.stops()).extracting(GradientStop::color)
                .as("stop colors").containsExactly("red", "blue");
    }

    @Test
    void localStopsOverrideReferenced() {
        define("base", Kind.LINEAR, Map.of(), redToBlue());
        define("derived", Kind.LINEAR, Map.of("href", "#base"),
               new GradientStop(0, "lime", 1), new GradientStop(1, "black", 1));

        assertThat(resolve("derived").stops()).extracting(GradientStop::color)
                .containsExactly("lime", "black");
    }

    @Test
    void circularReference() {
        define("a", Kind.LINEAR, Map.of("href", "#b"));
        define("b", Kind.LINEAR, Map.of("href", "#a"));

        assertThat(resolve("a")).isNull();
    }

    @Test
    void userSpaceOnUseNormalizedToSquare() {
        define("a", Kind.LINEAR, Map.of("gradientUnits", "userSpaceOnUse",
                                        "x1", "10", "y1", "20",
                                        "x2", "110", "y2", "20"), redToBlue());

        ResolvedGradient gradient = resolve("a");

        assertThat(gradient.coordinates()).as("coordinates")
                .containsExactly(new double[] { 0, 0, 1, 0 }, within(1e-9));
        assertMatrix(gradient.placement(), 100, 0, 0, 100, 10, 20);
    }

    @Test
    void unitsInheritedThroughReference() {
        define("base", Kind.LINEAR, Map.of("gradientUnits", "userSpaceOnUse"), redToBlue());
        define("derived", Kind.LINEAR, Map.of("href", "#base",
                                              "x1", "10", "y1", "70",
                                              "x2", "60", "y2", "70"));

        ResolvedGradient gradient = resolve("derived");

        assertThat(gradient.coordinates())
                .containsExactly(new double[] { 0, 0.5, 0.5, 0.5 }, within(1e-9));
    }

    @Test
    void userSpaceOnUsePercentages() {
        define("a", Kind.LINEAR, Map.of("gradientUnits", "userSpaceOnUse",
                                        "x1", "10%", "x2", "60%"), redToBlue());

        ResolvedGradient gradient = resolve("a");

        assertThat(gradient.coordinates())
                .containsExactly(new double[] { 0.1, 0, 0.6, 0 }, within(1e-9));
        assertMatrix(gradient.placement(), 100, 0, 0, 50, 10, 20);
    }

    @Test
    void boundingBoxNumbersAreFractions() {
        define("a", Kind.LINEAR, Map.of("x1", "0", "x2", "0.5"), redToBlue());

        assertThat(resolve("a").coordinates())
                .containsExactly(new double[] { 0, 0, 0.5, 0 }, within(1e-9));
    }

    @Test
    void degenerateLinear() {
        define("a", Kind.LINEAR, Map.of("x1", "0.5", "x2", "0.5",
                                        "y1", "0", "y2", "0"), redToBlue());

        assertThat(resolve("a").coordinates())
                .containsExactly(new double[] { 1, 0, 0.999, 0 }, within(1e-9));
    }

    @Test
    void gradientTransform() {
        define("a", Kind.LINEAR, Map.of("gradientTransform", "rotate(90)"), redToBlue());

        assertThat(resolve("a").coordinates())
                .containsExactly(new double[] { 0, 0, 0, 1 }, within(1e-9));
    }

    @Test
    void radialTransformScalesRadius() {
        define("r", Kind.RADIAL, Map.of("gradientTransform", "scale(0.5)"), redToBlue());

        assertThat(resolve("r").coordinates())
                .containsExactly(new double[] { 0.25, 0.25, 0.25, 0.25, 0.25 }, within(1e-9));
    }

    @Test
    void normalizeStops() {
        List<GradientStop> stops = GradientResolver.normalizeStops(List.of(
                new GradientStop(-0.5, "red", 1),
                new GradientStop(0.5, "lime", 1),
                new GradientStop(0.2, "blue", 1),
                new GradientStop(1.5, "black", 1)));

        assertThat(stops).extracting(GradientStop::offset)
                .containsExactly(0.0, 0.5, 0.5, 1.0);
    }

    @Test
    void stopsLookup() {
        define("base", Kind.LINEAR, Map.of(), redToBlue());
        define("derived", Kind.LINEAR, Map.of("href", "#base"));

        assertThat(resolver.stops("derived", gradients)).as("referenced")
                .extracting(GradientStop::color).containsExactly("red", "blue");
        assertThat(resolver.stops("missing", gradients)).as("missing").isEmpty();
    }

}
