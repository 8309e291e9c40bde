/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.Rectangle2D;

import org.junit.jupiter.api.Test;

class PathInterpreterTest {

    private final PathInterpreter interpreter = new PathInterpreter(0.01);

    private RecordingPathSink interpret(String pathData) {
        RecordingPathSink sink = new RecordingPathSink();
        interpreter.interpret(pathData, sink);
        return sink;
    }

    @Test
    void relativeCommands() {
        RecordingPathSink sink = new RecordingPathSink();
        BoundingBox box = interpreter.interpret("m 10 10 l 5 0 0 5 z", sink);

        assertThat(sink.calls).as("calls")
                .containsExactly("M 10.000 10.000",
                                 "L 15.000 10.000",
                                 "L 15.000 15.000",
                                 "Z");
        assertThat(box.toRectangle()).as("bounds")
                .isEqualTo(new Rectangle2D.Double(10, 10, 5, 5));
    }

    @Test
    void moveToContinuationIsLineTo() {
        assertThat(interpret("M0 0 10 0 10 10").calls)
                .containsExactly("M 0.000 0.000",
                                 "L 10.000 0.000",
                                 "L 10.000 10.000");
    }

    @Test
    void horizontalAndVerticalLines() {
        assertThat(interpret("M1 2 H 5 V 7 h -1 v -1").calls)
                .containsExactly("M 1.000 2.000",
                                 "L 5.000 2.000",
                                 "L 5.000 7.000",
                                 "L 4.000 7.000",
                                 "L 4.000 6.000");
    }

    @Test
    void implicitMoveToOrigin() {
        assertThat(interpret("L 10 10").calls)
                .containsExactly("M 0.000 0.000", "L 10.000 10.000");
    }

    @Test
    void closePathReturnsToSubpathStart() {
        assertThat(interpret("M 5 5 L 10 5 Z l 1 1").calls)
                .containsExactly("M 5.000 5.000",
                                 "L 10.000 5.000",
                                 "Z",
                                 "L 6.000 6.000");
    }

    @Test
    void quadraticElevatedToCubic() {
        assertThat(interpret("M0 0 Q 3 3 6 0").calls)
                .containsExactly("M 0.000 0.000",
                                 "C 2.000 2.000 4.000 2.000 6.000 0.000");
    }

    @Test
    void smoothQuadraticReflectsControlPoint() {
        assertThat(interpret("M0 0 Q 3 3 6 0 T 12 0").calls)
                .containsExactly("M 0.000 0.000",
                                 "C 2.000 2.000 4.000 2.000 6.000 0.000",
                                 "C 8.000 -2.000 10.000 -2.000 12.000 0.000");
    }

    @Test
    void smoothCubicReflectsControlPoint() {
        assertThat(interpret("M0 0 C 0 10 10 10 10 0 S 20 -10 20 0").calls)
                .containsExactly("M 0.000 0.000",
                                 "C 0.000 10.000 10.000 10.000 10.000 0.000",
                                 "C 10.000 -10.000 20.000 -10.000 20.000 0.000");
    }

    @Test
    void smoothCubicWithoutPreviousCurve() {
        assertThat(interpret("M5 5 S 10 0 15 5").calls)
                .containsExactly("M 5.000 5.000",
                                 "C 5.000 5.000 10.000 0.000 15.000 5.000");
    }

    @Test
    void unknownCommandSkipped() {
        assertThat(interpret("M0 0 X 5 5 L 10 10").calls)
                .containsExactly("M 0.000 0.000", "L 10.000 10.000");
    }

    @Test
    void insufficientParametersIgnored() {
        assertThat(interpret("M0 0 L 10").calls)
                .containsExactly("M 0.000 0.000");
    }

    @Test
    void tinyValuesSnappedToZero() {
        assertThat(interpret("M 0.001 0 L 10 0.005").calls)
                .containsExactly("M 0.000 0.000", "L 10.000 0.000");
    }

    @Test
    void compactNumberSyntax() {
        assertThat(interpret("M1.5.5L-1-1").calls)
                .containsExactly("M 1.500 0.500", "L -1.000 -1.000");
    }

    @Test
    void arcWithZeroRadiusMovesCurrentPoint() {
        assertThat(interpret("M0 0 A 0 5 0 0 1 10 0 L 10 10").calls)
                .containsExactly("M 0.000 0.000", "L 10.000 10.000");
    }

    @Test
    void arcWithZeroRadiusRelativeOffset() {
        assertThat(interpret("M0 0 a 5 0 0 0 1 10 0 l 0 10").calls)
                .containsExactly("M 0.000 0.000", "L 10.000 10.000");
    }

    @Test
    void arcToCurrentPointIsNoOp() {
        assertThat(interpret("M5 5 A 5 5 0 0 1 5 5").calls)
                .containsExactly("M 5.000 5.000");
    }

    @Test
    void arcWithinToleranceOfCurrentPointIsNoOp() {
        assertThat(interpret("M5 5 A 5 5 0 0 1 5.005 5").calls)
                .containsExactly("M 5.000 5.000");
    }

    @Test
    void repeatedInterpretationIsIdentical() {
        String pathData = "M10 10 h 20 v 5 q 5 5 0 10 t -10 0"
                + " c 0 -5 -5 -5 -5 0 s 5 5 5 0 A 5 5 0 1 0 20 40 z";
        RecordingPathSink first = new RecordingPathSink();
        RecordingPathSink second = new RecordingPathSink();
        BoundingBox firstBox = interpreter.interpret(pathData, first);
        BoundingBox secondBox = interpreter.interpret(pathData, second);

        assertThat(second.calls).as("primitives").isEqualTo(first.calls);
        assertThat(new double[] { secondBox.minX(), secondBox.minY(),
                                  secondBox.width(), secondBox.height() })
                .as("bounds")
                .containsExactly(firstBox.minX(), firstBox.minY(),
                                 firstBox.width(), firstBox.height());
    }

    @Test
    void arcEndsAtTargetPoint() {
        RecordingPathSink sink = interpret("M0 0 A 5 5 0 0 1 10 0");

        assertThat(sink.calls).as("calls").hasSizeGreaterThan(1);
        assertThat(sink.calls.get(sink.calls.size() - 1)).as("last segment")
                .startsWith("C").endsWith("10.000 0.000");
    }

    @Test
    void halfCircleArcBounds() {
        BoundingBox box = interpreter.bounds("M 0 0 A 5 5 0 0 1 10 0");

        assertThat(box.minX()).as("minX").isCloseTo(0, within(1e-9));
        assertThat(box.maxX()).as("maxX").isCloseTo(10, within(1e-9));
        assertThat(box.minY()).as("minY").isCloseTo(-5, within(1e-9));
        assertThat(box.maxY()).as("maxY").isCloseTo(0, within(1e-9));
        assertThat(box.height()).as("height").isCloseTo(5, within(1e-9));
    }

    @Test
    void curveBoundsIncludeControlPoints() {
        BoundingBox box = interpreter.bounds("M0 0 C 0 20 10 20 10 0");

        assertThat(box.maxY()).as("maxY").isEqualTo(20);
        assertThat(box.width()).as("width").isEqualTo(10);
    }

    @Test
    void emptyPath() {
        assertThat(interpreter.bounds(null).isEmpty()).as("null path").isTrue();
        assertThat(interpreter.bounds("").isEmpty()).as("empty path").isTrue();
    }

}
