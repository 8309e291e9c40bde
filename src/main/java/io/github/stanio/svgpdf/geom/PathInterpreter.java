/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf.geom;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets SVG path data.
 * <p>
 * The data is split into command letters, each followed by a run of
 * parameters.  A parameter run longer than the command's group size repeats
 * the command for each further group; a repeated {@code M}/{@code m} turns
 * into {@code L}/{@code l}.  Relative coordinates are resolved against the
 * current point after the preceding group.  Quadratic segments are elevated
 * to cubic ones.  Unknown command letters are skipped along with their
 * parameters.</p>
 * <p>
 * Instances are immutable and may be shared.</p>
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/paths.html#PathData"
 *          >SVG 1.1: Path data</a>
 */
public class PathInterpreter {

    private static final Logger log = Logger.getLogger(PathInterpreter.class.getName());

    private static final Pattern COMMAND = Pattern.compile("([A-Za-z])([^A-Za-z]*)");

    private final double minimumLength;

    /**
     * @param  minimumLength  parameter values with a smaller magnitude are
     *         taken as zero
     */
    public PathInterpreter(double minimumLength) {
        this.minimumLength = Math.abs(minimumLength);
    }

    public double minimumLength() {
        return minimumLength;
    }

    /**
     * Computes the bounding box of the given path data without drawing.
     *
     * @param   pathData  the {@code d} attribute value
     * @return  the bounding box of the path, including control points
     */
    public BoundingBox bounds(String pathData) {
        return interpret(pathData, PathSink.NULL);
    }

    /**
     * Interprets the given path data issuing the corresponding calls to the
     * given sink.
     *
     * @param   pathData  the {@code d} attribute value
     * @param   sink  receives the path construction calls
     * @return  the bounding box of the path; curve control points are
     *          included, arcs contribute their exact extremes
     */
    public BoundingBox interpret(String pathData, PathSink sink) {
        PathState state = new PathState();
        if (pathData == null)
            return state.bounds;

        Matcher m = COMMAND.matcher(pathData);
        while (m.find()) {
            char command = m.group(1).charAt(0);
            double[] params = snap(NumberList.parse(m.group(2)));
            apply(state, command, params, sink);
        }
        return state.bounds;
    }

    private double[] snap(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i]) < minimumLength) {
                values[i] = 0;
            }
        }
        return values;
    }

    private static int groupSize(char op) {
        switch (op) {
        case 'Z': return 0;
        case 'H':
        case 'V': return 1;
        case 'M':
        case 'L':
        case 'T': return 2;
        case 'S':
        case 'Q': return 4;
        case 'C': return 6;
        case 'A': return 7;
        default:  return -1;
        }
    }

    private void apply(PathState s, char command, double[] p, PathSink sink) {
        char op = Character.toUpperCase(command);
        boolean relative = (op != command);
        int groupSize = groupSize(op);
        if (groupSize < 0) {
            log.log(Level.FINE, "Unknown path command ignored: {0}", command);
            return;
        }

        if (op == 'Z') {
            if (s.started) {
                sink.closePath();
                s.x = s.startX;
                s.y = s.startY;
            }
            s.previous = 'Z';
            return;
        }

        if (p.length < groupSize) {
            log.log(Level.FINE, "Insufficient parameters for path command {0}: {1}",
                                new Object[] { command, p.length });
            return;
        }

        for (int i = 0; i + groupSize <= p.length; i += groupSize) {
            double ox = relative ? s.x : 0;
            double oy = relative ? s.y : 0;
            switch (op) {
            case 'M':
                if (i == 0) {
                    s.moveTo(sink, ox + p[i], oy + p[i + 1]);
                } else {
                    s.lineTo(sink, ox + p[i], oy + p[i + 1]);
                }
                break;

            case 'L':
                s.lineTo(sink, ox + p[i], oy + p[i + 1]);
                break;

            case 'H':
                s.lineTo(sink, ox + p[i], s.y);
                break;

            case 'V':
                s.lineTo(sink, s.x, oy + p[i]);
                break;

            case 'C':
                s.curveTo(sink, ox + p[i], oy + p[i + 1],
                                ox + p[i + 2], oy + p[i + 3],
                                ox + p[i + 4], oy + p[i + 5]);
                s.previous = 'C';
                break;

            case 'S': {
                double x1 = s.x;
                double y1 = s.y;
                if (s.previous == 'C' || s.previous == 'S') {
                    x1 = 2 * s.x - s.ctrlX;
                    y1 = 2 * s.y - s.ctrlY;
                }
                s.curveTo(sink, x1, y1,
                                ox + p[i], oy + p[i + 1],
                                ox + p[i + 2], oy + p[i + 3]);
                s.previous = 'S';
                break;
            }

            case 'Q':
                s.quadTo(sink, ox + p[i], oy + p[i + 1],
                               ox + p[i + 2], oy + p[i + 3]);
                s.previous = 'Q';
                break;

            case 'T': {
                double qx = s.x;
                double qy = s.y;
                if (s.previous == 'Q' || s.previous == 'T') {
                    qx = 2 * s.x - s.ctrlX;
                    qy = 2 * s.y - s.ctrlY;
                }
                s.quadTo(sink, qx, qy, ox + p[i], oy + p[i + 1]);
                s.previous = 'T';
                break;
            }

            case 'A':
                arcTo(s, sink, p[i], p[i + 1], p[i + 2],
                      p[i + 3] != 0, p[i + 4] != 0,
                      ox + p[i + 5], oy + p[i + 6]);
                break;

            default:
                throw new IllegalStateException("Unhandled command: " + op);
            }
        }
    }

    private void arcTo(PathState s, PathSink sink,
                       double rx, double ry, double rotation,
                       boolean largeArc, boolean sweep, double x, double y) {
        s.ensureStarted(sink);
        s.previous = 'A';
        if (negligible(x - s.x) && negligible(y - s.y))
            return; // no-op

        if (negligible(rx) || negligible(ry)) {
            // Degenerate radii only move the current point
            s.x = x;
            s.y = y;
            return;
        }

        EllipticalArc arc = EllipticalArc.fromEndpoints(s.x, s.y,
                rx, ry, rotation, largeArc, sweep, x, y);
        sink.ellipticalArc(arc);
        s.bounds.add(arc.bounds());
        s.x = x;
        s.y = y;
    }

    private boolean negligible(double value) {
        return value == 0 || Math.abs(value) < minimumLength;
    }


    /**
     * Running state of a single path interpretation.
     */
    static final class PathState {

        final BoundingBox bounds = new BoundingBox();

        double x;
        double y;
        double startX;
        double startY;
        double ctrlX;
        double ctrlY;
        char previous;
        boolean started;

        void ensureStarted(PathSink sink) {
            if (started) return;

            sink.moveTo(x, y);
            bounds.add(x, y);
            startX = x;
            startY = y;
            started = true;
        }

        void moveTo(PathSink sink, double x, double y) {
            sink.moveTo(x, y);
            bounds.add(x, y);
            this.x = startX = x;
            this.y = startY = y;
            started = true;
            previous = 'M';
        }

        void lineTo(PathSink sink, double x, double y) {
            ensureStarted(sink);
            sink.lineTo(x, y);
            bounds.add(x, y);
            this.x = x;
            this.y = y;
            previous = 'L';
        }

        void curveTo(PathSink sink, double x1, double y1,
                     double x2, double y2, double x, double y) {
            ensureStarted(sink);
            sink.curveTo(x1, y1, x2, y2, x, y);
            bounds.add(x1, y1);
            bounds.add(x2, y2);
            bounds.add(x, y);
            ctrlX = x2;
            ctrlY = y2;
            this.x = x;
            this.y = y;
        }

        void quadTo(PathSink sink, double qx, double qy, double x, double y) {
            double x1 = this.x + 2.0 / 3 * (qx - this.x);
            double y1 = this.y + 2.0 / 3 * (qy - this.y);
            double x2 = x + 2.0 / 3 * (qx - x);
            double y2 = y + 2.0 / 3 * (qy - y);
            curveTo(sink, x1, y1, x2, y2, x, y);
            ctrlX = qx;
            ctrlY = qy;
        }

    } // class PathState


}
