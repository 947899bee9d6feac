/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.soltrack;

import static com.github.tinemuz.soltrack.SolarConstants.TWO_PI;

/** Angle reduction and the azimuth zero-point convention. */
public final class Conventions {

    private Conventions() {}

    /** Reduce an angle into [0, 2pi). */
    public static double reduceAngle(double angle) {
        double r = angle % TWO_PI;  // exact, keeps the sign of angle
        if (r < 0.0) r += TWO_PI;
        // a tiny negative remainder can round up to exactly 2pi
        return r >= TWO_PI ? 0.0 : r;
    }

    /** Reduce an angle into [-pi, pi). */
    public static double reduceAngleSigned(double angle) {
        return reduceAngle(angle + Math.PI) - Math.PI;
    }

    /** Degrees of an angle already in [0, 2pi), kept below 360. */
    public static double toDegreesReduced(double angle) {
        double deg = Math.toDegrees(angle);
        return deg >= 360.0 ? 0.0 : deg;
    }

    /**
     * Move the zero point of an azimuth or hour angle from south to north
     * (compass convention, pi/2 = east).
     */
    public static double northEqualsZero(double southBasedAngle) {
        return reduceAngle(southBasedAngle + Math.PI);
    }
}
