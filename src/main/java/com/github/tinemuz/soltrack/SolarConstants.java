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

/**
 * Physical and calendar constants shared by the pipeline stages.
 *
 * <p>Series coefficients of the solar theory live next to the code that
 * evaluates them ({@link EclipticSolver}, {@link CoordinateTransforms},
 * {@link AtmosphericCorrection}); this class holds the values several stages
 * agree on.</p>
 */
public final class SolarConstants {
    /** Full turn in radians. */
    public static final double TWO_PI = 2.0 * Math.PI;

    /** Radians to hours of time (12/pi). */
    public static final double RAD_TO_HOURS = 12.0 / Math.PI;

    /** Julian Day of the J2000.0 epoch (2000-01-01 12:00 UT). */
    public static final double JD_J2000 = 2451545.0;

    /** Days in a Julian century. */
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    /** Equatorial radius of the Earth in centimeters (GRS 80 / WGS-84). */
    public static final double EARTH_RADIUS_CM = 6.3781370e8;

    /** Astronomical unit in centimeters (2012 IAU value). */
    public static final double AU_CM = 1.49597870700e13;

    /** First year of the Gregorian calendar. */
    public static final int FIRST_GREGORIAN_YEAR = 1582;

    private SolarConstants() {}
}
