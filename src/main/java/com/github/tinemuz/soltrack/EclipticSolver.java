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
 * Apparent ecliptic longitude, distance and obliquity of the Sun from a
 * truncated low-precision solar theory.
 *
 * <p>All series are polynomials in Julian centuries T since J2000.0, with
 * coefficients in radians (or AU / dimensionless where noted) per power of T.
 * The coefficients fix the accuracy of the whole library and are not meant to
 * be tuned.</p>
 */
public final class EclipticSolver {
    /** Mean longitude of the Sun: rad, rad/T, rad/T^2. */
    private static final double[] MEAN_LONGITUDE = {4.895063168, 628.331966786, 5.291838e-6};

    /** Mean anomaly of the Sun: rad, rad/T, rad/T^2. */
    private static final double[] MEAN_ANOMALY = {6.240060141, 628.301955152, -2.682571e-6};

    /** Eccentricity of the Earth's orbit: 1, 1/T, 1/T^2. */
    private static final double[] ECCENTRICITY = {0.016708634, -0.000042037, -0.0000001267};

    /** Equation of the centre, coefficient of sin(M): rad, rad/T, rad/T^2. */
    private static final double[] CENTRE_SIN_M = {3.34161088e-2, -8.40725e-5, -2.443e-7};

    /** Equation of the centre, coefficient of sin(2M): rad, rad/T. */
    private static final double[] CENTRE_SIN_2M = {3.489437e-4, -1.76278e-6};

    /** Equation of the centre, coefficient of sin(3M) (rad). */
    private static final double CENTRE_SIN_3M = 5.044e-6;

    /** Semi-major axis of the Earth's orbit (AU). */
    private static final double SEMI_MAJOR_AXIS_AU = 1.000001018;

    /** Longitude of the Moon's mean ascending node: rad per T^0..T^4. */
    private static final double[] MOON_NODE =
            {2.1824390725, -33.7570464271, 3.622256e-5, 3.7337958e-8, -2.879321e-10};

    /** Mean longitude of the Moon: rad, rad/T. */
    private static final double[] MOON_MEAN_LONGITUDE = {3.8103417, 8399.709113};

    /** Nutation in longitude: coefficients of sin(Omega), sin(2L0), sin(2Lm), sin(2Omega) (rad). */
    private static final double[] NUTATION_LONGITUDE = {-8.338795e-5, -6.39954e-6, -1.115e-6, 1.018e-6};

    /** Annual aberration times distance (rad AU). */
    private static final double ABERRATION = -9.93087e-5;

    /** Mean obliquity of the ecliptic: rad per T^0..T^3. */
    private static final double[] MEAN_OBLIQUITY =
            {0.409092804222, -2.26965525e-4, -2.86e-9, 8.78967e-9};

    /** Nutation in obliquity: coefficients of cos(Omega), cos(2L0), cos(2Lm), cos(2Omega) (rad). */
    private static final double[] NUTATION_OBLIQUITY = {4.46e-5, 2.76e-6, 4.848e-7, -4.36e-7};

    private EclipticSolver() {}

    /** Evaluate the solar theory at the given time. */
    public static EclipticPosition solve(TimeScale ts) {
        double t = ts.centuries();
        double t2 = ts.centuries2();
        double t3 = ts.centuries3();

        double l0 = MEAN_LONGITUDE[0] + MEAN_LONGITUDE[1] * t + MEAN_LONGITUDE[2] * t2;
        double m = MEAN_ANOMALY[0] + MEAN_ANOMALY[1] * t + MEAN_ANOMALY[2] * t2;
        double e = ECCENTRICITY[0] + ECCENTRICITY[1] * t + ECCENTRICITY[2] * t2;

        double centre = (CENTRE_SIN_M[0] + CENTRE_SIN_M[1] * t + CENTRE_SIN_M[2] * t2) * Math.sin(m)
                + (CENTRE_SIN_2M[0] + CENTRE_SIN_2M[1] * t) * Math.sin(2 * m)
                + CENTRE_SIN_3M * Math.sin(3 * m);
        double trueLongitude = l0 + centre;
        double trueAnomaly = m + centre;
        double distance = SEMI_MAJOR_AXIS_AU * (1.0 - e * e) / (1.0 + e * Math.cos(trueAnomaly));

        double omega = MOON_NODE[0] + MOON_NODE[1] * t + MOON_NODE[2] * t2
                + MOON_NODE[3] * t3 + MOON_NODE[4] * t2 * t2;
        double moonLongitude = MOON_MEAN_LONGITUDE[0] + MOON_MEAN_LONGITUDE[1] * t;

        double dpsi = NUTATION_LONGITUDE[0] * Math.sin(omega)
                + NUTATION_LONGITUDE[1] * Math.sin(2 * l0)
                + NUTATION_LONGITUDE[2] * Math.sin(2 * moonLongitude)
                + NUTATION_LONGITUDE[3] * Math.sin(2 * omega);
        double aberration = ABERRATION / distance;
        double longitude = Conventions.reduceAngle(trueLongitude + aberration + dpsi);

        double eps0 = MEAN_OBLIQUITY[0] + MEAN_OBLIQUITY[1] * t
                + MEAN_OBLIQUITY[2] * t2 + MEAN_OBLIQUITY[3] * t3;
        double deps = NUTATION_OBLIQUITY[0] * Math.cos(omega)
                + NUTATION_OBLIQUITY[1] * Math.cos(2 * l0)
                + NUTATION_OBLIQUITY[2] * Math.cos(2 * moonLongitude)
                + NUTATION_OBLIQUITY[3] * Math.cos(2 * omega);

        return new EclipticPosition(longitude, distance, eps0 + deps, dpsi);
    }
}
