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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EclipticSolverTest {

    private static final double LONGITUDE_TOLERANCE = 1e-3; // degrees

    private static EclipticPosition at(int year, int month, int day, int hour, int minute, double second) {
        return EclipticSolver.solve(TimeScale.of(CivilTime.of(year, month, day, hour, minute, second)));
    }

    @Test
    @DisplayName("June solstice 2014: longitude 90 degrees")
    void juneSolstice() {
        EclipticPosition p = at(2014, 6, 21, 10, 51, 0);
        // solstice instant 10:51 UT; the Sun moves about 0.04 degrees per hour
        assertEquals(90.0, Math.toDegrees(p.longitude()), 0.04);
        assertEquals(90.0374, Math.toDegrees(at(2014, 6, 21, 11, 41, 46).longitude()), LONGITUDE_TOLERANCE);
    }

    @Test
    @DisplayName("December solstice 2014: longitude 270 degrees")
    void decemberSolstice() {
        assertEquals(270.0042, Math.toDegrees(at(2014, 12, 21, 23, 3, 0).longitude()), LONGITUDE_TOLERANCE);
    }

    @Test
    @DisplayName("March equinox 2014: longitude 0 degrees")
    void marchEquinox() {
        double lon = Math.toDegrees(at(2014, 3, 20, 16, 57, 0).longitude());
        assertEquals(0.0058, lon, LONGITUDE_TOLERANCE);
    }

    @Test
    @DisplayName("Longitude is reduced into [0, 2pi)")
    void longitudeReduced() {
        for (int year = 1700; year <= 2300; year += 7) {
            for (int month = 1; month <= 12; month++) {
                double lon = at(year, month, 10, 6, 0, 0).longitude();
                assertTrue(lon >= 0.0 && lon < 2 * Math.PI, "longitude " + lon);
            }
        }
    }

    @Test
    @DisplayName("Distance: perihelion in January, aphelion in July")
    void distance() {
        double perihelion = at(2014, 1, 4, 0, 0, 0).distanceAu();
        double aphelion = at(2014, 7, 4, 0, 0, 0).distanceAu();
        assertEquals(0.98330, perihelion, 1e-4);
        assertEquals(1.01670, aphelion, 1e-4);
    }

    @Test
    @DisplayName("Obliquity is about 23.44 degrees")
    void obliquity() {
        EclipticPosition j2000 = at(2000, 1, 1, 12, 0, 0);
        assertEquals(23.4377, Math.toDegrees(j2000.obliquity()), 1e-3);
        assertEquals(Math.cos(j2000.obliquity()), j2000.cosObliquity());

        // decreasing by about 47 arcseconds per century
        EclipticPosition j2100 = EclipticSolver.solve(TimeScale.ofJulianDay(SolarConstants.JD_J2000 + 36525.0));
        assertTrue(j2100.obliquity() < j2000.obliquity());
    }

    @Test
    @DisplayName("Nutation in longitude stays below 20 arcseconds")
    void nutation() {
        for (int day = 0; day < 7000; day += 37) {
            EclipticPosition p = EclipticSolver.solve(TimeScale.ofJulianDay(SolarConstants.JD_J2000 + day));
            assertTrue(Math.abs(Math.toDegrees(p.nutationLongitude()) * 3600.0) < 20.0);
        }
    }
}
