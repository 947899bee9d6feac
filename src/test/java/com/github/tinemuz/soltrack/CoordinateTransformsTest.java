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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CoordinateTransformsTest {

    private static final double TOLERANCE = 1e-9; // radians
    private static final double OBLIQUITY = Math.toRadians(23.4393);

    @Nested
    @DisplayName("Ecliptic to Equatorial")
    class EclipticToEquatorialTests {

        @Test
        @DisplayName("Equinoxes and solstices")
        void cardinalPoints() {
            EquatorialPosition equinox = CoordinateTransforms.eclipticToEquatorial(0.0, OBLIQUITY);
            assertEquals(0.0, equinox.rightAscension(), TOLERANCE);
            assertEquals(0.0, equinox.declination(), TOLERANCE);

            EquatorialPosition june = CoordinateTransforms.eclipticToEquatorial(Math.PI / 2, OBLIQUITY);
            assertEquals(Math.PI / 2, june.rightAscension(), TOLERANCE);
            assertEquals(OBLIQUITY, june.declination(), TOLERANCE);

            EquatorialPosition december = CoordinateTransforms.eclipticToEquatorial(1.5 * Math.PI, OBLIQUITY);
            assertEquals(-Math.PI / 2, december.rightAscension(), TOLERANCE);
            assertEquals(-OBLIQUITY, december.declination(), TOLERANCE);
        }

        @Test
        @DisplayName("Right ascension stays in the quadrant of the longitude")
        void quadrant() {
            for (double lon = 0.05; lon < 2 * Math.PI; lon += 0.1) {
                EquatorialPosition p = CoordinateTransforms.eclipticToEquatorial(lon, OBLIQUITY);
                double ra = Conventions.reduceAngle(p.rightAscension());
                assertEquals((int) (lon / (Math.PI / 2)), (int) (ra / (Math.PI / 2)), "lon " + lon);
            }
        }
    }

    @Nested
    @DisplayName("Equatorial and Horizontal")
    class HorizontalTests {

        @Test
        @DisplayName("Upper culmination is due south with altitude 90 - lat + dec")
        void culmination() {
            double lat = Math.toRadians(52.0);
            double dec = Math.toRadians(20.0);
            HorizontalPosition h = CoordinateTransforms.equatorialToHorizontal(lat, 0.0, dec);
            assertEquals(0.0, h.azimuth(), TOLERANCE);
            assertEquals(Math.toRadians(58.0), h.altitude(), TOLERANCE);
        }

        @Test
        @DisplayName("Positive hour angle places the body in the west")
        void westward() {
            HorizontalPosition h = CoordinateTransforms.equatorialToHorizontal(
                    Math.toRadians(52.0), Math.toRadians(45.0), 0.0);
            assertTrue(h.azimuth() > 0.0 && h.azimuth() < Math.PI, "west of south: " + h.azimuth());
        }

        @Test
        @DisplayName("At the North Pole the altitude equals the declination")
        void northPole() {
            for (double dec = -0.4; dec <= 0.4; dec += 0.05) {
                for (double ha = 0.0; ha < 2 * Math.PI; ha += 0.7) {
                    HorizontalPosition h = CoordinateTransforms.equatorialToHorizontal(Math.PI / 2, ha, dec);
                    assertEquals(dec, h.altitude(), TOLERANCE);
                    assertTrue(Double.isFinite(h.azimuth()));
                }
            }
        }

        @Test
        @DisplayName("Horizontal to equatorial inverts equatorial to horizontal")
        void roundTrip() {
            for (double latDeg = -80.0; latDeg <= 80.0; latDeg += 10.0) {
                double lat = Math.toRadians(latDeg);
                for (double ha = 0.1; ha < 2 * Math.PI; ha += 0.4) {
                    for (double decDeg = -23.0; decDeg <= 23.0; decDeg += 4.6) {
                        double dec = Math.toRadians(decDeg);
                        HorizontalPosition h = CoordinateTransforms.equatorialToHorizontal(lat, ha, dec);
                        if (Math.abs(h.altitude()) > Math.toRadians(85.0)) continue;

                        HourAnglePosition back =
                                CoordinateTransforms.horizontalToEquatorial(lat, h.azimuth(), h.altitude());
                        String at = "lat " + latDeg + " ha " + ha + " dec " + decDeg;
                        assertEquals(dec, back.declination(), TOLERANCE, at);
                        double dHa = Conventions.reduceAngleSigned(back.hourAngle() - ha);
                        assertEquals(0.0, dHa, TOLERANCE, at);
                    }
                }
            }
        }

        @Test
        @DisplayName("Hour angle from the inverse is in [0, 2pi)")
        void hourAngleReduced() {
            HourAnglePosition p = CoordinateTransforms.horizontalToEquatorial(
                    Math.toRadians(52.0), Math.toRadians(-60.0), Math.toRadians(10.0));
            assertTrue(p.hourAngle() >= 0.0 && p.hourAngle() < 2 * Math.PI);
        }
    }

    @Nested
    @DisplayName("Sidereal Time")
    class SiderealTimeTests {

        @Test
        @DisplayName("Apparent sidereal time at J2000.0")
        void j2000() {
            TimeScale ts = TimeScale.ofJulianDay(SolarConstants.JD_J2000);
            EclipticPosition ecl = EclipticSolver.solve(ts);
            double agst = CoordinateTransforms.apparentSiderealTime(ts, ecl);
            double hours = Conventions.reduceAngle(agst) * SolarConstants.RAD_TO_HOURS;
            // GMST 18.6973746 h minus 0.86 s equation of the equinoxes
            assertEquals(18.6971362, hours, 1e-6);
        }

        @Test
        @DisplayName("Advances one sidereal day per 0.99727 solar days")
        void rate() {
            TimeScale t0 = TimeScale.ofJulianDay(2460000.5);
            TimeScale t1 = TimeScale.ofJulianDay(2460001.5);
            double a0 = CoordinateTransforms.apparentSiderealTime(t0, EclipticSolver.solve(t0));
            double a1 = CoordinateTransforms.apparentSiderealTime(t1, EclipticSolver.solve(t1));
            assertEquals(2 * Math.PI * 1.0027379, a1 - a0, 1e-5);
        }

        @Test
        @DisplayName("Hour angle is sidereal time plus longitude minus right ascension")
        void hourAngle() {
            assertEquals(0.7, CoordinateTransforms.localHourAngle(1.0, 0.2, 0.5), 1e-15);
        }
    }
}
