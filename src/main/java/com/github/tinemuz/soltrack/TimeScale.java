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

import static com.github.tinemuz.soltrack.SolarConstants.DAYS_PER_JULIAN_CENTURY;
import static com.github.tinemuz.soltrack.SolarConstants.JD_J2000;

/**
 * Continuous time scale of one computation: Julian Day and the powers of time
 * since J2000.0 that the solar series are polynomials in.
 *
 * @param julianDay      Julian Day (UT)
 * @param daysSinceJ2000 days since 2000-01-01 12:00 UT
 * @param centuries      Julian centuries since J2000.0 (T)
 * @param centuries2     T^2
 * @param centuries3     T^3
 */
public record TimeScale(
        double julianDay, double daysSinceJ2000, double centuries, double centuries2, double centuries3) {

    /** Time scale of an already validated civil time. */
    public static TimeScale of(CivilTime time) {
        return ofJulianDay(
                julianDay(time.year(), time.month(), time.day(),
                        time.hour(), time.minute(), time.second()));
    }

    public static TimeScale ofJulianDay(double julianDay) {
        double dJD = julianDay - JD_J2000;
        double t = dJD / DAYS_PER_JULIAN_CENTURY;
        double t2 = t * t;
        return new TimeScale(julianDay, dJD, t, t2, t2 * t);
    }

    /**
     * Julian Day of a Gregorian calendar date and UT time.
     *
     * <p>No range checks: hour, minute and second simply add their day
     * fractions, so second counts past 60 are accepted.</p>
     */
    public static double julianDay(int year, int month, int day, int hour, int minute, double second) {
        // January and February count as months 13 and 14 of the previous year
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        int century = (int) Math.floor(year / 100.0);
        int gregorian = 2 - century + (int) Math.floor(century / 4.0);

        double dayWithFraction = day + hour / 24.0 + minute / 1440.0 + second / 86400.0;
        return Math.floor(365.250 * (year + 4716))
                + Math.floor(30.60010 * (month + 1))
                + dayWithFraction
                + gregorian
                - 1524.5;
    }
}
