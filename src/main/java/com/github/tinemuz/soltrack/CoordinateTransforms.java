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
 * Closed-form spherical-trigonometry conversions between the ecliptic,
 * equatorial and horizontal frames.
 *
 * <p>Azimuth and hour angle use the south = 0 convention of celestial
 * astronomy. Cosines of latitude, declination and altitude are taken as
 * sqrt(1 - sin^2), which is valid because those angles never leave
 * [-pi/2, pi/2].</p>
 */
public final class CoordinateTransforms {
    /** Greenwich mean sidereal time: rad, rad/day, rad/T^2, rad/T^3. */
    private static final double[] GMST =
            {4.89496121273579229, 6.3003880989849575, 6.77070812713916e-6, -4.5087296615715e-10};

    private CoordinateTransforms() {}

    /**
     * Ecliptic to equatorial coordinates for a body on the ecliptic
     * (ecliptic latitude zero).
     *
     * <p>The right ascension is returned as atan2 gives it, in (-pi, pi].</p>
     */
    public static EquatorialPosition eclipticToEquatorial(double longitude, double obliquity) {
        double sinLon = Math.sin(longitude);
        double ra = Math.atan2(Math.cos(obliquity) * sinLon, Math.cos(longitude));
        double dec = Math.asin(Math.sin(obliquity) * sinLon);
        return new EquatorialPosition(ra, dec);
    }

    /**
     * Apparent Greenwich sidereal time: the mean sidereal time corrected for
     * the equation of the equinoxes. Not reduced; callers only take sines and
     * cosines of angles derived from it.
     */
    public static double apparentSiderealTime(TimeScale ts, EclipticPosition ecliptic) {
        double gmst = GMST[0] + GMST[1] * ts.daysSinceJ2000()
                + GMST[2] * ts.centuries2() + GMST[3] * ts.centuries2() * ts.centuries();
        return gmst + ecliptic.nutationLongitude() * ecliptic.cosObliquity();
    }

    /** Local hour angle, south = 0, not reduced. */
    public static double localHourAngle(double agst, double longitude, double rightAscension) {
        return agst + longitude - rightAscension;
    }

    /**
     * Equatorial to horizontal coordinates.
     *
     * @param latitude    observer latitude (rad)
     * @param hourAngle   local hour angle (rad)
     * @param declination declination (rad)
     * @return azimuth in [0, 2pi) counted from south, and geometric altitude
     */
    public static HorizontalPosition equatorialToHorizontal(
            double latitude, double hourAngle, double declination) {
        double sinHa = Math.sin(hourAngle);
        double cosHa = Math.cos(hourAngle);

        double sinDec = Math.sin(declination);
        double cosDec = Math.sqrt(1.0 - sinDec * sinDec);
        double tanDec = sinDec / cosDec;

        double sinLat = Math.sin(latitude);
        double cosLat = Math.sqrt(1.0 - sinLat * sinLat);

        double azimuth = Conventions.reduceAngle(Math.atan2(sinHa, cosHa * sinLat - tanDec * cosLat));
        double altitude = Math.asin(sinLat * sinDec + cosLat * cosDec * cosHa);
        return new HorizontalPosition(azimuth, altitude);
    }

    /**
     * Horizontal to equatorial coordinates, the inverse of
     * {@link #equatorialToHorizontal}. The hour angle is reduced into
     * [0, 2pi) and counted from south.
     */
    public static HourAnglePosition horizontalToEquatorial(
            double latitude, double azimuth, double altitude) {
        double sinAz = Math.sin(azimuth);
        double cosAz = Math.cos(azimuth);

        double sinAlt = Math.sin(altitude);
        double cosAlt = Math.sqrt(1.0 - sinAlt * sinAlt);
        double tanAlt = sinAlt / cosAlt;

        double sinLat = Math.sin(latitude);
        double cosLat = Math.sqrt(1.0 - sinLat * sinLat);

        double hourAngle = Conventions.reduceAngle(Math.atan2(sinAz, cosAz * sinLat + tanAlt * cosLat));
        double declination = Math.asin(sinLat * sinAlt - cosLat * cosAlt * cosAz);
        return new HourAnglePosition(hourAngle, declination);
    }
}
