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

import java.util.Collections;
import java.util.EnumSet;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable result of {@link SolTrack#compute}.
 *
 * <p>Intermediate quantities are always in radians. Only the four final
 * fields {@link #azimuthRefract}, {@link #altitudeRefract},
 * {@link #hourAngleRefract} and {@link #declinationRefract} follow the
 * {@link Option#USE_DEGREES} and {@link Option#USE_NORTH_EQUALS_ZERO}
 * switches.</p>
 */
public final class SolarPosition {
    /** Julian Day (UT). */
    public final double julianDay;

    /** Days since J2000.0. */
    public final double daysSinceJ2000;

    /** Julian centuries since J2000.0 (T). */
    public final double centuries;

    /** T^2. */
    public final double centuries2;

    /** T^3. */
    public final double centuries3;

    /** Apparent geocentric ecliptic longitude, true equinox of date (rad, [0, 2pi)). */
    public final double longitude;

    /** Geocentric distance (AU), present with {@link Option#COMPUTE_DISTANCE}. */
    public final OptionalDouble distanceAu;

    /** True obliquity of the ecliptic (rad). */
    public final double obliquity;

    /** Nutation in longitude (rad). */
    public final double nutationLongitude;

    /** Right ascension (rad, [0, 2pi)). */
    public final double rightAscension;

    /** Declination, without refraction (rad). */
    public final double declination;

    /** Apparent Greenwich sidereal time (rad, not reduced). */
    public final double apparentSiderealTime;

    /** Geometric altitude, before parallax and refraction (rad). */
    public final double altitudeUncorrected;

    /** Altitude corrected for parallax only (rad). */
    public final double altitude;

    /** Altitude corrected for parallax and refraction (rad, or degrees with {@link Option#USE_DEGREES}). */
    public final double altitudeRefract;

    /** Azimuth, [0, 2pi) or [0, 360). Neither parallax nor refraction change it. */
    public final double azimuthRefract;

    /** Refraction-corrected hour angle, present with {@link Option#COMPUTE_REFR_EQUATORIAL}. */
    public final OptionalDouble hourAngleRefract;

    /** Refraction-corrected declination, present with {@link Option#COMPUTE_REFR_EQUATORIAL}. */
    public final OptionalDouble declinationRefract;

    /** Domain warnings raised while computing this position; usually empty. */
    public final Set<DomainWarning> warnings;

    SolarPosition(
            TimeScale time,
            EclipticPosition ecliptic,
            boolean reportDistance,
            EquatorialPosition equatorial,
            double apparentSiderealTime,
            double altitudeUncorrected,
            AtmosphericCorrection.Result corrected,
            double azimuthRefract,
            double altitudeRefract,
            HourAnglePosition refractedEquatorial,
            Set<DomainWarning> warnings) {
        this.julianDay = time.julianDay();
        this.daysSinceJ2000 = time.daysSinceJ2000();
        this.centuries = time.centuries();
        this.centuries2 = time.centuries2();
        this.centuries3 = time.centuries3();
        this.longitude = ecliptic.longitude();
        this.distanceAu = reportDistance ? OptionalDouble.of(ecliptic.distanceAu()) : OptionalDouble.empty();
        this.obliquity = ecliptic.obliquity();
        this.nutationLongitude = ecliptic.nutationLongitude();
        this.rightAscension = Conventions.reduceAngle(equatorial.rightAscension());
        this.declination = equatorial.declination();
        this.apparentSiderealTime = apparentSiderealTime;
        this.altitudeUncorrected = altitudeUncorrected;
        this.altitude = corrected.altitude();
        this.altitudeRefract = altitudeRefract;
        this.azimuthRefract = azimuthRefract;
        if (refractedEquatorial != null) {
            this.hourAngleRefract = OptionalDouble.of(refractedEquatorial.hourAngle());
            this.declinationRefract = OptionalDouble.of(refractedEquatorial.declination());
        } else {
            this.hourAngleRefract = OptionalDouble.empty();
            this.declinationRefract = OptionalDouble.empty();
        }
        this.warnings = warnings.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
    }

    /** Shorthand for {@code warnings.isEmpty()}. */
    public boolean isClean() {
        return warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "SolarPosition{jd=" + julianDay
                + ", azimuth=" + azimuthRefract
                + ", altitude=" + altitudeRefract
                + (hourAngleRefract.isPresent()
                        ? ", hourAngle=" + hourAngleRefract.getAsDouble()
                                + ", declination=" + declinationRefract.getAsDouble()
                        : "")
                + (warnings.isEmpty() ? "" : ", warnings=" + warnings)
                + "}";
    }
}
