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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Position of the Sun as seen from a point on Earth.
 *
 * <p>A low-precision (arc-minute class) geocentric solar ephemeris intended for
 * applications such as solar-energy yield estimates, where speed matters more
 * than the last arcsecond. The single entry point {@link #compute} runs five
 * stateless stages in a fixed order:</p>
 *
 * <ol>
 *   <li>civil time to Julian Day and centuries since J2000.0 ({@link TimeScale});</li>
 *   <li>apparent ecliptic longitude, distance and obliquity ({@link EclipticSolver});</li>
 *   <li>ecliptic to equatorial to horizontal coordinates ({@link CoordinateTransforms});</li>
 *   <li>parallax and refraction in altitude ({@link AtmosphericCorrection});</li>
 *   <li>azimuth zero point and degree conversion ({@link Conventions}).</li>
 * </ol>
 *
 * <p>Every call is a pure function of its arguments, so concurrent calls from
 * any number of threads are safe.</p>
 */
public final class SolTrack {
    private static final Logger log = LoggerFactory.getLogger(SolTrack.class);
    private static volatile boolean warnedNonFinite = false;

    private SolTrack() {}

    /**
     * Compute the position of the Sun with the options from
     * <code>soltrack.properties</code>.
     *
     * @see #compute(CivilTime, Observer, Options)
     */
    public static SolarPosition compute(CivilTime time, Observer observer) {
        return compute(time, observer, Options.defaults());
    }

    /**
     * Compute the position of the Sun.
     *
     * @param time     date and time in UT
     * @param observer geographic location, in degrees with {@link Option#USE_DEGREES}
     *                 and radians otherwise
     * @param options  output switches
     * @return the position; check {@link SolarPosition#warnings} for numerically
     *         questionable results
     * @throws InvalidInputException if the date, time or observer is out of range
     */
    public static SolarPosition compute(CivilTime time, Observer observer, Options options) {
        if (time == null || observer == null || options == null) {
            throw new InvalidInputException("time, observer and options are required");
        }
        time.validate();
        Observer obs = options.contains(Option.USE_DEGREES) ? observer.toRadians() : observer;
        obs.validate();
        return computeAt(TimeScale.of(time), obs, options);
    }

    /**
     * Julian Day of a Gregorian date and UT time, with the same validation as
     * {@link #compute}.
     *
     * @throws InvalidInputException if any field is out of range
     */
    public static double computeJulianDay(int year, int month, int day, int hour, int minute, double second) {
        CivilTime.of(year, month, day, hour, minute, second).validate();
        return TimeScale.julianDay(year, month, day, hour, minute, second);
    }

    /**
     * Run the pipeline for a time scale and an observer already validated and
     * in radians.
     */
    static SolarPosition computeAt(TimeScale ts, Observer observer, Options options) {
        Objects.requireNonNull(ts, "ts");
        Set<DomainWarning> warnings = EnumSet.noneOf(DomainWarning.class);
        if (Math.abs(Math.abs(observer.latitude()) - Math.PI / 2.0) < 1e-12) {
            warnings.add(DomainWarning.POLAR_DEGENERACY);
        }

        // Ecliptic position, then geocentric equatorial coordinates
        EclipticPosition ecliptic = EclipticSolver.solve(ts);
        EquatorialPosition equatorial =
                CoordinateTransforms.eclipticToEquatorial(ecliptic.longitude(), ecliptic.obliquity());

        // Horizontal coordinates; azimuth needs no parallax or refraction correction
        double agst = CoordinateTransforms.apparentSiderealTime(ts, ecliptic);
        double hourAngle = CoordinateTransforms.localHourAngle(
                agst, observer.longitude(), equatorial.rightAscension());
        HorizontalPosition horizontal = CoordinateTransforms.equatorialToHorizontal(
                observer.latitude(), hourAngle, equatorial.declination());

        AtmosphericCorrection.Result corrected = AtmosphericCorrection.correct(
                horizontal.altitude(), ecliptic.distanceAu(), observer);
        warnings.addAll(corrected.warnings());

        double azimuth = horizontal.azimuth();
        double altitudeRefract = corrected.altitudeRefract();
        HourAnglePosition refractedEquatorial = null;
        if (options.contains(Option.COMPUTE_REFR_EQUATORIAL)) {
            refractedEquatorial = CoordinateTransforms.horizontalToEquatorial(
                    observer.latitude(), azimuth, altitudeRefract);
        }

        if (options.contains(Option.USE_NORTH_EQUALS_ZERO)) {
            azimuth = Conventions.northEqualsZero(azimuth);
            if (refractedEquatorial != null) {
                refractedEquatorial = new HourAnglePosition(
                        Conventions.northEqualsZero(refractedEquatorial.hourAngle()),
                        refractedEquatorial.declination());
            }
        }

        if (options.contains(Option.USE_DEGREES)) {
            azimuth = Conventions.toDegreesReduced(azimuth);
            altitudeRefract = Math.toDegrees(altitudeRefract);
            if (refractedEquatorial != null) {
                refractedEquatorial = new HourAnglePosition(
                        Conventions.toDegreesReduced(refractedEquatorial.hourAngle()),
                        Math.toDegrees(refractedEquatorial.declination()));
            }
        }

        if (!allFinite(ecliptic, equatorial, horizontal, corrected, azimuth, altitudeRefract, refractedEquatorial)) {
            warnings.add(DomainWarning.NON_FINITE_RESULT);
            warnNonFinite(ts);
        }

        return new SolarPosition(
                ts,
                ecliptic,
                options.contains(Option.COMPUTE_DISTANCE),
                equatorial,
                agst,
                horizontal.altitude(),
                corrected,
                azimuth,
                altitudeRefract,
                refractedEquatorial,
                warnings);
    }

    private static boolean allFinite(
            EclipticPosition ecliptic,
            EquatorialPosition equatorial,
            HorizontalPosition horizontal,
            AtmosphericCorrection.Result corrected,
            double azimuth,
            double altitudeRefract,
            HourAnglePosition refractedEquatorial) {
        boolean finite = Double.isFinite(ecliptic.longitude())
                && Double.isFinite(ecliptic.distanceAu())
                && Double.isFinite(equatorial.rightAscension())
                && Double.isFinite(equatorial.declination())
                && Double.isFinite(horizontal.altitude())
                && Double.isFinite(corrected.altitude())
                && Double.isFinite(azimuth)
                && Double.isFinite(altitudeRefract);
        if (refractedEquatorial != null) {
            finite = finite
                    && Double.isFinite(refractedEquatorial.hourAngle())
                    && Double.isFinite(refractedEquatorial.declination());
        }
        return finite;
    }

    private static void warnNonFinite(TimeScale ts) {
        if (!warnedNonFinite) {
            synchronized (SolTrack.class) {
                if (!warnedNonFinite) {
                    warnedNonFinite = true;
                    log.warn("Non-finite solar position at JD {}; check the result's warnings",
                            String.format("%.6f", ts.julianDay()));
                    return;
                }
            }
        }
        log.debug("Non-finite solar position at JD {}", ts.julianDay());
    }
}
