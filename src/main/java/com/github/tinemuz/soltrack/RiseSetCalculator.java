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

import static com.github.tinemuz.soltrack.SolarConstants.RAD_TO_HOURS;
import static com.github.tinemuz.soltrack.SolarConstants.TWO_PI;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rise, transit and set times of the Sun, refined iteratively with the
 * position pipeline of {@link SolTrack}.
 */
public final class RiseSetCalculator {
    private static final Logger log = LoggerFactory.getLogger(RiseSetCalculator.class);

    /** Standard rise/set altitude of the Sun's centre: refraction plus semi-diameter (rad). */
    public static final double STANDARD_ALTITUDE = Math.toRadians(-0.8333);

    /** Sidereal days per solar day around J2000. */
    private static final double SIDEREAL_RATE = 1.002737909350795;

    /** Convergence limit of the event time (rad of hour angle, about 0.14 s). */
    private static final double ACCURACY = 1.0e-5;
    private static final int MAX_ITERATIONS = 30;

    private static final Options PIPELINE_OPTIONS = Options.none();

    private static final int TRANSIT = 0;
    private static final int RISE = 1;
    private static final int SET = 2;
    private static final String[] EVENT_NAMES = {"transit", "rise", "set"};

    private RiseSetCalculator() {}

    /** Actual sunrise and sunset (standard altitude). */
    public static RiseSet compute(CivilTime date, Observer observer, Options options) {
        return compute(date, observer, 0.0, options);
    }

    /**
     * Rise, transit and set of the Sun on the UT date of {@code date}; its
     * time of day is ignored.
     *
     * @param date            date (UT)
     * @param observer        observer, degrees with {@link Option#USE_DEGREES}
     * @param riseSetAltitude altitude the rise and set times refer to; zero
     *                        selects {@link #STANDARD_ALTITUDE}. Same angular
     *                        unit as the observer.
     * @param options         {@link Option#USE_DEGREES} and
     *                        {@link Option#USE_NORTH_EQUALS_ZERO} apply to the
     *                        returned angles
     * @throws InvalidInputException if the date or observer is out of range
     */
    public static RiseSet compute(CivilTime date, Observer observer, double riseSetAltitude, Options options) {
        if (date == null || observer == null || options == null) {
            throw new InvalidInputException("date, observer and options are required");
        }
        boolean degrees = options.contains(Option.USE_DEGREES);
        CivilTime midnight = date.atMidnight().validate();
        Observer obs = (degrees ? observer.toRadians() : observer).validate();
        double requested = degrees ? Math.toRadians(riseSetAltitude) : riseSetAltitude;
        if (!Double.isFinite(requested)) {
            throw new InvalidInputException("Rise/set altitude must be finite, got " + riseSetAltitude);
        }
        boolean standard = Math.abs(requested) <= 1.0e-9;
        double rsAlt = standard ? STANDARD_ALTITUDE : requested;

        double lat = obs.latitude();
        double lon = obs.longitude();
        double jd0 = TimeScale.of(midnight).julianDay();

        SolarPosition pos = SolTrack.computeAt(TimeScale.ofJulianDay(jd0), obs, PIPELINE_OPTIONS);
        double agst0 = pos.apparentSiderealTime;

        RiseSet.Visibility visibility = RiseSet.Visibility.RISES_AND_SETS;
        double cosH0 = (Math.sin(rsAlt) - Math.sin(lat) * Math.sin(pos.declination))
                / (Math.cos(lat) * Math.cos(pos.declination));
        double h0 = 0.0;
        if (cosH0 > 1.0) {
            visibility = RiseSet.Visibility.NEVER_RISES;
        } else if (cosH0 < -1.0) {
            visibility = RiseSet.Visibility.NEVER_SETS;
        } else {
            h0 = Math.acos(cosH0);
        }
        int events = visibility == RiseSet.Visibility.RISES_AND_SETS ? 3 : 1;

        // Event times as hour angles of the mean Sun after 00:00 UT (rad)
        double[] tm = new double[3];
        tm[TRANSIT] = Conventions.reduceAngle(pos.rightAscension - lon - agst0);
        tm[RISE] = Conventions.reduceAngle(tm[TRANSIT] - h0);
        tm[SET] = Conventions.reduceAngle(tm[TRANSIT] + h0);

        RiseSet.Event[] found = new RiseSet.Event[3];
        for (int ev = 0; ev < events; ev++) {
            double t = tm[ev];
            double ha = 0.0;
            double alt = 0.0;
            double dec = 0.0;
            double dt = Double.POSITIVE_INFINITY;
            int iter = 0;
            while (Math.abs(dt) > ACCURACY) {
                double th0 = agst0 + SIDEREAL_RATE * t;
                SolarPosition p = SolTrack.computeAt(TimeScale.ofJulianDay(jd0 + t / TWO_PI), obs, PIPELINE_OPTIONS);
                dec = p.declination;
                ha = Conventions.reduceAngleSigned(th0 + lon - p.rightAscension);
                alt = Math.asin(Math.sin(lat) * Math.sin(dec) + Math.cos(lat) * Math.cos(dec) * Math.cos(ha));

                if (ev == TRANSIT) {
                    dt = -ha;
                } else {
                    dt = (alt - rsAlt) / (Math.cos(dec) * Math.cos(lat) * Math.sin(ha));
                }
                t += dt;

                iter++;
                if (iter > MAX_ITERATIONS) break;
            }

            if (iter > MAX_ITERATIONS || !Double.isFinite(t)) {
                log.warn("Sun {} did not converge after {} iterations on {}-{}-{} (rise/set altitude {} deg)",
                        EVENT_NAMES[ev], MAX_ITERATIONS, date.year(), date.month(), date.day(),
                        String.format("%.4f", Math.toDegrees(rsAlt)));
                continue;
            }
            if (t < 0.0 && standard) {
                log.debug("Sun {} falls before 00:00 UT on {}-{}-{}", EVENT_NAMES[ev],
                        date.year(), date.month(), date.day());
                continue;
            }

            double angle;
            if (ev == TRANSIT) {
                angle = alt;
            } else {
                angle = Conventions.reduceAngle(Math.atan2(Math.sin(ha),
                        Math.cos(ha) * Math.sin(lat) - Math.tan(dec) * Math.cos(lat)));
                if (options.contains(Option.USE_NORTH_EQUALS_ZERO)) {
                    angle = Conventions.northEqualsZero(angle);
                }
            }
            if (degrees) angle = Math.toDegrees(angle);
            found[ev] = new RiseSet.Event(t * RAD_TO_HOURS, angle);
        }

        return new RiseSet(
                visibility,
                Optional.ofNullable(found[RISE]),
                Optional.ofNullable(found[TRANSIT]),
                Optional.ofNullable(found[SET]));
    }
}
