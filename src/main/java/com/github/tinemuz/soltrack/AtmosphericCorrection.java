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

import static com.github.tinemuz.soltrack.SolarConstants.AU_CM;
import static com.github.tinemuz.soltrack.SolarConstants.EARTH_RADIUS_CM;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diurnal parallax and empirical atmospheric refraction, applied to the
 * altitude only. Azimuth is unaffected by either.
 */
public final class AtmosphericCorrection {
    private static final Logger log = LoggerFactory.getLogger(AtmosphericCorrection.class);

    // Refraction R = A / tan(h + B / (h + C)), h and R in radians
    private static final double REFRACTION_A = 2.9670597e-4;
    private static final double REFRACTION_B = 3.137559e-3;
    private static final double REFRACTION_C = 8.91863e-2;

    /** Altitude where the inner term of the refraction formula diverges (rad). */
    static final double REFRACTION_POLE = -REFRACTION_C;

    private static volatile boolean warnedBelowValidRange = false;
    private static volatile boolean warnedSingular = false;

    private AtmosphericCorrection() {}

    /**
     * Parallax in altitude for a body at the given distance.
     *
     * @param altitude   geometric altitude (rad)
     * @param distanceAu geocentric distance (AU)
     * @return the amount (rad) to subtract from the altitude
     */
    public static double parallax(double altitude, double distanceAu) {
        return Math.asin(EARTH_RADIUS_CM / (distanceAu * AU_CM)) * Math.cos(altitude);
    }

    /**
     * Refraction correction to add to an airless altitude, scaled to the
     * local pressure and temperature. The scale factor is exactly one for
     * the standard atmosphere of 101 kPa and 283 K.
     *
     * @param altitude     parallax-corrected altitude (rad)
     * @param pressureKpa  air pressure (kPa)
     * @param temperatureK air temperature (K)
     */
    public static double refraction(double altitude, double pressureKpa, double temperatureK) {
        double r = REFRACTION_A / Math.tan(tangentArgument(altitude));
        if (pressureKpa != Observer.STANDARD_PRESSURE_KPA
                || temperatureK != Observer.STANDARD_TEMPERATURE_K) {
            r *= pressureKpa / Observer.STANDARD_PRESSURE_KPA
                    * Observer.STANDARD_TEMPERATURE_K / temperatureK;
        }
        return r;
    }

    private static double tangentArgument(double altitude) {
        return altitude + REFRACTION_B / (altitude + REFRACTION_C);
    }

    /**
     * Whether the tangent in the refraction formula has left its principal
     * branch below the horizon. Near the pole the argument runs off to
     * infinity, and the formula returns corrections of tens of degrees with
     * either sign.
     */
    static boolean outsidePrincipalBranch(double altitude) {
        return altitude < 0.0 && !(Math.abs(tangentArgument(altitude)) < Math.PI / 2.0);
    }

    /**
     * Apply parallax, then refraction, to a geometric altitude.
     *
     * <p>Below the formula's pole, or wherever its tangent has left the
     * principal branch, the altitude is flagged
     * {@link DomainWarning#REFRACTION_BELOW_VALID_RANGE}. A correction off the
     * principal branch, not finite, or moving the altitude outside
     * [-pi/2, pi/2] is dropped and flagged
     * {@link DomainWarning#REFRACTION_SINGULAR}.</p>
     */
    public static Result correct(double geometricAltitude, double distanceAu, Observer observer) {
        double altitude = geometricAltitude - parallax(geometricAltitude, distanceAu);
        Set<DomainWarning> warnings = EnumSet.noneOf(DomainWarning.class);
        boolean offBranch = outsidePrincipalBranch(altitude);

        if (altitude <= REFRACTION_POLE || offBranch) {
            warnings.add(DomainWarning.REFRACTION_BELOW_VALID_RANGE);
            if (!warnedBelowValidRange) {
                synchronized (AtmosphericCorrection.class) {
                    if (!warnedBelowValidRange) {
                        warnedBelowValidRange = true;
                        log.warn(
                                "Altitude {} deg is below the refraction formula's valid range "
                                        + "({} deg); refracted altitudes this low are not meaningful",
                                String.format("%.3f", Math.toDegrees(altitude)),
                                String.format("%.3f", Math.toDegrees(REFRACTION_POLE)));
                    }
                }
            }
        }

        double refracted = altitude
                + refraction(altitude, observer.pressureKpa(), observer.temperatureK());
        if (offBranch || !Double.isFinite(refracted) || Math.abs(refracted) > Math.PI / 2.0) {
            warnings.add(DomainWarning.REFRACTION_SINGULAR);
            if (!warnedSingular) {
                synchronized (AtmosphericCorrection.class) {
                    if (!warnedSingular) {
                        warnedSingular = true;
                        log.warn(
                                "Refraction correction is singular at altitude {} deg; "
                                        + "reporting the parallax-corrected altitude",
                                String.format("%.6f", Math.toDegrees(altitude)));
                    }
                }
            }
            log.debug("Refraction singular at altitude {} rad", altitude);
            refracted = altitude;
        }
        return new Result(altitude, refracted, warnings);
    }

    /**
     * Corrected altitudes of one evaluation.
     *
     * @param altitude        altitude corrected for parallax only (rad)
     * @param altitudeRefract altitude corrected for parallax and refraction (rad)
     * @param warnings        domain warnings raised by the corrections
     */
    public record Result(double altitude, double altitudeRefract, Set<DomainWarning> warnings) {
        public Result {
            warnings = warnings.isEmpty()
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
        }
    }
}
