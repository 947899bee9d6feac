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
 * Geographic location of the observer plus the local atmosphere used to scale
 * the refraction correction.
 *
 * <p>Longitude is east-positive. Longitude and latitude are radians unless the
 * computation runs with {@link Option#USE_DEGREES}.</p>
 *
 * @param longitude    geographic longitude, east positive
 * @param latitude     geographic latitude, north positive
 * @param pressureKpa  air pressure at the observer (kPa)
 * @param temperatureK air temperature at the observer (K)
 */
public record Observer(double longitude, double latitude, double pressureKpa, double temperatureK) {
    /** Pressure the refraction coefficients are calibrated for (kPa). */
    public static final double STANDARD_PRESSURE_KPA = 101.0;

    /** Temperature the refraction coefficients are calibrated for (K). */
    public static final double STANDARD_TEMPERATURE_K = 283.0;

    /** Observer under the standard atmosphere. */
    public static Observer of(double longitude, double latitude) {
        return new Observer(longitude, latitude, STANDARD_PRESSURE_KPA, STANDARD_TEMPERATURE_K);
    }

    public Observer withAtmosphere(double pressureKpa, double temperatureK) {
        return new Observer(longitude, latitude, pressureKpa, temperatureK);
    }

    /** Same observer with longitude and latitude converted from degrees to radians. */
    Observer toRadians() {
        return new Observer(
                Math.toRadians(longitude), Math.toRadians(latitude), pressureKpa, temperatureK);
    }

    /**
     * Check the observer, with angles already in radians.
     *
     * @throws InvalidInputException if a value is outside its physical range
     */
    Observer validate() {
        if (!Double.isFinite(longitude)) {
            throw new InvalidInputException("Longitude must be finite, got " + longitude);
        }
        if (!(Math.abs(latitude) <= Math.PI / 2.0)) {
            throw new InvalidInputException(
                    "Latitude must be within [-90, 90] degrees, got "
                            + Math.toDegrees(latitude) + " degrees");
        }
        if (!(pressureKpa > 0.0) || Double.isInfinite(pressureKpa)) {
            throw new InvalidInputException("Pressure must be positive, got " + pressureKpa + " kPa");
        }
        if (!(temperatureK > 0.0) || Double.isInfinite(temperatureK)) {
            throw new InvalidInputException(
                    "Temperature must be positive, got " + temperatureK + " K");
        }
        return this;
    }
}
