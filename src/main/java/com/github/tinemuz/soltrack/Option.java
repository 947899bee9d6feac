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

/** Independently toggleable switches of a solar position computation. */
public enum Option {
    /** Observer angles are given, and final angles returned, in degrees. */
    USE_DEGREES("soltrack.useDegrees"),

    /** Azimuth and hour angle count from north instead of south. */
    USE_NORTH_EQUALS_ZERO("soltrack.useNorthEqualsZero"),

    /** Convert the refraction-corrected position back to hour angle and declination. */
    COMPUTE_REFR_EQUATORIAL("soltrack.computeRefrEquatorial"),

    /** Report the geocentric distance of the Sun. */
    COMPUTE_DISTANCE("soltrack.computeDistance");

    private final String propertyKey;

    Option(String propertyKey) {
        this.propertyKey = propertyKey;
    }

    /** Key of this option in {@code soltrack.properties}. */
    public String propertyKey() {
        return propertyKey;
    }
}
