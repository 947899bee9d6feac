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
 * Conditions under which a computed position is numerically questionable.
 * Reported in {@link SolarPosition#warnings} instead of throwing.
 */
public enum DomainWarning {
    /**
     * Altitude is below the pole of the empirical refraction formula
     * (about -5.1 degrees), or in the band just above it (up to about
     * -5.0 degrees) where the formula's tangent leaves its principal branch.
     * Refracted altitudes this low have no physical meaning.
     */
    REFRACTION_BELOW_VALID_RANGE,

    /**
     * Refraction correction was off the formula's principal branch,
     * non-finite, or pushed the altitude outside [-90, 90] degrees; the
     * parallax-corrected altitude is reported instead.
     */
    REFRACTION_SINGULAR,

    /** Observer stands on a geographic pole, where azimuth has no zero point. */
    POLAR_DEGENERACY,

    /** At least one output field is NaN or infinite. */
    NON_FINITE_RESULT
}
