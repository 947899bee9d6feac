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

import java.util.Optional;

/**
 * Rise, transit and set of the Sun on one UT date.
 *
 * <p>An event is absent when it does not happen on that date (polar day or
 * night, or a rise before 00:00 UT) or when its iteration did not
 * converge.</p>
 *
 * @param visibility whether the Sun crosses the rise/set altitude at all that day
 * @param rise       rise time and azimuth
 * @param transit    transit time and altitude
 * @param set        set time and azimuth
 */
public record RiseSet(Visibility visibility, Optional<Event> rise, Optional<Event> transit, Optional<Event> set) {

    /** Crossing behaviour with respect to the rise/set altitude. */
    public enum Visibility {
        RISES_AND_SETS,
        /** Above the rise/set altitude all day. */
        NEVER_SETS,
        /** Below the rise/set altitude all day. */
        NEVER_RISES
    }

    /**
     * One event.
     *
     * @param timeHours hours UT after 00:00 of the date
     * @param angle     azimuth for rise and set, altitude for transit
     */
    public record Event(double timeHours, double angle) {}
}
