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

import java.time.LocalDateTime;
import java.time.Year;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.YearMonth;

/**
 * Civil date and time in Universal Time, Gregorian calendar.
 *
 * <p>No time-zone offset is applied by the solar computation; use
 * {@link #from(ZonedDateTime)} to convert a zoned value to UT first.</p>
 *
 * @param year   calendar year, 1582 to {@link Year#MAX_VALUE}
 * @param month  month of year, 1-12
 * @param day    day of month
 * @param hour   hour of day, 0-23
 * @param minute minute of hour, 0-59
 * @param second second of minute, fractions allowed, [0, 60)
 */
public record CivilTime(int year, int month, int day, int hour, int minute, double second) {

    public static CivilTime of(int year, int month, int day, int hour, int minute, double second) {
        return new CivilTime(year, month, day, hour, minute, second);
    }

    /** Convert a zoned date-time to UT. */
    public static CivilTime from(ZonedDateTime dateTime) {
        return from(dateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }

    /** Interpret a local date-time as UT. */
    public static CivilTime from(LocalDateTime utc) {
        return new CivilTime(
                utc.getYear(),
                utc.getMonthValue(),
                utc.getDayOfMonth(),
                utc.getHour(),
                utc.getMinute(),
                utc.getSecond() + utc.getNano() / 1.0e9);
    }

    /** Midnight UT at the start of this date. */
    public CivilTime atMidnight() {
        return new CivilTime(year, month, day, 0, 0, 0.0);
    }

    /**
     * Check every field against the Gregorian calendar.
     *
     * @return this instance, for chaining
     * @throws InvalidInputException if any field is out of range
     */
    public CivilTime validate() {
        if (year < SolarConstants.FIRST_GREGORIAN_YEAR) {
            throw new InvalidInputException(
                    "Year " + year + " predates the Gregorian calendar ("
                            + SolarConstants.FIRST_GREGORIAN_YEAR + ")");
        }
        if (year > Year.MAX_VALUE) {
            throw new InvalidInputException(
                    "Year " + year + " is beyond the supported calendar (" + Year.MAX_VALUE + ")");
        }
        if (month < 1 || month > 12) {
            throw new InvalidInputException("Month must be in 1..12, got " + month);
        }
        int daysInMonth = YearMonth.of(year, month).lengthOfMonth();
        if (day < 1 || day > daysInMonth) {
            throw new InvalidInputException(
                    "Day must be in 1.." + daysInMonth + " for " + year + "-" + month + ", got " + day);
        }
        if (hour < 0 || hour >= 24) {
            throw new InvalidInputException("Hour must be in 0..23, got " + hour);
        }
        if (minute < 0 || minute >= 60) {
            throw new InvalidInputException("Minute must be in 0..59, got " + minute);
        }
        if (!Double.isFinite(second) || second < 0.0 || second >= 60.0) {
            throw new InvalidInputException("Second must be in [0, 60), got " + second);
        }
        return this;
    }
}
