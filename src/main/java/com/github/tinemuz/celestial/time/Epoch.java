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
package com.github.tinemuz.celestial.time;

import com.github.tinemuz.celestial.error.MissingRequiredFieldException;
import com.github.tinemuz.celestial.error.RangeValidationException;

import java.time.Instant;

/**
 * An instant on a single continuous time scale, held as a Julian day.
 *
 * <p>Epochs identify both the observing time and the equinox of reference. No distinction
 * is made between TT, UT1 and UTC.</p>
 */
public final class Epoch implements Comparable<Epoch> {

    public static final double J2000_JULIAN_DAY = 2451545.0;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    private static final double UNIX_EPOCH_JULIAN_DAY = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final double DAYS_PER_JULIAN_YEAR = 365.25;
    private static final double B1900_JULIAN_DAY = 2415020.31352;
    private static final double DAYS_PER_TROPICAL_YEAR = 365.242198781;

    private static final Epoch J2000 = new Epoch(J2000_JULIAN_DAY);

    private final double julianDay;

    private Epoch(double julianDay) {
        this.julianDay = julianDay;
    }

    public static Epoch j2000() {
        return J2000;
    }

    public static Epoch ofJulianDay(double julianDay) {
        RangeValidationException.requireFinite("julianDay", julianDay);
        return new Epoch(julianDay);
    }

    /** Julian epoch such as J2000.0 or J2050.5. */
    public static Epoch julianEpoch(double year) {
        RangeValidationException.requireFinite("year", year);
        return new Epoch(J2000_JULIAN_DAY + (year - 2000.0) * DAYS_PER_JULIAN_YEAR);
    }

    /** Besselian epoch such as B1950.0. */
    public static Epoch besselianEpoch(double year) {
        RangeValidationException.requireFinite("year", year);
        return new Epoch(B1900_JULIAN_DAY + (year - 1900.0) * DAYS_PER_TROPICAL_YEAR);
    }

    public static Epoch of(Instant instant) {
        MissingRequiredFieldException.require("instant", instant);
        return new Epoch(instant.toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_JULIAN_DAY);
    }

    public double julianDay() {
        return julianDay;
    }

    /** Julian centuries elapsed since J2000.0, the argument of every polynomial model. */
    public double centuriesSinceJ2000() {
        return (julianDay - J2000_JULIAN_DAY) / DAYS_PER_JULIAN_CENTURY;
    }

    public boolean isJ2000() {
        return julianDay == J2000_JULIAN_DAY;
    }

    public Instant toInstant() {
        return Instant.ofEpochMilli(Math.round((julianDay - UNIX_EPOCH_JULIAN_DAY) * MILLIS_PER_DAY));
    }

    public double julianEpochYear() {
        return 2000.0 + (julianDay - J2000_JULIAN_DAY) / DAYS_PER_JULIAN_YEAR;
    }

    public double besselianEpochYear() {
        return 1900.0 + (julianDay - B1900_JULIAN_DAY) / DAYS_PER_TROPICAL_YEAR;
    }

    @Override
    public int compareTo(Epoch other) {
        return Double.compare(julianDay, other.julianDay);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Epoch)) return false;
        return Double.compare(julianDay, ((Epoch) o).julianDay) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(julianDay);
    }

    @Override
    public String toString() {
        return "Epoch[JD " + julianDay + "]";
    }
}
