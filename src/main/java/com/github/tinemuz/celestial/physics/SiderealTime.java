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
package com.github.tinemuz.celestial.physics;

import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.time.Epoch;

/**
 * Local sidereal time for an observing time and an east-positive geographic longitude.
 *
 * <p>IAU 2006 and IAU 2000 build Greenwich mean sidereal time on the Earth rotation angle;
 * IAU 1976 uses the classic polynomial in UT. Apparent (true) sidereal time adds the
 * equation of the equinoxes, delta-psi times the cosine of the true obliquity.</p>
 */
public final class SiderealTime {

    public static final double SECONDS_PER_DAY = 86400.0;

    private final double meanSeconds;
    private final double trueSeconds;

    private SiderealTime(double meanSeconds, double trueSeconds) {
        this.meanSeconds = meanSeconds;
        this.trueSeconds = trueSeconds;
    }

    public static SiderealTime at(Epoch time, double geoLongitude,
                                  PrecessionModel precessionModel, NutationModel nutationModel) {
        RangeValidationException.requireClosed("geoLongitude", geoLongitude, -180.0, 180.0);
        double gmst = greenwichMeanRadians(time, precessionModel);
        double lonRad = Math.toRadians(geoLongitude);
        double mean = Angles.normalizeRadians(gmst + lonRad);

        Nutation nutation = Nutation.at(time, nutationModel);
        double epsilon = Angles.arcsecondsToRadians(Precession.meanObliquity(time, precessionModel))
                + Angles.milliarcsecondsToRadians(nutation.obliquity());
        double equationOfEquinoxes = Angles.milliarcsecondsToRadians(nutation.longitude()) * Math.cos(epsilon);
        double apparent = Angles.normalizeRadians(mean + equationOfEquinoxes);

        return new SiderealTime(mean / Angles.TIME_SECOND_TO_RAD, apparent / Angles.TIME_SECOND_TO_RAD);
    }

    /** Greenwich mean sidereal time in radians, in [0, 2π). */
    public static double greenwichMeanRadians(Epoch time, PrecessionModel model) {
        double du = time.julianDay() - Epoch.J2000_JULIAN_DAY;
        double t = time.centuriesSinceJ2000();
        switch (model) {
            case IAU1976: {
                double degrees = 280.46061837 + 360.98564736629 * du
                        + 0.000387933 * t * t - t * t * t / 38710000.0;
                return Angles.normalizeRadians(Math.toRadians(Angles.normalizeDegrees(degrees)));
            }
            case IAU2000:
                return Angles.normalizeRadians(earthRotationAngle(du) + Angles.arcsecondsToRadians(
                        Precession.poly(t, 0.014506, 4612.15739966, 1.39667721, -0.00009344, 0.00001882)));
            default:
                return Angles.normalizeRadians(earthRotationAngle(du) + Angles.arcsecondsToRadians(
                        Precession.poly(t, 0.014506, 4612.156534, 1.3915817, -0.00000044,
                                -0.000029956, -0.0000000368)));
        }
    }

    /** Earth rotation angle (IERS 2003) for {@code du} days since J2000. */
    static double earthRotationAngle(double du) {
        double fraction = du - Math.floor(du);
        double turns = fraction + 0.7790572732640 + 0.00273781191135448 * du;
        return Angles.normalizeRadians(Angles.TWO_PI * turns);
    }

    /** Local mean sidereal time in seconds of time, in [0, 86400). */
    public double meanSeconds() {
        return meanSeconds;
    }

    /** Local apparent sidereal time in seconds of time, in [0, 86400). */
    public double trueSeconds() {
        return trueSeconds;
    }

    public double trueHours() {
        return trueSeconds / 3600.0;
    }

    public double trueRadians() {
        return trueSeconds * Angles.TIME_SECOND_TO_RAD;
    }
}
