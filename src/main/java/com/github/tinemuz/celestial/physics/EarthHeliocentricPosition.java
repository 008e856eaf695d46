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

import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.time.Epoch;

/**
 * Heliocentric ecliptic position of the Earth, referred to the mean equinox of date,
 * from the low precision solar theory (Meeus, Astronomical Algorithms, ch. 25).
 * Accuracy is about 0.01 degree in longitude, ample for the aberration and deflection
 * corrections and for center switching of ecliptic coordinates.
 */
public final class EarthHeliocentricPosition {

    private final double sunLongitude;
    private final double eccentricity;
    private final double perihelionLongitude;
    private final double radius;

    private EarthHeliocentricPosition(double sunLongitude, double eccentricity,
                                      double perihelionLongitude, double radius) {
        this.sunLongitude = sunLongitude;
        this.eccentricity = eccentricity;
        this.perihelionLongitude = perihelionLongitude;
        this.radius = radius;
    }

    public static EarthHeliocentricPosition at(Epoch epoch) {
        double t = epoch.centuriesSinceJ2000();
        double l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double m = Math.toRadians(357.52911 + 35999.05029 * t - 0.0001537 * t * t);
        double e = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;
        double c = (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(m)
                + (0.019993 - 0.000101 * t) * Math.sin(2 * m)
                + 0.000289 * Math.sin(3 * m);
        double trueAnomaly = m + Math.toRadians(c);
        double r = 1.000001018 * (1 - e * e) / (1 + e * Math.cos(trueAnomaly));
        double perihelion = 102.93735 + 1.71946 * t + 0.00046 * t * t;
        return new EarthHeliocentricPosition(
                Angles.normalizeRadians(Math.toRadians(l0 + c)), e,
                Angles.normalizeRadians(Math.toRadians(perihelion)), r);
    }

    /** Geometric longitude of the Sun seen from the Earth, radians. */
    public double sunLongitude() {
        return sunLongitude;
    }

    public double eccentricity() {
        return eccentricity;
    }

    /** Longitude of the perihelion of the Earth's orbit, radians. */
    public double perihelionLongitude() {
        return perihelionLongitude;
    }

    /** Sun-Earth distance in astronomical units. */
    public double radius() {
        return radius;
    }

    /** Earth position as a spherical value: latitude zero, longitude opposite to the Sun. */
    public SphericalPosition position() {
        return SphericalPosition.of(radius, Angles.HALF_PI, Angles.normalizeRadians(sunLongitude + Math.PI));
    }

    /** Unit vector from the Sun toward the Earth, ecliptic of date. */
    double[] unitVector() {
        double lon = sunLongitude + Math.PI;
        return new double[] {Math.cos(lon), Math.sin(lon), 0.0};
    }
}
