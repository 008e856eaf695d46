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
 * Annual aberration from the Earth's orbital velocity, including the elliptic term
 * (Meeus, Astronomical Algorithms, ch. 23).
 */
public final class AnnualAberration {

    /** Constant of aberration, arcseconds. */
    public static final double KAPPA = 20.49552;

    private AnnualAberration() {}

    /** Correction for a mean ecliptic position of date. */
    public static AngularCorrection ecliptic(SphericalPosition position, Epoch epoch) {
        return AngularCorrection.displacement(position, velocityTerm(epoch));
    }

    /** Correction for an equatorial position; {@code obliquity} in radians. */
    public static AngularCorrection equinoctial(SphericalPosition position, Epoch epoch, double obliquity) {
        return AngularCorrection.displacement(position,
                EclipticGeometry.toEquatorial(velocityTerm(epoch), obliquity));
    }

    // Earth velocity over c, ecliptic axes
    private static double[] velocityTerm(Epoch epoch) {
        EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(epoch);
        double kappa = Angles.arcsecondsToRadians(KAPPA);
        double sun = earth.sunLongitude();
        double e = earth.eccentricity();
        double pi = earth.perihelionLongitude();
        return new double[] {
            kappa * (Math.sin(sun) - e * Math.sin(pi)),
            kappa * (-Math.cos(sun) + e * Math.cos(pi)),
            0.0
        };
    }
}
