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

import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.time.Epoch;

/**
 * Relativistic deflection of light by the Sun.
 *
 * <p>Directions within a hair of the anti-solar point are left alone, where the
 * deflection vanishes anyway and the formula is singular.</p>
 */
public final class GravitationalDeflection {

    /** 2GM/c^2 of the Sun, in astronomical units. */
    public static final double SCHWARZSCHILD_RADIUS_AU = 1.97412574336e-8;

    private static final double SINGULARITY_GUARD = 1e-9;

    private GravitationalDeflection() {}

    public static AngularCorrection ecliptic(SphericalPosition position, Epoch epoch) {
        EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(epoch);
        return deflect(position, earth.unitVector(), earth.radius());
    }

    public static AngularCorrection equinoctial(SphericalPosition position, Epoch epoch, double obliquity) {
        EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(epoch);
        return deflect(position, EclipticGeometry.toEquatorial(earth.unitVector(), obliquity), earth.radius());
    }

    private static AngularCorrection deflect(SphericalPosition position, double[] sunToEarth, double distance) {
        double[] p = position.toUnitVector();
        double pe = AngularCorrection.dot(p, sunToEarth);
        double denominator = 1.0 + pe;
        if (denominator < SINGULARITY_GUARD) {
            return AngularCorrection.NONE;
        }
        double f = SCHWARZSCHILD_RADIUS_AU / distance / denominator;
        return AngularCorrection.displacement(position, new double[] {
            f * (sunToEarth[0] - pe * p[0]),
            f * (sunToEarth[1] - pe * p[1]),
            f * (sunToEarth[2] - pe * p[2])
        });
    }
}
