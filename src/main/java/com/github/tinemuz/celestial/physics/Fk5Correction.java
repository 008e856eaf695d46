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
 * Conversion of dynamical ecliptic coordinates to the FK5 system (Meeus, eq. 32.3).
 */
public final class Fk5Correction {

    private static final double LONGITUDE_OFFSET = -0.09033;
    private static final double AMPLITUDE = 0.03916;

    private Fk5Correction() {}

    public static AngularCorrection ecliptic(SphericalPosition position, Epoch epoch) {
        return AngularCorrection.displacement(position, displacement(position.toUnitVector(), epoch));
    }

    public static AngularCorrection equinoctial(SphericalPosition position, Epoch epoch, double obliquity) {
        double[] ecl = EclipticGeometry.toEcliptic(position.toUnitVector(), obliquity);
        return AngularCorrection.displacement(position,
                EclipticGeometry.toEquatorial(displacement(ecl, epoch), obliquity));
    }

    private static double[] displacement(double[] u, Epoch epoch) {
        double t = epoch.centuriesSinceJ2000();
        double lambda = Math.atan2(u[1], u[0]);
        double beta = Math.asin(Math.max(-1.0, Math.min(1.0, u[2])));
        double lp = lambda - Math.toRadians(1.397 * t + 0.00031 * t * t);
        double cl = Math.cos(lp);
        double sl = Math.sin(lp);
        // d-lambda times cos(beta), which stays finite at the ecliptic poles
        double east = Angles.arcsecondsToRadians(
                LONGITUDE_OFFSET * Math.cos(beta) + AMPLITUDE * (cl + sl) * Math.sin(beta));
        double north = Angles.arcsecondsToRadians(AMPLITUDE * (cl - sl));
        double[] e = EclipticGeometry.eastward(lambda);
        double[] n = EclipticGeometry.northward(lambda, beta);
        return new double[] {
            east * e[0] + north * n[0],
            east * e[1] + north * n[1],
            east * e[2] + north * n[2]
        };
    }
}
