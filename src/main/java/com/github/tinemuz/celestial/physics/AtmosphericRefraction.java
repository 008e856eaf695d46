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

/**
 * Atmospheric refraction near standard conditions (Bennett 1982, Meeus eq. 16.4).
 *
 * <p>Bennett's formula gives the true altitude from an apparent one; the opposite
 * direction solves the same formula numerically so that both conversions are inverse
 * to each other. Altitudes are in degrees. The model is undefined below the horizon, so
 * altitudes of zero or less come back unchanged.</p>
 */
public final class AtmosphericRefraction {

    // arcminutes, makes the refraction vanish at the zenith
    private static final double ZENITH_OFFSET = 0.0013515;
    private static final double TOLERANCE = 1e-13;
    private static final int MAX_ITERATIONS = 50;

    private AtmosphericRefraction() {}

    /** Refraction in degrees for an apparent altitude in degrees. */
    public static double refraction(double apparentAltitude) {
        double arg = Math.toRadians(apparentAltitude + 7.31 / (apparentAltitude + 4.4));
        return (1.0 / Math.tan(arg) + ZENITH_OFFSET) / 60.0;
    }

    public static double apparentToTrue(double apparentAltitude) {
        if (apparentAltitude <= 0.0) {
            return apparentAltitude;
        }
        return apparentAltitude - refraction(apparentAltitude);
    }

    public static double trueToApparent(double trueAltitude) {
        if (trueAltitude <= 0.0) {
            return trueAltitude;
        }
        // Newton iteration on f(h0) = h0 - R(h0) - h
        double h0 = trueAltitude + refraction(trueAltitude);
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double f = h0 - refraction(h0) - trueAltitude;
            double step = 1e-6;
            double slope = 1.0 - (refraction(h0 + step) - refraction(h0 - step)) / (2 * step);
            double next = h0 - f / slope;
            if (Math.abs(next - h0) < TOLERANCE) {
                return next;
            }
            h0 = next;
        }
        return h0;
    }
}
