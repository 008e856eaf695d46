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
package com.github.tinemuz.celestial;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.tinemuz.celestial.math.SphericalPosition;

/** Assertion helpers shared by the frame and provider tests. */
public final class PositionAssertions {

    private PositionAssertions() {}

    /** Angle between two directions, radians. */
    public static double separation(SphericalPosition a, SphericalPosition b) {
        double[] u = a.toUnitVector();
        double[] v = b.toUnitVector();
        double cx = u[1] * v[2] - u[2] * v[1];
        double cy = u[2] * v[0] - u[0] * v[2];
        double cz = u[0] * v[1] - u[1] * v[0];
        double dot = u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
        return Math.atan2(Math.sqrt(cx * cx + cy * cy + cz * cz), dot);
    }

    public static void assertSameDirection(SphericalPosition expected, SphericalPosition actual,
                                           double tolerance, String message) {
        double sep = separation(expected, actual);
        assertTrue(sep <= tolerance, message + ": directions differ by " + sep + " rad");
    }

    /** Same direction and same radius (relative). */
    public static void assertSamePosition(SphericalPosition expected, SphericalPosition actual,
                                          double tolerance, String message) {
        assertSameDirection(expected, actual, tolerance, message);
        assertEquals(expected.r(), actual.r(), tolerance * Math.max(1.0, expected.r()), message + ": radius");
    }

    /** Difference of two angles in degrees, wrapped into [-180, 180). */
    public static double angleDifference(double a, double b) {
        double d = (a - b) % 360.0;
        if (d >= 180.0) d -= 360.0;
        if (d < -180.0) d += 360.0;
        return d;
    }

    public static void assertAngleEquals(double expected, double actual, double tolerance, String message) {
        double d = angleDifference(actual, expected);
        assertTrue(Math.abs(d) <= tolerance,
                message + ": expected " + expected + " but was " + actual + " (off by " + d + ")");
    }

    public static double arcseconds(double radians) {
        return Math.toDegrees(radians) * 3600.0;
    }
}
