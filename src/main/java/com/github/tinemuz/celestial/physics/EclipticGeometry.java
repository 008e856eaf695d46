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

/** Vector helpers shared by the correction providers. */
final class EclipticGeometry {

    private EclipticGeometry() {}

    /** Ecliptic vector to the equator of obliquity {@code epsilon} (radians). */
    static double[] toEquatorial(double[] v, double epsilon) {
        double c = Math.cos(epsilon);
        double s = Math.sin(epsilon);
        return new double[] {v[0], v[1] * c - v[2] * s, v[1] * s + v[2] * c};
    }

    static double[] toEcliptic(double[] v, double epsilon) {
        return toEquatorial(v, -epsilon);
    }

    /** Unit vector of increasing longitude at the given direction. */
    static double[] eastward(double longitude) {
        return new double[] {-Math.sin(longitude), Math.cos(longitude), 0.0};
    }

    /** Unit vector of increasing latitude at the given direction. */
    static double[] northward(double longitude, double latitude) {
        double sb = Math.sin(latitude);
        return new double[] {-sb * Math.cos(longitude), -sb * Math.sin(longitude), Math.cos(latitude)};
    }
}
