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
package com.github.tinemuz.celestial.math;

import java.util.Objects;

/**
 * Immutable point in spherical coordinates.
 *
 * <p>{@code theta} is the polar angle measured from the +z axis and {@code phi} the
 * azimuth measured from +x toward +y, both in radians. Values returned by the rotation,
 * inversion and translation operations are always canonical ({@code theta} in [0, π],
 * {@code phi} in [0, 2π)); a position built through {@link #continuousFrom} may hold angles
 * outside those ranges so that a sequence of positions evolves without wraparound.</p>
 *
 * <p>Rotations are active and right-handed: {@code rotateZ(a)} turns the point by
 * {@code a} about +z, which adds {@code a} to its azimuth.</p>
 */
public final class SphericalPosition {

    /** Cartesian axis selector for rotations and inversions. */
    public enum Axis {
        X,
        Y,
        Z
    }

    private final double r;
    private final double theta;
    private final double phi;

    private SphericalPosition(double r, double theta, double phi) {
        this.r = r;
        this.theta = theta;
        this.phi = phi;
    }

    /** Position from radius, polar angle and azimuth (radians); angles are stored as given. */
    public static SphericalPosition of(double r, double theta, double phi) {
        return new SphericalPosition(r, theta, phi);
    }

    /** Position from a longitude/latitude pair in degrees. */
    public static SphericalPosition ofDegrees(double longitude, double latitude, double r) {
        return new SphericalPosition(r, Math.toRadians(90.0 - latitude), Math.toRadians(longitude));
    }

    public static SphericalPosition fromCartesian(double x, double y, double z) {
        double rho = Math.hypot(x, y);
        double radius = Math.sqrt(rho * rho + z * z);
        if (radius == 0.0) {
            return new SphericalPosition(0.0, 0.0, 0.0);
        }
        return new SphericalPosition(
                radius, Math.atan2(rho, z), Angles.normalizeRadians(Math.atan2(y, x)));
    }

    public double r() {
        return r;
    }

    public double theta() {
        return theta;
    }

    public double phi() {
        return phi;
    }

    /** Longitude-like reading of {@code phi}, in degrees. */
    public double longitudeDegrees() {
        return Math.toDegrees(phi);
    }

    /** Latitude-like reading of {@code theta} (90° minus the polar angle), in degrees. */
    public double latitudeDegrees() {
        return 90.0 - Math.toDegrees(theta);
    }

    public double[] toCartesian() {
        double s = Math.sin(theta);
        return new double[] {r * s * Math.cos(phi), r * s * Math.sin(phi), r * Math.cos(theta)};
    }

    /** Unit vector of the direction. */
    public double[] toUnitVector() {
        double s = Math.sin(theta);
        return new double[] {s * Math.cos(phi), s * Math.sin(phi), Math.cos(theta)};
    }

    public SphericalPosition withRadius(double radius) {
        return new SphericalPosition(radius, theta, phi);
    }

    public SphericalPosition withTheta(double polar) {
        return new SphericalPosition(r, polar, phi);
    }

    public SphericalPosition withPhi(double azimuth) {
        return new SphericalPosition(r, theta, azimuth);
    }

    public SphericalPosition rotateX(double angle) {
        double[] u = toUnitVector();
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return fromUnit(u[0], u[1] * c - u[2] * s, u[1] * s + u[2] * c);
    }

    public SphericalPosition rotateY(double angle) {
        double[] u = toUnitVector();
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return fromUnit(u[0] * c + u[2] * s, u[1], -u[0] * s + u[2] * c);
    }

    public SphericalPosition rotateZ(double angle) {
        double[] u = toUnitVector();
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return fromUnit(u[0] * c - u[1] * s, u[0] * s + u[1] * c, u[2]);
    }

    /** Mirror the point through the plane orthogonal to {@code axis}. */
    public SphericalPosition inverse(Axis axis) {
        double[] u = toUnitVector();
        switch (axis) {
            case X:
                return fromUnit(-u[0], u[1], u[2]);
            case Y:
                return fromUnit(u[0], -u[1], u[2]);
            default:
                return fromUnit(u[0], u[1], -u[2]);
        }
    }

    public SphericalPosition translate(double dx, double dy, double dz) {
        double[] v = toCartesian();
        return fromCartesian(v[0] + dx, v[1] + dy, v[2] + dz);
    }

    /** Same direction with {@code theta} in [0, π] and {@code phi} in [0, 2π). */
    public SphericalPosition normalized() {
        double t = Angles.wrapPi(theta);
        double p = phi;
        if (t < 0) {
            t = -t;
            p += Math.PI;
        }
        return new SphericalPosition(r, t, Angles.normalizeRadians(p));
    }

    /**
     * Representation of this direction whose angles lie closest to {@code previous}.
     *
     * <p>Two families describe the same direction: ({@code theta + 2kπ}, {@code phi + 2mπ})
     * and ({@code -theta + 2kπ}, {@code phi + π + 2mπ}). The candidate with the smallest
     * angular step from {@code previous} is kept, so a path crossing a pole continues
     * with a negative polar angle instead of a jump of π in azimuth.</p>
     */
    public SphericalPosition continuousFrom(SphericalPosition previous) {
        SphericalPosition c = normalized();
        double directTheta = nearest(c.theta, previous.theta);
        double directPhi = nearest(c.phi, previous.phi);
        double flippedTheta = nearest(-c.theta, previous.theta);
        double flippedPhi = nearest(c.phi + Math.PI, previous.phi);
        double direct = square(directTheta - previous.theta) + square(directPhi - previous.phi);
        double flipped = square(flippedTheta - previous.theta) + square(flippedPhi - previous.phi);
        if (flipped < direct) {
            return new SphericalPosition(c.r, flippedTheta, flippedPhi);
        }
        return new SphericalPosition(c.r, directTheta, directPhi);
    }

    private SphericalPosition fromUnit(double x, double y, double z) {
        SphericalPosition p = fromCartesian(x, y, z);
        return new SphericalPosition(r, p.theta, p.phi);
    }

    private static double nearest(double angle, double reference) {
        return angle + Angles.TWO_PI * Math.rint((reference - angle) / Angles.TWO_PI);
    }

    private static double square(double v) {
        return v * v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SphericalPosition)) return false;
        SphericalPosition that = (SphericalPosition) o;
        return Double.compare(r, that.r) == 0
                && Double.compare(theta, that.theta) == 0
                && Double.compare(phi, that.phi) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(r, theta, phi);
    }

    @Override
    public String toString() {
        return String.format("SphericalPosition[r=%.9g, theta=%.12f, phi=%.12f]", r, theta, phi);
    }
}
