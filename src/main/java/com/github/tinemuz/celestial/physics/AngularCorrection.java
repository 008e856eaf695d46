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

import java.util.function.Function;

/**
 * A small displacement of a direction, held as a rotation about a fixed axis.
 *
 * <p>Applying and then removing the same correction is an exact inverse pair, and the
 * radius of the position is never changed.</p>
 */
public final class AngularCorrection {

    public static final AngularCorrection NONE = new AngularCorrection(new double[] {0, 0, 1}, 0.0);

    private static final int INVERSION_STEPS = 3;

    private final double[] axis;
    private final double angle;

    private AngularCorrection(double[] axis, double angle) {
        this.axis = axis;
        this.angle = angle;
    }

    /** The rotation carrying the direction of {@code from} onto that of {@code to}. */
    public static AngularCorrection between(SphericalPosition from, SphericalPosition to) {
        double[] a = from.toUnitVector();
        double[] b = to.toUnitVector();
        double[] n = cross(a, b);
        double sin = Math.sqrt(dot(n, n));
        double cos = dot(a, b);
        if (sin == 0.0) {
            return NONE;
        }
        return new AngularCorrection(new double[] {n[0] / sin, n[1] / sin, n[2] / sin}, Math.atan2(sin, cos));
    }

    /**
     * Correction that moves {@code position} along the displacement {@code delta} (same
     * frame as the position, unit sphere scale).
     */
    public static AngularCorrection displacement(SphericalPosition position, double[] delta) {
        double[] u = position.toUnitVector();
        SphericalPosition moved = SphericalPosition.fromCartesian(u[0] + delta[0], u[1] + delta[1], u[2] + delta[2]);
        return between(position, moved);
    }

    /**
     * Solve for the correction that was applied to reach {@code corrected}, given the
     * provider that computes the correction of an uncorrected direction.
     */
    public static AngularCorrection recover(SphericalPosition corrected,
                                            Function<SphericalPosition, AngularCorrection> provider) {
        SphericalPosition estimate = corrected;
        for (int i = 0; i < INVERSION_STEPS; i++) {
            estimate = provider.apply(estimate).removeFrom(corrected);
        }
        return between(estimate, corrected);
    }

    public SphericalPosition applyTo(SphericalPosition position) {
        return rotate(position, angle);
    }

    public SphericalPosition removeFrom(SphericalPosition position) {
        return rotate(position, -angle);
    }

    /** Size of the displacement in radians. */
    public double angle() {
        return angle;
    }

    private SphericalPosition rotate(SphericalPosition position, double by) {
        if (by == 0.0) {
            return position;
        }
        // Rodrigues rotation
        double[] v = position.toUnitVector();
        double c = Math.cos(by);
        double s = Math.sin(by);
        double[] kxv = cross(axis, v);
        double kv = dot(axis, v) * (1 - c);
        SphericalPosition turned = SphericalPosition.fromCartesian(
                v[0] * c + kxv[0] * s + axis[0] * kv,
                v[1] * c + kxv[1] * s + axis[1] * kv,
                v[2] * c + kxv[2] * s + axis[2] * kv);
        return SphericalPosition.of(position.r(), turned.theta(), turned.phi());
    }

    static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    static double[] cross(double[] a, double[] b) {
        return new double[] {
            a[1] * b[2] - a[2] * b[1],
            a[2] * b[0] - a[0] * b[2],
            a[0] * b[1] - a[1] * b[0]
        };
    }
}
