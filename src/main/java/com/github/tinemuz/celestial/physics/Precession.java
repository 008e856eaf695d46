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

import com.github.tinemuz.celestial.time.Epoch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equatorial precession angles and mean obliquity for one epoch.
 *
 * <p>All angles are in arcseconds. {@code zeta}, {@code theta} and {@code z} carry
 * J2000 mean coordinates to mean coordinates of the epoch; {@code epsilon} is the mean
 * obliquity of the epoch and {@code epsilon0} the obliquity at J2000 for the same model.</p>
 *
 * <p>Polynomials: IAU 2006 (Capitaine et al. 2003, P03), IAU 2000 (IERS Conventions 2003)
 * and IAU 1976 (Lieske 1977). They are fits valid for a few centuries around J2000.</p>
 */
public final class Precession {
    private static final Logger log = LoggerFactory.getLogger(Precession.class);

    private static final double VALID_CENTURIES = 10.0;

    private static volatile boolean warnedOutOfRange = false;

    private final Epoch epoch;
    private final PrecessionModel model;
    private final double zeta;
    private final double theta;
    private final double z;
    private final double epsilon;
    private final double epsilon0;

    private Precession(Epoch epoch, PrecessionModel model,
                       double zeta, double theta, double z, double epsilon, double epsilon0) {
        this.epoch = epoch;
        this.model = model;
        this.zeta = zeta;
        this.theta = theta;
        this.z = z;
        this.epsilon = epsilon;
        this.epsilon0 = epsilon0;
    }

    public static Precession at(Epoch epoch, PrecessionModel model) {
        double t = epoch.centuriesSinceJ2000();
        warnIfOutOfRange(t);
        switch (model) {
            case IAU2000:
                return new Precession(epoch, model,
                        poly(t, 2.5976176, 2306.0809506, 0.3019015, 0.0179663, -0.0000327, -0.0000002),
                        poly(t, 0.0, 2004.1917476, -0.4269353, -0.0418251, -0.0000601, -0.0000001),
                        poly(t, -2.5976176, 2306.0803226, 1.0947790, 0.0182273, 0.0000470, -0.0000003),
                        poly(t, 84381.448, -46.84024, -0.00059, 0.001813),
                        84381.448);
            case IAU1976:
                return new Precession(epoch, model,
                        poly(t, 0.0, 2306.2181, 0.30188, 0.017998),
                        poly(t, 0.0, 2004.3109, -0.42665, -0.041833),
                        poly(t, 0.0, 2306.2181, 1.09468, 0.018203),
                        poly(t, 84381.448, -46.8150, -0.00059, 0.001813),
                        84381.448);
            default:
                return new Precession(epoch, model,
                        poly(t, 2.650545, 2306.083227, 0.2988499, 0.01801828, -0.000005971, -0.0000003173),
                        poly(t, 0.0, 2004.191903, -0.4294934, -0.04182264, -0.000007089, -0.0000001274),
                        poly(t, -2.650545, 2306.077181, 1.0927348, 0.01826837, -0.000028596, -0.0000002904),
                        poly(t, 84381.406, -46.836769, -0.0001831, 0.00200340, -0.000000576, -0.0000000434),
                        84381.406);
        }
    }

    /** Mean obliquity of the ecliptic at {@code epoch}, in arcseconds. */
    public static double meanObliquity(Epoch epoch, PrecessionModel model) {
        return at(epoch, model).epsilon;
    }

    public Epoch epoch() {
        return epoch;
    }

    public PrecessionModel model() {
        return model;
    }

    public double zeta() {
        return zeta;
    }

    public double theta() {
        return theta;
    }

    public double z() {
        return z;
    }

    public double epsilon() {
        return epsilon;
    }

    public double epsilon0() {
        return epsilon0;
    }

    // Horner evaluation, coefficients from the constant term upward
    static double poly(double t, double... c) {
        double sum = 0.0;
        for (int i = c.length - 1; i >= 0; i--) {
            sum = sum * t + c[i];
        }
        return sum;
    }

    private static void warnIfOutOfRange(double centuries) {
        if (Math.abs(centuries) <= VALID_CENTURIES || warnedOutOfRange) return;
        synchronized (Precession.class) {
            if (!warnedOutOfRange) {
                warnedOutOfRange = true;
                log.warn("Requested epoch is {} centuries from J2000; precession polynomials "
                                + "degrade beyond {} centuries",
                        String.format("%.1f", centuries), VALID_CENTURIES);
            }
        }
    }
}
