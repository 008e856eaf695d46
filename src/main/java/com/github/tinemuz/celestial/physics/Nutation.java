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

/**
 * Nutation in longitude and in obliquity for one epoch, in milliarcseconds.
 */
public final class Nutation {

    // IAU 2000B stand-in for the planetary terms, milliarcseconds
    private static final double PLANETARY_PSI_MAS = -0.135;
    private static final double PLANETARY_EPS_MAS = 0.388;

    private final Epoch epoch;
    private final NutationModel model;
    private final double longitude;
    private final double obliquity;

    private Nutation(Epoch epoch, NutationModel model, double longitude, double obliquity) {
        this.epoch = epoch;
        this.model = model;
        this.longitude = longitude;
        this.obliquity = obliquity;
    }

    public static Nutation at(Epoch epoch, NutationModel model) {
        double t = epoch.centuriesSinceJ2000();
        if (model == NutationModel.LP) {
            double om = Math.toRadians(125.04452 - 1934.136261 * t);
            double sunL = Math.toRadians(280.4665 + 36000.7698 * t);
            double moonL = Math.toRadians(218.3165 + 481267.8813 * t);
            double dpsi = -17.20 * Math.sin(om) - 1.32 * Math.sin(2 * sunL)
                    - 0.23 * Math.sin(2 * moonL) + 0.21 * Math.sin(2 * om);
            double deps = 9.20 * Math.cos(om) + 0.57 * Math.cos(2 * sunL)
                    + 0.10 * Math.cos(2 * moonL) - 0.09 * Math.cos(2 * om);
            return new Nutation(epoch, model, dpsi * 1000.0, deps * 1000.0);
        }
        double[] lunisolar = NutationSeries.evaluate(t);
        return new Nutation(epoch, model,
                lunisolar[0] * 1000.0 + PLANETARY_PSI_MAS,
                lunisolar[1] * 1000.0 + PLANETARY_EPS_MAS);
    }

    public Epoch epoch() {
        return epoch;
    }

    public NutationModel model() {
        return model;
    }

    /** Nutation in longitude, delta-psi, in milliarcseconds. */
    public double longitude() {
        return longitude;
    }

    /** Nutation in obliquity, delta-epsilon, in milliarcseconds. */
    public double obliquity() {
        return obliquity;
    }
}
