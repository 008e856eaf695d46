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

import com.github.tinemuz.celestial.error.UnknownEnumException;

import java.util.Locale;

/**
 * Corrections an equinoctial or ecliptic frame can carry on top of its mean place.
 *
 * <p>Each one can be disabled per frame. A disabled correction is never rotated in or
 * out: its {@code with*} flag is then only a label describing the supplied position.</p>
 */
public enum Correction {
    NUTATION,
    ANNUAL_ABERRATION,
    GRAVITATIONAL_DEFLECTION,
    FK5;

    public static Correction fromName(String name) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (Correction c : values()) {
                if (c.name().equals(key)) return c;
            }
        }
        throw new UnknownEnumException("correction", name,
                "[nutation, annual_aberration, gravitational_deflection, fk5]");
    }
}
