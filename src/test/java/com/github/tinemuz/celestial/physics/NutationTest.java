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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.time.Epoch;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NutationTest {

    // Meeus, Astronomical Algorithms, example 22.a: 1987 April 10, 0h TD
    private static final Epoch MEEUS_DATE = Epoch.of(Instant.parse("1987-04-10T00:00:00Z"));
    private static final double MEEUS_DPSI = -3788.0;
    private static final double MEEUS_DEPS = 9443.0;

    @Test
    @DisplayName("Bundled series holds all 77 luni-solar terms")
    void seriesLoaded() {
        assertEquals(NutationSeries.EXPECTED_TERMS, NutationSeries.size());
    }

    @Test
    @DisplayName("IAU 2000B agrees with the published example within 0.02 arcseconds")
    void iau2000b() {
        Nutation n = Nutation.at(MEEUS_DATE, NutationModel.IAU2000B);
        assertEquals(MEEUS_DPSI, n.longitude(), 20.0, "delta psi (mas)");
        assertEquals(MEEUS_DEPS, n.obliquity(), 20.0, "delta epsilon (mas)");
    }

    @Test
    @DisplayName("Low precision series within half an arcsecond")
    void lowPrecision() {
        Nutation n = Nutation.at(MEEUS_DATE, NutationModel.LP);
        assertEquals(MEEUS_DPSI, n.longitude(), 500.0);
        assertEquals(MEEUS_DEPS, n.obliquity(), 500.0);
    }

    @Test
    @DisplayName("Nutation stays within its physical amplitude")
    void bounded() {
        for (int year = 1900; year <= 2100; year += 7) {
            Nutation n = Nutation.at(Epoch.julianEpoch(year), NutationModel.IAU2000B);
            assertTrue(Math.abs(n.longitude()) < 20000.0, "delta psi at " + year);
            assertTrue(Math.abs(n.obliquity()) < 11000.0, "delta epsilon at " + year);
        }
    }
}
