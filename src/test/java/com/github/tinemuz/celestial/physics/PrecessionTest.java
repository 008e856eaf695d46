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

import com.github.tinemuz.celestial.error.UnknownEnumException;
import com.github.tinemuz.celestial.time.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PrecessionTest {

    private static final double ARCSEC_TOLERANCE = 1e-9;

    @Nested
    @DisplayName("Values at J2000")
    class AtJ2000 {

        @Test
        @DisplayName("IAU 2006 carries the frame offset in zeta and z")
        void iau2006() {
            Precession p = Precession.at(Epoch.j2000(), PrecessionModel.IAU2006);
            assertEquals(2.650545, p.zeta(), ARCSEC_TOLERANCE);
            assertEquals(-2.650545, p.z(), ARCSEC_TOLERANCE);
            assertEquals(0.0, p.theta(), ARCSEC_TOLERANCE);
            assertEquals(84381.406, p.epsilon(), ARCSEC_TOLERANCE);
            assertEquals(84381.406, p.epsilon0(), ARCSEC_TOLERANCE);
        }

        @Test
        @DisplayName("IAU 1976 angles vanish")
        void iau1976() {
            Precession p = Precession.at(Epoch.j2000(), PrecessionModel.IAU1976);
            assertEquals(0.0, p.zeta(), ARCSEC_TOLERANCE);
            assertEquals(0.0, p.z(), ARCSEC_TOLERANCE);
            assertEquals(84381.448, p.epsilon(), ARCSEC_TOLERANCE);
        }
    }

    @Test
    @DisplayName("One century of precession, all models within an arcsecond")
    void oneCentury() {
        Epoch j2100 = Epoch.julianEpoch(2100.0);
        for (PrecessionModel model : PrecessionModel.values()) {
            Precession p = Precession.at(j2100, model);
            assertEquals(2306.2, p.zeta(), 4.0, model + " zeta");
            assertEquals(2004.3, p.theta(), 1.0, model + " theta");
            assertEquals(2307.3, p.z(), 4.0, model + " z");
            assertEquals(84381.4 - 46.8, p.epsilon(), 0.1, model + " epsilon");
        }
    }

    @Test
    @DisplayName("Model names resolve case-insensitively")
    void modelNames() {
        assertEquals(PrecessionModel.IAU2000, PrecessionModel.fromName("IAU2000"));
        assertEquals(NutationModel.LP, NutationModel.fromName("lp"));
        UnknownEnumException e = assertThrows(UnknownEnumException.class, () -> PrecessionModel.fromName("iau1980"));
        assertEquals("iau1980", e.getValue());
        assertEquals("precessionModel", e.getParameter());
    }
}
