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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AtmosphericRefractionTest {

    @Test
    @DisplayName("About one arcminute at 45 degrees, nothing at the zenith")
    void magnitude() {
        assertEquals(1.0, AtmosphericRefraction.refraction(45.0) * 60.0, 0.01);
        assertEquals(0.0, AtmosphericRefraction.refraction(90.0) * 60.0, 1e-4);
        assertTrue(AtmosphericRefraction.refraction(0.5) * 60.0 > 25.0, "large near the horizon");
    }

    @Test
    @DisplayName("True and apparent altitude conversions are inverse")
    void inverse() {
        for (double h = 0.5; h < 90.0; h += 3.7) {
            double apparent = AtmosphericRefraction.trueToApparent(h);
            assertTrue(apparent > h, "refraction raises the object at " + h);
            assertEquals(h, AtmosphericRefraction.apparentToTrue(apparent), 1e-10, "round trip at " + h);
        }
    }

    @Test
    @DisplayName("Altitudes at or below the horizon are returned unchanged")
    void belowHorizon() {
        assertEquals(0.0, AtmosphericRefraction.trueToApparent(0.0));
        assertEquals(-5.0, AtmosphericRefraction.trueToApparent(-5.0));
        assertEquals(-0.3, AtmosphericRefraction.apparentToTrue(-0.3));
    }
}
