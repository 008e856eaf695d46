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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AnglesTest {

    private static final double TOLERANCE = 1e-12;

    @Nested
    @DisplayName("Unit conversions")
    class Conversions {

        @Test
        @DisplayName("Arcseconds, milliarcseconds and seconds of time")
        void units() {
            assertEquals(Math.toRadians(1.0), Angles.arcsecondsToRadians(3600.0), TOLERANCE);
            assertEquals(Angles.arcsecondsToRadians(1.0), Angles.milliarcsecondsToRadians(1000.0), TOLERANCE);
            assertEquals(Math.toRadians(15.0), Angles.timeSecondsToRadians(3600.0), TOLERANCE);
            assertEquals(3600.0, Angles.radiansToArcseconds(Math.toRadians(1.0)), 1e-9);
        }

        @Test
        @DisplayName("Sexagesimal parts to degrees")
        void sexagesimal() {
            assertEquals(-6.719891666666667, Angles.fromDms(true, 6, 43, 11.61), TOLERANCE);
            assertEquals(347.3193375, Angles.fromHms(23, 9, 16.641), 1e-9);
        }
    }

    @Nested
    @DisplayName("Wrapping")
    class Wrapping {

        @Test
        @DisplayName("Radians wrap into [0, 2π)")
        void normalizeRadians() {
            assertEquals(0.0, Angles.normalizeRadians(Angles.TWO_PI), TOLERANCE);
            assertEquals(Math.PI, Angles.normalizeRadians(-Math.PI), TOLERANCE);
            assertEquals(1.0, Angles.normalizeRadians(1.0 + 4 * Math.PI), 1e-12);
            double r = Angles.normalizeRadians(-1e-18);
            assertTrue(r >= 0.0 && r < Angles.TWO_PI, "result in range, got " + r);
        }

        @Test
        @DisplayName("wrapPi maps into [-π, π)")
        void wrapPi() {
            assertEquals(-Math.PI, Angles.wrapPi(Math.PI), TOLERANCE);
            assertEquals(-1.0, Angles.wrapPi(Angles.TWO_PI - 1.0), TOLERANCE);
        }

        @Test
        @DisplayName("Degrees wrap into [0, 360)")
        void normalizeDegrees() {
            assertEquals(0.0, Angles.normalizeDegrees(360.0), TOLERANCE);
            assertEquals(350.0, Angles.normalizeDegrees(-10.0), TOLERANCE);
            assertEquals(10.0, Angles.normalizeDegrees(730.0), TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Hour strings in several notations")
        void hours() {
            assertEquals(347.3193375, Angles.parseHours("23h 09m 16.641s"), 1e-9);
            assertEquals(347.3193375, Angles.parseHours("23:09:16.641"), 1e-9);
            assertEquals(15.0, Angles.parseHours("1h"), 1e-12);
        }

        @Test
        @DisplayName("Degree strings with sign or hemisphere")
        void degrees() {
            assertEquals(-6.719891666666667, Angles.parseDegrees("-6°43′11.61″"), 1e-12);
            assertEquals(-77.06555555555556, Angles.parseDegrees("77°03'56\"W"), 1e-12);
            assertEquals(38.92138888888889, Angles.parseDegrees("38 55 17 N"), 1e-12);
            assertEquals(-14.718944444444444, Angles.parseDegrees("-14 43 08.2"), 1e-12);
        }

        @Test
        @DisplayName("Malformed strings are rejected")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> Angles.parseDegrees(""));
            assertThrows(IllegalArgumentException.class, () -> Angles.parseDegrees("north"));
            assertThrows(IllegalArgumentException.class, () -> Angles.parseHours("1 2 3 4"));
        }
    }
}
