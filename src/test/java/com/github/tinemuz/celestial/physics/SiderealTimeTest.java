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

import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.time.Epoch;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SiderealTimeTest {

    private static final double HOUR_TOLERANCE = 2e-6;

    @Nested
    @DisplayName("Reference values")
    class ReferenceValues {

        @Test
        @DisplayName("Apparent Greenwich sidereal time, 1987 April 10 19:21 UT")
        void meeusExample() {
            Epoch time = Epoch.of(Instant.parse("1987-04-10T19:21:00Z"));
            SiderealTime st = SiderealTime.at(time, 0.0, PrecessionModel.IAU2006, NutationModel.IAU2000B);
            double expected = 8.0 + 34.0 / 60.0 + 56.853 / 3600.0;
            assertEquals(expected, st.trueHours(), HOUR_TOLERANCE);
        }

        @Test
        @DisplayName("Classic GMST polynomial, 1987 April 10 0h UT")
        void iau1976Mean() {
            Epoch time = Epoch.of(Instant.parse("1987-04-10T00:00:00Z"));
            SiderealTime st = SiderealTime.at(time, 0.0, PrecessionModel.IAU1976, NutationModel.IAU2000B);
            double expected = 13.0 + 10.0 / 60.0 + 46.3668 / 3600.0;
            assertEquals(expected * 3600.0, st.meanSeconds(), 1e-3);
        }

        @Test
        @DisplayName("Local sidereal time west of Greenwich")
        void localWest() {
            SiderealTime st = SiderealTime.at(Epoch.ofJulianDay(2458582.5), -89.5,
                    PrecessionModel.IAU2006, NutationModel.IAU2000B);
            assertEquals(7.16327, st.trueHours(), 1e-4);
        }
    }

    @Test
    @DisplayName("Longitude shifts local time by four minutes per degree")
    void longitudeShift() {
        Epoch time = Epoch.julianEpoch(2020.3);
        SiderealTime greenwich = SiderealTime.at(time, 0.0, PrecessionModel.IAU2006, NutationModel.IAU2000B);
        SiderealTime east = SiderealTime.at(time, 10.0, PrecessionModel.IAU2006, NutationModel.IAU2000B);
        double diff = (east.meanSeconds() - greenwich.meanSeconds() + SiderealTime.SECONDS_PER_DAY)
                % SiderealTime.SECONDS_PER_DAY;
        assertEquals(2400.0, diff, 1e-6);
        assertTrue(east.trueSeconds() >= 0.0 && east.trueSeconds() < SiderealTime.SECONDS_PER_DAY);
    }

    @Test
    @DisplayName("Longitude outside [-180, 180] is rejected")
    void invalidLongitude() {
        assertThrows(RangeValidationException.class, () ->
                SiderealTime.at(Epoch.j2000(), 181.0, PrecessionModel.IAU2006, NutationModel.IAU2000B));
    }
}
