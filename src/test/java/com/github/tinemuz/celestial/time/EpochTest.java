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
package com.github.tinemuz.celestial.time;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.error.MissingRequiredFieldException;
import com.github.tinemuz.celestial.error.RangeValidationException;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EpochTest {

    @Test
    @DisplayName("J2000 from every factory")
    void j2000() {
        assertTrue(Epoch.j2000().isJ2000());
        assertEquals(Epoch.j2000(), Epoch.julianEpoch(2000.0));
        assertEquals(Epoch.j2000(), Epoch.ofJulianDay(2451545.0));
        assertEquals(Epoch.j2000(), Epoch.of(Instant.parse("2000-01-01T12:00:00Z")));
        assertEquals(0.0, Epoch.j2000().centuriesSinceJ2000());
    }

    @Test
    @DisplayName("Besselian epoch B1950")
    void besselian() {
        Epoch b1950 = Epoch.besselianEpoch(1950.0);
        assertEquals(2433282.4235, b1950.julianDay(), 1e-4);
        assertEquals(1950.0, b1950.besselianEpochYear(), 1e-9);
        assertFalse(b1950.isJ2000());
    }

    @Test
    @DisplayName("Instant conversion both ways")
    void instants() {
        Instant instant = Instant.parse("1987-04-10T19:21:00Z");
        Epoch epoch = Epoch.of(instant);
        assertEquals(2446896.30625, epoch.julianDay(), 1e-9);
        assertEquals(instant, epoch.toInstant());
        assertEquals(1987.27, epoch.julianEpochYear(), 0.01);
    }

    @Test
    @DisplayName("Ordering and equality follow the Julian day")
    void ordering() {
        Epoch a = Epoch.julianEpoch(1990.0);
        Epoch b = Epoch.julianEpoch(2010.0);
        assertTrue(a.compareTo(b) < 0);
        assertEquals(a, Epoch.ofJulianDay(a.julianDay()));
        assertEquals(a.hashCode(), Epoch.ofJulianDay(a.julianDay()).hashCode());
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void invalid() {
        assertThrows(RangeValidationException.class, () -> Epoch.ofJulianDay(Double.NaN));
        assertThrows(MissingRequiredFieldException.class, () -> Epoch.of(null));
    }
}
