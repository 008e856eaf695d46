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

import static com.github.tinemuz.celestial.PositionAssertions.assertAngleEquals;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.time.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GalacticFrameTest {

    @Test
    @DisplayName("The galactic centre maps to the origin")
    void centreAtOrigin() {
        EquinoctialFrame centre = EquinoctialFrame.builder()
                .rightAscension(GalacticFrame.CENTER_RA_J2000)
                .declination(GalacticFrame.CENTER_DEC_J2000)
                .build();
        GalacticFrame g = centre.toGalactic(RetargetOptions.none());
        assertAngleEquals(0.0, g.longitude(), 2e-4, "longitude");
        assertEquals(0.0, g.latitude(), 2e-4);
        assertEquals(Epoch.j2000(), g.epoch());
    }

    @Test
    @DisplayName("The north galactic pole maps to latitude 90")
    void poleAtNinety() {
        EquinoctialFrame pole = EquinoctialFrame.builder()
                .rightAscension(GalacticFrame.POLE_RA_J2000)
                .declination(GalacticFrame.POLE_DEC_J2000)
                .build();
        assertEquals(90.0, pole.toGalactic(RetargetOptions.none()).latitude(), 1e-9);
    }

    @Test
    @DisplayName("Ascending node of the galactic plane is 32.93 degrees from the centre")
    void nodeAngle() {
        GalacticFrame g = GalacticFrame.builder().longitude(0.0).build();
        assertEquals(32.932, Math.toDegrees(g.nodeAngle()), 0.01);
    }

    @Nested
    @DisplayName("Range policy")
    class Ranges {

        @Test
        @DisplayName("Lenient by default: out of range longitudes are wrapped")
        void lenientDefault() {
            GalacticFrame g = GalacticFrame.builder().longitude(400.0).latitude(10.0).build();
            assertEquals(RangePolicy.LENIENT, g.rangePolicy());
            assertEquals(40.0, g.longitude(), 1e-9);
            assertEquals(10.0, g.latitude(), 1e-9);
        }

        @Test
        @DisplayName("Strict policy rejects 360")
        void strict() {
            RangeValidationException e = assertThrows(RangeValidationException.class, () -> GalacticFrame.builder()
                    .rangePolicy(RangePolicy.STRICT)
                    .longitude(360.0)
                    .build());
            assertEquals("longitude", e.getParameter());
        }

        @Test
        @DisplayName("Non-finite values are rejected even when lenient")
        void notFinite() {
            assertThrows(RangeValidationException.class,
                    () -> GalacticFrame.builder().longitude(Double.NaN).build());
        }
    }

    @Nested
    @DisplayName("Epoch retargeting")
    class Retargeting {

        @Test
        @DisplayName("Galactic coordinates do not change with the epoch")
        void invariantCoordinates() {
            GalacticFrame g = GalacticFrame.builder().longitude(30.0).latitude(20.0).build();
            g.retargetEpoch(Epoch.besselianEpoch(1950.0));
            assertEquals(Epoch.besselianEpoch(1950.0), g.epoch());
            assertAngleEquals(30.0, g.longitude(), 1e-8, "longitude");
            assertEquals(20.0, g.latitude(), 1e-8);
        }

        @Test
        @DisplayName("Defining directions are precessed with the frame")
        void definingDirections() {
            GalacticFrame g = GalacticFrame.builder().longitude(0.0).build();
            g.retargetEpoch(Epoch.besselianEpoch(1950.0));
            assertEquals(192.25, g.pole().longitudeDegrees(), 0.02);
            assertEquals(27.40, g.pole().latitudeDegrees(), 0.02);
            assertEquals(265.6, g.center().longitudeDegrees(), 0.05);
            assertEquals(-28.92, g.center().latitudeDegrees(), 0.05);
        }

        @Test
        @DisplayName("A snapshot leaves the receiver untouched")
        void snapshotPurity() {
            GalacticFrame g = GalacticFrame.builder().longitude(120.0).latitude(-45.0).build();
            GalacticFrame moved = g.snapshot(RetargetOptions.builder().epoch(Epoch.julianEpoch(2100.0)).build());
            assertEquals(Epoch.j2000(), g.epoch());
            assertEquals(GalacticFrame.POLE_RA_J2000, g.pole().longitudeDegrees(), 1e-9);
            assertEquals(Epoch.julianEpoch(2100.0), moved.epoch());
        }
    }
}
