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

import static com.github.tinemuz.celestial.PositionAssertions.arcseconds;
import static com.github.tinemuz.celestial.PositionAssertions.assertSamePosition;
import static com.github.tinemuz.celestial.PositionAssertions.separation;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.time.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AngularCorrectionTest {

    private static final Epoch EPOCH = Epoch.julianEpoch(2021.4);
    private static final double OBLIQUITY = Math.toRadians(23.4367);

    @Nested
    @DisplayName("Rotation mechanics")
    class Mechanics {

        @Test
        @DisplayName("Apply then remove restores the position and radius")
        void inverse() {
            SphericalPosition from = SphericalPosition.ofDegrees(10.0, 20.0, 3.0);
            SphericalPosition to = SphericalPosition.ofDegrees(10.01, 19.99, 1.0);
            AngularCorrection c = AngularCorrection.between(from, to);
            SphericalPosition moved = c.applyTo(from);
            assertSamePosition(to.withRadius(3.0), moved, 1e-14, "moved");
            assertSamePosition(from, c.removeFrom(moved), 1e-14, "restored");
        }

        @Test
        @DisplayName("Recovering a correction from the corrected place")
        void recover() {
            SphericalPosition mean = SphericalPosition.ofDegrees(200.0, -40.0, 1.0);
            AngularCorrection applied = AnnualAberration.ecliptic(mean, EPOCH);
            SphericalPosition apparent = applied.applyTo(mean);
            AngularCorrection recovered = AngularCorrection.recover(apparent, p -> AnnualAberration.ecliptic(p, EPOCH));
            assertSamePosition(mean, recovered.removeFrom(apparent), 1e-14, "recovered mean place");
        }

        @Test
        @DisplayName("Identical directions give no correction")
        void none() {
            SphericalPosition p = SphericalPosition.ofDegrees(1.0, 2.0, 1.0);
            assertEquals(0.0, AngularCorrection.between(p, p).angle());
        }
    }

    @Nested
    @DisplayName("Physical magnitudes")
    class Magnitudes {

        @Test
        @DisplayName("Aberration at the ecliptic pole is the constant of aberration")
        void aberrationAtPole() {
            SphericalPosition pole = SphericalPosition.of(1.0, 0.0, 0.0);
            double shift = arcseconds(AnnualAberration.ecliptic(pole, EPOCH).angle());
            assertEquals(AnnualAberration.KAPPA, shift, 0.4);
        }

        @Test
        @DisplayName("Equatorial and ecliptic aberration move a star identically")
        void aberrationFrames() {
            SphericalPosition ecl = SphericalPosition.ofDegrees(75.0, 12.0, 1.0);
            SphericalPosition eq = ecl.rotateX(OBLIQUITY);
            SphericalPosition viaEcliptic = AnnualAberration.ecliptic(ecl, EPOCH).applyTo(ecl).rotateX(OBLIQUITY);
            SphericalPosition viaEquator = AnnualAberration.equinoctial(eq, EPOCH, OBLIQUITY).applyTo(eq);
            assertSamePosition(viaEcliptic, viaEquator, 1e-13, "aberration in both frames");
        }

        @Test
        @DisplayName("Light deflection 90 degrees from the Sun is about four milliarcseconds")
        void deflectionQuadrature() {
            EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(EPOCH);
            // ecliptic pole is perpendicular to the Sun direction
            SphericalPosition pole = SphericalPosition.of(1.0, 0.0, 0.0);
            double shift = arcseconds(GravitationalDeflection.ecliptic(pole, EPOCH).angle());
            assertEquals(0.00407 / earth.radius(), shift, 0.0002);
        }

        @Test
        @DisplayName("Light deflection grows toward the Sun and moves the star away from it")
        void deflectionNearSun() {
            EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(EPOCH);
            SphericalPosition sun = SphericalPosition.of(1.0, Angles.HALF_PI, earth.sunLongitude());
            SphericalPosition nearSun = sun.rotateZ(Math.toRadians(5.0));
            AngularCorrection c = GravitationalDeflection.ecliptic(nearSun, EPOCH);
            assertTrue(arcseconds(c.angle()) > 0.08, "deflection at 5 degrees");
            assertTrue(separation(sun, c.applyTo(nearSun)) > separation(sun, nearSun), "moves away");
            // anti-solar point is left alone
            SphericalPosition anti = sun.rotateZ(Math.PI);
            assertEquals(0.0, GravitationalDeflection.ecliptic(anti, EPOCH).angle(), 1e-15);
        }

        @Test
        @DisplayName("FK5 correction is under a fifth of an arcsecond")
        void fk5() {
            for (double lon = 0.0; lon < 360.0; lon += 45.0) {
                SphericalPosition p = SphericalPosition.ofDegrees(lon, 30.0, 1.0);
                double shift = arcseconds(Fk5Correction.ecliptic(p, EPOCH).angle());
                assertTrue(shift > 0.03 && shift < 0.2, "FK5 shift at " + lon + ": " + shift);
            }
        }
    }

    @Test
    @DisplayName("Earth is opposite to the Sun at about one astronomical unit")
    void earthPosition() {
        EarthHeliocentricPosition earth = EarthHeliocentricPosition.at(EPOCH);
        assertEquals(1.0, earth.radius(), 0.02);
        assertEquals(Angles.normalizeRadians(earth.sunLongitude() + Math.PI), earth.position().phi(), 1e-12);
        assertEquals(0.0167, earth.eccentricity(), 1e-4);
    }
}
