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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.error.UnknownEnumException;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.time.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FrameDefaultsTest {

    @Test
    @DisplayName("Bundled configuration is read from the classpath")
    void bundledDefaults() {
        assertEquals(PrecessionModel.IAU2006, FrameDefaults.precessionModel());
        assertEquals(NutationModel.IAU2000B, FrameDefaults.nutationModel());
        assertEquals(RangePolicy.LENIENT, FrameDefaults.galacticRangePolicy());
        assertEquals(RangePolicy.STRICT, FrameDefaults.horizontalRangePolicy());
        assertNotNull(FrameDefaults.class.getClassLoader().getResource(FrameDefaults.RESOURCE));
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        @DisplayName("Frame codes resolve from their short form")
        void frameCodes() {
            for (FrameCode code : FrameCode.values()) {
                assertEquals(code, FrameCode.fromCode(code.code()));
            }
            assertThrows(UnknownEnumException.class, () -> FrameCode.fromCode("EQC"));
            assertThrows(UnknownEnumException.class, () -> FrameCode.fromCode(null));
        }

        @Test
        @DisplayName("Centers and policies resolve case-insensitively")
        void enums() {
            assertEquals(HorizontalCenter.TOPOCENTRIC, HorizontalCenter.fromName("topocentric"));
            assertEquals(EclipticCenter.HELIOCENTRIC, EclipticCenter.fromName(" Heliocentric "));
            assertEquals(RangePolicy.LENIENT, RangePolicy.fromName("Lenient"));
            UnknownEnumException e = assertThrows(UnknownEnumException.class, () -> RangePolicy.fromName("loose"));
            assertEquals("rangePolicy", e.getParameter());
        }
    }

    @Nested
    @DisplayName("Retarget options")
    class Options {

        @Test
        @DisplayName("Empty options leave every field unset")
        void none() {
            RetargetOptions o = RetargetOptions.none();
            assertNull(o.epoch());
            assertNull(o.withNutation());
            assertNull(o.onFk5());
            assertNull(o.eclipticCenter());
            assertNull(o.observingCondition());
        }

        @Test
        @DisplayName("Apparent place sets the four corrections")
        void apparentPlace() {
            RetargetOptions o = RetargetOptions.builder().apparentPlace(true).build();
            assertEquals(Boolean.TRUE, o.withNutation());
            assertEquals(Boolean.TRUE, o.withAnnualAberration());
            assertEquals(Boolean.TRUE, o.withGravitationalDeflection());
            assertEquals(Boolean.TRUE, o.onFk5());
            assertNull(o.withRefraction());
        }

        @Test
        @DisplayName("A derived builder keeps the original untouched")
        void toBuilder() {
            RetargetOptions original = RetargetOptions.builder().epoch(Epoch.j2000()).withRefraction(true).build();
            RetargetOptions derived = original.toBuilder().withRefraction(false).build();
            assertEquals(Boolean.TRUE, original.withRefraction());
            assertEquals(Boolean.FALSE, derived.withRefraction());
            assertEquals(Epoch.j2000(), derived.epoch());
        }
    }
}
