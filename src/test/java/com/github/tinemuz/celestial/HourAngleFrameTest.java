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
import static com.github.tinemuz.celestial.PositionAssertions.assertSamePosition;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestial.error.MissingRequiredFieldException;
import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.time.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HourAngleFrameTest {

    private static final Epoch TIME = Epoch.ofJulianDay(2459580.8);
    private static final ObservingCondition OBSERVER = ObservingCondition.of(TIME, -70.4, -24.6, 2600.0);

    private static EquinoctialFrame apparentStar() {
        return EquinoctialFrame.builder()
                .rightAscension(88.79294)
                .declination(7.40706)
                .epoch(TIME)
                .withNutation(true)
                .withAnnualAberration(true)
                .withGravitationalDeflection(true)
                .onFk5(true)
                .build();
    }

    @Test
    @DisplayName("Hour angle is local sidereal time minus right ascension")
    void definition() {
        HourAngleFrame h = apparentStar().toHourAngle(OBSERVER);
        double lst = Math.toDegrees(h.siderealTime());
        assertAngleEquals(Angles.normalizeDegrees(lst - 88.79294), h.hourAngle(), 1e-9, "hour angle");
        assertEquals(7.40706, h.declination(), 1e-9);
        assertEquals(FrameCode.HOUR_ANGLE, h.code());
    }

    @Test
    @DisplayName("One hour later the hour angle grows by one sidereal hour")
    void oneHourLater() {
        HourAngleFrame h = apparentStar().toHourAngle(OBSERVER);
        double before = h.hourAngle();
        h.retarget(RetargetOptions.builder().epoch(Epoch.ofJulianDay(TIME.julianDay() + 1.0 / 24.0)).build());
        assertAngleEquals(before + 15.0411, h.hourAngle(), 1e-3, "hour angle after an hour");
        assertEquals(7.40706, h.declination(), 1e-3);
    }

    @Test
    @DisplayName("Ten degrees further east adds ten degrees of hour angle")
    void furtherEast() {
        HourAngleFrame h = apparentStar().toHourAngle(OBSERVER);
        double before = h.hourAngle();
        double declination = h.declination();
        h.retarget(RetargetOptions.builder()
                .observingCondition(ObservingCondition.of(TIME, -60.4, -24.6, 2600.0))
                .build());
        assertAngleEquals(before + 10.0, h.hourAngle(), 1e-9, "hour angle");
        assertEquals(declination, h.declination(), 1e-12);
    }

    @Test
    @DisplayName("Hour angle frames are independent of the observer latitude")
    void latitudeIndependent() {
        HourAngleFrame south = apparentStar().toHourAngle(OBSERVER);
        HourAngleFrame north = apparentStar().toHourAngle(ObservingCondition.of(TIME, -70.4, 60.0));
        assertSamePosition(south.position(), north.position(), 1e-12, "latitude");
    }

    @Test
    @DisplayName("Conversion without a condition keeps the current one")
    void noCondition() {
        HourAngleFrame h = apparentStar().toHourAngle(OBSERVER);
        HourAngleFrame same = h.toHourAngle(null);
        assertNotSame(h, same);
        assertEquals(h.position(), same.position());
        assertEquals(OBSERVER, same.observingCondition());
    }

    @Test
    @DisplayName("Construction checks the condition and the ranges")
    void construction() {
        assertThrows(MissingRequiredFieldException.class,
                () -> HourAngleFrame.builder().hourAngle(10.0).build());
        RangeValidationException e = assertThrows(RangeValidationException.class,
                () -> HourAngleFrame.builder().hourAngle(360.0).observingCondition(OBSERVER).build());
        assertEquals("hourAngle", e.getParameter());
    }
}
