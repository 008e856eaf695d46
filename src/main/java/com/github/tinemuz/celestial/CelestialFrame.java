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

import com.github.tinemuz.celestial.math.SphericalPosition;

/**
 * Capabilities shared by the five frame kinds. Every conversion is a query: it returns
 * a new frame and never alters the receiver.
 */
public interface CelestialFrame {

    FrameCode code();

    /** Current position; canonical unless the frame tracks continuity. */
    SphericalPosition position();

    EquinoctialFrame toEquinoctial();

    EclipticFrame toEcliptic(RetargetOptions options);

    GalacticFrame toGalactic(RetargetOptions options);

    HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options);

    HourAngleFrame toHourAngle(ObservingCondition condition);
}
