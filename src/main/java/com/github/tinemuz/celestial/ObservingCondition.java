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

import com.github.tinemuz.celestial.error.MissingRequiredFieldException;
import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.time.Epoch;

import java.util.Objects;

/**
 * Where and when an observer stands: observing time, geodetic longitude (east positive)
 * and latitude in degrees, and elevation in metres.
 */
public final class ObservingCondition {

    private final Epoch time;
    private final double geoLongitude;
    private final double geoLatitude;
    private final double elevation;

    private ObservingCondition(Epoch time, double geoLongitude, double geoLatitude, double elevation) {
        this.time = MissingRequiredFieldException.require("time", time);
        this.geoLongitude = RangeValidationException.requireClosed("geoLongitude", geoLongitude, -180.0, 180.0);
        this.geoLatitude = RangeValidationException.requireClosed("geoLatitude", geoLatitude, -90.0, 90.0);
        this.elevation = RangeValidationException.requireClosed("elevation", elevation, -12000.0, 3e7);
    }

    public static ObservingCondition of(Epoch time, double geoLongitude, double geoLatitude) {
        return new ObservingCondition(time, geoLongitude, geoLatitude, 0.0);
    }

    public static ObservingCondition of(Epoch time, double geoLongitude, double geoLatitude, double elevation) {
        return new ObservingCondition(time, geoLongitude, geoLatitude, elevation);
    }

    public Epoch time() {
        return time;
    }

    public double geoLongitude() {
        return geoLongitude;
    }

    public double geoLatitude() {
        return geoLatitude;
    }

    public double elevation() {
        return elevation;
    }

    /** Same place at another time. */
    public ObservingCondition withTime(Epoch newTime) {
        return new ObservingCondition(newTime, geoLongitude, geoLatitude, elevation);
    }

    boolean samePlaceAs(ObservingCondition other) {
        return Double.compare(geoLongitude, other.geoLongitude) == 0
                && Double.compare(geoLatitude, other.geoLatitude) == 0
                && Double.compare(elevation, other.elevation) == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservingCondition)) return false;
        ObservingCondition that = (ObservingCondition) o;
        return time.equals(that.time) && samePlaceAs(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, geoLongitude, geoLatitude, elevation);
    }

    @Override
    public String toString() {
        return "ObservingCondition[" + time + ", lon=" + geoLongitude + ", lat=" + geoLatitude
                + ", elevation=" + elevation + "]";
    }
}
