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

import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.math.SphericalPosition;

/**
 * Geocentric to topocentric displacement caused by the observer's offset from the
 * centre of the Earth (Meeus, ch. 11 and 40).
 *
 * <p>Positions must carry their distance in astronomical units. The displacement is a
 * pure translation, so {@link #toTopocentric} and {@link #toGeocentric} are exact
 * inverses of each other.</p>
 */
public final class DiurnalParallax {

    /** Observer-relative frames the displacement can be expressed in. */
    public enum Frame {
        EQUINOCTIAL,
        HOUR_ANGLE,
        HORIZONTAL
    }

    /** Polar to equatorial axis ratio b/a of the reference ellipsoid. */
    public static final double AXIS_RATIO = 0.99664719;
    public static final double EQUATORIAL_RADIUS_M = 6378140.0;
    public static final double EARTH_RADIUS_AU = 6378.14 / 149597870.7;

    private DiurnalParallax() {}

    public static SphericalPosition toTopocentric(SphericalPosition geocentric, double siderealTime,
                                                  double geoLatitude, double elevation, Frame frame) {
        double[] o = observer(siderealTime, geoLatitude, elevation, frame);
        return geocentric.translate(-o[0], -o[1], -o[2]);
    }

    public static SphericalPosition toGeocentric(SphericalPosition topocentric, double siderealTime,
                                                 double geoLatitude, double elevation, Frame frame) {
        double[] o = observer(siderealTime, geoLatitude, elevation, frame);
        return topocentric.translate(o[0], o[1], o[2]);
    }

    /**
     * Observer position relative to the geocentre, in AU, in the axes of {@code frame}.
     *
     * @param siderealTime local sidereal time in radians, used by the equinoctial frame only
     * @param geoLatitude  geodetic latitude in degrees
     * @param elevation    height above the ellipsoid in metres
     */
    static double[] observer(double siderealTime, double geoLatitude, double elevation, Frame frame) {
        RangeValidationException.requireClosed("geoLatitude", geoLatitude, -90.0, 90.0);
        double phi = Math.toRadians(geoLatitude);
        double u = Math.atan(AXIS_RATIO * Math.tan(phi));
        double h = elevation / EQUATORIAL_RADIUS_M;
        double rhoSin = AXIS_RATIO * Math.sin(u) + h * Math.sin(phi);
        double rhoCos = Math.cos(u) + h * Math.cos(phi);
        double rho = Math.hypot(rhoSin, rhoCos) * EARTH_RADIUS_AU;
        double geocentricLatitude = Math.atan2(rhoSin, rhoCos);

        switch (frame) {
            case HORIZONTAL:
                return new double[] {
                    rho * Math.sin(phi - geocentricLatitude), 0.0, rho * Math.cos(phi - geocentricLatitude)
                };
            case HOUR_ANGLE:
                return new double[] {
                    rho * Math.cos(geocentricLatitude), 0.0, rho * Math.sin(geocentricLatitude)
                };
            default:
                return new double[] {
                    rho * Math.cos(geocentricLatitude) * Math.cos(siderealTime),
                    rho * Math.cos(geocentricLatitude) * Math.sin(siderealTime),
                    rho * Math.sin(geocentricLatitude)
                };
        }
    }
}
