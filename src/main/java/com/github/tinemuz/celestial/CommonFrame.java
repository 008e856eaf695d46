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
import com.github.tinemuz.celestial.math.SphericalPosition;

/**
 * Validated storage of one spherical position plus the continuity policy.
 *
 * <p>The stored value is never shared: callers get immutable {@link SphericalPosition}
 * values and every change goes through {@link #changePosition}. With continuity off,
 * reads are canonical ({@code theta} in [0, π], {@code phi} in [0, 2π)); with continuity
 * on, each change picks the representation nearest to the previous one so that tracked
 * angles never jump by a full turn.</p>
 */
public abstract class CommonFrame implements CelestialFrame {

    /** Smallest accepted radius. */
    public static final double MIN_RADIUS = 1e-7;

    private SphericalPosition stored;
    private boolean continuous;

    protected CommonFrame(SphericalPosition initial, boolean continuous) {
        this.continuous = continuous;
        this.stored = validate(initial).normalized();
    }

    @Override
    public SphericalPosition position() {
        return continuous ? stored : stored.normalized();
    }

    /** Longitude-like angle (right ascension, azimuth, hour angle) in degrees. */
    public double longitude() {
        return position().longitudeDegrees();
    }

    /** Latitude-like angle (declination, altitude) in degrees. */
    public double latitude() {
        return position().latitudeDegrees();
    }

    public double radius() {
        return stored.r();
    }

    public boolean isContinuous() {
        return continuous;
    }

    public void setContinuous(boolean continuous) {
        this.continuous = continuous;
    }

    /** Replace the position. Corrections recorded as already applied are kept as flags. */
    public void setPosition(SphericalPosition position) {
        changePosition(validate(position));
        positionReplaced();
    }

    /** Replace the position from scalar angles in degrees. */
    public void setPosition(double longitude, double latitude, double radius) {
        changePosition(fromScalars(longitude, latitude, radius));
        positionReplaced();
    }

    /** Range policy applied to scalar longitude/latitude. */
    protected RangePolicy rangePolicy() {
        return RangePolicy.STRICT;
    }

    protected abstract String longitudeParameter();

    protected abstract String latitudeParameter();

    /** Hook for frames that remember the exact value of applied corrections. */
    protected void positionReplaced() {}

    /** Canonical copy of the stored position, for computations. */
    protected SphericalPosition working() {
        return stored.normalized();
    }

    protected void changePosition(SphericalPosition next) {
        stored = continuous ? next.continuousFrom(stored) : next.normalized();
    }

    /** Stored value as held, tracked angles included. */
    SphericalPosition storedPosition() {
        return stored;
    }

    /** With continuity on, re-express the stored value nearest to {@code previous}. */
    void trackFrom(SphericalPosition previous) {
        if (continuous && previous != null) {
            stored = stored.continuousFrom(previous);
        }
    }

    /** Copy the stored value verbatim, used when cloning a frame. */
    protected void copyPositionFrom(CommonFrame other) {
        this.stored = other.stored;
        this.continuous = other.continuous;
    }

    protected SphericalPosition fromScalars(double longitude, double latitude, double radius) {
        return fromScalars(rangePolicy(), longitudeParameter(), latitudeParameter(), longitude, latitude, radius);
    }

    static SphericalPosition fromScalars(RangePolicy policy, String longitudeParameter, String latitudeParameter,
                                         double longitude, double latitude, double radius) {
        if (policy == RangePolicy.STRICT) {
            RangeValidationException.requireHalfOpen(longitudeParameter, longitude, 0.0, 360.0);
            RangeValidationException.requireClosed(latitudeParameter, latitude, -90.0, 90.0);
        } else {
            RangeValidationException.requireFinite(longitudeParameter, longitude);
            RangeValidationException.requireFinite(latitudeParameter, latitude);
        }
        requireRadius(radius);
        return SphericalPosition.ofDegrees(longitude, latitude, radius);
    }

    /**
     * Position handed to a builder: an explicit value wins, otherwise the scalars are
     * validated and the longitude-like one is required.
     */
    static SphericalPosition resolve(SphericalPosition position, Double longitude, double latitude, double radius,
                                     RangePolicy policy, String longitudeParameter, String latitudeParameter) {
        if (position != null) {
            return position;
        }
        if (longitude == null) {
            throw new MissingRequiredFieldException(longitudeParameter,
                    "The param " + longitudeParameter + " or position should be given.");
        }
        return fromScalars(policy, longitudeParameter, latitudeParameter, longitude, latitude, radius);
    }

    private static SphericalPosition validate(SphericalPosition position) {
        MissingRequiredFieldException.require("position", position);
        RangeValidationException.requireFinite("theta", position.theta());
        RangeValidationException.requireFinite("phi", position.phi());
        requireRadius(position.r());
        return position;
    }

    private static void requireRadius(double radius) {
        RangeValidationException.requireFinite("radius", radius);
        if (radius < MIN_RADIUS) {
            throw new RangeValidationException("radius",
                    "The param radius should be in [" + MIN_RADIUS + ", +inf), got " + radius);
        }
    }
}
