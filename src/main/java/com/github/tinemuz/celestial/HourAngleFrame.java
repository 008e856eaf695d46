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
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.physics.SiderealTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hour angle and declination of an apparent place for one observer.
 *
 * <p>The hour angle is measured westward from the local meridian. The frame depends on
 * the observer longitude and time only; latitude plays no part.</p>
 */
public final class HourAngleFrame extends CommonFrame {
    private static final Logger log = LoggerFactory.getLogger(HourAngleFrame.class);

    private ObservingCondition observingCondition;
    private final PrecessionModel precessionModel;
    private final NutationModel nutationModel;

    private HourAngleFrame(Builder b, SphericalPosition position) {
        super(position, b.continuous);
        this.observingCondition = b.observingCondition;
        this.precessionModel = b.precessionModel != null ? b.precessionModel : FrameDefaults.precessionModel();
        this.nutationModel = b.nutationModel != null ? b.nutationModel : FrameDefaults.nutationModel();
    }

    private HourAngleFrame(HourAngleFrame other) {
        super(other.position(), other.isContinuous());
        copyPositionFrom(other);
        this.observingCondition = other.observingCondition;
        this.precessionModel = other.precessionModel;
        this.nutationModel = other.nutationModel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HourAngleFrame copy() {
        return new HourAngleFrame(this);
    }

    @Override
    public FrameCode code() {
        return FrameCode.HOUR_ANGLE;
    }

    /** Hour angle in degrees, westward from the meridian. */
    public double hourAngle() {
        return longitude();
    }

    public double declination() {
        return latitude();
    }

    public ObservingCondition observingCondition() {
        return observingCondition;
    }

    public PrecessionModel precessionModel() {
        return precessionModel;
    }

    public NutationModel nutationModel() {
        return nutationModel;
    }

    /** True local sidereal time of the observing condition, radians. */
    public double siderealTime() {
        return siderealTime(observingCondition);
    }

    /**
     * Move to a new observing condition, or to a new time at the same place when only
     * {@code epoch} is given. A new time goes through the apparent equatorial place.
     */
    public HourAngleFrame retarget(RetargetOptions options) {
        if (options == null) return this;
        ObservingCondition next = options.observingCondition();
        if (next == null && options.epoch() != null) {
            next = observingCondition.withTime(options.epoch());
        }
        if (next == null || next.equals(observingCondition)) return this;

        SphericalPosition equatorial = toEquatorial(working(), siderealTime());
        if (!next.time().equals(observingCondition.time())) {
            EquinoctialFrame apparent = EquinoctialFrame.builder()
                    .position(equatorial)
                    .epoch(observingCondition.time())
                    .withNutation(true)
                    .withAnnualAberration(true)
                    .withGravitationalDeflection(true)
                    .onFk5(true)
                    .precessionModel(precessionModel)
                    .nutationModel(nutationModel)
                    .build();
            apparent.retargetEpoch(next.time());
            equatorial = apparent.position();
        }
        changePosition(fromEquatorial(equatorial, siderealTime(next)));
        log.debug("Hour angle frame moved to {}", next);
        observingCondition = next;
        return this;
    }

    public HourAngleFrame snapshot(RetargetOptions options) {
        return copy().retarget(options);
    }

    @Override
    public EquinoctialFrame toEquinoctial() {
        return FrameSwitcher.adopt(this).hub();
    }

    @Override
    public EclipticFrame toEcliptic(RetargetOptions options) {
        return FrameSwitcher.adopt(this).toEcliptic(options);
    }

    @Override
    public GalacticFrame toGalactic(RetargetOptions options) {
        return FrameSwitcher.adopt(this).toGalactic(options);
    }

    @Override
    public HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options) {
        return FrameSwitcher.adopt(this).toHorizontal(condition, options);
    }

    @Override
    public HourAngleFrame toHourAngle(ObservingCondition condition) {
        if (condition == null) return copy();
        return snapshot(RetargetOptions.builder().observingCondition(condition).build());
    }

    @Override
    protected String longitudeParameter() {
        return "hourAngle";
    }

    @Override
    protected String latitudeParameter() {
        return "declination";
    }

    static SphericalPosition fromEquatorial(SphericalPosition p, double siderealTime) {
        return p.rotateZ(-siderealTime).inverse(SphericalPosition.Axis.Y);
    }

    static SphericalPosition toEquatorial(SphericalPosition p, double siderealTime) {
        return p.inverse(SphericalPosition.Axis.Y).rotateZ(siderealTime);
    }

    private double siderealTime(ObservingCondition condition) {
        return SiderealTime.at(condition.time(), condition.geoLongitude(), precessionModel, nutationModel)
                .trueRadians();
    }

    /** Builder for {@link HourAngleFrame}. */
    public static final class Builder {
        private SphericalPosition position;
        private Double hourAngle;
        private double declination = 0.0;
        private double radius = 1.0;
        private ObservingCondition observingCondition;
        private PrecessionModel precessionModel;
        private NutationModel nutationModel;
        private boolean continuous;

        private Builder() {}

        public Builder position(SphericalPosition position) {
            this.position = position;
            return this;
        }

        /** Degrees in [0, 360), westward. */
        public Builder hourAngle(double degrees) {
            this.hourAngle = degrees;
            return this;
        }

        public Builder declination(double degrees) {
            this.declination = degrees;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        public Builder observingCondition(ObservingCondition condition) {
            this.observingCondition = condition;
            return this;
        }

        public Builder precessionModel(PrecessionModel model) {
            this.precessionModel = model;
            return this;
        }

        public Builder precessionModel(String name) {
            this.precessionModel = PrecessionModel.fromName(name);
            return this;
        }

        public Builder nutationModel(NutationModel model) {
            this.nutationModel = model;
            return this;
        }

        public Builder nutationModel(String name) {
            this.nutationModel = NutationModel.fromName(name);
            return this;
        }

        public Builder continuous(boolean continuous) {
            this.continuous = continuous;
            return this;
        }

        public HourAngleFrame build() {
            MissingRequiredFieldException.require("observingCondition", observingCondition);
            SphericalPosition p = resolve(position, hourAngle, declination, radius,
                    RangePolicy.STRICT, "hourAngle", "declination");
            return new HourAngleFrame(this, p);
        }
    }
}
